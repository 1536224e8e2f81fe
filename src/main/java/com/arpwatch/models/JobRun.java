package com.arpwatch.models;

import io.vertx.core.json.JsonObject;

import java.time.Duration;

import java.time.Instant;

/**
 * One execution attempt of a job (job_runs row).

 * Lifecycle:
 * - Created RUNNING when the job is dispatched
 * - Closed exactly once as COMPLETED (with counts) or FAILED (with error text)
 */
public class JobRun
{

    public String id;

    public String jobId;

    public RunStatus status = RunStatus.RUNNING;

    // Counts, filled on completion
    public int devicesFound;

    public int newDevices;

    public int warnings;

    public Instant startedAt;

    public Instant finishedAt;

    public Long duration;            // seconds, set when closed

    public String output;

    public String errorMessage;

    /**
     * Close this run.
     *
     * @param closedStatus COMPLETED or FAILED
     * @param at finish timestamp
     * @throws IllegalStateException if the run is already closed
     */
    public void close(RunStatus closedStatus, Instant at)
    {
        if (status.isTerminal())
        {
            throw new IllegalStateException("Run " + id + " already closed as " + status.value());
        }

        status = closedStatus;

        finishedAt = at;

        duration = durationUntil(at);
    }

    /**
     * Whole seconds elapsed from startedAt to the given instant.
     */
    public long durationUntil(Instant at)
    {
        return startedAt != null ? Duration.between(startedAt, at).getSeconds() : 0L;
    }

    public JsonObject toJson()
    {
        return new JsonObject()
            .put("id", id)
            .put("job_id", jobId)
            .put("status", status.value())
            .put("devices_found", devicesFound)
            .put("new_devices", newDevices)
            .put("warnings", warnings)
            .put("started_at", startedAt != null ? startedAt.toString() : null)
            .put("finished_at", finishedAt != null ? finishedAt.toString() : null)
            .put("duration", duration)
            .put("output", output)
            .put("error_message", errorMessage);
    }

}
