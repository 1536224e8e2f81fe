package com.arpwatch.services;

import com.arpwatch.models.Job;

import com.arpwatch.models.JobRun;

import com.arpwatch.models.ReconciliationPlan;

import io.vertx.core.Future;

import java.time.Instant;

import java.util.List;

/**
 * JobRunService - Run records and the per-run commit

 * A run is opened with runStart and closed exactly once by runComplete or runFail.
 * runComplete applies the whole reconciliation plan atomically:
 * - known device insertions, updates and inactivations
 * - history samples and notifications
 * - retention deletes for the job
 * - run close (completed) and job status back to active
 */
public interface JobRunService
{

    /**
     * Open a run: insert a running JobRun and flip the job to running with last_run = startedAt,
     * in one transaction.
     *
     * @param jobId job id
     * @param startedAt run start time
     * @return Future containing the opened run
     */
    Future<JobRun> runStart(String jobId, Instant startedAt);

    /**
     * Commit a successful run.
     *
     * @param run the open run
     * @param job job being run (retention policy)
     * @param plan reconciliation result
     * @param finishedAt run end time, also the retention reference time
     * @return Future containing the closed run; output carries the plan summary and deleted count
     */
    Future<JobRun> runComplete(JobRun run, Job job, ReconciliationPlan plan, Instant finishedAt);

    /**
     * Close a run as failed and return its job to active.
     *
     * @param run the open run
     * @param errorMessage error text kept for the operator
     * @param finishedAt run end time
     * @return Future containing the closed run
     */
    Future<JobRun> runFail(JobRun run, String errorMessage, Instant finishedAt);

    /**
     * Most recent runs of a job, newest first.
     *
     * @param jobId job id
     * @param limit maximum rows
     * @return Future containing runs
     */
    Future<List<JobRun>> runListByJob(String jobId, int limit);

    /**
     * Close every run left in status running as failed (startup recovery).
     *
     * @param finishedAt time written as finished_at
     * @return Future containing the number of runs closed
     */
    Future<Integer> runFailStaleRunning(Instant finishedAt);

}
