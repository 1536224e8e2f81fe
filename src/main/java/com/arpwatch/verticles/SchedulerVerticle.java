package com.arpwatch.verticles;

import com.arpwatch.core.JobRunner;

import com.arpwatch.models.Job;

import com.arpwatch.models.JobStatus;

import com.arpwatch.services.JobRunService;

import com.arpwatch.services.JobService;

import io.vertx.core.AbstractVerticle;

import io.vertx.core.Future;

import io.vertx.core.Promise;

import io.vertx.core.json.JsonArray;

import io.vertx.core.json.JsonObject;

import org.slf4j.Logger;

import org.slf4j.LoggerFactory;

import java.time.Clock;

import java.util.ArrayList;

import java.util.List;

import java.util.Set;

import java.util.concurrent.ConcurrentHashMap;

/**
 * SchedulerVerticle - Periodic dispatch of scheduled monitoring jobs

 * Responsibilities:
 * - Startup recovery: jobs left running become active, runs left running become failed
 * - Initial next_run for scheduled jobs that have none
 * - Tick every scheduler.tick.interval.seconds: dispatch due jobs, then persist next_run = now + interval
 * - Status snapshot for the HTTP layer

 * Dispatch is fire-and-forget: a slow or failing run never blocks or breaks the tick,
 * and failed dispatches are not retried before the job's next due time.
 */
public class SchedulerVerticle extends AbstractVerticle
{

    private static final Logger logger = LoggerFactory.getLogger(SchedulerVerticle.class);

    public static final int DEFAULT_TICK_INTERVAL_SECONDS = 60;

    private final JobService jobService;

    private final JobRunService jobRunService;

    private final JobRunner jobRunner;

    private final Clock clock;

    // Ids of non-manual jobs seen on the last load or tick
    private final Set<String> scheduledJobIds = ConcurrentHashMap.newKeySet();

    private long tickTimerId = -1;

    public SchedulerVerticle(JobService jobService, JobRunService jobRunService, JobRunner jobRunner, Clock clock)
    {
        this.jobService = jobService;

        this.jobRunService = jobRunService;

        this.jobRunner = jobRunner;

        this.clock = clock;
    }

    @Override
    public void start(Promise<Void> startPromise)
    {
        try
        {
            logger.info("Starting SchedulerVerticle");

            // HOCON parses dotted keys as nested objects: tick.interval.seconds becomes tick -> interval -> seconds
            var tickIntervalSeconds = config().getJsonObject("tick", new JsonObject())
                    .getJsonObject("interval", new JsonObject())
                    .getInteger("seconds", DEFAULT_TICK_INTERVAL_SECONDS);

            recoverStaleRuns()
                .compose(v -> initializeSchedules())
                .onSuccess(count ->
                {
                    tickTimerId = vertx.setPeriodic(tickIntervalSeconds * 1000L, timerId -> checkDueJobs());

                    logger.info("SchedulerVerticle started: {} scheduled jobs, tick every {}s", count, tickIntervalSeconds);

                    startPromise.complete();
                })
                .onFailure(cause ->
                {
                    logger.error("Failed to start scheduler: {}", cause.getMessage());

                    startPromise.fail(cause);
                });
        }
        catch (Exception exception)
        {
            logger.error("Error in start: {}", exception.getMessage());

            startPromise.fail(exception);
        }
    }

    @Override
    public void stop()
    {
        if (tickTimerId != -1)
        {
            vertx.cancelTimer(tickTimerId);
        }

        logger.info("SchedulerVerticle stopped");
    }

    /**
     * Reset state left by a previous process that stopped mid-run.
     */
    private Future<Void> recoverStaleRuns()
    {
        return jobRunService.runFailStaleRunning(clock.instant())
            .compose(runs -> jobService.jobResetStaleRunning()
                .onSuccess(jobs ->
                {
                    if (runs > 0 || jobs > 0)
                    {
                        logger.warn("Startup recovery: {} runs marked failed, {} jobs reset to active", runs, jobs);
                    }
                })
                .mapEmpty());
    }

    /**
     * Load active scheduled jobs and persist next_run = now + interval where it is missing.
     * Inactive jobs are left untouched.
     *
     * @return Future with the number of active scheduled jobs
     */
    private Future<Integer> initializeSchedules()
    {
        return jobService.jobListScheduled()
            .compose(jobs ->
            {
                var now = clock.instant();

                var updates = new ArrayList<Future<Void>>();

                scheduledJobIds.clear();

                for (var job : jobs)
                {
                    if (job.status != JobStatus.ACTIVE || job.schedule.isManual())
                    {
                        continue;
                    }

                    scheduledJobIds.add(job.id);

                    if (job.nextRun == null)
                    {
                        updates.add(jobService.jobUpdateNextRun(job.id, job.schedule.nextRunAfter(now)));
                    }
                }

                return Future.all(updates).map(v -> scheduledJobIds.size());
            });
    }

    /**
     * One scheduler tick: dispatch every due job that is not already in flight.
     *
     * @return Future completing once next_run of every dispatched job is persisted
     */
    public Future<List<String>> checkDueJobs()
    {
        try
        {
            return jobService.jobListScheduled()
                .compose(jobs ->
                {
                    var now = clock.instant();

                    scheduledJobIds.clear();

                    List<String> dispatched = new ArrayList<>();

                    var updates = new ArrayList<Future<Void>>();

                    for (var job : jobs)
                    {
                        scheduledJobIds.add(job.id);

                        if (!job.isDue(now) || jobRunner.isRunning(job.id))
                        {
                            continue;
                        }

                        dispatch(job);

                        dispatched.add(job.id);

                        updates.add(jobService.jobUpdateNextRun(job.id, job.schedule.nextRunAfter(now)));
                    }

                    if (!dispatched.isEmpty())
                    {
                        logger.info("Scheduler dispatched {} due jobs", dispatched.size());
                    }

                    return Future.join(updates).map(v -> dispatched);
                })
                .onFailure(cause -> logger.error("Scheduler tick failed: {}", cause.getMessage()));
        }
        catch (Exception exception)
        {
            logger.error("Error in checkDueJobs: {}", exception.getMessage());

            return Future.failedFuture(exception);
        }
    }

    private void dispatch(Job job)
    {
        logger.debug("Dispatching job {} ({}), schedule {}", job.name, job.id, job.schedule.tag());

        jobRunner.run(job.id)
            .onFailure(cause -> logger.error("Scheduled run of job {} failed: {}", job.id, cause.getMessage()));
    }

    /**
     * Status snapshot: scheduled_jobs, running_jobs, running_job_ids.
     */
    public JsonObject getStatus()
    {
        var running = jobRunner.listRunning();

        return new JsonObject()
            .put("scheduled_jobs", scheduledJobIds.size())
            .put("running_jobs", running.size())
            .put("running_job_ids", new JsonArray(running));
    }

    /**
     * Refresh the schedule bookkeeping of one job after it was created or updated.
     *
     * @param job stored job
     */
    public void jobScheduleChanged(Job job)
    {
        if (job.schedule.isManual())
        {
            scheduledJobIds.remove(job.id);
        }
        else
        {
            scheduledJobIds.add(job.id);
        }
    }

    public void jobRemoved(String jobId)
    {
        scheduledJobIds.remove(jobId);
    }

}
