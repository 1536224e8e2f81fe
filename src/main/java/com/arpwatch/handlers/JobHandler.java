package com.arpwatch.handlers;

import com.arpwatch.core.JobRunner;

import com.arpwatch.exceptions.JobAlreadyRunningException;

import com.arpwatch.exceptions.JobNotFoundException;

import com.arpwatch.models.Job;

import com.arpwatch.models.JobRun;

import com.arpwatch.models.JobStatus;

import com.arpwatch.models.KnownDevice;

import com.arpwatch.services.JobRunService;

import com.arpwatch.services.JobService;

import com.arpwatch.services.KnownDeviceService;

import com.arpwatch.utils.ExceptionUtil;

import com.arpwatch.utils.ResponseUtil;

import com.arpwatch.utils.ValidationUtil;

import com.arpwatch.verticles.SchedulerVerticle;

import io.vertx.core.Future;

import io.vertx.core.json.JsonArray;

import io.vertx.core.json.JsonObject;

import io.vertx.ext.web.RoutingContext;

import org.slf4j.Logger;

import org.slf4j.LoggerFactory;

import java.time.Clock;

import java.util.NoSuchElementException;

/**
 * JobHandler - Handles monitoring job HTTP requests

 * This handler manages:
 * - Job CRUD with whitelist
 * - Manual run trigger and running state queries
 * - Scheduler status
 * - Run history and known devices of a job
 */
public class JobHandler
{

    private static final Logger logger = LoggerFactory.getLogger(JobHandler.class);

    private static final int RUN_HISTORY_LIMIT = 50;

    private final JobService jobService;

    private final JobRunService jobRunService;

    private final KnownDeviceService knownDeviceService;

    private final JobRunner jobRunner;

    private final SchedulerVerticle scheduler;

    private final Clock clock;

    public JobHandler(JobService jobService,
                      JobRunService jobRunService,
                      KnownDeviceService knownDeviceService,
                      JobRunner jobRunner,
                      SchedulerVerticle scheduler,
                      Clock clock)
    {
        this.jobService = jobService;

        this.jobRunService = jobRunService;

        this.knownDeviceService = knownDeviceService;

        this.jobRunner = jobRunner;

        this.scheduler = scheduler;

        this.clock = clock;
    }

    // ========================================
    // JOB CRUD
    // ========================================

    public void getJobs(RoutingContext ctx)
    {
        try
        {
            jobService.jobList()
                .onSuccess(jobs ->
                {
                    var result = new JsonArray();

                    for (var job : jobs)
                    {
                        result.add(withRunningFlag(job));
                    }

                    ResponseUtil.handleSuccess(ctx, new JsonObject().put("jobs", result));
                })
                .onFailure(cause -> ExceptionUtil.handleHttp(ctx, cause, "Failed to get jobs"));
        }
        catch (Exception exception)
        {
            logger.error("Error in getJobs handler: {}", exception.getMessage());

            ExceptionUtil.handleHttp(ctx, exception, "Failed to get jobs");
        }
    }

    public void getJob(RoutingContext ctx)
    {
        try
        {
            var jobId = ctx.pathParam("id");

            if (!ValidationUtil.validatePathParameterUUID(ctx, jobId, "Job ID"))
            {
                return; // Validation failed, response already sent
            }

            requireJob(jobId)
                .onSuccess(job -> ResponseUtil.handleSuccess(ctx, withRunningFlag(job)))
                .onFailure(cause -> ExceptionUtil.handleHttp(ctx, cause, "Failed to get job"));
        }
        catch (Exception exception)
        {
            logger.error("Error in getJob handler: {}", exception.getMessage());

            ExceptionUtil.handleHttp(ctx, exception, "Failed to get job");
        }
    }

    /**
     * Create a job. next_run is set from the schedule (null for manual jobs).
     *
     * @param ctx routing context containing the HTTP request and response
     */
    public void createJob(RoutingContext ctx)
    {
        try
        {
            var requestBody = ctx.body().asJsonObject();

            if (!ValidationUtil.Job.validateCreate(ctx, requestBody))
            {
                return; // Validation failed, response already sent
            }

            var job = new Job().merge(requestBody);

            job.nextRun = job.schedule.nextRunAfter(clock.instant());

            jobService.jobCreate(job)
                .onSuccess(created ->
                {
                    scheduler.jobScheduleChanged(created);

                    ResponseUtil.handleSuccess(ctx, 201, created.toJson());
                })
                .onFailure(cause -> ExceptionUtil.handleHttp(ctx, cause, "Failed to create job"));
        }
        catch (Exception exception)
        {
            logger.error("Error in createJob handler: {}", exception.getMessage());

            ExceptionUtil.handleHttp(ctx, exception, "Failed to create job");
        }
    }

    /**
     * Update a job. Rejected with 409 while the job is running. A schedule change
     * recomputes next_run from now.
     *
     * @param ctx routing context containing the HTTP request and response
     */
    public void updateJob(RoutingContext ctx)
    {
        try
        {
            var jobId = ctx.pathParam("id");

            var requestBody = ctx.body().asJsonObject();

            if (!ValidationUtil.validatePathParameterUUID(ctx, jobId, "Job ID"))
            {
                return; // Validation failed, response already sent
            }

            if (!ValidationUtil.Job.validateUpdate(ctx, requestBody))
            {
                return; // Validation failed, response already sent
            }

            requireIdle(jobId)
                .compose(job ->
                {
                    var previousSchedule = job.schedule;

                    job.merge(requestBody);

                    if (job.schedule != previousSchedule)
                    {
                        job.nextRun = job.schedule.nextRunAfter(clock.instant());
                    }

                    return jobService.jobUpdate(job);
                })
                .onSuccess(updated ->
                {
                    scheduler.jobScheduleChanged(updated);

                    ResponseUtil.handleSuccess(ctx, updated.toJson());
                })
                .onFailure(cause -> ExceptionUtil.handleHttp(ctx, cause, "Failed to update job"));
        }
        catch (Exception exception)
        {
            logger.error("Error in updateJob handler: {}", exception.getMessage());

            ExceptionUtil.handleHttp(ctx, exception, "Failed to update job");
        }
    }

    public void deleteJob(RoutingContext ctx)
    {
        try
        {
            var jobId = ctx.pathParam("id");

            if (!ValidationUtil.validatePathParameterUUID(ctx, jobId, "Job ID"))
            {
                return; // Validation failed, response already sent
            }

            requireIdle(jobId)
                .compose(job -> jobService.jobDelete(jobId))
                .onSuccess(deleted ->
                {
                    scheduler.jobRemoved(jobId);

                    ResponseUtil.handleSuccess(ctx, new JsonObject().put("job_id", jobId).put("deleted", deleted));
                })
                .onFailure(cause -> ExceptionUtil.handleHttp(ctx, cause, "Failed to delete job"));
        }
        catch (Exception exception)
        {
            logger.error("Error in deleteJob handler: {}", exception.getMessage());

            ExceptionUtil.handleHttp(ctx, exception, "Failed to delete job");
        }
    }

    // ========================================
    // RUN TRIGGER AND STATUS
    // ========================================

    /**
     * Start a run in the background. Answers 202 once the job is known to exist and the run
     * has claimed it, 409 when another run holds the claim; the run outcome is recorded on the
     * job's run history.
     *
     * @param ctx routing context containing the HTTP request and response
     */
    public void runJob(RoutingContext ctx)
    {
        try
        {
            var jobId = ctx.pathParam("id");

            if (!ValidationUtil.validatePathParameterUUID(ctx, jobId, "Job ID"))
            {
                return; // Validation failed, response already sent
            }

            requireIdle(jobId)
                .onSuccess(job ->
                {
                    var run = jobRunner.run(jobId);

                    // The in-flight claim is taken synchronously; a concurrent trigger fails here
                    if (run.failed() && run.cause() instanceof JobAlreadyRunningException)
                    {
                        ExceptionUtil.handleHttp(ctx, run.cause(), "Failed to run job");

                        return;
                    }

                    run.onFailure(cause -> logger.error("Manual run of job {} failed: {}", jobId, cause.getMessage()));

                    ResponseUtil.handleSuccess(ctx, 202, new JsonObject()
                        .put("job_id", jobId)
                        .put("message", "Job " + job.name + " started"));
                })
                .onFailure(cause -> ExceptionUtil.handleHttp(ctx, cause, "Failed to run job"));
        }
        catch (Exception exception)
        {
            logger.error("Error in runJob handler: {}", exception.getMessage());

            ExceptionUtil.handleHttp(ctx, exception, "Failed to run job");
        }
    }

    public void isJobRunning(RoutingContext ctx)
    {
        var jobId = ctx.pathParam("id");

        if (!ValidationUtil.validatePathParameterUUID(ctx, jobId, "Job ID"))
        {
            return; // Validation failed, response already sent
        }

        ResponseUtil.handleSuccess(ctx, new JsonObject()
            .put("job_id", jobId)
            .put("running", jobRunner.isRunning(jobId)));
    }

    public void getRunningJobs(RoutingContext ctx)
    {
        ResponseUtil.handleSuccess(ctx, new JsonObject().put("running_job_ids", new JsonArray(jobRunner.listRunning())));
    }

    public void getSchedulerStatus(RoutingContext ctx)
    {
        ResponseUtil.handleSuccess(ctx, scheduler.getStatus());
    }

    public void getJobRuns(RoutingContext ctx)
    {
        try
        {
            var jobId = ctx.pathParam("id");

            if (!ValidationUtil.validatePathParameterUUID(ctx, jobId, "Job ID"))
            {
                return; // Validation failed, response already sent
            }

            jobRunService.runListByJob(jobId, RUN_HISTORY_LIMIT)
                .onSuccess(runs ->
                {
                    var result = new JsonArray();

                    for (JobRun run : runs)
                    {
                        result.add(run.toJson());
                    }

                    ResponseUtil.handleSuccess(ctx, new JsonObject().put("runs", result));
                })
                .onFailure(cause -> ExceptionUtil.handleHttp(ctx, cause, "Failed to get job runs"));
        }
        catch (Exception exception)
        {
            logger.error("Error in getJobRuns handler: {}", exception.getMessage());

            ExceptionUtil.handleHttp(ctx, exception, "Failed to get job runs");
        }
    }

    // ========================================
    // KNOWN DEVICES
    // ========================================

    public void getJobDevices(RoutingContext ctx)
    {
        try
        {
            var jobId = ctx.pathParam("id");

            if (!ValidationUtil.validatePathParameterUUID(ctx, jobId, "Job ID"))
            {
                return; // Validation failed, response already sent
            }

            knownDeviceService.knownDeviceListByJob(jobId)
                .onSuccess(devices ->
                {
                    var result = new JsonArray();

                    for (KnownDevice device : devices)
                    {
                        result.add(device.toJson());
                    }

                    ResponseUtil.handleSuccess(ctx, new JsonObject().put("devices", result));
                })
                .onFailure(cause -> ExceptionUtil.handleHttp(ctx, cause, "Failed to get devices"));
        }
        catch (Exception exception)
        {
            logger.error("Error in getJobDevices handler: {}", exception.getMessage());

            ExceptionUtil.handleHttp(ctx, exception, "Failed to get devices");
        }
    }

    public void deleteJobDevice(RoutingContext ctx)
    {
        try
        {
            var jobId = ctx.pathParam("id");

            var deviceId = ctx.pathParam("deviceId");

            if (!ValidationUtil.validatePathParameterUUID(ctx, jobId, "Job ID")
                || !ValidationUtil.validatePathParameterUUID(ctx, deviceId, "Device ID"))
            {
                return; // Validation failed, response already sent
            }

            knownDeviceService.knownDeviceDelete(jobId, deviceId)
                .compose(deleted -> deleted
                    ? Future.succeededFuture(new JsonObject().put("device_id", deviceId).put("deleted", true))
                    : Future.<JsonObject>failedFuture(new NoSuchElementException("Device not found: " + deviceId)))
                .onSuccess(result -> ResponseUtil.handleSuccess(ctx, result))
                .onFailure(cause -> ExceptionUtil.handleHttp(ctx, cause, "Failed to delete device"));
        }
        catch (Exception exception)
        {
            logger.error("Error in deleteJobDevice handler: {}", exception.getMessage());

            ExceptionUtil.handleHttp(ctx, exception, "Failed to delete device");
        }
    }

    /**
     * Toggle the whitelisted flag of a device. Body: { "whitelisted": true|false }
     *
     * @param ctx routing context containing the HTTP request and response
     */
    public void setDeviceWhitelisted(RoutingContext ctx)
    {
        try
        {
            var jobId = ctx.pathParam("id");

            var deviceId = ctx.pathParam("deviceId");

            var requestBody = ctx.body().asJsonObject();

            if (!ValidationUtil.validatePathParameterUUID(ctx, jobId, "Job ID")
                || !ValidationUtil.validatePathParameterUUID(ctx, deviceId, "Device ID")
                || !ValidationUtil.validateRequiredFields(ctx, requestBody, "whitelisted"))
            {
                return; // Validation failed, response already sent
            }

            var whitelisted = requestBody.getBoolean("whitelisted");

            knownDeviceService.knownDeviceSetWhitelisted(jobId, deviceId, whitelisted)
                .compose(device -> device != null
                    ? Future.succeededFuture(device.toJson())
                    : Future.<JsonObject>failedFuture(new NoSuchElementException("Device not found: " + deviceId)))
                .onSuccess(result -> ResponseUtil.handleSuccess(ctx, result))
                .onFailure(cause -> ExceptionUtil.handleHttp(ctx, cause, "Failed to update device"));
        }
        catch (Exception exception)
        {
            logger.error("Error in setDeviceWhitelisted handler: {}", exception.getMessage());

            ExceptionUtil.handleHttp(ctx, exception, "Failed to update device");
        }
    }

    /**
     * Load a job or fail with JobNotFoundException.
     */
    private Future<Job> requireJob(String jobId)
    {
        return jobService.jobGetById(jobId)
            .compose(job -> job != null
                ? Future.succeededFuture(job)
                : Future.<Job>failedFuture(new JobNotFoundException(jobId)));
    }

    /**
     * Load a job that is not currently running, or fail with JobAlreadyRunningException.
     */
    private Future<Job> requireIdle(String jobId)
    {
        if (jobRunner.isRunning(jobId))
        {
            return Future.failedFuture(new JobAlreadyRunningException(jobId));
        }

        return requireJob(jobId)
            .compose(job -> job.status == JobStatus.RUNNING
                ? Future.<Job>failedFuture(new JobAlreadyRunningException(jobId))
                : Future.succeededFuture(job));
    }

    private JsonObject withRunningFlag(Job job)
    {
        return job.toJson().put("is_running", jobRunner.isRunning(job.id));
    }

}
