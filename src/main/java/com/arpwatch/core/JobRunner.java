package com.arpwatch.core;

import com.arpwatch.exceptions.JobAlreadyRunningException;

import com.arpwatch.exceptions.JobNotFoundException;

import com.arpwatch.models.DiscoveredDevice;

import com.arpwatch.models.Job;

import com.arpwatch.models.JobRun;

import com.arpwatch.models.JobStatus;

import com.arpwatch.services.JobRunService;

import com.arpwatch.services.JobService;

import com.arpwatch.services.KnownDeviceService;

import io.vertx.core.Future;

import io.vertx.core.Vertx;

import io.vertx.core.WorkerExecutor;

import org.slf4j.Logger;

import org.slf4j.LoggerFactory;

import java.time.Clock;

import java.util.Collections;

import java.util.List;

import java.util.Set;

import java.util.TreeSet;

import java.util.concurrent.ConcurrentHashMap;

import java.util.concurrent.TimeUnit;

import java.util.function.Supplier;

/**
 * JobRunner - Executes one run of a monitoring job

 * State machine: Idle -> Running -> {Completed, Failed} -> Idle

 * Run flow:
 * 1. Claim the job id in the in-flight set (JobAlreadyRunningException if already claimed)
 * 2. Load the job (JobNotFoundException unless it exists and is active)
 * 3. runStart: JobRun created as running, job flipped to running
 * 4. arp-scan on a worker thread with a fresh scanner instance
 * 5. DeviceReconciler builds the plan against the job's known devices
 * 6. runComplete: plan, retention, run close and job status committed together
 * On any failure after step 3 the run is closed as failed, the job returns to active and
 * the original error is returned to the caller. The in-flight claim is always released.

 * Only one run per job id is in flight at a time; different jobs run in parallel.
 */
public class JobRunner
{

    private static final Logger logger = LoggerFactory.getLogger(JobRunner.class);

    private static final String WORKER_POOL_NAME = "arpwatch-scan-worker";

    // Scans run for execution_time + grace seconds; keep the blocked-thread checker quiet below that
    private static final long MAX_SCAN_EXECUTE_MINUTES = 90;

    private final Set<String> inFlight = ConcurrentHashMap.newKeySet();

    private final JobService jobService;

    private final JobRunService jobRunService;

    private final KnownDeviceService knownDeviceService;

    private final Supplier<NetworkScanner> scannerFactory;

    private final DeviceReconciler reconciler;

    private final WorkerExecutor workerExecutor;

    private final Clock clock;

    public JobRunner(Vertx vertx,
                     JobService jobService,
                     JobRunService jobRunService,
                     KnownDeviceService knownDeviceService,
                     Supplier<NetworkScanner> scannerFactory,
                     int workerPoolSize,
                     Clock clock)
    {
        this.jobService = jobService;

        this.jobRunService = jobRunService;

        this.knownDeviceService = knownDeviceService;

        this.scannerFactory = scannerFactory;

        this.reconciler = new DeviceReconciler();

        this.workerExecutor = vertx.createSharedWorkerExecutor(WORKER_POOL_NAME, workerPoolSize, MAX_SCAN_EXECUTE_MINUTES, TimeUnit.MINUTES);

        this.clock = clock;
    }

    /**
     * Run a job now.
     *
     * @param jobId job id
     * @return Future containing the closed run; failed with JobAlreadyRunningException,
     *         JobNotFoundException, or the scan/persistence error of a failed run
     */
    public Future<JobRun> run(String jobId)
    {
        if (!inFlight.add(jobId))
        {
            logger.debug("Job {} is already running, rejecting run", jobId);

            return Future.failedFuture(new JobAlreadyRunningException(jobId));
        }

        try
        {
            return execute(jobId)
                .transform(result ->
                {
                    inFlight.remove(jobId);

                    if (result.failed())
                    {
                        logger.warn("Job {} run failed: {}", jobId, result.cause().getMessage());

                        return Future.failedFuture(result.cause());
                    }

                    var run = result.result();

                    logger.info("Job {} run {} completed in {}s: found={} new={} warnings={}",
                        jobId, run.id, run.duration, run.devicesFound, run.newDevices, run.warnings);

                    return Future.succeededFuture(run);
                });
        }
        catch (Exception exception)
        {
            inFlight.remove(jobId);

            logger.error("Error in run: {}", exception.getMessage());

            return Future.failedFuture(exception);
        }
    }

    /**
     * @param jobId job id
     * @return true while a run of this job is in flight
     */
    public boolean isRunning(String jobId)
    {
        return inFlight.contains(jobId);
    }

    /**
     * @return sorted snapshot of job ids currently in flight
     */
    public List<String> listRunning()
    {
        return List.copyOf(new TreeSet<>(inFlight));
    }

    /**
     * Release the scan worker pool.
     */
    public Future<Void> close()
    {
        return workerExecutor.close();
    }

    private Future<JobRun> execute(String jobId)
    {
        return jobService.jobGetById(jobId)
            .compose(job ->
            {
                if (job == null || job.status != JobStatus.ACTIVE)
                {
                    return Future.failedFuture(new JobNotFoundException(jobId));
                }

                return jobRunService.runStart(jobId, clock.instant())
                    .compose(run ->
                    {
                        logger.info("Job {} ({}) started run {} on {} {}", job.name, jobId, run.id, job.networkInterface, job.subnet);

                        return scanAndCommit(job, run)
                            .recover(cause -> failRun(run, cause));
                    });
            });
    }

    private Future<JobRun> scanAndCommit(Job job, JobRun run)
    {
        return knownDeviceService.knownDeviceListByJob(job.id)
            .compose(knownDevices -> scan(job)
                .compose(discovered ->
                {
                    var now = clock.instant();

                    var plan = reconciler.reconcile(job, job.whitelist, knownDevices, discovered, now);

                    logger.debug("Job {} reconciled: {}", job.id, plan.summary());

                    return jobRunService.runComplete(run, job, plan, now);
                }));
    }

    private Future<List<DiscoveredDevice>> scan(Job job)
    {
        // Fresh single-flight scanner per run so different jobs scan in parallel
        var scanner = scannerFactory.get();

        return workerExecutor.executeBlocking(
            () -> Collections.unmodifiableList(scanner.scan(job.networkInterface, job.subnet, job.executionTime)),
            false);
    }

    private Future<JobRun> failRun(JobRun run, Throwable cause)
    {
        var message = cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();

        return jobRunService.runFail(run, message, clock.instant())
            .transform(result ->
            {
                if (result.failed())
                {
                    logger.error("Failed to close run {} as failed: {}", run.id, result.cause().getMessage());
                }

                return Future.<JobRun>failedFuture(cause);
            });
    }

}
