package com.arpwatch.services.impl;

import com.arpwatch.models.DeviceHistorySample;

import com.arpwatch.models.Job;

import com.arpwatch.models.JobRun;

import com.arpwatch.models.KnownDevice;

import com.arpwatch.models.Notification;

import com.arpwatch.models.ReconciliationPlan;

import com.arpwatch.models.RetentionPolicy;

import com.arpwatch.models.RunStatus;

import com.arpwatch.services.JobRunService;

import com.arpwatch.utils.SqlUtil;

import io.vertx.core.Future;

import io.vertx.core.Promise;

import io.vertx.sqlclient.Pool;

import io.vertx.sqlclient.SqlClient;

import io.vertx.sqlclient.Tuple;

import org.slf4j.Logger;

import org.slf4j.LoggerFactory;

import java.time.Instant;

import java.util.ArrayList;

import java.util.List;

import java.util.UUID;

/**
 * JobRunServiceImpl - PostgreSQL implementation of JobRunService

 * runComplete commits, in one transaction and in this order:
 * 1. insertions into known_devices
 * 2. updates of seen devices
 * 3. inactivation of unseen devices
 * 4. device_history samples
 * 5. notifications
 * 6. retention delete of inactive devices
 * 7. job_runs row closed as completed
 * 8. job status back to active
 */
public class JobRunServiceImpl implements JobRunService
{

    private static final Logger logger = LoggerFactory.getLogger(JobRunServiceImpl.class);

    private static final String STALE_RUN_MESSAGE = "Run interrupted by application shutdown";

    private final Pool pgPool;

    public JobRunServiceImpl(Pool pgPool)
    {
        this.pgPool = pgPool;
    }

    @Override
    public Future<JobRun> runStart(String jobId, Instant startedAt)
    {
        try
        {
            var id = UUID.fromString(jobId);

            var startedAtColumn = SqlUtil.toTimestamp(startedAt);

            return pgPool.withTransaction(client -> client
                .preparedQuery("INSERT INTO job_runs (job_id, status, started_at) VALUES ($1, 'running', $2) RETURNING id")
                .execute(Tuple.of(id, startedAtColumn))
                .compose(rows ->
                {
                    var run = new JobRun();

                    run.id = rows.iterator().next().getUUID("id").toString();

                    run.jobId = jobId;

                    run.status = RunStatus.RUNNING;

                    run.startedAt = startedAt;

                    return client
                        .preparedQuery("UPDATE jobs SET status = 'running', last_run = $2, updated_at = NOW() WHERE id = $1")
                        .execute(Tuple.of(id, startedAtColumn))
                        .map(updated -> run);
                }));
        }
        catch (Exception exception)
        {
            logger.error("Error in runStart: {}", exception.getMessage());

            return Future.failedFuture(exception);
        }
    }

    @Override
    public Future<JobRun> runComplete(JobRun run, Job job, ReconciliationPlan plan, Instant finishedAt)
    {
        try
        {
            var jobId = UUID.fromString(job.id);

            return pgPool.withTransaction(client -> insertDevices(client, jobId, plan.insertions())
                    .compose(v -> updateDevices(client, jobId, plan.updates()))
                    .compose(v -> inactivateDevices(client, jobId, plan.inactivations()))
                    .compose(v -> insertHistory(client, jobId, plan.historySamples()))
                    .compose(v -> insertNotifications(client, jobId, plan.notifications()))
                    .compose(v -> applyRetention(client, jobId, job.retentionPolicy, finishedAt))
                    .compose(deleted ->
                    {
                        if (deleted > 0)
                        {
                            logger.info("Retention {} removed {} inactive devices of job {}", job.retentionPolicy, deleted, job.id);
                        }

                        var output = plan.summary() + " retention_deleted=" + deleted;

                        var sql = """
                                UPDATE job_runs
                                SET status = 'completed', devices_found = $2, new_devices = $3, warnings = $4,
                                    finished_at = $5, duration = $6, output = $7
                                WHERE id = $1
                                """;

                        return client.preparedQuery(sql)
                            .execute(Tuple.of(UUID.fromString(run.id), plan.devicesFound(), plan.newDevices(), plan.warnings(),
                                SqlUtil.toTimestamp(finishedAt), run.durationUntil(finishedAt), output))
                            .map(updated -> output);
                    })
                    .compose(output -> client
                        .preparedQuery("UPDATE jobs SET status = 'active', updated_at = NOW() WHERE id = $1")
                        .execute(Tuple.of(jobId))
                        .map(updated -> output)))
                .map(output ->
                {
                    run.devicesFound = plan.devicesFound();

                    run.newDevices = plan.newDevices();

                    run.warnings = plan.warnings();

                    run.output = output;

                    run.close(RunStatus.COMPLETED, finishedAt);

                    return run;
                });
        }
        catch (Exception exception)
        {
            logger.error("Error in runComplete: {}", exception.getMessage());

            return Future.failedFuture(exception);
        }
    }

    @Override
    public Future<JobRun> runFail(JobRun run, String errorMessage, Instant finishedAt)
    {
        try
        {
            var sql = """
                    UPDATE job_runs
                    SET status = 'failed', finished_at = $2, duration = $3, error_message = $4
                    WHERE id = $1 AND status = 'running'
                    """;

            return pgPool.withTransaction(client -> client.preparedQuery(sql)
                    .execute(Tuple.of(UUID.fromString(run.id), SqlUtil.toTimestamp(finishedAt), run.durationUntil(finishedAt), errorMessage))
                    .compose(updated -> client
                        .preparedQuery("UPDATE jobs SET status = 'active', updated_at = NOW() WHERE id = $1")
                        .execute(Tuple.of(UUID.fromString(run.jobId)))))
                .map(updated ->
                {
                    run.errorMessage = errorMessage;

                    run.close(RunStatus.FAILED, finishedAt);

                    return run;
                });
        }
        catch (Exception exception)
        {
            logger.error("Error in runFail: {}", exception.getMessage());

            return Future.failedFuture(exception);
        }
    }

    @Override
    public Future<List<JobRun>> runListByJob(String jobId, int limit)
    {
        var promise = Promise.<List<JobRun>>promise();

        try
        {
            var sql = """
                    SELECT id, job_id, status, devices_found, new_devices, warnings, started_at, finished_at,
                           duration, output, error_message
                    FROM job_runs
                    WHERE job_id = $1
                    ORDER BY started_at DESC
                    LIMIT $2
                    """;

            pgPool.preparedQuery(sql)
                .execute(Tuple.of(UUID.fromString(jobId), limit))
                .onSuccess(rows ->
                {
                    var runs = new ArrayList<JobRun>();

                    for (var row : rows)
                    {
                        runs.add(RowMappers.jobRun(row));
                    }

                    promise.complete(runs);
                })
                .onFailure(cause ->
                {
                    logger.error("Failed to list runs of job {}: {}", jobId, cause.getMessage());

                    promise.fail(cause);
                });
        }
        catch (Exception exception)
        {
            logger.error("Error in runListByJob: {}", exception.getMessage());

            promise.fail(exception);
        }

        return promise.future();
    }

    @Override
    public Future<Integer> runFailStaleRunning(Instant finishedAt)
    {
        var sql = """
                UPDATE job_runs
                SET status = 'failed', finished_at = $1, error_message = $2
                WHERE status = 'running'
                """;

        return pgPool.preparedQuery(sql)
            .execute(Tuple.of(SqlUtil.toTimestamp(finishedAt), STALE_RUN_MESSAGE))
            .map(result -> result.rowCount());
    }

    private static Future<Void> insertDevices(SqlClient client, UUID jobId, List<KnownDevice> devices)
    {
        var sql = """
                INSERT INTO known_devices (job_id, mac_address, ip_address, vendor, whitelisted, first_seen, last_seen, status)
                VALUES ($1, $2, $3, $4, $5, $6, $7, 'active')
                ON CONFLICT (job_id, mac_address) DO UPDATE
                SET ip_address = EXCLUDED.ip_address,
                    vendor = COALESCE(EXCLUDED.vendor, known_devices.vendor),
                    whitelisted = EXCLUDED.whitelisted,
                    last_seen = EXCLUDED.last_seen,
                    status = 'active'
                """;

        var batch = new ArrayList<Tuple>();

        for (var device : devices)
        {
            batch.add(Tuple.of(jobId, device.macAddress, device.ipAddress, device.vendor, device.whitelisted,
                SqlUtil.toTimestamp(device.firstSeen), SqlUtil.toTimestamp(device.lastSeen)));
        }

        return executeBatch(client, sql, batch);
    }

    private static Future<Void> updateDevices(SqlClient client, UUID jobId, List<KnownDevice> devices)
    {
        var sql = """
                UPDATE known_devices
                SET ip_address = $3, vendor = $4, whitelisted = $5, last_seen = $6, status = 'active'
                WHERE job_id = $1 AND mac_address = $2
                """;

        var batch = new ArrayList<Tuple>();

        for (var device : devices)
        {
            batch.add(Tuple.of(jobId, device.macAddress, device.ipAddress, device.vendor, device.whitelisted,
                SqlUtil.toTimestamp(device.lastSeen)));
        }

        return executeBatch(client, sql, batch);
    }

    private static Future<Void> inactivateDevices(SqlClient client, UUID jobId, List<KnownDevice> devices)
    {
        var batch = new ArrayList<Tuple>();

        for (var device : devices)
        {
            batch.add(Tuple.of(jobId, device.macAddress));
        }

        return executeBatch(client,
            "UPDATE known_devices SET status = 'inactive' WHERE job_id = $1 AND mac_address = $2", batch);
    }

    private static Future<Void> insertHistory(SqlClient client, UUID jobId, List<DeviceHistorySample> samples)
    {
        var batch = new ArrayList<Tuple>();

        for (var sample : samples)
        {
            batch.add(Tuple.of(jobId, sample.macAddress(), sample.ipAddress(), sample.vendor(),
                SqlUtil.toTimestamp(sample.detectedAt())));
        }

        return executeBatch(client,
            "INSERT INTO device_history (job_id, mac_address, ip_address, vendor, detected_at) VALUES ($1, $2, $3, $4, $5)",
            batch);
    }

    private static Future<Void> insertNotifications(SqlClient client, UUID jobId, List<Notification> notifications)
    {
        var sql = """
                INSERT INTO notifications (job_id, job_name, type, message, mac_address, ip_address, created_at)
                VALUES ($1, $2, $3, $4, $5, $6, $7)
                """;

        var batch = new ArrayList<Tuple>();

        for (var notification : notifications)
        {
            batch.add(Tuple.of(jobId, notification.jobName, notification.type.value(), notification.message,
                notification.macAddress, notification.ipAddress, SqlUtil.toTimestamp(notification.createdAt)));
        }

        return executeBatch(client, sql, batch);
    }

    /**
     * Delete inactive devices of the job according to its retention policy.
     *
     * @return Future containing the number of devices deleted
     */
    private static Future<Integer> applyRetention(SqlClient client, UUID jobId, RetentionPolicy policy, Instant runAt)
    {
        switch (policy.kind())
        {
            case IMMEDIATE:
                return client.preparedQuery("DELETE FROM known_devices WHERE job_id = $1 AND status = 'inactive'")
                    .execute(Tuple.of(jobId))
                    .map(result -> result.rowCount());

            case DAYS:
                return client.preparedQuery("DELETE FROM known_devices WHERE job_id = $1 AND status = 'inactive' AND last_seen < $2")
                    .execute(Tuple.of(jobId, SqlUtil.toTimestamp(policy.cutoff(runAt))))
                    .map(result -> result.rowCount());

            default:
                return Future.succeededFuture(0);
        }
    }

    private static Future<Void> executeBatch(SqlClient client, String sql, List<Tuple> batch)
    {
        if (batch.isEmpty())
        {
            return Future.succeededFuture();
        }

        return client.preparedQuery(sql).executeBatch(batch).mapEmpty();
    }

}
