package com.arpwatch.services.impl;

import com.arpwatch.exceptions.JobNotFoundException;

import com.arpwatch.models.Job;

import com.arpwatch.models.RetentionPolicy;

import com.arpwatch.services.JobService;

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

import java.util.Collection;

import java.util.List;

import java.util.UUID;

/**
 * JobServiceImpl - PostgreSQL implementation of JobService

 * Jobs live in the jobs table; the whitelist in job_whitelist, replaced wholesale on
 * update. Create and update run in a transaction so a job is never stored with a
 * partial whitelist.
 */
public class JobServiceImpl implements JobService
{

    private static final Logger logger = LoggerFactory.getLogger(JobServiceImpl.class);

    private final Pool pgPool;

    /**
     * Constructor for JobServiceImpl
     *
     * @param pgPool PostgreSQL connection pool
     */
    public JobServiceImpl(Pool pgPool)
    {
        this.pgPool = pgPool;
    }

    @Override
    public Future<Job> jobCreate(Job job)
    {
        try
        {
            var sql = """
                    INSERT INTO jobs (name, network_interface, subnet, execution_time, schedule,
                                      notifications_enabled, notify_new_macs, notify_unauthorized_macs, notify_ip_changes,
                                      retention_policy, retention_days, next_run)
                    VALUES ($1, $2, $3, $4, $5, $6, $7, $8, $9, $10, $11, $12)
                    RETURNING id
                    """;

            return pgPool.withTransaction(client -> client.preparedQuery(sql)
                    .execute(Tuple.of(job.name, job.networkInterface, job.subnet, job.executionTime, job.schedule.tag(),
                        job.notificationsEnabled, job.notifyNewMacs, job.notifyUnauthorizedMacs, job.notifyIpChanges,
                        job.retentionPolicy.policyColumn(), retentionDaysColumn(job.retentionPolicy),
                        SqlUtil.toTimestamp(job.nextRun)))
                    .compose(rows ->
                    {
                        var jobId = rows.iterator().next().getUUID("id");

                        return insertWhitelist(client, jobId, job.whitelist).map(jobId);
                    }))
                .compose(jobId ->
                {
                    logger.info("Job created: {} ({})", job.name, jobId);

                    return jobGetById(jobId.toString());
                })
                .onFailure(cause -> logger.error("Failed to create job {}: {}", job.name, cause.getMessage()));
        }
        catch (Exception exception)
        {
            logger.error("Error in jobCreate: {}", exception.getMessage());

            return Future.failedFuture(exception);
        }
    }

    @Override
    public Future<Job> jobUpdate(Job job)
    {
        try
        {
            var sql = """
                    UPDATE jobs
                    SET name = $2, network_interface = $3, subnet = $4, execution_time = $5, schedule = $6,
                        notifications_enabled = $7, notify_new_macs = $8, notify_unauthorized_macs = $9,
                        notify_ip_changes = $10, retention_policy = $11, retention_days = $12, next_run = $13,
                        updated_at = NOW()
                    WHERE id = $1
                    """;

            var jobId = UUID.fromString(job.id);

            return pgPool.withTransaction(client -> client.preparedQuery(sql)
                    .execute(Tuple.of(jobId, job.name, job.networkInterface, job.subnet, job.executionTime, job.schedule.tag(),
                        job.notificationsEnabled, job.notifyNewMacs, job.notifyUnauthorizedMacs, job.notifyIpChanges,
                        job.retentionPolicy.policyColumn(), retentionDaysColumn(job.retentionPolicy),
                        SqlUtil.toTimestamp(job.nextRun)))
                    .compose(result ->
                    {
                        if (result.rowCount() == 0)
                        {
                            return Future.<Void>failedFuture(new JobNotFoundException(job.id));
                        }

                        return client.preparedQuery("DELETE FROM job_whitelist WHERE job_id = $1")
                            .execute(Tuple.of(jobId))
                            .compose(deleted -> insertWhitelist(client, jobId, job.whitelist));
                    }))
                .compose(v ->
                {
                    logger.info("Job updated: {} ({})", job.name, job.id);

                    return jobGetById(job.id);
                });
        }
        catch (Exception exception)
        {
            logger.error("Error in jobUpdate: {}", exception.getMessage());

            return Future.failedFuture(exception);
        }
    }

    @Override
    public Future<Boolean> jobDelete(String jobId)
    {
        var promise = Promise.<Boolean>promise();

        try
        {
            pgPool.preparedQuery("DELETE FROM jobs WHERE id = $1")
                .execute(Tuple.of(UUID.fromString(jobId)))
                .onSuccess(result ->
                {
                    var deleted = result.rowCount() > 0;

                    if (deleted)
                    {
                        logger.info("Job deleted: {}", jobId);
                    }

                    promise.complete(deleted);
                })
                .onFailure(cause ->
                {
                    logger.error("Failed to delete job {}: {}", jobId, cause.getMessage());

                    promise.fail(cause);
                });
        }
        catch (Exception exception)
        {
            logger.error("Error in jobDelete: {}", exception.getMessage());

            promise.fail(exception);
        }

        return promise.future();
    }

    @Override
    public Future<Job> jobGetById(String jobId)
    {
        var promise = Promise.<Job>promise();

        try
        {
            var sql = RowMappers.JOB_SELECT + """
                    WHERE j.id = $1
                    GROUP BY j.id
                    """;

            pgPool.preparedQuery(sql)
                .execute(Tuple.of(UUID.fromString(jobId)))
                .onSuccess(rows ->
                {
                    var iterator = rows.iterator();

                    promise.complete(iterator.hasNext() ? RowMappers.job(iterator.next()) : null);
                })
                .onFailure(cause ->
                {
                    logger.error("Failed to get job {}: {}", jobId, cause.getMessage());

                    promise.fail(cause);
                });
        }
        catch (Exception exception)
        {
            logger.error("Error in jobGetById: {}", exception.getMessage());

            promise.fail(exception);
        }

        return promise.future();
    }

    @Override
    public Future<List<Job>> jobList()
    {
        return listJobs(RowMappers.JOB_SELECT + """
                GROUP BY j.id
                ORDER BY j.created_at
                """);
    }

    @Override
    public Future<List<Job>> jobListScheduled()
    {
        return listJobs(RowMappers.JOB_SELECT + """
                WHERE j.schedule <> 'manual'
                GROUP BY j.id
                ORDER BY j.next_run NULLS FIRST
                """);
    }

    @Override
    public Future<Void> jobUpdateNextRun(String jobId, Instant nextRun)
    {
        try
        {
            return pgPool.preparedQuery("UPDATE jobs SET next_run = $2 WHERE id = $1")
                .execute(Tuple.of(UUID.fromString(jobId), SqlUtil.toTimestamp(nextRun)))
                .onFailure(cause -> logger.error("Failed to update next run of job {}: {}", jobId, cause.getMessage()))
                .mapEmpty();
        }
        catch (Exception exception)
        {
            logger.error("Error in jobUpdateNextRun: {}", exception.getMessage());

            return Future.failedFuture(exception);
        }
    }

    @Override
    public Future<Integer> jobResetStaleRunning()
    {
        return pgPool.query("UPDATE jobs SET status = 'active', updated_at = NOW() WHERE status = 'running'")
            .execute()
            .map(result -> result.rowCount());
    }

    private Future<List<Job>> listJobs(String sql)
    {
        var promise = Promise.<List<Job>>promise();

        try
        {
            pgPool.query(sql)
                .execute()
                .onSuccess(rows ->
                {
                    var jobs = new ArrayList<Job>();

                    for (var row : rows)
                    {
                        jobs.add(RowMappers.job(row));
                    }

                    promise.complete(jobs);
                })
                .onFailure(cause ->
                {
                    logger.error("Failed to list jobs: {}", cause.getMessage());

                    promise.fail(cause);
                });
        }
        catch (Exception exception)
        {
            logger.error("Error in listJobs: {}", exception.getMessage());

            promise.fail(exception);
        }

        return promise.future();
    }

    private static Future<Void> insertWhitelist(SqlClient client, UUID jobId, Collection<String> macAddresses)
    {
        if (macAddresses.isEmpty())
        {
            return Future.succeededFuture();
        }

        var batch = new ArrayList<Tuple>();

        for (var mac : macAddresses)
        {
            batch.add(Tuple.of(jobId, mac));
        }

        return client.preparedQuery("INSERT INTO job_whitelist (job_id, mac_address) VALUES ($1, $2) ON CONFLICT DO NOTHING")
            .executeBatch(batch)
            .mapEmpty();
    }

    private static Integer retentionDaysColumn(RetentionPolicy policy)
    {
        return policy.kind() == RetentionPolicy.Kind.DAYS ? policy.retentionDays() : null;
    }

}
