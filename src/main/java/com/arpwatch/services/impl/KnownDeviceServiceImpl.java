package com.arpwatch.services.impl;

import com.arpwatch.models.KnownDevice;

import com.arpwatch.services.KnownDeviceService;

import io.vertx.core.Future;

import io.vertx.core.Promise;

import io.vertx.sqlclient.Pool;

import io.vertx.sqlclient.Tuple;

import org.slf4j.Logger;

import org.slf4j.LoggerFactory;

import java.util.ArrayList;

import java.util.List;

import java.util.UUID;

/**
 * KnownDeviceServiceImpl - PostgreSQL implementation of KnownDeviceService
 */
public class KnownDeviceServiceImpl implements KnownDeviceService
{

    private static final Logger logger = LoggerFactory.getLogger(KnownDeviceServiceImpl.class);

    private static final String DEVICE_COLUMNS =
        "id, job_id, mac_address, ip_address, vendor, whitelisted, first_seen, last_seen, status";

    private final Pool pgPool;

    public KnownDeviceServiceImpl(Pool pgPool)
    {
        this.pgPool = pgPool;
    }

    @Override
    public Future<List<KnownDevice>> knownDeviceListByJob(String jobId)
    {
        var promise = Promise.<List<KnownDevice>>promise();

        try
        {
            pgPool.preparedQuery("SELECT " + DEVICE_COLUMNS + " FROM known_devices WHERE job_id = $1 ORDER BY status, last_seen DESC")
                .execute(Tuple.of(UUID.fromString(jobId)))
                .onSuccess(rows ->
                {
                    var devices = new ArrayList<KnownDevice>();

                    for (var row : rows)
                    {
                        devices.add(RowMappers.knownDevice(row));
                    }

                    promise.complete(devices);
                })
                .onFailure(cause ->
                {
                    logger.error("Failed to list known devices of job {}: {}", jobId, cause.getMessage());

                    promise.fail(cause);
                });
        }
        catch (Exception exception)
        {
            logger.error("Error in knownDeviceListByJob: {}", exception.getMessage());

            promise.fail(exception);
        }

        return promise.future();
    }

    @Override
    public Future<Boolean> knownDeviceDelete(String jobId, String deviceId)
    {
        try
        {
            return pgPool.preparedQuery("DELETE FROM known_devices WHERE id = $1 AND job_id = $2")
                .execute(Tuple.of(UUID.fromString(deviceId), UUID.fromString(jobId)))
                .map(result -> result.rowCount() > 0)
                .onSuccess(deleted ->
                {
                    if (deleted)
                    {
                        logger.info("Known device {} of job {} deleted", deviceId, jobId);
                    }
                });
        }
        catch (Exception exception)
        {
            logger.error("Error in knownDeviceDelete: {}", exception.getMessage());

            return Future.failedFuture(exception);
        }
    }

    @Override
    public Future<KnownDevice> knownDeviceSetWhitelisted(String jobId, String deviceId, boolean whitelisted)
    {
        try
        {
            var jobUuid = UUID.fromString(jobId);

            var sql = "UPDATE known_devices SET whitelisted = $3 WHERE id = $1 AND job_id = $2 RETURNING " + DEVICE_COLUMNS;

            // Flag and job whitelist change together
            return pgPool.withTransaction(client -> client.preparedQuery(sql)
                .execute(Tuple.of(UUID.fromString(deviceId), jobUuid, whitelisted))
                .compose(rows ->
                {
                    var iterator = rows.iterator();

                    if (!iterator.hasNext())
                    {
                        return Future.<KnownDevice>succeededFuture(null);
                    }

                    var device = RowMappers.knownDevice(iterator.next());

                    var whitelistSql = whitelisted
                        ? "INSERT INTO job_whitelist (job_id, mac_address) VALUES ($1, $2) ON CONFLICT DO NOTHING"
                        : "DELETE FROM job_whitelist WHERE job_id = $1 AND mac_address = $2";

                    return client.preparedQuery(whitelistSql)
                        .execute(Tuple.of(jobUuid, device.macAddress))
                        .map(result -> device);
                }));
        }
        catch (Exception exception)
        {
            logger.error("Error in knownDeviceSetWhitelisted: {}", exception.getMessage());

            return Future.failedFuture(exception);
        }
    }

}
