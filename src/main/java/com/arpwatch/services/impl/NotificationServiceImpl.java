package com.arpwatch.services.impl;

import com.arpwatch.models.Notification;

import com.arpwatch.models.NotificationType;

import com.arpwatch.services.NotificationService;

import com.arpwatch.utils.SqlUtil;

import io.vertx.core.Future;

import io.vertx.core.Promise;

import io.vertx.core.json.JsonObject;

import io.vertx.sqlclient.Pool;

import io.vertx.sqlclient.Tuple;

import org.slf4j.Logger;

import org.slf4j.LoggerFactory;

import java.util.ArrayList;

import java.util.List;

import java.util.UUID;

/**
 * NotificationServiceImpl - PostgreSQL implementation of NotificationService

 * Notifications are inserted by the run commit (JobRunServiceImpl); this service reads
 * them and manages the read flag.
 */
public class NotificationServiceImpl implements NotificationService
{

    private static final Logger logger = LoggerFactory.getLogger(NotificationServiceImpl.class);

    private final Pool pgPool;

    public NotificationServiceImpl(Pool pgPool)
    {
        this.pgPool = pgPool;
    }

    /**
     * List notifications with optional filters.
     * FILTER: is_read = false when unreadOnly, job_id = jobId when set, type = type when set
     */
    @Override
    public Future<List<Notification>> notificationList(boolean unreadOnly, String jobId, NotificationType type, int limit)
    {
        var promise = Promise.<List<Notification>>promise();

        try
        {
            var sql = """
                    SELECT id, job_id, job_name, type, message, mac_address, ip_address, created_at, is_read
                    FROM notifications
                    WHERE ($1 = FALSE OR is_read = FALSE)
                      AND ($2::uuid IS NULL OR job_id = $2)
                      AND ($3::varchar IS NULL OR type = $3)
                    ORDER BY created_at DESC
                    LIMIT $4
                    """;

            pgPool.preparedQuery(sql)
                .execute(Tuple.of(unreadOnly, SqlUtil.toUuid(jobId), type != null ? type.value() : null, limit))
                .onSuccess(rows ->
                {
                    var notifications = new ArrayList<Notification>();

                    for (var row : rows)
                    {
                        notifications.add(RowMappers.notification(row));
                    }

                    promise.complete(notifications);
                })
                .onFailure(cause ->
                {
                    logger.error("Failed to list notifications: {}", cause.getMessage());

                    promise.fail(cause);
                });
        }
        catch (Exception exception)
        {
            logger.error("Error in notificationList: {}", exception.getMessage());

            promise.fail(exception);
        }

        return promise.future();
    }

    @Override
    public Future<Boolean> notificationMarkRead(String notificationId)
    {
        try
        {
            return pgPool.preparedQuery("UPDATE notifications SET is_read = TRUE WHERE id = $1")
                .execute(Tuple.of(UUID.fromString(notificationId)))
                .map(result -> result.rowCount() > 0);
        }
        catch (Exception exception)
        {
            logger.error("Error in notificationMarkRead: {}", exception.getMessage());

            return Future.failedFuture(exception);
        }
    }

    @Override
    public Future<Integer> notificationMarkAllReadForJob(String jobId)
    {
        try
        {
            return pgPool.preparedQuery("UPDATE notifications SET is_read = TRUE WHERE job_id = $1 AND is_read = FALSE")
                .execute(Tuple.of(UUID.fromString(jobId)))
                .map(result -> result.rowCount());
        }
        catch (Exception exception)
        {
            logger.error("Error in notificationMarkAllReadForJob: {}", exception.getMessage());

            return Future.failedFuture(exception);
        }
    }

    @Override
    public Future<Boolean> notificationDelete(String notificationId)
    {
        try
        {
            return pgPool.preparedQuery("DELETE FROM notifications WHERE id = $1")
                .execute(Tuple.of(UUID.fromString(notificationId)))
                .map(result -> result.rowCount() > 0);
        }
        catch (Exception exception)
        {
            logger.error("Error in notificationDelete: {}", exception.getMessage());

            return Future.failedFuture(exception);
        }
    }

    @Override
    public Future<Integer> notificationCleanupOlderThan(int days)
    {
        return pgPool.preparedQuery("DELETE FROM notifications WHERE created_at < NOW() - make_interval(days => $1)")
            .execute(Tuple.of(days))
            .map(result -> result.rowCount())
            .onSuccess(deleted -> logger.info("Notification cleanup removed {} rows older than {} days", deleted, days))
            .onFailure(cause -> logger.error("Failed to clean up notifications: {}", cause.getMessage()));
    }

    @Override
    public Future<JsonObject> notificationStatistics()
    {
        var sql = """
                SELECT COUNT(*) AS total,
                       COUNT(*) FILTER (WHERE NOT is_read) AS unread,
                       COUNT(*) FILTER (WHERE NOT is_read AND type = 'warning') AS unread_warnings,
                       COUNT(*) FILTER (WHERE NOT is_read AND type = 'information') AS unread_information
                FROM notifications
                """;

        return pgPool.query(sql)
            .execute()
            .map(rows ->
            {
                var row = rows.iterator().next();

                return new JsonObject()
                    .put("total", row.getLong("total"))
                    .put("unread", row.getLong("unread"))
                    .put("unread_warnings", row.getLong("unread_warnings"))
                    .put("unread_information", row.getLong("unread_information"));
            });
    }

}
