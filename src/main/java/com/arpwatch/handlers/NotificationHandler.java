package com.arpwatch.handlers;

import com.arpwatch.models.NotificationType;

import com.arpwatch.services.NotificationService;

import com.arpwatch.utils.ExceptionUtil;

import com.arpwatch.utils.ResponseUtil;

import com.arpwatch.utils.ValidationUtil;

import io.vertx.core.Future;

import io.vertx.core.json.JsonArray;

import io.vertx.core.json.JsonObject;

import io.vertx.ext.web.RoutingContext;

import org.slf4j.Logger;

import org.slf4j.LoggerFactory;

import java.util.NoSuchElementException;

/**
 * NotificationHandler - Handles notification HTTP requests

 * Query parameters of GET /api/notifications:
 * - unread=true: only unread notifications
 * - job_id: notifications of one job
 * - type: information | warning
 * - limit: maximum rows (default 100)
 */
public class NotificationHandler
{

    private static final Logger logger = LoggerFactory.getLogger(NotificationHandler.class);

    private static final int DEFAULT_LIMIT = 100;

    private static final int DEFAULT_CLEANUP_DAYS = 30;

    private final NotificationService notificationService;

    public NotificationHandler(NotificationService notificationService)
    {
        this.notificationService = notificationService;
    }

    public void getNotifications(RoutingContext ctx)
    {
        try
        {
            var unreadOnly = Boolean.parseBoolean(ctx.request().getParam("unread"));

            var jobId = ctx.request().getParam("job_id");

            var typeParam = ctx.request().getParam("type");

            if (jobId != null && !ValidationUtil.validatePathParameterUUID(ctx, jobId, "job_id"))
            {
                return; // Validation failed, response already sent
            }

            var limit = ValidationUtil.positiveQueryParam(ctx, "limit", DEFAULT_LIMIT);

            if (limit == null)
            {
                return; // Validation failed, response already sent
            }

            var type = typeParam != null ? NotificationType.fromValue(typeParam) : null;

            notificationService.notificationList(unreadOnly, jobId, type, limit)
                .onSuccess(notifications ->
                {
                    var result = new JsonArray();

                    for (var notification : notifications)
                    {
                        result.add(notification.toJson());
                    }

                    ResponseUtil.handleSuccess(ctx, new JsonObject().put("notifications", result));
                })
                .onFailure(cause -> ExceptionUtil.handleHttp(ctx, cause, "Failed to get notifications"));
        }
        catch (Exception exception)
        {
            logger.error("Error in getNotifications handler: {}", exception.getMessage());

            ExceptionUtil.handleHttp(ctx, exception, "Failed to get notifications");
        }
    }

    public void markRead(RoutingContext ctx)
    {
        try
        {
            var notificationId = ctx.pathParam("id");

            if (!ValidationUtil.validatePathParameterUUID(ctx, notificationId, "Notification ID"))
            {
                return; // Validation failed, response already sent
            }

            notificationService.notificationMarkRead(notificationId)
                .compose(updated -> found(updated, notificationId))
                .onSuccess(v -> ResponseUtil.handleSuccess(ctx, new JsonObject().put("notification_id", notificationId).put("read", true)))
                .onFailure(cause -> ExceptionUtil.handleHttp(ctx, cause, "Failed to mark notification as read"));
        }
        catch (Exception exception)
        {
            logger.error("Error in markRead handler: {}", exception.getMessage());

            ExceptionUtil.handleHttp(ctx, exception, "Failed to mark notification as read");
        }
    }

    public void markAllReadForJob(RoutingContext ctx)
    {
        try
        {
            var jobId = ctx.pathParam("jobId");

            if (!ValidationUtil.validatePathParameterUUID(ctx, jobId, "Job ID"))
            {
                return; // Validation failed, response already sent
            }

            notificationService.notificationMarkAllReadForJob(jobId)
                .onSuccess(count -> ResponseUtil.handleSuccess(ctx, new JsonObject().put("job_id", jobId).put("marked_read", count)))
                .onFailure(cause -> ExceptionUtil.handleHttp(ctx, cause, "Failed to mark notifications as read"));
        }
        catch (Exception exception)
        {
            logger.error("Error in markAllReadForJob handler: {}", exception.getMessage());

            ExceptionUtil.handleHttp(ctx, exception, "Failed to mark notifications as read");
        }
    }

    public void deleteNotification(RoutingContext ctx)
    {
        try
        {
            var notificationId = ctx.pathParam("id");

            if (!ValidationUtil.validatePathParameterUUID(ctx, notificationId, "Notification ID"))
            {
                return; // Validation failed, response already sent
            }

            notificationService.notificationDelete(notificationId)
                .compose(deleted -> found(deleted, notificationId))
                .onSuccess(v -> ResponseUtil.handleSuccess(ctx, new JsonObject().put("notification_id", notificationId).put("deleted", true)))
                .onFailure(cause -> ExceptionUtil.handleHttp(ctx, cause, "Failed to delete notification"));
        }
        catch (Exception exception)
        {
            logger.error("Error in deleteNotification handler: {}", exception.getMessage());

            ExceptionUtil.handleHttp(ctx, exception, "Failed to delete notification");
        }
    }

    public void getStatistics(RoutingContext ctx)
    {
        notificationService.notificationStatistics()
            .onSuccess(stats -> ResponseUtil.handleSuccess(ctx, stats))
            .onFailure(cause -> ExceptionUtil.handleHttp(ctx, cause, "Failed to get notification statistics"));
    }

    /**
     * Delete notifications older than ?days=N (default 30).
     *
     * @param ctx routing context containing the HTTP request and response
     */
    public void cleanup(RoutingContext ctx)
    {
        try
        {
            var days = ValidationUtil.positiveQueryParam(ctx, "days", DEFAULT_CLEANUP_DAYS);

            if (days == null)
            {
                return; // Validation failed, response already sent
            }

            notificationService.notificationCleanupOlderThan(days)
                .onSuccess(deleted -> ResponseUtil.handleSuccess(ctx, new JsonObject().put("days", days).put("deleted", deleted)))
                .onFailure(cause -> ExceptionUtil.handleHttp(ctx, cause, "Failed to clean up notifications"));
        }
        catch (Exception exception)
        {
            logger.error("Error in cleanup handler: {}", exception.getMessage());

            ExceptionUtil.handleHttp(ctx, exception, "Failed to clean up notifications");
        }
    }

    private static Future<Void> found(boolean changed, String notificationId)
    {
        return changed
            ? Future.succeededFuture()
            : Future.failedFuture(new NoSuchElementException("Notification not found: " + notificationId));
    }

}
