package com.arpwatch.services;

import com.arpwatch.models.Notification;

import com.arpwatch.models.NotificationType;

import io.vertx.core.Future;

import io.vertx.core.json.JsonObject;

import java.util.List;

/**
 * NotificationService - Notification queries and read-flag management.
 * Notifications are created only by the run commit.
 */
public interface NotificationService
{

    /**
     * List notifications, newest first.
     *
     * @param unreadOnly only unread rows when true
     * @param jobId optional job filter (null for all)
     * @param type optional type filter (null for all)
     * @param limit maximum rows
     * @return Future containing notifications
     */
    Future<List<Notification>> notificationList(boolean unreadOnly, String jobId, NotificationType type, int limit);

    Future<Boolean> notificationMarkRead(String notificationId);

    /**
     * @param jobId job id
     * @return Future containing the number of notifications marked read
     */
    Future<Integer> notificationMarkAllReadForJob(String jobId);

    Future<Boolean> notificationDelete(String notificationId);

    /**
     * Delete notifications older than the given number of days.
     *
     * @param days age threshold in days
     * @return Future containing the number of rows deleted
     */
    Future<Integer> notificationCleanupOlderThan(int days);

    /**
     * Counters: total, unread, unread_warnings, unread_information.
     *
     * @return Future containing the statistics object
     */
    Future<JsonObject> notificationStatistics();

}
