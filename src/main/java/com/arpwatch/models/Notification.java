package com.arpwatch.models;

import io.vertx.core.json.JsonObject;

import java.time.Instant;

/**
 * Operator-facing notification raised by reconciliation. Only the read flag changes after creation.
 */
public class Notification
{

    public String id;

    public String jobId;

    public String jobName;           // denormalized for display

    public NotificationType type;

    public String message;

    public String macAddress;

    public String ipAddress;

    public Instant createdAt;

    public boolean read;

    /**
     * Build an unsaved notification for a job. The id is assigned on insert.
     */
    public static Notification of(Job job, NotificationType type, String message,
                                  String macAddress, String ipAddress, Instant createdAt)
    {
        var notification = new Notification();

        notification.jobId = job.id;

        notification.jobName = job.name;

        notification.type = type;

        notification.message = message;

        notification.macAddress = macAddress;

        notification.ipAddress = ipAddress;

        notification.createdAt = createdAt;

        return notification;
    }

    public JsonObject toJson()
    {
        return new JsonObject()
            .put("id", id)
            .put("job_id", jobId)
            .put("job_name", jobName)
            .put("type", type.value())
            .put("message", message)
            .put("mac_address", macAddress)
            .put("ip_address", ipAddress)
            .put("created_at", createdAt != null ? createdAt.toString() : null)
            .put("read", read);
    }

}
