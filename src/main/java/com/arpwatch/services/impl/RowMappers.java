package com.arpwatch.services.impl;

import com.arpwatch.exceptions.InvalidScheduleException;

import com.arpwatch.models.DeviceStatus;

import com.arpwatch.models.Job;

import com.arpwatch.models.JobRun;

import com.arpwatch.models.JobStatus;

import com.arpwatch.models.KnownDevice;

import com.arpwatch.models.Notification;

import com.arpwatch.models.NotificationType;

import com.arpwatch.models.RetentionPolicy;

import com.arpwatch.models.RunStatus;

import com.arpwatch.models.Schedule;

import com.arpwatch.utils.SqlUtil;

import io.vertx.sqlclient.Row;

import org.slf4j.Logger;

import org.slf4j.LoggerFactory;

import java.util.Arrays;

/**
 * Row to model mapping shared by the PostgreSQL service implementations.
 */
final class RowMappers
{

    private static final Logger logger = LoggerFactory.getLogger(RowMappers.class);

    // Job columns plus the aggregated whitelist, used by every job query
    static final String JOB_SELECT = """
            SELECT j.id, j.name, j.network_interface, j.subnet, j.execution_time, j.schedule,
                   j.notifications_enabled, j.notify_new_macs, j.notify_unauthorized_macs, j.notify_ip_changes,
                   j.retention_policy, j.retention_days, j.status, j.last_run, j.next_run, j.created_at, j.updated_at,
                   COALESCE(array_agg(w.mac_address ORDER BY w.id) FILTER (WHERE w.mac_address IS NOT NULL), '{}') AS whitelist
            FROM jobs j
            LEFT JOIN job_whitelist w ON w.job_id = j.id
            """;

    private RowMappers()
    {
    }

    static Job job(Row row)
    {
        var job = new Job();

        job.id = row.getUUID("id").toString();

        job.name = row.getString("name");

        job.networkInterface = row.getString("network_interface");

        job.subnet = row.getString("subnet");

        job.executionTime = row.getInteger("execution_time");

        try
        {
            job.schedule = Schedule.fromTag(row.getString("schedule"));
        }
        catch (InvalidScheduleException exception)
        {
            // Never auto-dispatched; the job can still be run manually
            logger.warn("Job {} has an invalid stored schedule, treating as manual: {}", job.id, exception.getMessage());

            job.schedule = Schedule.MANUAL;
        }

        job.notificationsEnabled = row.getBoolean("notifications_enabled");

        job.notifyNewMacs = row.getBoolean("notify_new_macs");

        job.notifyUnauthorizedMacs = row.getBoolean("notify_unauthorized_macs");

        job.notifyIpChanges = row.getBoolean("notify_ip_changes");

        try
        {
            job.retentionPolicy = RetentionPolicy.fromColumns(row.getString("retention_policy"), row.getInteger("retention_days"));
        }
        catch (IllegalArgumentException exception)
        {
            logger.warn("Job {} has an invalid stored retention policy, using default: {}", job.id, exception.getMessage());

            job.retentionPolicy = RetentionPolicy.defaultPolicy();
        }

        job.status = JobStatus.fromValue(row.getString("status"));

        job.lastRun = SqlUtil.toInstant(row.getOffsetDateTime("last_run"));

        job.nextRun = SqlUtil.toInstant(row.getOffsetDateTime("next_run"));

        job.createdAt = SqlUtil.toInstant(row.getOffsetDateTime("created_at"));

        job.updatedAt = SqlUtil.toInstant(row.getOffsetDateTime("updated_at"));

        var whitelist = row.getArrayOfStrings("whitelist");

        if (whitelist != null)
        {
            job.whitelist.addAll(Arrays.asList(whitelist));
        }

        return job;
    }

    static KnownDevice knownDevice(Row row)
    {
        var device = new KnownDevice();

        device.id = row.getUUID("id").toString();

        device.jobId = row.getUUID("job_id").toString();

        device.macAddress = row.getString("mac_address");

        device.ipAddress = row.getString("ip_address");

        device.vendor = row.getString("vendor");

        device.whitelisted = row.getBoolean("whitelisted");

        device.firstSeen = SqlUtil.toInstant(row.getOffsetDateTime("first_seen"));

        device.lastSeen = SqlUtil.toInstant(row.getOffsetDateTime("last_seen"));

        device.status = DeviceStatus.fromValue(row.getString("status"));

        return device;
    }

    static JobRun jobRun(Row row)
    {
        var run = new JobRun();

        run.id = row.getUUID("id").toString();

        run.jobId = row.getUUID("job_id").toString();

        run.status = RunStatus.fromValue(row.getString("status"));

        run.devicesFound = row.getInteger("devices_found");

        run.newDevices = row.getInteger("new_devices");

        run.warnings = row.getInteger("warnings");

        run.startedAt = SqlUtil.toInstant(row.getOffsetDateTime("started_at"));

        run.finishedAt = SqlUtil.toInstant(row.getOffsetDateTime("finished_at"));

        run.duration = row.getLong("duration");

        run.output = row.getString("output");

        run.errorMessage = row.getString("error_message");

        return run;
    }

    static Notification notification(Row row)
    {
        var notification = new Notification();

        notification.id = row.getUUID("id").toString();

        notification.jobId = row.getUUID("job_id").toString();

        notification.jobName = row.getString("job_name");

        notification.type = NotificationType.fromValue(row.getString("type"));

        notification.message = row.getString("message");

        notification.macAddress = row.getString("mac_address");

        notification.ipAddress = row.getString("ip_address");

        notification.createdAt = SqlUtil.toInstant(row.getOffsetDateTime("created_at"));

        notification.read = row.getBoolean("is_read");

        return notification;
    }

}
