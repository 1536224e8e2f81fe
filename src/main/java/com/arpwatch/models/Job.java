package com.arpwatch.models;

import com.arpwatch.utils.MacAddressUtil;

import io.vertx.core.json.JsonArray;

import io.vertx.core.json.JsonObject;

import java.time.Instant;

import java.util.ArrayList;

import java.util.Collection;

import java.util.LinkedHashSet;

import java.util.Set;

/**
 * Monitoring job: one interface/subnet pair scanned on a schedule.

 * Data Sources:
 * - Database: jobs table + job_whitelist table
 * - API: create/update payloads (snake_case keys, same as the columns)

 * The whitelist keeps insertion order but has set semantics; entries are stored
 * normalized (lower-case, colon-separated) so membership is case-insensitive.
 */
public class Job
{

    public static final int DEFAULT_EXECUTION_TIME = 300;

    // Identity
    public String id;                          // jobs.id

    public String name;                        // jobs.name

    // Scan target
    public String networkInterface;            // jobs.network_interface

    public String subnet;                      // jobs.subnet (IPv4 CIDR)

    public int executionTime = DEFAULT_EXECUTION_TIME;  // jobs.execution_time, scan budget in seconds

    public Schedule schedule = Schedule.MANUAL;         // jobs.schedule

    // Notification toggles
    public boolean notificationsEnabled = true;

    public boolean notifyNewMacs = true;

    public boolean notifyUnauthorizedMacs = true;

    public boolean notifyIpChanges = true;

    public RetentionPolicy retentionPolicy = RetentionPolicy.defaultPolicy();

    public JobStatus status = JobStatus.ACTIVE;

    // Timestamps
    public Instant lastRun;

    public Instant nextRun;

    public Instant createdAt;

    public Instant updatedAt;

    public final Set<String> whitelist = new LinkedHashSet<>();

    /**
     * Replace the whitelist, normalizing every entry.
     *
     * @param macAddresses MAC addresses in any accepted notation
     * @throws IllegalArgumentException if an entry is not a valid MAC address
     */
    public void setWhitelist(Collection<String> macAddresses)
    {
        whitelist.clear();

        if (macAddresses == null)
        {
            return;
        }

        for (var mac : macAddresses)
        {
            whitelist.add(MacAddressUtil.normalize(mac));
        }
    }

    public boolean isWhitelisted(String macAddress)
    {
        return macAddress != null && whitelist.contains(macAddress.toLowerCase());
    }

    /**
     * Checks if the scheduler should dispatch this job now.

     * A job is due when:
     * - it is active (not currently running)
     * - its schedule is not manual
     * - nextRun is unset or not after now
     *
     * @param now current time
     * @return true if the job should be dispatched
     */
    public boolean isDue(Instant now)
    {
        if (status != JobStatus.ACTIVE || schedule.isManual())
        {
            return false;
        }

        return nextRun == null || !nextRun.isAfter(now);
    }

    public JsonObject toJson()
    {
        return new JsonObject()
            .put("id", id)
            .put("name", name)
            .put("network_interface", networkInterface)
            .put("subnet", subnet)
            .put("execution_time", executionTime)
            .put("schedule", schedule.tag())
            .put("notifications_enabled", notificationsEnabled)
            .put("notify_new_macs", notifyNewMacs)
            .put("notify_unauthorized_macs", notifyUnauthorizedMacs)
            .put("notify_ip_changes", notifyIpChanges)
            .put("retention_policy", retentionPolicy.toString())
            .put("status", status.value())
            .put("last_run", lastRun != null ? lastRun.toString() : null)
            .put("next_run", nextRun != null ? nextRun.toString() : null)
            .put("created_at", createdAt != null ? createdAt.toString() : null)
            .put("updated_at", updatedAt != null ? updatedAt.toString() : null)
            .put("whitelist", new JsonArray(new ArrayList<>(whitelist)));
    }

    /**
     * Apply an API payload on top of this job. Only keys present in the payload are changed.

     * Accepted keys: name, network_interface, subnet, execution_time, schedule,
     * notifications_enabled, notify_new_macs, notify_unauthorized_macs, notify_ip_changes,
     * retention_policy, retention_days, whitelist.
     *
     * @param payload request body
     * @return this job
     * @throws IllegalArgumentException on malformed retention or whitelist values
     * @throws com.arpwatch.exceptions.InvalidScheduleException on an unknown schedule tag
     */
    public Job merge(JsonObject payload)
    {
        if (payload.containsKey("name"))
        {
            name = payload.getString("name");
        }

        if (payload.containsKey("network_interface"))
        {
            networkInterface = payload.getString("network_interface");
        }

        if (payload.containsKey("subnet"))
        {
            subnet = payload.getString("subnet");
        }

        if (payload.containsKey("execution_time"))
        {
            executionTime = payload.getInteger("execution_time", DEFAULT_EXECUTION_TIME);
        }

        if (payload.containsKey("schedule"))
        {
            schedule = Schedule.fromTag(payload.getString("schedule"));
        }

        notificationsEnabled = payload.getBoolean("notifications_enabled", notificationsEnabled);

        notifyNewMacs = payload.getBoolean("notify_new_macs", notifyNewMacs);

        notifyUnauthorizedMacs = payload.getBoolean("notify_unauthorized_macs", notifyUnauthorizedMacs);

        notifyIpChanges = payload.getBoolean("notify_ip_changes", notifyIpChanges);

        if (payload.containsKey("retention_policy"))
        {
            var policy = payload.getString("retention_policy");

            // "days" with a separate retention_days key is the column form
            retentionPolicy = "days".equalsIgnoreCase(policy)
                ? RetentionPolicy.days(payload.getInteger("retention_days", RetentionPolicy.DEFAULT_DAYS))
                : RetentionPolicy.parse(policy);
        }

        if (payload.containsKey("whitelist"))
        {
            var entries = payload.getJsonArray("whitelist", new JsonArray());

            var macs = new ArrayList<String>();

            for (var entry : entries)
            {
                macs.add(String.valueOf(entry));
            }

            setWhitelist(macs);
        }

        return this;
    }

}
