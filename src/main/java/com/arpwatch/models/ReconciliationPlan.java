package com.arpwatch.models;

import java.time.Instant;

import java.util.Collections;

import java.util.List;

/**
 * Result of reconciling one scan against a job's known devices.

 * Contains every state change the run must persist (applied together in one transaction):
 * - insertions: devices seen for the first time
 * - updates: known devices seen again (new IP, vendor, last seen, status active)
 * - inactivations: known devices not seen in this scan
 * - historySamples: one per discovered entry
 * - notifications: raised according to the job's toggles
 */
public final class ReconciliationPlan
{

    private final String jobId;

    private final Instant reconciledAt;

    private final List<KnownDevice> insertions;

    private final List<KnownDevice> updates;

    private final List<KnownDevice> inactivations;

    private final List<DeviceHistorySample> historySamples;

    private final List<Notification> notifications;

    private final int devicesFound;

    private final int newDevices;

    private final int warnings;

    public ReconciliationPlan(String jobId,
                              Instant reconciledAt,
                              List<KnownDevice> insertions,
                              List<KnownDevice> updates,
                              List<KnownDevice> inactivations,
                              List<DeviceHistorySample> historySamples,
                              List<Notification> notifications,
                              int devicesFound,
                              int newDevices,
                              int warnings)
    {
        this.jobId = jobId;

        this.reconciledAt = reconciledAt;

        this.insertions = Collections.unmodifiableList(insertions);

        this.updates = Collections.unmodifiableList(updates);

        this.inactivations = Collections.unmodifiableList(inactivations);

        this.historySamples = Collections.unmodifiableList(historySamples);

        this.notifications = Collections.unmodifiableList(notifications);

        this.devicesFound = devicesFound;

        this.newDevices = newDevices;

        this.warnings = warnings;
    }

    public String jobId()
    {
        return jobId;
    }

    public Instant reconciledAt()
    {
        return reconciledAt;
    }

    public List<KnownDevice> insertions()
    {
        return insertions;
    }

    public List<KnownDevice> updates()
    {
        return updates;
    }

    public List<KnownDevice> inactivations()
    {
        return inactivations;
    }

    public List<DeviceHistorySample> historySamples()
    {
        return historySamples;
    }

    public List<Notification> notifications()
    {
        return notifications;
    }

    public int devicesFound()
    {
        return devicesFound;
    }

    public int newDevices()
    {
        return newDevices;
    }

    public int warnings()
    {
        return warnings;
    }

    /**
     * One-line summary stored as the run output.
     */
    public String summary()
    {
        return String.format("found=%d new=%d updated=%d inactive=%d warnings=%d notifications=%d",
            devicesFound, newDevices, updates.size(), inactivations.size(), warnings, notifications.size());
    }

}
