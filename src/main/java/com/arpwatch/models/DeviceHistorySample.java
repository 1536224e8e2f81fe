package com.arpwatch.models;

import java.time.Instant;

/**
 * Append-only sighting record (device_history row). Written once per discovered entry.
 */
public final class DeviceHistorySample
{

    private final String jobId;

    private final String macAddress;

    private final String ipAddress;

    private final String vendor;

    private final Instant detectedAt;

    public DeviceHistorySample(String jobId, String macAddress, String ipAddress, String vendor, Instant detectedAt)
    {
        this.jobId = jobId;

        this.macAddress = macAddress;

        this.ipAddress = ipAddress;

        this.vendor = vendor;

        this.detectedAt = detectedAt;
    }

    public String jobId()
    {
        return jobId;
    }

    public String macAddress()
    {
        return macAddress;
    }

    public String ipAddress()
    {
        return ipAddress;
    }

    public String vendor()
    {
        return vendor;
    }

    public Instant detectedAt()
    {
        return detectedAt;
    }

}
