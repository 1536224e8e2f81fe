package com.arpwatch.models;

import java.time.Instant;

/**
 * One validated (ip, mac) pair reported by the scan tool. The MAC is already normalized.
 */
public final class DiscoveredDevice
{

    private final String ip;

    private final String mac;

    private final String vendor;

    private final Instant detectedAt;

    public DiscoveredDevice(String ip, String mac, String vendor, Instant detectedAt)
    {
        this.ip = ip;

        this.mac = mac;

        this.vendor = vendor;

        this.detectedAt = detectedAt;
    }

    public DiscoveredDevice(String ip, String mac)
    {
        this(ip, mac, null, Instant.now());
    }

    public String ip()
    {
        return ip;
    }

    public String mac()
    {
        return mac;
    }

    public String vendor()
    {
        return vendor;
    }

    public Instant detectedAt()
    {
        return detectedAt;
    }

    @Override
    public String toString()
    {
        return ip + "\t" + mac + (vendor != null ? "\t" + vendor : "");
    }

}
