package com.arpwatch.support;

import com.arpwatch.models.DiscoveredDevice;

import com.arpwatch.models.Job;

import com.arpwatch.models.Schedule;

import java.time.Instant;

import java.util.List;

/**
 * Builders for jobs and scan entries used across tests.
 */
public final class TestJobs
{

    private TestJobs()
    {
    }

    public static Job job(String name, String... whitelist)
    {
        var job = new Job();

        job.name = name;

        job.networkInterface = "eth0";

        job.subnet = "192.168.1.0/24";

        job.executionTime = 5;

        job.schedule = Schedule.MANUAL;

        job.setWhitelist(List.of(whitelist));

        return job;
    }

    public static DiscoveredDevice seen(String ip, String mac, Instant at)
    {
        return new DiscoveredDevice(ip, mac, null, at);
    }

}
