package com.arpwatch.models;

import io.vertx.core.json.JsonObject;

import java.time.Instant;

/**
 * Latest reconciled state of one device (by MAC) under one job.
 * Unique on (jobId, macAddress).
 */
public class KnownDevice
{

    public String id;

    public String jobId;

    public String macAddress;

    public String ipAddress;

    public String vendor;            // best-effort, may be null

    public boolean whitelisted;

    public Instant firstSeen;

    public Instant lastSeen;

    public DeviceStatus status = DeviceStatus.ACTIVE;

    public KnownDevice copy()
    {
        var copy = new KnownDevice();

        copy.id = id;

        copy.jobId = jobId;

        copy.macAddress = macAddress;

        copy.ipAddress = ipAddress;

        copy.vendor = vendor;

        copy.whitelisted = whitelisted;

        copy.firstSeen = firstSeen;

        copy.lastSeen = lastSeen;

        copy.status = status;

        return copy;
    }

    public JsonObject toJson()
    {
        return new JsonObject()
            .put("id", id)
            .put("job_id", jobId)
            .put("mac_address", macAddress)
            .put("ip_address", ipAddress)
            .put("vendor", vendor)
            .put("whitelisted", whitelisted)
            .put("first_seen", firstSeen != null ? firstSeen.toString() : null)
            .put("last_seen", lastSeen != null ? lastSeen.toString() : null)
            .put("status", status.value());
    }

}
