package com.arpwatch.services;

import com.arpwatch.models.KnownDevice;

import io.vertx.core.Future;

import java.util.List;

/**
 * KnownDeviceService - Reads and operator actions on known devices.
 * Scan-driven writes go through JobRunService.runComplete.
 */
public interface KnownDeviceService
{

    /**
     * @param jobId job id
     * @return Future containing every known device of the job, active and inactive
     */
    Future<List<KnownDevice>> knownDeviceListByJob(String jobId);

    /**
     * Delete a known device (operator action).
     *
     * @param jobId owning job id
     * @param deviceId device id
     * @return Future containing true if a row was deleted
     */
    Future<Boolean> knownDeviceDelete(String jobId, String deviceId);

    /**
     * Set the whitelisted flag of a device and keep the job whitelist in sync.
     *
     * @param jobId owning job id
     * @param deviceId device id
     * @param whitelisted new flag
     * @return Future containing the updated device, or null if absent
     */
    Future<KnownDevice> knownDeviceSetWhitelisted(String jobId, String deviceId, boolean whitelisted);

}
