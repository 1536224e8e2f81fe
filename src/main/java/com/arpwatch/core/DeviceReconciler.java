package com.arpwatch.core;

import com.arpwatch.models.DeviceHistorySample;

import com.arpwatch.models.DeviceStatus;

import com.arpwatch.models.DiscoveredDevice;

import com.arpwatch.models.Job;

import com.arpwatch.models.KnownDevice;

import com.arpwatch.models.Notification;

import com.arpwatch.models.NotificationType;

import com.arpwatch.models.ReconciliationPlan;

import java.time.Instant;

import java.util.ArrayList;

import java.util.Collection;

import java.util.LinkedHashMap;

import java.util.List;

import java.util.Map;

import java.util.Set;

/**
 * DeviceReconciler - Classifies one scan result against a job's known devices

 * Pure: takes snapshots, returns a ReconciliationPlan, touches no store. The caller
 * persists the plan in a single transaction.

 * Per discovered device:
 * - unknown MAC: insertion; information (whitelisted, notify new) or warning (not whitelisted, notify unauthorized)
 * - known MAC: update; information when the IP changed and notify IP changes is on
 * - always: one history sample

 * Known devices not seen in the scan become inactive (no notification). All
 * notifications are gated by the job's master notificationsEnabled toggle.

 * A MAC listed twice in one scan is inserted (or updated) once; the later line wins and
 * is compared against the earlier one for IP changes.
 */
public class DeviceReconciler
{

    /**
     * Reconcile a scan against known devices.
     *
     * @param job job being run (toggles, id, name)
     * @param whitelist normalized whitelisted MACs
     * @param knownDevices persisted devices of the job (not modified)
     * @param discovered devices returned by the scanner, in output order
     * @param now run timestamp used for first/last seen and notifications
     * @return plan to persist
     */
    public ReconciliationPlan reconcile(Job job,
                                        Set<String> whitelist,
                                        Collection<KnownDevice> knownDevices,
                                        List<DiscoveredDevice> discovered,
                                        Instant now)
    {
        // Working copy keyed by MAC; entries are removed as they are seen
        var unseen = new LinkedHashMap<String, KnownDevice>();

        for (var device : knownDevices)
        {
            unseen.put(device.macAddress, device);
        }

        var insertions = new LinkedHashMap<String, KnownDevice>();

        var updates = new LinkedHashMap<String, KnownDevice>();

        var historySamples = new ArrayList<DeviceHistorySample>();

        var notifications = new ArrayList<Notification>();

        var warnings = 0;

        for (var device : discovered)
        {
            var mac = device.mac();

            var whitelisted = whitelist.contains(mac);

            historySamples.add(new DeviceHistorySample(job.id, mac, device.ip(), device.vendor(), now));

            var previous = currentState(mac, unseen, insertions, updates);

            if (previous == null)
            {
                insertions.put(mac, newDevice(job, device, whitelisted, now));

                if (job.notificationsEnabled)
                {
                    if (whitelisted && job.notifyNewMacs)
                    {
                        notifications.add(Notification.of(job, NotificationType.INFORMATION,
                            "New authorized device discovered: " + mac, mac, device.ip(), now));
                    }
                    else if (!whitelisted && job.notifyUnauthorizedMacs)
                    {
                        notifications.add(Notification.of(job, NotificationType.WARNING,
                            "Unauthorized device detected: " + mac, mac, device.ip(), now));

                        warnings++;
                    }
                }

                continue;
            }

            var previousIp = previous.ipAddress;

            if (job.notificationsEnabled && job.notifyIpChanges
                && previousIp != null && !previousIp.equals(device.ip()))
            {
                notifications.add(Notification.of(job, NotificationType.INFORMATION,
                    "Device " + mac + " IP changed from " + previousIp + " to " + device.ip(), mac, device.ip(), now));
            }

            var updated = previous.copy();

            updated.ipAddress = device.ip();

            if (device.vendor() != null)
            {
                updated.vendor = device.vendor();
            }

            updated.whitelisted = whitelisted;

            updated.lastSeen = now;

            updated.status = DeviceStatus.ACTIVE;

            // A duplicate of a MAC first seen in this scan stays an insertion
            if (insertions.containsKey(mac))
            {
                insertions.put(mac, updated);
            }
            else
            {
                updates.put(mac, updated);
            }

            unseen.remove(mac);
        }

        var inactivations = new ArrayList<KnownDevice>();

        for (var device : unseen.values())
        {
            var inactive = device.copy();

            inactive.status = DeviceStatus.INACTIVE;

            inactivations.add(inactive);
        }

        return new ReconciliationPlan(
            job.id,
            now,
            new ArrayList<>(insertions.values()),
            new ArrayList<>(updates.values()),
            inactivations,
            historySamples,
            notifications,
            discovered.size(),
            insertions.size(),
            warnings);
    }

    private static KnownDevice currentState(String mac,
                                            Map<String, KnownDevice> unseen,
                                            Map<String, KnownDevice> insertions,
                                            Map<String, KnownDevice> updates)
    {
        var device = insertions.get(mac);

        if (device == null)
        {
            device = updates.get(mac);
        }

        return device != null ? device : unseen.get(mac);
    }

    private static KnownDevice newDevice(Job job, DiscoveredDevice discovered, boolean whitelisted, Instant now)
    {
        var device = new KnownDevice();

        device.jobId = job.id;

        device.macAddress = discovered.mac();

        device.ipAddress = discovered.ip();

        device.vendor = discovered.vendor();

        device.whitelisted = whitelisted;

        device.firstSeen = now;

        device.lastSeen = now;

        device.status = DeviceStatus.ACTIVE;

        return device;
    }

}
