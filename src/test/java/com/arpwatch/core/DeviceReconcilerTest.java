package com.arpwatch.core;

import com.arpwatch.models.DeviceStatus;

import com.arpwatch.models.DiscoveredDevice;

import com.arpwatch.models.Job;

import com.arpwatch.models.KnownDevice;

import com.arpwatch.models.Notification;

import com.arpwatch.models.NotificationType;

import com.arpwatch.models.ReconciliationPlan;

import org.junit.jupiter.api.BeforeEach;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import java.time.Instant;

import java.util.ArrayList;

import java.util.Collection;

import java.util.LinkedHashMap;

import java.util.List;

import java.util.Map;

import java.util.stream.Collectors;

import static com.arpwatch.support.TestJobs.job;

import static org.junit.jupiter.api.Assertions.assertEquals;

import static org.junit.jupiter.api.Assertions.assertFalse;

import static org.junit.jupiter.api.Assertions.assertTrue;

class DeviceReconcilerTest
{

    private static final String AUTHORIZED = "aa:bb:cc:dd:ee:ff";

    private static final String STRANGER = "11:22:33:44:55:66";

    private static final Instant FIRST_RUN = Instant.parse("2024-04-01T09:00:00Z");

    private static final Instant SECOND_RUN = FIRST_RUN.plus(Duration.ofHours(1));

    private final DeviceReconciler reconciler = new DeviceReconciler();

    private Job job;

    @BeforeEach
    void setUp()
    {
        job = job("office", AUTHORIZED);

        job.id = "job-1";
    }

    @Test
    void firstRunInsertsAndClassifiesByWhitelist()
    {
        var plan = reconcile(List.of(), FIRST_RUN,
            seen("192.168.1.10", AUTHORIZED),
            seen("192.168.1.11", STRANGER));

        assertEquals(2, plan.insertions().size());

        assertTrue(plan.updates().isEmpty());

        assertTrue(plan.inactivations().isEmpty());

        assertEquals(List.of(NotificationType.INFORMATION, NotificationType.WARNING), typesOf(plan.notifications()));

        assertEquals("New authorized device discovered: " + AUTHORIZED, plan.notifications().get(0).message);

        assertEquals("Unauthorized device detected: " + STRANGER, plan.notifications().get(1).message);

        assertEquals(2, plan.devicesFound());

        assertEquals(2, plan.newDevices());

        assertEquals(1, plan.warnings());

        assertTrue(plan.insertions().get(0).whitelisted);

        assertFalse(plan.insertions().get(1).whitelisted);

        assertEquals(FIRST_RUN, plan.insertions().get(0).firstSeen);
    }

    @Test
    void secondRunReportsIpChangeAndInactivatesMissingDevice()
    {
        var first = reconcile(List.of(), FIRST_RUN,
            seen("192.168.1.10", AUTHORIZED),
            seen("192.168.1.11", STRANGER));

        var known = apply(Map.of(), first);

        var second = reconcile(known.values(), SECOND_RUN, seen("192.168.1.99", AUTHORIZED));

        assertEquals(1, second.notifications().size());

        var notification = second.notifications().get(0);

        assertEquals(NotificationType.INFORMATION, notification.type);

        assertTrue(notification.message.contains("IP changed from 192.168.1.10 to 192.168.1.99"));

        assertEquals(1, second.updates().size());

        assertEquals("192.168.1.99", second.updates().get(0).ipAddress);

        assertEquals(FIRST_RUN, second.updates().get(0).firstSeen);

        assertEquals(SECOND_RUN, second.updates().get(0).lastSeen);

        assertEquals(1, second.inactivations().size());

        assertEquals(STRANGER, second.inactivations().get(0).macAddress);

        assertEquals(DeviceStatus.INACTIVE, second.inactivations().get(0).status);

        // Leaving the network raises nothing
        assertEquals(1, second.devicesFound());

        assertEquals(0, second.newDevices());

        assertEquals(0, second.warnings());
    }

    @Test
    void reconcilingSameScanTwiceProducesOnlyUpdates()
    {
        var scan = new DiscoveredDevice[] {
            seen("192.168.1.10", AUTHORIZED),
            seen("192.168.1.11", STRANGER),
            seen("192.168.1.12", "00:00:5e:00:53:01")
        };

        var first = reconcile(List.of(), FIRST_RUN, scan);

        var second = reconcile(apply(Map.of(), first).values(), SECOND_RUN, scan);

        assertTrue(second.insertions().isEmpty());

        assertEquals(3, second.updates().size());

        assertEquals(0, second.newDevices());

        assertTrue(second.notifications().isEmpty());

        assertTrue(second.inactivations().isEmpty());
    }

    @Test
    void returningDeviceIsReactivated()
    {
        var known = device(STRANGER, "192.168.1.11", DeviceStatus.INACTIVE, FIRST_RUN);

        var plan = reconcile(List.of(known), SECOND_RUN, seen("192.168.1.11", STRANGER));

        assertEquals(DeviceStatus.ACTIVE, plan.updates().get(0).status);

        assertTrue(plan.notifications().isEmpty());
    }

    @Test
    void duplicateMacInOneScanIsLaterWinsUpdate()
    {
        var plan = reconcile(List.of(), FIRST_RUN,
            seen("192.168.1.10", STRANGER),
            seen("192.168.1.20", STRANGER));

        assertEquals(1, plan.insertions().size());

        assertEquals("192.168.1.20", plan.insertions().get(0).ipAddress);

        assertEquals(2, plan.devicesFound());

        assertEquals(1, plan.newDevices());

        assertEquals(2, plan.historySamples().size());

        // Warning for the new device, then the IP change against the first line
        assertEquals(List.of(NotificationType.WARNING, NotificationType.INFORMATION), typesOf(plan.notifications()));
    }

    @Test
    void masterToggleSilencesEveryNotification()
    {
        job.notificationsEnabled = false;

        var known = device(AUTHORIZED, "192.168.1.10", DeviceStatus.ACTIVE, FIRST_RUN);

        var plan = reconcile(List.of(known), SECOND_RUN,
            seen("192.168.1.50", AUTHORIZED),
            seen("192.168.1.11", STRANGER));

        assertTrue(plan.notifications().isEmpty());

        assertEquals(0, plan.warnings());

        assertEquals(1, plan.insertions().size());
    }

    @Test
    void individualTogglesAreHonored()
    {
        job.notifyNewMacs = false;

        job.notifyIpChanges = false;

        var known = device("00:00:5e:00:53:01", "192.168.1.5", DeviceStatus.ACTIVE, FIRST_RUN);

        var plan = reconcile(List.of(known), SECOND_RUN,
            seen("192.168.1.6", "00:00:5e:00:53:01"),
            seen("192.168.1.10", AUTHORIZED),
            seen("192.168.1.11", STRANGER));

        assertEquals(List.of(NotificationType.WARNING), typesOf(plan.notifications()));

        job.notifyUnauthorizedMacs = false;

        var silent = reconcile(List.of(), SECOND_RUN, seen("192.168.1.11", STRANGER));

        assertTrue(silent.notifications().isEmpty());

        assertEquals(0, silent.warnings());
    }

    @Test
    void updateRefreshesWhitelistFlagAndKeepsVendor()
    {
        var known = device(STRANGER, "192.168.1.11", DeviceStatus.ACTIVE, FIRST_RUN);

        known.vendor = "Acme";

        job.setWhitelist(List.of(STRANGER));

        var plan = reconcile(List.of(known), SECOND_RUN, seen("192.168.1.11", STRANGER));

        var updated = plan.updates().get(0);

        assertTrue(updated.whitelisted);

        assertEquals("Acme", updated.vendor);

        assertFalse(known.whitelisted, "snapshot is not modified");
    }

    @Test
    void emptyScanInactivatesEveryKnownDevice()
    {
        var plan = reconcile(List.of(
            device(AUTHORIZED, "192.168.1.10", DeviceStatus.ACTIVE, FIRST_RUN),
            device(STRANGER, "192.168.1.11", DeviceStatus.INACTIVE, FIRST_RUN)), SECOND_RUN);

        assertEquals(2, plan.inactivations().size());

        assertEquals(0, plan.devicesFound());

        assertTrue(plan.historySamples().isEmpty());

        assertEquals("found=0 new=0 updated=0 inactive=2 warnings=0 notifications=0", plan.summary());
    }

    private ReconciliationPlan reconcile(Collection<KnownDevice> known, Instant now, DiscoveredDevice... discovered)
    {
        return reconciler.reconcile(job, job.whitelist, known, List.of(discovered), now);
    }

    private static DiscoveredDevice seen(String ip, String mac)
    {
        return new DiscoveredDevice(ip, mac, null, FIRST_RUN);
    }

    private KnownDevice device(String mac, String ip, DeviceStatus status, Instant lastSeen)
    {
        var device = new KnownDevice();

        device.id = "dev-" + mac;

        device.jobId = job.id;

        device.macAddress = mac;

        device.ipAddress = ip;

        device.status = status;

        device.firstSeen = lastSeen;

        device.lastSeen = lastSeen;

        return device;
    }

    private static Map<String, KnownDevice> apply(Map<String, KnownDevice> known, ReconciliationPlan plan)
    {
        var state = new LinkedHashMap<>(known);

        var changes = new ArrayList<KnownDevice>();

        changes.addAll(plan.insertions());

        changes.addAll(plan.updates());

        changes.addAll(plan.inactivations());

        for (var device : changes)
        {
            state.put(device.macAddress, device);
        }

        return state;
    }

    private static List<NotificationType> typesOf(List<Notification> notifications)
    {
        return notifications.stream().map(notification -> notification.type).collect(Collectors.toList());
    }

}
