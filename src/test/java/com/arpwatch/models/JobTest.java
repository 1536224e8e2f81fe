package com.arpwatch.models;

import com.arpwatch.exceptions.InvalidScheduleException;

import io.vertx.core.json.JsonArray;

import io.vertx.core.json.JsonObject;

import org.junit.jupiter.api.Test;

import java.time.Instant;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;

import static org.junit.jupiter.api.Assertions.assertFalse;

import static org.junit.jupiter.api.Assertions.assertThrows;

import static org.junit.jupiter.api.Assertions.assertTrue;

class JobTest
{

    private static final Instant NOW = Instant.parse("2024-05-10T08:00:00Z");

    @Test
    void dueWhenScheduledActiveAndNextRunReached()
    {
        var job = new Job();

        job.schedule = Schedule.HOURLY;

        assertTrue(job.isDue(NOW), "unset next run is due");

        job.nextRun = NOW;

        assertTrue(job.isDue(NOW));

        job.nextRun = NOW.plusSeconds(1);

        assertFalse(job.isDue(NOW));
    }

    @Test
    void manualAndRunningJobsAreNeverDue()
    {
        var job = new Job();

        job.nextRun = NOW.minusSeconds(60);

        assertFalse(job.isDue(NOW));

        job.schedule = Schedule.DAILY;

        job.status = JobStatus.RUNNING;

        assertFalse(job.isDue(NOW));
    }

    @Test
    void whitelistIsNormalizedAndDeduplicated()
    {
        var job = new Job();

        job.setWhitelist(List.of("AA-BB-CC-DD-EE-FF", "aa:bb:cc:dd:ee:ff", "00:11:22:33:44:55"));

        assertEquals(List.of("aa:bb:cc:dd:ee:ff", "00:11:22:33:44:55"), List.copyOf(job.whitelist));

        assertTrue(job.isWhitelisted("AA:BB:CC:DD:EE:FF"));

        assertThrows(IllegalArgumentException.class, () -> job.setWhitelist(List.of("not-a-mac")));
    }

    @Test
    void mergeAppliesOnlyPresentKeys()
    {
        var job = new Job();

        job.name = "office";

        job.subnet = "10.0.0.0/24";

        job.merge(new JsonObject()
            .put("schedule", "6h")
            .put("notify_ip_changes", false)
            .put("retention_policy", "days")
            .put("retention_days", 14)
            .put("whitelist", new JsonArray().add("AA:BB:CC:00:00:01")));

        assertEquals("office", job.name);

        assertEquals("10.0.0.0/24", job.subnet);

        assertEquals(Schedule.EVERY_6H, job.schedule);

        assertFalse(job.notifyIpChanges);

        assertTrue(job.notifyNewMacs);

        assertEquals(RetentionPolicy.days(14), job.retentionPolicy);

        assertTrue(job.isWhitelisted("aa:bb:cc:00:00:01"));
    }

    @Test
    void mergeRejectsUnknownSchedule()
    {
        var job = new Job();

        assertThrows(InvalidScheduleException.class, () -> job.merge(new JsonObject().put("schedule", "hourly")));
    }

    @Test
    void toJsonUsesWireForms()
    {
        var job = new Job();

        job.schedule = Schedule.WEEKLY;

        job.retentionPolicy = RetentionPolicy.IMMEDIATE;

        var json = job.toJson();

        assertEquals("7d", json.getString("schedule"));

        assertEquals("immediate", json.getString("retention_policy"));

        assertEquals("active", json.getString("status"));
    }

}
