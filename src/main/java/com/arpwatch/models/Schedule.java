package com.arpwatch.models;

import com.arpwatch.exceptions.InvalidScheduleException;

import java.time.Duration;

import java.time.Instant;

/**
 * Schedule - Fixed recurrence of a monitoring job

 * Wire tags (as stored in jobs.schedule and accepted by the API):
 * - manual: never dispatched by the scheduler
 * - 1h, 6h, 12h, 24h, 7d: fixed interval from the last dispatch
 */
public enum Schedule
{
    MANUAL("manual", null),

    HOURLY("1h", Duration.ofHours(1)),

    EVERY_6H("6h", Duration.ofHours(6)),

    EVERY_12H("12h", Duration.ofHours(12)),

    DAILY("24h", Duration.ofHours(24)),

    WEEKLY("7d", Duration.ofDays(7));

    private final String tag;

    private final Duration interval;

    Schedule(String tag, Duration interval)
    {
        this.tag = tag;

        this.interval = interval;
    }

    public String tag()
    {
        return tag;
    }

    public boolean isManual()
    {
        return this == MANUAL;
    }

    /**
     * Recurrence interval of this schedule.
     *
     * @return interval duration
     * @throws IllegalStateException for MANUAL, which has no interval
     */
    public Duration interval()
    {
        if (interval == null)
        {
            throw new IllegalStateException("Manual schedule has no interval");
        }

        return interval;
    }

    /**
     * Next due timestamp counted from the given instant.
     *
     * @param from reference instant (usually now)
     * @return from + interval, or null for manual jobs
     */
    public Instant nextRunAfter(Instant from)
    {
        return isManual() ? null : from.plus(interval);
    }

    /**
     * Resolve a wire tag into a schedule.
     *
     * @param tag schedule tag, e.g. "6h"
     * @return matching schedule
     * @throws InvalidScheduleException if the tag is null or unknown
     */
    public static Schedule fromTag(String tag)
    {
        if (tag != null)
        {
            var trimmed = tag.trim();

            for (var schedule : values())
            {
                if (schedule.tag.equalsIgnoreCase(trimmed))
                {
                    return schedule;
                }
            }
        }

        throw new InvalidScheduleException(tag);
    }

}
