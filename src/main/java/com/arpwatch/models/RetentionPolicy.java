package com.arpwatch.models;

import java.time.Duration;

import java.time.Instant;

import java.util.Objects;

/**
 * RetentionPolicy - How long inactive known devices are kept

 * Textual forms:
 * - "forever": inactive devices are never removed
 * - "immediate": inactive devices are removed at the end of the run that saw them leave
 * - "days:N": inactive devices whose last sighting is older than N days are removed

 * Active devices are never subject to retention.
 */
public final class RetentionPolicy
{

    public enum Kind
    {
        FOREVER,

        DAYS,

        IMMEDIATE
    }

    public static final int DEFAULT_DAYS = 30;

    public static final RetentionPolicy FOREVER = new RetentionPolicy(Kind.FOREVER, 0);

    public static final RetentionPolicy IMMEDIATE = new RetentionPolicy(Kind.IMMEDIATE, 0);

    private final Kind kind;

    private final int days;

    private RetentionPolicy(Kind kind, int days)
    {
        this.kind = kind;

        this.days = days;
    }

    public static RetentionPolicy days(int days)
    {
        if (days < 1)
        {
            throw new IllegalArgumentException("Retention days must be at least 1, got " + days);
        }

        return new RetentionPolicy(Kind.DAYS, days);
    }

    public static RetentionPolicy defaultPolicy()
    {
        return days(DEFAULT_DAYS);
    }

    /**
     * Parse the textual form ("forever", "immediate", "days:N").
     *
     * @param value policy text
     * @return parsed policy
     * @throws IllegalArgumentException on unknown or malformed input
     */
    public static RetentionPolicy parse(String value)
    {
        if (value == null || value.isBlank())
        {
            throw new IllegalArgumentException("Retention policy cannot be empty");
        }

        var normalized = value.trim().toLowerCase();

        if (normalized.equals("forever"))
        {
            return FOREVER;
        }

        if (normalized.equals("immediate"))
        {
            return IMMEDIATE;
        }

        if (normalized.startsWith("days:"))
        {
            try
            {
                return days(Integer.parseInt(normalized.substring("days:".length()).trim()));
            }
            catch (NumberFormatException exception)
            {
                throw new IllegalArgumentException("Invalid retention days in: " + value, exception);
            }
        }

        throw new IllegalArgumentException("Unknown retention policy: " + value);
    }

    /**
     * Rebuild a policy from its database columns (jobs.retention_policy, jobs.retention_days).
     *
     * @param policy "forever", "immediate" or "days"
     * @param days retention days, used for "days" only
     * @return policy
     */
    public static RetentionPolicy fromColumns(String policy, Integer days)
    {
        if ("days".equalsIgnoreCase(policy))
        {
            return days(days != null ? days : DEFAULT_DAYS);
        }

        return parse(policy);
    }

    public Kind kind()
    {
        return kind;
    }

    public int retentionDays()
    {
        return days;
    }

    /**
     * Column value for jobs.retention_policy.
     */
    public String policyColumn()
    {
        return kind.name().toLowerCase();
    }

    /**
     * Decide whether a device is removed by this policy at the given run timestamp.
     *
     * @param status device status after reconciliation
     * @param lastSeen last sighting of the device
     * @param runAt timestamp of the run applying the policy
     * @return true if the device must be deleted
     */
    public boolean shouldDelete(DeviceStatus status, Instant lastSeen, Instant runAt)
    {
        if (status != DeviceStatus.INACTIVE)
        {
            return false;
        }

        switch (kind)
        {
            case IMMEDIATE:
                return true;

            case DAYS:
                return lastSeen != null && lastSeen.isBefore(cutoff(runAt));

            default:
                return false;
        }
    }

    /**
     * Oldest last-seen timestamp kept under a DAYS policy.
     *
     * @param runAt run timestamp
     * @return runAt minus the retention window
     */
    public Instant cutoff(Instant runAt)
    {
        return runAt.minus(Duration.ofDays(days));
    }

    @Override
    public String toString()
    {
        return kind == Kind.DAYS ? "days:" + days : policyColumn();
    }

    @Override
    public boolean equals(Object other)
    {
        if (this == other)
        {
            return true;
        }

        if (!(other instanceof RetentionPolicy))
        {
            return false;
        }

        var that = (RetentionPolicy) other;

        return kind == that.kind && days == that.days;
    }

    @Override
    public int hashCode()
    {
        return Objects.hash(kind, days);
    }

}
