package com.arpwatch.models;

/**
 * Lifecycle status of a job (jobs.status).

 * A job is RUNNING only while an execution is in flight and always returns to ACTIVE,
 * whether the run completed or failed.
 */
public enum JobStatus
{
    ACTIVE,

    RUNNING;

    /**
     * Lower-case value as stored in the database and rendered in JSON.
     */
    public String value()
    {
        return name().toLowerCase();
    }

    public static JobStatus fromValue(String value)
    {
        if (value == null)
        {
            throw new IllegalArgumentException("JobStatus value cannot be null");
        }

        return valueOf(value.trim().toUpperCase());
    }

}
