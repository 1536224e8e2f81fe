package com.arpwatch.models;

/**
 * Outcome of a job run (job_runs.status)
 */
public enum RunStatus
{
    RUNNING,

    COMPLETED,

    FAILED;

    /**
     * Lower-case value as stored in the database and rendered in JSON.
     */
    public String value()
    {
        return name().toLowerCase();
    }

    /**
     * A run is closed once it reached COMPLETED or FAILED; it is never reopened.
     */
    public boolean isTerminal()
    {
        return this != RUNNING;
    }

    public static RunStatus fromValue(String value)
    {
        if (value == null)
        {
            throw new IllegalArgumentException("RunStatus value cannot be null");
        }

        return valueOf(value.trim().toUpperCase());
    }

}
