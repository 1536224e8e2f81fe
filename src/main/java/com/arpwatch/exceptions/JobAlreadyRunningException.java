package com.arpwatch.exceptions;

/**
 * Raised when a run is requested for a job that already has an execution in flight.
 */
public class JobAlreadyRunningException extends RuntimeException
{

    private final String jobId;

    public JobAlreadyRunningException(String jobId)
    {
        super("Job " + jobId + " is already running");

        this.jobId = jobId;
    }

    public String getJobId()
    {
        return jobId;
    }

}
