package com.arpwatch.exceptions;

public class JobNotFoundException extends RuntimeException
{

    private final String jobId;

    public JobNotFoundException(String jobId)
    {
        super("Job not found or not active: " + jobId);

        this.jobId = jobId;
    }

    public String getJobId()
    {
        return jobId;
    }

}
