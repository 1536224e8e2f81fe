package com.arpwatch.exceptions;

/**
 * Raised when the scan tool exceeds its budget plus grace period and is killed.
 */
public class ScanTimeoutException extends RuntimeException
{

    private final long timeoutSeconds;

    public ScanTimeoutException(long timeoutSeconds)
    {
        super("Scan timed out after " + timeoutSeconds + " seconds");

        this.timeoutSeconds = timeoutSeconds;
    }

    public long getTimeoutSeconds()
    {
        return timeoutSeconds;
    }

}
