package com.arpwatch.exceptions;

/**
 * Raised when the scan tool cannot be started or exits with a non-zero code.

 * exitCode is -1 when the process could not be started at all.
 */
public class ScanProcessException extends RuntimeException
{

    private final int exitCode;

    private final String stderr;

    public ScanProcessException(int exitCode, String stderr)
    {
        super("arp-scan exited with code " + exitCode + (stderr != null && !stderr.isBlank() ? ": " + stderr.trim() : ""));

        this.exitCode = exitCode;

        this.stderr = stderr;
    }

    public ScanProcessException(String message, Throwable cause)
    {
        super(message, cause);

        this.exitCode = -1;

        this.stderr = cause != null ? cause.getMessage() : null;
    }

    public int getExitCode()
    {
        return exitCode;
    }

    public String getStderr()
    {
        return stderr;
    }

}
