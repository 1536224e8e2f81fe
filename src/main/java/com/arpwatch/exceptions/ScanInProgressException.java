package com.arpwatch.exceptions;

/**
 * Raised when a scanner instance is asked to scan while its previous scan has not finished.
 */
public class ScanInProgressException extends RuntimeException
{

    public ScanInProgressException()
    {
        super("A scan is already in progress on this scanner");
    }

}
