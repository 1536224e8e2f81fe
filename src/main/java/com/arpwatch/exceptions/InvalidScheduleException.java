package com.arpwatch.exceptions;

public class InvalidScheduleException extends IllegalArgumentException
{

    public InvalidScheduleException(String tag)
    {
        super("Invalid schedule: " + tag + " (expected one of manual, 1h, 6h, 12h, 24h, 7d)");
    }

}
