package com.arpwatch.models;

/**
 * Severity of a notification (notifications.type)
 */
public enum NotificationType
{
    INFORMATION,

    WARNING;

    public String value()
    {
        return name().toLowerCase();
    }

    public static NotificationType fromValue(String value)
    {
        if (value == null)
        {
            throw new IllegalArgumentException("NotificationType value cannot be null");
        }

        return valueOf(value.trim().toUpperCase());
    }

}
