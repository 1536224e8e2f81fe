package com.arpwatch.models;

/**
 * Presence status of a known device (known_devices.status)
 */
public enum DeviceStatus
{
    ACTIVE,

    INACTIVE;

    /**
     * Lower-case value as stored in the database and rendered in JSON.
     */
    public String value()
    {
        return name().toLowerCase();
    }

    public static DeviceStatus fromValue(String value)
    {
        if (value == null)
        {
            throw new IllegalArgumentException("DeviceStatus value cannot be null");
        }

        return valueOf(value.trim().toUpperCase());
    }

}
