package com.arpwatch.utils;

import java.time.Instant;

import java.time.OffsetDateTime;

import java.time.ZoneOffset;

import java.util.UUID;

/**
 * Conversions between model values and pg client bind/row values.
 * TIMESTAMPTZ columns are bound as UTC OffsetDateTime.
 */
public class SqlUtil
{

    public static OffsetDateTime toTimestamp(Instant instant)
    {
        return instant != null ? instant.atOffset(ZoneOffset.UTC) : null;
    }

    public static Instant toInstant(OffsetDateTime timestamp)
    {
        return timestamp != null ? timestamp.toInstant() : null;
    }

    public static UUID toUuid(String id)
    {
        return id != null ? UUID.fromString(id) : null;
    }

}
