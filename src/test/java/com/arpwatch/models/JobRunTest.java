package com.arpwatch.models;

import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.assertEquals;

import static org.junit.jupiter.api.Assertions.assertThrows;

class JobRunTest
{

    @Test
    void closeSetsDurationOnce()
    {
        var run = new JobRun();

        run.startedAt = Instant.parse("2024-01-01T00:00:00Z");

        run.close(RunStatus.COMPLETED, Instant.parse("2024-01-01T00:01:30Z"));

        assertEquals(RunStatus.COMPLETED, run.status);

        assertEquals(90L, run.duration);

        assertThrows(IllegalStateException.class, () -> run.close(RunStatus.FAILED, Instant.parse("2024-01-01T00:02:00Z")));

        assertEquals(RunStatus.COMPLETED, run.status);
    }

}
