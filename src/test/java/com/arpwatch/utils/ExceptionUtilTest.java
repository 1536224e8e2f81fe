package com.arpwatch.utils;

import com.arpwatch.exceptions.InvalidScheduleException;

import com.arpwatch.exceptions.JobAlreadyRunningException;

import com.arpwatch.exceptions.JobNotFoundException;

import com.arpwatch.exceptions.ScanTimeoutException;

import io.vertx.core.json.DecodeException;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;

class ExceptionUtilTest
{

    @Test
    void mapsDomainErrorsToStatusCodes()
    {
        assertEquals(404, ExceptionUtil.statusCodeFor(new JobNotFoundException("j1")));

        assertEquals(409, ExceptionUtil.statusCodeFor(new JobAlreadyRunningException("j1")));

        assertEquals(400, ExceptionUtil.statusCodeFor(new InvalidScheduleException("2h")));

        assertEquals(400, ExceptionUtil.statusCodeFor(new DecodeException("bad json")));

        assertEquals(500, ExceptionUtil.statusCodeFor(new ScanTimeoutException(10)));
    }

}
