package com.arpwatch.utils;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;

import static org.junit.jupiter.api.Assertions.assertFalse;

import static org.junit.jupiter.api.Assertions.assertThrows;

import static org.junit.jupiter.api.Assertions.assertTrue;

class MacAddressUtilTest
{

    @Test
    void acceptsColonAndDashNotation()
    {
        assertTrue(MacAddressUtil.isValid("aa:bb:cc:dd:ee:ff"));

        assertTrue(MacAddressUtil.isValid("AA-BB-CC-DD-EE-FF"));
    }

    @Test
    void rejectsMalformedAddresses()
    {
        assertFalse(MacAddressUtil.isValid(null));

        assertFalse(MacAddressUtil.isValid("aa:bb:cc:dd:ee"));

        assertFalse(MacAddressUtil.isValid("aa:bb:cc:dd:ee:fg"));

        assertFalse(MacAddressUtil.isValid("aabbccddeeff"));
    }

    @Test
    void normalizesToLowerCaseColons()
    {
        assertEquals("00:1a:2b:3c:4d:5e", MacAddressUtil.normalize("00-1A-2B-3C-4D-5E"));

        assertThrows(IllegalArgumentException.class, () -> MacAddressUtil.normalize("zz:zz"));
    }

}
