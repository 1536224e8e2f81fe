package com.arpwatch.utils;

import java.util.regex.Pattern;

/**
 * MacAddressUtil - Validation and normalization of hardware addresses

 * Accepts six hex octets separated by ':' or '-', in any letter case.
 * The normalized form is lower-case and colon-separated (aa:bb:cc:dd:ee:ff), which is
 * how MACs are stored, compared and rendered everywhere in the application.
 */
public class MacAddressUtil
{

    private static final Pattern MAC_PATTERN = Pattern.compile(
        "^([0-9a-fA-F]{2}[:-]){5}[0-9a-fA-F]{2}$"
    );

    public static boolean isValid(String macAddress)
    {
        return macAddress != null && MAC_PATTERN.matcher(macAddress.trim()).matches();
    }

    /**
     * Normalize a MAC address to lower-case colon form.
     *
     * @param macAddress MAC in any accepted notation
     * @return normalized MAC
     * @throws IllegalArgumentException if the value is not a MAC address
     */
    public static String normalize(String macAddress)
    {
        if (!isValid(macAddress))
        {
            throw new IllegalArgumentException("Invalid MAC address: " + macAddress);
        }

        return macAddress.trim().toLowerCase().replace('-', ':');
    }

}
