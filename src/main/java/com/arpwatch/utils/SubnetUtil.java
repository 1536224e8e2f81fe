package com.arpwatch.utils;

import java.util.regex.Pattern;

/**
 * SubnetUtil - IPv4 address and CIDR validation

 * Supports:
 * - Single IPv4 addresses: "192.168.1.100"
 * - IPv4 CIDR blocks: "192.168.1.0/24" (prefix 0-32)
 */
public class SubnetUtil
{

    private static final Pattern SINGLE_IP_PATTERN = Pattern.compile(
        "^((25[0-5]|2[0-4][0-9]|[01]?[0-9][0-9]?)\\.){3}(25[0-5]|2[0-4][0-9]|[01]?[0-9][0-9]?)$"
    );

    /**
     * Validate if a string is a dotted-quad IPv4 address
     *
     * @param ip The IP address string to validate
     * @return true if valid, false otherwise
     */
    public static boolean isValidIPv4(String ip)
    {
        if (ip == null || ip.trim().isEmpty())
        {
            return false;
        }

        return SINGLE_IP_PATTERN.matcher(ip.trim()).matches();
    }

    /**
     * Validate an IPv4 CIDR block such as "10.0.0.0/8"
     *
     * @param subnet subnet string
     * @return true if the address part is valid IPv4 and the prefix is 0-32
     */
    public static boolean isValidCidr(String subnet)
    {
        if (subnet == null || subnet.trim().isEmpty())
        {
            return false;
        }

        var parts = subnet.trim().split("/");

        if (parts.length != 2 || !isValidIPv4(parts[0]))
        {
            return false;
        }

        try
        {
            var prefix = Integer.parseInt(parts[1]);

            return prefix >= 0 && prefix <= 32;
        }
        catch (NumberFormatException exception)
        {
            return false;
        }
    }

}
