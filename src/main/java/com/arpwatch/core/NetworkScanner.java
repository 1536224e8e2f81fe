package com.arpwatch.core;

import com.arpwatch.models.DiscoveredDevice;

import java.util.List;

/**
 * Discovers reachable hosts on one interface/subnet pair.

 * Implementations are single-flight: an instance refuses a second scan while one is in
 * progress. Callers needing parallel scans create one instance per scan.

 * WARNING: scan() is BLOCKING and must be called from within executeBlocking() or a worker executor.
 */
public interface NetworkScanner
{

    /**
     * Scan a subnet through an interface.
     *
     * @param interfaceName network interface, e.g. "eth0"
     * @param subnet IPv4 CIDR block, e.g. "192.168.1.0/24"
     * @param budgetSeconds scan duration budget; a fixed grace period is added on top
     * @return validated devices, possibly empty
     * @throws com.arpwatch.exceptions.ScanInProgressException if this instance is already scanning
     * @throws com.arpwatch.exceptions.ScanTimeoutException if the deadline expires
     * @throws com.arpwatch.exceptions.ScanProcessException if the tool fails or cannot be started
     */
    List<DiscoveredDevice> scan(String interfaceName, String subnet, int budgetSeconds);

    /**
     * Whether the underlying tool can be invoked on this host.
     */
    boolean isAvailable();

    /**
     * Version line reported by the underlying tool, or null if unavailable.
     */
    String version();

}
