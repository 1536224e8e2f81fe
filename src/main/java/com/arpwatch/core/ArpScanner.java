package com.arpwatch.core;

import com.arpwatch.exceptions.ScanInProgressException;

import com.arpwatch.exceptions.ScanProcessException;

import com.arpwatch.exceptions.ScanTimeoutException;

import com.arpwatch.models.DiscoveredDevice;

import com.arpwatch.utils.MacAddressUtil;

import com.arpwatch.utils.SubnetUtil;

import io.vertx.core.json.JsonObject;

import org.slf4j.Logger;

import org.slf4j.LoggerFactory;

import java.io.IOException;

import java.io.InputStream;

import java.nio.charset.StandardCharsets;

import java.time.Clock;

import java.util.ArrayList;

import java.util.List;

import java.util.concurrent.TimeUnit;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * ArpScanner - Runs arp-scan for one interface/subnet and parses its output

 * Command line:
 *   arp-scan -I <interface> --format '${ip}\t${mac}' --plain --quiet <subnet>

 * Process handling:
 * - stdout and stderr are drained on two threads owned by the scan, so a chatty tool cannot block on a full pipe
 * - once the tool has exited, output that cannot be fully read within the grace period fails the scan
 * - the process gets budget + grace seconds, then is killed (destroyForcibly) and the scan fails
 * - a non-zero exit fails the scan with the exit code and stderr text
 * - the process is destroyed on every exit path if it is still alive

 * Output parsing:
 * - one device per line: ip TAB mac [TAB vendor]
 * - strict dotted-quad IPv4 and 6-octet MAC (':' or '-' separated)
 * - malformed lines are logged at WARN and skipped
 * - MACs are returned normalized (lower-case, colon-separated)

 * Instances are single-flight; JobRunner creates a fresh instance per run.
 */
public class ArpScanner implements NetworkScanner
{

    private static final Logger logger = LoggerFactory.getLogger(ArpScanner.class);

    public static final int DEFAULT_GRACE_SECONDS = 10;

    private static final String OUTPUT_FORMAT = "${ip}\t${mac}";

    private static final int AVAILABILITY_TIMEOUT_SECONDS = 5;

    private final String arpScanPath;

    private final int graceSeconds;

    private final Clock clock;

    private final AtomicBoolean scanning = new AtomicBoolean(false);

    public ArpScanner(String arpScanPath, int graceSeconds, Clock clock)
    {
        this.arpScanPath = arpScanPath;

        this.graceSeconds = graceSeconds;

        this.clock = clock;
    }

    public ArpScanner(String arpScanPath, int graceSeconds)
    {
        this(arpScanPath, graceSeconds, Clock.systemUTC());
    }

    /**
     * Build a scanner from application config.

     * HOCON parses dotted keys as nested objects:
     * - tools.arpscan.path (default "arp-scan")
     * - scanner.grace.seconds (default 10)
     *
     * @param config application configuration
     * @return new scanner instance
     */
    public static ArpScanner fromConfig(JsonObject config)
    {
        var arpScanPath = config.getJsonObject("tools", new JsonObject())
                .getJsonObject("arpscan", new JsonObject())
                .getString("path", "arp-scan");

        var graceSeconds = config.getJsonObject("scanner", new JsonObject())
                .getJsonObject("grace", new JsonObject())
                .getInteger("seconds", DEFAULT_GRACE_SECONDS);

        return new ArpScanner(arpScanPath, graceSeconds);
    }

    @Override
    public List<DiscoveredDevice> scan(String interfaceName, String subnet, int budgetSeconds)
    {
        if (!scanning.compareAndSet(false, true))
        {
            throw new ScanInProgressException();
        }

        Process process = null;

        try
        {
            var deadlineSeconds = (long) budgetSeconds + graceSeconds;

            var command = List.of(arpScanPath, "-I", interfaceName, "--format", OUTPUT_FORMAT, "--plain", "--quiet", subnet);

            logger.debug("Starting arp-scan on {} {} (deadline {}s)", interfaceName, subnet, deadlineSeconds);

            try
            {
                process = new ProcessBuilder(command).start();
            }
            catch (IOException exception)
            {
                throw new ScanProcessException("Failed to start " + arpScanPath, exception);
            }

            var stdout = new OutputCollector(process.getInputStream(), "arp-scan-stdout");

            var stderr = new OutputCollector(process.getErrorStream(), "arp-scan-stderr");

            var finished = process.waitFor(deadlineSeconds, TimeUnit.SECONDS);

            if (!finished)
            {
                process.destroyForcibly();

                logger.warn("arp-scan on {} {} timed out after {} seconds", interfaceName, subnet, deadlineSeconds);

                throw new ScanTimeoutException(deadlineSeconds);
            }

            var exitCode = process.exitValue();

            var drainSeconds = Math.max(graceSeconds, 1);

            var errorText = stderr.await(drainSeconds);

            if (exitCode != 0)
            {
                throw new ScanProcessException(exitCode, errorText);
            }

            var devices = parseOutput(stdout.await(drainSeconds));

            logger.debug("arp-scan on {} {} found {} devices", interfaceName, subnet, devices.size());

            return devices;
        }
        catch (InterruptedException exception)
        {
            Thread.currentThread().interrupt();

            throw new ScanProcessException("Interrupted while waiting for arp-scan", exception);
        }
        finally
        {
            if (process != null && process.isAlive())
            {
                process.destroyForcibly();
            }

            scanning.set(false);
        }
    }

    /**
     * Parse arp-scan output into devices. Lines failing validation are skipped.
     *
     * @param output raw stdout
     * @return devices in output order
     */
    public List<DiscoveredDevice> parseOutput(String output)
    {
        var devices = new ArrayList<DiscoveredDevice>();

        if (output == null || output.isEmpty())
        {
            return devices;
        }

        var now = clock.instant();

        var skipped = 0;

        for (var rawLine : output.split("\\r?\n"))
        {
            var line = rawLine.trim();

            if (line.isEmpty())
            {
                continue;
            }

            var fields = line.split("\t");

            if (fields.length < 2)
            {
                logger.warn("Skipping malformed arp-scan line: {}", line);

                skipped++;

                continue;
            }

            var ip = fields[0].trim();

            var mac = fields[1].trim();

            if (!SubnetUtil.isValidIPv4(ip) || !MacAddressUtil.isValid(mac))
            {
                logger.warn("Skipping invalid arp-scan entry: ip={} mac={}", ip, mac);

                skipped++;

                continue;
            }

            String vendor = null;

            if (fields.length > 2 && !fields[2].isBlank())
            {
                vendor = fields[2].trim();
            }

            devices.add(new DiscoveredDevice(ip, MacAddressUtil.normalize(mac), vendor, now));
        }

        if (skipped > 0)
        {
            logger.warn("Skipped {} malformed arp-scan lines", skipped);
        }

        return devices;
    }

    @Override
    public boolean isAvailable()
    {
        return version() != null;
    }

    @Override
    public String version()
    {
        Process process = null;

        try
        {
            process = new ProcessBuilder(arpScanPath, "--version").redirectErrorStream(true).start();

            var output = new OutputCollector(process.getInputStream(), "arp-scan-version");

            if (!process.waitFor(AVAILABILITY_TIMEOUT_SECONDS, TimeUnit.SECONDS))
            {
                logger.warn("{} --version did not finish within {} seconds", arpScanPath, AVAILABILITY_TIMEOUT_SECONDS);

                return null;
            }

            var text = output.await(AVAILABILITY_TIMEOUT_SECONDS).trim();

            if (text.isEmpty())
            {
                return null;
            }

            // arp-scan prints the version on the first line
            return text.split("\\r?\n")[0].trim();
        }
        catch (IOException | ScanProcessException exception)
        {
            logger.warn("{} is not available: {}", arpScanPath, exception.getMessage());

            return null;
        }
        catch (InterruptedException exception)
        {
            Thread.currentThread().interrupt();

            return null;
        }
        finally
        {
            if (process != null && process.isAlive())
            {
                process.destroyForcibly();
            }
        }
    }

    /**
     * Reads one process stream to the end on its own daemon thread.
     */
    private static final class OutputCollector
    {

        private final Thread reader;

        private volatile String text = "";

        private volatile IOException failure;

        OutputCollector(InputStream stream, String name)
        {
            reader = new Thread(() ->
            {
                try (stream)
                {
                    text = new String(stream.readAllBytes(), StandardCharsets.UTF_8);
                }
                catch (IOException exception)
                {
                    failure = exception;
                }
            }, name);

            reader.setDaemon(true);

            reader.start();
        }

        /**
         * Wait for the stream to reach end of file. Only called after the process has exited.
         *
         * @param timeoutSeconds how long to wait for the remaining output
         * @return everything the process wrote to the stream
         * @throws ScanProcessException when the stream could not be read completely
         */
        String await(long timeoutSeconds) throws InterruptedException
        {
            reader.join(TimeUnit.SECONDS.toMillis(timeoutSeconds));

            if (reader.isAlive())
            {
                reader.interrupt();

                throw new ScanProcessException("arp-scan output was not fully read within " + timeoutSeconds + " seconds after exit", null);
            }

            if (failure != null)
            {
                throw new ScanProcessException("Failed to read arp-scan output", failure);
            }

            return text;
        }

    }

}
