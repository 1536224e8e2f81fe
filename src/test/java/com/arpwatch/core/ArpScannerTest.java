package com.arpwatch.core;

import com.arpwatch.exceptions.ScanInProgressException;

import com.arpwatch.exceptions.ScanProcessException;

import com.arpwatch.exceptions.ScanTimeoutException;

import io.vertx.core.json.JsonObject;

import org.junit.jupiter.api.Test;

import org.junit.jupiter.api.condition.EnabledOnOs;

import org.junit.jupiter.api.condition.OS;

import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;

import java.nio.charset.StandardCharsets;

import java.nio.file.Files;

import java.nio.file.Path;

import java.time.Clock;

import java.time.Instant;

import java.time.ZoneOffset;

import java.util.ArrayList;

import java.util.concurrent.CompletableFuture;

import java.util.concurrent.CountDownLatch;

import java.util.concurrent.ForkJoinPool;

import java.util.concurrent.Future;

import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;

import static org.junit.jupiter.api.Assertions.assertNull;

import static org.junit.jupiter.api.Assertions.assertThrows;

import static org.junit.jupiter.api.Assertions.assertTrue;

class ArpScannerTest
{

    private static final Instant NOW = Instant.parse("2024-02-02T02:02:02Z");

    @TempDir
    Path tempDir;

    private final ArpScanner parser = new ArpScanner("arp-scan", 10, Clock.fixed(NOW, ZoneOffset.UTC));

    @Test
    void parsesTabSeparatedLines()
    {
        var devices = parser.parseOutput("192.168.1.1\tAA:BB:CC:DD:EE:FF\n192.168.1.7\t00-11-22-33-44-55\tAcme Corp\n");

        assertEquals(2, devices.size());

        assertEquals("192.168.1.1", devices.get(0).ip());

        assertEquals("aa:bb:cc:dd:ee:ff", devices.get(0).mac());

        assertNull(devices.get(0).vendor());

        assertEquals("00:11:22:33:44:55", devices.get(1).mac());

        assertEquals("Acme Corp", devices.get(1).vendor());

        assertEquals(NOW, devices.get(1).detectedAt());
    }

    @Test
    void skipsMalformedLines()
    {
        var output = String.join("\n",
            "",
            "Interface: eth0, type: EN10MB",
            "999.1.1.1\taa:bb:cc:dd:ee:ff",
            "192.168.1.3\tnot-a-mac",
            "192.168.1.4 aa:bb:cc:dd:ee:04",
            "192.168.1.5\taa:bb:cc:dd:ee:05",
            "   ");

        var devices = parser.parseOutput(output);

        assertEquals(1, devices.size());

        assertEquals("192.168.1.5", devices.get(0).ip());
    }

    @Test
    void emptyOutputYieldsNoDevices()
    {
        assertTrue(parser.parseOutput("").isEmpty());

        assertTrue(parser.parseOutput(null).isEmpty());
    }

    @Test
    void readsToolSettingsFromNestedConfig()
    {
        var config = new JsonObject()
            .put("tools", new JsonObject().put("arpscan", new JsonObject().put("path", "/nonexistent/arp-scan")))
            .put("scanner", new JsonObject().put("grace", new JsonObject().put("seconds", 3)));

        var scanner = ArpScanner.fromConfig(config);

        var failure = assertThrows(ScanProcessException.class, () -> scanner.scan("eth0", "10.0.0.0/24", 1));

        assertEquals(-1, failure.getExitCode());
    }

    @Test
    @EnabledOnOs({OS.LINUX, OS.MAC})
    void runsToolWithExpectedArguments() throws IOException
    {
        var argsFile = tempDir.resolve("args.txt");

        var tool = script("fake-arp-scan",
            "printf '%s\\n' \"$@\" > '" + argsFile + "'",
            "printf '10.0.0.1\\tAA:BB:CC:00:00:01\\n'",
            "printf 'garbage\\n'",
            "printf '10.0.0.2\\taa:bb:cc:00:00:02\\n'");

        var devices = new ArpScanner(tool.toString(), 5).scan("eth1", "10.0.0.0/24", 2);

        assertEquals(2, devices.size());

        assertEquals("aa:bb:cc:00:00:01", devices.get(0).mac());

        var args = Files.readAllLines(argsFile, StandardCharsets.UTF_8);

        assertEquals("-I", args.get(0));

        assertEquals("eth1", args.get(1));

        assertEquals("--format", args.get(2));

        assertEquals("${ip}\t${mac}", args.get(3));

        assertTrue(args.contains("--plain"));

        assertTrue(args.contains("--quiet"));

        assertEquals("10.0.0.0/24", args.get(args.size() - 1));
    }

    @Test
    @EnabledOnOs({OS.LINUX, OS.MAC})
    void nonZeroExitCarriesCodeAndStderr() throws IOException
    {
        var tool = script("failing-arp-scan",
            "echo 'pcap_open_live: permission denied' >&2",
            "exit 2");

        var failure = assertThrows(ScanProcessException.class,
            () -> new ArpScanner(tool.toString(), 5).scan("eth0", "10.0.0.0/24", 2));

        assertEquals(2, failure.getExitCode());

        assertTrue(failure.getStderr().contains("permission denied"));
    }

    @Test
    @EnabledOnOs({OS.LINUX, OS.MAC})
    void killsToolAfterBudgetPlusGrace() throws IOException
    {
        var tool = script("hanging-arp-scan", "exec sleep 30");

        var scanner = new ArpScanner(tool.toString(), 1);

        var started = System.nanoTime();

        var failure = assertThrows(ScanTimeoutException.class, () -> scanner.scan("eth0", "10.0.0.0/24", 0));

        assertEquals(1, failure.getTimeoutSeconds());

        assertTrue(TimeUnit.NANOSECONDS.toSeconds(System.nanoTime() - started) < 10);
    }

    @Test
    @EnabledOnOs({OS.LINUX, OS.MAC})
    void refusesSecondConcurrentScan() throws Exception
    {
        var marker = tempDir.resolve("started");

        var tool = script("slow-arp-scan",
            "touch '" + marker + "'",
            "sleep 2",
            "printf '10.0.0.9\\taa:bb:cc:00:00:09\\n'");

        var scanner = new ArpScanner(tool.toString(), 5);

        var first = CompletableFuture.supplyAsync(() -> scanner.scan("eth0", "10.0.0.0/24", 5));

        var deadline = System.currentTimeMillis() + 5000;

        while (!Files.exists(marker) && System.currentTimeMillis() < deadline)
        {
            Thread.sleep(20);
        }

        assertThrows(ScanInProgressException.class, () -> scanner.scan("eth0", "10.0.0.0/24", 5));

        assertEquals(1, first.get(10, TimeUnit.SECONDS).size());

        // Released once the first scan finished
        assertEquals(1, scanner.scan("eth0", "10.0.0.0/24", 5).size());
    }

    @Test
    @EnabledOnOs({OS.LINUX, OS.MAC})
    void collectsOutputWhileCommonPoolIsSaturated() throws Exception
    {
        var tool = script("busy-pool-arp-scan",
            "printf '10.0.0.1\\taa:bb:cc:00:00:01\\n'",
            "printf '10.0.0.2\\taa:bb:cc:00:00:02\\n'");

        var pool = ForkJoinPool.commonPool();

        var release = new CountDownLatch(1);

        var blockers = new ArrayList<Future<?>>();

        try
        {
            for (var i = 0; i < pool.getParallelism() + 2; i++)
            {
                blockers.add(pool.submit(() ->
                {
                    release.await();

                    return null;
                }));
            }

            var started = System.nanoTime();

            var devices = new ArpScanner(tool.toString(), 5).scan("eth0", "10.0.0.0/24", 2);

            assertEquals(2, devices.size());

            assertTrue(TimeUnit.NANOSECONDS.toSeconds(System.nanoTime() - started) < 4);
        }
        finally
        {
            release.countDown();

            for (var blocker : blockers)
            {
                blocker.get(5, TimeUnit.SECONDS);
            }
        }
    }

    @Test
    @EnabledOnOs({OS.LINUX, OS.MAC})
    void reportsVersionLine() throws IOException
    {
        var tool = script("versioned-arp-scan",
            "echo 'arp-scan 1.10.0'",
            "echo 'Copyright (C) 2005-2023 Roy Hills'");

        var scanner = new ArpScanner(tool.toString(), 5);

        assertEquals("arp-scan 1.10.0", scanner.version());

        assertTrue(scanner.isAvailable());

        assertNull(new ArpScanner(tempDir.resolve("missing").toString(), 5).version());
    }

    private Path script(String name, String... lines) throws IOException
    {
        var path = tempDir.resolve(name);

        Files.writeString(path, "#!/bin/sh\n" + String.join("\n", lines) + "\n", StandardCharsets.UTF_8);

        assertTrue(path.toFile().setExecutable(true));

        return path;
    }

}
