package com.arpwatch.utils;

import io.vertx.core.json.JsonObject;

import org.junit.jupiter.api.AfterEach;

import org.junit.jupiter.api.Test;

import org.junit.jupiter.api.io.TempDir;

import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;

import java.nio.file.Files;

import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.assertFalse;

import static org.junit.jupiter.api.Assertions.assertTrue;

class LoggingConfiguratorTest
{

    @TempDir
    Path tempDir;

    @AfterEach
    void restoreTestLogging()
    {
        System.clearProperty("arpwatch.log.level");

        System.clearProperty("arpwatch.log.file.path");

        System.clearProperty("arpwatch.log.console.appender");

        System.clearProperty("arpwatch.log.file.appender");

        LoggingConfigurator.reload("logback-test.xml");
    }

    @Test
    void fileSettingsTakeEffectAfterLogbackStarted() throws Exception
    {
        // Logback is already initialized by the time the config is applied
        LoggerFactory.getLogger(LoggingConfiguratorTest.class).info("logging started before configure");

        var logFile = tempDir.resolve("logs").resolve("arpwatch.log");

        LoggingConfigurator.configure(logging(true, logFile, false, "DEBUG"));

        LoggerFactory.getLogger("com.arpwatch.scan").debug("written to the configured file");

        assertTrue(Files.exists(logFile));

        assertTrue(Files.readString(logFile, StandardCharsets.UTF_8).contains("written to the configured file"));
    }

    @Test
    void disabledFileOutputCreatesNoFile()
    {
        var logFile = tempDir.resolve("off").resolve("arpwatch.log");

        LoggingConfigurator.configure(logging(false, logFile, true, "INFO"));

        LoggerFactory.getLogger("com.arpwatch.scan").info("console only");

        assertFalse(Files.exists(logFile));
    }

    private static JsonObject logging(boolean fileEnabled, Path filePath, boolean consoleEnabled, String level)
    {
        return new JsonObject().put("logging", new JsonObject()
            .put("enabled", true)
            .put("level", level)
            .put("file", new JsonObject().put("enabled", fileEnabled).put("path", filePath.toString()))
            .put("console", new JsonObject().put("enabled", consoleEnabled)));
    }

}
