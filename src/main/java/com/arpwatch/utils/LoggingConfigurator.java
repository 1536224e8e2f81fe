package com.arpwatch.utils;

import ch.qos.logback.classic.Level;

import ch.qos.logback.classic.Logger;

import ch.qos.logback.classic.LoggerContext;

import ch.qos.logback.classic.joran.JoranConfigurator;

import ch.qos.logback.core.joran.spi.JoranException;

import io.vertx.core.json.JsonObject;

import java.io.File;

import org.slf4j.LoggerFactory;

/**
 * LoggingConfigurator - Applies the logging section of application.conf

 * logging {
 *   enabled = true
 *   level = "INFO"
 *   file.path = "logs/arpwatch.log"
 *   file.enabled = true
 *   console.enabled = true
 * }

 * Values are exported as system properties read by logback.xml
 * (arpwatch.log.level, arpwatch.log.file.path, arpwatch.log.console.appender,
 * arpwatch.log.file.appender). Logback has already parsed logback.xml by the time
 * the config is loaded, so the context is reset and logback.xml is parsed again
 * with the new properties.
 */
public class LoggingConfigurator
{

    public static final String APPLICATION_LOGGER = "com.arpwatch";

    static final String CONFIGURATION_RESOURCE = "logback.xml";

    /**
     * Configure logging based on application configuration
     *
     * @param config Application configuration JsonObject
     */
    public static void configure(JsonObject config)
    {
        var loggingConfig = config.getJsonObject("logging", new JsonObject());

        var loggingEnabled = loggingConfig.getBoolean("enabled", true);

        var logLevel = loggingConfig.getString("level", "INFO");

        // HOCON parses dotted keys as nested objects: file.path becomes file -> path
        var fileConfig = loggingConfig.getJsonObject("file", new JsonObject());

        var fileEnabled = fileConfig.getBoolean("enabled", true);

        var filePath = fileConfig.getString("path", "logs/arpwatch.log");

        var consoleEnabled = loggingConfig.getJsonObject("console", new JsonObject()).getBoolean("enabled", true);

        System.setProperty("arpwatch.log.level", loggingEnabled ? logLevel : "OFF");

        System.setProperty("arpwatch.log.file.path", filePath);

        System.setProperty("arpwatch.log.console.appender", consoleEnabled ? "CONSOLE" : "NULL");

        System.setProperty("arpwatch.log.file.appender", fileEnabled ? "FILE" : "NULL");

        if (fileEnabled && loggingEnabled)
        {
            var logDir = new File(filePath).getParentFile();

            if (logDir != null && !logDir.exists() && !logDir.mkdirs())
            {
                LoggerFactory.getLogger(LoggingConfigurator.class).warn("Could not create log directory {}", logDir);
            }
        }

        var loggerContext = reload(CONFIGURATION_RESOURCE);

        var level = loggingEnabled ? Level.toLevel(logLevel, Level.INFO) : Level.OFF;

        loggerContext.getLogger(Logger.ROOT_LOGGER_NAME).setLevel(level);

        loggerContext.getLogger(APPLICATION_LOGGER).setLevel(level);

        if (loggingEnabled)
        {
            var logger = LoggerFactory.getLogger(LoggingConfigurator.class);

            logger.info("=".repeat(60));

            logger.info("ArpWatch Logging Configuration");

            logger.info("=".repeat(60));

            logger.info("Log Level: {}", logLevel);

            logger.info("Console Logging: {}", consoleEnabled);

            logger.info("File Logging: {}", fileEnabled);

            if (fileEnabled)
            {
                logger.info("Log File Path: {}", filePath);
            }

            logger.info("=".repeat(60));
        }
    }

    /**
     * Reset the logback context and configure it from a classpath resource.
     *
     * @param resource logback configuration file on the classpath
     * @return the reconfigured context
     * @throws IllegalStateException when the resource is missing or cannot be parsed
     */
    static LoggerContext reload(String resource)
    {
        var loggerContext = (LoggerContext) LoggerFactory.getILoggerFactory();

        var url = LoggingConfigurator.class.getClassLoader().getResource(resource);

        if (url == null)
        {
            throw new IllegalStateException("Logging configuration not found on classpath: " + resource);
        }

        loggerContext.reset();

        var configurator = new JoranConfigurator();

        configurator.setContext(loggerContext);

        try
        {
            configurator.doConfigure(url);
        }
        catch (JoranException exception)
        {
            throw new IllegalStateException("Failed to apply logging configuration " + resource, exception);
        }

        return loggerContext;
    }

}
