package com.arpwatch;

import io.vertx.core.json.JsonObject;

/**
 * Bootstrap - Process-wide access to the loaded configuration.
 * Set once by ArpWatchApplication during startup.
 */
public final class Bootstrap
{

    private static volatile JsonObject config = new JsonObject();

    private Bootstrap()
    {
    }

    static void initialize(JsonObject applicationConfig)
    {
        config = applicationConfig;
    }

    public static JsonObject getConfig()
    {
        return config;
    }

}
