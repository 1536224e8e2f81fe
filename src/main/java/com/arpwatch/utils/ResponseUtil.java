package com.arpwatch.utils;

import io.vertx.core.json.JsonObject;

import io.vertx.ext.web.RoutingContext;

/**
 * ResponseUtil - Success envelope for the HTTP API
 * { "success": true, "data": ..., "timestamp": millis }
 */
public class ResponseUtil
{

    public static void handleSuccess(RoutingContext context, Object result)
    {
        handleSuccess(context, 200, result);
    }

    /**
     * Send a success envelope with an explicit status code (201 on create, 202 on accepted runs).
     *
     * @param context Routing context
     * @param statusCode HTTP status code
     * @param result Payload placed under "data"
     */
    public static void handleSuccess(RoutingContext context, int statusCode, Object result)
    {
        var successResponse = new JsonObject()
            .put("success", true)
            .put("data", result)
            .put("timestamp", System.currentTimeMillis());

        context.response()
            .setStatusCode(statusCode)
            .putHeader("Content-Type", "application/json")
            .end(successResponse.encode());
    }

}
