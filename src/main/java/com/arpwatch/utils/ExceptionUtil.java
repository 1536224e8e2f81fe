package com.arpwatch.utils;

import com.arpwatch.exceptions.JobAlreadyRunningException;

import com.arpwatch.exceptions.JobNotFoundException;

import io.vertx.core.json.DecodeException;

import io.vertx.core.json.JsonObject;

import io.vertx.ext.web.RoutingContext;

import java.util.NoSuchElementException;

import org.slf4j.Logger;

import org.slf4j.LoggerFactory;

/**
 * ExceptionUtil - Error response formatting for the HTTP API

 * Every error is answered with the same envelope:
 * { "success": false, "error": "...", "timestamp": millis }

 * Status code mapping:
 * - JobNotFoundException, NoSuchElementException: 404
 * - JobAlreadyRunningException: 409
 * - IllegalArgumentException (incl. invalid schedule), DecodeException: 400
 * - anything else: 500
 */
public class ExceptionUtil
{

    private static final Logger logger = LoggerFactory.getLogger(ExceptionUtil.class);

    /**
     * Handle HTTP exceptions with default message
     *
     * @param context Routing context
     * @param cause Exception cause
     */
    public static void handleHttp(RoutingContext context, Throwable cause)
    {
        handleHttp(context, cause, "Operation failed");
    }

    /**
     * Handle HTTP exceptions with custom default message
     *
     * @param context Routing context
     * @param cause Exception cause
     * @param defaultMessage Context prefix for the error message
     */
    public static void handleHttp(RoutingContext context, Throwable cause, String defaultMessage)
    {
        var statusCode = statusCodeFor(cause);

        var message = getMessage(cause, defaultMessage);

        var errorResponse = new JsonObject()
            .put("success", false)
            .put("error", message)
            .put("timestamp", System.currentTimeMillis());

        if (context.response().ended())
        {
            logger.warn("Response already sent, dropping error: {}", message);

            return;
        }

        context.response()
            .setStatusCode(statusCode)
            .putHeader("Content-Type", "application/json")
            .end(errorResponse.encode());

        if (statusCode >= 500)
        {
            logger.error("HTTP Error {}: {}", statusCode, message);
        }
        else
        {
            logger.debug("HTTP Error {}: {}", statusCode, message);
        }
    }

    /**
     * Map an exception to its HTTP status code.
     *
     * @param cause Exception cause
     * @return HTTP status code
     */
    public static int statusCodeFor(Throwable cause)
    {
        if (cause instanceof JobNotFoundException || cause instanceof NoSuchElementException)
        {
            return 404;
        }

        if (cause instanceof JobAlreadyRunningException)
        {
            return 409;
        }

        if (cause instanceof IllegalArgumentException || cause instanceof DecodeException)
        {
            return 400;
        }

        return 500;
    }

    private static String getMessage(Throwable cause, String defaultMessage)
    {
        if (cause == null)
        {
            return defaultMessage;
        }

        var exceptionMessage = cause.getMessage();

        if (exceptionMessage != null && !exceptionMessage.trim().isEmpty())
        {
            return defaultMessage + ": " + exceptionMessage;
        }

        return defaultMessage;
    }

}
