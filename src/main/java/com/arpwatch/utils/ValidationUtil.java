package com.arpwatch.utils;

import com.arpwatch.models.Schedule;

import com.arpwatch.models.RetentionPolicy;

import io.vertx.core.json.JsonArray;

import io.vertx.core.json.JsonObject;

import io.vertx.ext.web.RoutingContext;

import java.util.UUID;

/**
 * ValidationUtil - Request validation for the HTTP API

 * Common validations live on the outer class; job payload rules are grouped in the
 * nested Job class.

 * All methods return true if validation passes, false if validation fails
 * (with HTTP 400 response already sent to client)
 */
public class ValidationUtil
{

    public static final int MAX_EXECUTION_TIME = 3600;

    /**
     * Validate required fields in request JSON
     *
     * @param context Routing context
     * @param json Request JSON
     * @param requiredFields Array of required field names
     * @return true if all fields present, false otherwise (response already sent)
     */
    public static boolean validateRequiredFields(RoutingContext context, JsonObject json, String... requiredFields)
    {
        if (json == null)
        {
            ExceptionUtil.handleHttp(context, new IllegalArgumentException("Request body is required"), "Validation failed");

            return false;
        }

        for (String field : requiredFields)
        {
            if (!json.containsKey(field) || json.getValue(field) == null)
            {
                ExceptionUtil.handleHttp(context, new IllegalArgumentException("Missing required field: " + field), "Validation failed");

                return false;
            }
        }

        return true;
    }

    /**
     * Validate UUID path parameter
     *
     * @param context Routing context
     * @param uuidValue UUID string to validate
     * @param parameterName Name of the parameter for error messages
     * @return true if valid UUID, false otherwise (response already sent)
     */
    public static boolean validatePathParameterUUID(RoutingContext context, String uuidValue, String parameterName)
    {
        if (!isValidUUID(uuidValue))
        {
            ExceptionUtil.handleHttp(context, new IllegalArgumentException(parameterName + " must be a valid UUID"), "Validation failed");

            return false;
        }

        return true;
    }

    public static boolean isValidUUID(String uuidValue)
    {
        if (uuidValue == null || uuidValue.trim().isEmpty())
        {
            return false;
        }

        try
        {
            UUID.fromString(uuidValue);

            return true;
        }
        catch (IllegalArgumentException exception)
        {
            return false;
        }
    }

    /**
     * Parse an optional positive integer query parameter.
     *
     * @param context Routing context
     * @param name query parameter name
     * @param defaultValue value used when the parameter is absent
     * @return parsed value, or null if invalid (response already sent)
     */
    public static Integer positiveQueryParam(RoutingContext context, String name, int defaultValue)
    {
        var raw = context.request().getParam(name);

        if (raw == null || raw.isBlank())
        {
            return defaultValue;
        }

        try
        {
            var value = Integer.parseInt(raw.trim());

            if (value < 1)
            {
                throw new IllegalArgumentException(name + " must be a positive integer");
            }

            return value;
        }
        catch (IllegalArgumentException exception)
        {
            // NumberFormatException is an IllegalArgumentException; both answer 400
            ExceptionUtil.handleHttp(context, new IllegalArgumentException(name + " must be a positive integer", exception), "Validation failed");

            return null;
        }
    }

    /**
     * Job - Monitoring job payload validations
     */
    public static class Job
    {

        private static final String[] UPDATABLE_FIELDS = {
            "name", "network_interface", "subnet", "execution_time", "schedule",
            "notifications_enabled", "notify_new_macs", "notify_unauthorized_macs", "notify_ip_changes",
            "retention_policy", "retention_days", "whitelist"
        };

        /**
         * Validate a job creation payload.
         *
         * @param ctx routing context
         * @param body request body
         * @return true if validation passes, false otherwise
         */
        public static boolean validateCreate(RoutingContext ctx, JsonObject body)
        {
            if (!validateRequiredFields(ctx, body, "name", "network_interface", "subnet"))
            {
                return false;
            }

            return validateFields(ctx, body);
        }

        /**
         * Validate a job update payload; at least one known field must be present.
         *
         * @param ctx routing context
         * @param body request body
         * @return true if validation passes, false otherwise
         */
        public static boolean validateUpdate(RoutingContext ctx, JsonObject body)
        {
            if (body == null || body.isEmpty())
            {
                ExceptionUtil.handleHttp(ctx, new IllegalArgumentException("Request body is required"), "Validation failed");

                return false;
            }

            var hasField = false;

            for (var field : UPDATABLE_FIELDS)
            {
                if (body.containsKey(field))
                {
                    hasField = true;

                    break;
                }
            }

            if (!hasField)
            {
                ExceptionUtil.handleHttp(ctx, new IllegalArgumentException(
                    "At least one field must be provided: " + String.join(", ", UPDATABLE_FIELDS)), "Validation failed");

                return false;
            }

            return validateFields(ctx, body);
        }

        private static boolean validateFields(RoutingContext ctx, JsonObject body)
        {
            try
            {
                if (body.containsKey("name") && isBlank(body.getValue("name")))
                {
                    throw new IllegalArgumentException("name cannot be empty");
                }

                if (body.containsKey("network_interface") && isBlank(body.getValue("network_interface")))
                {
                    throw new IllegalArgumentException("network_interface cannot be empty");
                }

                if (body.containsKey("subnet") && !SubnetUtil.isValidCidr(String.valueOf(body.getValue("subnet"))))
                {
                    throw new IllegalArgumentException("subnet must be an IPv4 CIDR block, e.g. 192.168.1.0/24");
                }

                if (body.containsKey("execution_time"))
                {
                    var executionTime = body.getValue("execution_time");

                    if (!(executionTime instanceof Number)
                        || ((Number) executionTime).intValue() < 1
                        || ((Number) executionTime).intValue() > MAX_EXECUTION_TIME)
                    {
                        throw new IllegalArgumentException("execution_time must be between 1 and " + MAX_EXECUTION_TIME + " seconds");
                    }
                }

                if (body.containsKey("schedule"))
                {
                    Schedule.fromTag(body.getString("schedule"));
                }

                if (body.containsKey("retention_policy"))
                {
                    var policy = body.getString("retention_policy");

                    if ("days".equalsIgnoreCase(policy))
                    {
                        RetentionPolicy.days(body.getInteger("retention_days", RetentionPolicy.DEFAULT_DAYS));
                    }
                    else
                    {
                        RetentionPolicy.parse(policy);
                    }
                }

                if (body.containsKey("whitelist"))
                {
                    var whitelist = body.getValue("whitelist");

                    if (!(whitelist instanceof JsonArray))
                    {
                        throw new IllegalArgumentException("whitelist must be an array of MAC addresses");
                    }

                    for (var entry : (JsonArray) whitelist)
                    {
                        if (!MacAddressUtil.isValid(String.valueOf(entry)))
                        {
                            throw new IllegalArgumentException("Invalid MAC address in whitelist: " + entry);
                        }
                    }
                }

                return true;
            }
            catch (IllegalArgumentException | ClassCastException exception)
            {
                ExceptionUtil.handleHttp(ctx, exception instanceof IllegalArgumentException
                    ? exception
                    : new IllegalArgumentException("Invalid field type", exception), "Validation failed");

                return false;
            }
        }

        private static boolean isBlank(Object value)
        {
            return !(value instanceof String) || ((String) value).trim().isEmpty();
        }

    }

}
