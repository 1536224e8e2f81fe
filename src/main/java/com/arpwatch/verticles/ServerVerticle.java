package com.arpwatch.verticles;

import com.arpwatch.handlers.JobHandler;

import com.arpwatch.handlers.NotificationHandler;

import io.vertx.core.AbstractVerticle;

import io.vertx.core.Promise;

import io.vertx.core.http.HttpMethod;

import io.vertx.core.http.HttpServer;

import io.vertx.core.json.JsonObject;

import io.vertx.ext.web.Router;

import io.vertx.ext.web.handler.BodyHandler;

import io.vertx.ext.web.handler.CorsHandler;

import org.slf4j.Logger;

import org.slf4j.LoggerFactory;

/**
 * ServerVerticle - HTTP API Server

 * Responsibilities:
 * - Router setup and middleware (CORS, body parsing)
 * - Job, run, device and scheduler routes (JobHandler)
 * - Notification routes (NotificationHandler)
 * - Failure and 404 handling with the JSON error envelope
 */
public class ServerVerticle extends AbstractVerticle
{

    private static final Logger logger = LoggerFactory.getLogger(ServerVerticle.class);

    private final JobHandler jobHandler;

    private final NotificationHandler notificationHandler;

    private HttpServer httpServer;

    private int httpPort;

    public ServerVerticle(JobHandler jobHandler, NotificationHandler notificationHandler)
    {
        this.jobHandler = jobHandler;

        this.notificationHandler = notificationHandler;
    }

    /**
     * Starts the HTTP server on server.http.port.
     *
     * @param startPromise Promise completed when server starts successfully
     */
    @Override
    public void start(Promise<Void> startPromise)
    {
        try
        {
            logger.info("Starting ServerVerticle");

            // HOCON parses dotted keys as nested objects: http.port becomes http -> port
            httpPort = config().getJsonObject("http", new JsonObject()).getInteger("port", 8080);

            httpServer = vertx.createHttpServer();

            httpServer.requestHandler(createRouter())
                .listen(httpPort)
                .onSuccess(server ->
                {
                    logger.info("HTTP Server started on port {}", server.actualPort());

                    startPromise.complete();
                })
                .onFailure(cause ->
                {
                    logger.error("Failed to start HTTP server: {}", cause.getMessage());

                    startPromise.fail(cause);
                });
        }
        catch (Exception exception)
        {
            logger.error("Error in start: {}", exception.getMessage());

            startPromise.fail(exception);
        }
    }

    /**
     * Port the server is bound to; useful when configured with port 0.
     */
    public int actualPort()
    {
        return httpServer != null ? httpServer.actualPort() : httpPort;
    }

    private Router createRouter()
    {
        var router = Router.router(vertx);

        // Middleware
        router.route().handler(CorsHandler.create()
                .addOrigin("*")
                .allowedMethod(HttpMethod.GET)
                .allowedMethod(HttpMethod.POST)
                .allowedMethod(HttpMethod.PUT)
                .allowedMethod(HttpMethod.PATCH)
                .allowedMethod(HttpMethod.DELETE));

        router.route().handler(BodyHandler.create());

        setupJobRoutes(router);

        setupNotificationRoutes(router);

        // Global failure handler - catches all unhandled exceptions
        router.route().failureHandler(ctx ->
        {
            var failure = ctx.failure();

            var statusCode = ctx.statusCode() == -1 ? 500 : ctx.statusCode();

            logger.error("Request failed: {} - {}", ctx.request().path(),
                failure != null ? failure.getMessage() : "Unknown error");

            var errorResponse = new JsonObject()
                .put("success", false)
                .put("error", failure != null ? failure.getMessage() : "Internal Server Error")
                .put("path", ctx.request().path())
                .put("timestamp", System.currentTimeMillis());

            ctx.response()
                .setStatusCode(statusCode)
                .putHeader("content-type", "application/json")
                .end(errorResponse.encode());
        });

        // 404 handler for unmatched routes
        router.route("/*").handler(ctx ->
                ctx.response()
                    .setStatusCode(404)
                    .putHeader("content-type", "application/json")
                    .end(new JsonObject()
                        .put("success", false)
                        .put("error", "Not Found")
                        .put("timestamp", System.currentTimeMillis())
                        .encode()));

        return router;
    }

    private void setupJobRoutes(Router router)
    {
        // Static paths are registered before /api/jobs/:id so they are not captured as ids
        router.get("/api/jobs/running").handler(jobHandler::getRunningJobs);

        router.get("/api/scheduler/status").handler(jobHandler::getSchedulerStatus);

        router.get("/api/jobs").handler(jobHandler::getJobs);

        router.post("/api/jobs").handler(jobHandler::createJob);

        router.get("/api/jobs/:id").handler(jobHandler::getJob);

        router.put("/api/jobs/:id").handler(jobHandler::updateJob);

        router.delete("/api/jobs/:id").handler(jobHandler::deleteJob);

        router.post("/api/jobs/:id/run").handler(jobHandler::runJob);

        router.get("/api/jobs/:id/running").handler(jobHandler::isJobRunning);

        router.get("/api/jobs/:id/runs").handler(jobHandler::getJobRuns);

        router.get("/api/jobs/:id/devices").handler(jobHandler::getJobDevices);

        router.delete("/api/jobs/:id/devices/:deviceId").handler(jobHandler::deleteJobDevice);

        router.patch("/api/jobs/:id/devices/:deviceId/whitelist").handler(jobHandler::setDeviceWhitelisted);
    }

    private void setupNotificationRoutes(Router router)
    {
        router.get("/api/notifications/stats").handler(notificationHandler::getStatistics);

        router.delete("/api/notifications/cleanup").handler(notificationHandler::cleanup);

        router.patch("/api/notifications/job/:jobId/read-all").handler(notificationHandler::markAllReadForJob);

        router.get("/api/notifications").handler(notificationHandler::getNotifications);

        router.patch("/api/notifications/:id/read").handler(notificationHandler::markRead);

        router.delete("/api/notifications/:id").handler(notificationHandler::deleteNotification);
    }

}
