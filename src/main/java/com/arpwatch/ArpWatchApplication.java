package com.arpwatch;

import com.arpwatch.core.ArpScanner;

import com.arpwatch.core.DatabaseInitializer;

import com.arpwatch.core.JobRunner;

import com.arpwatch.handlers.JobHandler;

import com.arpwatch.handlers.NotificationHandler;

import com.arpwatch.utils.LoggingConfigurator;

import com.arpwatch.verticles.SchedulerVerticle;

import com.arpwatch.verticles.ServerVerticle;

import io.vertx.config.ConfigRetriever;

import io.vertx.config.ConfigRetrieverOptions;

import io.vertx.config.ConfigStoreOptions;

import io.vertx.core.DeploymentOptions;

import io.vertx.core.Future;

import io.vertx.core.Promise;

import io.vertx.core.Vertx;

import io.vertx.core.json.JsonObject;

import org.slf4j.Logger;

import org.slf4j.LoggerFactory;

import java.time.Clock;

import java.util.ArrayList;

import java.util.List;

/**
 * ArpWatch Application - Main Entry Point (Vert.x 5.0.4)

 * Startup sequence:
 * 1. Load application.conf (HOCON) and configure logging
 * 2. Connect to PostgreSQL, apply schema.sql, create services (DatabaseInitializer)
 * 3. Probe the arp-scan binary and log its version
 * 4. Create the JobRunner (scan worker pool) and deploy:
 *    - SchedulerVerticle: startup recovery and periodic dispatch of due jobs
 *    - ServerVerticle: HTTP API

 * Shutdown: verticles undeployed, worker pool and database pool closed.
 */
public class ArpWatchApplication
{

    private static final Logger logger = LoggerFactory.getLogger(ArpWatchApplication.class);

    private static final int DEFAULT_WORKER_POOL_SIZE = 10;

    private static Vertx vertx;

    private static DatabaseInitializer databaseInitializer;

    private static JobRunner jobRunner;

    private static final List<String> deployedVerticleIds = new ArrayList<>();

    /**
     * Main entry point for the ArpWatch application.
     *
     * @param args Command line arguments (not used)
     */
    public static void main(String[] args)
    {
        logger.info("Starting ArpWatch Application");

        vertx = Vertx.vertx();

        loadConfiguration()
            .compose(config ->
            {
                LoggingConfigurator.configure(config);

                Bootstrap.initialize(config);

                databaseInitializer = new DatabaseInitializer(vertx, config.getJsonObject("database", new JsonObject()));

                return databaseInitializer.initialize();
            })
            .compose(v -> probeScanner())
            .compose(v -> deployAllVerticles())
            .onSuccess(v ->
            {
                logger.info("ArpWatch Application started successfully");

                Runtime.getRuntime().addShutdownHook(new Thread(() ->
                {
                    logger.info("Shutdown signal received");

                    cleanup()
                        .compose(cleanupResult -> vertx.close())
                        .onSuccess(closeResult -> logger.info("Application stopped gracefully"))
                        .onFailure(cause -> logger.error("Error during graceful shutdown", cause));
                }));
            })
            .onFailure(cause ->
            {
                logger.error("Failed to start ArpWatch Application", cause);

                cleanup()
                    .compose(cleanupResult -> vertx.close())
                    .onComplete(closeResult ->
                    {
                        if (closeResult.failed())
                        {
                            logger.error("Failed to close Vertx instance", closeResult.cause());
                        }

                        System.exit(1);
                    });
            });
    }

    /**
     * Check that arp-scan can be invoked. A missing binary is logged, not fatal:
     * runs will fail with a process error until it is installed.
     */
    private static Future<Void> probeScanner()
    {
        var scanner = ArpScanner.fromConfig(Bootstrap.getConfig());

        return vertx.executeBlocking(scanner::version, false)
            .onSuccess(version ->
            {
                if (version != null)
                {
                    logger.info("arp-scan available: {}", version);
                }
                else
                {
                    logger.warn("arp-scan is not available; scans will fail until it is installed");
                }
            })
            .mapEmpty();
    }

    /**
     * Deploys SchedulerVerticle then ServerVerticle.
     *
     * @return Future that completes when all verticles are deployed
     */
    private static Future<Void> deployAllVerticles()
    {
        logger.info("Deploying verticles");

        var config = Bootstrap.getConfig();

        var clock = Clock.systemUTC();

        var workerPoolSize = config.getJsonObject("worker", new JsonObject())
            .getJsonObject("pool", new JsonObject())
            .getInteger("size", DEFAULT_WORKER_POOL_SIZE);

        jobRunner = new JobRunner(
            vertx,
            databaseInitializer.getJobService(),
            databaseInitializer.getJobRunService(),
            databaseInitializer.getKnownDeviceService(),
            () -> ArpScanner.fromConfig(config),
            workerPoolSize,
            clock);

        var scheduler = new SchedulerVerticle(
            databaseInitializer.getJobService(),
            databaseInitializer.getJobRunService(),
            jobRunner,
            clock);

        var jobHandler = new JobHandler(
            databaseInitializer.getJobService(),
            databaseInitializer.getJobRunService(),
            databaseInitializer.getKnownDeviceService(),
            jobRunner,
            scheduler,
            clock);

        var notificationHandler = new NotificationHandler(databaseInitializer.getNotificationService());

        var schedulerOptions = new DeploymentOptions()
            .setConfig(config.getJsonObject("scheduler", new JsonObject()));

        return vertx.deployVerticle(scheduler, schedulerOptions)
            .compose(schedulerId ->
            {
                deployedVerticleIds.add(schedulerId);

                logger.debug("SchedulerVerticle deployed: {}", schedulerId);

                var serverOptions = new DeploymentOptions()
                    .setConfig(config.getJsonObject("server", new JsonObject()));

                return vertx.deployVerticle(new ServerVerticle(jobHandler, notificationHandler), serverOptions);
            })
            .compose(serverId ->
            {
                deployedVerticleIds.add(serverId);

                logger.debug("ServerVerticle deployed: {}", serverId);

                logger.info("All {} verticles deployed successfully", deployedVerticleIds.size());

                return Future.<Void>succeededFuture();
            })
            .onFailure(cause -> logger.error("Failed to deploy verticles", cause));
    }

    /**
     * Undeploys verticles, then closes the scan worker pool and the database pool.
     *
     * @return Future that completes when cleanup is done
     */
    private static Future<Void> cleanup()
    {
        logger.info("Starting cleanup");

        var undeployFutures = new ArrayList<Future<Void>>();

        for (var deploymentId : deployedVerticleIds)
        {
            undeployFutures.add(vertx.undeploy(deploymentId)
                .onFailure(cause -> logger.error("Failed to undeploy verticle: {}", deploymentId, cause)));
        }

        return Future.join(undeployFutures)
            .transform(undeployed ->
            {
                deployedVerticleIds.clear();

                var closeFutures = new ArrayList<Future<Void>>();

                if (jobRunner != null)
                {
                    closeFutures.add(jobRunner.close());
                }

                if (databaseInitializer != null)
                {
                    closeFutures.add(databaseInitializer.cleanup());
                }

                return Future.join(closeFutures);
            })
            .onFailure(cause -> logger.error("Some cleanup operations failed", cause))
            .mapEmpty();
    }

    /**
     * Loads application configuration from application.conf file using HOCON format.
     *
     * @return Future containing the loaded configuration as JsonObject
     */
    private static Future<JsonObject> loadConfiguration()
    {
        var promise = Promise.<JsonObject>promise();

        var fileStore = new ConfigStoreOptions()
            .setType("file")
            .setFormat("hocon")
            .setConfig(new JsonObject().put("path", "application.conf"));

        var options = new ConfigRetrieverOptions().addStore(fileStore);

        var retriever = ConfigRetriever.create(vertx, options);

        retriever.getConfig()
            .onSuccess(config ->
            {
                var dbConfig = config.getJsonObject("database", new JsonObject());

                logger.info("Configuration loaded - Database: {}:{}/{}",
                    dbConfig.getString("host"),
                    dbConfig.getInteger("port"),
                    dbConfig.getString("database"));

                promise.complete(config);
            })
            .onFailure(cause ->
            {
                logger.error("Failed to load configuration from application.conf", cause);

                promise.fail(cause);
            });

        return promise.future();
    }

}
