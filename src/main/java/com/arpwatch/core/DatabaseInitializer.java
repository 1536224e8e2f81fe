package com.arpwatch.core;

import com.arpwatch.services.JobRunService;

import com.arpwatch.services.JobService;

import com.arpwatch.services.KnownDeviceService;

import com.arpwatch.services.NotificationService;

import com.arpwatch.services.impl.JobRunServiceImpl;

import com.arpwatch.services.impl.JobServiceImpl;

import com.arpwatch.services.impl.KnownDeviceServiceImpl;

import com.arpwatch.services.impl.NotificationServiceImpl;

import io.vertx.core.Future;

import io.vertx.core.Promise;

import io.vertx.core.Vertx;

import io.vertx.core.json.JsonObject;

import io.vertx.pgclient.PgBuilder;

import io.vertx.pgclient.PgConnectOptions;

import io.vertx.sqlclient.Pool;

import io.vertx.sqlclient.PoolOptions;

import org.slf4j.Logger;

import org.slf4j.LoggerFactory;

import java.io.IOException;

import java.nio.charset.StandardCharsets;

import java.util.ArrayList;

import java.util.List;

/**
 * DatabaseInitializer - One-time database setup during application startup
 * <p>
 * Tasks performed:
 * - Creates the PostgreSQL connection pool and checks connectivity
 * - Applies classpath schema.sql (idempotent CREATE ... IF NOT EXISTS statements)
 * - Instantiates the service implementations backed by the pool
 * <p>
 * Runs before any verticle is deployed so services are ready when the scheduler starts.
 */
public class DatabaseInitializer
{

    private static final Logger logger = LoggerFactory.getLogger(DatabaseInitializer.class);

    private static final String SCHEMA_RESOURCE = "schema.sql";

    private final Vertx vertx;

    private final JsonObject databaseConfig;

    private Pool pgPool;

    private JobService jobService;

    private JobRunService jobRunService;

    private KnownDeviceService knownDeviceService;

    private NotificationService notificationService;

    /**
     * Creates a new DatabaseInitializer instance.
     *
     * @param vertx Vert.x instance
     * @param databaseConfig database section of application.conf
     */
    public DatabaseInitializer(Vertx vertx, JsonObject databaseConfig)
    {
        this.vertx = vertx;

        this.databaseConfig = databaseConfig;
    }

    /**
     * Connects, applies the schema and creates the services.
     *
     * @return Future that completes when all initialization is done
     */
    public Future<Void> initialize()
    {
        try
        {
            logger.info("Initializing database services");

            return setupDatabaseConnection()
                .compose(pool ->
                {
                    this.pgPool = pool;

                    return applySchema();
                })
                .compose(statementCount ->
                {
                    logger.info("Database schema applied ({} statements)", statementCount);

                    setupAllServices();

                    return Future.<Void>succeededFuture();
                })
                .onFailure(cause -> logger.error("Failed to initialize database services: {}", cause.getMessage()));
        }
        catch (Exception exception)
        {
            logger.error("Error in initialize: {}", exception.getMessage());

            return Future.failedFuture(exception);
        }
    }

    private Future<Pool> setupDatabaseConnection()
    {
        var promise = Promise.<Pool>promise();

        try
        {
            var connectOptions = new PgConnectOptions()
                .setPort(databaseConfig.getInteger("port", 5432))
                .setHost(databaseConfig.getString("host", "localhost"))
                .setDatabase(databaseConfig.getString("database", "arpwatch"))
                .setUser(databaseConfig.getString("user", "arpwatch"))
                .setPassword(databaseConfig.getString("password", "arpwatch"));

            var poolOptions = new PoolOptions()
                .setMaxSize(databaseConfig.getInteger("maxSize", 5));

            var pool = PgBuilder.pool()
                .with(poolOptions)
                .connectingTo(connectOptions)
                .using(vertx)
                .build();

            // Test database connection
            pool.getConnection()
                .onSuccess(connection ->
                {
                    logger.info("Database connection established: {}:{}/{}",
                        connectOptions.getHost(), connectOptions.getPort(), connectOptions.getDatabase());

                    connection.close();

                    promise.complete(pool);
                })
                .onFailure(cause ->
                {
                    logger.error("Database connection failed: {}", cause.getMessage());

                    pool.close();

                    promise.fail(cause);
                });
        }
        catch (Exception exception)
        {
            logger.error("Failed to setup database connection: {}", exception.getMessage());

            promise.fail(exception);
        }

        return promise.future();
    }

    private Future<Integer> applySchema()
    {
        List<String> statements;

        try (var stream = DatabaseInitializer.class.getClassLoader().getResourceAsStream(SCHEMA_RESOURCE))
        {
            if (stream == null)
            {
                return Future.failedFuture(new IllegalStateException(SCHEMA_RESOURCE + " not found on classpath"));
            }

            statements = parseStatements(new String(stream.readAllBytes(), StandardCharsets.UTF_8));
        }
        catch (IOException exception)
        {
            logger.error("Error in applySchema: {}", exception.getMessage());

            return Future.failedFuture(exception);
        }

        // Statements depend on each other (foreign keys), run them in order
        Future<Void> chain = Future.succeededFuture();

        for (var statement : statements)
        {
            chain = chain.compose(v -> pgPool.query(statement).execute().mapEmpty());
        }

        return chain.map(v -> statements.size());
    }

    /**
     * Split a SQL script into statements: "--" comments are stripped, statements end at ';'.
     *
     * @param script SQL script text
     * @return non-empty statements in script order
     */
    static List<String> parseStatements(String script)
    {
        var cleaned = new StringBuilder();

        for (var line : script.split("\n"))
        {
            var commentIndex = line.indexOf("--");

            if (commentIndex >= 0)
            {
                line = line.substring(0, commentIndex);
            }

            if (!line.trim().isEmpty())
            {
                cleaned.append(line).append("\n");
            }
        }

        var statements = new ArrayList<String>();

        for (var statement : cleaned.toString().split(";"))
        {
            var trimmed = statement.trim();

            if (!trimmed.isEmpty())
            {
                statements.add(trimmed);
            }
        }

        return statements;
    }

    private void setupAllServices()
    {
        this.jobService = new JobServiceImpl(pgPool);

        this.jobRunService = new JobRunServiceImpl(pgPool);

        this.knownDeviceService = new KnownDeviceServiceImpl(pgPool);

        this.notificationService = new NotificationServiceImpl(pgPool);

        logger.debug("All 4 service implementations created");
    }

    public JobService getJobService()
    {
        return jobService;
    }

    public JobRunService getJobRunService()
    {
        return jobRunService;
    }

    public KnownDeviceService getKnownDeviceService()
    {
        return knownDeviceService;
    }

    public NotificationService getNotificationService()
    {
        return notificationService;
    }

    /**
     * Closes the database connection pool.
     *
     * @return Future that completes when cleanup is done
     */
    public Future<Void> cleanup()
    {
        var promise = Promise.<Void>promise();

        try
        {
            logger.info("Cleaning up database resources");

            if (pgPool != null)
            {
                pgPool.close()
                    .onSuccess(v ->
                    {
                        logger.debug("Database connection pool closed");

                        promise.complete();
                    })
                    .onFailure(cause ->
                    {
                        logger.error("Failed to close database pool: {}", cause.getMessage());

                        promise.fail(cause);
                    });
            }
            else
            {
                promise.complete();
            }
        }
        catch (Exception exception)
        {
            logger.error("Error in cleanup: {}", exception.getMessage());

            promise.fail(exception);
        }

        return promise.future();
    }

}
