package com.arpwatch.verticles;

import com.arpwatch.core.JobRunner;

import com.arpwatch.exceptions.ScanProcessException;

import com.arpwatch.models.JobStatus;

import com.arpwatch.models.RunStatus;

import com.arpwatch.models.Schedule;

import com.arpwatch.support.FakeScanner;

import com.arpwatch.support.InMemoryStore;

import io.vertx.core.DeploymentOptions;

import io.vertx.core.Future;

import io.vertx.core.Promise;

import io.vertx.core.Vertx;

import io.vertx.core.json.JsonObject;

import io.vertx.junit5.Timeout;

import io.vertx.junit5.VertxExtension;

import io.vertx.junit5.VertxTestContext;

import org.junit.jupiter.api.AfterEach;

import org.junit.jupiter.api.BeforeEach;

import org.junit.jupiter.api.Test;

import org.junit.jupiter.api.extension.ExtendWith;

import java.time.Clock;

import java.time.Duration;

import java.time.Instant;

import java.time.ZoneOffset;

import java.util.List;

import java.util.concurrent.TimeUnit;

import static com.arpwatch.support.TestJobs.job;

import static org.junit.jupiter.api.Assertions.assertEquals;

import static org.junit.jupiter.api.Assertions.assertNull;

import static org.junit.jupiter.api.Assertions.assertTrue;

@ExtendWith(VertxExtension.class)
@Timeout(value = 20, timeUnit = TimeUnit.SECONDS)
class SchedulerVerticleTest
{

    private static final Instant NOW = Instant.parse("2024-09-09T09:00:00Z");

    private InMemoryStore store;

    private FakeScanner scanner;

    private JobRunner runner;

    private SchedulerVerticle scheduler;

    @BeforeEach
    void setUp(Vertx vertx)
    {
        store = new InMemoryStore();

        scanner = new FakeScanner();

        var clock = Clock.fixed(NOW, ZoneOffset.UTC);

        runner = new JobRunner(vertx, store, store, store, () -> scanner, 2, clock);

        scheduler = new SchedulerVerticle(store, store, runner, clock);
    }

    @AfterEach
    void tearDown()
    {
        scanner.release();
    }

    @Test
    void startupRecoversInterruptedRuns(Vertx vertx, VertxTestContext testContext)
    {
        var job = store.addJob(job("lab"));

        store.runStart(job.id, NOW.minus(Duration.ofMinutes(10)));

        deploy(vertx).onComplete(testContext.succeeding(id -> testContext.verify(() ->
        {
            assertEquals(JobStatus.ACTIVE, store.job(job.id).status);

            var run = store.runsOf(job.id).get(0);

            assertEquals(RunStatus.FAILED, run.status);

            assertEquals("Run interrupted by application shutdown", run.errorMessage);

            assertEquals(NOW, run.finishedAt);

            testContext.completeNow();
        })));
    }

    @Test
    void startupAssignsMissingNextRun(Vertx vertx, VertxTestContext testContext)
    {
        var scheduled = job("lab");

        scheduled.schedule = Schedule.EVERY_6H;

        store.addJob(scheduled);

        var manual = store.addJob(job("adhoc"));

        deploy(vertx).onComplete(testContext.succeeding(id -> testContext.verify(() ->
        {
            assertEquals(NOW.plus(Duration.ofHours(6)), store.job(scheduled.id).nextRun);

            assertNull(store.job(manual.id).nextRun);

            assertEquals(1, scheduler.getStatus().getInteger("scheduled_jobs"));

            testContext.completeNow();
        })));
    }

    @Test
    void tickDispatchesDueJobsAndAdvancesNextRun(Vertx vertx, VertxTestContext testContext)
    {
        var due = job("due");

        due.schedule = Schedule.HOURLY;

        due.nextRun = NOW.minusSeconds(1);

        store.addJob(due);

        var later = job("later");

        later.schedule = Schedule.DAILY;

        later.nextRun = NOW.plus(Duration.ofHours(3));

        store.addJob(later);

        var manual = store.addJob(job("manual"));

        deploy(vertx)
            .compose(id -> scheduler.checkDueJobs())
            .onComplete(testContext.succeeding(dispatched -> testContext.verify(() ->
            {
                assertEquals(List.of(due.id), dispatched);

                assertEquals(NOW.plus(Duration.ofHours(1)), store.job(due.id).nextRun);

                assertEquals(NOW.plus(Duration.ofHours(3)), store.job(later.id).nextRun);

                assertTrue(store.runsOf(later.id).isEmpty());

                assertTrue(store.runsOf(manual.id).isEmpty());

                assertEquals(1, store.runsOf(due.id).size());

                testContext.completeNow();
            })));
    }

    @Test
    void tickSkipsJobsAlreadyInFlight(Vertx vertx, VertxTestContext testContext)
    {
        var busy = job("busy");

        busy.schedule = Schedule.HOURLY;

        busy.nextRun = NOW.minusSeconds(60);

        store.addJob(busy);

        scanner.hold();

        deploy(vertx)
            .compose(id ->
            {
                runner.run(busy.id);

                return scheduler.checkDueJobs();
            })
            .onComplete(testContext.succeeding(dispatched -> testContext.verify(() ->
            {
                assertTrue(dispatched.isEmpty());

                assertEquals(1, store.runsOf(busy.id).size());

                var status = scheduler.getStatus();

                assertEquals(1, status.getInteger("running_jobs"));

                assertEquals(busy.id, status.getJsonArray("running_job_ids").getString(0));

                testContext.completeNow();
            })));
    }

    @Test
    void failedDispatchDoesNotStopLaterTicks(Vertx vertx, VertxTestContext testContext)
    {
        var broken = job("broken");

        broken.schedule = Schedule.HOURLY;

        broken.nextRun = NOW.minusSeconds(5);

        store.addJob(broken);

        var healthy = job("healthy");

        healthy.schedule = Schedule.EVERY_6H;

        healthy.nextRun = NOW.minusSeconds(5);

        store.addJob(healthy);

        scanner.failingWith(new ScanProcessException(1, "interface eth0 not found"));

        deploy(vertx)
            .compose(id -> scheduler.checkDueJobs())
            .compose(dispatched ->
            {
                testContext.verify(() ->
                {
                    assertEquals(2, dispatched.size());

                    assertEquals(NOW.plus(Duration.ofHours(1)), store.job(broken.id).nextRun);

                    assertEquals(NOW.plus(Duration.ofHours(6)), store.job(healthy.id).nextRun);
                });

                return awaitIdle(vertx);
            })
            .compose(v ->
            {
                testContext.verify(() ->
                {
                    assertEquals(RunStatus.FAILED, store.runsOf(broken.id).get(0).status);

                    assertEquals(RunStatus.FAILED, store.runsOf(healthy.id).get(0).status);
                });

                // The next tick still dispatches once the job is due again
                scanner.returning(List.of());

                store.job(healthy.id).nextRun = NOW.minusSeconds(1);

                return scheduler.checkDueJobs();
            })
            .compose(dispatched ->
            {
                testContext.verify(() -> assertEquals(List.of(healthy.id), dispatched));

                return awaitIdle(vertx);
            })
            .onComplete(testContext.succeeding(v -> testContext.verify(() ->
            {
                var runs = store.runsOf(healthy.id);

                assertEquals(2, runs.size());

                assertTrue(runs.stream().anyMatch(run -> run.status == RunStatus.COMPLETED));

                assertEquals(1, store.runsOf(broken.id).size());

                testContext.completeNow();
            })));
    }

    @Test
    void startupInitializesOnlyActiveJobs(Vertx vertx, VertxTestContext testContext)
    {
        // A store whose recovery step finds nothing to reset, leaving one job marked running
        var keepsRunning = new InMemoryStore()
        {
            @Override
            public synchronized Future<Integer> jobResetStaleRunning()
            {
                return Future.succeededFuture(0);
            }
        };

        var clock = Clock.fixed(NOW, ZoneOffset.UTC);

        var localRunner = new JobRunner(vertx, keepsRunning, keepsRunning, keepsRunning, () -> scanner, 1, clock);

        var localScheduler = new SchedulerVerticle(keepsRunning, keepsRunning, localRunner, clock);

        var active = job("active");

        active.schedule = Schedule.DAILY;

        keepsRunning.addJob(active);

        var busy = job("busy");

        busy.schedule = Schedule.DAILY;

        busy.status = JobStatus.RUNNING;

        keepsRunning.addJob(busy);

        vertx.deployVerticle(localScheduler, new DeploymentOptions().setConfig(tickConfig()))
            .onComplete(testContext.succeeding(id -> testContext.verify(() ->
            {
                assertEquals(NOW.plus(Duration.ofHours(24)), keepsRunning.job(active.id).nextRun);

                assertNull(keepsRunning.job(busy.id).nextRun);

                assertEquals(1, localScheduler.getStatus().getInteger("scheduled_jobs"));

                testContext.completeNow();
            })));
    }

    /**
     * Complete once no run is in flight.
     */
    private Future<Void> awaitIdle(Vertx vertx)
    {
        var idle = Promise.<Void>promise();

        vertx.setPeriodic(10, timerId ->
        {
            if (runner.listRunning().isEmpty())
            {
                vertx.cancelTimer(timerId);

                idle.complete();
            }
        });

        return idle.future();
    }

    private static JsonObject tickConfig()
    {
        return new JsonObject()
            .put("tick", new JsonObject().put("interval", new JsonObject().put("seconds", 3600)));
    }

    private Future<String> deploy(Vertx vertx)
    {
        return vertx.deployVerticle(scheduler, new DeploymentOptions().setConfig(tickConfig()));
    }

}
