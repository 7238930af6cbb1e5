package com.gamearr.scheduler;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class SingleFlightSchedulerTest {

    private SingleFlightScheduler scheduler;

    @BeforeEach
    void setUp() {
        scheduler = new SingleFlightScheduler(Clock.systemUTC());
    }

    @AfterEach
    void tearDown() {
        scheduler.close();
    }

    @Test
    void concurrentTriggersShareOneExecution() throws Exception {
        BlockingJob job = new BlockingJob("blocking");
        scheduler.register(job, Duration.ofHours(1), Duration.ZERO);

        CompletableFuture<RunSummary> first = scheduler.trigger("blocking");
        assertTrue(job.started.await(5, TimeUnit.SECONDS));
        CompletableFuture<RunSummary> second = scheduler.trigger("blocking");

        assertSame(first, second);
        assertTrue(scheduler.status("blocking").orElseThrow().running());

        job.release.countDown();
        RunSummary summary = first.get(5, TimeUnit.SECONDS);
        assertEquals("blocking", summary.job());
        assertEquals(1, job.runs.get());
        assertFalse(scheduler.status("blocking").orElseThrow().running());
    }

    @Test
    void failedRunLeavesJobIdleAndRunnable() throws Exception {
        AtomicInteger attempts = new AtomicInteger();
        ScheduledJob failing = new ScheduledJob() {
            @Override
            public String name() {
                return "failing";
            }

            @Override
            public RunSummary run() {
                attempts.incrementAndGet();
                throw new IllegalStateException("boom");
            }
        };
        scheduler.register(failing, Duration.ofHours(1), Duration.ZERO);

        ExecutionException ex = assertThrows(ExecutionException.class,
                () -> scheduler.trigger("failing").get(5, TimeUnit.SECONDS));
        assertEquals("boom", ex.getCause().getMessage());

        JobStatus status = scheduler.status("failing").orElseThrow();
        assertFalse(status.running());
        assertEquals("boom", status.lastRun().failure());
        assertFalse(status.lastRun().succeeded());

        assertThrows(ExecutionException.class, () -> scheduler.trigger("failing").get(5, TimeUnit.SECONDS));
        assertEquals(2, attempts.get());
    }

    @Test
    void timerRunsJobRepeatedly() throws Exception {
        CountDownLatch threeRuns = new CountDownLatch(3);
        scheduler.register(new CountingJob("ticker", threeRuns), Duration.ofMillis(50), Duration.ZERO);

        scheduler.start("ticker");

        assertTrue(threeRuns.await(5, TimeUnit.SECONDS));
        assertTrue(scheduler.status("ticker").orElseThrow().scheduled());
        assertNotNull(scheduler.status("ticker").orElseThrow().lastTickAt());
    }

    @Test
    void ticksAreDroppedWhileRunInProgress() throws Exception {
        BlockingJob job = new BlockingJob("slow");
        scheduler.register(job, Duration.ofMillis(20), Duration.ZERO);

        scheduler.start("slow");
        assertTrue(job.started.await(5, TimeUnit.SECONDS));
        Thread.sleep(200);

        assertEquals(1, job.runs.get());
        scheduler.stop("slow");
        job.release.countDown();
    }

    @Test
    void updateIntervalReinstallsTimer() throws Exception {
        CountDownLatch ran = new CountDownLatch(1);
        scheduler.register(new CountingJob("rescheduled", ran), Duration.ofHours(1), Duration.ofHours(1));
        scheduler.start("rescheduled");

        scheduler.updateInterval("rescheduled", Duration.ofMillis(50));

        assertEquals(0, scheduler.status("rescheduled").orElseThrow().intervalSeconds());
        assertTrue(ran.await(5, TimeUnit.SECONDS));
    }

    @Test
    void updateIntervalOnStoppedJobOnlyRecordsValue() {
        scheduler.register(new CountingJob("idle", new CountDownLatch(1)), Duration.ofMinutes(15), Duration.ZERO);

        scheduler.updateInterval("idle", Duration.ofMinutes(30));

        JobStatus status = scheduler.status("idle").orElseThrow();
        assertEquals(1800, status.intervalSeconds());
        assertFalse(status.scheduled());
    }

    @Test
    void rejectsDuplicatesUnknownNamesAndBadIntervals() {
        scheduler.register(new CountingJob("dup", new CountDownLatch(1)), Duration.ofMinutes(1), Duration.ZERO);

        assertThrows(IllegalStateException.class,
                () -> scheduler.register(new CountingJob("dup", new CountDownLatch(1)), Duration.ofMinutes(1), Duration.ZERO));
        assertThrows(IllegalArgumentException.class, () -> scheduler.trigger("missing"));
        assertThrows(IllegalArgumentException.class, () -> scheduler.updateInterval("dup", Duration.ZERO));
        assertTrue(scheduler.status("missing").isEmpty());
    }

    @Test
    void statusesAreSortedByName() {
        scheduler.register(new CountingJob("b", new CountDownLatch(1)), Duration.ofMinutes(1), Duration.ZERO);
        scheduler.register(new CountingJob("a", new CountDownLatch(1)), Duration.ofMinutes(1), Duration.ZERO);

        assertEquals("a", scheduler.statuses().get(0).name());
        assertEquals("b", scheduler.statuses().get(1).name());
    }

    private static final class BlockingJob implements ScheduledJob {
        private final String name;
        private final CountDownLatch started = new CountDownLatch(1);
        private final CountDownLatch release = new CountDownLatch(1);
        private final AtomicInteger runs = new AtomicInteger();

        private BlockingJob(String name) {
            this.name = name;
        }

        @Override
        public String name() {
            return name;
        }

        @Override
        public RunSummary run() throws Exception {
            runs.incrementAndGet();
            started.countDown();
            release.await(10, TimeUnit.SECONDS);
            return RunSummary.builder(name, Instant.now()).build(Instant.now());
        }
    }

    private static final class CountingJob implements ScheduledJob {
        private final String name;
        private final CountDownLatch latch;

        private CountingJob(String name, CountDownLatch latch) {
            this.name = name;
            this.latch = latch;
        }

        @Override
        public String name() {
            return name;
        }

        @Override
        public RunSummary run() {
            latch.countDown();
            return RunSummary.builder(name, Instant.now()).processed().build(Instant.now());
        }
    }
}
