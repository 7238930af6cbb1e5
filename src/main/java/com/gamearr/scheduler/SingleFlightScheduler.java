package com.gamearr.scheduler;

import com.gamearr.integration.IntegrationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs registered jobs on fixed intervals with at most one execution per job in flight.
 * <p>
 * A manual {@link #trigger(String)} while a run is active returns the future of that run
 * instead of starting another. Timer ticks that land on an active run are dropped.
 */
public class SingleFlightScheduler implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(SingleFlightScheduler.class);
    static final String MDC_JOB_KEY = "job";

    private final Map<String, JobRunState> jobs = new ConcurrentHashMap<>();
    private final ScheduledExecutorService timer;
    private final ExecutorService runner;
    private final Clock clock;

    public SingleFlightScheduler() {
        this(Clock.systemUTC());
    }

    public SingleFlightScheduler(Clock clock) {
        this.clock = clock;
        this.timer = Executors.newSingleThreadScheduledExecutor(daemonThreads("scheduler-timer"));
        this.runner = Executors.newCachedThreadPool(daemonThreads("job-runner"));
    }

    public void register(ScheduledJob job, Duration interval, Duration initialDelay) {
        requirePositive(interval);
        JobRunState state = new JobRunState(job, interval, initialDelay == null ? Duration.ZERO : initialDelay);
        if (jobs.putIfAbsent(job.name(), state) != null) {
            throw new IllegalStateException("Job already registered: " + job.name());
        }
        log.debug("Registered job {} every {}s", job.name(), interval.toSeconds());
    }

    public boolean isRegistered(String name) {
        return jobs.containsKey(name);
    }

    public void start(String name) {
        JobRunState state = require(name);
        synchronized (state) {
            if (state.tick() != null) {
                log.warn("Job {} is already scheduled", name);
                return;
            }
            Duration interval = state.interval();
            ScheduledFuture<?> handle = timer.scheduleAtFixedRate(() -> onTick(state),
                    state.initialDelay().toMillis(), interval.toMillis(), TimeUnit.MILLISECONDS);
            state.scheduled(handle, clock.instant());
        }
        log.info("Started job {} (every {})", name, describe(state.interval()));
    }

    public void startAll() {
        jobs.keySet().forEach(this::start);
    }

    /**
     * Cancels future ticks. A run already in progress is left to finish.
     */
    public void stop(String name) {
        JobRunState state = require(name);
        ScheduledFuture<?> handle = state.unschedule();
        if (handle != null) {
            handle.cancel(false);
            log.info("Stopped job {}", name);
        }
    }

    public CompletableFuture<RunSummary> trigger(String name) {
        JobRunState state = require(name);
        JobRunState.Claim claim = state.claim();
        if (!claim.owner()) {
            log.debug("Job {} already running, joining in-flight run", name);
            return claim.future();
        }
        try {
            runner.execute(() -> execute(state, claim.future()));
        } catch (RuntimeException e) {
            state.finish(RunSummary.failed(name, clock.instant(), clock.instant(), e.getMessage()));
            claim.future().completeExceptionally(e);
        }
        return claim.future();
    }

    /**
     * Changes a job's interval. If the job is scheduled its timer is reinstalled so that the
     * next tick lands one new interval after the previous tick, or immediately if that is already past.
     */
    public void updateInterval(String name, Duration interval) {
        requirePositive(interval);
        JobRunState state = require(name);
        synchronized (state) {
            Duration previous = state.interval();
            state.interval(interval);
            ScheduledFuture<?> current = state.tick();
            if (current == null) {
                return;
            }
            current.cancel(false);
            Instant anchor = state.scheduleAnchor();
            long elapsed = anchor == null ? 0 : Duration.between(anchor, clock.instant()).toMillis();
            long delay = Math.max(0, interval.toMillis() - elapsed);
            ScheduledFuture<?> handle = timer.scheduleAtFixedRate(() -> onTick(state),
                    delay, interval.toMillis(), TimeUnit.MILLISECONDS);
            state.scheduled(handle, clock.instant());
            log.info("Job {} interval changed from {} to {}, next run in {}s",
                    name, describe(previous), describe(interval), delay / 1000);
        }
    }

    public Optional<JobStatus> status(String name) {
        JobRunState state = jobs.get(name);
        return state == null ? Optional.empty() : Optional.of(state.status());
    }

    public List<JobStatus> statuses() {
        List<JobStatus> out = new ArrayList<>();
        jobs.values().forEach(s -> out.add(s.status()));
        out.sort((a, b) -> a.name().compareTo(b.name()));
        return out;
    }

    @Override
    public void close() {
        jobs.keySet().forEach(this::stop);
        timer.shutdownNow();
        runner.shutdown();
        try {
            if (!runner.awaitTermination(10, TimeUnit.SECONDS)) {
                log.warn("Jobs still running after shutdown timeout");
                runner.shutdownNow();
            }
        } catch (InterruptedException e) {
            runner.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    // =========================================================================
    // Execution
    // =========================================================================

    private void onTick(JobRunState state) {
        // Exceptions escaping here would silently cancel the periodic task.
        try {
            state.markTick(clock.instant());
            if (state.isRunning()) {
                log.debug("Skipping tick for {}: previous run still in progress", state.job().name());
                return;
            }
            trigger(state.job().name());
        } catch (Exception e) {
            log.error("Tick for job {} failed: {}", state.job().name(), e.getMessage(), e);
        }
    }

    private void execute(JobRunState state, CompletableFuture<RunSummary> future) {
        String name = state.job().name();
        Instant started = clock.instant();
        RunSummary summary = null;
        Exception failure = null;
        MDC.put(MDC_JOB_KEY, name);
        try {
            summary = state.job().run();
            logOutcome(summary);
        } catch (Exception e) {
            failure = e;
            logFailure(name, e);
        } finally {
            RunSummary recorded = summary != null
                    ? summary
                    : RunSummary.failed(name, started, clock.instant(), failure == null ? "aborted" : failure.getMessage());
            state.finish(recorded);
            MDC.remove(MDC_JOB_KEY);
            if (failure != null) {
                future.completeExceptionally(failure);
            } else if (summary != null) {
                future.complete(summary);
            } else {
                future.completeExceptionally(new IllegalStateException("Job " + name + " ended without a result"));
            }
        }
    }

    private void logOutcome(RunSummary summary) {
        if (summary == null) return;
        if (summary.errors().isEmpty()) {
            log.info("Completed: processed={}, matched={}, grabbed={}",
                    summary.processed(), summary.matched(), summary.grabbed());
        } else {
            log.warn("Completed with {} errors: processed={}, matched={}, grabbed={}",
                    summary.errors().size(), summary.processed(), summary.matched(), summary.grabbed());
        }
    }

    private void logFailure(String name, Exception e) {
        if (e instanceof IntegrationException ie && ie.isNotConfigured()) {
            log.debug("Job {} skipped: {}", name, ie.getMessage());
        } else if (e instanceof IntegrationException ie) {
            log.warn("Job {} failed: {}", name, ie.getMessage());
        } else {
            log.error("Job {} failed: {}", name, e.getMessage(), e);
        }
    }

    private JobRunState require(String name) {
        JobRunState state = jobs.get(name);
        if (state == null) {
            throw new IllegalArgumentException("Unknown job: " + name);
        }
        return state;
    }

    private static void requirePositive(Duration interval) {
        if (interval == null || interval.isZero() || interval.isNegative()) {
            throw new IllegalArgumentException("Interval must be positive");
        }
    }

    private static String describe(Duration d) {
        long s = d.toSeconds();
        if (s % 3600 == 0) return (s / 3600) + "h";
        if (s % 60 == 0) return (s / 60) + "m";
        return s + "s";
    }

    private static ThreadFactory daemonThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, prefix + "-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }
}
