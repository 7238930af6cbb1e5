package com.gamearr.scheduler;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ScheduledFuture;

/**
 * Per-job bookkeeping owned by one {@link SingleFlightScheduler}. All mutation happens
 * while holding this object's monitor.
 */
final class JobRunState {

    private final ScheduledJob job;
    private final Duration initialDelay;
    private Duration interval;

    private boolean running;
    private CompletableFuture<RunSummary> inFlight;
    private RunSummary lastSummary;
    private Instant startedAt;
    private Instant lastTickAt;
    private ScheduledFuture<?> tick;

    JobRunState(ScheduledJob job, Duration interval, Duration initialDelay) {
        this.job = job;
        this.interval = interval;
        this.initialDelay = initialDelay;
    }

    ScheduledJob job() {
        return job;
    }

    Duration initialDelay() {
        return initialDelay;
    }

    synchronized Duration interval() {
        return interval;
    }

    synchronized void interval(Duration interval) {
        this.interval = interval;
    }

    /**
     * Moves Idle to Running and returns the new future, or returns the in-flight future
     * when a run is already active.
     */
    synchronized Claim claim() {
        if (running) {
            return new Claim(inFlight, false);
        }
        running = true;
        inFlight = new CompletableFuture<>();
        return new Claim(inFlight, true);
    }

    synchronized void finish(RunSummary summary) {
        running = false;
        inFlight = null;
        lastSummary = summary;
    }

    synchronized boolean isRunning() {
        return running;
    }

    synchronized void markTick(Instant at) {
        lastTickAt = at;
    }

    synchronized Instant scheduleAnchor() {
        return lastTickAt != null ? lastTickAt : startedAt;
    }

    synchronized ScheduledFuture<?> tick() {
        return tick;
    }

    synchronized void scheduled(ScheduledFuture<?> handle, Instant at) {
        tick = handle;
        if (startedAt == null) {
            startedAt = at;
        }
    }

    synchronized ScheduledFuture<?> unschedule() {
        ScheduledFuture<?> handle = tick;
        tick = null;
        startedAt = null;
        return handle;
    }

    synchronized JobStatus status() {
        return new JobStatus(job.name(), tick != null, running, interval.toSeconds(), lastTickAt, lastSummary);
    }

    record Claim(CompletableFuture<RunSummary> future, boolean owner) {}
}
