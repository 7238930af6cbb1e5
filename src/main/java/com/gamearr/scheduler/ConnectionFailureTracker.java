package com.gamearr.scheduler;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Throttles log output for a dependency that keeps failing. The first failure and the
 * recovery are logged; repeats are logged at most once per quiet window. Scheduling is
 * not affected, every tick still tries the dependency.
 */
public class ConnectionFailureTracker {

    private static final Logger log = LoggerFactory.getLogger(ConnectionFailureTracker.class);
    public static final Duration DEFAULT_QUIET_WINDOW = Duration.ofMinutes(5);

    private final String service;
    private final Duration quietWindow;
    private final Clock clock;

    private boolean connected = true;
    private int consecutiveFailures;
    private Instant lastLoggedAt;

    public ConnectionFailureTracker(String service) {
        this(service, DEFAULT_QUIET_WINDOW, Clock.systemUTC());
    }

    public ConnectionFailureTracker(String service, Duration quietWindow, Clock clock) {
        this.service = service;
        this.quietWindow = quietWindow;
        this.clock = clock;
    }

    public synchronized void recordSuccess() {
        if (!connected) {
            log.info("{} connection restored after {} failed attempts", service, consecutiveFailures);
        }
        connected = true;
        consecutiveFailures = 0;
        lastLoggedAt = null;
    }

    /**
     * @return true if this failure was logged
     */
    public synchronized boolean recordFailure(String reason) {
        consecutiveFailures++;
        Instant now = clock.instant();
        if (connected) {
            connected = false;
            lastLoggedAt = now;
            log.warn("{} is offline or unreachable ({}). Retrying on every tick.", service, reason);
            return true;
        }
        if (Duration.between(lastLoggedAt, now).compareTo(quietWindow) >= 0) {
            lastLoggedAt = now;
            log.info("{} still offline ({} consecutive failures)", service, consecutiveFailures);
            return true;
        }
        return false;
    }

    public synchronized boolean isConnected() {
        return connected;
    }

    public synchronized int consecutiveFailures() {
        return consecutiveFailures;
    }
}
