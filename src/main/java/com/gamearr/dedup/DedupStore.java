package com.gamearr.dedup;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Bounded, time-limited memory of release GUIDs that have already been evaluated.
 * <p>
 * Eviction on overflow is insertion-order FIFO. Refreshing an existing GUID updates its
 * timestamp but keeps its original position. Entries older than {@code maxAge} read as
 * absent and are dropped when looked up or purged.
 */
public class DedupStore {

    private final int maxProcessed;
    private final Duration maxAge;
    private final Clock clock;
    private final LinkedHashMap<String, Long> seen = new LinkedHashMap<>();

    public DedupStore(int maxProcessed, Duration maxAge) {
        this(maxProcessed, maxAge, Clock.systemUTC());
    }

    public DedupStore(int maxProcessed, Duration maxAge, Clock clock) {
        if (maxProcessed <= 0) {
            throw new IllegalArgumentException("maxProcessed must be positive");
        }
        this.maxProcessed = maxProcessed;
        this.maxAge = maxAge;
        this.clock = clock;
    }

    public synchronized boolean has(String guid) {
        if (guid == null) return false;
        Long ts = seen.get(guid);
        if (ts == null) {
            return false;
        }
        if (isStale(ts, clock.millis())) {
            seen.remove(guid);
            return false;
        }
        return true;
    }

    public void markSeen(String guid) {
        markSeen(guid, clock.instant());
    }

    public synchronized void markSeen(String guid, Instant at) {
        if (guid == null) return;
        seen.put(guid, at.toEpochMilli());
        evictOverflow();
    }

    /**
     * @return number of entries removed
     */
    public synchronized int purgeStale(Instant now) {
        long nowMs = now.toEpochMilli();
        int removed = 0;
        Iterator<Map.Entry<String, Long>> it = seen.entrySet().iterator();
        while (it.hasNext()) {
            if (isStale(it.next().getValue(), nowMs)) {
                it.remove();
                removed++;
            }
        }
        return removed;
    }

    public int purgeStale() {
        return purgeStale(clock.instant());
    }

    public synchronized int size() {
        return seen.size();
    }

    public synchronized void clear() {
        seen.clear();
    }

    /**
     * Copy of the current entries in insertion order, GUID to epoch millis.
     */
    public synchronized Map<String, Long> snapshot() {
        return new LinkedHashMap<>(seen);
    }

    /**
     * Replaces the contents with a previously taken snapshot. Stale entries are skipped
     * and the size cap is applied.
     */
    public synchronized void restore(Map<String, Long> entries) {
        seen.clear();
        if (entries == null) return;
        long nowMs = clock.millis();
        for (Map.Entry<String, Long> e : entries.entrySet()) {
            if (e.getKey() != null && e.getValue() != null && !isStale(e.getValue(), nowMs)) {
                seen.put(e.getKey(), e.getValue());
            }
        }
        evictOverflow();
    }

    public int maxProcessed() {
        return maxProcessed;
    }

    public Duration maxAge() {
        return maxAge;
    }

    private boolean isStale(long timestamp, long nowMs) {
        return nowMs - timestamp > maxAge.toMillis();
    }

    private void evictOverflow() {
        int excess = seen.size() - maxProcessed;
        if (excess <= 0) return;
        Iterator<String> it = seen.keySet().iterator();
        while (excess-- > 0 && it.hasNext()) {
            it.next();
            it.remove();
        }
    }
}
