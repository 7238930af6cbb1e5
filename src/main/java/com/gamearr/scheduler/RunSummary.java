package com.gamearr.scheduler;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Outcome of one job pass. {@code failure} is set only when the pass aborted.
 */
public record RunSummary(
        String job,
        Instant startedAt,
        Instant finishedAt,
        int processed,
        int matched,
        int grabbed,
        List<String> grabbedTitles,
        List<String> errors,
        String failure
) {

    public RunSummary {
        grabbedTitles = grabbedTitles == null ? List.of() : List.copyOf(grabbedTitles);
        errors = errors == null ? List.of() : List.copyOf(errors);
    }

    public static RunSummary failed(String job, Instant startedAt, Instant finishedAt, String failure) {
        return new RunSummary(job, startedAt, finishedAt, 0, 0, 0, List.of(), List.of(),
                failure == null ? "unknown failure" : failure);
    }

    public boolean succeeded() {
        return failure == null;
    }

    public static Builder builder(String job, Instant startedAt) {
        return new Builder(job, startedAt);
    }

    /**
     * Mutable accumulator used inside a single job pass.
     */
    public static final class Builder {
        private final String job;
        private final Instant startedAt;
        private int processed;
        private int matched;
        private final List<String> grabbedTitles = new ArrayList<>();
        private final List<String> errors = new ArrayList<>();

        private Builder(String job, Instant startedAt) {
            this.job = job;
            this.startedAt = startedAt;
        }

        public Builder processed() {
            processed++;
            return this;
        }

        public Builder processed(int count) {
            processed += count;
            return this;
        }

        public Builder matched() {
            matched++;
            return this;
        }

        public Builder grabbed(String title) {
            grabbedTitles.add(title == null ? "(untitled)" : title);
            return this;
        }

        public Builder error(String message) {
            errors.add(message == null ? "unknown error" : message);
            return this;
        }

        public int errorCount() {
            return errors.size();
        }

        public RunSummary build(Instant finishedAt) {
            return new RunSummary(job, startedAt, finishedAt, processed, matched, grabbedTitles.size(),
                    grabbedTitles, errors, null);
        }
    }
}
