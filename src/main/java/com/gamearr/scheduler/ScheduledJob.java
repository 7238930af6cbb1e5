package com.gamearr.scheduler;

/**
 * A recurring unit of work driven by {@link SingleFlightScheduler}.
 */
public interface ScheduledJob {

    String name();

    /**
     * Runs one pass. Per-item problems belong in the returned summary; an exception
     * means the pass as a whole could not run.
     */
    RunSummary run() throws Exception;
}
