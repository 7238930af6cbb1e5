package com.gamearr.scheduler;

import java.time.Instant;

public record JobStatus(
        String name,
        boolean scheduled,
        boolean running,
        long intervalSeconds,
        Instant lastTickAt,
        RunSummary lastRun
) {}
