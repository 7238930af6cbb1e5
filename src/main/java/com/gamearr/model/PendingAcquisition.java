package com.gamearr.model;

import java.time.Instant;

public record PendingAcquisition(long entryId, ReleaseInfo release, Instant startedAt) {}
