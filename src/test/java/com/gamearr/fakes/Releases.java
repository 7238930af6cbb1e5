package com.gamearr.fakes;

import com.gamearr.model.ReleaseCandidate;

import java.time.Instant;

public final class Releases {

    public static final long GB = 1024L * 1024 * 1024;

    private Releases() {}

    public static ReleaseCandidate release(String guid, String title, Integer seeders, Instant publishedAt) {
        return new ReleaseCandidate(guid, title, 10 * GB, seeders, 1, "TestIndexer", publishedAt, "magnet:?xt=urn:btih:" + guid);
    }
}
