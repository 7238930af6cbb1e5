package com.gamearr.fakes;

import com.gamearr.integration.IntegrationException;
import com.gamearr.integration.ReleaseFeedClient;
import com.gamearr.model.ReleaseCandidate;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

public class FakeReleaseFeed implements ReleaseFeedClient {

    public boolean configured = true;
    public List<ReleaseCandidate> recent = new ArrayList<>();
    public final Map<String, List<ReleaseCandidate>> byQuery = new HashMap<>();
    public final Map<String, RuntimeException> queryFailures = new HashMap<>();
    public final List<String> queries = new ArrayList<>();
    public final List<Optional<Instant>> sinceValues = new ArrayList<>();
    public RuntimeException failure;

    @Override
    public boolean isConfigured() {
        return configured;
    }

    @Override
    public List<ReleaseCandidate> fetchRecentReleases(Optional<Instant> since) {
        sinceValues.add(since);
        if (failure != null) throw failure;
        return recent;
    }

    @Override
    public List<ReleaseCandidate> fetchConfiguredQueryReleases(String query) {
        queries.add(query);
        if (failure != null) throw failure;
        if (!configured) throw IntegrationException.notConfigured("Release feed");
        if (queryFailures.containsKey(query)) throw queryFailures.get(query);
        return byQuery.getOrDefault(query, List.of());
    }
}
