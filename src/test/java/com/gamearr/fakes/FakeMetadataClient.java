package com.gamearr.fakes;

import com.gamearr.integration.MetadataClient;
import com.gamearr.model.MetadataCandidate;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

public class FakeMetadataClient implements MetadataClient {

    public final Map<String, List<MetadataCandidate>> results = new HashMap<>();
    public final List<String> searched = new ArrayList<>();
    public final Map<String, RuntimeException> failures = new HashMap<>();

    @Override
    public boolean isConfigured() {
        return true;
    }

    @Override
    public List<MetadataCandidate> search(String query) {
        searched.add(query);
        RuntimeException failure = failures.get(query);
        if (failure != null) {
            throw failure;
        }
        return results.getOrDefault(query, List.of());
    }
}
