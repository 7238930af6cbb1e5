package com.gamearr.integration;

import com.gamearr.model.MetadataCandidate;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.BiConsumer;

/**
 * Game metadata lookup used to confirm that a title exists before trusting a version bump.
 */
public interface MetadataClient {

    boolean isConfigured();

    List<MetadataCandidate> search(String query);

    /**
     * Searches each query in turn. {@code progress} receives (completed, total) after every
     * query. A query whose lookup failed has no key in the result, which keeps it apart
     * from a lookup that found nothing.
     */
    default Map<String, List<MetadataCandidate>> searchBatch(List<String> queries, BiConsumer<Integer, Integer> progress) {
        Map<String, List<MetadataCandidate>> results = new LinkedHashMap<>();
        int done = 0;
        for (String q : queries) {
            try {
                results.put(q, search(q));
            } catch (IntegrationException e) {
                if (e.isNotConfigured()) {
                    throw e;
                }
                LoggerFactory.getLogger(MetadataClient.class).warn("Metadata search for '{}' failed: {}", q, e.getMessage());
            }
            done++;
            if (progress != null) {
                progress.accept(done, queries.size());
            }
        }
        return results;
    }

    MetadataClient DISABLED = new MetadataClient() {
        @Override
        public boolean isConfigured() {
            return false;
        }

        @Override
        public List<MetadataCandidate> search(String query) {
            throw IntegrationException.notConfigured("Metadata");
        }
    };
}
