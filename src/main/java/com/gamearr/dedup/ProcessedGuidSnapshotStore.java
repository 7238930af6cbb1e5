package com.gamearr.dedup;

import java.util.Map;

/**
 * Persists {@link DedupStore} contents across restarts.
 */
public interface ProcessedGuidSnapshotStore {

    Map<String, Long> load();

    void save(Map<String, Long> snapshot);

    ProcessedGuidSnapshotStore NONE = new ProcessedGuidSnapshotStore() {
        @Override
        public Map<String, Long> load() {
            return Map.of();
        }

        @Override
        public void save(Map<String, Long> snapshot) {
        }
    };
}
