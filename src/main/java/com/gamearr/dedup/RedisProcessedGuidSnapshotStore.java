package com.gamearr.dedup;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import redis.clients.jedis.Jedis;

import java.io.IOException;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Keeps the processed-GUID snapshot in a single Redis key as a JSON object. The key
 * expires after the dedup window, since older entries would be dropped on restore anyway.
 */
public class RedisProcessedGuidSnapshotStore implements ProcessedGuidSnapshotStore {

    private static final Logger log = LoggerFactory.getLogger(RedisProcessedGuidSnapshotStore.class);
    static final String DEFAULT_KEY = "gamearr:rss:processed";
    private static final TypeReference<LinkedHashMap<String, Long>> SNAPSHOT_TYPE = new TypeReference<>() {};

    private final ObjectMapper mapper;
    private final String key;
    private final Duration ttl;

    public RedisProcessedGuidSnapshotStore(ObjectMapper mapper, Duration ttl) {
        this(mapper, DEFAULT_KEY, ttl);
    }

    public RedisProcessedGuidSnapshotStore(ObjectMapper mapper, String key, Duration ttl) {
        this.mapper = mapper;
        this.key = key;
        this.ttl = ttl;
    }

    @Override
    public Map<String, Long> load() {
        if (!RedisConfig.isAvailable()) {
            return Map.of();
        }
        try (Jedis jedis = RedisConfig.getJedis()) {
            if (jedis == null) {
                return Map.of();
            }
            String json = jedis.get(key);
            if (json == null || json.isBlank()) {
                return Map.of();
            }
            Map<String, Long> entries = decode(json);
            log.info("Restored {} processed releases from Redis", entries.size());
            return entries;
        } catch (Exception e) {
            log.warn("Failed to load processed releases from Redis: {}", e.getMessage());
            return Map.of();
        }
    }

    @Override
    public void save(Map<String, Long> snapshot) {
        if (!RedisConfig.isAvailable()) {
            return;
        }
        try (Jedis jedis = RedisConfig.getJedis()) {
            if (jedis == null) {
                return;
            }
            jedis.setex(key, Math.max(1L, ttl.toSeconds()), encode(snapshot));
        } catch (Exception e) {
            log.warn("Failed to save processed releases to Redis: {}", e.getMessage());
        }
    }

    /** Insertion order of {@code snapshot} is the FIFO order and survives the round trip. */
    String encode(Map<String, Long> snapshot) throws IOException {
        return mapper.writeValueAsString(snapshot);
    }

    LinkedHashMap<String, Long> decode(String json) throws IOException {
        if (json == null || json.isBlank()) {
            return new LinkedHashMap<>();
        }
        return mapper.readValue(json, SNAPSHOT_TYPE);
    }
}
