package com.gamearr.dedup;

import com.gamearr.Config;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import redis.clients.jedis.Jedis;
import redis.clients.jedis.JedisPool;
import redis.clients.jedis.JedisPoolConfig;

import java.time.Duration;

/**
 * Lazily created Jedis pool. When no host is configured, or the first ping fails,
 * the pool stays null and callers run memory-only.
 */
public final class RedisConfig {

    private static final Logger log = LoggerFactory.getLogger(RedisConfig.class);

    private static final int TIMEOUT_MS = 2000;
    private static final int MAX_POOL_SIZE = 4;

    private static JedisPool jedisPool;
    private static volatile boolean initialized = false;

    private RedisConfig() {}

    public static synchronized void initialize() {
        if (initialized) {
            return;
        }
        String host = Config.getRedisHost();
        if (host == null || host.isBlank()) {
            log.info("Redis host not configured, processed releases are kept in memory only");
            initialized = true;
            return;
        }
        int port = Config.getRedisPort();
        String password = Config.getRedisPassword();
        try {
            JedisPoolConfig poolConfig = new JedisPoolConfig();
            poolConfig.setMaxTotal(MAX_POOL_SIZE);
            poolConfig.setMaxIdle(2);
            poolConfig.setMaxWait(Duration.ofMillis(TIMEOUT_MS));
            poolConfig.setTestOnBorrow(true);

            if (password != null && !password.isBlank()) {
                jedisPool = new JedisPool(poolConfig, host, port, TIMEOUT_MS, password);
            } else {
                jedisPool = new JedisPool(poolConfig, host, port, TIMEOUT_MS);
            }
            try (Jedis jedis = jedisPool.getResource()) {
                jedis.ping();
            }
            log.info("Redis connection pool initialized: {}:{}", host, port);
        } catch (Exception e) {
            log.warn("Failed to initialize Redis connection pool: {}. Falling back to in-memory dedup.", e.getMessage());
            if (jedisPool != null) {
                jedisPool.close();
            }
            jedisPool = null;
        }
        initialized = true;
    }

    /**
     * @return a pooled connection, or null when Redis is not available
     */
    public static Jedis getJedis() {
        if (!initialized) {
            initialize();
        }
        if (jedisPool == null) {
            return null;
        }
        try {
            return jedisPool.getResource();
        } catch (Exception e) {
            log.warn("Failed to get Redis connection: {}", e.getMessage());
            return null;
        }
    }

    public static boolean isAvailable() {
        if (!initialized) {
            initialize();
        }
        if (jedisPool == null) {
            return false;
        }
        try (Jedis jedis = jedisPool.getResource()) {
            return "PONG".equals(jedis.ping());
        } catch (Exception e) {
            log.debug("Redis ping failed: {}", e.getMessage());
            return false;
        }
    }

    public static synchronized void shutdown() {
        if (jedisPool != null) {
            jedisPool.close();
            jedisPool = null;
            log.info("Redis connection pool closed");
        }
        initialized = false;
    }
}
