package Server.routes;

import Server.http.ApiFilters;
import Server.http.HttpUtils;
import com.gamearr.ReleaseEngine;
import com.gamearr.dedup.RedisConfig;
import com.gamearr.integration.DownloadClient;
import com.gamearr.integration.ReleaseFeedClient;
import com.gamearr.scheduler.JobStatus;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;

import java.io.IOException;
import java.lang.management.ManagementFactory;
import java.lang.management.MemoryUsage;
import java.time.Instant;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Health check endpoints. Collaborators that are not configured are reported but do
 * not make the service unhealthy.
 */
public class HealthRoutes {

    private final ReleaseEngine engine;

    public HealthRoutes(ReleaseEngine engine) {
        this.engine = engine;
    }

    public void register(HttpServer server) {
        ApiFilters.apply(server.createContext("/api/health", this::handleHealth));
        ApiFilters.apply(server.createContext("/api/health/simple", this::handleSimpleHealth));
    }

    private void handleSimpleHealth(HttpExchange exchange) throws IOException {
        if (!"GET".equalsIgnoreCase(exchange.getRequestMethod())) {
            HttpUtils.methodNotAllowed(exchange, "GET");
            return;
        }
        HttpUtils.sendJson(exchange, 200, Map.of("status", "UP"));
    }

    private void handleHealth(HttpExchange exchange) throws IOException {
        if (!"GET".equalsIgnoreCase(exchange.getRequestMethod())) {
            HttpUtils.methodNotAllowed(exchange, "GET");
            return;
        }
        long startTime = System.currentTimeMillis();
        Map<String, Object> checks = new LinkedHashMap<>();
        boolean allHealthy = true;

        Map<String, Object> feed = checkFeed(engine.feed());
        checks.put("releaseFeed", feed);
        allHealthy &= (Boolean) feed.get("healthy");

        Map<String, Object> download = checkDownloadClient(engine.downloadClient());
        checks.put("downloadClient", download);
        allHealthy &= (Boolean) download.get("healthy");

        checks.put("redis", checkRedis());
        checks.put("jobs", jobSummary());
        checks.put("system", checkSystem());

        Map<String, Object> health = new HashMap<>();
        health.put("status", allHealthy ? "UP" : "DEGRADED");
        health.put("dryRun", engine.settings().dryRun());
        health.put("timestamp", Instant.now().toString());
        health.put("checks", checks);
        health.put("responseTimeMs", System.currentTimeMillis() - startTime);
        HttpUtils.sendJson(exchange, allHealthy ? 200 : 503, health);
    }

    private Map<String, Object> checkFeed(ReleaseFeedClient feed) {
        Map<String, Object> result = new HashMap<>();
        if (!feed.isConfigured()) {
            result.put("healthy", true);
            result.put("status", "not_configured");
            return result;
        }
        boolean reachable = feed.testConnection();
        result.put("healthy", reachable);
        result.put("status", reachable ? "reachable" : "unreachable");
        return result;
    }

    private Map<String, Object> checkDownloadClient(DownloadClient client) {
        Map<String, Object> result = new HashMap<>();
        if (!client.isConfigured()) {
            result.put("healthy", true);
            result.put("status", "not_configured");
            return result;
        }
        boolean reachable = client.testConnection();
        result.put("healthy", reachable);
        result.put("status", reachable ? "reachable" : "unreachable");
        return result;
    }

    private Map<String, Object> checkRedis() {
        Map<String, Object> result = new HashMap<>();
        boolean available = RedisConfig.isAvailable();
        result.put("status", available ? "connected" : "memory_only");
        return result;
    }

    private Map<String, Object> jobSummary() {
        Map<String, Object> jobs = new LinkedHashMap<>();
        for (JobStatus s : engine.statuses()) {
            Map<String, Object> job = new HashMap<>();
            job.put("scheduled", s.scheduled());
            job.put("running", s.running());
            job.put("lastRunOk", s.lastRun() == null ? null : s.lastRun().succeeded());
            jobs.put(s.name(), job);
        }
        return jobs;
    }

    private Map<String, Object> checkSystem() {
        MemoryUsage heap = ManagementFactory.getMemoryMXBean().getHeapMemoryUsage();
        Map<String, Object> memory = new HashMap<>();
        memory.put("heapUsedMB", heap.getUsed() / 1024 / 1024);
        memory.put("heapMaxMB", heap.getMax() / 1024 / 1024);
        return Map.of("memory", memory);
    }
}
