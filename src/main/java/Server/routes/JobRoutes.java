package Server.routes;

import Server.http.ApiFilters;
import Server.http.HttpUtils;
import com.fasterxml.jackson.databind.JsonNode;
import com.gamearr.EngineSettings;
import com.gamearr.ReleaseEngine;
import com.gamearr.integration.IntegrationException;
import com.gamearr.jobs.JobNames;
import com.gamearr.scheduler.RunSummary;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Duration;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Manual job control.
 * <ul>
 *   <li>{@code GET /api/jobs} lists job statuses</li>
 *   <li>{@code GET /api/jobs/{name}} returns one status</li>
 *   <li>{@code POST /api/jobs/{name}/run} triggers or joins a run; {@code ?wait=false} returns 202 immediately</li>
 *   <li>{@code POST /api/jobs/{name}/interval} with {@code {"minutes":N}} or {@code {"seconds":N}}</li>
 *   <li>{@code DELETE /api/jobs/rss-sync/processed} forgets processed releases</li>
 * </ul>
 */
public class JobRoutes {

    private static final Logger log = LoggerFactory.getLogger(JobRoutes.class);
    private static final String PREFIX = "/api/jobs";
    private static final long RUN_WAIT_SECONDS = 300;

    private final ReleaseEngine engine;

    public JobRoutes(ReleaseEngine engine) {
        this.engine = engine;
    }

    public void register(HttpServer server) {
        ApiFilters.apply(server.createContext(PREFIX, this::handle));
    }

    private void handle(HttpExchange exchange) throws IOException {
        String path = exchange.getRequestURI().getPath();
        String rest = path.length() > PREFIX.length() ? path.substring(PREFIX.length()) : "";
        String[] parts = rest.replaceAll("^/+|/+$", "").split("/");
        String method = exchange.getRequestMethod().toUpperCase(Locale.ROOT);

        if (rest.isBlank() || rest.equals("/")) {
            if (!method.equals("GET")) {
                HttpUtils.methodNotAllowed(exchange, "GET");
                return;
            }
            HttpUtils.sendJson(exchange, 200, Map.of("jobs", engine.statuses()));
            return;
        }

        String name = parts[0];
        if (!engine.hasJob(name)) {
            HttpUtils.sendApiError(exchange, 404, "job_not_found", "Unknown job: " + name);
            return;
        }
        String action = parts.length > 1 ? parts[1] : "";
        switch (action) {
            case "" -> {
                if (!method.equals("GET")) {
                    HttpUtils.methodNotAllowed(exchange, "GET");
                    return;
                }
                HttpUtils.sendJson(exchange, 200, engine.status(name).orElseThrow());
            }
            case "run" -> {
                if (!method.equals("POST")) {
                    HttpUtils.methodNotAllowed(exchange, "POST");
                    return;
                }
                handleRun(exchange, name);
            }
            case "interval" -> {
                if (!method.equals("POST")) {
                    HttpUtils.methodNotAllowed(exchange, "POST");
                    return;
                }
                handleInterval(exchange, name);
            }
            case "processed" -> {
                if (!method.equals("DELETE")) {
                    HttpUtils.methodNotAllowed(exchange, "DELETE");
                    return;
                }
                if (!JobNames.RSS_SYNC.equals(name)) {
                    HttpUtils.sendApiError(exchange, 404, "not_found", "Only rss-sync keeps processed releases");
                    return;
                }
                int cleared = engine.clearProcessedReleases();
                HttpUtils.sendJson(exchange, 200, Map.of("cleared", cleared));
            }
            default -> HttpUtils.sendApiError(exchange, 404, "not_found", "Unknown action: " + action);
        }
    }

    private void handleRun(HttpExchange exchange, String name) throws IOException {
        Map<String, String> query = HttpUtils.parseQueryParams(exchange.getRequestURI().getRawQuery());
        CompletableFuture<RunSummary> run = engine.trigger(name);
        if ("false".equalsIgnoreCase(query.get("wait"))) {
            HttpUtils.sendJson(exchange, 202, Map.of("job", name, "status", "started"));
            return;
        }
        try {
            RunSummary summary = run.get(RUN_WAIT_SECONDS, TimeUnit.SECONDS);
            HttpUtils.sendJson(exchange, 200, summary);
        } catch (TimeoutException e) {
            HttpUtils.sendJson(exchange, 202, Map.of("job", name, "status", "running"));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            HttpUtils.sendApiError(exchange, 503, "interrupted", "Interrupted while waiting for " + name);
        } catch (ExecutionException e) {
            sendRunFailure(exchange, name, e.getCause());
        }
    }

    private void sendRunFailure(HttpExchange exchange, String name, Throwable cause) throws IOException {
        if (cause instanceof IntegrationException ie) {
            String code = ie.service().toLowerCase(Locale.ROOT).replaceAll("[^a-z0-9]+", "_");
            if (ie.isNotConfigured()) {
                HttpUtils.sendApiError(exchange, 503, code + "_not_configured", ie.getMessage());
            } else {
                HttpUtils.sendApiError(exchange, 502, code + "_unavailable", ie.getMessage());
            }
            return;
        }
        log.warn("Manual run of {} failed: {}", name, cause == null ? "unknown" : cause.getMessage());
        HttpUtils.sendApiError(exchange, 500, "job_failed", cause == null ? null : cause.getMessage());
    }

    private void handleInterval(HttpExchange exchange, String name) throws IOException {
        JsonNode body;
        try {
            body = HttpUtils.getMapper().readTree(HttpUtils.readRequestBody(exchange));
        } catch (IOException e) {
            HttpUtils.sendApiError(exchange, 400, "invalid_json", "Request body must be JSON");
            return;
        }
        if (body != null && body.hasNonNull("schedule") && JobNames.UPDATE_CHECK.equals(name)) {
            engine.updateSchedule(EngineSettings.UpdateSchedule.parse(body.get("schedule").asText()));
            Duration interval = engine.settings().updateSchedule().interval();
            HttpUtils.sendJson(exchange, 200, Map.of("job", name, "intervalSeconds", interval.toSeconds(),
                    "schedule", engine.settings().updateSchedule().name().toLowerCase(Locale.ROOT)));
            return;
        }
        Integer minutes = positiveInt(body, "minutes");
        Integer seconds = positiveInt(body, "seconds");
        Duration requested;
        if (minutes != null) {
            requested = Duration.ofMinutes(minutes);
        } else if (seconds != null) {
            requested = Duration.ofSeconds(seconds);
        } else {
            HttpUtils.sendApiError(exchange, 400, "invalid_interval", "Provide a positive 'minutes' or 'seconds' value");
            return;
        }
        Duration applied = engine.updateInterval(name, requested);
        HttpUtils.sendJson(exchange, 200, Map.of("job", name, "intervalSeconds", applied.toSeconds()));
    }

    private static Integer positiveInt(JsonNode body, String field) {
        if (body == null || !body.hasNonNull(field)) {
            return null;
        }
        JsonNode node = body.get(field);
        Integer value = HttpUtils.intValue(node.isNumber() ? node.numberValue() : node.asText());
        return value != null && value > 0 ? value : null;
    }
}
