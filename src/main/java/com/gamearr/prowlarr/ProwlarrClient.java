package com.gamearr.prowlarr;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.gamearr.integration.IntegrationException;
import com.gamearr.integration.ReleaseFeedClient;
import com.gamearr.model.ReleaseCandidate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Release feed backed by the Prowlarr search API. The recent-release feed is a search
 * with an empty query, which Prowlarr answers with each indexer's latest items.
 */
public class ProwlarrClient implements ReleaseFeedClient {

    private static final Logger log = LoggerFactory.getLogger(ProwlarrClient.class);
    private static final String SERVICE = "Prowlarr";
    static final int RSS_LIMIT = 100;
    static final int SEARCH_LIMIT = 50;

    private final HttpClient http;
    private final ObjectMapper mapper;
    private final String baseUrl;
    private final String apiKey;
    private final List<Integer> categories;

    public ProwlarrClient(HttpClient http, ObjectMapper mapper, String baseUrl, String apiKey, List<Integer> categories) {
        this.http = http;
        this.mapper = mapper;
        this.baseUrl = baseUrl == null ? null : baseUrl.trim().replaceAll("/+$", "");
        this.apiKey = apiKey;
        this.categories = categories == null ? List.of() : List.copyOf(categories);
    }

    @Override
    public boolean isConfigured() {
        return baseUrl != null && !baseUrl.isBlank() && apiKey != null && !apiKey.isBlank();
    }

    @Override
    public List<ReleaseCandidate> fetchRecentReleases(Optional<Instant> since) {
        List<ReleaseCandidate> releases = search("", RSS_LIMIT);
        log.info("Fetched {} recent releases from Prowlarr", releases.size());
        if (since == null || since.isEmpty()) {
            return releases;
        }
        Instant cutoff = since.get();
        return releases.stream()
                .filter(r -> r.publishedAt() == null || r.publishedAt().isAfter(cutoff))
                .toList();
    }

    @Override
    public List<ReleaseCandidate> fetchConfiguredQueryReleases(String query) {
        log.debug("Searching Prowlarr for '{}'", query);
        return search(query == null ? "" : query, SEARCH_LIMIT);
    }

    @Override
    public boolean testConnection() {
        if (!isConfigured()) {
            return false;
        }
        try {
            HttpResponse<String> resp = send(URI.create(baseUrl + "/api/v1/system/status"), Duration.ofSeconds(5));
            return resp.statusCode() == 200;
        } catch (IntegrationException e) {
            log.debug("Prowlarr connection test failed: {}", e.getMessage());
            return false;
        }
    }

    private List<ReleaseCandidate> search(String query, int limit) {
        if (!isConfigured()) {
            throw IntegrationException.notConfigured(SERVICE);
        }
        Map<String, String> params = new LinkedHashMap<>();
        params.put("query", query);
        params.put("type", "search");
        params.put("limit", String.valueOf(limit));
        params.put("offset", "0");
        for (int i = 0; i < categories.size(); i++) {
            params.put("categories[" + i + "]", String.valueOf(categories.get(i)));
        }
        URI uri = URI.create(baseUrl + "/api/v1/search?" + encode(params));
        HttpResponse<String> resp = send(uri, Duration.ofSeconds(30));
        if (resp.statusCode() != 200) {
            throw IntegrationException.api(SERVICE, resp.statusCode(), truncate(resp.body()));
        }
        return parseReleases(resp.body());
    }

    List<ReleaseCandidate> parseReleases(String body) {
        JsonNode root;
        try {
            root = mapper.readTree(body);
        } catch (IOException e) {
            throw new IntegrationException(IntegrationException.Kind.API, SERVICE, "Unreadable search response", e);
        }
        List<ReleaseCandidate> out = new ArrayList<>();
        if (root == null || !root.isArray()) {
            return out;
        }
        for (JsonNode node : root) {
            String guid = optText(node, "guid");
            String title = optText(node, "title");
            if (guid == null || title == null) {
                continue;
            }
            String downloadUrl = optText(node, "downloadUrl");
            if (downloadUrl == null) {
                downloadUrl = optText(node, "magnetUrl");
            }
            out.add(new ReleaseCandidate(
                    guid,
                    title,
                    node.path("size").asLong(0),
                    node.hasNonNull("seeders") ? node.get("seeders").asInt() : null,
                    node.hasNonNull("leechers") ? node.get("leechers").asInt() : null,
                    optText(node, "indexer"),
                    parseDate(optText(node, "publishDate")),
                    downloadUrl
            ));
        }
        return out;
    }

    private HttpResponse<String> send(URI uri, Duration timeout) {
        HttpRequest req = HttpRequest.newBuilder(uri)
                .timeout(timeout)
                .header("X-Api-Key", apiKey)
                .header("Accept", "application/json")
                .GET()
                .build();
        try {
            return http.send(req, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw IntegrationException.connection(SERVICE, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw IntegrationException.connection(SERVICE, e);
        }
    }

    private static String encode(Map<String, String> params) {
        StringBuilder qs = new StringBuilder();
        for (Map.Entry<String, String> e : params.entrySet()) {
            if (qs.length() > 0) qs.append('&');
            qs.append(URLEncoder.encode(e.getKey(), StandardCharsets.UTF_8))
                    .append('=')
                    .append(URLEncoder.encode(e.getValue(), StandardCharsets.UTF_8));
        }
        return qs.toString();
    }

    private static Instant parseDate(String raw) {
        if (raw == null) return null;
        try {
            return OffsetDateTime.parse(raw).toInstant();
        } catch (DateTimeParseException e) {
            try {
                return Instant.parse(raw);
            } catch (DateTimeParseException ignored) {
                log.debug("Unparseable publishDate '{}'", raw);
                return null;
            }
        }
    }

    private static String truncate(String body) {
        if (body == null) return null;
        return body.length() > 200 ? body.substring(0, 200) : body;
    }

    private static String optText(JsonNode node, String field) {
        JsonNode v = node == null ? null : node.get(field);
        if (v == null || v.isNull()) {
            return null;
        }
        String text = v.asText();
        return text.isBlank() ? null : text;
    }
}
