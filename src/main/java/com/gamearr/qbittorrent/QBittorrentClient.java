package com.gamearr.qbittorrent;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.gamearr.integration.DownloadClient;
import com.gamearr.integration.IntegrationException;
import com.gamearr.model.AcquisitionRequest;
import com.gamearr.model.ActiveDownload;
import com.gamearr.model.DownloadState;
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
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Download client for the qBittorrent Web API (v2). Authenticates lazily with a
 * session cookie and logs in again once when the session has expired.
 */
public class QBittorrentClient implements DownloadClient {

    private static final Logger log = LoggerFactory.getLogger(QBittorrentClient.class);
    private static final String SERVICE = "qBittorrent";
    private static final Pattern ENTRY_TAG = Pattern.compile("(?:^|,)\\s*game-(\\d+)\\s*(?:,|$)");

    private final HttpClient http;
    private final ObjectMapper mapper;
    private final String host;
    private final String username;
    private final String password;

    private volatile String sessionCookie;

    public QBittorrentClient(HttpClient http, ObjectMapper mapper, String host, String username, String password) {
        this.http = http;
        this.mapper = mapper;
        this.host = host == null ? null : host.trim().replaceAll("/+$", "");
        this.username = username;
        this.password = password;
    }

    @Override
    public boolean isConfigured() {
        return host != null && !host.isBlank();
    }

    @Override
    public String submit(AcquisitionRequest request) {
        StringBuilder form = new StringBuilder();
        appendForm(form, "urls", request.downloadUrl());
        if (request.category() != null) appendForm(form, "category", request.category());
        if (request.tags() != null && !request.tags().isEmpty()) appendForm(form, "tags", String.join(",", request.tags()));
        if (request.paused()) appendForm(form, "paused", "true");

        HttpResponse<String> resp = post("torrents/add", form.toString());
        String body = resp.body() == null ? "" : resp.body().trim();
        if (body.equalsIgnoreCase("Fails.")) {
            throw new IntegrationException(IntegrationException.Kind.API, SERVICE, "Torrent was rejected by qBittorrent");
        }
        log.debug("Submitted torrent to qBittorrent: {}", body);
        return body.isEmpty() ? "Ok." : body;
    }

    @Override
    public Optional<ActiveDownload> pollStatus(String handle) {
        if (handle == null || handle.isBlank()) {
            return Optional.empty();
        }
        List<ActiveDownload> found = parseTorrents(get("torrents/info?hashes=" + encode(handle)).body());
        return found.isEmpty() ? Optional.empty() : Optional.of(found.get(0));
    }

    @Override
    public List<ActiveDownload> listDownloads(String category) {
        String endpoint = "torrents/info";
        if (category != null && !category.isBlank()) {
            endpoint += "?category=" + encode(category);
        }
        return parseTorrents(get(endpoint).body());
    }

    @Override
    public boolean testConnection() {
        try {
            return get("app/version").statusCode() == 200;
        } catch (IntegrationException e) {
            log.debug("qBittorrent connection test failed: {}", e.getMessage());
            return false;
        }
    }

    // =========================================================================
    // Parsing
    // =========================================================================

    List<ActiveDownload> parseTorrents(String body) {
        JsonNode root;
        try {
            root = mapper.readTree(body);
        } catch (IOException e) {
            throw new IntegrationException(IntegrationException.Kind.API, SERVICE, "Unreadable torrent list", e);
        }
        List<ActiveDownload> out = new ArrayList<>();
        if (root == null || !root.isArray()) {
            return out;
        }
        for (JsonNode t : root) {
            out.add(new ActiveDownload(
                    t.path("hash").asText(""),
                    t.path("name").asText(""),
                    t.path("progress").asDouble(0),
                    mapState(t.path("state").asText("")),
                    t.path("category").asText(null),
                    entryIdFromTags(t.path("tags").asText(""))
            ));
        }
        return out;
    }

    static DownloadState mapState(String state) {
        return switch (state) {
            case "error", "missingFiles" -> DownloadState.FAILED;
            case "uploading", "pausedUP", "queuedUP", "stalledUP", "checkingUP", "forcedUP", "stoppedUP" -> DownloadState.COMPLETED;
            case "pausedDL", "stoppedDL" -> DownloadState.PAUSED;
            case "queuedDL", "allocating", "checkingResumeData" -> DownloadState.QUEUED;
            case "downloading", "metaDL", "stalledDL", "checkingDL", "forcedDL", "moving" -> DownloadState.DOWNLOADING;
            default -> DownloadState.UNKNOWN;
        };
    }

    static Long entryIdFromTags(String tags) {
        if (tags == null || tags.isBlank()) return null;
        Matcher m = ENTRY_TAG.matcher(tags);
        return m.find() ? Long.parseLong(m.group(1)) : null;
    }

    // =========================================================================
    // Transport
    // =========================================================================

    private HttpResponse<String> get(String endpoint) {
        return withSession(() -> HttpRequest.newBuilder(URI.create(host + "/api/v2/" + endpoint))
                .timeout(Duration.ofSeconds(10))
                .GET());
    }

    private HttpResponse<String> post(String endpoint, String form) {
        return withSession(() -> HttpRequest.newBuilder(URI.create(host + "/api/v2/" + endpoint))
                .timeout(Duration.ofSeconds(15))
                .header("Content-Type", "application/x-www-form-urlencoded")
                .POST(HttpRequest.BodyPublishers.ofString(form)));
    }

    private HttpResponse<String> withSession(RequestFactory factory) {
        if (!isConfigured()) {
            throw IntegrationException.notConfigured(SERVICE);
        }
        if (sessionCookie == null) {
            login();
        }
        HttpResponse<String> resp = send(withCookie(factory.create()));
        if (resp.statusCode() == 403) {
            log.debug("qBittorrent session expired, logging in again");
            sessionCookie = null;
            login();
            resp = send(withCookie(factory.create()));
        }
        if (resp.statusCode() < 200 || resp.statusCode() >= 300) {
            throw IntegrationException.api(SERVICE, resp.statusCode(), resp.body());
        }
        return resp;
    }

    private HttpRequest withCookie(HttpRequest.Builder builder) {
        String cookie = sessionCookie;
        if (cookie != null && !cookie.isEmpty()) {
            builder.header("Cookie", cookie);
        }
        return builder.build();
    }

    private synchronized void login() {
        if (sessionCookie != null) {
            return;
        }
        StringBuilder form = new StringBuilder();
        appendForm(form, "username", username == null ? "" : username);
        appendForm(form, "password", password == null ? "" : password);
        HttpRequest req = HttpRequest.newBuilder(URI.create(host + "/api/v2/auth/login"))
                .timeout(Duration.ofSeconds(10))
                .header("Content-Type", "application/x-www-form-urlencoded")
                .header("Referer", host)
                .POST(HttpRequest.BodyPublishers.ofString(form.toString()))
                .build();
        HttpResponse<String> resp = send(req);
        String body = resp.body() == null ? "" : resp.body().trim();
        if (resp.statusCode() != 200 || !body.equals("Ok.")) {
            throw new IntegrationException(IntegrationException.Kind.API, SERVICE,
                    "Authentication failed (HTTP " + resp.statusCode() + ")");
        }
        sessionCookie = resp.headers().firstValue("set-cookie")
                .map(c -> c.split(";", 2)[0])
                .orElse("");
        log.debug("Authenticated with qBittorrent");
    }

    private HttpResponse<String> send(HttpRequest req) {
        try {
            return http.send(req, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw IntegrationException.connection(SERVICE, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw IntegrationException.connection(SERVICE, e);
        }
    }

    private static void appendForm(StringBuilder form, String key, String value) {
        if (form.length() > 0) form.append('&');
        form.append(encode(key)).append('=').append(encode(value));
    }

    private static String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8);
    }

    @FunctionalInterface
    private interface RequestFactory {
        HttpRequest.Builder create();
    }
}
