package Server.http;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.gamearr.JacksonConfig;
import com.sun.net.httpserver.HttpExchange;

import java.io.IOException;
import java.io.OutputStream;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.HashMap;
import java.util.Map;

/**
 * Shared HTTP utilities for request/response handling.
 */
public final class HttpUtils {

    private static final ObjectMapper MAPPER = JacksonConfig.newObjectMapper();

    private HttpUtils() {}

    public static ObjectMapper getMapper() {
        return MAPPER;
    }

    // =========================================================================
    // Request Parsing
    // =========================================================================

    public static Map<String, String> parseQueryParams(String rawQuery) {
        Map<String, String> params = new HashMap<>();
        if (rawQuery == null || rawQuery.isBlank()) {
            return params;
        }
        for (String pair : rawQuery.split("&")) {
            if (pair.isEmpty()) {
                continue;
            }
            int idx = pair.indexOf('=');
            String key = URLDecoder.decode(idx >= 0 ? pair.substring(0, idx) : pair, StandardCharsets.UTF_8);
            String value = idx >= 0 ? URLDecoder.decode(pair.substring(idx + 1), StandardCharsets.UTF_8) : "";
            params.put(key, value);
        }
        return params;
    }

    public static String readRequestBody(HttpExchange exchange) throws IOException {
        return new String(exchange.getRequestBody().readAllBytes(), StandardCharsets.UTF_8);
    }

    public static Integer intValue(Object value) {
        if (value instanceof Number number) {
            return number.intValue();
        }
        if (value instanceof String s) {
            String trimmed = s.trim();
            if (trimmed.isEmpty()) {
                return null;
            }
            try {
                return Integer.parseInt(trimmed);
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }

    // =========================================================================
    // Response Helpers
    // =========================================================================

    public static void sendJson(HttpExchange exchange, int statusCode, Object payload) throws IOException {
        byte[] body = MAPPER.writeValueAsBytes(payload);
        exchange.getResponseHeaders().set("Content-Type", "application/json; charset=utf-8");
        exchange.sendResponseHeaders(statusCode, body.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(body);
        }
    }

    public static void sendApiError(HttpExchange exchange, int statusCode, String code, String message) throws IOException {
        String safeCode = (code == null || code.isBlank()) ? "error" : code.trim();
        String safeMessage = (message == null || message.isBlank()) ? "Request failed" : message;
        sendJson(exchange, statusCode, ApiErrorResponse.of(safeCode, statusCode, safeMessage));
    }

    public static void methodNotAllowed(HttpExchange exchange, String allowed) throws IOException {
        exchange.getResponseHeaders().set("Allow", allowed);
        sendApiError(exchange, 405, "method_not_allowed", "Only " + allowed + " is supported");
    }
}
