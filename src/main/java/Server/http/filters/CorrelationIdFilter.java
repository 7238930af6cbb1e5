package Server.http.filters;

import com.sun.net.httpserver.Filter;
import com.sun.net.httpserver.HttpExchange;
import org.slf4j.MDC;

import java.io.IOException;
import java.util.UUID;

/**
 * Takes the X-Correlation-Id request header, or generates one, echoes it on the
 * response and keeps it in the MDC while the request is handled.
 */
public class CorrelationIdFilter extends Filter {

    static final String CORRELATION_ID_HEADER = "X-Correlation-Id";
    static final String MDC_CORRELATION_ID_KEY = "correlationId";

    @Override
    public void doFilter(HttpExchange exchange, Chain chain) throws IOException {
        String correlationId = exchange.getRequestHeaders().getFirst(CORRELATION_ID_HEADER);
        if (correlationId == null || correlationId.isBlank() || correlationId.length() > 100) {
            correlationId = UUID.randomUUID().toString();
        }
        MDC.put(MDC_CORRELATION_ID_KEY, correlationId);
        exchange.getResponseHeaders().set(CORRELATION_ID_HEADER, correlationId);
        try {
            chain.doFilter(exchange);
        } finally {
            MDC.remove(MDC_CORRELATION_ID_KEY);
        }
    }

    @Override
    public String description() {
        return "Extracts or generates correlation IDs for request tracing";
    }
}
