package Server.http.filters;

import Server.http.HttpUtils;
import com.sun.net.httpserver.Filter;
import com.sun.net.httpserver.HttpExchange;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;

/**
 * Turns exceptions escaping a handler into a logged 500 with the standard error body.
 */
public class ErrorTrackingFilter extends Filter {

    private static final Logger log = LoggerFactory.getLogger(ErrorTrackingFilter.class);

    @Override
    public void doFilter(HttpExchange exchange, Chain chain) throws IOException {
        try {
            chain.doFilter(exchange);
        } catch (Exception e) {
            log.error("Unhandled exception in request {} {}: {}",
                    exchange.getRequestMethod(),
                    exchange.getRequestURI(),
                    e.getMessage(),
                    e);
            if (exchange.getResponseCode() == -1) {
                try {
                    HttpUtils.sendApiError(exchange, 500, "internal_error", "An unexpected error occurred");
                } catch (IOException ioe) {
                    log.debug("Could not send error response: {}", ioe.getMessage());
                }
            }
        }
    }

    @Override
    public String description() {
        return "Logs unhandled handler exceptions and answers with a 500";
    }
}
