package Server.http;

import Server.http.filters.CorrelationIdFilter;
import Server.http.filters.ErrorTrackingFilter;
import com.sun.net.httpserver.Filter;
import com.sun.net.httpserver.HttpContext;

import java.util.List;

public final class ApiFilters {

    private static final Filter CORRELATION_ID_FILTER = new CorrelationIdFilter();
    private static final Filter ERROR_TRACKING_FILTER = new ErrorTrackingFilter();

    private ApiFilters() {}

    public static Filter correlationId() {
        return CORRELATION_ID_FILTER;
    }

    public static Filter errorTracking() {
        return ERROR_TRACKING_FILTER;
    }

    /**
     * Order: CorrelationId -> ErrorTracking
     */
    public static List<Filter> getAllApiFilters() {
        return List.of(CORRELATION_ID_FILTER, ERROR_TRACKING_FILTER);
    }

    public static HttpContext apply(HttpContext context) {
        context.getFilters().addAll(getAllApiFilters());
        return context;
    }
}
