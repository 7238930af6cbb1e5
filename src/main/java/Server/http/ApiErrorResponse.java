package Server.http;

/**
 * Error body shared by every endpoint: {@code {"error":{"code":..,"status":..,"message":..}}}.
 */
public record ApiErrorResponse(ApiError error) {

    public record ApiError(String code, int status, String message) {}

    public static ApiErrorResponse of(String code, int status, String message) {
        return new ApiErrorResponse(new ApiError(code, status, message));
    }
}
