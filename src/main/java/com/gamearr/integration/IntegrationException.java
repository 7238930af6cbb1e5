package com.gamearr.integration;

/**
 * Failure reported by an external collaborator (indexer, download client, metadata source).
 */
public class IntegrationException extends RuntimeException {

    public enum Kind {
        /** The collaborator has no usable configuration; the whole pass is skipped. */
        NOT_CONFIGURED,
        /** Network failure or timeout. */
        CONNECTION,
        /** The collaborator answered, but with an error or an unreadable body. */
        API
    }

    private final Kind kind;
    private final String service;

    public IntegrationException(Kind kind, String service, String message) {
        super(message);
        this.kind = kind;
        this.service = service;
    }

    public IntegrationException(Kind kind, String service, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.service = service;
    }

    public static IntegrationException notConfigured(String service) {
        return new IntegrationException(Kind.NOT_CONFIGURED, service, service + " is not configured");
    }

    public static IntegrationException connection(String service, Throwable cause) {
        return new IntegrationException(Kind.CONNECTION, service,
                "Failed to connect to " + service + ": " + cause.getMessage(), cause);
    }

    public static IntegrationException api(String service, int status, String detail) {
        return new IntegrationException(Kind.API, service,
                service + " returned HTTP " + status + (detail == null || detail.isBlank() ? "" : ": " + detail));
    }

    public Kind kind() {
        return kind;
    }

    public String service() {
        return service;
    }

    public boolean isNotConfigured() {
        return kind == Kind.NOT_CONFIGURED;
    }

    public boolean isConnectionFailure() {
        return kind == Kind.CONNECTION || kind == Kind.NOT_CONFIGURED;
    }
}
