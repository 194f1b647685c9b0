package com.proposalpilot.orchestrator.tool;

/**
 * Thrown by a backend when the provider answered with a non-2xx status.
 * The gateway maps the status code to a {@link ToolFailureKind}.
 */
public class BackendHttpException extends RuntimeException {

    private final int statusCode;

    public BackendHttpException(int statusCode, String body) {
        super("HTTP %d: %s".formatted(statusCode, abbreviate(body)));
        this.statusCode = statusCode;
    }

    public int statusCode() { return statusCode; }

    private static String abbreviate(String body) {
        if (body == null) return "";
        return body.length() > 200 ? body.substring(0, 200) + "..." : body;
    }
}
