package com.proposalpilot.orchestrator.tool;

/**
 * The query does not match the schema declared in the backend's manifest.
 * Raised before dispatch; nothing goes over the wire.
 */
public class InvalidQueryException extends RuntimeException {
    public InvalidQueryException(String providerId, String problem) {
        super("Invalid query for provider '" + providerId + "': " + problem);
    }
}
