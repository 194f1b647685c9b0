package com.proposalpilot.orchestrator.tool;

public class UnknownProviderException extends RuntimeException {
    public UnknownProviderException(String providerId) {
        super("No backend registered with provider id: '" + providerId + "'");
    }
}
