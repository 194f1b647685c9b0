package com.proposalpilot.orchestrator.tool;

import java.io.IOException;

/**
 * The provider answered 2xx but the body did not have the expected shape
 * (valid JSON, missing fields).
 */
public class MalformedPayloadException extends IOException {

    public MalformedPayloadException(String message) {
        super(message);
    }
}
