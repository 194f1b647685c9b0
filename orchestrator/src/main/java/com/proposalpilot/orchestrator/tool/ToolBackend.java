package com.proposalpilot.orchestrator.tool;

import java.io.IOException;
import java.util.List;

/**
 * An external search provider reachable through the {@link ToolGateway}.
 *
 * Backends are plain transports: they issue one request and translate the
 * reply into {@link SearchResult}s. They never retry and never enforce their
 * own deadline; the gateway does both normalisation and timing.
 *
 * <p>Failures are reported by throwing:
 * <ul>
 *   <li>{@link BackendHttpException} for a non-2xx HTTP reply,</li>
 *   <li>{@link com.fasterxml.jackson.core.JsonProcessingException} or
 *       {@link MalformedPayloadException} when the reply cannot be understood,</li>
 *   <li>any other {@link IOException} for transport problems.</li>
 * </ul>
 */
public interface ToolBackend {

    BackendManifest manifest();

    /**
     * Run one search. Must respond to thread interruption, which is how the
     * gateway aborts a call that ran past its deadline or whose run was cancelled.
     */
    List<SearchResult> search(ToolQuery query) throws IOException, InterruptedException;
}
