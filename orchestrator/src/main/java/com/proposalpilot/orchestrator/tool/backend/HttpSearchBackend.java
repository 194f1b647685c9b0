package com.proposalpilot.orchestrator.tool.backend;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.proposalpilot.orchestrator.tool.BackendHttpException;
import com.proposalpilot.orchestrator.tool.MalformedPayloadException;
import com.proposalpilot.orchestrator.tool.ToolBackend;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Map;

/**
 * Shared HTTP plumbing for the JSON search backends.
 *
 * Uses java.net.http.HttpClient so every header and byte on the wire is
 * explicit. Blocking I/O is fine here: the gateway runs each call on its
 * own executor and interrupts it at the deadline.
 */
public abstract class HttpSearchBackend implements ToolBackend {

    protected final HttpClient   http;
    protected final ObjectMapper json;
    protected final String       baseUrl;

    protected HttpSearchBackend(String baseUrl, ObjectMapper objectMapper) {
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        this.json    = objectMapper;
        this.http    = HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(10))
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build();
    }

    /** GET baseUrl + pathAndQuery and parse the JSON body. */
    protected JsonNode getJson(String pathAndQuery, Map<String, String> headers)
            throws IOException, InterruptedException {
        HttpRequest.Builder req = HttpRequest.newBuilder()
                .uri(URI.create(baseUrl + pathAndQuery))
                .header("Accept", "application/json")
                .GET();
        headers.forEach(req::header);
        return send(req.build());
    }

    /** POST a JSON body to baseUrl + path and parse the JSON reply. */
    protected JsonNode postJson(String path, Object body, Map<String, String> headers)
            throws IOException, InterruptedException {
        HttpRequest.Builder req = HttpRequest.newBuilder()
                .uri(URI.create(baseUrl + path))
                .header("Content-Type", "application/json")
                .header("Accept",       "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(json.writeValueAsString(body)));
        headers.forEach(req::header);
        return send(req.build());
    }

    /**
     * Status code the gateway should see. Providers that signal rate limiting
     * with something other than 429 override this.
     */
    protected int effectiveStatus(HttpResponse<String> response) {
        return response.statusCode();
    }

    private JsonNode send(HttpRequest request) throws IOException, InterruptedException {
        HttpResponse<String> resp = http.send(request, HttpResponse.BodyHandlers.ofString());
        int status = effectiveStatus(resp);
        if (status < 200 || status >= 300) {
            throw new BackendHttpException(status, resp.body());
        }
        String body = resp.body();
        if (body == null || body.isBlank()) {
            throw new MalformedPayloadException("Empty response body from " + request.uri().getHost());
        }
        return json.readTree(body);
    }

    // ------------------------------------------------------------------
    // Helpers for subclasses
    // ------------------------------------------------------------------

    protected static String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8);
    }

    /** Text of a field, or "" when absent or null. */
    protected static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value == null || value.isNull() ? "" : value.asText();
    }

    /** The node as an array, or MALFORMED_RESPONSE if it is anything else. */
    protected static JsonNode requireArray(JsonNode node, String what) throws MalformedPayloadException {
        if (node == null || !node.isArray()) {
            throw new MalformedPayloadException("Expected " + what + " to be a JSON array");
        }
        return node;
    }
}
