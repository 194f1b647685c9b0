package com.proposalpilot.orchestrator.tool.backend;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.proposalpilot.orchestrator.tool.BackendCategory;
import com.proposalpilot.orchestrator.tool.BackendHttpException;
import com.proposalpilot.orchestrator.tool.BackendManifest;
import com.proposalpilot.orchestrator.tool.MalformedPayloadException;
import com.proposalpilot.orchestrator.tool.SearchResult;
import com.proposalpilot.orchestrator.tool.ToolQuery;
import com.sun.net.httpserver.HttpServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Runs each provider backend against a local HTTP stub and checks the
 * request it sends and how it maps the reply.
 */
class HttpSearchBackendTest {

    final ObjectMapper objectMapper = new ObjectMapper();

    HttpServer server;
    String     baseUrl;

    // Last request seen per path.
    final Map<String, String> lastQuery  = new ConcurrentHashMap<>();
    final Map<String, String> lastAuth   = new ConcurrentHashMap<>();
    final Map<String, String> lastBody   = new ConcurrentHashMap<>();

    @BeforeEach
    void startServer() throws IOException {
        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.start();
        baseUrl = "http://127.0.0.1:" + server.getAddress().getPort();
    }

    @AfterEach
    void stopServer() {
        server.stop(0);
    }

    void respond(String path, int status, String body, Map<String, String> headers) {
        server.createContext(path, exchange -> {
            String query = exchange.getRequestURI().getRawQuery();
            lastQuery.put(path, query == null ? "" : query);
            String auth = exchange.getRequestHeaders().getFirst("Authorization");
            lastAuth.put(path, auth == null ? "" : auth);
            lastBody.put(path, new String(exchange.getRequestBody().readAllBytes(), StandardCharsets.UTF_8));
            headers.forEach((k, v) -> exchange.getResponseHeaders().add(k, v));
            byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
            exchange.sendResponseHeaders(status, bytes.length == 0 ? -1 : bytes.length);
            try (OutputStream out = exchange.getResponseBody()) {
                out.write(bytes);
            }
        });
    }

    // ------------------------------------------------------------------
    // Tavily
    // ------------------------------------------------------------------

    @Test
    void tavily_postsQueryWithBearerKey_andMapsResults() throws Exception {
        respond("/search", 200, """
                {"results":[
                  {"title":"AI in logistics","url":"https://news.example/1","content":"Route optimisation","score":0.9},
                  {"title":"Warehouse robots","url":"https://news.example/2","content":"Picking automation"}
                ]}
                """, Map.of("Content-Type", "application/json"));

        TavilySearchBackend backend = tavily("tvly-key");
        List<SearchResult> hits = backend.search(ToolQuery.of("supply-chain AI trends", 5));

        assertThat(hits).extracting(SearchResult::title).containsExactly("AI in logistics", "Warehouse robots");
        assertThat(hits.get(0).snippet()).isEqualTo("Route optimisation");
        assertThat(hits).allMatch(h -> h.provider().equals("market_trends"));
        assertThat(lastAuth.get("/search")).isEqualTo("Bearer tvly-key");

        JsonNode sent = objectMapper.readTree(lastBody.get("/search"));
        assertThat(sent.get("query").asText()).isEqualTo("supply-chain AI trends");
        assertThat(sent.get("topic").asText()).isEqualTo("news");
        assertThat(sent.get("max_results").asInt()).isEqualTo(5);
    }

    @Test
    void tavily_withoutKey_failsAsUnauthorisedWithoutCallingOut() {
        TavilySearchBackend backend = tavily(" ");

        assertThatThrownBy(() -> backend.search(ToolQuery.of("anything", 3)))
                .isInstanceOf(BackendHttpException.class)
                .satisfies(e -> assertThat(((BackendHttpException) e).statusCode()).isEqualTo(401));
    }

    @Test
    void tavily_resultsNotAnArray_isMalformed() {
        respond("/search", 200, "{\"results\":\"oops\"}", Map.of());

        assertThatThrownBy(() -> tavily("k").search(ToolQuery.of("q", 3)))
                .isInstanceOf(MalformedPayloadException.class);
    }

    // ------------------------------------------------------------------
    // Hugging Face
    // ------------------------------------------------------------------

    @Test
    void huggingFace_mapsDatasets_fallingBackToTags() throws Exception {
        respond("/api/datasets", 200, """
                [
                  {"id":"acme/shipments","description":"Shipment delays 2019-2023"},
                  {"id":"org/routes","tags":["logistics","tabular"]},
                  {"description":"no id, ignored"}
                ]
                """, Map.of());

        HuggingFaceDatasetBackend backend = new HuggingFaceDatasetBackend(baseUrl, null, objectMapper);
        List<SearchResult> hits = backend.search(ToolQuery.of("supply chain", 10));

        assertThat(hits).extracting(SearchResult::title).containsExactly("acme/shipments", "org/routes");
        assertThat(hits.get(0).url()).isEqualTo(baseUrl + "/datasets/acme/shipments");
        assertThat(hits.get(1).snippet()).isEqualTo("logistics, tabular");
        assertThat(lastQuery.get("/api/datasets")).contains("search=supply+chain").contains("limit=10");
        assertThat(lastAuth.get("/api/datasets")).isEmpty();
    }

    @Test
    void huggingFace_serverError_surfacesStatus() {
        respond("/api/datasets", 503, "unavailable", Map.of());

        HuggingFaceDatasetBackend backend = new HuggingFaceDatasetBackend(baseUrl, "hf-token", objectMapper);

        assertThatThrownBy(() -> backend.search(ToolQuery.of("q", 3)))
                .isInstanceOf(BackendHttpException.class)
                .satisfies(e -> assertThat(((BackendHttpException) e).statusCode()).isEqualTo(503));
    }

    // ------------------------------------------------------------------
    // GitHub
    // ------------------------------------------------------------------

    @Test
    void gitHub_mapsRepositories() throws Exception {
        respond("/search/repositories", 200, """
                {"total_count":1,"items":[
                  {"full_name":"acme/route-optimizer","html_url":"https://github.com/acme/route-optimizer","description":"VRP solver"}
                ]}
                """, Map.of());

        GitHubRepositoryBackend backend = new GitHubRepositoryBackend(baseUrl, "gh-token", objectMapper);
        List<SearchResult> hits = backend.search(ToolQuery.of("supply-chain machine learning", 5));

        assertThat(hits).singleElement().satisfies(h -> {
            assertThat(h.title()).isEqualTo("acme/route-optimizer");
            assertThat(h.url()).isEqualTo("https://github.com/acme/route-optimizer");
            assertThat(h.provider()).isEqualTo(GitHubRepositoryBackend.PROVIDER_ID);
        });
        assertThat(lastQuery.get("/search/repositories")).contains("sort=stars").contains("per_page=5");
        assertThat(lastAuth.get("/search/repositories")).isEqualTo("Bearer gh-token");
    }

    @Test
    void gitHub_forbiddenWithExhaustedQuota_isReportedAsRateLimited() {
        respond("/search/repositories", 403, "{\"message\":\"API rate limit exceeded\"}",
                Map.of("x-ratelimit-remaining", "0"));

        GitHubRepositoryBackend backend = new GitHubRepositoryBackend(baseUrl, null, objectMapper);

        assertThatThrownBy(() -> backend.search(ToolQuery.of("q", 5)))
                .isInstanceOf(BackendHttpException.class)
                .satisfies(e -> assertThat(((BackendHttpException) e).statusCode()).isEqualTo(429));
    }

    @Test
    void gitHub_plainForbidden_staysForbidden() {
        respond("/search/repositories", 403, "{\"message\":\"Bad credentials\"}",
                Map.of("x-ratelimit-remaining", "42"));

        GitHubRepositoryBackend backend = new GitHubRepositoryBackend(baseUrl, "bad", objectMapper);

        assertThatThrownBy(() -> backend.search(ToolQuery.of("q", 5)))
                .isInstanceOf(BackendHttpException.class)
                .satisfies(e -> assertThat(((BackendHttpException) e).statusCode()).isEqualTo(403));
    }

    // ------------------------------------------------------------------
    // Kaggle
    // ------------------------------------------------------------------

    @Test
    void kaggle_truncatesToMaxResults_andSkipsEntriesWithoutRef() throws Exception {
        respond("/api/v1/datasets/list", 200, """
                [
                  {"ref":"a/one","title":"One","subtitle":"first"},
                  {"title":"no ref"},
                  {"ref":"b/two","title":""},
                  {"ref":"c/three","title":"Three"}
                ]
                """, Map.of());

        KaggleDatasetBackend backend = new KaggleDatasetBackend(baseUrl, "kg-token", objectMapper);
        List<SearchResult> hits = backend.search(ToolQuery.of("freight", 2));

        assertThat(hits).extracting(SearchResult::title).containsExactly("One", "b/two");
        assertThat(hits.get(0).url()).isEqualTo(baseUrl + "/datasets/a/one");
        assertThat(lastAuth.get("/api/v1/datasets/list")).isEqualTo("Bearer kg-token");
    }

    @Test
    void emptyBody_isMalformed() {
        respond("/api/v1/datasets/list", 200, "", Map.of());

        KaggleDatasetBackend backend = new KaggleDatasetBackend(baseUrl, "kg-token", objectMapper);

        assertThatThrownBy(() -> backend.search(ToolQuery.of("q", 2)))
                .isInstanceOf(MalformedPayloadException.class);
    }

    TavilySearchBackend tavily(String apiKey) {
        return new TavilySearchBackend(
                new BackendManifest("market_trends", "news", BackendCategory.MARKET_DATA, 20),
                "news", "basic", baseUrl, apiKey, objectMapper);
    }
}
