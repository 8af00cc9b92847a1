package org.cleanseam.engine.http;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.cleanseam.engine.TestCatalogs;
import org.cleanseam.engine.catalog.Catalog;
import org.cleanseam.engine.catalog.CatalogLoadException;
import org.cleanseam.engine.catalog.ReloadableCatalogStore;
import org.cleanseam.engine.domain.service.AnalysisService;
import org.cleanseam.engine.domain.service.AnalysisServiceImpl;
import org.cleanseam.engine.domain.service.ComparisonRanker;
import org.cleanseam.engine.domain.service.RequestValidator;
import org.cleanseam.engine.domain.service.ScoringServiceImpl;
import org.cleanseam.engine.domain.service.WearEstimator;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.junit.jupiter.api.Assertions.*;

class AnalysisServerTest {

    private final ObjectMapper mapper = new ObjectMapper();
    private final HttpClient client = HttpClient.newBuilder()
            .version(HttpClient.Version.HTTP_1_1)
            .build();
    private final AtomicBoolean sourceBroken = new AtomicBoolean(false);

    private AnalysisServer server;

    @BeforeEach
    void setUp() throws IOException {
        Catalog bundled = TestCatalogs.bundled();
        ReloadableCatalogStore store = new ReloadableCatalogStore(() -> {
            if (sourceBroken.get()) {
                throw new CatalogLoadException("catalog source unavailable");
            }
            return bundled;
        });
        AnalysisService analysisService = new AnalysisServiceImpl(
                store, new RequestValidator(), new ScoringServiceImpl(), new WearEstimator());
        server = new AnalysisServer(0, 2, store, analysisService, new ComparisonRanker(analysisService));
        server.start();
    }

    @AfterEach
    void tearDown() {
        server.stop();
    }

    private HttpResponse<String> get(String path) throws Exception {
        HttpRequest request = HttpRequest.newBuilder(uri(path)).GET().build();
        return client.send(request, HttpResponse.BodyHandlers.ofString());
    }

    private HttpResponse<String> post(String path, String body) throws Exception {
        HttpRequest request = HttpRequest.newBuilder(uri(path))
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(body))
                .build();
        return client.send(request, HttpResponse.BodyHandlers.ofString());
    }

    private URI uri(String path) {
        return URI.create("http://localhost:" + server.getPort() + path);
    }

    private JsonNode json(HttpResponse<String> response) throws IOException {
        return mapper.readTree(response.body());
    }

    @Test
    void health_reportsCatalogSize() throws Exception {
        HttpResponse<String> response = get("/health");

        assertEquals(200, response.statusCode());
        JsonNode body = json(response);
        assertEquals("healthy", body.get("status").asText());
        assertEquals(8, body.get("brands").asInt());
        assertEquals(9, body.get("categories").asInt());
    }

    @Test
    void analyze_returnsScoreAndCostPerWear() throws Exception {
        HttpResponse<String> response = post("/analyze",
                "{\"brand\": \"Patagonia\", \"item_type\": \"jeans\", \"price\": 49.99}");

        assertEquals(200, response.statusCode());
        JsonNode body = json(response);
        assertEquals("Patagonia", body.get("brand").asText());
        assertEquals(96, body.get("quality_score").asInt());
        assertEquals(194, body.get("estimated_wears").asInt());
        assertEquals("0.26", body.get("cost_per_wear").decimalValue().toPlainString());
        assertEquals("excellent value potential", body.get("verdict").asText());
        assertFalse(body.get("fallback_used").asBoolean());
    }

    @Test
    void analyze_acceptsPriceAsText() throws Exception {
        HttpResponse<String> response = post("/analyze",
                "{\"brand\": \"NoName\", \"item_type\": \"jeans\", \"price\": \"49.99\"}");

        assertEquals(200, response.statusCode());
        JsonNode body = json(response);
        assertEquals(40, body.get("quality_score").asInt());
        assertTrue(body.get("fallback_used").asBoolean());
    }

    @Test
    void analyze_invalidPrice_is400WithKind() throws Exception {
        HttpResponse<String> response = post("/analyze",
                "{\"brand\": \"Zara\", \"item_type\": \"jeans\", \"price\": -3}");

        assertEquals(400, response.statusCode());
        assertEquals("INVALID_PRICE", json(response).get("error_kind").asText());
    }

    @Test
    void analyze_unknownCategory_is400WithKind() throws Exception {
        HttpResponse<String> response = post("/analyze",
                "{\"brand\": \"Zara\", \"item_type\": \"socks\", \"price\": 10}");

        assertEquals(400, response.statusCode());
        assertEquals("UNKNOWN_CATEGORY", json(response).get("error_kind").asText());
    }

    @Test
    void analyze_malformedJson_is400() throws Exception {
        HttpResponse<String> response = post("/analyze", "{\"brand\": ");

        assertEquals(400, response.statusCode());
        assertTrue(json(response).has("error"));
    }

    @Test
    void analyze_wrongMethod_is405() throws Exception {
        assertEquals(405, get("/analyze").statusCode());
    }

    @Test
    void compare_ranksAndReportsFailures() throws Exception {
        HttpResponse<String> response = post("/compare",
                "{\"item_type\": \"jeans\", \"price\": 49.99, \"brands\": [\"Shein\", \"Patagonia\", \"NoName\"]}");

        assertEquals(200, response.statusCode());
        JsonNode body = json(response);
        JsonNode ranked = body.get("ranked");
        assertEquals(3, ranked.size());
        assertEquals("Patagonia", ranked.get(0).get("brand").asText());
        assertEquals("Shein", ranked.get(2).get("brand").asText());
        assertTrue(body.get("recommendation").asText().startsWith("Patagonia"));
    }

    @Test
    void compare_allFailing_is422WithFailures() throws Exception {
        HttpResponse<String> response = post("/compare",
                "{\"item_type\": \"socks\", \"price\": 10, \"brands\": [\"Zara\", \"Gap\"]}");

        assertEquals(422, response.statusCode());
        JsonNode body = json(response);
        assertEquals("ALL_COMPARISONS_FAILED", body.get("error_kind").asText());
        assertEquals(2, body.get("failed").size());
    }

    @Test
    void compare_withoutBrands_is400() throws Exception {
        HttpResponse<String> response = post("/compare",
                "{\"item_type\": \"jeans\", \"price\": 10, \"brands\": []}");

        assertEquals(400, response.statusCode());
    }

    @Test
    void categories_areListed() throws Exception {
        HttpResponse<String> response = get("/categories");

        assertEquals(200, response.statusCode());
        assertTrue(response.body().contains("\"jeans\""));
        assertTrue(response.body().contains("\"coat\""));
    }

    @Test
    void brand_lookupByAlias() throws Exception {
        HttpResponse<String> found = get("/brand/levis");
        assertEquals(200, found.statusCode());
        assertEquals("Levi's", json(found).get("name").asText());

        assertEquals(404, get("/brand/NoSuchBrand").statusCode());
    }

    @Test
    void refresh_failureKeepsServing() throws Exception {
        assertEquals(200, post("/refresh", "").statusCode());

        sourceBroken.set(true);
        HttpResponse<String> failed = post("/refresh", "");
        assertEquals(500, failed.statusCode());

        HttpResponse<String> analyzed = post("/analyze",
                "{\"brand\": \"Gap\", \"item_type\": \"jeans\", \"price\": 40}");
        assertEquals(200, analyzed.statusCode());
    }
}
