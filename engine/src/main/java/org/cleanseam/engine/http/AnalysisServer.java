package org.cleanseam.engine.http;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import org.cleanseam.engine.api.dto.AnalysisResultDto;
import org.cleanseam.engine.api.dto.AnalyzeRequestDto;
import org.cleanseam.engine.api.dto.BrandProfileDto;
import org.cleanseam.engine.api.dto.CategoryListDto;
import org.cleanseam.engine.api.dto.CompareRequestDto;
import org.cleanseam.engine.api.dto.ComparisonResultDto;
import org.cleanseam.engine.api.dto.ErrorDto;
import org.cleanseam.engine.catalog.Catalog;
import org.cleanseam.engine.catalog.CatalogLoadException;
import org.cleanseam.engine.catalog.ReloadableCatalogStore;
import org.cleanseam.engine.domain.exception.AllComparisonsFailedException;
import org.cleanseam.engine.domain.exception.AnalysisException;
import org.cleanseam.engine.domain.model.AnalysisResult;
import org.cleanseam.engine.domain.model.BrandProfile;
import org.cleanseam.engine.domain.model.ComparisonResult;
import org.cleanseam.engine.domain.service.AnalysisService;
import org.cleanseam.engine.domain.service.ComparisonRanker;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * JSON HTTP front end for the analysis engine.
 * Maps requests to engine calls and engine errors to status codes.
 */
public final class AnalysisServer {

    private static final Logger LOG = Logger.getLogger(AnalysisServer.class.getName());

    private static final String BRAND_PREFIX = "/brand/";

    private final HttpServer server;
    private final ExecutorService executor;
    private final ObjectMapper mapper = new ObjectMapper();
    private final ReloadableCatalogStore catalogStore;
    private final AnalysisService analysisService;
    private final ComparisonRanker comparisonRanker;

    public AnalysisServer(int port, int threads, ReloadableCatalogStore catalogStore,
                          AnalysisService analysisService, ComparisonRanker comparisonRanker) throws IOException {
        this.catalogStore = Objects.requireNonNull(catalogStore, "catalogStore must not be null");
        this.analysisService = Objects.requireNonNull(analysisService, "analysisService must not be null");
        this.comparisonRanker = Objects.requireNonNull(comparisonRanker, "comparisonRanker must not be null");

        this.server = HttpServer.create(new InetSocketAddress(port), 0);
        this.executor = Executors.newFixedThreadPool(threads);
        this.server.setExecutor(executor);

        registerHandlers();
        LOG.info(() -> "Analysis server initialized on port " + getPort());
    }

    private void registerHandlers() {
        server.createContext("/health", this::handleHealth);
        server.createContext("/refresh", this::handleRefresh);
        server.createContext("/analyze", this::handleAnalyze);
        server.createContext("/compare", this::handleCompare);
        server.createContext("/categories", this::handleCategories);
        server.createContext(BRAND_PREFIX, this::handleBrand);
    }

    /**
     * Start the server.
     */
    public void start() {
        server.start();
        LOG.info("Analysis server started");
    }

    /**
     * Stop the server and its worker pool.
     */
    public void stop() {
        server.stop(1);
        executor.shutdownNow();
        LOG.info("Analysis server stopped");
    }

    /**
     * Bound port, useful when started on port 0.
     */
    public int getPort() {
        return server.getAddress().getPort();
    }

    /**
     * Health check endpoint.
     * GET /health
     */
    private void handleHealth(HttpExchange exchange) throws IOException {
        if (!requireMethod(exchange, "GET")) {
            return;
        }
        Catalog catalog = catalogStore.snapshot();
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", "healthy");
        body.put("brands", catalog.listBrands().size());
        body.put("categories", catalog.listCategories().size());
        sendJson(exchange, 200, body);
    }

    /**
     * Reload the catalog from its source.
     * POST /refresh
     */
    private void handleRefresh(HttpExchange exchange) throws IOException {
        if (!requireMethod(exchange, "POST")) {
            return;
        }
        LOG.info("Received refresh request");
        try {
            Catalog catalog = catalogStore.reload();
            Map<String, Object> body = new LinkedHashMap<>();
            body.put("status", "refreshed");
            body.put("brands", catalog.listBrands().size());
            body.put("categories", catalog.listCategories().size());
            sendJson(exchange, 200, body);
        } catch (CatalogLoadException e) {
            sendJson(exchange, 500, new ErrorDto("refresh failed: " + e.getMessage(), null));
        }
    }

    /**
     * Analyze one item.
     * POST /analyze
     */
    private void handleAnalyze(HttpExchange exchange) throws IOException {
        if (!requireMethod(exchange, "POST")) {
            return;
        }
        AnalyzeRequestDto request = readBody(exchange, AnalyzeRequestDto.class);
        if (request == null) {
            return;
        }
        try {
            AnalysisResult result = analysisService.analyze(request.toInput());
            sendJson(exchange, 200, AnalysisResultDto.from(result));
        } catch (AnalysisException e) {
            sendJson(exchange, 400, new ErrorDto(e.getMessage(), e.getErrorKind().name()));
        } catch (RuntimeException e) {
            LOG.log(Level.SEVERE, "Analysis failed", e);
            sendJson(exchange, 500, new ErrorDto("analysis failed", null));
        }
    }

    /**
     * Compare brands for one item type and price.
     * POST /compare
     */
    private void handleCompare(HttpExchange exchange) throws IOException {
        if (!requireMethod(exchange, "POST")) {
            return;
        }
        CompareRequestDto request = readBody(exchange, CompareRequestDto.class);
        if (request == null) {
            return;
        }
        if (request.getBrands() == null || request.getBrands().isEmpty()) {
            sendJson(exchange, 400, new ErrorDto("at least one brand is required", null));
            return;
        }
        try {
            ComparisonResult result = comparisonRanker.compare(
                    request.getItemType(), request.getPriceText(), request.getBrands());
            sendJson(exchange, 200, ComparisonResultDto.from(result));
        } catch (AllComparisonsFailedException e) {
            sendJson(exchange, 422, new ErrorDto(e.getMessage(), e.getErrorKind().name(),
                    ComparisonResultDto.failures(e.getFailures())));
        } catch (RuntimeException e) {
            LOG.log(Level.SEVERE, "Comparison failed", e);
            sendJson(exchange, 500, new ErrorDto("comparison failed", null));
        }
    }

    /**
     * List supported categories.
     * GET /categories
     */
    private void handleCategories(HttpExchange exchange) throws IOException {
        if (!requireMethod(exchange, "GET")) {
            return;
        }
        sendJson(exchange, 200, CategoryListDto.from(analysisService.categories()));
    }

    /**
     * Brand profile lookup.
     * GET /brand/{name}
     */
    private void handleBrand(HttpExchange exchange) throws IOException {
        if (!requireMethod(exchange, "GET")) {
            return;
        }
        String name = extractBrandName(exchange.getRequestURI().getPath());
        if (name == null) {
            sendJson(exchange, 400, new ErrorDto("missing brand name", null));
            return;
        }
        Optional<BrandProfile> profile = analysisService.brandProfile(name);
        if (profile.isPresent()) {
            sendJson(exchange, 200, BrandProfileDto.from(profile.get()));
        } else {
            sendJson(exchange, 404, new ErrorDto("Brand '" + name + "' not found", null));
        }
    }

    /**
     * Extract brand name from path like /brand/{name}
     */
    private String extractBrandName(String path) {
        if (path == null || !path.startsWith(BRAND_PREFIX)) {
            return null;
        }
        String name = path.substring(BRAND_PREFIX.length());
        if (name.endsWith("/")) {
            name = name.substring(0, name.length() - 1);
        }
        return name.trim().isEmpty() ? null : name;
    }

    private boolean requireMethod(HttpExchange exchange, String method) throws IOException {
        if (method.equals(exchange.getRequestMethod())) {
            return true;
        }
        sendJson(exchange, 405, new ErrorDto("method not allowed", null));
        return false;
    }

    /**
     * Parse the request body, answering 400 and returning null if it is not valid JSON.
     */
    private <T> T readBody(HttpExchange exchange, Class<T> type) throws IOException {
        try (InputStream in = exchange.getRequestBody()) {
            T body = mapper.readValue(in, type);
            if (body == null) {
                sendJson(exchange, 400, new ErrorDto("request body is required", null));
            }
            return body;
        } catch (JsonProcessingException e) {
            LOG.fine(() -> "Rejected malformed body: " + e.getOriginalMessage());
            sendJson(exchange, 400, new ErrorDto("malformed JSON body", null));
            return null;
        }
    }

    /**
     * Send a JSON response.
     */
    private void sendJson(HttpExchange exchange, int statusCode, Object body) throws IOException {
        byte[] bytes = mapper.writeValueAsBytes(body);
        exchange.getResponseHeaders().set("Content-Type", "application/json");
        exchange.sendResponseHeaders(statusCode, bytes.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(bytes);
        }
    }
}
