package org.cleanseam.engine;

import org.cleanseam.engine.catalog.CatalogLoader;
import org.cleanseam.engine.catalog.CatalogSource;
import org.cleanseam.engine.catalog.ReloadableCatalogStore;
import org.cleanseam.engine.config.EngineConfig;
import org.cleanseam.engine.domain.service.AnalysisService;
import org.cleanseam.engine.domain.service.AnalysisServiceImpl;
import org.cleanseam.engine.domain.service.ComparisonRanker;
import org.cleanseam.engine.domain.service.RequestValidator;
import org.cleanseam.engine.domain.service.ScoringServiceImpl;
import org.cleanseam.engine.domain.service.WearEstimator;
import org.cleanseam.engine.http.AnalysisServer;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.logging.FileHandler;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.logging.SimpleFormatter;

/**
 * Main entry point for the CleanSeam engine.
 *
 * Loads the brand and category catalog, wires the scoring pipeline and serves
 * quality and cost-per-wear analysis over HTTP. A catalog that fails to load
 * stops startup.
 */
public final class Main {

    private static final Logger LOG = Logger.getLogger(Main.class.getName());

    public static void main(String[] args) {
        try {
            new Main().run();
        } catch (Exception e) {
            LOG.log(Level.SEVERE, "Engine startup failed", e);
            System.exit(1);
        }
    }

    private void run() throws Exception {
        LOG.info("=== CleanSeam Engine ===");

        // Load configuration
        EngineConfig config = EngineConfig.fromEnvironment();
        LOG.info(() -> "Configuration: " + config);

        // Configure logging
        configureLogging(config);

        // Load catalog
        CatalogLoader loader = new CatalogLoader();
        CatalogSource source = config.hasCatalogPath()
                ? loader.fileSource(Paths.get(config.getCatalogPath()))
                : loader.classpathSource(CatalogLoader.DEFAULT_RESOURCE);
        ReloadableCatalogStore catalogStore = new ReloadableCatalogStore(source);

        // Create services
        AnalysisService analysisService = new AnalysisServiceImpl(
                catalogStore, new RequestValidator(), new ScoringServiceImpl(), new WearEstimator());
        ComparisonRanker comparisonRanker = new ComparisonRanker(analysisService);

        // Start HTTP server
        AnalysisServer server = new AnalysisServer(
                config.getPort(), config.getHttpThreads(), catalogStore, analysisService, comparisonRanker);
        server.start();

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            LOG.info("Shutting down engine...");
            server.stop();
            LOG.info("Engine shutdown complete");
        }));

        LOG.info("=== CleanSeam Engine started successfully ===");
        LOG.info("Endpoints:");
        LOG.info(() -> "  - Analyze: POST http://localhost:" + server.getPort() + "/analyze");
        LOG.info(() -> "  - Compare: POST http://localhost:" + server.getPort() + "/compare");
        LOG.info(() -> "  - Brand: GET http://localhost:" + server.getPort() + "/brand/{name}");
        LOG.info(() -> "  - Categories: GET http://localhost:" + server.getPort() + "/categories");
        LOG.info(() -> "  - Refresh: POST http://localhost:" + server.getPort() + "/refresh");

        // Keep main thread alive
        Thread.currentThread().join();
    }

    /**
     * Configure file logging if enabled.
     */
    private void configureLogging(EngineConfig config) {
        Logger root = Logger.getLogger("");
        root.setLevel(Level.INFO);

        if (!config.isFileLoggingEnabled()) {
            return;
        }

        Path target = Paths.get(config.getLogFilePath()).toAbsolutePath();

        try {
            Files.createDirectories(target.getParent());
            FileHandler handler = new FileHandler(target.toString(), 5 * 1024 * 1024, 3, true);
            handler.setFormatter(new SimpleFormatter());
            root.addHandler(handler);
            LOG.info(() -> "File logging enabled: " + target);
        } catch (IOException e) {
            LOG.log(Level.WARNING, "Failed to setup file logging", e);
        }
    }
}
