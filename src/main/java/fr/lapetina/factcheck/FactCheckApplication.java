package fr.lapetina.factcheck;

import fr.lapetina.factcheck.api.HttpServer;
import fr.lapetina.factcheck.infrastructure.config.FactCheckConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;

/**
 * Main entry point for the fact-check service.
 */
public class FactCheckApplication implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(FactCheckApplication.class);

    private final FactCheckFactory factory;
    private final HttpServer httpServer;
    private final CountDownLatch shutdownLatch = new CountDownLatch(1);

    public FactCheckApplication(String configPath) throws Exception {
        this(FactCheckFactory.create(configPath));
    }

    public FactCheckApplication(FactCheckFactory factory) throws Exception {
        log.info("Starting fact-check service...");

        this.factory = factory.start();
        FactCheckConfig config = factory.getConfig();

        // Create HTTP server
        this.httpServer = new HttpServer(
                config.getServer(),
                factory.getOrchestrator(),
                factory.getModelClient(),
                factory.getModelQueue(),
                factory.getSearchQueue(),
                factory.getMetricsRegistry(),
                factory.getConfigLoader(),
                Duration.ofMillis(config.getCheck().getRequestTimeoutMs()),
                config.getCheck().getMaxTextLength()
        );

        log.info("Fact-check service initialized");
    }

    public void start() {
        httpServer.start();
        log.info("Fact-check service started on port {}", httpServer.getPort());
    }

    public int getPort() {
        return httpServer.getPort();
    }

    public void awaitShutdown() throws InterruptedException {
        shutdownLatch.await();
    }

    public void requestShutdown() {
        shutdownLatch.countDown();
    }

    public FactCheckFactory getFactory() {
        return factory;
    }

    @Override
    public void close() {
        log.info("Shutting down fact-check service...");

        try {
            httpServer.close();
        } catch (Exception e) {
            log.warn("Error closing HTTP server", e);
        }

        try {
            factory.close();
        } catch (Exception e) {
            log.warn("Error closing factory", e);
        }

        log.info("Fact-check service shut down");
    }

    public static void main(String[] args) {
        String configPath = args.length > 0 ? args[0] : "factcheck.yaml";

        try {
            FactCheckApplication app = new FactCheckApplication(configPath);

            Runtime.getRuntime().addShutdownHook(new Thread(() -> {
                app.requestShutdown();
                app.close();
            }));

            app.start();
            app.awaitShutdown();

        } catch (Exception e) {
            log.error("Failed to start fact-check service", e);
            System.exit(1);
        }
    }
}
