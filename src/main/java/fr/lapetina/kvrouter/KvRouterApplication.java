package fr.lapetina.kvrouter;

import fr.lapetina.kvrouter.api.HttpServer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.concurrent.CountDownLatch;

/**
 * Main entry point for the KV-cache-aware router.
 */
public class KvRouterApplication implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(KvRouterApplication.class);

    private final RouterFactory factory;
    private final HttpServer httpServer;
    private final CountDownLatch shutdownLatch = new CountDownLatch(1);

    public KvRouterApplication(String configPath) throws IOException {
        this(RouterFactory.create(configPath));
    }

    KvRouterApplication(RouterFactory factory) throws IOException {
        log.info("Starting KV router...");

        this.factory = factory.start();
        try {
            this.httpServer = new HttpServer(
                    factory.getConfig().getServer(),
                    factory.getPipeline(),
                    factory.getServerRegistry(),
                    factory.getMetricsRegistry(),
                    factory.getConfigLoader(),
                    factory::createPicker
            );
        } catch (IOException e) {
            // Port taken or unbindable: release the pipeline threads before giving up
            factory.close();
            throw e;
        }

        log.info("KV router initialized");
    }

    public void start() {
        httpServer.start();
        log.info("KV router started on port {}", httpServer.getPort());
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

    @Override
    public void close() {
        log.info("Shutting down KV router...");

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

        log.info("KV router shut down");
    }

    public static void main(String[] args) {
        String configPath = args.length > 0 ? args[0] : "config.yaml";

        try {
            KvRouterApplication app = new KvRouterApplication(configPath);

            Runtime.getRuntime().addShutdownHook(new Thread(() -> {
                app.requestShutdown();
                app.close();
            }));

            app.start();
            app.awaitShutdown();

        } catch (Exception e) {
            log.error("Failed to start KV router", e);
            System.exit(1);
        }
    }
}
