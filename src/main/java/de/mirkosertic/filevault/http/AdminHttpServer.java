package de.mirkosertic.filevault.http;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.sun.net.httpserver.HttpServer;
import de.mirkosertic.filevault.MetadataStore;
import de.mirkosertic.filevault.task.IndexRebuildTask;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Administrative HTTP endpoint on the JDK HTTP server.
 */
public class AdminHttpServer {

    private static final Logger logger = LoggerFactory.getLogger(AdminHttpServer.class);

    public static final String REBUILD_PATH = "/api/v1/admin/index/rebuild/";

    private final String host;
    private final int port;
    private final IndexRebuildHandler rebuildHandler;
    private HttpServer server;
    private ExecutorService executor;

    public AdminHttpServer(final String host, final int port, final MetadataStore store,
                           final IndexRebuildTask rebuildTask) {
        this.host = host;
        this.port = port;
        this.rebuildHandler = new IndexRebuildHandler(new ApiKeyAuthenticator(store), rebuildTask, createObjectMapper());
    }

    static ObjectMapper createObjectMapper() {
        return new ObjectMapper()
                .setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE)
                .setSerializationInclusion(JsonInclude.Include.NON_NULL);
    }

    public void start() throws IOException {
        server = HttpServer.create(new InetSocketAddress(host, port), 0);
        server.createContext(REBUILD_PATH, rebuildHandler);

        final AtomicInteger threadCounter = new AtomicInteger(0);
        executor = Executors.newFixedThreadPool(4, r -> {
            final Thread thread = new Thread(r, "admin-http-" + threadCounter.getAndIncrement());
            thread.setDaemon(true);
            return thread;
        });
        server.setExecutor(executor);
        server.start();
        logger.info("Admin HTTP server listening on http://{}:{}{}", host, getPort(), REBUILD_PATH);
    }

    /**
     * Actual listening port; differs from the configured one when that was 0.
     */
    public int getPort() {
        return server != null ? server.getAddress().getPort() : port;
    }

    public void stop() {
        if (server != null) {
            server.stop(1);
            logger.info("Admin HTTP server stopped");
        }
        if (executor != null) {
            executor.shutdown();
            try {
                if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                    executor.shutdownNow();
                }
            } catch (final InterruptedException e) {
                executor.shutdownNow();
                Thread.currentThread().interrupt();
            }
        }
    }
}
