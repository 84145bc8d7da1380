package de.mirkosertic.filevault;

import com.fasterxml.jackson.databind.ObjectMapper;
import de.mirkosertic.filevault.cli.FileVaultCommand;
import de.mirkosertic.filevault.config.ApplicationConfig;
import de.mirkosertic.filevault.config.BuildInfo;
import de.mirkosertic.filevault.http.AdminHttpServer;
import de.mirkosertic.filevault.indexsync.IndexSyncService;
import de.mirkosertic.filevault.mcp.StorageAdminTools;
import de.mirkosertic.filevault.task.IndexRebuildTask;
import de.mirkosertic.filevault.task.StartupIndexCheck;
import io.modelcontextprotocol.json.jackson.JacksonMcpJsonMapper;
import io.modelcontextprotocol.server.McpServer;
import io.modelcontextprotocol.server.McpSyncServer;
import io.modelcontextprotocol.server.transport.StdioServerTransportProvider;
import io.modelcontextprotocol.spec.McpSchema;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;

/**
 * Wires the metadata store, the reconciliation engine and its invocation surfaces.
 * <p>
 * {@code serve} runs the admin HTTP endpoint, {@code mcp} the MCP stdio server; both run the
 * startup audit and the optional scheduled rebuild. {@code rebuild-index} only needs
 * {@link #init()} and {@link #getRebuildTask()}.
 */
public class FileVaultApplication {

    private static final Logger logger = LoggerFactory.getLogger(FileVaultApplication.class);

    private final ApplicationConfig config;
    private final MetadataStore store;
    private final IndexSyncService syncService;
    private final IndexRebuildTask rebuildTask;
    private final StartupIndexCheck startupCheck;
    private AdminHttpServer httpServer;
    private McpSyncServer mcpServer;

    public FileVaultApplication(final ApplicationConfig config) {
        this.config = config;

        // Initialize services in dependency order
        this.store = new MetadataStore(config.getIndexPath(), config.getNrtRefreshIntervalMs());
        this.syncService = new IndexSyncService(store, config);
        this.rebuildTask = new IndexRebuildTask(syncService);
        this.startupCheck = new StartupIndexCheck(rebuildTask, store, config.isStartupAudit());
    }

    /**
     * Open the metadata store.
     */
    public void init() throws IOException {
        logger.info("Initializing {}...", BuildInfo.describe());
        store.init();
        logger.info("Storage root: {}, shared root: {}", config.getStorageRoot(), config.getSharedRoot());
    }

    public IndexRebuildTask getRebuildTask() {
        return rebuildTask;
    }

    public MetadataStore getStore() {
        return store;
    }

    /**
     * Start the admin HTTP server and block until the process is terminated.
     */
    public void startHttp() throws IOException {
        httpServer = new AdminHttpServer(config.getHttpHost(), config.getHttpPort(), store, rebuildTask);
        httpServer.start();
        startBackgroundWork();

        Runtime.getRuntime().addShutdownHook(new Thread(this::shutdown, "shutdown-hook"));
        blockMainThread();
    }

    /**
     * Start the MCP server on stdio and block until the client goes away.
     */
    public void startMcp() {
        logger.info("Starting MCP server with STDIO transport...");

        final McpSchema.ServerCapabilities capabilities = McpSchema.ServerCapabilities.builder()
                .tools(true)
                .build();

        final McpSchema.Implementation serverInfo = new McpSchema.Implementation(
                "FileVault Storage Admin",
                BuildInfo.getVersion()
        );

        final JacksonMcpJsonMapper jsonMapper = new JacksonMcpJsonMapper(new ObjectMapper());
        final StdioServerTransportProvider transportProvider = new StdioServerTransportProvider(jsonMapper);

        mcpServer = McpServer.sync(transportProvider)
                .serverInfo(serverInfo)
                .capabilities(capabilities)
                .tools(new StorageAdminTools(rebuildTask, store).getToolSpecifications())
                .build();

        logger.info("MCP server started successfully");
        startBackgroundWork();

        // Stop together with the client that spawned us
        ProcessHandle.current().parent().ifPresent(parent -> {
            parent.onExit().thenRun(() -> {
                logger.info("Parent process terminated, shutting down...");
                shutdown();
                System.exit(0);
            });
            logger.info("Monitoring parent process PID: {}", parent.pid());
        });

        Runtime.getRuntime().addShutdownHook(new Thread(this::shutdown, "shutdown-hook"));
        blockMainThread();
    }

    private void startBackgroundWork() {
        startupCheck.start();
        rebuildTask.startSchedule(config);
    }

    private void blockMainThread() {
        try {
            Thread.currentThread().join();
        } catch (final InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.info("Main thread interrupted, shutting down...");
        }
    }

    /**
     * Shutdown all services gracefully. Safe to call more than once.
     */
    public synchronized void shutdown() {
        logger.info("Shutting down FileVault...");

        // Shutdown in reverse order of initialization
        try {
            if (mcpServer != null) {
                mcpServer.close();
                mcpServer = null;
            }
        } catch (final Exception e) {
            logger.error("Error closing MCP server", e);
        }

        try {
            if (httpServer != null) {
                httpServer.stop();
                httpServer = null;
            }
        } catch (final Exception e) {
            logger.error("Error stopping HTTP server", e);
        }

        try {
            rebuildTask.shutdown();
        } catch (final Exception e) {
            logger.error("Error shutting down rebuild task", e);
        }

        try {
            syncService.shutdown();
        } catch (final Exception e) {
            logger.error("Error shutting down index sync", e);
        }

        try {
            store.close();
        } catch (final Exception e) {
            logger.error("Error closing metadata store", e);
        }

        logger.info("FileVault shutdown complete");
    }

    public static void main(final String[] args) {
        System.exit(FileVaultCommand.commandLine().execute(args));
    }
}
