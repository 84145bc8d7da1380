package de.mirkosertic.filevault.mcp;

import de.mirkosertic.filevault.MetadataDocuments;
import de.mirkosertic.filevault.MetadataStore;
import de.mirkosertic.filevault.config.BuildInfo;
import de.mirkosertic.filevault.indexsync.IndexSyncException;
import de.mirkosertic.filevault.indexsync.SyncRequest;
import de.mirkosertic.filevault.mcp.dto.IndexStatsResponse;
import de.mirkosertic.filevault.mcp.dto.RebuildIndexRequest;
import de.mirkosertic.filevault.mcp.dto.RebuildIndexResponse;
import de.mirkosertic.filevault.mcp.dto.RebuildStatusResponse;
import de.mirkosertic.filevault.mcp.dto.SimpleMessageResponse;
import de.mirkosertic.filevault.mcp.dto.TaskIdRequest;
import de.mirkosertic.filevault.task.IndexRebuildTask;
import de.mirkosertic.filevault.task.TaskResult;
import io.modelcontextprotocol.server.McpServerFeatures;
import io.modelcontextprotocol.spec.McpSchema;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * MCP tools for storage index administration.
 */
public class StorageAdminTools {

    private static final Logger logger = LoggerFactory.getLogger(StorageAdminTools.class);

    private final IndexRebuildTask rebuildTask;
    private final MetadataStore store;

    public StorageAdminTools(final IndexRebuildTask rebuildTask, final MetadataStore store) {
        this.rebuildTask = rebuildTask;
        this.store = store;
    }

    /**
     * Returns all MCP tool specifications for registration with the MCP server.
     */
    public List<McpServerFeatures.SyncToolSpecification> getToolSpecifications() {
        final List<McpServerFeatures.SyncToolSpecification> tools = new ArrayList<>();

        tools.add(McpServerFeatures.SyncToolSpecification.builder()
                .tool(McpSchema.Tool.builder()
                        .name("rebuildIndex")
                        .description("Reconcile the metadata index with the files on disk. The filesystem always wins. "
                                + "Runs in the background; use getRebuildStatus to fetch the result. "
                                + "The destructive modes clean and full require force=true.")
                        .inputSchema(SchemaGenerator.generateSchema(RebuildIndexRequest.class))
                        .build())
                .callHandler((exchange, request) -> rebuildIndex(request.arguments()))
                .build());

        tools.add(McpServerFeatures.SyncToolSpecification.builder()
                .tool(McpSchema.Tool.builder()
                        .name("getRebuildStatus")
                        .description("Status and statistics of an index rebuild task")
                        .inputSchema(SchemaGenerator.generateSchema(TaskIdRequest.class))
                        .build())
                .callHandler((exchange, request) -> getRebuildStatus(request.arguments()))
                .build());

        tools.add(McpServerFeatures.SyncToolSpecification.builder()
                .tool(McpSchema.Tool.builder()
                        .name("cancelRebuild")
                        .description("Cancel a running index rebuild. The task stops between items and keeps its partial statistics.")
                        .inputSchema(SchemaGenerator.generateSchema(TaskIdRequest.class))
                        .build())
                .callHandler((exchange, request) -> cancelRebuild(request.arguments()))
                .build());

        tools.add(McpServerFeatures.SyncToolSpecification.builder()
                .tool(McpSchema.Tool.builder()
                        .name("getIndexStats")
                        .description("Document counts, schema version and build information of the metadata index")
                        .inputSchema(SchemaGenerator.emptySchema())
                        .build())
                .callHandler((exchange, request) -> getIndexStats())
                .build());

        return tools;
    }

    McpSchema.CallToolResult rebuildIndex(final Map<String, Object> args) {
        final SyncRequest request;
        try {
            request = RebuildIndexRequest.fromMap(args).toSyncRequest();
        } catch (final IndexSyncException e) {
            logger.info("Rebuild request rejected: {}", e.getMessage());
            return ToolResultHelper.createResult(
                    RebuildIndexResponse.rejected(e.getCode().name(), e.getMessage(), e.getAllowed()));
        } catch (final ClassCastException | NumberFormatException e) {
            return ToolResultHelper.createErrorResult("INVALID_REQUEST", "Invalid arguments: " + e.getMessage());
        }

        try {
            final TaskResult task = rebuildTask.submit(request);
            logger.info("Rebuild task {} started: mode={}, scope={}", task.taskId(), request.mode(),
                    request.describeScope());
            return ToolResultHelper.createResult(RebuildIndexResponse.accepted(task));
        } catch (final IndexSyncException e) {
            return ToolResultHelper.createResult(
                    RebuildIndexResponse.rejected(e.getCode().name(), e.getMessage(), e.getAllowed()));
        }
    }

    McpSchema.CallToolResult getRebuildStatus(final Map<String, Object> args) {
        final TaskIdRequest request = TaskIdRequest.fromMap(args);
        final Optional<TaskResult> task = request.taskId() == null
                ? rebuildTask.getLastTask()
                : rebuildTask.getTask(request.taskId());

        if (task.isPresent()) {
            return ToolResultHelper.createResult(RebuildStatusResponse.of(task.get()));
        }
        if (request.taskId() == null) {
            return ToolResultHelper.createResult(RebuildStatusResponse.idle());
        }
        return ToolResultHelper.createResult(RebuildStatusResponse.error("Unknown task: " + request.taskId()));
    }

    McpSchema.CallToolResult cancelRebuild(final Map<String, Object> args) {
        final TaskIdRequest request = TaskIdRequest.fromMap(args);
        if (request.taskId() == null) {
            final int cancelled = rebuildTask.cancelAll();
            return ToolResultHelper.createResult(cancelled > 0
                    ? SimpleMessageResponse.success("Cancellation requested for " + cancelled + " task(s)")
                    : SimpleMessageResponse.error("No rebuild is running"));
        }
        return ToolResultHelper.createResult(rebuildTask.cancel(request.taskId())
                ? SimpleMessageResponse.success("Cancellation requested for task " + request.taskId())
                : SimpleMessageResponse.error("Task " + request.taskId() + " is not running"));
    }

    McpSchema.CallToolResult getIndexStats() {
        logger.info("Index stats request");

        try {
            final IndexStatsResponse response = new IndexStatsResponse(
                    true,
                    store.getDocumentCount(),
                    store.countStoredFiles(),
                    store.countShareLinks(),
                    store.listAccounts().size(),
                    store.listOrganizations().size(),
                    store.getIndexPath(),
                    MetadataDocuments.SCHEMA_VERSION,
                    store.isSchemaUpgradeRequired(),
                    BuildInfo.getVersion(),
                    BuildInfo.getBuildTimestamp(),
                    rebuildTask.getStatus().name(),
                    null);
            logger.info("Index stats: {} documents", response.documentCount());
            return ToolResultHelper.createResult(response);

        } catch (final IOException e) {
            logger.error("Error getting index stats", e);
            return ToolResultHelper.createResult(IndexStatsResponse.error("Error getting index stats: " + e.getMessage()));
        }
    }
}
