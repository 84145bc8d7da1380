package de.mirkosertic.filevault.mcp;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import de.mirkosertic.filevault.indexsync.IndexSyncStats;
import de.mirkosertic.filevault.indexsync.StorageFixture;
import de.mirkosertic.filevault.indexsync.SyncMode;
import de.mirkosertic.filevault.indexsync.SyncRequest;
import de.mirkosertic.filevault.model.Account;
import de.mirkosertic.filevault.task.IndexRebuildTask;
import de.mirkosertic.filevault.task.TaskResult;
import de.mirkosertic.filevault.task.TaskStatus;
import io.modelcontextprotocol.server.McpServerFeatures;
import io.modelcontextprotocol.spec.McpSchema;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.ArgumentCaptor;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Tests for the MCP storage admin tools.
 */
@DisplayName("StorageAdminTools Tests")
class StorageAdminToolsTest {

    @TempDir
    Path tempDir;

    private final ObjectMapper objectMapper = new ObjectMapper();

    private StorageFixture fixture;
    private IndexRebuildTask rebuildTask;
    private StorageAdminTools tools;

    @BeforeEach
    void setUp() throws IOException {
        fixture = new StorageFixture(tempDir);
        rebuildTask = mock(IndexRebuildTask.class);
        tools = new StorageAdminTools(rebuildTask, fixture.store);
    }

    @AfterEach
    void tearDown() throws IOException {
        fixture.close();
    }

    private JsonNode body(final McpSchema.CallToolResult result) throws IOException {
        final McpSchema.TextContent content = (McpSchema.TextContent) result.content().get(0);
        return objectMapper.readTree(content.text());
    }

    private static TaskResult running(final SyncRequest request) {
        return new TaskResult("task-42", TaskStatus.RUNNING, request, null, List.of(), 1L, null);
    }

    @Test
    @DisplayName("All tools are registered with their schemas")
    void toolRegistration() {
        final List<McpServerFeatures.SyncToolSpecification> specifications = tools.getToolSpecifications();

        assertThat(specifications)
                .extracting(spec -> spec.tool().name())
                .containsExactly("rebuildIndex", "getRebuildStatus", "cancelRebuild", "getIndexStats");
        assertThat(specifications.get(0).tool().inputSchema().properties())
                .containsKeys("mode", "userId", "orgId", "shared", "dryRun", "force");
    }

    @Test
    @DisplayName("rebuildIndex submits a background task")
    void rebuildIndexSubmits() throws Exception {
        // Given
        when(rebuildTask.submit(any())).thenAnswer(invocation -> running(invocation.getArgument(0)));

        // When
        final McpSchema.CallToolResult result = tools.rebuildIndex(
                Map.of("mode", "full", "orgId", 7, "force", true));

        // Then
        final ArgumentCaptor<SyncRequest> captor = ArgumentCaptor.forClass(SyncRequest.class);
        verify(rebuildTask).submit(captor.capture());
        assertThat(captor.getValue()).isEqualTo(new SyncRequest(SyncMode.FULL, 7L, true, false, true));

        final JsonNode json = body(result);
        assertThat(result.isError()).isFalse();
        assertThat(json.path("success").asBoolean()).isTrue();
        assertThat(json.path("taskId").asText()).isEqualTo("task-42");
        assertThat(json.path("message").asText()).contains("organization 7");
    }

    @Test
    @DisplayName("rebuildIndex without arguments audits all users")
    void rebuildIndexDefaults() throws Exception {
        when(rebuildTask.submit(any())).thenAnswer(invocation -> running(invocation.getArgument(0)));

        tools.rebuildIndex(Map.of());

        verify(rebuildTask).submit(SyncRequest.audit());
    }

    @Test
    @DisplayName("rebuildIndex rejects an unknown mode with the allowed values")
    void rebuildIndexInvalidMode() throws Exception {
        final McpSchema.CallToolResult result = tools.rebuildIndex(Map.of("mode", "erase"));

        final JsonNode json = body(result);
        assertThat(result.isError()).isTrue();
        assertThat(json.path("errorCode").asText()).isEqualTo("INVALID_MODE");
        assertThat(json.path("allowed").size()).isEqualTo(4);
        verify(rebuildTask, never()).submit(any());
    }

    @Test
    @DisplayName("rebuildIndex reports FORCE_REQUIRED from the task")
    void rebuildIndexForceRequired() throws Exception {
        when(rebuildTask.submit(any())).thenAnswer(invocation -> {
            final SyncRequest request = invocation.getArgument(0);
            request.checkForce();
            return running(request);
        });

        final McpSchema.CallToolResult result = tools.rebuildIndex(Map.of("mode", "clean"));

        assertThat(result.isError()).isTrue();
        assertThat(body(result).path("errorCode").asText()).isEqualTo("FORCE_REQUIRED");
    }

    @Test
    @DisplayName("rebuildIndex rejects arguments of the wrong type")
    void rebuildIndexWrongTypes() throws Exception {
        final McpSchema.CallToolResult result = tools.rebuildIndex(Map.of("force", "yes"));

        assertThat(result.isError()).isTrue();
        assertThat(body(result).path("errorCode").asText()).isEqualTo("INVALID_REQUEST");
    }

    @Test
    @DisplayName("getRebuildStatus returns the finished task with its stats")
    void rebuildStatus() throws Exception {
        final IndexSyncStats stats = new IndexSyncStats(2, 5, 4, 1, 0, 0, 1, 0, 0, 0, 0, List.of(), false, 9L);
        final TaskResult done = new TaskResult("task-1", TaskStatus.SUCCESSFUL, SyncRequest.of("sync", 3L, false, false),
                stats, List.of(), 1L, 10L);
        when(rebuildTask.getTask("task-1")).thenReturn(Optional.of(done));

        final JsonNode json = body(tools.getRebuildStatus(Map.of("taskId", "task-1")));

        assertThat(json.path("status").asText()).isEqualTo("SUCCESSFUL");
        assertThat(json.path("mode").asText()).isEqualTo("sync");
        assertThat(json.path("scope").asText()).isEqualTo("user 3");
        assertThat(json.at("/stats/recordsCreated").asInt()).isEqualTo(1);
        assertThat(json.at("/stats/usersScanned").asInt()).isEqualTo(2);
    }

    @Test
    @DisplayName("getRebuildStatus without any task reports IDLE, an unknown id is an error")
    void rebuildStatusIdleAndUnknown() throws Exception {
        when(rebuildTask.getLastTask()).thenReturn(Optional.empty());
        when(rebuildTask.getTask("nope")).thenReturn(Optional.empty());

        assertThat(body(tools.getRebuildStatus(Map.of())).path("status").asText()).isEqualTo("IDLE");

        final McpSchema.CallToolResult unknown = tools.getRebuildStatus(Map.of("taskId", "nope"));
        assertThat(unknown.isError()).isTrue();
        assertThat(body(unknown).path("error").asText()).contains("nope");
    }

    @Test
    @DisplayName("cancelRebuild forwards to the task")
    void cancelRebuild() throws Exception {
        when(rebuildTask.cancel("task-1")).thenReturn(true);
        when(rebuildTask.cancelAll()).thenReturn(0);

        assertThat(tools.cancelRebuild(Map.of("taskId", "task-1")).isError()).isFalse();
        assertThat(tools.cancelRebuild(Map.of()).isError()).as("nothing running").isTrue();
    }

    @Test
    @DisplayName("getIndexStats counts the records by type")
    void indexStats() throws Exception {
        // Given
        final Account user = fixture.createUser(1);
        fixture.createOrganization(2);
        fixture.writeFile(user, "a.txt", 1);
        fixture.share(user.owner(), "a.txt", "tok");
        when(rebuildTask.getStatus()).thenReturn(TaskStatus.IDLE);

        // When
        final JsonNode json = body(tools.getIndexStats());

        // Then
        assertThat(json.path("success").asBoolean()).isTrue();
        assertThat(json.path("accountCount").asInt()).isEqualTo(1);
        assertThat(json.path("organizationCount").asInt()).isEqualTo(1);
        assertThat(json.path("shareLinkCount").asInt()).isEqualTo(1);
        assertThat(json.path("storedFileCount").asInt()).isZero();
        assertThat(json.path("schemaUpgradeRequired").asBoolean()).isFalse();
        assertThat(json.path("lastRebuildStatus").asText()).isEqualTo("IDLE");
    }
}
