package de.mirkosertic.filevault.mcp.dto;

import de.mirkosertic.filevault.indexsync.IndexSyncStats;
import de.mirkosertic.filevault.task.TaskResult;
import de.mirkosertic.filevault.task.TaskStatus;

import java.util.List;

/**
 * Response DTO for the getRebuildStatus tool.
 */
public record RebuildStatusResponse(
        boolean success,
        String taskId,
        String status,
        String mode,
        String scope,
        Boolean dryRun,
        IndexSyncStats stats,
        List<String> errors,
        Long startedAt,
        Long finishedAt,
        String error
) {
    public static RebuildStatusResponse of(final TaskResult task) {
        return new RebuildStatusResponse(true, task.taskId(), task.status().name(),
                task.request().mode().value(), task.request().describeScope(), task.request().dryRun(),
                task.stats(), task.errors(), task.startedAt(), task.finishedAt(), null);
    }

    public static RebuildStatusResponse idle() {
        return new RebuildStatusResponse(true, null, TaskStatus.IDLE.name(), null, null, null, null,
                null, null, null, null);
    }

    public static RebuildStatusResponse error(final String errorMessage) {
        return new RebuildStatusResponse(false, null, null, null, null, null, null, null, null, null, errorMessage);
    }
}
