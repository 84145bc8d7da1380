package de.mirkosertic.filevault.http;

import de.mirkosertic.filevault.indexsync.IndexSyncStats;
import de.mirkosertic.filevault.task.TaskResult;

import java.util.List;

/**
 * Body of a successful rebuild request.
 */
public record RebuildResponse(
        String taskId,
        String status,
        IndexSyncStats result,
        List<String> errors
) {
    public static RebuildResponse from(final TaskResult task) {
        return new RebuildResponse(task.taskId(), task.status().name(), task.stats(), task.errors());
    }
}
