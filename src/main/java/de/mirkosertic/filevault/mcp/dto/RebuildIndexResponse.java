package de.mirkosertic.filevault.mcp.dto;

import de.mirkosertic.filevault.task.TaskResult;

import java.util.List;

/**
 * Response DTO for the rebuildIndex tool. The rebuild runs in the background;
 * poll getRebuildStatus with the task id.
 */
public record RebuildIndexResponse(
        boolean success,
        String taskId,
        String status,
        String message,
        String errorCode,
        List<String> allowed,
        String error
) {
    public static RebuildIndexResponse accepted(final TaskResult task) {
        return new RebuildIndexResponse(true, task.taskId(), task.status().name(),
                "Index rebuild started in mode " + task.request().mode().value() + " for "
                        + task.request().describeScope() + (task.request().dryRun() ? " (dry run)" : ""),
                null, null, null);
    }

    public static RebuildIndexResponse rejected(final String errorCode, final String errorMessage,
                                                final List<String> allowed) {
        return new RebuildIndexResponse(false, null, null, null, errorCode,
                allowed.isEmpty() ? null : allowed, errorMessage);
    }
}
