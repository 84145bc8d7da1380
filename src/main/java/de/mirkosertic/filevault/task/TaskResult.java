package de.mirkosertic.filevault.task;

import de.mirkosertic.filevault.indexsync.IndexSyncStats;
import de.mirkosertic.filevault.indexsync.SyncRequest;
import org.jspecify.annotations.Nullable;

import java.util.List;

/**
 * Snapshot of one index rebuild task.
 *
 * @param taskId     UUID assigned when the task was accepted
 * @param status     current status
 * @param request    what the task was asked to do
 * @param stats      engine result; {@code null} while running or when the task failed
 * @param errors     task-level failures (not the per-item errors, which live in {@code stats})
 * @param startedAt  epoch millis
 * @param finishedAt epoch millis, {@code null} while running
 */
public record TaskResult(
        String taskId,
        TaskStatus status,
        SyncRequest request,
        @Nullable IndexSyncStats stats,
        List<String> errors,
        long startedAt,
        @Nullable Long finishedAt
) {

    public TaskResult {
        errors = List.copyOf(errors);
    }

    static TaskResult running(final String taskId, final SyncRequest request) {
        return new TaskResult(taskId, TaskStatus.RUNNING, request, null, List.of(), System.currentTimeMillis(), null);
    }

    TaskResult finished(final TaskStatus finalStatus, @Nullable final IndexSyncStats result,
                        final List<String> taskErrors) {
        return new TaskResult(taskId, finalStatus, request, result, taskErrors, startedAt, System.currentTimeMillis());
    }
}
