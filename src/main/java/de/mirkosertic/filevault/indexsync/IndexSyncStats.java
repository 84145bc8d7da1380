package de.mirkosertic.filevault.indexsync;

import java.util.List;

/**
 * Immutable result of one reconciliation run. Produced fresh per run, never persisted.
 * <p>
 * Discrepancy counters ({@code missingInIndex}, {@code staleInIndex}, {@code orphanedInIndex})
 * describe what the scan found. Action counters describe what was changed, or in a dry run,
 * what would have been changed.
 */
public record IndexSyncStats(
        int usersScanned,
        int filesOnDisk,
        int filesInIndex,
        int missingInIndex,
        int staleInIndex,
        int orphanedInIndex,
        int recordsCreated,
        int recordsUpdated,
        int recordsDeleted,
        int recordsSkipped,
        int dependentsDeleted,
        List<IndexSyncError> errors,
        boolean cancelled,
        long durationMs
) {

    public IndexSyncStats {
        errors = List.copyOf(errors);
    }

    public static IndexSyncStats empty() {
        return new IndexSyncStats(0, 0, 0, 0, 0, 0, 0, 0, 0, 0, 0, List.of(), false, 0L);
    }

    /**
     * True when the scan found no discrepancy and nothing failed.
     */
    public boolean inSync() {
        return missingInIndex == 0 && staleInIndex == 0 && orphanedInIndex == 0 && errors.isEmpty();
    }
}
