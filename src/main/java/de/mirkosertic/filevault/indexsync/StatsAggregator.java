package de.mirkosertic.filevault.indexsync;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Thread-safe, purely additive collector for one run. Every action moves exactly one counter;
 * every failure appends one error entry.
 */
public class StatsAggregator {

    private final AtomicInteger usersScanned = new AtomicInteger();
    private final AtomicInteger filesOnDisk = new AtomicInteger();
    private final AtomicInteger filesInIndex = new AtomicInteger();
    private final AtomicInteger missingInIndex = new AtomicInteger();
    private final AtomicInteger staleInIndex = new AtomicInteger();
    private final AtomicInteger orphanedInIndex = new AtomicInteger();
    private final AtomicInteger recordsCreated = new AtomicInteger();
    private final AtomicInteger recordsUpdated = new AtomicInteger();
    private final AtomicInteger recordsDeleted = new AtomicInteger();
    private final AtomicInteger recordsSkipped = new AtomicInteger();
    private final AtomicInteger dependentsDeleted = new AtomicInteger();
    private final List<IndexSyncError> errors = new ArrayList<>();
    private final AtomicBoolean cancelled = new AtomicBoolean();

    public void ownerScanned() {
        usersScanned.incrementAndGet();
    }

    public void observed(final int onDisk, final int inIndex, final IndexDiff diff) {
        filesOnDisk.addAndGet(onDisk);
        filesInIndex.addAndGet(inIndex);
        missingInIndex.addAndGet(diff.missing().size());
        staleInIndex.addAndGet(diff.stale().size());
        orphanedInIndex.addAndGet(diff.orphaned().size());
    }

    public void created() {
        recordsCreated.incrementAndGet();
    }

    public void updated() {
        recordsUpdated.incrementAndGet();
    }

    public void deleted(final int dependents) {
        recordsDeleted.incrementAndGet();
        dependentsDeleted.addAndGet(dependents);
    }

    public void skipped() {
        recordsSkipped.incrementAndGet();
    }

    public void error(final IndexSyncError error) {
        synchronized (errors) {
            errors.add(error);
        }
    }

    public void error(final String path, final SyncErrorCode code, final String message) {
        error(new IndexSyncError(path, code, message));
    }

    public void markCancelled() {
        cancelled.set(true);
    }

    public IndexSyncStats snapshot(final long durationMs) {
        final List<IndexSyncError> errorsCopy;
        synchronized (errors) {
            errorsCopy = List.copyOf(errors);
        }
        return new IndexSyncStats(
                usersScanned.get(),
                filesOnDisk.get(),
                filesInIndex.get(),
                missingInIndex.get(),
                staleInIndex.get(),
                orphanedInIndex.get(),
                recordsCreated.get(),
                recordsUpdated.get(),
                recordsDeleted.get(),
                recordsSkipped.get(),
                dependentsDeleted.get(),
                errorsCopy,
                cancelled.get(),
                durationMs);
    }
}
