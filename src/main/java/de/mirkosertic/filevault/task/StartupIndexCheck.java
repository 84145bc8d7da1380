package de.mirkosertic.filevault.task;

import de.mirkosertic.filevault.MetadataStore;
import de.mirkosertic.filevault.indexsync.IndexSyncStats;
import de.mirkosertic.filevault.indexsync.SyncRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * Audits the index against the storage tree when the process starts.
 * <p>
 * Runs in {@code audit} mode without force, so it never changes anything. Failures are logged
 * as warnings and never prevent startup.
 */
public class StartupIndexCheck {

    private static final Logger logger = LoggerFactory.getLogger(StartupIndexCheck.class);

    private final IndexRebuildTask rebuildTask;
    private final MetadataStore store;
    private final boolean enabled;

    public StartupIndexCheck(final IndexRebuildTask rebuildTask, final MetadataStore store, final boolean enabled) {
        this.rebuildTask = rebuildTask;
        this.store = store;
        this.enabled = enabled;
    }

    /**
     * Run the audit in the background and return immediately.
     */
    public void start() {
        if (!enabled) {
            logger.info("Startup index audit disabled");
            return;
        }
        final Thread thread = new Thread(this::runNow, "startup-index-audit");
        thread.setDaemon(true);
        thread.start();
    }

    /**
     * Run the audit on the calling thread.
     *
     * @return the finished task, empty when disabled or when the audit could not run
     */
    public Optional<TaskResult> runNow() {
        if (!enabled) {
            return Optional.empty();
        }
        if (store.isSchemaUpgradeRequired()) {
            logger.warn("Metadata index schema is outdated - run 'rebuild-index --mode full --force' to rebuild it");
        }
        try {
            final TaskResult result = rebuildTask.run(SyncRequest.audit());
            report(result);
            return Optional.of(result);
        } catch (final Exception e) {
            logger.warn("Startup index audit failed, continuing startup", e);
            return Optional.empty();
        }
    }

    private void report(final TaskResult result) {
        final IndexSyncStats stats = result.stats();
        if (stats == null) {
            logger.warn("Startup index audit finished with status {}: {}", result.status(), result.errors());
            return;
        }
        if (stats.inSync()) {
            logger.info("Startup index audit: index is in sync ({} users, {} files)",
                    stats.usersScanned(), stats.filesOnDisk());
        } else {
            logger.warn("Startup index audit: missing={}, stale={}, orphaned={}, errors={} - "
                            + "run 'rebuild-index --mode sync' or 'rebuild-index --mode full --force'",
                    stats.missingInIndex(), stats.staleInIndex(), stats.orphanedInIndex(), stats.errors().size());
        }
    }
}
