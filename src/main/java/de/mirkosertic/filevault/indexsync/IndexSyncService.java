package de.mirkosertic.filevault.indexsync;

import com.google.common.util.concurrent.Striped;
import de.mirkosertic.filevault.MetadataStore;
import de.mirkosertic.filevault.config.ApplicationConfig;
import de.mirkosertic.filevault.model.Account;
import de.mirkosertic.filevault.model.FileEntry;
import de.mirkosertic.filevault.model.Organization;
import de.mirkosertic.filevault.model.OwnerRef;
import de.mirkosertic.filevault.model.StoredFile;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.locks.Lock;
import java.util.function.Consumer;
import java.util.stream.Stream;

/**
 * Keeps the metadata index consistent with the storage tree. The filesystem always wins.
 * <p>
 * One run resolves the owners in scope, then reconciles each owner as an independent unit
 * of work on the {@link SyncWorkerPool}:
 * <ol>
 *   <li>Scan the owner's storage root.</li>
 *   <li>Read the owner's stored file records.</li>
 *   <li>Diff both into missing, stale and orphaned.</li>
 *   <li>Apply the mode's actions (create, update, delete with cascade).</li>
 *   <li>Commit the index once for the owner.</li>
 * </ol>
 * Runs against the same owner are serialized by an owner lock. Per-item failures are recorded
 * in the returned stats and never abort the run; structural errors are raised before any I/O.
 */
public class IndexSyncService {

    private static final Logger logger = LoggerFactory.getLogger(IndexSyncService.class);

    private static final int OWNER_LOCK_STRIPES = 64;

    private final MetadataStore store;
    private final FilesystemScanner scanner;
    private final StoredFileIndexReader indexReader;
    private final ShareLinkCascade cascade;
    private final StoredFileWriter writer;
    private final SyncWorkerPool workerPool;
    private final Path storageRoot;
    private final Path sharedRoot;
    private final OrphanPolicy orphanPolicy;
    private final Striped<Lock> ownerLocks = Striped.lock(OWNER_LOCK_STRIPES);

    public IndexSyncService(final MetadataStore store, final ApplicationConfig config) {
        this(store, new FilesystemScanner(), config.getStorageRoot(), config.getSharedRoot(),
                config.getOrphanPolicy(), new SyncWorkerPool(config.getSyncThreadPoolSize()));
    }

    public IndexSyncService(final MetadataStore store,
                            final FilesystemScanner scanner,
                            final Path storageRoot,
                            final Path sharedRoot,
                            final OrphanPolicy orphanPolicy,
                            final SyncWorkerPool workerPool) {
        this.store = store;
        this.scanner = scanner;
        this.indexReader = new StoredFileIndexReader(store);
        this.cascade = new ShareLinkCascade(store);
        this.writer = new StoredFileWriter(store, cascade);
        this.storageRoot = storageRoot;
        this.sharedRoot = sharedRoot;
        this.orphanPolicy = orphanPolicy;
        this.workerPool = workerPool;
    }

    /**
     * Reconcile user storage.
     *
     * @param mode   audit, sync, clean or full (case-insensitive)
     * @param userId restrict to one user, {@code null} for all users with an account
     * @throws IndexSyncException for an unknown mode or a destructive mode without force
     */
    public IndexSyncStats sync(final String mode, @Nullable final Long userId, final boolean dryRun,
                               final boolean force) throws IndexSyncException {
        return sync(SyncRequest.of(mode, userId, dryRun, force), new CancellationToken());
    }

    /**
     * Reconcile organization shared storage, with the same modes and gates as {@link #sync}.
     */
    public IndexSyncStats syncShared(final String mode, @Nullable final Long orgId, final boolean dryRun,
                                     final boolean force) throws IndexSyncException {
        return sync(new SyncRequest(SyncMode.parse(mode), orgId, true, dryRun, force), new CancellationToken());
    }

    public IndexSyncStats sync(final SyncRequest request, final CancellationToken token) throws IndexSyncException {
        // Structural checks before any I/O
        request.checkForce();

        final long startTime = System.currentTimeMillis();
        final StatsAggregator stats = new StatsAggregator();

        logger.info("Index sync started: mode={}, scope={}, dryRun={}, orphanPolicy={}",
                request.mode(), request.describeScope(), request.dryRun(), orphanPolicy.configValue());

        final List<OwnerScope> scopes = request.shared()
                ? resolveOrganizations(request.ownerId(), stats)
                : resolveUsers(request.ownerId(), stats);

        runAll(scopes, request, token, stats);

        if (token.isCancelled()) {
            stats.markCancelled();
        }

        final IndexSyncStats result = stats.snapshot(System.currentTimeMillis() - startTime);
        logger.info("Index sync finished in {}ms: owners={}, onDisk={}, inIndex={}, missing={}, stale={}, orphaned={}, "
                        + "created={}, updated={}, deleted={}, skipped={}, dependentsDeleted={}, errors={}, cancelled={}",
                result.durationMs(), result.usersScanned(), result.filesOnDisk(), result.filesInIndex(),
                result.missingInIndex(), result.staleInIndex(), result.orphanedInIndex(),
                result.recordsCreated(), result.recordsUpdated(), result.recordsDeleted(), result.recordsSkipped(),
                result.dependentsDeleted(), result.errors().size(), result.cancelled());
        return result;
    }

    public void shutdown() {
        workerPool.shutdown();
    }

    private record OwnerScope(OwnerRef owner, Path root) {
    }

    private List<OwnerScope> resolveUsers(@Nullable final Long userId, final StatsAggregator stats) {
        final List<OwnerScope> scopes = new ArrayList<>();
        try {
            if (userId != null) {
                final Optional<Account> account = store.findAccount(userId);
                if (account.isEmpty()) {
                    logger.warn("User {} not found, nothing to reconcile", userId);
                    stats.error("", SyncErrorCode.USER_NOT_FOUND, "User " + userId + " not found");
                    return scopes;
                }
                scopes.add(scopeOf(account.get()));
            } else {
                for (final Account account : store.listAccounts()) {
                    scopes.add(scopeOf(account));
                }
            }
        } catch (final IOException e) {
            logger.error("Cannot read accounts", e);
            stats.error("", SyncErrorCode.INDEX_READ_FAILED, "Cannot read accounts: " + e.getMessage());
        }
        return scopes;
    }

    private List<OwnerScope> resolveOrganizations(@Nullable final Long orgId, final StatsAggregator stats) {
        final List<OwnerScope> scopes = new ArrayList<>();
        try {
            if (orgId != null) {
                final Optional<Organization> organization = store.findOrganization(orgId);
                if (organization.isEmpty()) {
                    logger.warn("Organization {} not found, nothing to reconcile", orgId);
                    stats.error("", SyncErrorCode.ORGANIZATION_NOT_FOUND, "Organization " + orgId + " not found");
                    return scopes;
                }
                scopes.add(scopeOf(organization.get()));
            } else {
                for (final Organization organization : store.listOrganizations()) {
                    scopes.add(scopeOf(organization));
                }
            }
        } catch (final IOException e) {
            logger.error("Cannot read organizations", e);
            stats.error("", SyncErrorCode.INDEX_READ_FAILED, "Cannot read organizations: " + e.getMessage());
        }
        return scopes;
    }

    private OwnerScope scopeOf(final Account account) {
        return new OwnerScope(account.owner(), storageRoot.resolve(account.accountId()));
    }

    private OwnerScope scopeOf(final Organization organization) {
        return new OwnerScope(organization.owner(), sharedRoot.resolve(Long.toString(organization.orgId())));
    }

    private void runAll(final List<OwnerScope> scopes, final SyncRequest request,
                        final CancellationToken token, final StatsAggregator stats) {
        if (scopes.isEmpty()) {
            return;
        }

        final List<Callable<Void>> units = new ArrayList<>(scopes.size());
        for (final OwnerScope scope : scopes) {
            units.add(() -> {
                reconcileOwner(scope, request, token, stats);
                return null;
            });
        }

        try {
            final List<Future<Void>> futures = workerPool.invokeAll(units);
            for (int i = 0; i < futures.size(); i++) {
                try {
                    futures.get(i).get();
                } catch (final ExecutionException e) {
                    final OwnerRef owner = scopes.get(i).owner();
                    logger.error("Reconciliation of {} failed", owner, e.getCause());
                    stats.error("", SyncErrorCode.OWNER_FAILED, owner + ": " + e.getCause().getMessage());
                }
            }
        } catch (final InterruptedException e) {
            logger.warn("Index sync interrupted, cancelling");
            token.cancel();
            Thread.currentThread().interrupt();
        }
    }

    private void reconcileOwner(final OwnerScope scope, final SyncRequest request,
                                final CancellationToken token, final StatsAggregator stats) {
        final OwnerRef owner = scope.owner();
        final Lock ownerLock = ownerLocks.get(owner.key());
        ownerLock.lock();
        try {
            if (token.isCancelled()) {
                return;
            }
            stats.ownerScanned();

            // Step 1: Scan the storage tree
            final ScanFailures scanFailures = new ScanFailures();
            final Consumer<IndexSyncError> errorSink = error -> {
                scanFailures.add(error);
                stats.error(error);
            };
            final List<FileEntry> onDisk;
            try (final Stream<FileEntry> entries = scanner.scan(scope.root(), errorSink, token)) {
                onDisk = entries.toList();
            }
            if (token.isCancelled()) {
                // A partial scan would make every unscanned record look orphaned
                logger.info("{}: cancelled during scan after {} entries", owner, onDisk.size());
                return;
            }

            // Step 2: Snapshot the owner's index records
            final List<StoredFile> inIndex;
            try {
                inIndex = indexReader.read(owner);
            } catch (final IOException e) {
                logger.error("{}: cannot read index records", owner, e);
                stats.error("", SyncErrorCode.INDEX_READ_FAILED, owner + ": " + e.getMessage());
                return;
            }

            // Step 3: Diff
            final IndexDiff diff = IndexDiffer.diff(owner, onDisk, inIndex);
            stats.observed(onDisk.size(), inIndex.size(), diff);
            logger.info("{}: {} on disk, {} in index, missing={}, stale={}, orphaned={}, unchanged={}",
                    owner, onDisk.size(), inIndex.size(), diff.missing().size(), diff.stale().size(),
                    diff.orphaned().size(), diff.unchanged());

            // Step 4: Apply the mode
            final SyncMode mode = request.mode();
            if (mode.createsMissing()) {
                applyMissing(owner, diff, request.dryRun(), token, stats);
            }
            if (mode.updatesStale()) {
                applyStale(owner, diff, request.dryRun(), token, stats);
            }
            if (mode.deletesOrphans()) {
                applyOrphans(owner, diff, scanFailures, request.dryRun(), token, stats);
            }

            // Step 5: Commit once per owner
            if (!request.dryRun() && mode != SyncMode.AUDIT && !diff.isEmpty()) {
                try {
                    store.commit();
                } catch (final IOException e) {
                    logger.error("{}: commit failed", owner, e);
                    stats.error("", SyncErrorCode.COMMIT_FAILED, owner + ": " + e.getMessage());
                }
            }
        } finally {
            ownerLock.unlock();
        }
    }

    private void applyMissing(final OwnerRef owner, final IndexDiff diff, final boolean dryRun,
                              final CancellationToken token, final StatsAggregator stats) {
        for (final FileEntry entry : diff.missing()) {
            if (token.isCancelled()) {
                return;
            }
            if (dryRun) {
                stats.created();
                continue;
            }
            try {
                record(writer.upsert(owner, entry), stats);
            } catch (final IOException e) {
                logger.warn("{}: cannot create record for {}", owner, entry.path(), e);
                stats.error(entry.path(), SyncErrorCode.CREATE_FAILED, e.getMessage());
            }
        }
    }

    private void applyStale(final OwnerRef owner, final IndexDiff diff, final boolean dryRun,
                            final CancellationToken token, final StatsAggregator stats) {
        for (final IndexDiff.Stale stale : diff.stale()) {
            if (token.isCancelled()) {
                return;
            }
            if (dryRun) {
                stats.updated();
                continue;
            }
            try {
                record(writer.upsert(owner, stale.entry()), stats);
            } catch (final IOException e) {
                logger.warn("{}: cannot update record for {}", owner, stale.entry().path(), e);
                stats.error(stale.entry().path(), SyncErrorCode.UPDATE_FAILED, e.getMessage());
            }
        }
    }

    private void applyOrphans(final OwnerRef owner, final IndexDiff diff, final ScanFailures scanFailures,
                              final boolean dryRun, final CancellationToken token, final StatsAggregator stats) {
        final long now = System.currentTimeMillis();
        for (final StoredFile orphan : diff.orphaned()) {
            if (token.isCancelled()) {
                return;
            }
            if (scanFailures.covers(orphan.path())) {
                // Not seen because it could not be read, which says nothing about whether it exists
                logger.debug("{}: keeping {}, it lies below a path that failed to scan", owner, orphan.path());
                stats.skipped();
                continue;
            }
            try {
                if (orphanPolicy == OrphanPolicy.PROTECT_SHARED && cascade.countActive(orphan, now) > 0) {
                    logger.debug("{}: keeping shared orphan {}", owner, orphan.path());
                    stats.skipped();
                    continue;
                }
                if (dryRun) {
                    stats.deleted(cascade.countDependents(orphan));
                    continue;
                }
                final DeleteOutcome outcome = writer.delete(orphan);
                if (outcome.deleted()) {
                    stats.deleted(outcome.dependentsDeleted());
                }
            } catch (final CascadeFailedException e) {
                logger.warn("{}: cannot delete share links of {}", owner, orphan.path(), e);
                stats.error(orphan.path(), SyncErrorCode.CASCADE_FAILED, e.getMessage());
            } catch (final IOException e) {
                logger.warn("{}: cannot delete record {}", owner, orphan.path(), e);
                stats.error(orphan.path(), SyncErrorCode.DELETE_FAILED, e.getMessage());
            }
        }
    }

    /**
     * Paths of one owner's scan that reported {@code SCAN_FAILED}. An empty path stands for the root.
     * Only touched by the thread that consumes the scan.
     */
    private static final class ScanFailures {

        private final List<String> paths = new ArrayList<>();

        void add(final IndexSyncError error) {
            if (error.code() == SyncErrorCode.SCAN_FAILED) {
                paths.add(error.path());
            }
        }

        boolean covers(final String path) {
            for (final String failed : paths) {
                if (failed.isEmpty() || path.equals(failed) || path.startsWith(failed + "/")) {
                    return true;
                }
            }
            return false;
        }
    }

    private static void record(final UpsertOutcome outcome, final StatsAggregator stats) {
        switch (outcome) {
            case CREATED -> stats.created();
            case UPDATED -> stats.updated();
            case UNCHANGED -> {
                // Another run got there first
            }
        }
    }
}
