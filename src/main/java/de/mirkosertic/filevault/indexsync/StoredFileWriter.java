package de.mirkosertic.filevault.indexsync;

import com.google.common.util.concurrent.Striped;
import de.mirkosertic.filevault.MetadataStore;
import de.mirkosertic.filevault.model.FileEntry;
import de.mirkosertic.filevault.model.OwnerRef;
import de.mirkosertic.filevault.model.StoredFile;

import java.io.IOException;
import java.util.Optional;
import java.util.concurrent.locks.Lock;

/**
 * Mutation layer for stored file records.
 * <p>
 * Every mutation is an explicit read-compare-write sequence under a lock striped by
 * {@code (owner, path)}, so concurrent runs against the same key cannot create duplicates
 * or count the same change twice. Distinct keys proceed in parallel.
 */
public class StoredFileWriter {

    private static final int LOCK_STRIPES = 256;

    private final MetadataStore store;
    private final ShareLinkCascade cascade;
    private final Striped<Lock> keyLocks = Striped.lock(LOCK_STRIPES);

    public StoredFileWriter(final MetadataStore store, final ShareLinkCascade cascade) {
        this.store = store;
        this.cascade = cascade;
    }

    /**
     * Make the record at {@code (owner, entry.path)} match the entry.
     * Calling this twice with the same entry writes nothing the second time.
     */
    public UpsertOutcome upsert(final OwnerRef owner, final FileEntry entry) throws IOException {
        final Lock lock = keyLocks.get(owner.recordKey(entry.path()));
        lock.lock();
        try {
            final Optional<StoredFile> existing = store.findStoredFile(owner, entry.path());
            if (existing.isPresent() && existing.get().matches(entry)) {
                return UpsertOutcome.UNCHANGED;
            }
            store.putStoredFile(StoredFile.fromEntry(owner, entry, System.currentTimeMillis()));
            return existing.isPresent() ? UpsertOutcome.UPDATED : UpsertOutcome.CREATED;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Delete the record and its share links, dependents first.
     *
     * @throws CascadeFailedException if the share links could not be removed; the record is kept
     * @throws IOException            if the record itself could not be deleted
     */
    public DeleteOutcome delete(final StoredFile record) throws IOException {
        final Lock lock = keyLocks.get(record.recordKey());
        lock.lock();
        try {
            if (store.findStoredFile(record.owner(), record.path()).isEmpty()) {
                return DeleteOutcome.NOT_FOUND;
            }
            final int dependents = cascade.deleteDependents(record);
            store.deleteStoredFile(record.owner(), record.path());
            return new DeleteOutcome(true, dependents);
        } finally {
            lock.unlock();
        }
    }
}
