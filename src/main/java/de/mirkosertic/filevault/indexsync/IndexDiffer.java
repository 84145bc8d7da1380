package de.mirkosertic.filevault.indexsync;

import de.mirkosertic.filevault.model.FileEntry;
import de.mirkosertic.filevault.model.OwnerRef;
import de.mirkosertic.filevault.model.StoredFile;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Computes the three-way diff between files on disk and index records. Pure, no I/O.
 * <p>
 * Entries are keyed by {@code (owner, path)}. Records that match the key of a disk entry are
 * compared on size, content type and kind; timestamps never participate.
 */
public final class IndexDiffer {

    private IndexDiffer() {
    }

    public static IndexDiff diff(final OwnerRef owner,
                                 final Collection<FileEntry> onDisk,
                                 final Collection<StoredFile> inIndex) {

        final Map<String, StoredFile> recordsByKey = new HashMap<>();
        for (final StoredFile record : inIndex) {
            recordsByKey.put(record.recordKey(), record);
        }

        final List<FileEntry> missing = new ArrayList<>();
        final List<IndexDiff.Stale> stale = new ArrayList<>();
        int unchanged = 0;

        for (final FileEntry entry : onDisk) {
            // Remove matched records so whatever remains is orphaned
            final StoredFile record = recordsByKey.remove(owner.recordKey(entry.path()));
            if (record == null) {
                missing.add(entry);
            } else if (record.matches(entry)) {
                unchanged++;
            } else {
                stale.add(new IndexDiff.Stale(entry, record));
            }
        }

        final List<StoredFile> orphaned = new ArrayList<>(recordsByKey.values());

        missing.sort(Comparator.comparing(FileEntry::path));
        stale.sort(Comparator.comparing(s -> s.entry().path()));
        orphaned.sort(Comparator.comparing(StoredFile::path).reversed());

        return new IndexDiff(missing, stale, orphaned, unchanged);
    }
}
