package de.mirkosertic.filevault.indexsync;

import de.mirkosertic.filevault.model.FileEntry;
import de.mirkosertic.filevault.model.StoredFile;

import java.util.List;

/**
 * Immutable result of comparing one owner's files on disk with the owner's index records.
 * <p>
 * The three lists are disjoint by {@code (owner, path)}.
 *
 * @param missing   on disk without a record, in path order (parents first)
 * @param stale     in both, but size, content type or kind disagree, in path order
 * @param orphaned  records without a file on disk, in reverse path order (children first)
 * @param unchanged number of paths present in both with matching metadata
 */
public record IndexDiff(
        List<FileEntry> missing,
        List<Stale> stale,
        List<StoredFile> orphaned,
        int unchanged
) {

    public IndexDiff {
        missing = List.copyOf(missing);
        stale = List.copyOf(stale);
        orphaned = List.copyOf(orphaned);
    }

    /**
     * A path whose record disagrees with the file on disk.
     *
     * @param entry  what the filesystem says
     * @param record what the index says
     */
    public record Stale(FileEntry entry, StoredFile record) {
    }

    public boolean isEmpty() {
        return missing.isEmpty() && stale.isEmpty() && orphaned.isEmpty();
    }
}
