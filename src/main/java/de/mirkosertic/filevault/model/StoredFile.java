package de.mirkosertic.filevault.model;

/**
 * Index record describing one file or directory of one owner.
 * {@code (owner, path)} is unique in the metadata store.
 */
public record StoredFile(
        OwnerRef owner,
        String path,
        String name,
        String parentPath,
        long size,
        String contentType,
        boolean directory,
        long modifiedAt,
        long indexedAt
) {

    /**
     * Build the record that mirrors the given filesystem entry.
     */
    public static StoredFile fromEntry(final OwnerRef owner, final FileEntry entry, final long indexedAt) {
        return new StoredFile(owner, entry.path(), entry.name(), entry.parentPath(), entry.size(),
                entry.contentType(), entry.directory(), entry.modifiedAt(), indexedAt);
    }

    public String recordKey() {
        return owner.recordKey(path);
    }

    /**
     * True when the metadata that participates in reconciliation matches the entry.
     * Timestamps are ignored; they drift harmlessly.
     */
    public boolean matches(final FileEntry entry) {
        return size == entry.size()
                && directory == entry.directory()
                && contentType.equals(entry.contentType());
    }

    static String parentOf(final String path) {
        final int slash = path.lastIndexOf('/');
        return slash < 0 ? "" : path.substring(0, slash);
    }
}
