package de.mirkosertic.filevault.model;

/**
 * A file or directory observed on disk during one scan. Never persisted.
 *
 * @param path        path relative to the owner's storage root, {@code /}-separated
 * @param name        last path segment
 * @param size        byte size; always 0 for directories
 * @param contentType content type guessed from the name; empty when unknown and for directories
 * @param directory   whether the entry is a directory
 * @param modifiedAt  last modification time in epoch millis
 */
public record FileEntry(
        String path,
        String name,
        long size,
        String contentType,
        boolean directory,
        long modifiedAt
) {
    /**
     * Relative path of the containing directory, empty for entries at the root.
     */
    public String parentPath() {
        return StoredFile.parentOf(path);
    }
}
