package de.mirkosertic.filevault.indexsync;

import de.mirkosertic.filevault.MetadataStore;
import de.mirkosertic.filevault.model.OwnerRef;
import de.mirkosertic.filevault.model.StoredFile;

import java.io.IOException;
import java.util.List;

/**
 * Read-only view of the stored file records of one owner, used as the comparison source.
 */
public class StoredFileIndexReader {

    private final MetadataStore store;

    public StoredFileIndexReader(final MetadataStore store) {
        this.store = store;
    }

    public List<StoredFile> read(final OwnerRef owner) throws IOException {
        return store.listStoredFiles(owner);
    }
}
