package de.mirkosertic.filevault.indexsync;

import de.mirkosertic.filevault.MetadataStore;
import de.mirkosertic.filevault.model.ShareLink;
import de.mirkosertic.filevault.model.StoredFile;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.List;

/**
 * Removes the share links of a stored file record that is about to be deleted.
 * A share link pointing at a deleted file is permanently broken, so this runs for every
 * deletion; there is no mode that deletes a record and keeps its links.
 */
public class ShareLinkCascade {

    private static final Logger logger = LoggerFactory.getLogger(ShareLinkCascade.class);

    private final MetadataStore store;

    public ShareLinkCascade(final MetadataStore store) {
        this.store = store;
    }

    /**
     * Delete all share links of the record.
     *
     * @return number of links deleted
     * @throws CascadeFailedException if the links could not be removed
     */
    public int deleteDependents(final StoredFile record) throws CascadeFailedException {
        try {
            final int deleted = store.deleteShareLinks(record.recordKey());
            if (deleted > 0) {
                logger.debug("Deleted {} share links of {}", deleted, record.recordKey());
            }
            return deleted;
        } catch (final IOException e) {
            throw new CascadeFailedException("Cannot delete share links of " + record.path(), e);
        }
    }

    /**
     * Number of links a deletion of the record would remove.
     */
    public int countDependents(final StoredFile record) throws IOException {
        return store.listShareLinks(record.recordKey()).size();
    }

    public int countActive(final StoredFile record, final long nowMillis) throws IOException {
        final List<ShareLink> links = store.listShareLinks(record.recordKey());
        int active = 0;
        for (final ShareLink link : links) {
            if (link.isActive(nowMillis)) {
                active++;
            }
        }
        return active;
    }
}
