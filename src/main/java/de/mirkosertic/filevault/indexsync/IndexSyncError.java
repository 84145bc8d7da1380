package de.mirkosertic.filevault.indexsync;

/**
 * One failed item of a reconciliation run.
 *
 * @param path    path of the item relative to its owner root, empty when the error concerns a whole scope
 * @param code    what failed
 * @param message human readable detail
 */
public record IndexSyncError(String path, SyncErrorCode code, String message) {

    @Override
    public String toString() {
        return path.isEmpty() ? code + ": " + message : code + " " + path + ": " + message;
    }
}
