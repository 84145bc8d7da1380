package de.mirkosertic.filevault.indexsync;

/**
 * Error codes reported by the reconciliation engine.
 * <p>
 * {@link #INVALID_MODE} and {@link #FORCE_REQUIRED} are structural: they are raised as
 * {@link IndexSyncException} before any I/O. All other codes describe a single item and are
 * collected into the run's {@link IndexSyncStats}.
 */
public enum SyncErrorCode {
    INVALID_MODE,
    FORCE_REQUIRED,
    USER_NOT_FOUND,
    ORGANIZATION_NOT_FOUND,
    SCAN_FAILED,
    INDEX_READ_FAILED,
    CREATE_FAILED,
    UPDATE_FAILED,
    DELETE_FAILED,
    CASCADE_FAILED,
    COMMIT_FAILED,
    /** Reconciliation of one owner stopped on an unexpected error. */
    OWNER_FAILED;

    public boolean isStructural() {
        return this == INVALID_MODE || this == FORCE_REQUIRED;
    }
}
