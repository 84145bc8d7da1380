package de.mirkosertic.filevault.indexsync;

/**
 * Result of a read-compare-write upsert of one record.
 */
public enum UpsertOutcome {
    CREATED,
    UPDATED,
    /** The stored record already matched; nothing was written. */
    UNCHANGED
}
