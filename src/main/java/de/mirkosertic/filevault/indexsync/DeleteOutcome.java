package de.mirkosertic.filevault.indexsync;

/**
 * Result of deleting one record together with its dependents.
 *
 * @param deleted           false when the record was already gone
 * @param dependentsDeleted number of share links removed with it
 */
public record DeleteOutcome(boolean deleted, int dependentsDeleted) {

    static final DeleteOutcome NOT_FOUND = new DeleteOutcome(false, 0);
}
