package de.mirkosertic.filevault.indexsync;

import org.jspecify.annotations.Nullable;

/**
 * Parameters of one reconciliation run, common to all invocation surfaces.
 *
 * @param mode    what to do with the diff
 * @param ownerId user id, or organization id when {@code shared}; {@code null} for all owners
 * @param shared  reconcile organization shared storage instead of user storage
 * @param dryRun  compute and count every action without writing
 * @param force   confirmation for destructive modes
 */
public record SyncRequest(
        SyncMode mode,
        @Nullable Long ownerId,
        boolean shared,
        boolean dryRun,
        boolean force
) {

    /**
     * Build a user-storage request from raw adapter input.
     *
     * @throws IndexSyncException if the mode string is not recognized
     */
    public static SyncRequest of(final String mode, @Nullable final Long userId, final boolean dryRun,
                                 final boolean force) throws IndexSyncException {
        return new SyncRequest(SyncMode.parse(mode), userId, false, dryRun, force);
    }

    public static SyncRequest audit() {
        return new SyncRequest(SyncMode.AUDIT, null, false, false, false);
    }

    /**
     * Fail unless a destructive mode is confirmed.
     */
    public void checkForce() throws IndexSyncException {
        if (mode.requiresForce() && !force) {
            throw new IndexSyncException(SyncErrorCode.FORCE_REQUIRED,
                    "Mode '" + mode.value() + "' deletes records and requires force=true");
        }
    }

    public String describeScope() {
        final String kind = shared ? "organization" : "user";
        return ownerId == null ? "all " + kind + "s" : kind + " " + ownerId;
    }
}
