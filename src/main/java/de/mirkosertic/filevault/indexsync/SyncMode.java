package de.mirkosertic.filevault.indexsync;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;

/**
 * Operating mode of one reconciliation run.
 * <p>
 * The mode is chosen per call; there are no transitions between modes within a run.
 */
public enum SyncMode {

    /** Report missing, stale and orphaned records without touching the index. */
    AUDIT("audit", false, false, false),
    /** Create missing records and update stale ones; orphans are left alone. */
    SYNC("sync", true, true, false),
    /** Delete orphaned records (with their dependents); requires force. */
    CLEAN("clean", false, false, true),
    /** Sync and clean in one pass; requires force. */
    FULL("full", true, true, true);

    private final String value;
    private final boolean createsMissing;
    private final boolean updatesStale;
    private final boolean deletesOrphans;

    SyncMode(final String value, final boolean createsMissing, final boolean updatesStale,
             final boolean deletesOrphans) {
        this.value = value;
        this.createsMissing = createsMissing;
        this.updatesStale = updatesStale;
        this.deletesOrphans = deletesOrphans;
    }

    public String value() {
        return value;
    }

    public boolean createsMissing() {
        return createsMissing;
    }

    public boolean updatesStale() {
        return updatesStale;
    }

    public boolean deletesOrphans() {
        return deletesOrphans;
    }

    /**
     * Destructive modes must be confirmed with the force flag.
     */
    public boolean requiresForce() {
        return deletesOrphans;
    }

    public static List<String> allowedValues() {
        return Arrays.stream(values()).map(SyncMode::value).toList();
    }

    /**
     * Parse a mode name, ignoring case and surrounding whitespace.
     *
     * @throws IndexSyncException with {@link SyncErrorCode#INVALID_MODE} for anything else
     */
    public static SyncMode parse(final String mode) throws IndexSyncException {
        if (mode != null) {
            final String normalized = mode.trim().toLowerCase(Locale.ROOT);
            for (final SyncMode candidate : values()) {
                if (candidate.value.equals(normalized)) {
                    return candidate;
                }
            }
        }
        throw new IndexSyncException(SyncErrorCode.INVALID_MODE,
                "Invalid mode '" + mode + "'. Must be one of: " + String.join(", ", allowedValues()),
                allowedValues());
    }

    @Override
    public String toString() {
        return value;
    }
}
