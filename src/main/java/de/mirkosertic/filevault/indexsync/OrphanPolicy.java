package de.mirkosertic.filevault.indexsync;

import java.util.Locale;

/**
 * What happens to an orphaned record that still has active share links.
 */
public enum OrphanPolicy {

    /** The filesystem wins: the record is deleted and its share links with it. */
    CASCADE("cascade"),
    /** The record is kept and counted as skipped while any of its share links is active. */
    PROTECT_SHARED("protect-shared");

    private final String configValue;

    OrphanPolicy(final String configValue) {
        this.configValue = configValue;
    }

    public String configValue() {
        return configValue;
    }

    public static OrphanPolicy fromConfigValue(final String value) {
        final String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (final OrphanPolicy policy : values()) {
            if (policy.configValue.equals(normalized)) {
                return policy;
            }
        }
        throw new IllegalArgumentException("Unknown orphan policy: " + value
                + " (expected 'cascade' or 'protect-shared')");
    }
}
