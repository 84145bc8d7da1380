package de.mirkosertic.filevault.model;

import java.util.Objects;

/**
 * Identity of the owner of a stored file. Together with the relative path it forms
 * the unique key of a {@link StoredFile}.
 */
public record OwnerRef(OwnerType type, String id) {

    public OwnerRef {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(id, "id");
    }

    public static OwnerRef user(final String accountId) {
        return new OwnerRef(OwnerType.USER, accountId);
    }

    public static OwnerRef organization(final long orgId) {
        return new OwnerRef(OwnerType.ORGANIZATION, Long.toString(orgId));
    }

    /**
     * Stable string form used as the owner part of index keys and lock keys.
     */
    public String key() {
        return type.code() + ":" + id;
    }

    /**
     * Key of the record at {@code path} for this owner.
     */
    public String recordKey(final String path) {
        return key() + "|" + path;
    }

    @Override
    public String toString() {
        return key();
    }
}
