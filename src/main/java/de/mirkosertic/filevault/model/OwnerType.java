package de.mirkosertic.filevault.model;

/**
 * Kind of principal that owns a storage tree.
 */
public enum OwnerType {
    /** A user account, stored under {@code <storage-root>/<account_id>}. */
    USER("user"),
    /** An organization's shared area, stored under {@code <shared-root>/<org_id>}. */
    ORGANIZATION("org");

    private final String code;

    OwnerType(final String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }

    public static OwnerType fromCode(final String code) {
        for (final OwnerType type : values()) {
            if (type.code.equals(code)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown owner type: " + code);
    }
}
