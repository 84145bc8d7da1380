package de.mirkosertic.filevault.model;

import org.jspecify.annotations.Nullable;

/**
 * Public share link pointing at exactly one stored file. A share link never outlives
 * its file: deleting the file record deletes its links.
 *
 * @param token     public token, unique
 * @param owner     owner of the shared file
 * @param filePath  path of the shared file
 * @param createdAt creation time in epoch millis
 * @param expiresAt expiry in epoch millis, {@code null} for links that never expire
 * @param revoked   whether the owner revoked the link
 */
public record ShareLink(
        String token,
        OwnerRef owner,
        String filePath,
        long createdAt,
        @Nullable Long expiresAt,
        boolean revoked
) {
    public String fileRecordKey() {
        return owner.recordKey(filePath);
    }

    public boolean isActive(final long nowMillis) {
        return !revoked && (expiresAt == null || expiresAt > nowMillis);
    }
}
