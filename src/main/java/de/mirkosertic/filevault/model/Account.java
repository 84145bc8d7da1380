package de.mirkosertic.filevault.model;

import org.jspecify.annotations.Nullable;

/**
 * A user that owns a storage area.
 *
 * @param userId     numeric id used by the admin surfaces to scope a rebuild
 * @param accountId  account UUID, also the name of the user's storage directory
 * @param username   login name
 * @param admin      whether the user may call administrative endpoints
 * @param apiKeyHash SHA-256 hex digest of the user's API key, if one was issued
 */
public record Account(
        long userId,
        String accountId,
        String username,
        boolean admin,
        @Nullable String apiKeyHash
) {
    public OwnerRef owner() {
        return OwnerRef.user(accountId);
    }
}
