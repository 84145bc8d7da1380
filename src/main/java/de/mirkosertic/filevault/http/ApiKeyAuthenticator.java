package de.mirkosertic.filevault.http;

import com.google.common.hash.Hashing;
import com.google.common.io.BaseEncoding;
import de.mirkosertic.filevault.MetadataStore;
import de.mirkosertic.filevault.model.Account;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.security.SecureRandom;
import java.util.Optional;

/**
 * Resolves {@code Authorization: Bearer <api key>} to an account.
 * Only the SHA-256 digest of an API key is ever stored.
 */
public class ApiKeyAuthenticator {

    private static final String BEARER_PREFIX = "Bearer ";
    private static final String API_KEY_PREFIX = "fv_";
    private static final int API_KEY_BYTES = 32;
    private static final SecureRandom RANDOM = new SecureRandom();

    private final MetadataStore store;

    public ApiKeyAuthenticator(final MetadataStore store) {
        this.store = store;
    }

    public Optional<Account> authenticate(final String authorizationHeader) throws IOException {
        if (authorizationHeader == null || !authorizationHeader.startsWith(BEARER_PREFIX)) {
            return Optional.empty();
        }
        final String apiKey = authorizationHeader.substring(BEARER_PREFIX.length()).trim();
        if (apiKey.isEmpty()) {
            return Optional.empty();
        }
        return store.findAccountByApiKeyHash(hashApiKey(apiKey));
    }

    /**
     * A new random API key. Only its hash is meant to be stored.
     */
    public static String generateApiKey() {
        final byte[] bytes = new byte[API_KEY_BYTES];
        RANDOM.nextBytes(bytes);
        return API_KEY_PREFIX + BaseEncoding.base16().lowerCase().encode(bytes);
    }

    public static String hashApiKey(final String apiKey) {
        return Hashing.sha256().hashString(apiKey, StandardCharsets.UTF_8).toString();
    }
}
