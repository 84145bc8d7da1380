package de.mirkosertic.filevault.cli;

import de.mirkosertic.filevault.MetadataStore;
import de.mirkosertic.filevault.config.ApplicationConfig;
import de.mirkosertic.filevault.http.ApiKeyAuthenticator;
import de.mirkosertic.filevault.model.Account;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

import java.io.IOException;
import java.io.PrintWriter;
import java.util.Optional;

/**
 * Issue a new API key for a user. The key is printed once; only its hash is stored,
 * and a previously issued key stops working.
 */
@Command(
        name = "generate-api-key",
        description = "Generate an API key for a user, replacing any previous key",
        mixinStandardHelpOptions = true
)
public class GenerateApiKeyCommand extends StoreCommand {

    private static final Logger logger = LoggerFactory.getLogger(GenerateApiKeyCommand.class);

    @Parameters(index = "0", paramLabel = "<username>", description = "User to generate a key for")
    private String username;

    public GenerateApiKeyCommand() {
        this(null, null);
    }

    public GenerateApiKeyCommand(@Nullable final MetadataStore store, @Nullable final ApplicationConfig config) {
        super(store, config);
    }

    @Override
    protected int execute(final MetadataStore store, final ApplicationConfig config, final PrintWriter out,
                          final PrintWriter err) throws IOException {
        final Optional<Account> account = store.findAccountByUsername(username);
        if (account.isEmpty()) {
            err.println("User \"" + username + "\" does not exist");
            return EXIT_FAILED;
        }

        final String apiKey = ApiKeyAuthenticator.generateApiKey();
        final Account current = account.get();
        store.saveAccount(new Account(current.userId(), current.accountId(), current.username(), current.admin(),
                ApiKeyAuthenticator.hashApiKey(apiKey)));
        store.commit();
        logger.info("Generated API key for user {} (id={})", username, current.userId());

        out.println("Successfully generated API key for \"" + username + "\"");
        out.println("API Key: " + apiKey);
        out.println("Save this key - it will not be shown again!");
        return EXIT_OK;
    }
}
