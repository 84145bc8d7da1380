package de.mirkosertic.filevault.cli;

import de.mirkosertic.filevault.MetadataStore;
import de.mirkosertic.filevault.config.ApplicationConfig;
import de.mirkosertic.filevault.model.Account;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

import java.io.IOException;
import java.io.PrintWriter;
import java.util.Optional;

@Command(
        name = "revoke-api-key",
        description = "Revoke the API key of a user",
        mixinStandardHelpOptions = true
)
public class RevokeApiKeyCommand extends StoreCommand {

    private static final Logger logger = LoggerFactory.getLogger(RevokeApiKeyCommand.class);

    @Parameters(index = "0", paramLabel = "<username>", description = "User whose key is revoked")
    private String username;

    public RevokeApiKeyCommand() {
        this(null, null);
    }

    public RevokeApiKeyCommand(@Nullable final MetadataStore store, @Nullable final ApplicationConfig config) {
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
        final Account current = account.get();
        if (current.apiKeyHash() == null) {
            out.println("User \"" + username + "\" has no API key");
            return EXIT_OK;
        }

        store.saveAccount(new Account(current.userId(), current.accountId(), current.username(), current.admin(), null));
        store.commit();
        logger.info("Revoked API key of user {} (id={})", username, current.userId());

        out.println("Successfully revoked API key of \"" + username + "\"");
        return EXIT_OK;
    }
}
