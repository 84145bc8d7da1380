package de.mirkosertic.filevault.cli;

import de.mirkosertic.filevault.MetadataStore;
import de.mirkosertic.filevault.config.ApplicationConfig;
import de.mirkosertic.filevault.model.Account;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.UUID;

/**
 * Create a user account together with its storage directory.
 */
@Command(
        name = "create-user",
        description = "Create a user account and its storage directory",
        mixinStandardHelpOptions = true
)
public class CreateUserCommand extends StoreCommand {

    private static final Logger logger = LoggerFactory.getLogger(CreateUserCommand.class);

    @Parameters(index = "0", paramLabel = "<username>", description = "Login name of the new user")
    private String username;

    @Option(names = "--user-id", paramLabel = "<id>", description = "Numeric user id (default: next free id)")
    private Long userId;

    @Option(names = "--admin", description = "Allow the user to call administrative endpoints")
    private boolean admin;

    public CreateUserCommand() {
        this(null, null);
    }

    public CreateUserCommand(@Nullable final MetadataStore store, @Nullable final ApplicationConfig config) {
        super(store, config);
    }

    @Override
    protected int execute(final MetadataStore store, final ApplicationConfig config, final PrintWriter out,
                          final PrintWriter err) throws IOException {
        if (store.findAccountByUsername(username).isPresent()) {
            err.println("User \"" + username + "\" already exists");
            return EXIT_FAILED;
        }
        if (userId != null && store.findAccount(userId).isPresent()) {
            err.println("User id " + userId + " is already taken");
            return EXIT_FAILED;
        }

        final long id = userId != null ? userId : nextUserId(store);
        final Account account = new Account(id, UUID.randomUUID().toString(), username, admin, null);
        store.saveAccount(account);
        store.commit();

        final Path storageDirectory = config.getStorageRoot().resolve(account.accountId());
        Files.createDirectories(storageDirectory);
        logger.info("Created user {} (id={}, account={})", username, id, account.accountId());

        out.println("Successfully created user \"" + username + "\" (id=" + id + ", admin=" + admin + ")");
        out.println("Account ID: " + account.accountId());
        out.println("Storage: " + storageDirectory);
        return EXIT_OK;
    }

    private static long nextUserId(final MetadataStore store) throws IOException {
        long max = 0;
        for (final Account account : store.listAccounts()) {
            max = Math.max(max, account.userId());
        }
        return max + 1;
    }
}
