package de.mirkosertic.filevault.cli;

import de.mirkosertic.filevault.config.ApplicationConfig;
import de.mirkosertic.filevault.http.ApiKeyAuthenticator;
import de.mirkosertic.filevault.indexsync.IndexSyncService;
import de.mirkosertic.filevault.indexsync.IndexSyncStats;
import de.mirkosertic.filevault.indexsync.OrphanPolicy;
import de.mirkosertic.filevault.indexsync.StorageFixture;
import de.mirkosertic.filevault.model.Account;
import de.mirkosertic.filevault.model.Organization;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("Provisioning command Tests")
class ProvisioningCommandsTest {

    private static final Pattern API_KEY_LINE = Pattern.compile("API Key: (\\S+)");

    @TempDir
    Path tempDir;

    private StorageFixture fixture;
    private ApplicationConfig config;
    private StringWriter out;
    private StringWriter err;

    @BeforeEach
    void setUp() throws IOException {
        fixture = new StorageFixture(tempDir);
        config = ApplicationConfig.forDirectories(fixture.storageRoot, fixture.sharedRoot, tempDir.resolve("index"));
    }

    @AfterEach
    void tearDown() throws IOException {
        fixture.close();
    }

    private int execute(final StoreCommand command, final String... args) {
        out = new StringWriter();
        err = new StringWriter();
        final CommandLine commandLine = new CommandLine(command);
        commandLine.setOut(new PrintWriter(out));
        commandLine.setErr(new PrintWriter(err));
        return commandLine.execute(args);
    }

    private String generateKey(final String username) {
        final int exitCode = execute(new GenerateApiKeyCommand(fixture.store, config), username);
        assertThat(exitCode).isEqualTo(StoreCommand.EXIT_OK);
        final Matcher matcher = API_KEY_LINE.matcher(out.toString());
        assertThat(matcher.find()).as("key is printed").isTrue();
        return matcher.group(1);
    }

    @Nested
    @DisplayName("create-user")
    class CreateUser {

        @Test
        @DisplayName("Creates the account and its storage directory, which a rebuild then picks up")
        void createsAccount() throws Exception {
            // When
            final int exitCode = execute(new CreateUserCommand(fixture.store, config), "alice", "--admin");

            // Then
            assertThat(exitCode).isEqualTo(StoreCommand.EXIT_OK);
            final Account alice = fixture.store.findAccountByUsername("alice").orElseThrow();
            assertThat(alice.userId()).isEqualTo(1L);
            assertThat(alice.admin()).isTrue();
            assertThat(alice.apiKeyHash()).isNull();
            assertThat(fixture.storageRoot.resolve(alice.accountId())).isDirectory();
            assertThat(out.toString()).contains("Successfully created user \"alice\"");

            Files.write(fixture.storageRoot.resolve(alice.accountId()).resolve("hello.txt"), new byte[3]);
            final IndexSyncService service = fixture.newService(OrphanPolicy.CASCADE, 1);
            try {
                final IndexSyncStats stats = service.sync("audit", null, false, false);
                assertThat(stats.usersScanned()).isEqualTo(1);
                assertThat(stats.missingInIndex()).isEqualTo(1);
            } finally {
                service.shutdown();
            }
        }

        @Test
        @DisplayName("Assigns the next free id unless one is given")
        void assignsIds() throws Exception {
            execute(new CreateUserCommand(fixture.store, config), "alice", "--user-id", "7");
            execute(new CreateUserCommand(fixture.store, config), "bob");

            assertThat(fixture.store.findAccountByUsername("alice")).get().extracting(Account::userId).isEqualTo(7L);
            assertThat(fixture.store.findAccountByUsername("bob")).get().extracting(Account::userId).isEqualTo(8L);
        }

        @Test
        @DisplayName("Refuses a duplicate username or user id")
        void refusesDuplicates() throws Exception {
            execute(new CreateUserCommand(fixture.store, config), "alice", "--user-id", "1");

            assertThat(execute(new CreateUserCommand(fixture.store, config), "alice"))
                    .isEqualTo(StoreCommand.EXIT_FAILED);
            assertThat(err.toString()).contains("already exists");

            assertThat(execute(new CreateUserCommand(fixture.store, config), "bob", "--user-id", "1"))
                    .isEqualTo(StoreCommand.EXIT_FAILED);
            assertThat(err.toString()).contains("already taken");
            assertThat(fixture.store.listAccounts()).hasSize(1);
        }
    }

    @Nested
    @DisplayName("API keys")
    class ApiKeys {

        private ApiKeyAuthenticator authenticator;

        @BeforeEach
        void setUp() {
            authenticator = new ApiKeyAuthenticator(fixture.store);
            execute(new CreateUserCommand(fixture.store, config), "admin", "--admin");
        }

        @Test
        @DisplayName("A generated key authenticates its user and only its hash is stored")
        void generatedKeyAuthenticates() throws Exception {
            final String apiKey = generateKey("admin");

            assertThat(authenticator.authenticate("Bearer " + apiKey))
                    .get()
                    .satisfies(account -> {
                        assertThat(account.username()).isEqualTo("admin");
                        assertThat(account.admin()).isTrue();
                        assertThat(account.apiKeyHash()).isEqualTo(ApiKeyAuthenticator.hashApiKey(apiKey));
                    });
        }

        @Test
        @DisplayName("A new key replaces the previous one")
        void regenerateReplaces() throws Exception {
            final String first = generateKey("admin");
            final String second = generateKey("admin");

            assertThat(second).isNotEqualTo(first);
            assertThat(authenticator.authenticate("Bearer " + first)).isEmpty();
            assertThat(authenticator.authenticate("Bearer " + second)).isPresent();
        }

        @Test
        @DisplayName("A revoked key no longer authenticates; revoking again is harmless")
        void revoke() throws Exception {
            final String apiKey = generateKey("admin");

            assertThat(execute(new RevokeApiKeyCommand(fixture.store, config), "admin")).isEqualTo(StoreCommand.EXIT_OK);
            assertThat(authenticator.authenticate("Bearer " + apiKey)).isEmpty();

            assertThat(execute(new RevokeApiKeyCommand(fixture.store, config), "admin")).isEqualTo(StoreCommand.EXIT_OK);
            assertThat(out.toString()).contains("has no API key");
        }

        @Test
        @DisplayName("Unknown users are reported")
        void unknownUser() {
            assertThat(execute(new GenerateApiKeyCommand(fixture.store, config), "ghost"))
                    .isEqualTo(StoreCommand.EXIT_FAILED);
            assertThat(err.toString()).contains("\"ghost\" does not exist");
            assertThat(execute(new RevokeApiKeyCommand(fixture.store, config), "ghost"))
                    .isEqualTo(StoreCommand.EXIT_FAILED);
        }
    }

    @Nested
    @DisplayName("create-organization")
    class CreateOrganization {

        @Test
        @DisplayName("Creates the organization and its shared directory, which a shared rebuild then picks up")
        void createsOrganization() throws Exception {
            final int exitCode = execute(new CreateOrganizationCommand(fixture.store, config), "Acme Corp");

            assertThat(exitCode).isEqualTo(StoreCommand.EXIT_OK);
            assertThat(fixture.store.listOrganizations())
                    .singleElement()
                    .satisfies(org -> {
                        assertThat(org.orgId()).isEqualTo(1L);
                        assertThat(org.name()).isEqualTo("Acme Corp");
                    });
            assertThat(fixture.sharedRoot.resolve("1")).isDirectory();

            final IndexSyncService service = fixture.newService(OrphanPolicy.CASCADE, 1);
            try {
                assertThat(service.syncShared("audit", 1L, false, false).usersScanned()).isEqualTo(1);
            } finally {
                service.shutdown();
            }
        }

        @Test
        @DisplayName("Refuses a duplicate name")
        void refusesDuplicateName() throws Exception {
            execute(new CreateOrganizationCommand(fixture.store, config), "Acme Corp", "--org-id", "5");

            assertThat(execute(new CreateOrganizationCommand(fixture.store, config), "acme corp"))
                    .isEqualTo(StoreCommand.EXIT_FAILED);
            assertThat(fixture.store.listOrganizations()).extracting(Organization::orgId).containsExactly(5L);
        }
    }
}
