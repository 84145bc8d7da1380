package de.mirkosertic.filevault.cli;

import de.mirkosertic.filevault.MetadataStore;
import de.mirkosertic.filevault.config.ApplicationConfig;
import de.mirkosertic.filevault.model.Organization;
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

/**
 * Create an organization together with its shared storage directory.
 */
@Command(
        name = "create-organization",
        description = "Create an organization and its shared storage directory",
        mixinStandardHelpOptions = true
)
public class CreateOrganizationCommand extends StoreCommand {

    private static final Logger logger = LoggerFactory.getLogger(CreateOrganizationCommand.class);

    @Parameters(index = "0", paramLabel = "<name>", description = "Organization name, e.g. \"Acme Corp\"")
    private String name;

    @Option(names = "--org-id", paramLabel = "<id>", description = "Numeric organization id (default: next free id)")
    private Long orgId;

    public CreateOrganizationCommand() {
        this(null, null);
    }

    public CreateOrganizationCommand(@Nullable final MetadataStore store, @Nullable final ApplicationConfig config) {
        super(store, config);
    }

    @Override
    protected int execute(final MetadataStore store, final ApplicationConfig config, final PrintWriter out,
                          final PrintWriter err) throws IOException {
        long max = 0;
        for (final Organization existing : store.listOrganizations()) {
            if (existing.name().equalsIgnoreCase(name)) {
                err.println("Organization \"" + name + "\" already exists (id=" + existing.orgId() + ")");
                return EXIT_FAILED;
            }
            if (orgId != null && existing.orgId() == orgId) {
                err.println("Organization id " + orgId + " is already taken");
                return EXIT_FAILED;
            }
            max = Math.max(max, existing.orgId());
        }

        final Organization organization = new Organization(orgId != null ? orgId : max + 1, name);
        store.saveOrganization(organization);
        store.commit();

        final Path sharedDirectory = config.getSharedRoot().resolve(Long.toString(organization.orgId()));
        Files.createDirectories(sharedDirectory);
        logger.info("Created organization {} (id={})", name, organization.orgId());

        out.println("Created organization: " + name + " (id=" + organization.orgId() + ")");
        out.println("Shared storage: " + sharedDirectory);
        return EXIT_OK;
    }
}
