package de.mirkosertic.filevault.cli;

import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

/**
 * Root command. Without a subcommand it prints the usage.
 */
@Command(
        name = "filevault",
        description = "Self-hosted file storage backend",
        mixinStandardHelpOptions = true,
        versionProvider = BuildInfoVersionProvider.class,
        subcommands = {
                ServeCommand.class,
                McpCommand.class,
                RebuildIndexCommand.class,
                CreateUserCommand.class,
                GenerateApiKeyCommand.class,
                RevokeApiKeyCommand.class,
                CreateOrganizationCommand.class
        }
)
public class FileVaultCommand implements Runnable {

    @Spec
    private CommandSpec spec;

    @Override
    public void run() {
        spec.commandLine().usage(spec.commandLine().getOut());
    }

    public static CommandLine commandLine() {
        return new CommandLine(new FileVaultCommand());
    }
}
