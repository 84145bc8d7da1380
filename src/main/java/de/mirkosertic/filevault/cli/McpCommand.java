package de.mirkosertic.filevault.cli;

import de.mirkosertic.filevault.FileVaultApplication;
import de.mirkosertic.filevault.config.ApplicationConfig;
import de.mirkosertic.filevault.config.LoggingConfigurator;
import picocli.CommandLine.Command;

import java.util.concurrent.Callable;

@Command(
        name = "mcp",
        description = "Serve the storage administration tools over MCP (stdio)",
        mixinStandardHelpOptions = true
)
public class McpCommand implements Callable<Integer> {

    @Override
    public Integer call() throws Exception {
        // stdout carries JSON-RPC, so logs go to file only
        LoggingConfigurator.configure(true);

        final FileVaultApplication app = new FileVaultApplication(ApplicationConfig.load());
        app.init();
        app.startMcp();
        return 0;
    }
}
