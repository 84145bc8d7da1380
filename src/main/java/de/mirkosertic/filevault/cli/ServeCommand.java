package de.mirkosertic.filevault.cli;

import de.mirkosertic.filevault.FileVaultApplication;
import de.mirkosertic.filevault.config.ApplicationConfig;
import de.mirkosertic.filevault.config.LoggingConfigurator;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.util.concurrent.Callable;

@Command(
        name = "serve",
        description = "Start the administrative HTTP server",
        mixinStandardHelpOptions = true
)
public class ServeCommand implements Callable<Integer> {

    @Option(names = "--port", paramLabel = "<port>", description = "HTTP port (default: from configuration)")
    private Integer port;

    @Override
    public Integer call() throws Exception {
        // Configure logging FIRST, before any other code that might log
        final boolean deployedMode = "deployed".equalsIgnoreCase(System.getProperty("filevault.profile"));
        LoggingConfigurator.configure(deployedMode);

        final ApplicationConfig config = ApplicationConfig.load();
        if (port != null) {
            config.setHttpPort(port);
        }

        final FileVaultApplication app = new FileVaultApplication(config);
        app.init();
        app.startHttp();
        return 0;
    }
}
