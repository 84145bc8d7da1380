package de.mirkosertic.filevault.config;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.joran.JoranConfigurator;
import ch.qos.logback.core.joran.spi.JoranException;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Configures logging for the different ways the server is started.
 * <p>
 * The MCP stdio server writes JSON-RPC to stdout, so in deployed mode
 * logback-deployed.xml is loaded, which logs to ~/.filevault/log only.
 * Every other mode keeps logback.xml with console output.
 */
public final class LoggingConfigurator {

    private static final String APP_LOGGER = "de.mirkosertic.filevault";
    private static final String DEPLOYED_CONFIG = "logback-deployed.xml";

    private LoggingConfigurator() {
    }

    /**
     * Must be called before anything logs.
     *
     * @param deployedMode true if stdout is reserved for the MCP transport
     */
    public static void configure(final boolean deployedMode) {
        if (deployedMode) {
            ensureLogDirectoryExists();
            loadConfiguration(DEPLOYED_CONFIG);
        }
    }

    /**
     * Map a command line verbosity (0 = quiet .. 3 = trace) to the application logger level.
     */
    public static void applyVerbosity(final int verbosity) {
        final Level level = switch (Math.max(0, Math.min(verbosity, 3))) {
            case 0 -> Level.WARN;
            case 1 -> Level.INFO;
            case 2 -> Level.DEBUG;
            default -> Level.TRACE;
        };
        if (LoggerFactory.getILoggerFactory() instanceof LoggerContext context) {
            final Logger appLogger = context.getLogger(APP_LOGGER);
            appLogger.setLevel(level);
        }
    }

    static Path logDirectory() {
        return ApplicationConfig.getConfigDirectory().resolve("log");
    }

    private static void ensureLogDirectoryExists() {
        final Path logDir = logDirectory();
        try {
            Files.createDirectories(logDir);
        } catch (final IOException e) {
            System.err.println("Warning: Could not create log directory: " + logDir);
        }
    }

    private static void loadConfiguration(final String configFile) {
        if (!(LoggerFactory.getILoggerFactory() instanceof LoggerContext context)) {
            System.err.println("Warning: Logback is not the active SLF4J provider, keeping defaults");
            return;
        }
        context.reset();

        final JoranConfigurator configurator = new JoranConfigurator();
        configurator.setContext(context);

        try (InputStream configStream = LoggingConfigurator.class.getClassLoader()
                .getResourceAsStream(configFile)) {
            if (configStream != null) {
                configurator.doConfigure(configStream);
            } else {
                System.err.println("Warning: Could not find " + configFile + " on classpath");
            }
        } catch (final JoranException e) {
            System.err.println("Warning: Error loading logback configuration: " + e.getMessage());
        } catch (final IOException e) {
            System.err.println("Warning: Could not read " + configFile + ": " + e.getMessage());
        }
    }
}
