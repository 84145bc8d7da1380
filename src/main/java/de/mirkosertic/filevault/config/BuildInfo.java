package de.mirkosertic.filevault.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.util.Properties;

/**
 * Version and build timestamp from the Maven-filtered build-info.properties.
 * Falls back to "dev"/"unknown" when the classes run unfiltered (IDE).
 */
public final class BuildInfo {

    private static final Logger logger = LoggerFactory.getLogger(BuildInfo.class);

    private static final String BUILD_INFO_FILE = "build-info.properties";

    private static final String version;
    private static final String buildTimestamp;

    static {
        final Properties props = new Properties();
        try (final InputStream input = BuildInfo.class.getClassLoader().getResourceAsStream(BUILD_INFO_FILE)) {
            if (input != null) {
                props.load(input);
            } else {
                logger.debug("Build info file not found, using defaults");
            }
        } catch (final IOException e) {
            logger.warn("Failed to load build info, using defaults", e);
        }

        version = filteredOrDefault(props.getProperty("build.version"), "dev");
        buildTimestamp = filteredOrDefault(props.getProperty("build.timestamp"), "unknown");
    }

    private BuildInfo() {
    }

    // An unfiltered resource still contains the ${...} placeholder
    static String filteredOrDefault(final String value, final String fallback) {
        if (value == null || value.isBlank() || value.startsWith("${")) {
            return fallback;
        }
        return value;
    }

    public static String getVersion() {
        return version;
    }

    public static String getBuildTimestamp() {
        return buildTimestamp;
    }

    /**
     * One-line description for banners and --version output.
     */
    public static String describe() {
        return "FileVault " + version + " (built " + buildTimestamp + ")";
    }
}
