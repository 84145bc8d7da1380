package de.mirkosertic.filevault.config;

import de.mirkosertic.filevault.indexsync.OrphanPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.Yaml;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Map;
import java.util.function.Function;

/**
 * Central configuration for the FileVault server.
 * Loads configuration from YAML files and environment variables.
 * <p>
 * Configuration priority (highest to lowest):
 * 1. Environment variables
 * 2. System properties
 * 3. User config file (~/.filevault/config.yaml)
 * 4. Application defaults (application.yaml in classpath)
 */
public class ApplicationConfig {

    private static final Logger logger = LoggerFactory.getLogger(ApplicationConfig.class);

    private static final String ENV_STORAGE_ROOT = "FILEVAULT_STORAGE_ROOT";
    private static final String ENV_SHARED_ROOT = "FILEVAULT_SHARED_ROOT";
    private static final String ENV_INDEX_PATH = "FILEVAULT_INDEX_PATH";
    private static final String ENV_HTTP_PORT = "FILEVAULT_HTTP_PORT";
    private static final String PROP_PROFILE = "filevault.profile";
    private static final String CONFIG_DIR = ".filevault";
    private static final String USER_CONFIG_FILE = "config.yaml";
    private static final String DEFAULT_CONFIG_FILE = "application.yaml";

    // Storage settings
    private String storageRoot;
    private String sharedRoot;

    // Metadata index settings
    private String indexPath;
    private long nrtRefreshIntervalMs = 100;

    // HTTP settings
    private String httpHost = "127.0.0.1";
    private int httpPort = 8080;

    // Index sync settings
    private int syncThreadPoolSize = 1;
    private boolean startupAudit = true;
    private OrphanPolicy orphanPolicy = OrphanPolicy.CASCADE;
    private long scheduleIntervalMinutes = 0;
    private String scheduleMode = "audit";
    private boolean scheduleForce = false;

    // Profile settings
    private boolean deployedMode = false;

    ApplicationConfig() {
    }

    /**
     * Load configuration from all sources with proper priority.
     */
    public static ApplicationConfig load() {
        final ApplicationConfig config = new ApplicationConfig();

        config.loadFromClasspath();
        config.loadFromUserConfig();
        config.applyEnvironmentOverrides();
        config.determineProfile();

        logger.info("Configuration loaded: storageRoot={}, sharedRoot={}, indexPath={}, deployedMode={}",
                config.storageRoot, config.sharedRoot, config.indexPath, config.deployedMode);

        return config;
    }

    /**
     * Configuration with built-in defaults only, rooted at the given directories.
     * Used by embedded setups and tests that bypass the file-based sources.
     */
    public static ApplicationConfig forDirectories(final Path storageRoot, final Path sharedRoot, final Path indexPath) {
        final ApplicationConfig config = new ApplicationConfig();
        config.storageRoot = storageRoot.toString();
        config.sharedRoot = sharedRoot.toString();
        config.indexPath = indexPath.toString();
        return config;
    }

    private void loadFromClasspath() {
        try (final InputStream is = getClass().getClassLoader().getResourceAsStream(DEFAULT_CONFIG_FILE)) {
            if (is != null) {
                final Map<String, Object> config = new Yaml().load(is);
                if (config != null) {
                    applyYamlConfig(config);
                    logger.debug("Loaded defaults from classpath: {}", DEFAULT_CONFIG_FILE);
                }
            }
        } catch (final IOException e) {
            logger.warn("Failed to load default config from classpath", e);
        }
    }

    private void loadFromUserConfig() {
        final Path userConfigPath = getUserConfigPath();
        if (Files.exists(userConfigPath)) {
            try (final InputStream is = Files.newInputStream(userConfigPath)) {
                final Map<String, Object> config = new Yaml().load(is);
                if (config != null) {
                    applyYamlConfig(config);
                    logger.debug("Loaded user config from: {}", userConfigPath);
                }
            } catch (final IOException e) {
                logger.warn("Failed to load user config from: {}", userConfigPath, e);
            }
        }
    }

    @SuppressWarnings("unchecked")
    void applyYamlConfig(final Map<String, Object> config) {
        final Map<String, Object> root = (Map<String, Object>) config.get("filevault");
        if (root == null) {
            return;
        }

        final Map<String, Object> storageConfig = (Map<String, Object>) root.get("storage");
        if (storageConfig != null) {
            if (storageConfig.get("root") != null) {
                this.storageRoot = resolveVariables(storageConfig.get("root").toString());
            }
            if (storageConfig.get("shared-root") != null) {
                this.sharedRoot = resolveVariables(storageConfig.get("shared-root").toString());
            }
        }

        final Map<String, Object> indexConfig = (Map<String, Object>) root.get("index");
        if (indexConfig != null) {
            if (indexConfig.get("path") != null) {
                this.indexPath = resolveVariables(indexConfig.get("path").toString());
            }
            if (indexConfig.containsKey("nrt-refresh-interval-ms")) {
                this.nrtRefreshIntervalMs = ((Number) indexConfig.get("nrt-refresh-interval-ms")).longValue();
            }
        }

        final Map<String, Object> httpConfig = (Map<String, Object>) root.get("http");
        if (httpConfig != null) {
            if (httpConfig.get("host") != null) {
                this.httpHost = httpConfig.get("host").toString();
            }
            if (httpConfig.containsKey("port")) {
                this.httpPort = ((Number) httpConfig.get("port")).intValue();
            }
        }

        final Map<String, Object> syncConfig = (Map<String, Object>) root.get("index-sync");
        if (syncConfig != null) {
            applyIndexSyncConfig(syncConfig);
        }
    }

    @SuppressWarnings("unchecked")
    private void applyIndexSyncConfig(final Map<String, Object> syncConfig) {
        if (syncConfig.containsKey("thread-pool-size")) {
            this.syncThreadPoolSize = Math.max(1, ((Number) syncConfig.get("thread-pool-size")).intValue());
        }
        if (syncConfig.containsKey("startup-audit")) {
            this.startupAudit = (Boolean) syncConfig.get("startup-audit");
        }
        if (syncConfig.containsKey("orphan-policy")) {
            this.orphanPolicy = OrphanPolicy.fromConfigValue(syncConfig.get("orphan-policy").toString());
        }

        final Map<String, Object> scheduleConfig = (Map<String, Object>) syncConfig.get("schedule");
        if (scheduleConfig != null) {
            if (scheduleConfig.containsKey("interval-minutes")) {
                this.scheduleIntervalMinutes = ((Number) scheduleConfig.get("interval-minutes")).longValue();
            }
            if (scheduleConfig.get("mode") != null) {
                this.scheduleMode = scheduleConfig.get("mode").toString();
            }
            if (scheduleConfig.containsKey("force")) {
                this.scheduleForce = (Boolean) scheduleConfig.get("force");
            }
        }
    }

    private void applyEnvironmentOverrides() {
        applyOverrides(System::getenv);
    }

    /**
     * System properties first, then environment variables, so the environment wins.
     */
    void applyOverrides(final Function<String, String> environment) {
        final String propIndexPath = System.getProperty("filevault.index.path");
        if (propIndexPath != null && !propIndexPath.isEmpty()) {
            this.indexPath = propIndexPath;
        }
        final String propStorageRoot = System.getProperty("filevault.storage.root");
        if (propStorageRoot != null && !propStorageRoot.isEmpty()) {
            this.storageRoot = propStorageRoot;
        }

        final String envStorageRoot = environment.apply(ENV_STORAGE_ROOT);
        if (envStorageRoot != null && !envStorageRoot.isBlank()) {
            this.storageRoot = envStorageRoot.trim();
            logger.info("Storage root from environment: {}", this.storageRoot);
        }

        final String envSharedRoot = environment.apply(ENV_SHARED_ROOT);
        if (envSharedRoot != null && !envSharedRoot.isBlank()) {
            this.sharedRoot = envSharedRoot.trim();
            logger.info("Shared storage root from environment: {}", this.sharedRoot);
        }

        final String envIndexPath = environment.apply(ENV_INDEX_PATH);
        if (envIndexPath != null && !envIndexPath.isBlank()) {
            this.indexPath = envIndexPath.trim();
            logger.info("Index path from environment: {}", this.indexPath);
        }

        final String envPort = environment.apply(ENV_HTTP_PORT);
        if (envPort != null && !envPort.isBlank()) {
            try {
                this.httpPort = Integer.parseInt(envPort.trim());
            } catch (final NumberFormatException e) {
                logger.warn("Ignoring invalid {}={}", ENV_HTTP_PORT, envPort);
            }
        }

        // Defaults below the config directory if still unset
        if (this.storageRoot == null || this.storageRoot.isEmpty()) {
            this.storageRoot = getConfigDirectory().resolve("storage").toString();
        }
        if (this.sharedRoot == null || this.sharedRoot.isEmpty()) {
            this.sharedRoot = Paths.get(this.storageRoot).resolve("shared").toString();
        }
        if (this.indexPath == null || this.indexPath.isEmpty()) {
            this.indexPath = getConfigDirectory().resolve("metadata-index").toString();
        }
    }

    private void determineProfile() {
        final String profile = System.getProperty(PROP_PROFILE, "default");
        this.deployedMode = "deployed".equalsIgnoreCase(profile);
    }

    /**
     * Resolve variables in strings like ${VAR:default}
     */
    static String resolveVariables(final String value) {
        if (value == null || !value.contains("${")) {
            return value;
        }

        String result = value;
        int start;
        while ((start = result.indexOf("${")) >= 0) {
            final int end = result.indexOf("}", start);
            if (end < 0) {
                break;
            }

            final String varExpr = result.substring(start + 2, end);
            final String[] parts = varExpr.split(":", 2);
            final String varName = parts[0];
            final String defaultValue = parts.length > 1 ? parts[1] : "";

            // Check environment first, then system properties
            String replacement = System.getenv(varName);
            if (replacement == null || replacement.isEmpty()) {
                replacement = System.getProperty(varName, defaultValue);
            }

            if (replacement.contains("${")) {
                replacement = resolveVariables(replacement);
            }

            result = result.substring(0, start) + replacement + result.substring(end + 1);
        }

        return result;
    }

    public static Path getUserConfigPath() {
        return getConfigDirectory().resolve(USER_CONFIG_FILE);
    }

    public static Path getConfigDirectory() {
        return Paths.get(System.getProperty("user.home"), CONFIG_DIR);
    }

    // Getters
    public Path getStorageRoot() {
        return Paths.get(storageRoot);
    }

    public Path getSharedRoot() {
        return Paths.get(sharedRoot);
    }

    public String getIndexPath() {
        return indexPath;
    }

    public long getNrtRefreshIntervalMs() {
        return nrtRefreshIntervalMs;
    }

    public String getHttpHost() {
        return httpHost;
    }

    public int getHttpPort() {
        return httpPort;
    }

    public void setHttpPort(final int httpPort) {
        this.httpPort = httpPort;
    }

    public int getSyncThreadPoolSize() {
        return syncThreadPoolSize;
    }

    public boolean isStartupAudit() {
        return startupAudit;
    }

    public OrphanPolicy getOrphanPolicy() {
        return orphanPolicy;
    }

    public long getScheduleIntervalMinutes() {
        return scheduleIntervalMinutes;
    }

    public String getScheduleMode() {
        return scheduleMode;
    }

    public boolean isScheduleForce() {
        return scheduleForce;
    }

    public boolean isDeployedMode() {
        return deployedMode;
    }
}
