package de.mirkosertic.mcp.ragsync.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.Yaml;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Central configuration for the MCP RAG Sync Server.
 * Loads configuration from YAML files and environment variables.
 * <p>
 * Configuration priority (highest to lowest):
 * 1. System properties
 * 2. Environment variables
 * 3. User config file (~/.mcpragsync/config.yaml)
 * 4. Application defaults (application.yaml in classpath)
 */
public class ApplicationConfig {

    private static final Logger logger = LoggerFactory.getLogger(ApplicationConfig.class);

    private static final String ENV_STORE_PATH = "RAG_STORE_PATH";
    private static final String ENV_WATCH_DIRECTORIES = "RAG_WATCH_DIRECTORIES";
    private static final String ENV_HTTP_PORT = "RAG_HTTP_PORT";
    private static final String ENV_DOWNSTREAM_URL = "RAG_DOWNSTREAM_URL";
    private static final String PROP_STORE_PATH = "rag.store.path";
    private static final String PROP_HTTP_PORT = "rag.http.port";
    private static final String CONFIG_DIR = ".mcpragsync";
    private static final String USER_CONFIG_FILE = "config.yaml";
    private static final String DEFAULT_CONFIG_FILE = "application.yaml";

    // Store settings
    private String storePath;
    private boolean backupOnClear = true;

    // Sync settings
    private List<String> directories = new ArrayList<>();
    private List<String> includePatterns = List.of("*.jsonl");
    private List<String> excludePatterns = List.of("**/.git/**", "**/node_modules/**");
    private boolean watchEnabled = true;
    private long watchPollIntervalMs = 2000;
    private long watchDebounceMs = 1500;
    private long duplicateWindowMs = 2000;
    private long eventHistoryTtlMs = 60000;
    private int queueCapacity = 10000;
    private int threadPoolSize = 4;
    private boolean syncOnStartup = true;
    private long fullScanIntervalMs = 30000;
    private String stateFile;

    // Reconciliation settings
    private boolean reconciliationEnabled = true;
    private long reconciliationIntervalMs = 60000;
    private int orphanBatchLimit = 5;
    private double corruptionRatio = 0.5;

    // Downstream served index
    private String downstreamUrl = "";
    private long downstreamTimeoutMs = 5000;

    // Boundaries
    private boolean httpEnabled = true;
    private String httpHost = "127.0.0.1";
    private int httpPort = 5000;
    private boolean mcpEnabled = false;

    // Query defaults
    private int defaultMaxResults = 5;
    private String defaultMode = "hybrid";

    // Profile settings
    private boolean deployedMode = false;

    private ApplicationConfig() {
    }

    /**
     * Load configuration from all sources with proper priority.
     */
    public static ApplicationConfig load() {
        final ApplicationConfig config = new ApplicationConfig();

        // Step 1: Load application defaults from classpath
        config.loadFromClasspath();

        // Step 2: Load user config file (may override some settings)
        config.loadFromUserConfig();

        // Step 3: Apply environment variables and system properties (highest priority)
        config.applyEnvironmentOverrides();

        // Step 4: Determine profile/mode
        config.determineProfile();

        logger.info("Configuration loaded: storePath={}, directories={}, httpPort={}, deployedMode={}",
                config.storePath, config.directories.size(), config.httpPort, config.deployedMode);

        return config;
    }

    /**
     * Build a configuration from a YAML document only, without user file or environment.
     * Used by tests and embedded setups.
     */
    public static ApplicationConfig fromYaml(final String yamlContent) {
        final ApplicationConfig config = new ApplicationConfig();
        final Map<String, Object> yaml = new Yaml().load(yamlContent);
        if (yaml != null) {
            config.applyYamlConfig(yaml);
        }
        config.applyDefaults();
        return config;
    }

    private void loadFromClasspath() {
        try (final InputStream is = getClass().getClassLoader().getResourceAsStream(DEFAULT_CONFIG_FILE)) {
            if (is != null) {
                final Yaml yaml = new Yaml();
                final Map<String, Object> config = yaml.load(is);
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
                final Yaml yaml = new Yaml();
                final Map<String, Object> config = yaml.load(is);
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
    private void applyYamlConfig(final Map<String, Object> config) {
        final Map<String, Object> ragConfig = (Map<String, Object>) config.get("rag");
        if (ragConfig == null) {
            return;
        }

        final Map<String, Object> storeConfig = (Map<String, Object>) ragConfig.get("store");
        if (storeConfig != null) {
            if (storeConfig.get("path") != null) {
                this.storePath = resolveVariables(storeConfig.get("path").toString());
            }
            if (storeConfig.containsKey("backup-on-clear")) {
                this.backupOnClear = (Boolean) storeConfig.get("backup-on-clear");
            }
        }

        final Map<String, Object> syncConfig = (Map<String, Object>) ragConfig.get("sync");
        if (syncConfig != null) {
            applySyncConfig(syncConfig);
        }

        final Map<String, Object> reconciliationConfig = (Map<String, Object>) ragConfig.get("reconciliation");
        if (reconciliationConfig != null) {
            applyReconciliationConfig(reconciliationConfig);
        }

        final Map<String, Object> downstreamConfig = (Map<String, Object>) ragConfig.get("downstream");
        if (downstreamConfig != null) {
            if (downstreamConfig.get("url") != null) {
                this.downstreamUrl = resolveVariables(downstreamConfig.get("url").toString());
            }
            if (downstreamConfig.containsKey("timeout-ms")) {
                this.downstreamTimeoutMs = ((Number) downstreamConfig.get("timeout-ms")).longValue();
            }
        }

        final Map<String, Object> httpConfig = (Map<String, Object>) ragConfig.get("http");
        if (httpConfig != null) {
            if (httpConfig.containsKey("enabled")) {
                this.httpEnabled = (Boolean) httpConfig.get("enabled");
            }
            if (httpConfig.get("host") != null) {
                this.httpHost = httpConfig.get("host").toString();
            }
            if (httpConfig.containsKey("port")) {
                this.httpPort = ((Number) httpConfig.get("port")).intValue();
            }
        }

        final Map<String, Object> mcpConfig = (Map<String, Object>) ragConfig.get("mcp");
        if (mcpConfig != null && mcpConfig.containsKey("enabled")) {
            this.mcpEnabled = (Boolean) mcpConfig.get("enabled");
        }

        final Map<String, Object> queryConfig = (Map<String, Object>) ragConfig.get("query");
        if (queryConfig != null) {
            if (queryConfig.containsKey("max-results")) {
                this.defaultMaxResults = ((Number) queryConfig.get("max-results")).intValue();
            }
            if (queryConfig.get("default-mode") != null) {
                this.defaultMode = queryConfig.get("default-mode").toString();
            }
        }
    }

    @SuppressWarnings("unchecked")
    private void applySyncConfig(final Map<String, Object> syncConfig) {
        if (syncConfig.get("directories") instanceof List) {
            final List<String> resolved = new ArrayList<>();
            for (final Object dir : (List<Object>) syncConfig.get("directories")) {
                resolved.add(resolveVariables(dir.toString()));
            }
            this.directories = resolved;
        }
        if (syncConfig.get("include-patterns") instanceof List) {
            this.includePatterns = new ArrayList<>((List<String>) syncConfig.get("include-patterns"));
        }
        if (syncConfig.get("exclude-patterns") instanceof List) {
            this.excludePatterns = new ArrayList<>((List<String>) syncConfig.get("exclude-patterns"));
        }
        if (syncConfig.containsKey("watch-enabled")) {
            this.watchEnabled = (Boolean) syncConfig.get("watch-enabled");
        }
        if (syncConfig.containsKey("watch-poll-interval-ms")) {
            this.watchPollIntervalMs = ((Number) syncConfig.get("watch-poll-interval-ms")).longValue();
        }
        if (syncConfig.containsKey("watch-debounce-ms")) {
            this.watchDebounceMs = ((Number) syncConfig.get("watch-debounce-ms")).longValue();
        }
        if (syncConfig.containsKey("duplicate-window-ms")) {
            this.duplicateWindowMs = ((Number) syncConfig.get("duplicate-window-ms")).longValue();
        }
        if (syncConfig.containsKey("event-history-ttl-ms")) {
            this.eventHistoryTtlMs = ((Number) syncConfig.get("event-history-ttl-ms")).longValue();
        }
        if (syncConfig.containsKey("queue-capacity")) {
            this.queueCapacity = ((Number) syncConfig.get("queue-capacity")).intValue();
        }
        if (syncConfig.containsKey("thread-pool-size")) {
            this.threadPoolSize = ((Number) syncConfig.get("thread-pool-size")).intValue();
        }
        if (syncConfig.containsKey("sync-on-startup")) {
            this.syncOnStartup = (Boolean) syncConfig.get("sync-on-startup");
        }
        if (syncConfig.containsKey("full-scan-interval-ms")) {
            this.fullScanIntervalMs = ((Number) syncConfig.get("full-scan-interval-ms")).longValue();
        }
        if (syncConfig.get("state-file") != null) {
            this.stateFile = resolveVariables(syncConfig.get("state-file").toString());
        }
    }

    private void applyReconciliationConfig(final Map<String, Object> reconciliationConfig) {
        if (reconciliationConfig.containsKey("enabled")) {
            this.reconciliationEnabled = (Boolean) reconciliationConfig.get("enabled");
        }
        if (reconciliationConfig.containsKey("interval-ms")) {
            this.reconciliationIntervalMs = ((Number) reconciliationConfig.get("interval-ms")).longValue();
        }
        if (reconciliationConfig.containsKey("orphan-batch-limit")) {
            this.orphanBatchLimit = ((Number) reconciliationConfig.get("orphan-batch-limit")).intValue();
        }
        if (reconciliationConfig.containsKey("corruption-ratio")) {
            this.corruptionRatio = ((Number) reconciliationConfig.get("corruption-ratio")).doubleValue();
        }
    }

    private void applyEnvironmentOverrides() {
        final String envStorePath = System.getenv(ENV_STORE_PATH);
        if (envStorePath != null && !envStorePath.trim().isEmpty()) {
            this.storePath = envStorePath.trim();
            logger.info("Store path from environment: {}", this.storePath);
        }

        // Watch directories from environment (overrides all other sources)
        final String envDirs = System.getenv(ENV_WATCH_DIRECTORIES);
        if (envDirs != null && !envDirs.trim().isEmpty()) {
            this.directories = new ArrayList<>();
            for (final String dir : envDirs.split(",")) {
                final String trimmed = dir.trim();
                if (!trimmed.isEmpty()) {
                    this.directories.add(trimmed);
                }
            }
            logger.info("Watch directories from environment: {}", this.directories);
        }

        final String envPort = System.getenv(ENV_HTTP_PORT);
        if (envPort != null && !envPort.isBlank()) {
            try {
                this.httpPort = Integer.parseInt(envPort.trim());
            } catch (final NumberFormatException e) {
                logger.warn("Ignoring invalid {} value: {}", ENV_HTTP_PORT, envPort);
            }
        }

        final String envDownstream = System.getenv(ENV_DOWNSTREAM_URL);
        if (envDownstream != null && !envDownstream.isBlank()) {
            this.downstreamUrl = envDownstream.trim();
        }

        final String propStorePath = System.getProperty(PROP_STORE_PATH);
        if (propStorePath != null && !propStorePath.isEmpty()) {
            this.storePath = propStorePath;
        }
        final String propPort = System.getProperty(PROP_HTTP_PORT);
        if (propPort != null && !propPort.isEmpty()) {
            this.httpPort = Integer.parseInt(propPort);
        }

        applyDefaults();
    }

    private void applyDefaults() {
        if (this.storePath == null || this.storePath.isEmpty()) {
            this.storePath = getConfigDirectory().resolve("knowledge-base.json").toString();
        }
    }

    private void determineProfile() {
        final String profile = System.getProperty("profile", "default");
        this.deployedMode = "deployed".equalsIgnoreCase(profile);
    }

    /**
     * Resolve variables in strings like ${VAR:default}
     */
    private String resolveVariables(final String value) {
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
    public String getStorePath() {
        return storePath;
    }

    public boolean isBackupOnClear() {
        return backupOnClear;
    }

    public List<String> getDirectories() {
        return directories;
    }

    public List<String> getIncludePatterns() {
        return includePatterns;
    }

    public List<String> getExcludePatterns() {
        return excludePatterns;
    }

    public boolean isWatchEnabled() {
        return watchEnabled;
    }

    public long getWatchPollIntervalMs() {
        return watchPollIntervalMs;
    }

    public long getWatchDebounceMs() {
        return watchDebounceMs;
    }

    public long getDuplicateWindowMs() {
        return duplicateWindowMs;
    }

    public long getEventHistoryTtlMs() {
        return eventHistoryTtlMs;
    }

    public int getQueueCapacity() {
        return queueCapacity;
    }

    public int getThreadPoolSize() {
        return threadPoolSize;
    }

    public boolean isSyncOnStartup() {
        return syncOnStartup;
    }

    public long getFullScanIntervalMs() {
        return fullScanIntervalMs;
    }

    public String getStateFile() {
        return stateFile;
    }

    public boolean isReconciliationEnabled() {
        return reconciliationEnabled;
    }

    public long getReconciliationIntervalMs() {
        return reconciliationIntervalMs;
    }

    public int getOrphanBatchLimit() {
        return orphanBatchLimit;
    }

    public double getCorruptionRatio() {
        return corruptionRatio;
    }

    public String getDownstreamUrl() {
        return downstreamUrl;
    }

    public long getDownstreamTimeoutMs() {
        return downstreamTimeoutMs;
    }

    public boolean isHttpEnabled() {
        return httpEnabled;
    }

    public String getHttpHost() {
        return httpHost;
    }

    public int getHttpPort() {
        return httpPort;
    }

    public boolean isMcpEnabled() {
        return mcpEnabled || deployedMode;
    }

    public int getDefaultMaxResults() {
        return defaultMaxResults;
    }

    public String getDefaultMode() {
        return defaultMode;
    }

    public boolean isDeployedMode() {
        return deployedMode;
    }
}
