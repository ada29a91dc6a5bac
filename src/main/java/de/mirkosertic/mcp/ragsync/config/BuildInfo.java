package de.mirkosertic.mcp.ragsync.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.util.Properties;

/**
 * Version and build timestamp of the running server, taken from the Maven-filtered build-info.properties.
 * Unfiltered placeholders (running from an IDE) fall back to "dev" and "unknown".
 */
public final class BuildInfo {

    private static final Logger logger = LoggerFactory.getLogger(BuildInfo.class);

    private static final String BUILD_INFO_FILE = "build-info.properties";
    private static final String DEFAULT_VERSION = "dev";
    private static final String DEFAULT_TIMESTAMP = "unknown";

    private static final Properties PROPERTIES = loadProperties();

    private BuildInfo() {
    }

    public static String getVersion() {
        return valueOrDefault("build.version", DEFAULT_VERSION);
    }

    public static String getBuildTimestamp() {
        return valueOrDefault("build.timestamp", DEFAULT_TIMESTAMP);
    }

    /**
     * One-line description used in the startup banner.
     */
    public static String describe() {
        return getVersion() + " (built " + getBuildTimestamp() + ")";
    }

    private static String valueOrDefault(final String key, final String fallback) {
        final String value = PROPERTIES.getProperty(key);
        if (value == null || value.isBlank() || value.startsWith("${")) {
            return fallback;
        }
        return value;
    }

    private static Properties loadProperties() {
        final Properties props = new Properties();
        try (final InputStream input = BuildInfo.class.getClassLoader().getResourceAsStream(BUILD_INFO_FILE)) {
            if (input != null) {
                props.load(input);
            } else {
                logger.debug("{} not found on classpath, using defaults", BUILD_INFO_FILE);
            }
        } catch (final IOException e) {
            logger.warn("Failed to load build info, using defaults", e);
        }
        return props;
    }
}
