package de.mirkosertic.mcp.docnav.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.util.Properties;

/**
 * Version and build timestamp of the navigator, read from the Maven-filtered
 * build-info.properties. Falls back to "dev"/"unknown" when the file is missing (IDE runs).
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

        version = nonFiltered(props.getProperty("build.version"), "dev");
        buildTimestamp = nonFiltered(props.getProperty("build.timestamp"), "unknown");
    }

    private BuildInfo() {
    }

    // An unfiltered resource still contains the raw ${...} placeholder
    private static String nonFiltered(final String value, final String fallback) {
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
}
