package de.mirkosertic.mcp.docnav.config;

import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.joran.JoranConfigurator;
import ch.qos.logback.core.joran.spi.JoranException;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Switches logback to the file-only configuration when the server runs as a deployed
 * STDIO process, where stdout belongs to the MCP JSON-RPC stream.
 * <p>
 * In default mode, logback.xml (stderr appender) is picked up automatically.
 */
public final class LoggingConfigurator {

    private static final Path LOG_DIR = Paths.get(System.getProperty("user.home"), ".docnav", "log");
    private static final String DEPLOYED_CONFIG = "logback-deployed.xml";

    private LoggingConfigurator() {
    }

    /**
     * Must be called before the first logger is used.
     *
     * @param deployedMode true if running in deployed mode (STDIO transport)
     */
    public static void configure(final boolean deployedMode) {
        if (deployedMode) {
            ensureLogDirectoryExists();
            loadConfiguration(DEPLOYED_CONFIG);
        }
    }

    private static void ensureLogDirectoryExists() {
        try {
            Files.createDirectories(LOG_DIR);
        } catch (final IOException e) {
            System.err.println("Warning: Could not create log directory: " + LOG_DIR);
        }
    }

    private static void loadConfiguration(final String configFile) {
        final LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();
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
        } catch (final JoranException | IOException e) {
            System.err.println("Warning: Error loading logback configuration: " + e.getMessage());
        }
    }
}
