package de.mirkosertic.mcp.docnav;

import com.fasterxml.jackson.databind.ObjectMapper;
import de.mirkosertic.mcp.docnav.config.ApplicationConfig;
import de.mirkosertic.mcp.docnav.config.BuildInfo;
import de.mirkosertic.mcp.docnav.config.LoggingConfigurator;
import de.mirkosertic.mcp.docnav.mcp.LatestProtocolStdioServerTransportProvider;
import io.modelcontextprotocol.json.jackson.JacksonMcpJsonMapper;
import io.modelcontextprotocol.server.McpServer;
import io.modelcontextprotocol.server.McpSyncServer;
import io.modelcontextprotocol.spec.McpSchema;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Files;

/**
 * Main entry point for the MCP documentation navigator.
 * Wires the index service and tools and serves them over STDIO.
 */
public class DocNavigatorApplication {

    private static final Logger logger = LoggerFactory.getLogger(DocNavigatorApplication.class);

    private final ApplicationConfig config;
    private final DocumentIndexService indexService;
    private final DocumentationTools tools;
    private McpSyncServer mcpServer;

    public DocNavigatorApplication(final ApplicationConfig config) {
        this.config = config;
        this.indexService = new DocumentIndexService(config);
        this.tools = new DocumentationTools(indexService, config);
    }

    /**
     * Report where the index lives. The snapshot is built lazily on first use.
     */
    public void init() {
        logger.info("Initializing MCP documentation navigator {}...", BuildInfo.getVersion());

        if (!Files.isDirectory(config.getProjectRootPath())) {
            logger.warn("Project root {} does not exist, index builds will fail until it is created",
                    config.getProjectRootPath());
        }
        if (Files.exists(indexService.getSnapshotPath())) {
            logger.info("Using existing snapshot {}", indexService.getSnapshotPath());
        } else {
            logger.info("No snapshot at {}, it will be built on first use", indexService.getSnapshotPath());
        }
    }

    /**
     * Start the MCP server and block until the process is terminated.
     */
    public void start() {
        logger.info("Starting MCP server with STDIO transport...");

        final McpSchema.ServerCapabilities capabilities = McpSchema.ServerCapabilities.builder()
                .tools(true)
                .build();

        final McpSchema.Implementation serverInfo = new McpSchema.Implementation(
                "MCP Documentation Navigator",
                BuildInfo.getVersion()
        );

        final JacksonMcpJsonMapper jsonMapper = new JacksonMcpJsonMapper(new ObjectMapper());
        final LatestProtocolStdioServerTransportProvider transportProvider =
                new LatestProtocolStdioServerTransportProvider(jsonMapper);

        mcpServer = McpServer.sync(transportProvider)
                .serverInfo(serverInfo)
                .capabilities(capabilities)
                .tools(tools.getToolSpecifications())
                .build();

        logger.info("MCP server started successfully");

        Runtime.getRuntime().addShutdownHook(new Thread(this::shutdown, "shutdown-hook"));

        // The STDIO transport runs on its own threads
        try {
            Thread.currentThread().join();
        } catch (final InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.info("Main thread interrupted, shutting down...");
        }
    }

    public void shutdown() {
        logger.info("Shutting down MCP documentation navigator...");

        try {
            if (mcpServer != null) {
                mcpServer.close();
            }
        } catch (final Exception e) {
            logger.error("Error closing MCP server", e);
        }

        logger.info("Shutdown complete");
    }

    public static void main(final String[] args) {
        try {
            // Logging must be set up before the first logger writes
            final boolean deployedMode = "deployed".equals(System.getProperty("spring.profiles.active"));
            LoggingConfigurator.configure(deployedMode);

            final ApplicationConfig config = ApplicationConfig.load();

            if (!deployedMode) {
                logger.info("Running in development mode (console logging enabled)");
                logger.info("Project root: {}", config.getProjectRootPath());
                logger.info("Snapshot: {}", config.getSnapshotPath());
            }

            final DocNavigatorApplication app = new DocNavigatorApplication(config);
            app.init();
            app.start();

        } catch (final Exception e) {
            // In deployed mode nothing may be logged to the console
            System.err.println("Failed to start MCP documentation navigator: " + e.getMessage());
            e.printStackTrace(System.err);
            System.exit(1);
        }
    }
}
