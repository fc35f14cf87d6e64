package de.mirkosertic.mcp.docnav.mcp;

import io.modelcontextprotocol.json.McpJsonMapper;
import io.modelcontextprotocol.server.transport.StdioServerTransportProvider;
import io.modelcontextprotocol.spec.ProtocolVersions;

import java.util.List;

/**
 * STDIO transport that negotiates the newer MCP protocol revisions as well.
 * The stock provider only offers {@code 2024-11-05}. Versions are listed newest first.
 */
public class LatestProtocolStdioServerTransportProvider extends StdioServerTransportProvider {

    private static final List<String> SUPPORTED_PROTOCOL_VERSIONS = List.of(
            ProtocolVersions.MCP_2025_06_18,
            ProtocolVersions.MCP_2025_03_26,
            ProtocolVersions.MCP_2024_11_05
    );

    public LatestProtocolStdioServerTransportProvider(final McpJsonMapper jsonMapper) {
        super(jsonMapper);
    }

    @Override
    public List<String> protocolVersions() {
        return SUPPORTED_PROTOCOL_VERSIONS;
    }
}
