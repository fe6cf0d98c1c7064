package de.mirkosertic.mcp.controlmapper.mcp;

import io.modelcontextprotocol.json.McpJsonMapper;
import io.modelcontextprotocol.server.transport.StdioServerTransportProvider;
import io.modelcontextprotocol.spec.ProtocolVersions;

import java.util.List;

/**
 * STDIO transport that negotiates the newer MCP protocol revisions, newest first.
 * The stock provider only offers {@code 2024-11-05}.
 */
public class LatestProtocolStdioServerTransportProvider extends StdioServerTransportProvider {

    static final List<String> SUPPORTED_PROTOCOL_VERSIONS = List.of(
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
