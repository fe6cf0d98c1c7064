package de.mirkosertic.mcp.controlmapper;

import com.fasterxml.jackson.databind.ObjectMapper;
import de.mirkosertic.mcp.controlmapper.catalog.ControlCatalog;
import de.mirkosertic.mcp.controlmapper.catalog.ControlCatalogLoader;
import de.mirkosertic.mcp.controlmapper.config.ApplicationConfig;
import de.mirkosertic.mcp.controlmapper.config.BuildInfo;
import de.mirkosertic.mcp.controlmapper.config.LoggingConfigurator;
import de.mirkosertic.mcp.controlmapper.enhancement.AssessingMappingEnhancer;
import de.mirkosertic.mcp.controlmapper.enhancement.EnhancedMapping;
import de.mirkosertic.mcp.controlmapper.enhancement.EnhancementContext;
import de.mirkosertic.mcp.controlmapper.enhancement.KeywordOverlapAssessor;
import de.mirkosertic.mcp.controlmapper.enhancement.MappingEnhancer;
import de.mirkosertic.mcp.controlmapper.extraction.DocumentTextLoader;
import de.mirkosertic.mcp.controlmapper.extraction.ExtractedDocument;
import de.mirkosertic.mcp.controlmapper.mapping.ControlMapper;
import de.mirkosertic.mcp.controlmapper.mapping.MappingResult;
import de.mirkosertic.mcp.controlmapper.mapping.RankedControl;
import de.mirkosertic.mcp.controlmapper.mcp.LatestProtocolStdioServerTransportProvider;
import de.mirkosertic.mcp.controlmapper.output.MappingReportWriter;
import io.modelcontextprotocol.json.jackson.JacksonMcpJsonMapper;
import io.modelcontextprotocol.server.McpServer;
import io.modelcontextprotocol.server.McpSyncServer;
import io.modelcontextprotocol.spec.McpSchema;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Main entry point.
 * <p>
 * With command line arguments a single service is mapped and the JSON report printed to stdout.
 * Without arguments the control mapper runs as MCP server on STDIO.
 */
public class ControlMapperApplication {

    private static final Logger logger = LoggerFactory.getLogger(ControlMapperApplication.class);

    private final ControlMapper mapper;
    private final ControlMappingTools tools;
    private McpSyncServer mcpServer;

    public ControlMapperApplication(final ApplicationConfig config, final ControlCatalog catalog) {
        this.mapper = ControlMapper.create(catalog, config);
        this.tools = new ControlMappingTools(mapper, new DocumentTextLoader(),
                createEnhancer(mapper, config, config.getEnhancementTopN()), config.getTopN());
    }

    static MappingEnhancer createEnhancer(final ControlMapper mapper, final ApplicationConfig config, final int topN) {
        return new AssessingMappingEnhancer(
                new KeywordOverlapAssessor(mapper.getTokenizer(), config.getEnhancementExcerptChars()), topN);
    }

    /**
     * Start the MCP server and block until the process is terminated.
     */
    public void start() {
        logger.info("Starting MCP server with STDIO transport...");

        final McpSchema.ServerCapabilities capabilities = McpSchema.ServerCapabilities.builder()
                .tools(false)
                .build();

        final McpSchema.Implementation serverInfo = new McpSchema.Implementation(
                "MCP Control Mapper",
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

        logger.info("MCP server started with {} controls from {}",
                mapper.getCatalog().size(), mapper.getCatalog().source());

        Runtime.getRuntime().addShutdownHook(new Thread(this::shutdown, "shutdown-hook"));

        try {
            Thread.currentThread().join();
        } catch (final InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.info("Main thread interrupted, shutting down...");
        }
    }

    public void shutdown() {
        logger.info("Shutting down MCP Control Mapper...");
        try {
            if (mcpServer != null) {
                mcpServer.close();
            }
        } catch (final Exception e) {
            logger.error("Error closing MCP server", e);
        }
    }

    /**
     * One-shot mapping as requested on the command line.
     *
     * @return process exit code
     */
    static int runCommandLine(final CommandLineOptions options, final ApplicationConfig config,
                              final PrintStream out, final PrintStream err) {
        if (options.help()) {
            out.print(CommandLineOptions.USAGE);
            return 0;
        }

        try {
            final Path catalogPath = options.controlsPath() != null
                    ? options.controlsPath()
                    : configuredCatalogPath(config);

            final ControlCatalog catalog = new ControlCatalogLoader(config.getIdColumn(), config.getDescriptionColumn())
                    .load(catalogPath);
            final ControlMapper mapper = ControlMapper.create(catalog, config);

            final ExtractedDocument document = new DocumentTextLoader()
                    .load(options.documentPath(), options.startPage(), options.endPage());

            final MappingResult result = mapper.map(options.serviceName(), options.analystNote(), document.content());

            final int topN = options.topN() != null ? options.topN() : config.getTopN();
            for (final RankedControl control : result.topRanked(topN)) {
                logger.info("#{} control {} ({}): score={}", control.rank(), control.id(), control.level(),
                        String.format("%.4f", control.score()));
            }

            EnhancedMapping enhanced = null;
            if (options.isEnhancementRequested()) {
                enhanced = createEnhancer(mapper, config, options.enhanceTopN()).enhance(result,
                        new EnhancementContext(result.serviceName(), options.analystNote(),
                                result.securityText(), catalog));
            }

            final MappingReportWriter writer = new MappingReportWriter();
            out.println(writer.toJson(result.mapping(), enhanced));
            if (options.outputPath() != null) {
                writer.write(result.mapping(), enhanced, options.outputPath());
            }
            return 0;

        } catch (final IOException e) {
            logger.error("Control mapping failed", e);
            err.println("Error: " + e.getMessage());
            return 1;
        } catch (final IllegalArgumentException e) {
            err.println("Error: " + e.getMessage());
            return 1;
        }
    }

    private static Path configuredCatalogPath(final ApplicationConfig config) {
        if (config.getCatalogPath() == null || config.getCatalogPath().isBlank()) {
            throw new IllegalArgumentException(
                    "No control catalog given, use --controls or set CONTROLMAPPER_CATALOG");
        }
        return Paths.get(config.getCatalogPath());
    }

    public static void main(final String[] args) {
        if (args.length > 0) {
            LoggingConfigurator.configure(false);
            final int exitCode;
            try {
                exitCode = runCommandLine(CommandLineOptions.parse(args), ApplicationConfig.load(),
                        System.out, System.err);
            } catch (final IllegalArgumentException e) {
                System.err.println("Error: " + e.getMessage());
                System.err.print(CommandLineOptions.USAGE);
                System.exit(1);
                return;
            }
            System.exit(exitCode);
            return;
        }

        try {
            // Configure logging FIRST, before any other code that might log
            final boolean deployedMode = "deployed".equalsIgnoreCase(System.getProperty("controlmapper.profile"));
            LoggingConfigurator.configure(deployedMode);

            final ApplicationConfig config = ApplicationConfig.load();
            final ControlCatalog catalog = new ControlCatalogLoader(config.getIdColumn(), config.getDescriptionColumn())
                    .load(configuredCatalogPath(config));

            if (!deployedMode) {
                logger.info("Running in development mode (console logging enabled)");
            }

            new ControlMapperApplication(config, catalog).start();

        } catch (final Exception e) {
            // In deployed mode, we can't log to console, so write to stderr
            System.err.println("Failed to start MCP Control Mapper: " + e.getMessage());
            e.printStackTrace(System.err);
            System.exit(1);
        }
    }

    ControlMappingTools getTools() {
        return tools;
    }
}
