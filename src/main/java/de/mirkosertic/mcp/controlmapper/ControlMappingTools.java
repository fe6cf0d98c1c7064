package de.mirkosertic.mcp.controlmapper;

import de.mirkosertic.mcp.controlmapper.catalog.ControlCatalog;
import de.mirkosertic.mcp.controlmapper.catalog.ControlRecord;
import de.mirkosertic.mcp.controlmapper.config.BuildInfo;
import de.mirkosertic.mcp.controlmapper.enhancement.EnhancedMapping;
import de.mirkosertic.mcp.controlmapper.enhancement.EnhancementContext;
import de.mirkosertic.mcp.controlmapper.enhancement.MappingEnhancer;
import de.mirkosertic.mcp.controlmapper.extraction.DocumentTextLoader;
import de.mirkosertic.mcp.controlmapper.extraction.ExtractedDocument;
import de.mirkosertic.mcp.controlmapper.index.Bm25Index;
import de.mirkosertic.mcp.controlmapper.mapping.ConfidenceLevel;
import de.mirkosertic.mcp.controlmapper.mapping.ConfidenceThresholds;
import de.mirkosertic.mcp.controlmapper.mapping.ControlMapper;
import de.mirkosertic.mcp.controlmapper.mapping.MappingResult;
import de.mirkosertic.mcp.controlmapper.mcp.SchemaGenerator;
import de.mirkosertic.mcp.controlmapper.mcp.ToolResultHelper;
import de.mirkosertic.mcp.controlmapper.mcp.dto.CatalogStatsResponse;
import de.mirkosertic.mcp.controlmapper.mcp.dto.EnhancedControlDto;
import de.mirkosertic.mcp.controlmapper.mcp.dto.GetControlRequest;
import de.mirkosertic.mcp.controlmapper.mcp.dto.GetControlResponse;
import de.mirkosertic.mcp.controlmapper.mcp.dto.MapControlsRequest;
import de.mirkosertic.mcp.controlmapper.mcp.dto.MapControlsResponse;
import de.mirkosertic.mcp.controlmapper.mcp.dto.RankedControlDto;
import io.modelcontextprotocol.server.McpServerFeatures;
import io.modelcontextprotocol.spec.McpSchema;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * MCP tools exposing the control mapping engine.
 * All tools answer with a response record; failures become {@code success=false} responses.
 */
public class ControlMappingTools {

    private static final Logger logger = LoggerFactory.getLogger(ControlMappingTools.class);

    private static final String MAP_CONTROLS_DESCRIPTION = """
            Map a cloud service's security documentation onto the security control catalog. \
            The service name, the analyst's threat note and the security-relevant passages of the documentation \
            are combined into one BM25 query that is scored against every control description. \
            Every control gets a confidence level relative to the best match: \
            'high' (normalized score > high threshold), 'medium' (> medium threshold) or 'low'. \
            Provide the documentation either inline (documentationText) or as a file (documentPath, optionally \
            restricted to a PDF page range). \
            Returns: the full mapping (every control id -> level, catalog order), the topN ranked controls with raw and \
            normalized scores, and with enhance=true an assessment and justification for the best-ranked controls \
            plus the final mapping of the controls that remain applicable.""";

    private final ControlMapper mapper;
    private final DocumentTextLoader documentLoader;
    private final MappingEnhancer enhancer;
    private final int defaultTopN;
    private final MappingRuntimeStats runtimeStats = new MappingRuntimeStats();

    public ControlMappingTools(final ControlMapper mapper,
                               final DocumentTextLoader documentLoader,
                               final MappingEnhancer enhancer,
                               final int defaultTopN) {
        this.mapper = mapper;
        this.documentLoader = documentLoader;
        this.enhancer = enhancer;
        this.defaultTopN = defaultTopN;
    }

    /**
     * Returns all MCP tool specifications for registration with the MCP server.
     */
    public List<McpServerFeatures.SyncToolSpecification> getToolSpecifications() {
        final List<McpServerFeatures.SyncToolSpecification> tools = new ArrayList<>();

        tools.add(McpServerFeatures.SyncToolSpecification.builder()
                .tool(McpSchema.Tool.builder()
                        .name("mapControls")
                        .description(MAP_CONTROLS_DESCRIPTION)
                        .inputSchema(SchemaGenerator.generateSchema(MapControlsRequest.class))
                        .build())
                .callHandler((exchange, request) -> mapControls(argumentsOf(request)))
                .build());

        tools.add(McpServerFeatures.SyncToolSpecification.builder()
                .tool(McpSchema.Tool.builder()
                        .name("getControl")
                        .description("Get id, description and the additional catalog columns of a single control.")
                        .inputSchema(SchemaGenerator.generateSchema(GetControlRequest.class))
                        .build())
                .callHandler((exchange, request) -> getControl(argumentsOf(request)))
                .build());

        tools.add(McpServerFeatures.SyncToolSpecification.builder()
                .tool(McpSchema.Tool.builder()
                        .name("getCatalogStats")
                        .description("Get catalog size, index statistics, BM25 parameters, confidence thresholds, "
                                + "runtime statistics of served mappings and the server version.")
                        .inputSchema(SchemaGenerator.emptySchema())
                        .build())
                .callHandler((exchange, request) -> getCatalogStats())
                .build());

        return tools;
    }

    private static Map<String, Object> argumentsOf(final McpSchema.CallToolRequest request) {
        return request.arguments() == null ? Map.of() : request.arguments();
    }

    private McpSchema.CallToolResult mapControls(final Map<String, Object> args) {
        final MapControlsRequest request;
        try {
            request = MapControlsRequest.fromMap(args);
        } catch (final IllegalArgumentException e) {
            logger.warn("Invalid map controls arguments: {}", e.getMessage());
            return ToolResultHelper.createResult(MapControlsResponse.error(e.getMessage()));
        }

        logger.info("Map controls request: service='{}', documentPath='{}', inlineText={}, enhance={}",
                request.serviceName(), request.documentPath(), request.hasDocumentationText(),
                request.effectiveEnhance());

        if (request.serviceName() == null || request.serviceName().isBlank()) {
            return ToolResultHelper.createResult(MapControlsResponse.error("serviceName is required"));
        }
        if (request.hasDocumentPath() && request.hasDocumentationText()) {
            return ToolResultHelper.createResult(MapControlsResponse.error(
                    "Provide either documentationText or documentPath, not both"));
        }

        final long startTime = System.nanoTime();
        try {
            final String documentation = request.hasDocumentPath()
                    ? loadDocument(request)
                    : request.documentationText();

            final MappingResult result = mapper.map(request.serviceName(), request.analystNote(), documentation);

            Map<String, EnhancedControlDto> enhanced = null;
            Map<String, String> finalMapping = null;
            if (request.effectiveEnhance()) {
                final EnhancedMapping enhancedMapping = enhancer.enhance(result, new EnhancementContext(
                        result.serviceName(),
                        request.analystNote() == null ? "" : request.analystNote(),
                        result.securityText(),
                        mapper.getCatalog()));
                enhanced = new LinkedHashMap<>();
                for (final var entry : enhancedMapping.controls().entrySet()) {
                    enhanced.put(entry.getKey(), EnhancedControlDto.from(entry.getValue()));
                }
                finalMapping = enhancedMapping.toFinalOutput().get(result.serviceName());
            }

            final Map<String, String> mapping = result.mapping().toOutput().get(result.serviceName());
            final List<RankedControlDto> topControls = result.topRanked(request.effectiveTopN(defaultTopN)).stream()
                    .map(RankedControlDto::from)
                    .toList();
            final long durationMs = (System.nanoTime() - startTime) / 1_000_000;

            runtimeStats.recordMapping(durationMs, result.queryTermCount(),
                    result.mapping().count(ConfidenceLevel.HIGH),
                    result.fallback());

            return ToolResultHelper.createResult(MapControlsResponse.success(result.serviceName(), mapping,
                    topControls, enhanced, finalMapping, result.queryTermCount(), result.fallback(), durationMs));

        } catch (final IllegalArgumentException e) {
            runtimeStats.recordFailure();
            logger.warn("Invalid map controls request for '{}': {}", request.serviceName(), e.getMessage());
            return ToolResultHelper.createResult(MapControlsResponse.error(e.getMessage()));
        } catch (final IOException e) {
            runtimeStats.recordFailure();
            logger.error("Error reading documentation {}", request.documentPath(), e);
            return ToolResultHelper.createResult(MapControlsResponse.error(
                    "Error reading documentation: " + e.getMessage()));
        } catch (final Exception e) {
            runtimeStats.recordFailure();
            logger.error("Unexpected error mapping controls for '{}'", request.serviceName(), e);
            return ToolResultHelper.createResult(MapControlsResponse.error("Unexpected error: " + e.getMessage()));
        }
    }

    private String loadDocument(final MapControlsRequest request) throws IOException {
        final Path path = Paths.get(request.documentPath());
        final ExtractedDocument document = documentLoader.load(path, request.startPage(), request.endPage());
        logger.debug("Loaded {} characters from {} ({})", document.content().length(), path, document.fileType());
        return document.content();
    }

    private McpSchema.CallToolResult getControl(final Map<String, Object> args) {
        final GetControlRequest request = GetControlRequest.fromMap(args);

        logger.info("Get control request: controlId='{}'", request.controlId());

        if (request.controlId() == null || request.controlId().isBlank()) {
            return ToolResultHelper.createResult(GetControlResponse.error("controlId is required"));
        }

        final ControlCatalog catalog = mapper.getCatalog();
        final Optional<ControlRecord> control = catalog.find(request.controlId().trim());
        if (control.isEmpty()) {
            logger.warn("Control not found in catalog: {}", request.controlId());
            return ToolResultHelper.createResult(GetControlResponse.error(
                    "Control not found in catalog: " + request.controlId()));
        }

        final ControlRecord record = control.get();
        return ToolResultHelper.createResult(GetControlResponse.success(record.id(), record.description(),
                record.attributes(), catalog.positionOf(record.id()),
                mapper.getIndex().getDocumentLength(record.id())));
    }

    private McpSchema.CallToolResult getCatalogStats() {
        logger.info("Catalog stats request");

        try {
            final Bm25Index index = mapper.getIndex();
            final ConfidenceThresholds thresholds = mapper.getClassifier().getThresholds();
            final MappingRuntimeStats.Percentiles percentiles = runtimeStats.getPercentiles();

            final CatalogStatsResponse.MappingRuntimeMetrics metrics = new CatalogStatsResponse.MappingRuntimeMetrics(
                    runtimeStats.getTotalMappings(),
                    runtimeStats.getFailedMappings(),
                    runtimeStats.getFallbackExtractions(),
                    String.format("%.1f", runtimeStats.getAverageDurationMs()),
                    runtimeStats.getMinDurationMs(),
                    runtimeStats.getMaxDurationMs(),
                    String.format("%.1f", runtimeStats.getAverageQueryTerms()),
                    String.format("%.1f", runtimeStats.getAverageHighControls()),
                    percentiles != null ? percentiles.p50() : null,
                    percentiles != null ? percentiles.p90() : null,
                    percentiles != null ? percentiles.p99() : null);

            return ToolResultHelper.createResult(CatalogStatsResponse.success(
                    index.getDocumentCount(),
                    mapper.getCatalog().source(),
                    index.getDistinctTermCount(),
                    String.format("%.2f", index.getAverageDocumentLength()),
                    index.getParameters().k1(),
                    index.getParameters().b(),
                    thresholds.high(),
                    thresholds.medium(),
                    BuildInfo.getVersion(),
                    BuildInfo.getBuildTimestamp(),
                    metrics));

        } catch (final Exception e) {
            logger.error("Error getting catalog stats", e);
            return ToolResultHelper.createResult(CatalogStatsResponse.error(
                    "Error getting catalog stats: " + e.getMessage()));
        }
    }

    MappingRuntimeStats getRuntimeStats() {
        return runtimeStats;
    }
}
