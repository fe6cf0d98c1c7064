package de.mirkosertic.mcp.controlmapper.mcp.dto;

import de.mirkosertic.mcp.controlmapper.mcp.ToolResponse;

/**
 * Response DTO for the getCatalogStats tool.
 */
public record CatalogStatsResponse(
        boolean success,
        int controlCount,
        String catalogSource,
        int distinctTerms,
        String averageDescriptionLength,
        double k1,
        double b,
        double highThreshold,
        double mediumThreshold,
        String softwareVersion,
        String buildTimestamp,
        MappingRuntimeMetrics runtimeMetrics,
        String error
) implements ToolResponse {

    /**
     * Aggregated statistics of the mappings served so far.
     */
    public record MappingRuntimeMetrics(
            long totalMappings,
            long failedMappings,
            long fallbackExtractions,
            String averageDurationMs,
            long minDurationMs,
            long maxDurationMs,
            String averageQueryTerms,
            String averageHighControls,
            Long p50Ms,
            Long p90Ms,
            Long p99Ms
    ) {
    }

    public static CatalogStatsResponse success(final int controlCount, final String catalogSource,
                                               final int distinctTerms, final String averageDescriptionLength,
                                               final double k1, final double b,
                                               final double highThreshold, final double mediumThreshold,
                                               final String softwareVersion, final String buildTimestamp,
                                               final MappingRuntimeMetrics runtimeMetrics) {
        return new CatalogStatsResponse(true, controlCount, catalogSource, distinctTerms, averageDescriptionLength,
                k1, b, highThreshold, mediumThreshold, softwareVersion, buildTimestamp, runtimeMetrics, null);
    }

    public static CatalogStatsResponse error(final String errorMessage) {
        return new CatalogStatsResponse(false, 0, null, 0, null, 0, 0, 0, 0, null, null, null, errorMessage);
    }
}
