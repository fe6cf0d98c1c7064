package de.mirkosertic.mcp.controlmapper.mcp.dto;

import de.mirkosertic.mcp.controlmapper.mcp.ToolResponse;

import java.util.List;
import java.util.Map;

/**
 * Response DTO for the mapControls tool.
 */
public record MapControlsResponse(
        boolean success,
        String serviceName,
        Map<String, String> mapping,
        List<RankedControlDto> topControls,
        Map<String, EnhancedControlDto> enhancedMapping,
        Map<String, String> finalMapping,
        Integer queryTermCount,
        Boolean fallbackExtraction,
        Long durationMs,
        String error
) implements ToolResponse {

    public static MapControlsResponse success(final String serviceName,
                                              final Map<String, String> mapping,
                                              final List<RankedControlDto> topControls,
                                              final Map<String, EnhancedControlDto> enhancedMapping,
                                              final Map<String, String> finalMapping,
                                              final int queryTermCount,
                                              final boolean fallbackExtraction,
                                              final long durationMs) {
        return new MapControlsResponse(true, serviceName, mapping, topControls, enhancedMapping, finalMapping,
                queryTermCount, fallbackExtraction, durationMs, null);
    }

    public static MapControlsResponse error(final String errorMessage) {
        return new MapControlsResponse(false, null, null, null, null, null, null, null, null, errorMessage);
    }
}
