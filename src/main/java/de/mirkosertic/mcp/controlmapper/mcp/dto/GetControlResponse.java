package de.mirkosertic.mcp.controlmapper.mcp.dto;

import de.mirkosertic.mcp.controlmapper.mcp.ToolResponse;

import java.util.Map;

/**
 * Response DTO for the getControl tool.
 */
public record GetControlResponse(
        boolean success,
        String controlId,
        String description,
        Map<String, String> attributes,
        Integer catalogPosition,
        Integer termCount,
        String error
) implements ToolResponse {

    public static GetControlResponse success(final String controlId, final String description,
                                             final Map<String, String> attributes,
                                             final int catalogPosition, final int termCount) {
        return new GetControlResponse(true, controlId, description, attributes, catalogPosition, termCount, null);
    }

    public static GetControlResponse error(final String errorMessage) {
        return new GetControlResponse(false, null, null, null, null, null, errorMessage);
    }
}
