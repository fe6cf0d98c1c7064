package de.mirkosertic.mcp.controlmapper.mcp.dto;

import de.mirkosertic.mcp.controlmapper.mcp.Description;

import java.util.Map;

/**
 * Request DTO for the getControl tool.
 */
public record GetControlRequest(
        @Description("Id of the control as it appears in the catalog")
        String controlId
) {
    public static GetControlRequest fromMap(final Map<String, Object> args) {
        final Object id = args.get("controlId");
        // Numeric ids arrive as JSON numbers
        return new GetControlRequest(id == null ? null : id.toString());
    }
}
