package de.mirkosertic.mcp.controlmapper.mcp.dto;

import de.mirkosertic.mcp.controlmapper.enhancement.EnhancedControl;

/**
 * Result of the enhancement stage for one control.
 */
public record EnhancedControlDto(
        String confidence,
        String baseConfidence,
        boolean applicable,
        boolean assessed,
        String justification
) {
    public static EnhancedControlDto from(final EnhancedControl control) {
        return new EnhancedControlDto(control.confidence().label(), control.baseConfidence().label(),
                control.applicable(), control.assessed(), control.justification());
    }
}
