package de.mirkosertic.mcp.controlmapper.mcp.dto;

import de.mirkosertic.mcp.controlmapper.mapping.RankedControl;

/**
 * A ranked control as returned by the mapControls tool.
 */
public record RankedControlDto(
        int rank,
        String controlId,
        String description,
        double score,
        double normalizedScore,
        String confidence
) {
    public static RankedControlDto from(final RankedControl control) {
        return new RankedControlDto(control.rank(), control.id(), control.description(),
                control.score(), control.normalizedScore(), control.level().label());
    }
}
