package de.mirkosertic.mcp.controlmapper.enhancement;

import de.mirkosertic.mcp.controlmapper.mapping.ConfidenceLevel;

/**
 * Verdict of a {@link ControlAssessor} on a single control.
 */
public record ControlAssessment(boolean applicable, ConfidenceLevel confidence, String justification) {
}
