package de.mirkosertic.mcp.controlmapper.enhancement;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import de.mirkosertic.mcp.controlmapper.mapping.ConfidenceLevel;

/**
 * A control after the enhancement stage.
 *
 * @param baseConfidence level assigned by BM25 classification
 * @param confidence     final level, the assessor's verdict for assessed controls
 * @param applicable     whether the control applies to the service
 * @param assessed       whether an assessor looked at this control
 * @param description    control description
 * @param justification  reason for the final level
 */
@JsonPropertyOrder({"confidence", "applicable", "description", "justification", "base_confidence"})
public record EnhancedControl(
        @JsonProperty("base_confidence") ConfidenceLevel baseConfidence,
        @JsonProperty("confidence") ConfidenceLevel confidence,
        @JsonProperty("applicable") boolean applicable,
        @JsonIgnore boolean assessed,
        @JsonProperty("description") String description,
        @JsonProperty("justification") String justification
) {

    public static final String BM25_JUSTIFICATION = "Based on BM25 retrieval score";

    /**
     * A control that keeps its BM25 level.
     */
    public static EnhancedControl unassessed(final ConfidenceLevel level, final String description) {
        return new EnhancedControl(level, level, true, false, description, BM25_JUSTIFICATION);
    }
}
