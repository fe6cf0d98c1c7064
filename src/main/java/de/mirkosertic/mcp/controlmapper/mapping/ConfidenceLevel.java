package de.mirkosertic.mcp.controlmapper.mapping;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Relevance of a control relative to the best-matching control of the same query.
 */
public enum ConfidenceLevel {

    HIGH("high"),
    MEDIUM("medium"),
    LOW("low");

    private final String label;

    ConfidenceLevel(final String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }

    @JsonCreator
    public static ConfidenceLevel fromLabel(final String label) {
        return valueOf(label.trim().toUpperCase(Locale.ROOT));
    }

    @Override
    public String toString() {
        return label;
    }
}
