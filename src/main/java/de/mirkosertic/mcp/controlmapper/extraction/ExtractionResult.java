package de.mirkosertic.mcp.controlmapper.extraction;

import java.util.List;

/**
 * Outcome of security passage extraction.
 *
 * @param text     passages joined with line breaks, or the (truncated) full text on fallback
 * @param passages the matched passages in document order; empty on fallback
 * @param fallback true if no pattern matched and the full text was used instead
 */
public record ExtractionResult(String text, List<String> passages, boolean fallback) {

    public ExtractionResult {
        passages = List.copyOf(passages);
    }

    public static ExtractionResult empty() {
        return new ExtractionResult("", List.of(), false);
    }

    public boolean isEmpty() {
        return text.isEmpty();
    }
}
