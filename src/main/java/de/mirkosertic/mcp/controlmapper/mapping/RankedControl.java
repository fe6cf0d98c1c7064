package de.mirkosertic.mcp.controlmapper.mapping;

/**
 * One control in the ranking of a mapping run.
 *
 * @param rank            1-based position, best first
 * @param id              control id
 * @param description     control description
 * @param score           raw BM25 score
 * @param normalizedScore score divided by the best score of the run
 * @param level           assigned confidence level
 */
public record RankedControl(
        int rank,
        String id,
        String description,
        double score,
        double normalizedScore,
        ConfidenceLevel level
) {
}
