package de.mirkosertic.mcp.controlmapper.mapping;

import java.util.List;

/**
 * Everything one mapping run produced.
 *
 * @param mapping        level per control, catalog order
 * @param ranking        all controls ordered by score, best first
 * @param securityText   the documentation excerpt that went into the query
 * @param queryTermCount number of terms in the composite query
 * @param fallback       true if no security passage was found and the full text was used
 */
public record MappingResult(
        ConfidenceMapping mapping,
        List<RankedControl> ranking,
        String securityText,
        int queryTermCount,
        boolean fallback
) {

    public MappingResult {
        ranking = List.copyOf(ranking);
    }

    public String serviceName() {
        return mapping.serviceName();
    }

    /**
     * The best {@code n} controls; a negative n returns the full ranking.
     */
    public List<RankedControl> topRanked(final int n) {
        if (n < 0 || n >= ranking.size()) {
            return ranking;
        }
        return ranking.subList(0, n);
    }
}
