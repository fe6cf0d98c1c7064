package de.mirkosertic.mcp.controlmapper.enhancement;

import de.mirkosertic.mcp.controlmapper.analysis.TextTokenizer;
import de.mirkosertic.mcp.controlmapper.mapping.ConfidenceLevel;
import de.mirkosertic.mcp.controlmapper.util.TextCleaner;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Offline assessor: counts the distinct terms a control description shares with the security text.
 * More than five shared terms is a strong match, more than two a moderate one.
 */
public class KeywordOverlapAssessor implements ControlAssessor {

    static final int STRONG_OVERLAP = 5;
    static final int MODERATE_OVERLAP = 2;
    private static final int MAX_LISTED_TERMS = 5;

    private final TextTokenizer tokenizer;
    private final int excerptChars;

    public KeywordOverlapAssessor(final TextTokenizer tokenizer, final int excerptChars) {
        this.tokenizer = tokenizer;
        this.excerptChars = excerptChars;
    }

    @Override
    public ControlAssessment assess(final String serviceName, final String securityText,
                                    final String analystNote, final String controlDescription) {
        final Set<String> documentTerms = new LinkedHashSet<>(
                tokenizer.tokenize(TextCleaner.truncateAtWhitespace(securityText, excerptChars)).toList());

        final List<String> shared = new ArrayList<>();
        for (final String term : new LinkedHashSet<>(tokenizer.tokenize(controlDescription).toList())) {
            if (documentTerms.contains(term)) {
                shared.add(term);
            }
        }

        final int overlap = shared.size();
        final String terms = overlap == 0
                ? ""
                : " (" + String.join(", ", shared.subList(0, Math.min(MAX_LISTED_TERMS, overlap))) + ")";

        if (overlap > STRONG_OVERLAP) {
            return new ControlAssessment(true, ConfidenceLevel.HIGH,
                    "Strong keyword match between control and documentation: " + overlap + " shared terms" + terms + ".");
        }
        if (overlap > MODERATE_OVERLAP) {
            return new ControlAssessment(true, ConfidenceLevel.MEDIUM,
                    "Moderate keyword match between control and documentation: " + overlap + " shared terms" + terms + ".");
        }
        return new ControlAssessment(false, ConfidenceLevel.LOW,
                "Minimal keyword match between control and documentation: " + overlap + " shared terms" + terms + ".");
    }
}
