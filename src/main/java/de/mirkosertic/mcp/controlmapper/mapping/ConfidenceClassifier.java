package de.mirkosertic.mcp.controlmapper.mapping;

import de.mirkosertic.mcp.controlmapper.index.ScoreVector;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Turns raw BM25 scores into confidence levels by normalizing against the best score of the vector.
 */
public class ConfidenceClassifier {

    private final ConfidenceThresholds thresholds;

    public ConfidenceClassifier(final ConfidenceThresholds thresholds) {
        this.thresholds = thresholds;
    }

    public static ConfidenceClassifier withDefaults() {
        return new ConfidenceClassifier(ConfidenceThresholds.defaults());
    }

    /**
     * Classify every entry of the vector. If no score is positive, every control is {@link ConfidenceLevel#LOW}.
     *
     * @return control id to level, in catalog order
     */
    public Map<String, ConfidenceLevel> classify(final ScoreVector scores) {
        final double max = scores.max();
        final Map<String, ConfidenceLevel> levels = new LinkedHashMap<>();
        for (int i = 0; i < scores.size(); i++) {
            levels.put(scores.controlId(i), levelOf(normalize(scores.score(i), max)));
        }
        return Collections.unmodifiableMap(levels);
    }

    /**
     * Score divided by the maximum, or 0 when the maximum is not positive.
     */
    public static double normalize(final double score, final double max) {
        if (max <= 0.0) {
            return 0.0;
        }
        return score / max;
    }

    public ConfidenceLevel levelOf(final double normalizedScore) {
        if (normalizedScore > thresholds.high()) {
            return ConfidenceLevel.HIGH;
        }
        if (normalizedScore > thresholds.medium()) {
            return ConfidenceLevel.MEDIUM;
        }
        return ConfidenceLevel.LOW;
    }

    public ConfidenceThresholds getThresholds() {
        return thresholds;
    }
}
