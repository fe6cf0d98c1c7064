package de.mirkosertic.mcp.controlmapper.mapping;

/**
 * Band boundaries on the max-normalized score range {@code [0, 1]}.
 *
 * <p>A control whose normalized score is strictly greater than {@code high} is classified
 * {@link ConfidenceLevel#HIGH}, strictly greater than {@code medium} is
 * {@link ConfidenceLevel#MEDIUM}, everything else is {@link ConfidenceLevel#LOW}.</p>
 *
 * <p>{@code medium} must stay below 1: the best control normalizes to exactly 1 and has to
 * land above the low band whenever any score is positive.</p>
 *
 * @param high   lower (exclusive) bound of the high band
 * @param medium lower (exclusive) bound of the medium band
 */
public record ConfidenceThresholds(double high, double medium) {

    public static final double DEFAULT_HIGH = 0.7;
    public static final double DEFAULT_MEDIUM = 0.4;

    public ConfidenceThresholds {
        if (Double.isNaN(high) || Double.isNaN(medium)
                || medium < 0 || medium >= 1 || high > 1 || medium > high) {
            throw new IllegalArgumentException(
                    "Thresholds must satisfy 0 <= medium <= high <= 1 and medium < 1, got high="
                            + high + ", medium=" + medium);
        }
    }

    public static ConfidenceThresholds defaults() {
        return new ConfidenceThresholds(DEFAULT_HIGH, DEFAULT_MEDIUM);
    }
}
