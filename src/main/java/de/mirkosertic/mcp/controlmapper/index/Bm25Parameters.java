package de.mirkosertic.mcp.controlmapper.index;

/**
 * Tunable BM25 constants.
 *
 * @param k1 term frequency saturation, must be {@code >= 0}
 * @param b  document length normalization, must be within {@code [0, 1]}
 */
public record Bm25Parameters(double k1, double b) {

    public static final double DEFAULT_K1 = 1.5;
    public static final double DEFAULT_B = 0.75;

    public Bm25Parameters {
        if (Double.isNaN(k1) || k1 < 0) {
            throw new IllegalArgumentException("k1 must be >= 0, got " + k1);
        }
        if (Double.isNaN(b) || b < 0 || b > 1) {
            throw new IllegalArgumentException("b must be within [0, 1], got " + b);
        }
    }

    public static Bm25Parameters defaults() {
        return new Bm25Parameters(DEFAULT_K1, DEFAULT_B);
    }
}
