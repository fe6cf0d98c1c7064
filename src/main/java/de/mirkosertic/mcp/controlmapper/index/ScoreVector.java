package de.mirkosertic.mcp.controlmapper.index;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Raw BM25 scores of one query, one entry per control, in catalog order.
 */
public final class ScoreVector {

    private final List<String> controlIds;
    private final double[] scores;

    ScoreVector(final List<String> controlIds, final double[] scores) {
        if (controlIds.size() != scores.length) {
            throw new IllegalArgumentException("Expected " + controlIds.size() + " scores, got " + scores.length);
        }
        this.controlIds = Collections.unmodifiableList(new ArrayList<>(controlIds));
        this.scores = Arrays.copyOf(scores, scores.length);
    }

    /**
     * Build a vector from explicit values, mainly for classification of externally computed scores.
     */
    public static ScoreVector of(final Map<String, Double> scoresInCatalogOrder) {
        final List<String> ids = new ArrayList<>(scoresInCatalogOrder.keySet());
        final double[] values = new double[ids.size()];
        for (int i = 0; i < values.length; i++) {
            values[i] = scoresInCatalogOrder.get(ids.get(i));
        }
        return new ScoreVector(ids, values);
    }

    public int size() {
        return scores.length;
    }

    public String controlId(final int position) {
        return controlIds.get(position);
    }

    public double score(final int position) {
        return scores[position];
    }

    public List<String> controlIds() {
        return controlIds;
    }

    /**
     * The largest score, or 0 for an empty vector.
     */
    public double max() {
        double max = 0.0;
        for (final double score : scores) {
            max = Math.max(max, score);
        }
        return max;
    }

    public boolean isAllZero() {
        for (final double score : scores) {
            if (score != 0.0) {
                return false;
            }
        }
        return true;
    }

    /**
     * Catalog positions ordered by score, highest first; equal scores keep catalog order.
     */
    public List<Integer> rankedPositions() {
        final List<Integer> positions = new ArrayList<>(scores.length);
        for (int i = 0; i < scores.length; i++) {
            positions.add(i);
        }
        // List.sort is stable, so ties stay in catalog order
        positions.sort(Comparator.comparingDouble((Integer position) -> scores[position]).reversed());
        return positions;
    }

    public Map<String, Double> asMap() {
        final Map<String, Double> result = new LinkedHashMap<>();
        for (int i = 0; i < scores.length; i++) {
            result.put(controlIds.get(i), scores[i]);
        }
        return result;
    }
}
