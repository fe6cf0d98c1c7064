package de.mirkosertic.mcp.controlmapper.index;

import de.mirkosertic.mcp.controlmapper.analysis.TextTokenizer;
import de.mirkosertic.mcp.controlmapper.catalog.ControlCatalog;
import de.mirkosertic.mcp.controlmapper.catalog.ControlRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Okapi BM25 over the control descriptions of one catalog.
 *
 * <p>For a query term {@code t} and a control description {@code d}:</p>
 * <pre>
 * score(t,d) = IDF(t) * f(t,d) * (k1 + 1) / (f(t,d) + k1 * (1 - b + b * |d| / avgdl))
 * IDF(t)     = ln((N - df(t) + 0.5) / (df(t) + 0.5) + 1)
 * </pre>
 * <p>The score of a query is the sum over all query terms, so a term that occurs twice in the
 * query counts twice. Terms that do not occur in a description contribute nothing.</p>
 *
 * <p>All statistics are computed once in {@link #build}. The index is immutable; a changed
 * catalog needs a new index. Concurrent scoring from several threads is safe.</p>
 */
public final class Bm25Index {

    private static final Logger logger = LoggerFactory.getLogger(Bm25Index.class);

    private final ControlCatalog catalog;
    private final Bm25Parameters parameters;
    private final List<String> controlIds;
    private final List<Map<String, Integer>> termFrequencies;
    private final int[] documentLengths;
    private final Map<String, Integer> documentFrequencies;
    private final double averageDocumentLength;

    private Bm25Index(final ControlCatalog catalog,
                      final Bm25Parameters parameters,
                      final List<Map<String, Integer>> termFrequencies,
                      final int[] documentLengths,
                      final Map<String, Integer> documentFrequencies) {
        this.catalog = catalog;
        this.parameters = parameters;
        this.termFrequencies = termFrequencies;
        this.documentLengths = documentLengths;
        this.documentFrequencies = documentFrequencies;

        final List<String> ids = new ArrayList<>(catalog.size());
        long totalLength = 0;
        for (int i = 0; i < catalog.size(); i++) {
            ids.add(catalog.get(i).id());
            totalLength += documentLengths[i];
        }
        this.controlIds = Collections.unmodifiableList(ids);
        this.averageDocumentLength = (double) totalLength / catalog.size();
    }

    /**
     * Tokenize every control description and collect the corpus statistics.
     */
    public static Bm25Index build(final ControlCatalog catalog,
                                  final TextTokenizer tokenizer,
                                  final Bm25Parameters parameters) {
        final long startTime = System.nanoTime();

        final List<Map<String, Integer>> termFrequencies = new ArrayList<>(catalog.size());
        final int[] documentLengths = new int[catalog.size()];
        final Map<String, Integer> documentFrequencies = new HashMap<>();

        for (int i = 0; i < catalog.size(); i++) {
            final ControlRecord control = catalog.get(i);
            final Map<String, Integer> frequencies = new HashMap<>();
            int length = 0;
            for (final String term : tokenizer.tokenize(control.description())) {
                frequencies.merge(term, 1, Integer::sum);
                length++;
            }
            for (final String term : frequencies.keySet()) {
                documentFrequencies.merge(term, 1, Integer::sum);
            }
            termFrequencies.add(Collections.unmodifiableMap(frequencies));
            documentLengths[i] = length;
        }

        final Bm25Index index = new Bm25Index(catalog, parameters,
                Collections.unmodifiableList(termFrequencies), documentLengths,
                Collections.unmodifiableMap(documentFrequencies));

        logger.debug("Built BM25 index over {} controls in {}ms: {} distinct terms, avgdl={}",
                catalog.size(), (System.nanoTime() - startTime) / 1_000_000,
                documentFrequencies.size(), String.format("%.2f", index.averageDocumentLength));
        return index;
    }

    /**
     * Score the query against every control.
     *
     * @param queryTerms normalized query terms, duplicates included
     * @return scores in catalog order
     */
    public ScoreVector scoreAll(final Iterable<String> queryTerms) {
        final Map<String, Integer> queryTermCounts = countTerms(queryTerms);
        final double[] scores = new double[controlIds.size()];
        for (int position = 0; position < scores.length; position++) {
            scores[position] = scoreDocument(queryTermCounts, position);
        }
        return new ScoreVector(controlIds, scores);
    }

    /**
     * Score the query against a single control.
     *
     * @throws UnknownControlException if the id was not in the catalog at build time
     */
    public double score(final Iterable<String> queryTerms, final String controlId) {
        final int position = catalog.positionOf(controlId);
        if (position < 0) {
            throw new UnknownControlException(controlId);
        }
        return scoreDocument(countTerms(queryTerms), position);
    }

    /**
     * Controls ordered by score, highest first. Equal scores keep catalog order.
     */
    public List<ControlRecord> rank(final ScoreVector scores) {
        if (scores.size() != controlIds.size()) {
            throw new IllegalArgumentException("Score vector has " + scores.size()
                    + " entries, index has " + controlIds.size() + " controls");
        }
        final List<ControlRecord> ranked = new ArrayList<>(scores.size());
        for (final int position : scores.rankedPositions()) {
            ranked.add(catalog.get(position));
        }
        return ranked;
    }

    /**
     * Inverse document frequency of a term; terms outside the corpus get the maximum IDF.
     */
    public double idf(final String term) {
        final int documentCount = controlIds.size();
        final int df = documentFrequencies.getOrDefault(term, 0);
        return Math.log((documentCount - df + 0.5) / (df + 0.5) + 1.0);
    }

    private double scoreDocument(final Map<String, Integer> queryTermCounts, final int position) {
        final Map<String, Integer> frequencies = termFrequencies.get(position);
        if (frequencies.isEmpty()) {
            return 0.0;
        }

        final double k1 = parameters.k1();
        final double b = parameters.b();
        final double lengthNorm = 1.0 - b + b * documentLengths[position] / averageDocumentLength;

        double score = 0.0;
        for (final Map.Entry<String, Integer> entry : queryTermCounts.entrySet()) {
            final Integer frequency = frequencies.get(entry.getKey());
            if (frequency == null) {
                continue;
            }
            final double termScore = idf(entry.getKey()) * (frequency * (k1 + 1.0))
                    / (frequency + k1 * lengthNorm);
            score += entry.getValue() * termScore;
        }
        return score;
    }

    // First occurrence order keeps the summation order, and with it the result, reproducible
    private static Map<String, Integer> countTerms(final Iterable<String> queryTerms) {
        final Map<String, Integer> counts = new LinkedHashMap<>();
        for (final String term : queryTerms) {
            counts.merge(term, 1, Integer::sum);
        }
        return counts;
    }

    public ControlCatalog getCatalog() {
        return catalog;
    }

    public Bm25Parameters getParameters() {
        return parameters;
    }

    public int getDocumentCount() {
        return controlIds.size();
    }

    public double getAverageDocumentLength() {
        return averageDocumentLength;
    }

    public int getDistinctTermCount() {
        return documentFrequencies.size();
    }

    public int getDocumentFrequency(final String term) {
        return documentFrequencies.getOrDefault(term, 0);
    }

    /**
     * Number of terms in a control's description.
     *
     * @throws UnknownControlException if the id is unknown
     */
    public int getDocumentLength(final String controlId) {
        final int position = catalog.positionOf(controlId);
        if (position < 0) {
            throw new UnknownControlException(controlId);
        }
        return documentLengths[position];
    }
}
