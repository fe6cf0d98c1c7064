package de.mirkosertic.mcp.controlmapper.mapping;

import de.mirkosertic.mcp.controlmapper.analysis.TermSequence;
import de.mirkosertic.mcp.controlmapper.analysis.TextTokenizer;
import de.mirkosertic.mcp.controlmapper.catalog.ControlCatalog;
import de.mirkosertic.mcp.controlmapper.catalog.ControlRecord;
import de.mirkosertic.mcp.controlmapper.config.ApplicationConfig;
import de.mirkosertic.mcp.controlmapper.extraction.ExtractionResult;
import de.mirkosertic.mcp.controlmapper.extraction.SecuritySectionExtractor;
import de.mirkosertic.mcp.controlmapper.index.Bm25Index;
import de.mirkosertic.mcp.controlmapper.index.Bm25Parameters;
import de.mirkosertic.mcp.controlmapper.index.ScoreVector;
import de.mirkosertic.mcp.controlmapper.util.TextCleaner;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Maps a service's documentation onto the control catalog.
 *
 * <p>The composite query is {@code serviceName + " " + analystNote + " " + excerpt}, where the
 * excerpt is the security-relevant part of the documentation cut to a configurable length.
 * Every control of the catalog is scored against that query and labelled relative to the best score.</p>
 *
 * <p>The relevance index is built once in the constructor. Instances are immutable and may
 * be shared between threads.</p>
 */
public class ControlMapper {

    private static final Logger logger = LoggerFactory.getLogger(ControlMapper.class);

    private static final int DEBUG_TOP_CONTROLS = 5;

    private final ControlCatalog catalog;
    private final TextTokenizer tokenizer;
    private final SecuritySectionExtractor extractor;
    private final Bm25Index index;
    private final ConfidenceClassifier classifier;
    private final int maxDocumentChars;

    public ControlMapper(final ControlCatalog catalog,
                         final TextTokenizer tokenizer,
                         final SecuritySectionExtractor extractor,
                         final Bm25Parameters parameters,
                         final ConfidenceClassifier classifier,
                         final int maxDocumentChars) {
        this.catalog = catalog;
        this.tokenizer = tokenizer;
        this.extractor = extractor;
        this.classifier = classifier;
        this.maxDocumentChars = maxDocumentChars;
        this.index = Bm25Index.build(catalog, tokenizer, parameters);
    }

    /**
     * Wire a mapper for the given catalog from configuration.
     */
    public static ControlMapper create(final ControlCatalog catalog, final ApplicationConfig config) {
        return new ControlMapper(
                catalog,
                new TextTokenizer(config.getTokenizerSettings()),
                new SecuritySectionExtractor(config.getSecurityPatterns(), config.getFallbackMaxChars()),
                config.getBm25Parameters(),
                new ConfidenceClassifier(config.getConfidenceThresholds()),
                config.getMaxDocumentChars());
    }

    /**
     * Map one service. Null arguments are treated as empty text.
     *
     * @param serviceName       name of the service, part of the query and key of the mapping
     * @param analystNote       free-text threat description
     * @param documentationText the service's documentation as plain text
     * @return the mapping with one level per catalog control, and the ranking behind it
     * @throws EmptyQueryException if the composite query contains no terms
     */
    public MappingResult map(final @Nullable String serviceName,
                             final @Nullable String analystNote,
                             final @Nullable String documentationText) {
        final long startTime = System.nanoTime();
        final String service = serviceName == null ? "" : serviceName;
        final String note = analystNote == null ? "" : analystNote;

        final ExtractionResult extraction = extractor.extract(documentationText == null ? "" : documentationText);
        if (extraction.fallback()) {
            logger.debug("No security passages found for '{}', using {} characters of the full text",
                    service, extraction.text().length());
        } else {
            logger.debug("Extracted {} security passages for '{}'", extraction.passages().size(), service);
        }

        final String excerpt = TextCleaner.truncateAtWhitespace(extraction.text(), maxDocumentChars);
        final TermSequence query = tokenizer.tokenize(service + " " + note + " " + excerpt);
        final List<String> queryTerms = query.toList();
        if (queryTerms.isEmpty()) {
            throw new EmptyQueryException(service);
        }

        final ScoreVector scores = index.scoreAll(queryTerms);
        final Map<String, ConfidenceLevel> levels = classifier.classify(scores);
        final List<RankedControl> ranking = rank(scores, levels);
        final ConfidenceMapping mapping = new ConfidenceMapping(service, levels);

        if (logger.isDebugEnabled()) {
            for (final RankedControl control : ranking.subList(0, Math.min(DEBUG_TOP_CONTROLS, ranking.size()))) {
                logger.debug("#{} {} score={} normalized={} level={}", control.rank(), control.id(),
                        String.format("%.4f", control.score()), String.format("%.3f", control.normalizedScore()),
                        control.level());
            }
        }

        logger.info("Mapped '{}' onto {} controls: {} query terms, {} high, {} medium in {}ms",
                service, mapping.size(), queryTerms.size(),
                mapping.count(ConfidenceLevel.HIGH), mapping.count(ConfidenceLevel.MEDIUM),
                (System.nanoTime() - startTime) / 1_000_000);

        return new MappingResult(mapping, ranking, excerpt, queryTerms.size(), extraction.fallback());
    }

    private List<RankedControl> rank(final ScoreVector scores, final Map<String, ConfidenceLevel> levels) {
        final double max = scores.max();
        final List<ControlRecord> ordered = index.rank(scores);
        final List<RankedControl> ranking = new ArrayList<>(ordered.size());
        int rank = 1;
        for (final ControlRecord control : ordered) {
            final double score = scores.score(catalog.positionOf(control.id()));
            ranking.add(new RankedControl(rank++, control.id(), control.description(), score,
                    ConfidenceClassifier.normalize(score, max), levels.get(control.id())));
        }
        return ranking;
    }

    public ControlCatalog getCatalog() {
        return catalog;
    }

    public Bm25Index getIndex() {
        return index;
    }

    public TextTokenizer getTokenizer() {
        return tokenizer;
    }

    public ConfidenceClassifier getClassifier() {
        return classifier;
    }

    public int getMaxDocumentChars() {
        return maxDocumentChars;
    }
}
