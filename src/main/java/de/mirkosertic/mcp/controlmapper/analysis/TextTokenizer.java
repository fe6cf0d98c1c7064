package de.mirkosertic.mcp.controlmapper.analysis;

import org.apache.lucene.analysis.Analyzer;
import org.jspecify.annotations.Nullable;

/**
 * Splits text into normalized terms for indexing and querying.
 *
 * <p>The same instance must be used for the control corpus and for the query,
 * otherwise terms will not line up.</p>
 */
public class TextTokenizer {

    static final String FIELD_NAME = "content";

    private final Analyzer analyzer;

    public TextTokenizer(final TokenizerSettings settings) {
        this(new ControlTextAnalyzer(settings));
    }

    public TextTokenizer(final Analyzer analyzer) {
        this.analyzer = analyzer;
    }

    public static TextTokenizer withDefaults() {
        return new TextTokenizer(TokenizerSettings.defaults());
    }

    public TermSequence tokenize(final @Nullable String text) {
        return new TermSequence(analyzer, FIELD_NAME, text == null ? "" : text);
    }
}
