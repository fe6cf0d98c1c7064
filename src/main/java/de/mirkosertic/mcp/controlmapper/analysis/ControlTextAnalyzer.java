package de.mirkosertic.mcp.controlmapper.analysis;

import com.google.common.io.Resources;
import org.apache.lucene.analysis.Analyzer;
import org.apache.lucene.analysis.CharArraySet;
import org.apache.lucene.analysis.LowerCaseFilter;
import org.apache.lucene.analysis.StopFilter;
import org.apache.lucene.analysis.TokenStream;
import org.apache.lucene.analysis.Tokenizer;
import org.apache.lucene.analysis.WordlistLoader;
import org.apache.lucene.analysis.icu.ICUFoldingFilter;
import org.apache.lucene.analysis.miscellaneous.LengthFilter;
import org.apache.lucene.analysis.pattern.PatternReplaceFilter;
import org.apache.lucene.analysis.snowball.SnowballFilter;
import org.apache.lucene.analysis.standard.StandardTokenizer;

import java.io.IOException;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.net.URL;
import java.nio.charset.StandardCharsets;
import java.util.regex.Pattern;

/**
 * Analyzer used for control descriptions and for the composite mapping query.
 *
 * <p>Token chain:
 * {@code StandardTokenizer -> LowerCaseFilter -> ICUFoldingFilter -> PatternReplaceFilter(strip punctuation)
 * -> LengthFilter(min, 64) -> StopFilter(English) [-> SnowballFilter(language)]}</p>
 *
 * <p>ICU folding maps ligatures and diacritics produced by PDF extraction onto plain
 * letters, so "ﬁrewall" in a converted document matches "firewall" in the catalog.
 * Punctuation inside tokens ("u.s.", "don't", "tls_1") is removed and the remaining
 * letters and digits are kept as one term.</p>
 *
 * <p>Token stream components are not reused between calls. A {@link TermSequence}
 * may be abandoned half way through iteration, which would leave a reused stream
 * in an unclosed state.</p>
 */
public class ControlTextAnalyzer extends Analyzer {

    static final String STOPWORDS_RESOURCE = "stopwords_en.txt";

    private static final Pattern NON_ALPHANUMERIC = Pattern.compile("[^\\p{L}\\p{N}]+");

    private static final ReuseStrategy NO_REUSE = new ReuseStrategy() {
        @Override
        public TokenStreamComponents getReusableComponents(final Analyzer analyzer, final String fieldName) {
            return null;
        }

        @Override
        public void setReusableComponents(final Analyzer analyzer, final String fieldName,
                                          final TokenStreamComponents components) {
            // nothing is cached
        }
    };

    private static final CharArraySet ENGLISH_STOP_WORDS = loadStopWords();

    private final TokenizerSettings settings;

    public ControlTextAnalyzer(final TokenizerSettings settings) {
        super(NO_REUSE);
        this.settings = settings;
    }

    public TokenizerSettings getSettings() {
        return settings;
    }

    public static CharArraySet stopWords() {
        return ENGLISH_STOP_WORDS;
    }

    @Override
    protected TokenStreamComponents createComponents(final String fieldName) {
        final Tokenizer tokenizer = new StandardTokenizer();
        TokenStream stream = new LowerCaseFilter(tokenizer);
        stream = new ICUFoldingFilter(stream);
        stream = new PatternReplaceFilter(stream, NON_ALPHANUMERIC, "", true);
        stream = new LengthFilter(stream, settings.minTokenLength(), TokenizerSettings.MAX_TOKEN_LENGTH);
        stream = new StopFilter(stream, ENGLISH_STOP_WORDS);
        if (settings.isStemmingEnabled()) {
            stream = new SnowballFilter(stream, settings.stemmingLanguage());
        }
        return new TokenStreamComponents(tokenizer, stream);
    }

    private static CharArraySet loadStopWords() {
        final URL url = Resources.getResource(STOPWORDS_RESOURCE);
        try (final Reader reader = Resources.asCharSource(url, StandardCharsets.UTF_8).openBufferedStream()) {
            return CharArraySet.unmodifiableSet(WordlistLoader.getWordSet(reader, "#"));
        } catch (final IOException e) {
            throw new UncheckedIOException("Cannot load stop words from " + STOPWORDS_RESOURCE, e);
        }
    }
}
