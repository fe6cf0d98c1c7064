package de.mirkosertic.mcp.controlmapper.analysis;

import org.apache.lucene.analysis.Analyzer;
import org.apache.lucene.analysis.TokenStream;
import org.apache.lucene.analysis.tokenattributes.CharTermAttribute;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * Lazy, restartable sequence of normalized terms for one piece of text.
 *
 * <p>Nothing is analyzed until {@link #iterator()} is consumed. Every call to
 * {@code iterator()} runs the analyzer again over the same text, so the sequence
 * can be traversed any number of times and always yields the same terms.</p>
 */
public final class TermSequence implements Iterable<String> {

    private final Analyzer analyzer;
    private final String fieldName;
    private final String text;

    TermSequence(final Analyzer analyzer, final String fieldName, final String text) {
        this.analyzer = analyzer;
        this.fieldName = fieldName;
        this.text = text;
    }

    public String text() {
        return text;
    }

    @Override
    public Iterator<String> iterator() {
        return new TermIterator();
    }

    public Stream<String> stream() {
        return StreamSupport.stream(spliterator(), false);
    }

    public List<String> toList() {
        final List<String> terms = new ArrayList<>();
        for (final String term : this) {
            terms.add(term);
        }
        return terms;
    }

    public boolean isEmpty() {
        return !iterator().hasNext();
    }

    /**
     * The terms joined with single spaces.
     */
    public String joined() {
        return String.join(" ", toList());
    }

    private final class TermIterator implements Iterator<String> {

        private TokenStream tokenStream;
        private CharTermAttribute termAttribute;
        private String next;
        private boolean exhausted;

        @Override
        public boolean hasNext() {
            if (next != null) {
                return true;
            }
            if (exhausted) {
                return false;
            }
            advance();
            return next != null;
        }

        @Override
        public String next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            final String result = next;
            next = null;
            return result;
        }

        private void advance() {
            try {
                if (tokenStream == null) {
                    tokenStream = analyzer.tokenStream(fieldName, text);
                    termAttribute = tokenStream.addAttribute(CharTermAttribute.class);
                    tokenStream.reset();
                }
                if (tokenStream.incrementToken()) {
                    next = termAttribute.toString();
                } else {
                    exhausted = true;
                    tokenStream.end();
                    tokenStream.close();
                }
            } catch (final IOException e) {
                exhausted = true;
                throw new UncheckedIOException("Failed to analyze text", e);
            }
        }
    }
}
