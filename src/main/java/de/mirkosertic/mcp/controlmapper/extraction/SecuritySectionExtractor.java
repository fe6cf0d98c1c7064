package de.mirkosertic.mcp.controlmapper.extraction;

import de.mirkosertic.mcp.controlmapper.util.TextCleaner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Keeps the security relevant sentences of a documentation text.
 *
 * <p>The text is split into paragraphs at blank lines; line breaks inside a paragraph are
 * treated as spaces (converters wrap lines mid-sentence). Each paragraph is split into
 * sentences after {@code . ! ? ;}. A sentence is kept when any of the configured patterns
 * is found in it. Patterns are plain regular expressions matched case-insensitively,
 * so new keywords can be added through configuration.</p>
 *
 * <p>If nothing matches, the full text is returned (cut to {@code fallbackMaxChars}) so that a
 * non-blank document never produces an empty query.</p>
 */
public class SecuritySectionExtractor {

    private static final Logger logger = LoggerFactory.getLogger(SecuritySectionExtractor.class);

    private static final Pattern PARAGRAPH_BREAK = Pattern.compile("\\n\\s*\\n");
    private static final Pattern SENTENCE_END = Pattern.compile("(?<=[.!?;])\\s+");

    private final List<Pattern> patterns;
    private final int fallbackMaxChars;

    /**
     * @param patterns         regular expressions; at least one is required
     * @param fallbackMaxChars maximum length of the fallback text, {@code <= 0} for no limit
     * @throws java.util.regex.PatternSyntaxException if a pattern does not compile
     */
    public SecuritySectionExtractor(final List<String> patterns, final int fallbackMaxChars) {
        if (patterns == null || patterns.isEmpty()) {
            throw new IllegalArgumentException("At least one security pattern is required");
        }
        final List<Pattern> compiled = new ArrayList<>(patterns.size());
        for (final String pattern : patterns) {
            compiled.add(Pattern.compile(pattern, Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE));
        }
        this.patterns = List.copyOf(compiled);
        this.fallbackMaxChars = fallbackMaxChars;
    }

    public List<Pattern> getPatterns() {
        return patterns;
    }

    public ExtractionResult extract(final String text) {
        final String cleaned = TextCleaner.cleanPreservingWhitespace(text).replace("\r\n", "\n").replace('\r', '\n');
        if (cleaned.isBlank()) {
            return ExtractionResult.empty();
        }

        final Set<String> passages = new LinkedHashSet<>();
        for (final String paragraph : PARAGRAPH_BREAK.split(cleaned)) {
            final String flattened = TextCleaner.clean(paragraph);
            if (flattened.isEmpty()) {
                continue;
            }
            for (final String sentence : SENTENCE_END.split(flattened)) {
                if (!sentence.isEmpty() && isSecurityRelevant(sentence)) {
                    passages.add(sentence);
                }
            }
        }

        if (passages.isEmpty()) {
            final String fallback = TextCleaner.truncateAtWhitespace(TextCleaner.clean(cleaned), fallbackMaxChars);
            logger.debug("No security passages found in {} characters, falling back to full text ({} characters)",
                    cleaned.length(), fallback.length());
            return new ExtractionResult(fallback, List.of(), true);
        }

        logger.debug("Extracted {} security passages from {} characters", passages.size(), cleaned.length());
        return new ExtractionResult(String.join("\n", passages), new ArrayList<>(passages), false);
    }

    boolean isSecurityRelevant(final String passage) {
        for (final Pattern pattern : patterns) {
            if (pattern.matcher(passage).find()) {
                return true;
            }
        }
        return false;
    }
}
