package de.mirkosertic.mcp.controlmapper.util;

import java.text.Normalizer;
import java.util.regex.Pattern;

/**
 * Text clean-up shared by the document loader, the security extractor and query composition.
 */
public final class TextCleaner {

    /**
     * Characters that never carry meaning in extracted documentation:
     * <ul>
     *   <li>U+0000-U+0008, U+000B-U+000C, U+000E-U+001F: control characters except tab, LF and CR</li>
     *   <li>U+007F-U+009F: DEL and C1 controls</li>
     *   <li>U+200B-U+200D: zero-width space, non-joiner, joiner</li>
     *   <li>U+FEFF: byte order mark</li>
     *   <li>U+FFFD: replacement character from failed decoding</li>
     * </ul>
     */
    private static final Pattern INVALID_CHARS = Pattern.compile(
            "[\\x{0000}-\\x{0008}\\x{000B}\\x{000C}\\x{000E}-\\x{001F}\\x{007F}-\\x{009F}\\x{200B}-\\x{200D}\\x{FEFF}\\x{FFFD}]");

    /**
     * Unicode spaces that PDF and office converters emit instead of U+0020.
     */
    private static final Pattern UNICODE_SPACES = Pattern.compile(
            "[\\x{00A0}\\x{1680}\\x{2000}-\\x{200A}\\x{202F}\\x{205F}\\x{3000}]");

    private static final Pattern HORIZONTAL_WHITESPACE = Pattern.compile("[\\t ]+");
    private static final Pattern LINE_BREAKS = Pattern.compile(" *\\r?\\n *");
    private static final Pattern BLANK_LINE_RUNS = Pattern.compile("\\n{3,}");
    private static final Pattern ANY_WHITESPACE = Pattern.compile("\\s+");

    private TextCleaner() {
    }

    /**
     * Normalize text as produced by a document converter.
     *
     * <ol>
     *   <li>decode common HTML entities ({@code &amp;}, {@code &#123;}, {@code &#x7B;})</li>
     *   <li>NFKC normalization (ligatures, full-width forms)</li>
     *   <li>remove invalid characters, map Unicode spaces to ASCII space</li>
     *   <li>collapse horizontal whitespace, keep paragraph breaks (at most one blank line)</li>
     *   <li>trim</li>
     * </ol>
     *
     * @param content raw converter output, may be null
     * @return normalized text, never null
     */
    public static String normalizeExtractedText(final String content) {
        if (content == null || content.isEmpty()) {
            return "";
        }
        String result = decodeHtmlEntities(content);
        result = Normalizer.normalize(result, Normalizer.Form.NFKC);
        result = INVALID_CHARS.matcher(result).replaceAll("");
        result = UNICODE_SPACES.matcher(result).replaceAll(" ");
        result = HORIZONTAL_WHITESPACE.matcher(result).replaceAll(" ");
        result = LINE_BREAKS.matcher(result).replaceAll("\n");
        result = BLANK_LINE_RUNS.matcher(result).replaceAll("\n\n");
        return result.trim();
    }

    /**
     * Remove invalid characters and collapse all whitespace, including line breaks, to single spaces.
     *
     * @param text the text to clean, may be null
     * @return cleaned single-line text, never null
     */
    public static String clean(final String text) {
        if (text == null || text.isEmpty()) {
            return "";
        }
        final String withoutInvalid = INVALID_CHARS.matcher(text).replaceAll("");
        return ANY_WHITESPACE.matcher(withoutInvalid).replaceAll(" ").trim();
    }

    /**
     * Remove invalid characters only, keeping line structure intact.
     */
    public static String cleanPreservingWhitespace(final String text) {
        if (text == null || text.isEmpty()) {
            return "";
        }
        return INVALID_CHARS.matcher(text).replaceAll("");
    }

    /**
     * Cut text to at most {@code maxChars} characters, backing off to the last whitespace
     * inside the limit so that no word is split. A limit {@code <= 0} disables the cut.
     */
    public static String truncateAtWhitespace(final String text, final int maxChars) {
        if (text == null) {
            return "";
        }
        if (maxChars <= 0 || text.length() <= maxChars) {
            return text;
        }
        int cut = maxChars;
        if (!Character.isWhitespace(text.charAt(cut))) {
            int candidate = cut;
            while (candidate > 0 && !Character.isWhitespace(text.charAt(candidate - 1))) {
                candidate--;
            }
            if (candidate > 0) {
                cut = candidate;
            }
        }
        return text.substring(0, cut).stripTrailing();
    }

    private static String decodeHtmlEntities(final String text) {
        if (!text.contains("&")) {
            return text;
        }

        final StringBuilder result = new StringBuilder(text.length());
        int i = 0;
        while (i < text.length()) {
            final char c = text.charAt(i);
            if (c == '&') {
                final int semicolon = text.indexOf(';', i + 1);
                if (semicolon > i && semicolon <= i + 10) {
                    final String decoded = decodeEntity(text.substring(i + 1, semicolon));
                    if (decoded != null) {
                        result.append(decoded);
                        i = semicolon + 1;
                        continue;
                    }
                }
            }
            result.append(c);
            i++;
        }
        return result.toString();
    }

    private static String decodeEntity(final String entity) {
        if (entity.isEmpty()) {
            return null;
        }
        if (entity.charAt(0) == '#') {
            try {
                final int codePoint = entity.length() > 1 && (entity.charAt(1) == 'x' || entity.charAt(1) == 'X')
                        ? Integer.parseInt(entity.substring(2), 16)
                        : Integer.parseInt(entity.substring(1), 10);
                return Character.isValidCodePoint(codePoint) ? new String(Character.toChars(codePoint)) : null;
            } catch (final NumberFormatException e) {
                return null;
            }
        }
        return switch (entity) {
            case "amp" -> "&";
            case "lt" -> "<";
            case "gt" -> ">";
            case "quot" -> "\"";
            case "apos" -> "'";
            case "nbsp" -> " ";
            case "mdash", "ndash" -> "-";
            case "hellip" -> "...";
            case "lsquo", "rsquo" -> "'";
            case "ldquo", "rdquo" -> "\"";
            case "bull", "middot" -> "*";
            case "sect" -> "§";
            default -> null;
        };
    }
}
