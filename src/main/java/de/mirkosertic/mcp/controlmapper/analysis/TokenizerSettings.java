package de.mirkosertic.mcp.controlmapper.analysis;

import org.jspecify.annotations.Nullable;

/**
 * Settings for the term normalization chain.
 *
 * @param minTokenLength    terms shorter than this are dropped
 * @param stemmingLanguage  Snowball stemmer name (e.g. {@code "English"}), or null to disable stemming
 */
public record TokenizerSettings(int minTokenLength, @Nullable String stemmingLanguage) {

    public static final int DEFAULT_MIN_TOKEN_LENGTH = 2;

    /**
     * Upper bound for a single term. Longer runs are almost always extraction garbage
     * (base64 blobs, hashes, concatenated table cells).
     */
    public static final int MAX_TOKEN_LENGTH = 64;

    public TokenizerSettings {
        if (minTokenLength < 1 || minTokenLength > MAX_TOKEN_LENGTH) {
            throw new IllegalArgumentException("minTokenLength must be between 1 and " + MAX_TOKEN_LENGTH
                    + ", got " + minTokenLength);
        }
        if (stemmingLanguage != null && stemmingLanguage.isBlank()) {
            stemmingLanguage = null;
        }
    }

    public static TokenizerSettings defaults() {
        return new TokenizerSettings(DEFAULT_MIN_TOKEN_LENGTH, null);
    }

    public boolean isStemmingEnabled() {
        return stemmingLanguage != null;
    }
}
