package com.phillippitts.greekeval.domain;

/**
 * Immutable switches controlling how transcripts are canonicalized before comparison.
 *
 * @param lowercase           fold case before comparing
 * @param removePunctuation   replace every non-Greek, non-whitespace character with a space
 * @param normalizeDiacritics fold polytonic accented vowels to their monotonic accented form
 * @param normalizeNumbers    keep digits when punctuation is removed
 * @param normalizeWhitespace collapse whitespace runs and trim
 * @param greekSpecific       fold final sigma to medial sigma and dialytika-with-tonos to dialytika
 */
public record NormalizationConfig(
        boolean lowercase,
        boolean removePunctuation,
        boolean normalizeDiacritics,
        boolean normalizeNumbers,
        boolean normalizeWhitespace,
        boolean greekSpecific
) {

    private static final NormalizationConfig DEFAULTS =
            new NormalizationConfig(true, true, true, true, true, true);

    /**
     * Returns the configuration used when a caller does not supply one (every flag enabled).
     *
     * @return default normalization configuration
     */
    public static NormalizationConfig defaults() {
        return DEFAULTS;
    }

    /**
     * Returns a configuration that leaves text untouched apart from NFC normalization.
     *
     * @return configuration with every flag disabled
     */
    public static NormalizationConfig none() {
        return new NormalizationConfig(false, false, false, false, false, false);
    }
}
