package com.phillippitts.greekeval.config.properties;

import com.phillippitts.greekeval.domain.NormalizationConfig;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;

/**
 * Typed properties for transcript normalization ({@code eval.normalization.*}).
 *
 * <p>Every flag defaults to {@code true}. Bound once at startup and converted into the
 * immutable {@link NormalizationConfig} used as the evaluation default.
 */
@ConfigurationProperties(prefix = "eval.normalization")
public class NormalizationProperties {

    private final boolean lowercase;
    private final boolean removePunctuation;

    /** Fold polytonic oxeia/varia/perispomeni vowels to monotonic tonos. */
    private final boolean normalizeDiacritics;

    /** Keep digits when punctuation is removed. */
    private final boolean normalizeNumbers;
    private final boolean normalizeWhitespace;

    /** Final sigma and dialytika-with-tonos folding. */
    private final boolean greekSpecific;

    @ConstructorBinding
    public NormalizationProperties(Boolean lowercase, Boolean removePunctuation, Boolean normalizeDiacritics,
                                   Boolean normalizeNumbers, Boolean normalizeWhitespace, Boolean greekSpecific) {
        this.lowercase = lowercase == null || lowercase;
        this.removePunctuation = removePunctuation == null || removePunctuation;
        this.normalizeDiacritics = normalizeDiacritics == null || normalizeDiacritics;
        this.normalizeNumbers = normalizeNumbers == null || normalizeNumbers;
        this.normalizeWhitespace = normalizeWhitespace == null || normalizeWhitespace;
        this.greekSpecific = greekSpecific == null || greekSpecific;
    }

    /**
     * Convenience constructor with every flag enabled.
     */
    public NormalizationProperties() {
        this(null, null, null, null, null, null);
    }

    public NormalizationConfig toConfig() {
        return new NormalizationConfig(lowercase, removePunctuation, normalizeDiacritics,
                normalizeNumbers, normalizeWhitespace, greekSpecific);
    }

    public boolean isLowercase() {
        return lowercase;
    }

    public boolean isRemovePunctuation() {
        return removePunctuation;
    }

    public boolean isNormalizeDiacritics() {
        return normalizeDiacritics;
    }

    public boolean isNormalizeNumbers() {
        return normalizeNumbers;
    }

    public boolean isNormalizeWhitespace() {
        return normalizeWhitespace;
    }

    public boolean isGreekSpecific() {
        return greekSpecific;
    }
}
