package com.phillippitts.greekeval.domain;

import java.util.Objects;

/**
 * Consolidated evaluation of one hypothesis transcript against one reference transcript.
 *
 * <p>Rates are percentages. WER and CER are clamped at the configured rate cap (200 by
 * default), so {@code wordAccuracy} and {@code charAccuracy} may be negative when insertions
 * dominate.
 *
 * @param wer                      word error rate
 * @param cer                      character error rate (whitespace excluded)
 * @param wordAccuracy             {@code 100 - wer}
 * @param charAccuracy             {@code 100 - cer}
 * @param wordOperations           substitutions, deletions and insertions at word level
 * @param diacritics               tonos comparison over the word alignment
 * @param greekCharAccuracy        character accuracy restricted to Greek letters, in [0, 100]
 * @param normalizedEditDistance   word distance divided by the longer word count
 * @param wordInformationPreserved {@code 100 - normalizedEditDistance}
 * @param referenceWordCount       normalized reference word count
 * @param hypothesisWordCount      normalized hypothesis word count
 * @param referenceCharCount       normalized reference character count, whitespace excluded
 * @param hypothesisCharCount      normalized hypothesis character count, whitespace excluded
 * @param orthography              diacritic system of the raw reference
 */
public record MetricsRecord(
        double wer,
        double cer,
        double wordAccuracy,
        double charAccuracy,
        EditOperationCounts wordOperations,
        DiacriticStats diacritics,
        double greekCharAccuracy,
        double normalizedEditDistance,
        double wordInformationPreserved,
        int referenceWordCount,
        int hypothesisWordCount,
        int referenceCharCount,
        int hypothesisCharCount,
        Orthography orthography
) {

    public MetricsRecord {
        Objects.requireNonNull(wordOperations, "wordOperations must not be null");
        Objects.requireNonNull(diacritics, "diacritics must not be null");
        Objects.requireNonNull(orthography, "orthography must not be null");
    }

    public double diacriticAccuracy() {
        return diacritics.accuracy();
    }

    public double diacriticErrors() {
        return diacritics.errorRate();
    }
}
