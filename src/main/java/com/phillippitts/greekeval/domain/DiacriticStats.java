package com.phillippitts.greekeval.domain;

/**
 * Counts of tonos marks compared across aligned reference and hypothesis words.
 *
 * <p>{@code missedDiacritics} counts only marks that were wrong inside a word the hypothesis
 * otherwise spelled correctly. Marks in deleted or wholly different words count toward
 * {@code totalDiacritics} only.
 *
 * @param totalDiacritics   marks present in the reference
 * @param correctDiacritics reference marks reproduced exactly by the hypothesis
 * @param missedDiacritics  reference marks the hypothesis got wrong within a same-base word
 * @param extraDiacritics   marks the hypothesis adds where the reference has none
 */
public record DiacriticStats(
        int totalDiacritics,
        int correctDiacritics,
        int missedDiacritics,
        int extraDiacritics
) {

    private static final double PERFECT = 100.0;

    public DiacriticStats {
        if (totalDiacritics < 0 || correctDiacritics < 0 || missedDiacritics < 0 || extraDiacritics < 0) {
            throw new IllegalArgumentException("diacritic counts must be non-negative");
        }
        if (correctDiacritics + missedDiacritics > totalDiacritics) {
            throw new IllegalArgumentException("correct + missed exceeds total diacritics");
        }
    }

    /**
     * Stats for a comparison with nothing to evaluate.
     */
    public static DiacriticStats empty() {
        return new DiacriticStats(0, 0, 0, 0);
    }

    /**
     * Share of reference marks reproduced correctly; 100 when the reference has none.
     *
     * @return accuracy percentage
     */
    public double accuracy() {
        return totalDiacritics == 0 ? PERFECT : correctDiacritics * PERFECT / totalDiacritics;
    }

    /**
     * Share of hypothesis marks that were correct; 100 when the hypothesis placed none.
     *
     * @return precision percentage
     */
    public double precision() {
        int placed = correctDiacritics + extraDiacritics;
        return placed == 0 ? PERFECT : correctDiacritics * PERFECT / placed;
    }

    /**
     * Same as {@link #accuracy()}: every reference mark is a retrieval target.
     *
     * @return recall percentage
     */
    public double recall() {
        return accuracy();
    }

    /**
     * @return {@code 100 - accuracy()}
     */
    public double errorRate() {
        return PERFECT - accuracy();
    }
}
