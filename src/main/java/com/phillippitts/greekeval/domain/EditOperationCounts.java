package com.phillippitts.greekeval.domain;

/**
 * Decomposed edit distance along one optimal alignment path.
 *
 * <p>Under unit costs {@code distance == substitutions + deletions + insertions}; the
 * compact constructor rejects any record breaking that identity.
 *
 * @param substitutions tokens replaced
 * @param deletions     reference tokens missing from the hypothesis
 * @param insertions    hypothesis tokens absent from the reference
 * @param distance      total edit distance
 */
public record EditOperationCounts(
        int substitutions,
        int deletions,
        int insertions,
        int distance
) {

    private static final EditOperationCounts ZERO = new EditOperationCounts(0, 0, 0, 0);

    public EditOperationCounts {
        if (substitutions < 0 || deletions < 0 || insertions < 0) {
            throw new IllegalArgumentException("operation counts must be non-negative");
        }
        if (distance != substitutions + deletions + insertions) {
            throw new IllegalArgumentException(
                    "distance " + distance + " != S+D+I (" + substitutions + "+" + deletions + "+" + insertions + ")");
        }
    }

    /**
     * Creates counts whose distance is the sum of the three operations.
     */
    public static EditOperationCounts of(int substitutions, int deletions, int insertions) {
        return new EditOperationCounts(substitutions, deletions, insertions,
                substitutions + deletions + insertions);
    }

    /**
     * Counts for two identical (or two empty) sequences.
     */
    public static EditOperationCounts zero() {
        return ZERO;
    }
}
