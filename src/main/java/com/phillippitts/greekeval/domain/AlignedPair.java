package com.phillippitts.greekeval.domain;

import java.util.Objects;

/**
 * One step of a {@link WordAlignment}.
 *
 * <p>A {@code null} reference index marks an insertion, a {@code null} hypothesis index a
 * deletion. Matches and substitutions carry both indices.
 *
 * @param referenceIndex  index into the reference tokens, or null for an insertion
 * @param hypothesisIndex index into the hypothesis tokens, or null for a deletion
 * @param operation       the edit step this pair represents
 */
public record AlignedPair(
        Integer referenceIndex,
        Integer hypothesisIndex,
        EditOperation operation
) {

    public AlignedPair {
        Objects.requireNonNull(operation, "operation");
        switch (operation) {
            case MATCH, SUBSTITUTION -> {
                if (referenceIndex == null || hypothesisIndex == null) {
                    throw new IllegalArgumentException(operation + " requires both indices");
                }
            }
            case DELETION -> {
                if (referenceIndex == null || hypothesisIndex != null) {
                    throw new IllegalArgumentException("DELETION requires only a reference index");
                }
            }
            case INSERTION -> {
                if (referenceIndex != null || hypothesisIndex == null) {
                    throw new IllegalArgumentException("INSERTION requires only a hypothesis index");
                }
            }
        }
    }

    public static AlignedPair match(int referenceIndex, int hypothesisIndex) {
        return new AlignedPair(referenceIndex, hypothesisIndex, EditOperation.MATCH);
    }

    public static AlignedPair substitution(int referenceIndex, int hypothesisIndex) {
        return new AlignedPair(referenceIndex, hypothesisIndex, EditOperation.SUBSTITUTION);
    }

    public static AlignedPair deletion(int referenceIndex) {
        return new AlignedPair(referenceIndex, null, EditOperation.DELETION);
    }

    public static AlignedPair insertion(int hypothesisIndex) {
        return new AlignedPair(null, hypothesisIndex, EditOperation.INSERTION);
    }

    /**
     * @return true when both sides carry a token (match or substitution)
     */
    public boolean isPaired() {
        return referenceIndex != null && hypothesisIndex != null;
    }
}
