package com.phillippitts.greekeval.domain;

import java.util.List;

/**
 * Minimum-cost correspondence between two token sequences, ordered left to right.
 *
 * <p>Every reference index and every hypothesis index appears exactly once across the pairs.
 *
 * @param pairs alignment steps in reading order
 */
public record WordAlignment(List<AlignedPair> pairs) {

    public WordAlignment {
        pairs = pairs == null ? List.of() : List.copyOf(pairs);
    }

    /**
     * Number of non-match steps, which equals the edit distance of the aligned sequences.
     *
     * @return cost of the alignment path
     */
    public int cost() {
        int cost = 0;
        for (AlignedPair pair : pairs) {
            if (pair.operation() != EditOperation.MATCH) {
                cost++;
            }
        }
        return cost;
    }

    public int size() {
        return pairs.size();
    }
}
