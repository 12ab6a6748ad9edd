package com.phillippitts.greekeval.domain;

/**
 * Single step of an edit path between a reference and a hypothesis token sequence.
 *
 * <p>Declaration order is the tie-break order used when several steps reach a cell
 * at the same cost.
 */
public enum EditOperation {
    MATCH,
    SUBSTITUTION,
    DELETION,
    INSERTION
}
