package com.phillippitts.greekeval.domain;

/**
 * Diacritic system used by a Greek text.
 */
public enum Orthography {

    /** Single accent mark (tonos), standard Modern Greek since 1982. Also the default for unaccented text. */
    MONOTONIC("monotonic"),

    /** Traditional multi-accent system with breathings (U+1F00–U+1FFF). */
    POLYTONIC("polytonic"),

    /** Both systems present in the same text. */
    MIXED("mixed");

    private final String value;

    Orthography(String value) {
        this.value = value;
    }

    /**
     * Lowercase identifier used on the wire.
     *
     * @return wire value, e.g. {@code "monotonic"}
     */
    public String value() {
        return value;
    }
}
