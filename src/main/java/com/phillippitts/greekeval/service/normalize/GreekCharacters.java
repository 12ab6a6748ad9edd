package com.phillippitts.greekeval.service.normalize;

/**
 * Unicode ranges, combining marks and predicates for Greek script handling.
 *
 * <p>Shared by normalization, orthography detection, diacritic alignment and the Greek-only
 * character accuracy so every component agrees on what counts as Greek.
 *
 * @since 1.0
 */
public final class GreekCharacters {

    /** Lowercase monotonic vowels carrying a tonos, including dialytika-with-tonos: άέήίόύώΐΰ. */
    public static final String MONOTONIC_ACCENTED = "\u03AC\u03AD\u03AE\u03AF\u03CC\u03CD\u03CE\u0390\u03B0";

    public static final char FINAL_SIGMA = '\u03C2';
    public static final char SIGMA = '\u03C3';

    /** Greek and Coptic block. */
    private static final int BASIC_START = 0x0370;
    private static final int BASIC_END = 0x03FF;

    /** Greek Extended block (polytonic precomposed letters). */
    private static final int EXTENDED_START = 0x1F00;
    private static final int EXTENDED_END = 0x1FFF;

    /** Lowercase and capital vowels that can carry a tonos. */
    private static final String VOWELS = "\u03B1\u03B5\u03B7\u03B9\u03BF\u03C5\u03C9"
            + "\u0391\u0395\u0397\u0399\u039F\u03A5\u03A9";

    /** Combining grave, the polytonic varia. */
    public static final int VARIA = 0x0300;

    /** Combining acute: the monotonic tonos and the polytonic oxeia. */
    public static final int TONOS = 0x0301;

    /** Combining Greek perispomeni (circumflex). */
    public static final int PERISPOMENI = 0x0342;

    public static final int DIALYTIKA = 0x0308;

    /** Smooth breathing. */
    public static final int PSILI = 0x0313;

    /** Rough breathing. */
    public static final int DASIA = 0x0314;

    /** Iota subscript. */
    public static final int YPOGEGRAMMENI = 0x0345;

    private GreekCharacters() {
        // Utility class - prevent instantiation
    }

    /**
     * @return true if the code point lies in U+0370–U+03FF or U+1F00–U+1FFF
     */
    public static boolean isGreekScript(int codePoint) {
        return (codePoint >= BASIC_START && codePoint <= BASIC_END)
                || isPolytonicRange(codePoint);
    }

    /**
     * Greek-script code point that is a letter (excludes spacing accents and numeral signs).
     */
    public static boolean isGreekLetter(int codePoint) {
        return isGreekScript(codePoint) && Character.isLetter(codePoint);
    }

    /**
     * @return true if the code point lies in the Greek Extended block
     */
    public static boolean isPolytonicRange(int codePoint) {
        return codePoint >= EXTENDED_START && codePoint <= EXTENDED_END;
    }

    /**
     * @return true for the lowercase tonos vowels of {@link #MONOTONIC_ACCENTED}
     */
    public static boolean isMonotonicAccented(int codePoint) {
        return MONOTONIC_ACCENTED.indexOf(codePoint) >= 0;
    }

    /**
     * @return true for the seven vowels, either case, without any mark
     */
    public static boolean isVowel(int codePoint) {
        return VOWELS.indexOf(codePoint) >= 0;
    }

    /**
     * @return true for varia, tonos/oxeia and perispomeni
     */
    public static boolean isAccentMark(int codePoint) {
        return codePoint == VARIA || codePoint == TONOS || codePoint == PERISPOMENI;
    }

    /**
     * @return true for any combining mark (nonspacing, spacing or enclosing)
     */
    public static boolean isCombiningMark(int codePoint) {
        int type = Character.getType(codePoint);
        return type == Character.NON_SPACING_MARK
                || type == Character.COMBINING_SPACING_MARK
                || type == Character.ENCLOSING_MARK;
    }

    /**
     * Whitespace predicate used for both collapsing and tokenization, so that the
     * two never disagree (covers no-break and other Unicode space separators).
     */
    public static boolean isWhitespace(int codePoint) {
        return Character.isWhitespace(codePoint) || Character.isSpaceChar(codePoint);
    }

    /**
     * Counts the tonos vowels in a word.
     *
     * @param word normalized word (may be null)
     * @return number of accented vowels
     */
    public static int countAccented(String word) {
        if (word == null) {
            return 0;
        }
        return (int) word.codePoints().filter(GreekCharacters::isMonotonicAccented).count();
    }
}
