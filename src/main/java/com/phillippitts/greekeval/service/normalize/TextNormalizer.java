package com.phillippitts.greekeval.service.normalize;

import com.phillippitts.greekeval.domain.NormalizationConfig;

import java.text.Normalizer;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Canonicalizes transcripts before they are compared.
 *
 * <p>Normalization steps, applied in order and each gated by a {@link NormalizationConfig} flag:
 * <ol>
 *   <li>Unicode NFC (always), so precomposed and decomposed accents compare equal</li>
 *   <li>{@code lowercase} - locale-independent case folding</li>
 *   <li>{@code greekSpecific} - final sigma to sigma, any accent on a dialytika letter dropped</li>
 *   <li>{@code normalizeDiacritics} - a vowel carrying oxeia, varia or perispomeni becomes the
 *       monotonic tonos vowel; its breathings and iota subscript go with it</li>
 *   <li>{@code removePunctuation} - every character other than a Greek letter, whitespace or
 *       (with {@code normalizeNumbers}) a digit becomes a single space</li>
 *   <li>{@code normalizeWhitespace} - collapse whitespace runs to one space and trim</li>
 * </ol>
 *
 * <p>Normalization is idempotent: normalizing already normalized text with the same
 * configuration returns it unchanged.
 *
 * <p>Thread-safe: stateless.
 *
 * @since 1.0
 */
public final class TextNormalizer {

    private static final Pattern COMBINING_MARKS = Pattern.compile("\\p{InCombiningDiacriticalMarks}+");

    /**
     * Normalizes text according to the given configuration.
     *
     * @param text   raw text (may be null)
     * @param config normalization switches; {@code null} means {@link NormalizationConfig#defaults()}
     * @return normalized text, never null
     */
    public String normalize(String text, NormalizationConfig config) {
        if (text == null || text.isEmpty()) {
            return "";
        }
        NormalizationConfig cfg = config == null ? NormalizationConfig.defaults() : config;

        String result = Normalizer.normalize(text, Normalizer.Form.NFC);
        if (cfg.lowercase()) {
            // recompose: some lowercase letters have precomposed forms their capitals lack
            result = Normalizer.normalize(result.toLowerCase(Locale.ROOT), Normalizer.Form.NFC);
        }
        if (cfg.greekSpecific()) {
            result = result.replace(GreekCharacters.FINAL_SIGMA, GreekCharacters.SIGMA);
            result = rewriteClusters(result, TextNormalizer::foldDialytika);
        }
        if (cfg.normalizeDiacritics()) {
            result = rewriteClusters(result, TextNormalizer::foldPolytonic);
        }
        if (cfg.removePunctuation()) {
            result = stripPunctuation(result, cfg.normalizeNumbers());
        }
        if (cfg.normalizeWhitespace()) {
            result = collapseWhitespace(result);
        }
        return result;
    }

    /**
     * Strips every accent, breathing and dialytika, leaving the bare base letters.
     *
     * <p>Used to decide whether two words are the same word with different accentuation;
     * not part of {@link #normalize(String, NormalizationConfig)}.
     *
     * @param text text to strip (may be null)
     * @return text without combining diacritical marks, never null
     */
    public String removeDiacritics(String text) {
        if (text == null || text.isEmpty()) {
            return "";
        }
        String decomposed = Normalizer.normalize(text, Normalizer.Form.NFD);
        String stripped = COMBINING_MARKS.matcher(decomposed).replaceAll("");
        return Normalizer.normalize(stripped, Normalizer.Form.NFC);
    }

    /**
     * Splits normalized text into word tokens on whitespace.
     *
     * @param normalized normalized text (may be null)
     * @return immutable list of words (empty if none)
     */
    public List<String> words(String normalized) {
        if (normalized == null || normalized.isEmpty()) {
            return List.of();
        }
        List<String> words = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        normalized.codePoints().forEach(cp -> {
            if (GreekCharacters.isWhitespace(cp)) {
                if (current.length() > 0) {
                    words.add(current.toString());
                    current.setLength(0);
                }
            } else {
                current.appendCodePoint(cp);
            }
        });
        if (current.length() > 0) {
            words.add(current.toString());
        }
        return List.copyOf(words);
    }

    /**
     * Returns the code points of normalized text with all whitespace removed.
     *
     * @param normalized normalized text (may be null)
     * @return immutable list of code points
     */
    public List<Integer> characters(String normalized) {
        if (normalized == null || normalized.isEmpty()) {
            return List.of();
        }
        List<Integer> chars = new ArrayList<>(normalized.length());
        normalized.codePoints()
                .filter(cp -> !GreekCharacters.isWhitespace(cp))
                .forEach(chars::add);
        return List.copyOf(chars);
    }

    /**
     * Returns only the Greek letters of normalized text.
     *
     * @param normalized normalized text (may be null)
     * @return immutable list of Greek-letter code points
     */
    public List<Integer> greekLetters(String normalized) {
        if (normalized == null || normalized.isEmpty()) {
            return List.of();
        }
        List<Integer> letters = new ArrayList<>();
        normalized.codePoints()
                .filter(GreekCharacters::isGreekLetter)
                .forEach(letters::add);
        return List.copyOf(letters);
    }

    /**
     * Rewrites one decomposed Greek letter: a base code point and the combining marks that
     * follow it, in canonical order.
     */
    @FunctionalInterface
    private interface ClusterRule {
        void rewrite(int base, int[] marks, StringBuilder out);
    }

    /**
     * Applies {@code rule} to every Greek letter of the canonical decomposition of {@code text}
     * and recomposes the result. Other clusters are copied unchanged.
     *
     * <p>A stray mark after a precomposed letter joins that letter's cluster, so the closing
     * NFC never assembles a letter that a second pass would fold again.
     */
    private static String rewriteClusters(String text, ClusterRule rule) {
        String decomposed = Normalizer.normalize(text, Normalizer.Form.NFD);
        StringBuilder out = new StringBuilder(decomposed.length());
        int i = 0;
        while (i < decomposed.length()) {
            int base = decomposed.codePointAt(i);
            i += Character.charCount(base);
            int marksStart = i;
            while (i < decomposed.length() && GreekCharacters.isCombiningMark(decomposed.codePointAt(i))) {
                i += Character.charCount(decomposed.codePointAt(i));
            }
            if (GreekCharacters.isGreekLetter(base)) {
                rule.rewrite(base, decomposed.substring(marksStart, i).codePoints().toArray(), out);
            } else {
                out.appendCodePoint(base).append(decomposed, marksStart, i);
            }
        }
        return Normalizer.normalize(out, Normalizer.Form.NFC);
    }

    // ΐ and ΰ lose their tonos, as does any accent stacked on a dialytika
    private static void foldDialytika(int base, int[] marks, StringBuilder out) {
        boolean dialytika = contains(marks, GreekCharacters.DIALYTIKA);
        out.appendCodePoint(base);
        for (int mark : marks) {
            if (!dialytika || !GreekCharacters.isAccentMark(mark)) {
                out.appendCodePoint(mark);
            }
        }
    }

    // ἄ, ᾴ, ῷ, Ἄ -> ά, ά, ώ, Ά; breathing-only letters such as ἀ are kept
    private static void foldPolytonic(int base, int[] marks, StringBuilder out) {
        out.appendCodePoint(base);
        boolean accented = false;
        for (int mark : marks) {
            accented |= GreekCharacters.isAccentMark(mark);
        }
        if (!GreekCharacters.isVowel(base) || !accented) {
            for (int mark : marks) {
                out.appendCodePoint(mark);
            }
            return;
        }
        for (int mark : marks) {
            boolean dropped = GreekCharacters.isAccentMark(mark)
                    || mark == GreekCharacters.PSILI
                    || mark == GreekCharacters.DASIA
                    || mark == GreekCharacters.YPOGEGRAMMENI;
            if (!dropped) {
                out.appendCodePoint(mark);
            }
        }
        out.appendCodePoint(GreekCharacters.TONOS);
    }

    private static boolean contains(int[] marks, int mark) {
        for (int m : marks) {
            if (m == mark) {
                return true;
            }
        }
        return false;
    }

    private static String stripPunctuation(String text, boolean keepDigits) {
        StringBuilder sb = new StringBuilder(text.length());
        text.codePoints().forEach(cp -> {
            boolean keep = GreekCharacters.isGreekLetter(cp)
                    || GreekCharacters.isWhitespace(cp)
                    || (keepDigits && Character.isDigit(cp));
            if (keep) {
                sb.appendCodePoint(cp);
            } else {
                sb.append(' ');
            }
        });
        return sb.toString();
    }

    private static String collapseWhitespace(String text) {
        StringBuilder sb = new StringBuilder(text.length());
        boolean pendingSpace = false;
        for (int i = 0; i < text.length(); ) {
            int cp = text.codePointAt(i);
            i += Character.charCount(cp);
            if (GreekCharacters.isWhitespace(cp)) {
                pendingSpace = sb.length() > 0;
                continue;
            }
            if (pendingSpace) {
                sb.append(' ');
                pendingSpace = false;
            }
            sb.appendCodePoint(cp);
        }
        return sb.toString();
    }
}
