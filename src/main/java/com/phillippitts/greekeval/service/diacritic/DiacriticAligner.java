package com.phillippitts.greekeval.service.diacritic;

import com.phillippitts.greekeval.domain.AlignedPair;
import com.phillippitts.greekeval.domain.DiacriticStats;
import com.phillippitts.greekeval.domain.NormalizationConfig;
import com.phillippitts.greekeval.domain.WordAlignment;
import com.phillippitts.greekeval.service.distance.EditDistanceEngine;
import com.phillippitts.greekeval.service.normalize.GreekCharacters;
import com.phillippitts.greekeval.service.normalize.TextNormalizer;

import java.util.List;
import java.util.Objects;

/**
 * Measures how accurately a hypothesis reproduces the tonos marks of a reference.
 *
 * <p><b>Algorithm:</b>
 * <ol>
 *   <li>Normalize both texts (accents are kept) and split into words</li>
 *   <li>Align the words with {@link EditDistanceEngine#align(List, List)}</li>
 *   <li>For each aligned pair:
 *     <ul>
 *       <li>deleted reference word: its marks count toward the total only</li>
 *       <li>inserted hypothesis word: ignored</li>
 *       <li>same base word (accents stripped): compare position by position; a reference mark
 *           is correct when the hypothesis character is identical, otherwise missed; a
 *           hypothesis mark over an unaccented reference position is extra</li>
 *       <li>different base word: the reference marks count toward the total only</li>
 *     </ul>
 *   </li>
 * </ol>
 *
 * <p>Thread-safe: holds only stateless collaborators.
 *
 * @since 1.0
 */
public final class DiacriticAligner {

    private final TextNormalizer normalizer;
    private final EditDistanceEngine engine;

    /**
     * @param normalizer text normalizer
     * @param engine     edit distance engine providing the word alignment
     * @throws NullPointerException if any parameter is null
     */
    public DiacriticAligner(TextNormalizer normalizer, EditDistanceEngine engine) {
        this.normalizer = Objects.requireNonNull(normalizer, "normalizer must not be null");
        this.engine = Objects.requireNonNull(engine, "engine must not be null");
    }

    /**
     * Compares the diacritics of two raw texts.
     *
     * @param reference  reference transcript (may be null)
     * @param hypothesis hypothesis transcript (may be null)
     * @param config     normalization configuration (null means defaults)
     * @return diacritic counts; accuracy 100 when the reference carries no marks
     */
    public DiacriticStats analyze(String reference, String hypothesis, NormalizationConfig config) {
        List<String> refWords = normalizer.words(normalizer.normalize(reference, config));
        List<String> hypWords = normalizer.words(normalizer.normalize(hypothesis, config));
        return analyzeWords(refWords, hypWords);
    }

    /**
     * Compares the diacritics of two already normalized word sequences.
     *
     * @param refWords normalized reference words
     * @param hypWords normalized hypothesis words
     * @return diacritic counts
     */
    public DiacriticStats analyzeWords(List<String> refWords, List<String> hypWords) {
        if (refWords.isEmpty() || hypWords.isEmpty()) {
            return DiacriticStats.empty();
        }
        WordAlignment alignment = engine.align(refWords, hypWords);

        Tally tally = new Tally();
        for (AlignedPair pair : alignment.pairs()) {
            if (!pair.isPaired()) {
                if (pair.referenceIndex() != null) {
                    tally.total += GreekCharacters.countAccented(refWords.get(pair.referenceIndex()));
                }
                continue;
            }
            String refWord = refWords.get(pair.referenceIndex());
            String hypWord = hypWords.get(pair.hypothesisIndex());
            if (normalizer.removeDiacritics(refWord).equals(normalizer.removeDiacritics(hypWord))) {
                compareMarks(refWord, hypWord, tally);
            } else {
                tally.total += GreekCharacters.countAccented(refWord);
            }
        }
        return new DiacriticStats(tally.total, tally.correct, tally.missed, tally.extra);
    }

    private static void compareMarks(String refWord, String hypWord, Tally tally) {
        int[] ref = refWord.codePoints().toArray();
        int[] hyp = hypWord.codePoints().toArray();
        int common = Math.min(ref.length, hyp.length);
        for (int i = 0; i < common; i++) {
            if (GreekCharacters.isMonotonicAccented(ref[i])) {
                tally.total++;
                if (ref[i] == hyp[i]) {
                    tally.correct++;
                } else {
                    tally.missed++;
                }
            } else if (GreekCharacters.isMonotonicAccented(hyp[i])) {
                tally.extra++;
            }
        }
        // Only reachable when stripping changed a word's length
        for (int i = common; i < ref.length; i++) {
            if (GreekCharacters.isMonotonicAccented(ref[i])) {
                tally.total++;
                tally.missed++;
            }
        }
        for (int i = common; i < hyp.length; i++) {
            if (GreekCharacters.isMonotonicAccented(hyp[i])) {
                tally.extra++;
            }
        }
    }

    private static final class Tally {
        int total;
        int correct;
        int missed;
        int extra;
    }
}
