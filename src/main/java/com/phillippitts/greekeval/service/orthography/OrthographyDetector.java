package com.phillippitts.greekeval.service.orthography;

import com.phillippitts.greekeval.domain.Orthography;
import com.phillippitts.greekeval.service.normalize.GreekCharacters;

import java.text.Normalizer;

/**
 * Classifies the diacritic system of a Greek text.
 *
 * <p>Operates on raw text: normalization folds polytonic marks and would erase the signal.
 * Only NFC is applied, so a decomposed letter such as alpha + U+0313 is classified like its
 * precomposed form.
 * Text with no accents at all is reported as {@link Orthography#MONOTONIC}, the Modern Greek
 * default.
 *
 * <p>Thread-safe: stateless.
 */
public final class OrthographyDetector {

    /**
     * Detects the orthography of the given text.
     *
     * @param text raw text (may be null)
     * @return detected orthography, never null
     */
    public Orthography detect(String text) {
        if (text == null || text.isEmpty()) {
            return Orthography.MONOTONIC;
        }
        String composed = Normalizer.normalize(text, Normalizer.Form.NFC);
        boolean monotonic = false;
        boolean polytonic = false;
        for (int i = 0; i < composed.length(); ) {
            int cp = composed.codePointAt(i);
            i += Character.charCount(cp);
            if (GreekCharacters.isMonotonicAccented(cp)) {
                monotonic = true;
            } else if (GreekCharacters.isPolytonicRange(cp)) {
                polytonic = true;
            }
            if (monotonic && polytonic) {
                return Orthography.MIXED;
            }
        }
        return polytonic ? Orthography.POLYTONIC : Orthography.MONOTONIC;
    }
}
