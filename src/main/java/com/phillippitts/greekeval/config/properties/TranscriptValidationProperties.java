package com.phillippitts.greekeval.config.properties;

import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Input ceiling applied before evaluation ({@code eval.validation.*}).
 *
 * <p>Character-level edit distance costs O(n*m) time and memory, so callers cap transcript
 * length; the engine itself does not self-limit.
 */
@ConfigurationProperties(prefix = "eval.validation")
@Validated
public class TranscriptValidationProperties {

    /** Maximum transcript length in characters (security cap against CPU/memory exhaustion). */
    @Positive(message = "Maximum transcript length must be positive")
    private int maxTranscriptChars = 50_000;

    public int getMaxTranscriptChars() {
        return maxTranscriptChars;
    }

    public void setMaxTranscriptChars(int maxTranscriptChars) {
        this.maxTranscriptChars = maxTranscriptChars;
    }
}
