package com.phillippitts.greekeval.service.validation;

import com.phillippitts.greekeval.config.properties.TranscriptValidationProperties;
import com.phillippitts.greekeval.exception.InvalidTranscriptException;

import java.util.Objects;

/**
 * Guards the evaluation engine against inputs it should never see.
 *
 * <p>The engine is total but quadratic in transcript length; this validator enforces the
 * caller-side ceiling and requires a reference to score against.
 */
public class TranscriptValidator {

    private final TranscriptValidationProperties props;

    public TranscriptValidator(TranscriptValidationProperties props) {
        this.props = Objects.requireNonNull(props, "props must not be null");
    }

    /**
     * Validate the human-verified reference transcript.
     * @param reference reference text; empty is allowed, null is not
     * @throws InvalidTranscriptException when missing or too long
     */
    public void validateReference(String reference) {
        if (reference == null) {
            throw new InvalidTranscriptException("Reference transcript is null");
        }
        checkLength("reference", reference);
    }

    /**
     * Validate one engine's hypothesis transcript.
     * @param engineName engine that produced the text (for the error message)
     * @param hypothesis hypothesis text (null means the engine produced nothing and is allowed)
     * @throws InvalidTranscriptException when too long
     */
    public void validateHypothesis(String engineName, String hypothesis) {
        if (hypothesis == null) {
            return;
        }
        checkLength(engineName + " hypothesis", hypothesis);
    }

    private void checkLength(String label, String text) {
        int max = props.getMaxTranscriptChars();
        if (text.length() > max) {
            throw new InvalidTranscriptException(text.length(),
                    label + " too long: " + text.length() + " chars. Max: " + max + " chars");
        }
    }
}
