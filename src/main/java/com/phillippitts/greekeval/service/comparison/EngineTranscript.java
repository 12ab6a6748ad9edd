package com.phillippitts.greekeval.service.comparison;

import java.util.Objects;

/**
 * Text produced by one ASR engine for the audio being evaluated.
 *
 * @param engine engine identifier, e.g. "whisper" or "wav2vec2"
 * @param text   transcript, or null if the engine failed or was not run
 */
public record EngineTranscript(String engine, String text) {
    public EngineTranscript {
        Objects.requireNonNull(engine, "engine");
        if (engine.isBlank()) {
            throw new IllegalArgumentException("engine must not be blank");
        }
    }

    public boolean hasText() {
        return text != null;
    }
}
