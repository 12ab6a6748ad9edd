package com.phillippitts.greekeval.service.comparison;

import com.phillippitts.greekeval.domain.MetricsRecord;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class EngineTranscriptTest {

    @Test
    void nullTextMeansNoTranscript() {
        assertThat(new EngineTranscript("whisper", null).hasText()).isFalse();
        assertThat(new EngineTranscript("whisper", "").hasText()).isTrue();
    }

    @Test
    void rejectsBlankEngine() {
        assertThatThrownBy(() -> new EngineTranscript(" ", "text"))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new EngineTranscript(null, "text"))
                .isInstanceOf(NullPointerException.class);
    }

    @Test
    void comparisonResultsAreImmutableCopies() {
        Map<String, MetricsRecord> source = new HashMap<>();
        source.put("whisper", null);

        EngineComparison comparison = new EngineComparison(source, null, null);
        source.put("wav2vec2", null);

        assertThat(comparison.results()).containsOnlyKeys("whisper");
        assertThatThrownBy(() -> comparison.results().put("x", null))
                .isInstanceOf(UnsupportedOperationException.class);
    }
}
