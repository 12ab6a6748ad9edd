package com.phillippitts.greekeval.config.properties;

import com.phillippitts.greekeval.domain.NormalizationConfig;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PropertiesValidationTest {

    @Test
    void normalizationDefaultsToEveryFlagEnabled() {
        assertThat(new NormalizationProperties().toConfig()).isEqualTo(NormalizationConfig.defaults());
    }

    @Test
    void normalizationKeepsExplicitFlags() {
        NormalizationProperties p = new NormalizationProperties(false, null, null, false, null, false);

        assertThat(p.toConfig()).isEqualTo(new NormalizationConfig(false, true, true, false, true, false));
        assertThat(p.isGreekSpecific()).isFalse();
        assertThat(p.isRemovePunctuation()).isTrue();
    }

    @Test
    void rateCapDefaultsToTwoHundred() {
        assertThat(new EvaluationProperties(null).getRateCap()).isEqualTo(200.0);
        assertThat(new EvaluationProperties(100.0).getRateCap()).isEqualTo(100.0);
    }

    @Test
    void failsOnRateCapBelowHundred() {
        assertThatThrownBy(() -> new EvaluationProperties(99.9))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("eval.metrics.rate-cap");
        assertThatThrownBy(() -> new EvaluationProperties(Double.POSITIVE_INFINITY))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void comparisonDefaultsToWhisperAndWav2vec2() {
        ComparisonProperties p = new ComparisonProperties(null, null);

        assertThat(p.getPrimaryEngine()).isEqualTo("whisper");
        assertThat(p.getSecondaryEngine()).isEqualTo("wav2vec2");
    }

    @Test
    void failsOnBlankEngineName() {
        assertThatThrownBy(() -> new ComparisonProperties(" ", "wav2vec2"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("must not be blank");
    }

    @Test
    void failsOnIdenticalEngineNames() {
        assertThatThrownBy(() -> new ComparisonProperties("whisper", "whisper"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("must differ");
    }
}
