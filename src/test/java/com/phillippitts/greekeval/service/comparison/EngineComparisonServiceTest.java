package com.phillippitts.greekeval.service.comparison;

import com.phillippitts.greekeval.config.properties.ComparisonProperties;
import com.phillippitts.greekeval.config.properties.TranscriptValidationProperties;
import com.phillippitts.greekeval.exception.InvalidTranscriptException;
import com.phillippitts.greekeval.service.metrics.EvaluationTelemetry;
import com.phillippitts.greekeval.service.metrics.GreekEvaluationMetrics;
import com.phillippitts.greekeval.service.validation.TranscriptValidator;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

class EngineComparisonServiceTest {

    private static final String REFERENCE = "Καλησπέρα, πώς είστε σήμερα;";
    private static final String EXACT = "καλησπέρα πώς είστε σήμερα";
    private static final String MISSING_TONOS = "Καλησπέρα, πως είστε σήμερα;";

    private MeterRegistry registry;
    private TranscriptValidationProperties validationProps;
    private EngineComparisonService service;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        validationProps = new TranscriptValidationProperties();
        service = new EngineComparisonService(
                new GreekEvaluationMetrics(),
                new TranscriptValidator(validationProps),
                new EvaluationTelemetry(registry),
                new ComparisonProperties(null, null));
    }

    @Test
    void prefersEngineWithHigherWordAccuracy() {
        EngineComparison result = service.compareEngines(REFERENCE, EXACT, MISSING_TONOS);

        assertThat(result.bestEngine()).isEqualTo("whisper");
        assertThat(result.bestAccuracy()).isEqualTo(100.0);
        assertThat(result.metricsFor("wav2vec2").wer()).isEqualTo(25.0);
        assertThat(result.results()).containsOnlyKeys("whisper", "wav2vec2");
    }

    @Test
    void secondaryWinsWhenMoreAccurate() {
        EngineComparison result = service.compareEngines(REFERENCE, MISSING_TONOS, EXACT);

        assertThat(result.bestEngine()).isEqualTo("wav2vec2");
        assertThat(result.bestAccuracy()).isEqualTo(100.0);
    }

    @Test
    void equalAccuracyIsTie() {
        EngineComparison result = service.compareEngines(REFERENCE, MISSING_TONOS, MISSING_TONOS);

        assertThat(result.bestEngine()).isEqualTo(EngineComparison.TIE);
        assertThat(result.bestAccuracy()).isEqualTo(75.0);
        assertThat(result.hasWinner()).isTrue();
    }

    @Test
    void onlyEngineWithTextWins() {
        EngineComparison result = service.compareEngines(REFERENCE, null, MISSING_TONOS);

        assertThat(result.bestEngine()).isEqualTo("wav2vec2");
        assertThat(result.bestAccuracy()).isEqualTo(75.0);
        assertThat(result.metricsFor("whisper")).isNull();
        assertThat(result.results()).containsKey("whisper");
    }

    @Test
    void noTextMeansNoWinner() {
        EngineComparison result = service.compareEngines(REFERENCE, null, null);

        assertThat(result.hasWinner()).isFalse();
        assertThat(result.bestEngine()).isNull();
        assertThat(result.bestAccuracy()).isNull();
        assertThat(result.results()).containsOnlyKeys("whisper", "wav2vec2");

        Counter none = registry.find("greekeval.comparison.winner").tag("engine", "none").counter();
        assertThat(none).isNotNull();
        assertThat(none.count()).isEqualTo(1.0);
    }

    @Test
    void emptyTranscriptIsEvaluatedAsTotalError() {
        EngineComparison result = service.compareEngines(REFERENCE, "", EXACT);

        assertThat(result.metricsFor("whisper").wer()).isEqualTo(100.0);
        assertThat(result.bestEngine()).isEqualTo("wav2vec2");
    }

    @Test
    void comparesArbitraryEngineNames() {
        EngineComparison result = service.compare(REFERENCE,
                new EngineTranscript("vosk", MISSING_TONOS),
                new EngineTranscript("whisper", EXACT));

        assertThat(result.results()).containsOnlyKeys("vosk", "whisper");
        assertThat(result.bestEngine()).isEqualTo("whisper");
    }

    @Test
    void recordsTelemetryPerEngineAndWinner() {
        service.compareEngines(REFERENCE, EXACT, MISSING_TONOS);

        assertThat(registry.find("greekeval.evaluation.latency").tag("engine", "whisper").timer()).isNotNull();
        assertThat(registry.find("greekeval.evaluation.wer").tag("engine", "wav2vec2").summary().totalAmount())
                .isEqualTo(25.0);
        Counter winner = registry.find("greekeval.comparison.winner").tag("engine", "whisper").counter();
        assertThat(winner).isNotNull();
        assertThat(winner.count()).isEqualTo(1.0);
    }

    @Test
    void rejectsNullReference() {
        assertThatThrownBy(() -> service.compareEngines(null, EXACT, EXACT))
                .isInstanceOf(InvalidTranscriptException.class)
                .hasMessageContaining("Reference transcript is null");
    }

    @Test
    void rejectsOversizedTranscript() {
        validationProps.setMaxTranscriptChars(10);

        assertThatThrownBy(() -> service.compareEngines("καλή", EXACT, null))
                .isInstanceOf(InvalidTranscriptException.class)
                .hasMessageContaining("whisper hypothesis too long");
    }

    @Test
    void rejectsSameEngineTwice() {
        assertThatThrownBy(() -> service.compare(REFERENCE,
                new EngineTranscript("whisper", EXACT),
                new EngineTranscript("whisper", MISSING_TONOS)))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("engines must differ");
    }

    @Test
    void worksWithoutRegistry() {
        EngineComparisonService quiet = new EngineComparisonService(
                new GreekEvaluationMetrics(),
                new TranscriptValidator(validationProps),
                EvaluationTelemetry.NOOP,
                new ComparisonProperties("primary", "secondary"));

        EngineComparison result = quiet.compareEngines(REFERENCE, EXACT, null);

        assertThat(result.bestEngine()).isEqualTo("primary");
    }

    @Test
    void rejectedInputSkipsEvaluationAndTelemetry() {
        GreekEvaluationMetrics metrics = mock(GreekEvaluationMetrics.class);
        TranscriptValidator validator = mock(TranscriptValidator.class);
        EvaluationTelemetry telemetry = mock(EvaluationTelemetry.class);
        doThrow(new InvalidTranscriptException("Reference transcript is null"))
                .when(validator).validateReference(any());
        EngineComparisonService guarded = new EngineComparisonService(
                metrics, validator, telemetry, new ComparisonProperties(null, null));

        assertThatThrownBy(() -> guarded.compareEngines(null, EXACT, EXACT))
                .isInstanceOf(InvalidTranscriptException.class);

        verify(metrics, never()).evaluate(any(), any());
        verify(telemetry, never()).recordWinner(anyString());
    }
}
