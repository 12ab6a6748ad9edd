package com.phillippitts.greekeval.service.comparison;

import com.phillippitts.greekeval.config.properties.ComparisonProperties;
import com.phillippitts.greekeval.domain.MetricsRecord;
import com.phillippitts.greekeval.service.metrics.EvaluationTelemetry;
import com.phillippitts.greekeval.service.metrics.GreekEvaluationMetrics;
import com.phillippitts.greekeval.service.validation.TranscriptValidator;
import com.phillippitts.greekeval.util.LogSanitizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Scores the transcripts of two ASR engines against one reference and picks the better engine.
 *
 * <p><b>Winner selection</b> (by {@link MetricsRecord#wordAccuracy()}):
 * <ul>
 *   <li>both evaluated: higher accuracy wins; equal accuracy is a {@link EngineComparison#TIE}</li>
 *   <li>only one engine produced text: that engine</li>
 *   <li>neither produced text: no winner</li>
 * </ul>
 *
 * <p>This is the policy layer around {@link GreekEvaluationMetrics}: it validates input,
 * records telemetry and logs, while the metrics engine stays pure.
 *
 * <p>Thread-safe: holds only thread-safe collaborators.
 *
 * @since 1.0
 */
public final class EngineComparisonService {

    private static final Logger LOG = LogManager.getLogger(EngineComparisonService.class);

    private static final int PREVIEW_CHARS = 40;
    private static final String NO_WINNER = "none";

    private final GreekEvaluationMetrics metrics;
    private final TranscriptValidator validator;
    private final EvaluationTelemetry telemetry;
    private final ComparisonProperties props;

    /**
     * @param metrics   evaluation facade
     * @param validator input ceiling and reference checks
     * @param telemetry metrics publisher (use {@link EvaluationTelemetry#NOOP} when not needed)
     * @param props     names of the primary and secondary engines
     * @throws NullPointerException if any parameter is null
     */
    public EngineComparisonService(GreekEvaluationMetrics metrics,
                                   TranscriptValidator validator,
                                   EvaluationTelemetry telemetry,
                                   ComparisonProperties props) {
        this.metrics = Objects.requireNonNull(metrics, "metrics must not be null");
        this.validator = Objects.requireNonNull(validator, "validator must not be null");
        this.telemetry = Objects.requireNonNull(telemetry, "telemetry must not be null");
        this.props = Objects.requireNonNull(props, "props must not be null");
    }

    /**
     * Evaluates the configured primary and secondary engines' transcripts.
     *
     * @param reference     human-verified reference transcript (must not be null)
     * @param primaryText   primary engine transcript (null if it produced nothing)
     * @param secondaryText secondary engine transcript (null if it produced nothing)
     * @return per-engine metrics and the winner
     */
    public EngineComparison compareEngines(String reference, String primaryText, String secondaryText) {
        return compare(reference,
                new EngineTranscript(props.getPrimaryEngine(), primaryText),
                new EngineTranscript(props.getSecondaryEngine(), secondaryText));
    }

    /**
     * Evaluates both engines' transcripts against the reference.
     *
     * @param reference human-verified reference transcript (must not be null)
     * @param first     first engine's transcript
     * @param second    second engine's transcript
     * @return per-engine metrics and the winner
     * @throws com.phillippitts.greekeval.exception.InvalidTranscriptException if the reference is
     *         null or any text exceeds the configured ceiling
     * @throws IllegalArgumentException if both transcripts name the same engine
     */
    public EngineComparison compare(String reference, EngineTranscript first, EngineTranscript second) {
        Objects.requireNonNull(first, "first must not be null");
        Objects.requireNonNull(second, "second must not be null");
        if (first.engine().equals(second.engine())) {
            throw new IllegalArgumentException("engines must differ, both are " + first.engine());
        }

        try {
            validator.validateReference(reference);
            validator.validateHypothesis(first.engine(), first.text());
            validator.validateHypothesis(second.engine(), second.text());
        } catch (RuntimeException e) {
            LOG.warn("Rejected comparison of {} and {}: {}", first.engine(), second.engine(), e.getMessage());
            throw e;
        }

        Map<String, MetricsRecord> results = new LinkedHashMap<>();
        results.put(first.engine(), evaluate(reference, first));
        results.put(second.engine(), evaluate(reference, second));

        EngineComparison comparison = decide(results, first.engine(), second.engine());
        telemetry.recordWinner(comparison.hasWinner() ? comparison.bestEngine() : NO_WINNER);
        LOG.info("Engine comparison complete (winner={}, accuracy={})",
                comparison.hasWinner() ? comparison.bestEngine() : NO_WINNER, comparison.bestAccuracy());
        return comparison;
    }

    private MetricsRecord evaluate(String reference, EngineTranscript transcript) {
        if (!transcript.hasText()) {
            LOG.debug("No transcript from {}; skipping evaluation", transcript.engine());
            return null;
        }
        long start = System.nanoTime();
        MetricsRecord record = metrics.evaluate(reference, transcript.text());
        long durationNanos = System.nanoTime() - start;

        telemetry.recordEvaluation(transcript.engine(), durationNanos, record);
        LOG.info("Evaluated {} in {} ms: WER={} CER={} diacritics={} (hyp='{}')",
                transcript.engine(), durationNanos / 1_000_000, record.wer(), record.cer(),
                record.diacriticAccuracy(), LogSanitizer.preview(transcript.text(), PREVIEW_CHARS));
        return record;
    }

    private static EngineComparison decide(Map<String, MetricsRecord> results, String firstEngine,
                                           String secondEngine) {
        MetricsRecord first = results.get(firstEngine);
        MetricsRecord second = results.get(secondEngine);

        if (first != null && second != null) {
            double a = first.wordAccuracy();
            double b = second.wordAccuracy();
            if (a > b) {
                return new EngineComparison(results, firstEngine, a);
            }
            if (b > a) {
                return new EngineComparison(results, secondEngine, b);
            }
            return new EngineComparison(results, EngineComparison.TIE, a);
        }
        if (first != null) {
            return new EngineComparison(results, firstEngine, first.wordAccuracy());
        }
        if (second != null) {
            return new EngineComparison(results, secondEngine, second.wordAccuracy());
        }
        return new EngineComparison(results, null, null);
    }
}
