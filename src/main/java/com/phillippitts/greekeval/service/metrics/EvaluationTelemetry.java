package com.phillippitts.greekeval.service.metrics;

import com.phillippitts.greekeval.domain.MetricsRecord;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.concurrent.TimeUnit;

/**
 * Micrometer instrumentation for engine comparisons.
 *
 * <p>Provides, per engine:
 * <ul>
 *   <li>evaluation latency ({@code greekeval.evaluation.latency})</li>
 *   <li>WER and CER distributions ({@code greekeval.evaluation.wer}, {@code .cer})</li>
 *   <li>comparison winner counts ({@code greekeval.comparison.winner})</li>
 * </ul>
 *
 * <p>Recording happens outside {@link GreekEvaluationMetrics}, which stays side-effect free.
 * A {@code null} registry turns every method into a no-op, see {@link #NOOP}.
 *
 * @see io.micrometer.core.instrument.MeterRegistry
 */
public final class EvaluationTelemetry {

    private static final Logger LOG = LogManager.getLogger(EvaluationTelemetry.class);

    private static final String EVALUATION_PREFIX = "greekeval.evaluation";
    private static final String COMPARISON_PREFIX = "greekeval.comparison";

    /** Instance that records nothing; for tests and callers without a registry. */
    public static final EvaluationTelemetry NOOP = new EvaluationTelemetry(null);

    private final MeterRegistry registry;

    /**
     * @param registry meter registry (nullable for no-op mode)
     */
    public EvaluationTelemetry(MeterRegistry registry) {
        this.registry = registry;
        if (registry == null) {
            LOG.debug("EvaluationTelemetry created without a registry (no-op mode)");
        }
    }

    /**
     * Records latency and error rates of one engine's evaluation.
     *
     * @param engineName    engine whose hypothesis was scored
     * @param durationNanos evaluation time in nanoseconds
     * @param record        resulting metrics
     */
    public void recordEvaluation(String engineName, long durationNanos, MetricsRecord record) {
        if (registry == null) {
            return;
        }
        Timer.builder(EVALUATION_PREFIX + ".latency")
                .description("Time taken to evaluate a hypothesis against its reference")
                .tag("engine", engineName)
                .register(registry)
                .record(durationNanos, TimeUnit.NANOSECONDS);
        DistributionSummary.builder(EVALUATION_PREFIX + ".wer")
                .description("Word error rate per evaluation (percent)")
                .baseUnit("percent")
                .tag("engine", engineName)
                .register(registry)
                .record(record.wer());
        DistributionSummary.builder(EVALUATION_PREFIX + ".cer")
                .description("Character error rate per evaluation (percent)")
                .baseUnit("percent")
                .tag("engine", engineName)
                .register(registry)
                .record(record.cer());
    }

    /**
     * Counts the outcome of an engine comparison.
     *
     * @param winner winning engine name, {@code "tie"} or {@code "none"}
     */
    public void recordWinner(String winner) {
        if (registry == null) {
            return;
        }
        Counter.builder(COMPARISON_PREFIX + ".winner")
                .description("Number of comparisons won per engine")
                .tag("engine", winner)
                .register(registry)
                .increment();
    }

    /**
     * @return true if a registry is attached
     */
    public boolean isEnabled() {
        return registry != null;
    }
}
