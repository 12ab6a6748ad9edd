package com.phillippitts.greekeval.service.comparison;

import com.phillippitts.greekeval.domain.MetricsRecord;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Outcome of scoring two engines against the same reference.
 *
 * @param results      metrics per engine in comparison order; null value when the engine produced no text
 * @param bestEngine   engine with the higher word accuracy, {@link #TIE}, or null when neither was evaluated
 * @param bestAccuracy word accuracy of the winner (either side on a tie), or null when neither was evaluated
 */
public record EngineComparison(
        Map<String, MetricsRecord> results,
        String bestEngine,
        Double bestAccuracy
) {

    /** Winner value when both engines reach the same word accuracy. */
    public static final String TIE = "tie";

    public EngineComparison {
        Objects.requireNonNull(results, "results");
        // ordered, null values allowed
        results = Collections.unmodifiableMap(new LinkedHashMap<>(results));
    }

    /**
     * @param engine engine identifier
     * @return metrics for the engine, or null if it produced no text or is unknown
     */
    public MetricsRecord metricsFor(String engine) {
        return results.get(engine);
    }

    public boolean hasWinner() {
        return bestEngine != null;
    }
}
