package com.phillippitts.greekeval.service.metrics;

import com.phillippitts.greekeval.domain.DiacriticStats;
import com.phillippitts.greekeval.domain.EditOperationCounts;
import com.phillippitts.greekeval.domain.MetricsRecord;
import com.phillippitts.greekeval.service.comparison.EngineComparison;
import org.json.JSONObject;

import java.util.Map;

/**
 * Serializes evaluation results into the snake_case JSON shape consumed by persistence and
 * transport layers.
 *
 * <p>Example:
 * <pre>{@code
 * {"wer": 25.0, "cer": 4.0, "word_accuracy": 75.0, ...,
 *  "word_operations": {"substitutions": 1, "deletions": 0, "insertions": 0, "distance": 1},
 *  "diacritics": {"total_diacritics": 4, "correct_diacritics": 3, ...},
 *  "orthography": "monotonic"}
 * }</pre>
 *
 * <p>Thread-safe: all methods are static and stateless.
 *
 * @since 1.0
 */
public final class MetricsJsonWriter {

    private MetricsJsonWriter() {
        // Utility class - prevent instantiation
    }

    /**
     * @param record metrics to serialize
     * @return JSON object with every MetricsRecord field
     */
    public static JSONObject toJson(MetricsRecord record) {
        JSONObject json = new JSONObject();
        json.put("wer", record.wer());
        json.put("cer", record.cer());
        json.put("word_accuracy", record.wordAccuracy());
        json.put("char_accuracy", record.charAccuracy());
        json.put("word_operations", toJson(record.wordOperations()));
        json.put("diacritics", toJson(record.diacritics()));
        json.put("diacritic_accuracy", record.diacriticAccuracy());
        json.put("diacritic_errors", record.diacriticErrors());
        json.put("greek_char_accuracy", record.greekCharAccuracy());
        json.put("normalized_edit_distance", record.normalizedEditDistance());
        json.put("word_information_preserved", record.wordInformationPreserved());
        json.put("reference_word_count", record.referenceWordCount());
        json.put("hypothesis_word_count", record.hypothesisWordCount());
        json.put("reference_char_count", record.referenceCharCount());
        json.put("hypothesis_char_count", record.hypothesisCharCount());
        json.put("orthography", record.orthography().value());
        return json;
    }

    /**
     * @param counts word-level operation counts
     * @return JSON object with substitutions, deletions, insertions and distance
     */
    public static JSONObject toJson(EditOperationCounts counts) {
        JSONObject json = new JSONObject();
        json.put("substitutions", counts.substitutions());
        json.put("deletions", counts.deletions());
        json.put("insertions", counts.insertions());
        json.put("distance", counts.distance());
        return json;
    }

    /**
     * @param stats diacritic counts
     * @return JSON object with counts and derived percentages
     */
    public static JSONObject toJson(DiacriticStats stats) {
        JSONObject json = new JSONObject();
        json.put("total_diacritics", stats.totalDiacritics());
        json.put("correct_diacritics", stats.correctDiacritics());
        json.put("missed_diacritics", stats.missedDiacritics());
        json.put("extra_diacritics", stats.extraDiacritics());
        json.put("accuracy", stats.accuracy());
        json.put("precision", stats.precision());
        json.put("recall", stats.recall());
        return json;
    }

    /**
     * Serializes a comparison; engines without a transcript appear with a {@code null} value.
     *
     * @param comparison engine comparison
     * @return JSON object keyed by engine name plus {@code best_model} and {@code best_accuracy}
     */
    public static JSONObject toJson(EngineComparison comparison) {
        JSONObject json = new JSONObject();
        JSONObject engines = new JSONObject();
        for (Map.Entry<String, MetricsRecord> entry : comparison.results().entrySet()) {
            engines.put(entry.getKey(), entry.getValue() == null ? JSONObject.NULL : toJson(entry.getValue()));
        }
        json.put("engines", engines);
        json.put("best_model", comparison.bestEngine() == null ? JSONObject.NULL : comparison.bestEngine());
        json.put("best_accuracy", comparison.bestAccuracy() == null ? JSONObject.NULL : comparison.bestAccuracy());
        return json;
    }
}
