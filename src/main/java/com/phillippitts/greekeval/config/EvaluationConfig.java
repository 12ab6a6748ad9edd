package com.phillippitts.greekeval.config;

import com.phillippitts.greekeval.config.properties.ComparisonProperties;
import com.phillippitts.greekeval.config.properties.EvaluationProperties;
import com.phillippitts.greekeval.config.properties.NormalizationProperties;
import com.phillippitts.greekeval.config.properties.TranscriptValidationProperties;
import com.phillippitts.greekeval.service.comparison.EngineComparisonService;
import com.phillippitts.greekeval.service.diacritic.DiacriticAligner;
import com.phillippitts.greekeval.service.distance.EditDistanceEngine;
import com.phillippitts.greekeval.service.metrics.EvaluationTelemetry;
import com.phillippitts.greekeval.service.metrics.GreekEvaluationMetrics;
import com.phillippitts.greekeval.service.normalize.TextNormalizer;
import com.phillippitts.greekeval.service.orthography.OrthographyDetector;
import com.phillippitts.greekeval.service.validation.TranscriptValidator;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Wires the evaluation engine and the comparison layer around it.
 *
 * <p>The engine components are plain stateless classes; Spring only shares one instance of each.
 */
@Configuration
public class EvaluationConfig {

    @Bean
    public TextNormalizer textNormalizer() {
        return new TextNormalizer();
    }

    @Bean
    public OrthographyDetector orthographyDetector() {
        return new OrthographyDetector();
    }

    @Bean
    public EditDistanceEngine editDistanceEngine() {
        return new EditDistanceEngine();
    }

    @Bean
    public DiacriticAligner diacriticAligner(TextNormalizer normalizer, EditDistanceEngine engine) {
        return new DiacriticAligner(normalizer, engine);
    }

    @Bean
    public GreekEvaluationMetrics greekEvaluationMetrics(TextNormalizer normalizer,
                                                         OrthographyDetector orthographyDetector,
                                                         EditDistanceEngine engine,
                                                         DiacriticAligner diacriticAligner,
                                                         NormalizationProperties normalizationProperties,
                                                         EvaluationProperties evaluationProperties) {
        return new GreekEvaluationMetrics(normalizer, orthographyDetector, engine, diacriticAligner,
                normalizationProperties.toConfig(), evaluationProperties.getRateCap());
    }

    /**
     * Falls back to {@link EvaluationTelemetry#NOOP} when no registry is present.
     */
    @Bean
    public EvaluationTelemetry evaluationTelemetry(ObjectProvider<MeterRegistry> registry) {
        MeterRegistry meterRegistry = registry.getIfAvailable();
        return meterRegistry == null ? EvaluationTelemetry.NOOP : new EvaluationTelemetry(meterRegistry);
    }

    @Bean
    public TranscriptValidator transcriptValidator(TranscriptValidationProperties props) {
        return new TranscriptValidator(props);
    }

    @Bean
    public EngineComparisonService engineComparisonService(GreekEvaluationMetrics metrics,
                                                           TranscriptValidator validator,
                                                           EvaluationTelemetry telemetry,
                                                           ComparisonProperties props) {
        return new EngineComparisonService(metrics, validator, telemetry, props);
    }
}
