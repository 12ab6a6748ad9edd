package com.phillippitts.greekeval.config.properties;

import jakarta.validation.constraints.DecimalMin;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;
import org.springframework.validation.annotation.Validated;

/**
 * Typed properties for metric computation ({@code eval.metrics.*}).
 */
@Validated
@ConfigurationProperties(prefix = "eval.metrics")
public class EvaluationProperties {

    static final double DEFAULT_RATE_CAP = 200.0;

    /**
     * Upper clamp for WER and CER in percent. Insertion-heavy hypotheses can exceed 100%;
     * values above the cap are reported as the cap.
     */
    @DecimalMin("100.0")
    private final double rateCap;

    @ConstructorBinding
    public EvaluationProperties(Double rateCap) {
        double cap = rateCap == null ? DEFAULT_RATE_CAP : rateCap;
        if (!Double.isFinite(cap) || cap < 100.0) {
            throw new IllegalArgumentException("eval.metrics.rate-cap must be a finite value >= 100");
        }
        this.rateCap = cap;
    }

    public double getRateCap() {
        return rateCap;
    }
}
