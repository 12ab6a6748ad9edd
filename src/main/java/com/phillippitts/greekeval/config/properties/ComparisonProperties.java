package com.phillippitts.greekeval.config.properties;

import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;
import org.springframework.validation.annotation.Validated;

/**
 * Names of the two ASR engines being compared ({@code eval.comparison.*}).
 */
@Validated
@ConfigurationProperties(prefix = "eval.comparison")
public class ComparisonProperties {

    public static final String DEFAULT_PRIMARY = "whisper";
    public static final String DEFAULT_SECONDARY = "wav2vec2";

    @NotBlank
    private final String primaryEngine;

    @NotBlank
    private final String secondaryEngine;

    @ConstructorBinding
    public ComparisonProperties(String primaryEngine, String secondaryEngine) {
        this.primaryEngine = primaryEngine == null ? DEFAULT_PRIMARY : primaryEngine;
        this.secondaryEngine = secondaryEngine == null ? DEFAULT_SECONDARY : secondaryEngine;
        if (this.primaryEngine.isBlank() || this.secondaryEngine.isBlank()) {
            throw new IllegalArgumentException("eval.comparison engine names must not be blank");
        }
        if (this.primaryEngine.equals(this.secondaryEngine)) {
            throw new IllegalArgumentException("eval.comparison engine names must differ");
        }
    }

    public String getPrimaryEngine() {
        return primaryEngine;
    }

    public String getSecondaryEngine() {
        return secondaryEngine;
    }
}
