package com.phillippitts.greekeval;

import com.phillippitts.greekeval.config.properties.ComparisonProperties;
import com.phillippitts.greekeval.config.properties.EvaluationProperties;
import com.phillippitts.greekeval.config.properties.NormalizationProperties;
import com.phillippitts.greekeval.config.properties.TranscriptValidationProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties({
        NormalizationProperties.class,
        EvaluationProperties.class,
        TranscriptValidationProperties.class,
        ComparisonProperties.class
})
public class GreekEvalApplication {

    public static void main(String[] args) {
        SpringApplication.run(GreekEvalApplication.class, args);
    }

}
