package com.phillippitts.greekeval.service.metrics;

import com.phillippitts.greekeval.domain.DiacriticStats;
import com.phillippitts.greekeval.domain.EditOperationCounts;
import com.phillippitts.greekeval.domain.MetricsRecord;
import com.phillippitts.greekeval.domain.NormalizationConfig;
import com.phillippitts.greekeval.domain.Orthography;
import com.phillippitts.greekeval.service.diacritic.DiacriticAligner;
import com.phillippitts.greekeval.service.distance.EditDistanceEngine;
import com.phillippitts.greekeval.service.normalize.TextNormalizer;
import com.phillippitts.greekeval.service.orthography.OrthographyDetector;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.List;
import java.util.Objects;

/**
 * Entry point for scoring an ASR hypothesis against a human-verified Greek reference.
 *
 * <p>{@link #evaluate(String, String)} produces the full {@link MetricsRecord}; the standalone
 * {@link #calculateWer(String, String)} and {@link #calculateCer(String, String)} share the same
 * normalization, tokenization and distance code and always agree with it.
 *
 * <p><b>Rate conventions:</b>
 * <ul>
 *   <li>empty reference and empty hypothesis: 0</li>
 *   <li>exactly one of them empty: 100</li>
 *   <li>otherwise {@code distance / referenceTokens * 100}, clamped at the rate cap</li>
 * </ul>
 * The cap (200 by default) is a deliberate lossy clamp: insertion-heavy hypotheses can push the
 * true rate above 100%, and downstream consumers should never see unbounded values.
 *
 * <p>Thread-safe and side-effect free: every call allocates its own tables, repeated calls
 * with the same inputs return equal records. Never throws for string input.
 *
 * @since 1.0
 */
public final class GreekEvaluationMetrics {

    private static final Logger LOG = LogManager.getLogger(GreekEvaluationMetrics.class);

    /** Default clamp for WER and CER, in percent. */
    public static final double DEFAULT_RATE_CAP = 200.0;

    private static final double PERCENT = 100.0;

    private final TextNormalizer normalizer;
    private final OrthographyDetector orthographyDetector;
    private final EditDistanceEngine engine;
    private final DiacriticAligner diacriticAligner;
    private final NormalizationConfig defaultConfig;
    private final double rateCap;

    /**
     * Creates a facade with its own collaborators, default normalization and the default cap.
     */
    public GreekEvaluationMetrics() {
        this(new TextNormalizer(), new OrthographyDetector(), new EditDistanceEngine(),
                NormalizationConfig.defaults(), DEFAULT_RATE_CAP);
    }

    private GreekEvaluationMetrics(TextNormalizer normalizer,
                                   OrthographyDetector orthographyDetector,
                                   EditDistanceEngine engine,
                                   NormalizationConfig defaultConfig,
                                   double rateCap) {
        this(normalizer, orthographyDetector, engine, new DiacriticAligner(normalizer, engine),
                defaultConfig, rateCap);
    }

    /**
     * @param normalizer          text normalizer
     * @param orthographyDetector orthography detector
     * @param engine              edit distance engine
     * @param diacriticAligner    diacritic aligner
     * @param defaultConfig       normalization used when a caller passes none
     * @param rateCap             upper clamp for WER and CER; must be at least 100
     * @throws NullPointerException     if any collaborator is null
     * @throws IllegalArgumentException if the rate cap is below 100 or not finite
     */
    public GreekEvaluationMetrics(TextNormalizer normalizer,
                                  OrthographyDetector orthographyDetector,
                                  EditDistanceEngine engine,
                                  DiacriticAligner diacriticAligner,
                                  NormalizationConfig defaultConfig,
                                  double rateCap) {
        this.normalizer = Objects.requireNonNull(normalizer, "normalizer must not be null");
        this.orthographyDetector = Objects.requireNonNull(orthographyDetector, "orthographyDetector must not be null");
        this.engine = Objects.requireNonNull(engine, "engine must not be null");
        this.diacriticAligner = Objects.requireNonNull(diacriticAligner, "diacriticAligner must not be null");
        this.defaultConfig = Objects.requireNonNull(defaultConfig, "defaultConfig must not be null");
        if (!Double.isFinite(rateCap) || rateCap < PERCENT) {
            throw new IllegalArgumentException("rateCap must be a finite value >= 100, got: " + rateCap);
        }
        this.rateCap = rateCap;
    }

    /**
     * Evaluates a hypothesis with the default normalization configuration.
     *
     * @param reference  reference transcript (null treated as empty)
     * @param hypothesis hypothesis transcript (null treated as empty)
     * @return consolidated metrics, never null
     */
    public MetricsRecord evaluate(String reference, String hypothesis) {
        return evaluate(reference, hypothesis, defaultConfig);
    }

    /**
     * Evaluates a hypothesis against a reference.
     *
     * @param reference  reference transcript (null treated as empty)
     * @param hypothesis hypothesis transcript (null treated as empty)
     * @param config     normalization configuration (null means the default)
     * @return consolidated metrics, never null
     */
    public MetricsRecord evaluate(String reference, String hypothesis, NormalizationConfig config) {
        NormalizationConfig cfg = config == null ? defaultConfig : config;
        String ref = reference == null ? "" : reference;
        String hyp = hypothesis == null ? "" : hypothesis;

        String refNorm = normalizer.normalize(ref, cfg);
        String hypNorm = normalizer.normalize(hyp, cfg);
        List<String> refWords = normalizer.words(refNorm);
        List<String> hypWords = normalizer.words(hypNorm);
        List<Integer> refChars = normalizer.characters(refNorm);
        List<Integer> hypChars = normalizer.characters(hypNorm);

        double wer = errorRate(ref, hyp, refWords, hypWords);
        double cer = errorRate(ref, hyp, refChars, hypChars);
        EditOperationCounts wordOperations = engine.distanceDetailed(refWords, hypWords);
        DiacriticStats diacritics = diacriticAligner.analyzeWords(refWords, hypWords);
        double greekCharAccuracy = greekCharAccuracy(refNorm, hypNorm);

        int longer = Math.max(refWords.size(), hypWords.size());
        double normalizedEditDistance = longer == 0 ? 0.0 : (double) wordOperations.distance() / longer * PERCENT;

        Orthography orthography = orthographyDetector.detect(ref);

        if (LOG.isDebugEnabled()) {
            LOG.debug("Evaluated {} ref words vs {} hyp words: WER={} CER={} S={} D={} I={} orthography={}",
                    refWords.size(), hypWords.size(), wer, cer, wordOperations.substitutions(),
                    wordOperations.deletions(), wordOperations.insertions(), orthography.value());
        }

        return new MetricsRecord(
                wer,
                cer,
                PERCENT - wer,
                PERCENT - cer,
                wordOperations,
                diacritics,
                greekCharAccuracy,
                normalizedEditDistance,
                PERCENT - normalizedEditDistance,
                refWords.size(),
                hypWords.size(),
                refChars.size(),
                hypChars.size(),
                orthography
        );
    }

    /**
     * Word error rate with the default normalization configuration.
     */
    public double calculateWer(String reference, String hypothesis) {
        return calculateWer(reference, hypothesis, defaultConfig);
    }

    /**
     * Word error rate: word-level edit distance over reference word count, in percent.
     *
     * @param reference  reference transcript (null treated as empty)
     * @param hypothesis hypothesis transcript (null treated as empty)
     * @param config     normalization configuration (null means the default)
     * @return WER in [0, rate cap]
     */
    public double calculateWer(String reference, String hypothesis, NormalizationConfig config) {
        NormalizationConfig cfg = config == null ? defaultConfig : config;
        String ref = reference == null ? "" : reference;
        String hyp = hypothesis == null ? "" : hypothesis;
        return errorRate(ref, hyp,
                normalizer.words(normalizer.normalize(ref, cfg)),
                normalizer.words(normalizer.normalize(hyp, cfg)));
    }

    /**
     * Character error rate with the default normalization configuration.
     */
    public double calculateCer(String reference, String hypothesis) {
        return calculateCer(reference, hypothesis, defaultConfig);
    }

    /**
     * Character error rate over despaced normalized text, in percent.
     *
     * @param reference  reference transcript (null treated as empty)
     * @param hypothesis hypothesis transcript (null treated as empty)
     * @param config     normalization configuration (null means the default)
     * @return CER in [0, rate cap]
     */
    public double calculateCer(String reference, String hypothesis, NormalizationConfig config) {
        NormalizationConfig cfg = config == null ? defaultConfig : config;
        String ref = reference == null ? "" : reference;
        String hyp = hypothesis == null ? "" : hypothesis;
        return errorRate(ref, hyp,
                normalizer.characters(normalizer.normalize(ref, cfg)),
                normalizer.characters(normalizer.normalize(hyp, cfg)));
    }

    public double getRateCap() {
        return rateCap;
    }

    public NormalizationConfig getDefaultConfig() {
        return defaultConfig;
    }

    private <T> double errorRate(String rawRef, String rawHyp, List<T> refTokens, List<T> hypTokens) {
        if (rawRef.isEmpty()) {
            return rawHyp.isEmpty() ? 0.0 : PERCENT;
        }
        if (rawHyp.isEmpty()) {
            return PERCENT;
        }
        // Raw text present but nothing left after normalization (e.g. punctuation only)
        if (refTokens.isEmpty()) {
            return hypTokens.isEmpty() ? 0.0 : PERCENT;
        }
        int distance = engine.distance(refTokens, hypTokens);
        double rate = (double) distance / refTokens.size() * PERCENT;
        return Math.min(rate, rateCap);
    }

    private double greekCharAccuracy(String refNorm, String hypNorm) {
        List<Integer> refGreek = normalizer.greekLetters(refNorm);
        List<Integer> hypGreek = normalizer.greekLetters(hypNorm);
        if (refGreek.isEmpty()) {
            return hypGreek.isEmpty() ? PERCENT : 0.0;
        }
        int distance = engine.distance(refGreek, hypGreek);
        return Math.max(0.0, PERCENT - (double) distance / refGreek.size() * PERCENT);
    }
}
