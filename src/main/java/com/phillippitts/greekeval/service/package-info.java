/**
 * Service layer: the evaluation engine and the policy layer that consumes it.
 *
 * <p>Service Sub-packages:
 * <ul>
 *   <li>{@code service.normalize} - transcript canonicalization and Greek character tables</li>
 *   <li>{@code service.orthography} - monotonic/polytonic/mixed detection</li>
 *   <li>{@code service.distance} - Levenshtein distance, operation counts and alignment</li>
 *   <li>{@code service.diacritic} - tonos accuracy over a word alignment</li>
 *   <li>{@code service.metrics} - the {@code GreekEvaluationMetrics} facade, JSON output, telemetry</li>
 *   <li>{@code service.comparison} - two-engine comparison and winner selection</li>
 *   <li>{@code service.validation} - input ceiling enforced before evaluation</li>
 * </ul>
 *
 * <p>Design Principles:
 * <ul>
 *   <li>Engine components are stateless and side-effect free; they never throw for string input</li>
 *   <li>Logging, metrics and validation live in the comparison layer, not in the engine</li>
 *   <li>Services use constructor injection</li>
 * </ul>
 *
 * @see com.phillippitts.greekeval.service.metrics.GreekEvaluationMetrics
 * @since 1.0
 */
package com.phillippitts.greekeval.service;
