/**
 * Immutable value types produced and consumed by the evaluation engine.
 *
 * <p>Every type here is created fresh for a single reference/hypothesis comparison and is
 * safe to share across threads:
 * <ul>
 *   <li>{@link com.phillippitts.greekeval.domain.NormalizationConfig} - normalization switches</li>
 *   <li>{@link com.phillippitts.greekeval.domain.Orthography} - monotonic, polytonic or mixed</li>
 *   <li>{@link com.phillippitts.greekeval.domain.EditOperationCounts} - S/D/I breakdown</li>
 *   <li>{@link com.phillippitts.greekeval.domain.WordAlignment} - minimum-cost token alignment</li>
 *   <li>{@link com.phillippitts.greekeval.domain.DiacriticStats} - tonos accuracy counts</li>
 *   <li>{@link com.phillippitts.greekeval.domain.MetricsRecord} - the consolidated result</li>
 * </ul>
 *
 * @since 1.0
 */
package com.phillippitts.greekeval.domain;
