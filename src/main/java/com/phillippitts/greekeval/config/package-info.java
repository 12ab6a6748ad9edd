/**
 * Spring configuration beans and typed properties.
 *
 * <p>Configuration Classes:
 * <ul>
 *   <li>{@link com.phillippitts.greekeval.config.EvaluationConfig} - engine components, the
 *       evaluation facade and the engine comparison service</li>
 * </ul>
 *
 * <p>Sub-packages:
 * <ul>
 *   <li>{@code config.properties} - {@code eval.*} properties loaded from {@code application.properties}</li>
 * </ul>
 *
 * @see com.phillippitts.greekeval.config.EvaluationConfig
 * @since 1.0
 */
package com.phillippitts.greekeval.config;
