/**
 * Input validation for transcripts before they reach the evaluation engine.
 *
 * <p>Key Components:
 * <ul>
 *   <li>{@link com.phillippitts.greekeval.service.validation.TranscriptValidator} - rejects a
 *       null reference and transcripts over the length ceiling</li>
 * </ul>
 *
 * <p>Configuration (application.properties):
 * <pre>
 * eval.validation.max-transcript-chars=50000
 * </pre>
 *
 * @see com.phillippitts.greekeval.exception.InvalidTranscriptException
 * @since 1.0
 */
package com.phillippitts.greekeval.service.validation;
