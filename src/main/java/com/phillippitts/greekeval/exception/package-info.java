/**
 * Unchecked exception hierarchy rooted at
 * {@link com.phillippitts.greekeval.exception.GreekEvalException}.
 *
 * <p>The evaluation engine is total and raises none of these; they guard its callers.
 *
 * @since 1.0
 */
package com.phillippitts.greekeval.exception;
