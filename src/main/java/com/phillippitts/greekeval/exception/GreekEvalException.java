package com.phillippitts.greekeval.exception;

/**
 * Base exception for all greek-asr-eval application errors.
 *
 * <p>The evaluation engine itself never throws; these exceptions come from the layers
 * around it (input validation, engine comparison).
 */
public class GreekEvalException extends RuntimeException {

    public GreekEvalException(String message) {
        super(message);
    }

    public GreekEvalException(String message, Throwable cause) {
        super(message, cause);
    }

    public GreekEvalException(Throwable cause) {
        super(cause);
    }
}
