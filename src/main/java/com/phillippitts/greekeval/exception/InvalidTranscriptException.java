package com.phillippitts.greekeval.exception;

/**
 * Thrown when a transcript is rejected before evaluation: a missing reference, or text
 * longer than the configured ceiling for the quadratic edit-distance tables.
 */
public class InvalidTranscriptException extends GreekEvalException {

    private final int length;
    private final String reason;

    public InvalidTranscriptException(String reason) {
        super("Invalid transcript: " + reason);
        this.length = 0;
        this.reason = reason;
    }

    public InvalidTranscriptException(int length, String reason) {
        super("Invalid transcript (" + length + " chars): " + reason);
        this.length = length;
        this.reason = reason;
    }

    public int getLength() {
        return length;
    }

    public String getReason() {
        return reason;
    }
}
