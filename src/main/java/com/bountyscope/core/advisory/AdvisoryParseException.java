package com.bountyscope.core.advisory;

/**
 * Thrown when advisory output cannot be parsed into the expected payload.
 */
public class AdvisoryParseException extends RuntimeException {
    public AdvisoryParseException(String message) {
        super(message);
    }

    public AdvisoryParseException(String message, Throwable cause) {
        super(message, cause);
    }
}
