package com.bountyscope.core.advisory;

/**
 * Thrown when the advisory service answers with no content.
 */
public class AdvisoryEmptyResponseException extends RuntimeException {
    public AdvisoryEmptyResponseException(String message) {
        super(message);
    }
}
