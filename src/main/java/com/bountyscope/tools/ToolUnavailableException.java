package com.bountyscope.tools;

/**
 * Thrown when an external tool binary cannot be started.
 */
public class ToolUnavailableException extends RuntimeException {
    public ToolUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
