package com.vigil.correlation.api.exceptions;

/**
 * Thrown when rules cannot be loaded or indexed. The previously active
 * rule index stays in effect.
 */
public class RuleLoadException extends Exception {

    public RuleLoadException(String message) {
        super(message);
    }

    public RuleLoadException(String message, Throwable cause) {
        super(message, cause);
    }
}
