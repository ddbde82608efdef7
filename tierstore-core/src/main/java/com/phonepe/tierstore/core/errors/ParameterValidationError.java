package com.phonepe.tierstore.core.errors;

/**
 * Validation failures in configuration and in parameters passed to the stores
 */
public class ParameterValidationError extends RuntimeException {
    public ParameterValidationError(final String message) {
        super(message);
    }
}
