package com.mpl.domain.exception;

/**
 * Unexpected failure inside the entitlement engine
 */
public class CalculationException extends RuntimeException {

    public CalculationException(String message) {
        super(message);
    }

    public CalculationException(String message, Throwable cause) {
        super(message, cause);
    }
}
