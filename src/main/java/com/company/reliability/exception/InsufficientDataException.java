package com.company.reliability.exception;

/**
 * Too few data points to compute a budget or a regression. Not retryable:
 * the caller should wait for more data.
 */
public class InsufficientDataException extends RuntimeException {
    public InsufficientDataException(String message) {
        super(message);
    }
}
