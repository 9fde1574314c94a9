package com.company.reliability.exception;

/**
 * A collaborator (time-series source, repository, dependency graph) failed.
 * Retry policy belongs to the caller.
 */
public class ProviderQueryException extends RuntimeException {
    public ProviderQueryException(String message) {
        super(message);
    }

    public ProviderQueryException(String message, Throwable cause) {
        super(message, cause);
    }
}
