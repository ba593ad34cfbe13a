package com.example.prospectus.domain.exception;

/**
 * Base type for all domain-level exceptions of the insight pipeline.
 * Subclasses describe why a document cannot yield a given kind of insight without leaking PDF library details.
 */
public abstract class DomainException extends RuntimeException {

    /**
     * Creates a domain exception with a descriptive failure message.
     *
     * @param message explanation suitable for surfacing to the caller
     */
    protected DomainException(String message) {
        super(message);
    }

    /**
     * Creates a domain exception that wraps an underlying cause.
     *
     * @param message explanation suitable for surfacing to the caller
     * @param cause   original exception that triggered the domain failure
     */
    protected DomainException(String message, Throwable cause) {
        super(message, cause);
    }
}
