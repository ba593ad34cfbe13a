package com.example.prospectus.infrastructure.exception;

/**
 * Signals that an upload could not be read into the document store.
 */
public class DocumentStorageException extends InfrastructureException {

    public DocumentStorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
