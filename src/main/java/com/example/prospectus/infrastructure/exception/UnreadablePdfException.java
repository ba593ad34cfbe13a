package com.example.prospectus.infrastructure.exception;

/**
 * Signals that the bytes are not a valid PDF container (corrupt header, trailer or cross reference table).
 * Fatal for an analysis.
 */
public class UnreadablePdfException extends InfrastructureException {

    /**
     * Creates the exception with a contextual message and the root cause from PDFBox.
     *
     * @param message description shared with the application layer
     * @param cause   low-level PDFBox exception
     */
    public UnreadablePdfException(String message, Throwable cause) {
        super(message, cause);
    }
}
