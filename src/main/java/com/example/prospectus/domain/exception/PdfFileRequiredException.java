package com.example.prospectus.domain.exception;

/**
 * Raised when a document is submitted without any content.
 */
public class PdfFileRequiredException extends DomainException {

    /**
     * Creates the exception with a user-friendly explanation.
     */
    public PdfFileRequiredException() {
        super("Please choose a prospectus PDF to upload.");
    }
}
