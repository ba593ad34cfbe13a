package com.example.prospectus.domain.exception;

/**
 * Raised when a submitted file neither carries a PDF signature nor a PDF name or content type.
 */
public class UnsupportedPdfFormatException extends DomainException {

    /**
     * Creates the exception and mentions the offending file so the user can react.
     *
     * @param fileName original file name supplied by the client
     */
    public UnsupportedPdfFormatException(String fileName) {
        super("Only PDF uploads are supported" + (fileName != null ? ": " + fileName : "."));
    }
}
