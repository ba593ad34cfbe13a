package com.example.prospectus.domain.exception;

/**
 * Raised when no meaningful summary can be produced, either because the MDA section is missing
 * or because it holds too few sentences. Non-fatal for the analysis as a whole.
 */
public class SummaryUnavailableException extends DomainException {

    public SummaryUnavailableException(String message) {
        super(message);
    }
}
