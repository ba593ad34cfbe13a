package com.example.prospectus.domain.exception;

/**
 * Raised when no Management Discussion &amp; Analysis heading can be located.
 * Non-fatal: the summary branch is reported as unavailable.
 */
public class SectionNotFoundException extends DomainException {

    public SectionNotFoundException(String message) {
        super(message);
    }
}
