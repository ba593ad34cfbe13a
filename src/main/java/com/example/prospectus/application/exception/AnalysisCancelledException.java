package com.example.prospectus.application.exception;

/**
 * Signals that an analysis was abandoned at a page boundary because the calling thread was interrupted.
 */
public class AnalysisCancelledException extends ApplicationException {

    public AnalysisCancelledException(String message) {
        super(message);
    }
}
