package com.example.prospectus.application.exception;

/**
 * Signals a total failure: the document opened but neither KPIs nor a summary could be produced
 * because it has no text layer at all.
 */
public class AnalysisFailedException extends ApplicationException {

    public AnalysisFailedException(String message, Throwable cause) {
        super(message, cause);
    }
}
