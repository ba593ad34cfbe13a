package com.example.prospectus.application.service;

import com.example.prospectus.application.exception.AnalysisCancelledException;

/**
 * Cooperative cancellation point. Page loops call {@link #checkpoint()} before each page so an interrupted
 * analysis stops at a page boundary and never in the middle of one.
 */
public final class AnalysisCancellation {

    private AnalysisCancellation() {
    }

    /**
     * @throws AnalysisCancelledException when the current thread has been interrupted
     */
    public static void checkpoint() {
        if (Thread.currentThread().isInterrupted()) {
            throw new AnalysisCancelledException("Analysis was cancelled.");
        }
    }
}
