package com.example.prospectus.application.service;

import com.example.prospectus.application.exception.AnalysisCancelledException;
import com.example.prospectus.domain.model.AnalysisResult;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.ExecutionException;
import java.util.function.Supplier;

/**
 * Single-flight store of analysis results keyed by {@code fileId}.
 * <p>
 * The first caller for a key runs the computation on its own thread; concurrent callers wait for the same
 * future. A computation that fails or is cancelled is removed so a later call starts over. Entries are only
 * ever replaced or removed, never mutated.
 */
@Component
public class AnalysisResultCache {

    private static final Logger log = LoggerFactory.getLogger(AnalysisResultCache.class);

    private final ConcurrentMap<String, CompletableFuture<AnalysisResult>> entries = new ConcurrentHashMap<>();

    /**
     * Returns the cached result for the key or computes it exactly once.
     *
     * @param fileId      cache key
     * @param computation pipeline run, invoked on the calling thread when this caller wins the race
     * @return cached or freshly computed result
     * @throws AnalysisCancelledException when the waiting thread is interrupted
     */
    public AnalysisResult getOrCompute(String fileId, Supplier<AnalysisResult> computation) {
        while (true) {
            CompletableFuture<AnalysisResult> existing = entries.get(fileId);
            if (existing == null) {
                CompletableFuture<AnalysisResult> created = new CompletableFuture<>();
                existing = entries.putIfAbsent(fileId, created);
                if (existing == null) {
                    log.info("Cache miss for {}", fileId);
                    return compute(fileId, created, computation);
                }
            } else if (existing.isDone()) {
                log.debug("Cache hit for {}", fileId);
            } else {
                log.info("Joining in-flight analysis of {}", fileId);
            }
            try {
                return await(existing);
            } catch (CancellationException ex) {
                // owner abandoned the run; race again for ownership
                log.debug("In-flight analysis of {} was cancelled; retrying", fileId);
            }
        }
    }

    /**
     * Removes the entry for a key. An in-flight computation still completes for its current waiters.
     */
    public void evict(String fileId) {
        if (entries.remove(fileId) != null) {
            log.info("Evicted cached analysis for {}", fileId);
        }
    }

    public void clear() {
        entries.clear();
    }

    public boolean contains(String fileId) {
        CompletableFuture<AnalysisResult> future = entries.get(fileId);
        return future != null && future.isDone() && !future.isCompletedExceptionally();
    }

    private AnalysisResult compute(String fileId,
                                   CompletableFuture<AnalysisResult> future,
                                   Supplier<AnalysisResult> computation) {
        try {
            AnalysisResult result = computation.get();
            future.complete(result);
            return result;
        } catch (AnalysisCancelledException ex) {
            entries.remove(fileId, future);
            future.cancel(false);
            throw ex;
        } catch (RuntimeException | Error ex) {
            entries.remove(fileId, future);
            future.completeExceptionally(ex);
            throw ex;
        }
    }

    private AnalysisResult await(CompletableFuture<AnalysisResult> future) {
        try {
            return future.get();
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new AnalysisCancelledException("Interrupted while waiting for an in-flight analysis.");
        } catch (ExecutionException ex) {
            Throwable cause = ex.getCause();
            if (cause instanceof RuntimeException runtime) {
                throw runtime;
            }
            if (cause instanceof Error error) {
                throw error;
            }
            throw new IllegalStateException("Analysis failed", cause);
        }
    }
}
