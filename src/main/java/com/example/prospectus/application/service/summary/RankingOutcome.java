package com.example.prospectus.application.service.summary;

import java.util.List;

/**
 * Scores of one TextRank run.
 *
 * @param scores     score per sentence, in sentence order; sums to one
 * @param iterations power iterations performed
 * @param converged  whether the tolerance was reached before the iteration cap
 */
public record RankingOutcome(List<Double> scores, int iterations, boolean converged) {

    public RankingOutcome {
        scores = List.copyOf(scores);
    }
}
