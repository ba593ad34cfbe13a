package com.example.prospectus.domain.model;

/**
 * Marker recorded in an {@link AnalysisResult} when one half of the pipeline produced nothing.
 *
 * @param code   stable machine readable code
 * @param reason human readable explanation
 */
public record BranchFailure(String code, String reason) {
}
