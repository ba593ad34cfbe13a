package com.example.prospectus.domain.model;

/**
 * Extractive summary of the MDA section.
 *
 * @param summary           selected sentences in their original order
 * @param startPage         first physical page of the section
 * @param endPage           last physical page of the section (inclusive)
 * @param sentenceCount     number of usable sentences the ranking ran over
 * @param selectedSentences number of sentences in the summary
 * @param rawText           full section text, kept for "show raw text" views
 */
public record SummaryResult(
        String summary,
        int startPage,
        int endPage,
        int sentenceCount,
        int selectedSentences,
        String rawText
) {
}
