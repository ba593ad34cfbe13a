package com.example.prospectus.domain.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Aggregate insight for one document. Instances are cached per {@code fileId} and never mutated.
 * Exactly one of {@code summary} / {@code summaryFailure} is set, and financial fields are empty whenever
 * {@code financialsFailure} is set.
 */
public record AnalysisResult(
        String fileId,
        String fileName,
        String companyName,
        int pageCount,
        TocMode tocMode,
        ReportingScale reportingScale,
        Map<String, Kpi> kpis,
        Map<String, FinancialStatement> statements,
        List<TrendSeries> trends,
        List<String> validationWarnings,
        BranchFailure financialsFailure,
        SummaryResult summary,
        BranchFailure summaryFailure
) {

    public AnalysisResult {
        kpis = kpis == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(kpis));
        statements = statements == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(statements));
        trends = trends == null ? List.of() : List.copyOf(trends);
        validationWarnings = validationWarnings == null ? List.of() : List.copyOf(validationWarnings);
    }

    public boolean hasFinancials() {
        return financialsFailure == null;
    }

    public boolean hasSummary() {
        return summary != null;
    }
}
