package com.example.prospectus.application.service;

import com.example.prospectus.domain.model.Kpi;
import com.example.prospectus.domain.model.TrendSeries;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Output of the KPI engine.
 *
 * @param kpis     computed KPIs keyed by name, in a stable order
 * @param trends   one series per line item reported for at least two periods
 * @param warnings consistency problems noticed in the statements
 */
public record KpiReport(Map<String, Kpi> kpis, List<TrendSeries> trends, List<String> warnings) {

    public KpiReport {
        kpis = Collections.unmodifiableMap(new LinkedHashMap<>(kpis));
        trends = List.copyOf(trends);
        warnings = List.copyOf(warnings);
    }
}
