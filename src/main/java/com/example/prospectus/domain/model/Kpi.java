package com.example.prospectus.domain.model;

import java.math.BigDecimal;

/**
 * Computed metric. Never extracted directly; recomputed on every analysis.
 */
public record Kpi(String name, BigDecimal value, KpiUnit unit) {

    public static Kpi of(KpiKey key, BigDecimal value) {
        return new Kpi(key.key(), value, key.unit());
    }
}
