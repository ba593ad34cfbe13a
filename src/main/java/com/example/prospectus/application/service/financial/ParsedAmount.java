package com.example.prospectus.application.service.financial;

import com.example.prospectus.domain.model.ReportingScale;

import java.math.BigDecimal;

/**
 * One numeric cell of a financial row.
 *
 * @param value        signed amount as printed, {@code null} for dash or "nil" placeholders
 * @param explicitUnit unit suffix printed next to the amount, {@code null} when the table scale applies
 */
public record ParsedAmount(BigDecimal value, ReportingScale explicitUnit) {

    public static ParsedAmount placeholder() {
        return new ParsedAmount(null, null);
    }

    public boolean isPlaceholder() {
        return value == null;
    }

    /**
     * @param tableScale scale announced for the surrounding table
     * @return the amount in absolute units, {@code null} for placeholders
     */
    public BigDecimal scaled(ReportingScale tableScale) {
        if (value == null) {
            return null;
        }
        ReportingScale scale = explicitUnit != null ? explicitUnit : tableScale;
        return scale == null || scale == ReportingScale.UNITS ? value : value.multiply(scale.multiplier());
    }
}
