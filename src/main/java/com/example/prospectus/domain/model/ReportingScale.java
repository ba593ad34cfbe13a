package com.example.prospectus.domain.model;

import java.math.BigDecimal;
import java.util.Locale;
import java.util.Optional;

/**
 * Unit multipliers used by financial tables ("₹ in crore", "Rs. in lakhs", "in million").
 */
public enum ReportingScale {
    UNITS("units", BigDecimal.ONE),
    THOUSANDS("thousands", new BigDecimal("1000")),
    LAKHS("lakhs", new BigDecimal("100000")),
    MILLIONS("millions", new BigDecimal("1000000")),
    CRORES("crores", new BigDecimal("10000000")),
    BILLIONS("billions", new BigDecimal("1000000000"));

    private final String label;
    private final BigDecimal multiplier;

    ReportingScale(String label, BigDecimal multiplier) {
        this.label = label;
        this.multiplier = multiplier;
    }

    public String label() {
        return label;
    }

    public BigDecimal multiplier() {
        return multiplier;
    }

    /**
     * Maps a unit word or abbreviation ("Cr", "crores", "Lakh", "Mn", "bn", "K") to its scale.
     *
     * @param word unit word, case insensitive, trailing dot allowed
     * @return matching scale or empty
     */
    public static Optional<ReportingScale> fromUnitWord(String word) {
        if (word == null) {
            return Optional.empty();
        }
        String normalized = word.strip().toLowerCase(Locale.ROOT);
        if (normalized.endsWith(".")) {
            normalized = normalized.substring(0, normalized.length() - 1);
        }
        return switch (normalized) {
            case "cr", "crore", "crores" -> Optional.of(CRORES);
            case "lakh", "lakhs", "lac", "lacs" -> Optional.of(LAKHS);
            case "mn", "million", "millions" -> Optional.of(MILLIONS);
            case "bn", "billion", "billions" -> Optional.of(BILLIONS);
            case "k", "thousand", "thousands" -> Optional.of(THOUSANDS);
            default -> Optional.empty();
        };
    }

    @Override
    public String toString() {
        return label;
    }
}
