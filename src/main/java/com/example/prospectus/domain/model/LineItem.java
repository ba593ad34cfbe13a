package com.example.prospectus.domain.model;

import java.math.BigDecimal;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Canonical financial line item with its value per reporting period.
 * The period map keeps the order in which periods appeared in the source table.
 */
public record LineItem(CanonicalLabel label, Map<String, BigDecimal> values) {

    public LineItem {
        if (label == null) {
            throw new IllegalArgumentException("label is required");
        }
        values = values == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }

    public String key() {
        return label.key();
    }

    public int periodCount() {
        return values.size();
    }
}
