package com.example.prospectus.domain.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Named mapping of canonical line items, keyed by {@link CanonicalLabel#key()}.
 */
public record FinancialStatement(StatementType type, Map<String, LineItem> items) {

    public FinancialStatement {
        items = items == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(items));
    }

    public Optional<LineItem> item(CanonicalLabel label) {
        return Optional.ofNullable(items.get(label.key()));
    }

    public boolean isEmpty() {
        return items.isEmpty();
    }
}
