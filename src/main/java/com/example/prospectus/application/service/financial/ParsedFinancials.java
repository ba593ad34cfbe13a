package com.example.prospectus.application.service.financial;

import com.example.prospectus.domain.model.CanonicalLabel;
import com.example.prospectus.domain.model.FinancialStatement;
import com.example.prospectus.domain.model.LineItem;
import com.example.prospectus.domain.model.ReportingScale;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Everything the table parser recognised in one document.
 *
 * @param statements     statements keyed by {@link com.example.prospectus.domain.model.StatementType#key()}
 * @param reportingScale first scale announced in the document, {@link ReportingScale#UNITS} when none was found
 * @param pagesScanned   number of pages read
 * @param pagesWithText  pages that carried a text layer
 */
public record ParsedFinancials(
        Map<String, FinancialStatement> statements,
        ReportingScale reportingScale,
        int pagesScanned,
        int pagesWithText
) {

    public ParsedFinancials {
        statements = Collections.unmodifiableMap(new LinkedHashMap<>(statements));
    }

    public Optional<LineItem> item(CanonicalLabel label) {
        FinancialStatement statement = statements.get(label.statement().key());
        return statement == null ? Optional.empty() : statement.item(label);
    }

    public int itemCount() {
        return statements.values().stream().mapToInt(statement -> statement.items().size()).sum();
    }
}
