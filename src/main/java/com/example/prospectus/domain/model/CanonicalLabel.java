package com.example.prospectus.domain.model;

import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Closed vocabulary of financial line items with their synonym table.
 * Synonyms are stored in normalized form: lower case, punctuation replaced by spaces, single spaced.
 * The {@link #key()} values are part of the public output contract.
 */
public enum CanonicalLabel {
    REVENUE("revenue", StatementType.PROFIT_AND_LOSS,
            "revenue", "revenue from operations", "total revenue from operations", "revenue from operations net",
            "net revenue from operations", "net revenue", "net sales", "sales", "turnover", "total revenue",
            "income from operations", "total income from operations", "revenue from contracts with customers"),
    OTHER_INCOME("other_income", StatementType.PROFIT_AND_LOSS,
            "other income", "other operating income"),
    TOTAL_INCOME("total_income", StatementType.PROFIT_AND_LOSS,
            "total income"),
    TOTAL_EXPENSES("total_expenses", StatementType.PROFIT_AND_LOSS,
            "total expenses", "total expenditure"),
    EBITDA("ebitda", StatementType.PROFIT_AND_LOSS,
            "ebitda", "operating ebitda", "restated ebitda",
            "earnings before interest tax depreciation and amortisation",
            "earnings before interest tax depreciation and amortization"),
    DEPRECIATION("depreciation", StatementType.PROFIT_AND_LOSS,
            "depreciation", "depreciation and amortisation", "depreciation and amortization",
            "depreciation and amortisation expense", "depreciation and amortization expense",
            "depreciation and amortisation expenses", "depreciation and amortization expenses"),
    FINANCE_COSTS("finance_costs", StatementType.PROFIT_AND_LOSS,
            "finance costs", "finance cost", "interest expense", "interest and finance charges"),
    PROFIT_BEFORE_TAX("profit_before_tax", StatementType.PROFIT_AND_LOSS,
            "profit before tax", "profit loss before tax", "pbt", "restated profit before tax"),
    TAX_EXPENSE("tax_expense", StatementType.PROFIT_AND_LOSS,
            "tax expense", "total tax expense", "total tax expenses", "income tax expense", "tax expenses"),
    NET_PROFIT("net_profit", StatementType.PROFIT_AND_LOSS,
            "net profit", "net profit after tax", "profit after tax", "pat", "net income",
            "profit for the year", "profit for the period", "profit loss for the year", "profit loss for the period",
            "restated profit for the year", "restated profit for the period", "restated profit loss for the year",
            "restated profit loss for the period"),
    EPS("eps", StatementType.PROFIT_AND_LOSS,
            "eps", "basic eps", "basic earnings per share", "earnings per share basic", "basic and diluted eps"),
    TOTAL_ASSETS("total_assets", StatementType.BALANCE_SHEET,
            "total assets"),
    CURRENT_ASSETS("current_assets", StatementType.BALANCE_SHEET,
            "total current assets", "current assets"),
    NON_CURRENT_ASSETS("non_current_assets", StatementType.BALANCE_SHEET,
            "total non current assets", "non current assets"),
    TOTAL_LIABILITIES("total_liabilities", StatementType.BALANCE_SHEET,
            "total liabilities"),
    CURRENT_LIABILITIES("current_liabilities", StatementType.BALANCE_SHEET,
            "total current liabilities", "current liabilities"),
    NON_CURRENT_LIABILITIES("non_current_liabilities", StatementType.BALANCE_SHEET,
            "total non current liabilities", "non current liabilities"),
    TOTAL_EQUITY("total_equity", StatementType.BALANCE_SHEET,
            "total equity", "net worth", "shareholders funds", "total shareholders funds", "shareholders equity",
            "total shareholders equity", "equity attributable to owners of the company",
            "equity attributable to equity holders of the company"),
    TOTAL_BORROWINGS("total_borrowings", StatementType.BALANCE_SHEET,
            "total borrowings", "borrowings", "total debt"),
    CASH_AND_EQUIVALENTS("cash_and_equivalents", StatementType.BALANCE_SHEET,
            "cash and cash equivalents", "cash and equivalents", "cash and bank balances",
            "cash and cash equivalents at the end of the year", "cash and cash equivalents at the end of the period"),
    INVENTORIES("inventories", StatementType.BALANCE_SHEET,
            "inventories", "inventory"),
    TRADE_RECEIVABLES("trade_receivables", StatementType.BALANCE_SHEET,
            "trade receivables", "sundry debtors"),
    OPERATING_CASH_FLOW("operating_cash_flow", StatementType.CASH_FLOW,
            "net cash from operating activities", "net cash generated from operating activities",
            "net cash generated from used in operating activities", "net cash from used in operating activities",
            "net cash flow from operating activities", "net cash flows from operating activities",
            "net cash flow from used in operating activities", "net cash used in operating activities"),
    INVESTING_CASH_FLOW("investing_cash_flow", StatementType.CASH_FLOW,
            "net cash used in investing activities", "net cash from used in investing activities",
            "net cash used in from investing activities", "net cash flow from investing activities",
            "net cash flows from investing activities", "net cash flow used in investing activities",
            "net cash generated from used in investing activities", "net cash from investing activities"),
    FINANCING_CASH_FLOW("financing_cash_flow", StatementType.CASH_FLOW,
            "net cash used in financing activities", "net cash from used in financing activities",
            "net cash used in from financing activities", "net cash flow from financing activities",
            "net cash flows from financing activities", "net cash flow used in financing activities",
            "net cash generated from used in financing activities", "net cash from financing activities"),
    CAPITAL_EXPENDITURE("capital_expenditure", StatementType.CASH_FLOW,
            "capital expenditure", "capex", "purchase of property plant and equipment",
            "purchase of property plant and equipment and intangible assets",
            "purchase of property plant and equipment including capital work in progress");

    /**
     * Phrases that start like a synonym but mean something else.
     */
    private static final Set<String> EXCLUDED_PHRASES = Set.of(
            "total equity and liabilities",
            "total liabilities and equity",
            "total comprehensive income",
            "net worth ratio",
            "sales promotion",
            "total income tax"
    );

    private static final Map<String, CanonicalLabel> BY_SYNONYM;
    private static final List<Map.Entry<String, CanonicalLabel>> PREFIX_SYNONYMS;

    static {
        Map<String, CanonicalLabel> bySynonym = new HashMap<>();
        for (CanonicalLabel label : values()) {
            for (String synonym : label.synonyms) {
                CanonicalLabel previous = bySynonym.putIfAbsent(synonym, label);
                if (previous != null && previous != label) {
                    throw new IllegalStateException("Synonym '" + synonym + "' mapped twice");
                }
            }
        }
        BY_SYNONYM = Collections.unmodifiableMap(bySynonym);
        PREFIX_SYNONYMS = bySynonym.entrySet().stream()
                .filter(entry -> entry.getKey().contains(" "))
                .sorted(Comparator.comparing((Map.Entry<String, CanonicalLabel> entry) -> entry.getKey().length())
                        .reversed()
                        .thenComparing(Map.Entry::getKey))
                .toList();
    }

    private final String key;
    private final StatementType statement;
    private final List<String> synonyms;

    CanonicalLabel(String key, StatementType statement, String... synonyms) {
        this.key = key;
        this.statement = statement;
        this.synonyms = List.of(synonyms);
    }

    public String key() {
        return key;
    }

    public StatementType statement() {
        return statement;
    }

    public List<String> synonyms() {
        return synonyms;
    }

    /**
     * Resolves a normalized label against the synonym table.
     * Exact synonyms win; otherwise the longest multi-word synonym the label starts with is used,
     * so "profit for the year attributable to owners" still resolves to {@link #NET_PROFIT}.
     *
     * @param normalizedLabel label in normalized form
     * @return matched canonical label or empty when the label is not part of the vocabulary
     */
    public static Optional<CanonicalLabel> fromNormalized(String normalizedLabel) {
        if (normalizedLabel == null || normalizedLabel.isBlank()) {
            return Optional.empty();
        }
        CanonicalLabel exact = BY_SYNONYM.get(normalizedLabel);
        if (exact != null) {
            return Optional.of(exact);
        }
        for (String excluded : EXCLUDED_PHRASES) {
            if (normalizedLabel.startsWith(excluded)) {
                return Optional.empty();
            }
        }
        for (Map.Entry<String, CanonicalLabel> entry : PREFIX_SYNONYMS) {
            if (normalizedLabel.startsWith(entry.getKey() + " ")) {
                return Optional.of(entry.getValue());
            }
        }
        return Optional.empty();
    }

    public static Optional<CanonicalLabel> fromKey(String key) {
        for (CanonicalLabel label : values()) {
            if (label.key.equals(key)) {
                return Optional.of(label);
            }
        }
        return Optional.empty();
    }

    @Override
    public String toString() {
        return key;
    }
}
