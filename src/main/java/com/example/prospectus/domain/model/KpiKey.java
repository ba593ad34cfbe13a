package com.example.prospectus.domain.model;

/**
 * Keys of the computed KPI map. The string form is consumed verbatim by downstream clients.
 */
public enum KpiKey {
    REVENUE("revenue", KpiUnit.CURRENCY),
    NET_PROFIT("net_profit", KpiUnit.CURRENCY),
    TOTAL_ASSETS("total_assets", KpiUnit.CURRENCY),
    TOTAL_LIABILITIES("total_liabilities", KpiUnit.CURRENCY),
    TOTAL_EQUITY("total_equity", KpiUnit.CURRENCY),
    CASH_AND_EQUIVALENTS("cash_and_equivalents", KpiUnit.CURRENCY),
    EBITDA("ebitda", KpiUnit.CURRENCY),
    OPERATING_CASH_FLOW("operating_cash_flow", KpiUnit.CURRENCY),
    EPS("eps", KpiUnit.DIMENSIONLESS),
    NET_MARGIN("net_margin", KpiUnit.RATIO),
    EBITDA_MARGIN("ebitda_margin", KpiUnit.RATIO),
    DEBT_TO_EQUITY("debt_to_equity", KpiUnit.RATIO),
    CURRENT_RATIO("current_ratio", KpiUnit.RATIO),
    ASSET_TURNOVER("asset_turnover", KpiUnit.RATIO),
    EQUITY_TO_ASSETS_PCT("equity_to_assets_pct", KpiUnit.PERCENTAGE),
    RETURN_ON_EQUITY_PCT("return_on_equity_pct", KpiUnit.PERCENTAGE),
    REVENUE_GROWTH_PCT("revenue_growth_pct", KpiUnit.PERCENTAGE),
    NET_PROFIT_GROWTH_PCT("net_profit_growth_pct", KpiUnit.PERCENTAGE),
    FREE_CASH_FLOW("free_cash_flow", KpiUnit.CURRENCY);

    private final String key;
    private final KpiUnit unit;

    KpiKey(String key, KpiUnit unit) {
        this.key = key;
        this.unit = unit;
    }

    public String key() {
        return key;
    }

    public KpiUnit unit() {
        return unit;
    }

    @Override
    public String toString() {
        return key;
    }
}
