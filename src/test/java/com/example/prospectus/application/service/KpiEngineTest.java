package com.example.prospectus.application.service;

import com.example.prospectus.config.InsightProperties;
import com.example.prospectus.domain.model.CanonicalLabel;
import com.example.prospectus.domain.model.FinancialStatement;
import com.example.prospectus.domain.model.Kpi;
import com.example.prospectus.domain.model.KpiUnit;
import com.example.prospectus.domain.model.LineItem;
import com.example.prospectus.domain.model.StatementType;
import com.example.prospectus.domain.model.TrendPoint;
import com.example.prospectus.domain.model.TrendSeries;

import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class KpiEngineTest {

    private final KpiEngine engine = new KpiEngine(new InsightProperties());

    @Test
    void revenueGrowthUsesTwoMostRecentPeriods() {
        KpiReport report = engine.compute(statements(
                item(CanonicalLabel.REVENUE, "FY2023", "1000", "FY2022", "800")));

        Kpi growth = report.kpis().get("revenue_growth_pct");
        assertThat(growth.value().toPlainString()).isEqualTo("25.00");
        assertThat(growth.unit()).isEqualTo(KpiUnit.PERCENTAGE);
        assertThat(report.kpis().get("revenue").value()).isEqualByComparingTo("1000");
    }

    @Test
    void zeroEquityLeavesLeverageRatiosOut() {
        KpiReport report = engine.compute(statements(
                item(CanonicalLabel.TOTAL_LIABILITIES, "FY2023", "500"),
                item(CanonicalLabel.TOTAL_EQUITY, "FY2023", "0"),
                item(CanonicalLabel.NET_PROFIT, "FY2023", "50")));

        assertThat(report.kpis()).doesNotContainKeys("debt_to_equity", "return_on_equity_pct");
        assertThat(report.kpis()).containsKeys("total_liabilities", "total_equity", "net_profit");
    }

    @Test
    void computesMarginsAndRatiosAtConfiguredPrecision() {
        KpiReport report = engine.compute(statements(
                item(CanonicalLabel.REVENUE, "FY2023", "1000"),
                item(CanonicalLabel.NET_PROFIT, "FY2023", "100"),
                item(CanonicalLabel.EBITDA, "FY2023", "250"),
                item(CanonicalLabel.TOTAL_ASSETS, "FY2023", "2000"),
                item(CanonicalLabel.TOTAL_EQUITY, "FY2023", "800"),
                item(CanonicalLabel.TOTAL_LIABILITIES, "FY2023", "1200"),
                item(CanonicalLabel.CURRENT_ASSETS, "FY2023", "600"),
                item(CanonicalLabel.CURRENT_LIABILITIES, "FY2023", "400")));

        Map<String, Kpi> kpis = report.kpis();
        assertThat(kpis.get("net_margin").value().toPlainString()).isEqualTo("0.10");
        assertThat(kpis.get("ebitda_margin").value().toPlainString()).isEqualTo("0.25");
        assertThat(kpis.get("debt_to_equity").value().toPlainString()).isEqualTo("1.50");
        assertThat(kpis.get("current_ratio").value().toPlainString()).isEqualTo("1.50");
        assertThat(kpis.get("asset_turnover").value().toPlainString()).isEqualTo("0.50");
        assertThat(kpis.get("equity_to_assets_pct").value().toPlainString()).isEqualTo("40.00");
        assertThat(kpis.get("return_on_equity_pct").value().toPlainString()).isEqualTo("12.50");
        assertThat(report.warnings()).isEmpty();
    }

    @Test
    void freeCashFlowSubtractsCapexMagnitude() {
        KpiReport report = engine.compute(statements(
                item(CanonicalLabel.OPERATING_CASH_FLOW, "FY2023", "300"),
                item(CanonicalLabel.CAPITAL_EXPENDITURE, "FY2023", "-120")));

        assertThat(report.kpis().get("free_cash_flow").value()).isEqualByComparingTo("180");
    }

    @Test
    void totalLiabilitiesFallsBackToCurrentPlusNonCurrent() {
        KpiReport report = engine.compute(statements(
                item(CanonicalLabel.CURRENT_LIABILITIES, "FY2023", "200"),
                item(CanonicalLabel.NON_CURRENT_LIABILITIES, "FY2023", "300")));

        assertThat(report.kpis().get("total_liabilities").value()).isEqualByComparingTo("500");
    }

    @Test
    void unbalancedBalanceSheetProducesWarning() {
        KpiReport report = engine.compute(statements(
                item(CanonicalLabel.TOTAL_ASSETS, "FY2023", "1000"),
                item(CanonicalLabel.TOTAL_EQUITY, "FY2023", "400"),
                item(CanonicalLabel.TOTAL_LIABILITIES, "FY2023", "500")));

        assertThat(report.warnings()).singleElement().asString().contains("does not balance");
    }

    @Test
    void trendsAreOrderedOldestFirst() {
        KpiReport report = engine.compute(statements(
                item(CanonicalLabel.REVENUE, "FY2023", "1000", "FY2021", "600", "FY2022", "800"),
                item(CanonicalLabel.TOTAL_ASSETS, "FY2023", "5000")));

        assertThat(report.trends()).hasSize(1);
        TrendSeries revenue = report.trends().get(0);
        assertThat(revenue.label()).isEqualTo("revenue");
        assertThat(revenue.points()).extracting(TrendPoint::period).containsExactly("FY2021", "FY2022", "FY2023");
    }

    @Test
    void emptyStatementsYieldEmptyReport() {
        KpiReport report = engine.compute(Map.of());

        assertThat(report.kpis()).isEmpty();
        assertThat(report.trends()).isEmpty();
    }

    private static LineItem item(CanonicalLabel label, String... periodValues) {
        Map<String, BigDecimal> values = new LinkedHashMap<>();
        for (int i = 0; i < periodValues.length; i += 2) {
            values.put(periodValues[i], new BigDecimal(periodValues[i + 1]));
        }
        return new LineItem(label, values);
    }

    private static Map<String, FinancialStatement> statements(LineItem... items) {
        Map<StatementType, Map<String, LineItem>> grouped = new LinkedHashMap<>();
        for (LineItem item : items) {
            grouped.computeIfAbsent(item.label().statement(), type -> new LinkedHashMap<>()).put(item.key(), item);
        }
        Map<String, FinancialStatement> statements = new LinkedHashMap<>();
        grouped.forEach((type, statementItems) -> statements.put(type.key(), new FinancialStatement(type, statementItems)));
        return statements;
    }
}
