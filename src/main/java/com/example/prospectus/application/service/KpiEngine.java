package com.example.prospectus.application.service;

import com.example.prospectus.application.service.financial.PeriodOrdering;
import com.example.prospectus.config.InsightProperties;
import com.example.prospectus.domain.model.CanonicalLabel;
import com.example.prospectus.domain.model.FinancialStatement;
import com.example.prospectus.domain.model.Kpi;
import com.example.prospectus.domain.model.KpiKey;
import com.example.prospectus.domain.model.LineItem;
import com.example.prospectus.domain.model.StatementType;
import com.example.prospectus.domain.model.TrendPoint;
import com.example.prospectus.domain.model.TrendSeries;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Derives KPIs and trend series from parsed statements.
 * Direct KPIs use the latest period of their line item. A KPI whose inputs are missing, or whose denominator is
 * zero, is left out rather than reported as zero.
 */
@Service
public class KpiEngine {

    private static final Logger log = LoggerFactory.getLogger(KpiEngine.class);
    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);
    private static final BigDecimal BALANCE_TOLERANCE_RATIO = new BigDecimal("0.001");
    private static final Map<KpiKey, CanonicalLabel> DIRECT = new EnumMap<>(KpiKey.class);

    static {
        DIRECT.put(KpiKey.REVENUE, CanonicalLabel.REVENUE);
        DIRECT.put(KpiKey.NET_PROFIT, CanonicalLabel.NET_PROFIT);
        DIRECT.put(KpiKey.TOTAL_ASSETS, CanonicalLabel.TOTAL_ASSETS);
        DIRECT.put(KpiKey.TOTAL_LIABILITIES, CanonicalLabel.TOTAL_LIABILITIES);
        DIRECT.put(KpiKey.TOTAL_EQUITY, CanonicalLabel.TOTAL_EQUITY);
        DIRECT.put(KpiKey.CASH_AND_EQUIVALENTS, CanonicalLabel.CASH_AND_EQUIVALENTS);
        DIRECT.put(KpiKey.EBITDA, CanonicalLabel.EBITDA);
        DIRECT.put(KpiKey.OPERATING_CASH_FLOW, CanonicalLabel.OPERATING_CASH_FLOW);
        DIRECT.put(KpiKey.EPS, CanonicalLabel.EPS);
    }

    private final InsightProperties properties;

    public KpiEngine(InsightProperties properties) {
        this.properties = properties;
    }

    /**
     * @param statements statements keyed by {@link StatementType#key()}
     * @return KPIs, trends and validation warnings
     */
    public KpiReport compute(Map<String, FinancialStatement> statements) {
        Map<CanonicalLabel, LineItem> items = index(statements);
        Map<KpiKey, BigDecimal> values = new EnumMap<>(KpiKey.class);

        DIRECT.forEach((key, label) -> latest(items, label).ifPresent(value -> values.put(key, value)));
        if (!values.containsKey(KpiKey.TOTAL_LIABILITIES)) {
            Optional<BigDecimal> current = latest(items, CanonicalLabel.CURRENT_LIABILITIES);
            Optional<BigDecimal> nonCurrent = latest(items, CanonicalLabel.NON_CURRENT_LIABILITIES);
            if (current.isPresent() && nonCurrent.isPresent()) {
                values.put(KpiKey.TOTAL_LIABILITIES, current.get().add(nonCurrent.get()));
            }
        }

        BigDecimal revenue = values.get(KpiKey.REVENUE);
        BigDecimal netProfit = values.get(KpiKey.NET_PROFIT);
        BigDecimal totalAssets = values.get(KpiKey.TOTAL_ASSETS);
        BigDecimal totalLiabilities = values.get(KpiKey.TOTAL_LIABILITIES);
        BigDecimal totalEquity = values.get(KpiKey.TOTAL_EQUITY);

        ratio(netProfit, revenue).ifPresent(value -> values.put(KpiKey.NET_MARGIN, value));
        ratio(values.get(KpiKey.EBITDA), revenue).ifPresent(value -> values.put(KpiKey.EBITDA_MARGIN, value));
        ratio(totalLiabilities, totalEquity).ifPresent(value -> values.put(KpiKey.DEBT_TO_EQUITY, value));
        ratio(latest(items, CanonicalLabel.CURRENT_ASSETS).orElse(null),
                latest(items, CanonicalLabel.CURRENT_LIABILITIES).orElse(null))
                .ifPresent(value -> values.put(KpiKey.CURRENT_RATIO, value));
        ratio(revenue, totalAssets).ifPresent(value -> values.put(KpiKey.ASSET_TURNOVER, value));
        ratio(totalEquity, totalAssets).map(KpiEngine::percent)
                .ifPresent(value -> values.put(KpiKey.EQUITY_TO_ASSETS_PCT, value));
        ratio(netProfit, totalEquity).map(KpiEngine::percent)
                .ifPresent(value -> values.put(KpiKey.RETURN_ON_EQUITY_PCT, value));
        growth(items.get(CanonicalLabel.REVENUE)).ifPresent(value -> values.put(KpiKey.REVENUE_GROWTH_PCT, value));
        growth(items.get(CanonicalLabel.NET_PROFIT)).ifPresent(value -> values.put(KpiKey.NET_PROFIT_GROWTH_PCT, value));

        BigDecimal operatingCashFlow = values.get(KpiKey.OPERATING_CASH_FLOW);
        Optional<BigDecimal> capex = latest(items, CanonicalLabel.CAPITAL_EXPENDITURE);
        if (operatingCashFlow != null && capex.isPresent()) {
            values.put(KpiKey.FREE_CASH_FLOW, operatingCashFlow.subtract(capex.get().abs()));
        }

        Map<String, Kpi> kpis = new LinkedHashMap<>();
        int precision = properties.getKpi().getPrecision();
        values.forEach((key, value) -> kpis.put(key.key(), Kpi.of(key, value.setScale(precision, RoundingMode.HALF_UP))));

        List<String> warnings = new ArrayList<>();
        checkBalance(totalAssets, totalEquity, totalLiabilities).ifPresent(warnings::add);

        List<TrendSeries> trends = trends(items);
        log.info("Computed {} KPIs and {} trend series", kpis.size(), trends.size());
        return new KpiReport(kpis, trends, warnings);
    }

    private static Map<CanonicalLabel, LineItem> index(Map<String, FinancialStatement> statements) {
        Map<CanonicalLabel, LineItem> items = new EnumMap<>(CanonicalLabel.class);
        if (statements == null) {
            return items;
        }
        for (FinancialStatement statement : statements.values()) {
            for (LineItem item : statement.items().values()) {
                items.putIfAbsent(item.label(), item);
            }
        }
        return items;
    }

    private static Optional<BigDecimal> latest(Map<CanonicalLabel, LineItem> items, CanonicalLabel label) {
        LineItem item = items.get(label);
        if (item == null || item.values().isEmpty()) {
            return Optional.empty();
        }
        String period = PeriodOrdering.latest(new ArrayList<>(item.values().keySet()));
        return Optional.ofNullable(item.values().get(period));
    }

    private static Optional<BigDecimal> ratio(BigDecimal numerator, BigDecimal denominator) {
        if (numerator == null || denominator == null || denominator.signum() == 0) {
            return Optional.empty();
        }
        return Optional.of(numerator.divide(denominator, MathContext.DECIMAL64));
    }

    private static BigDecimal percent(BigDecimal ratio) {
        return ratio.multiply(HUNDRED);
    }

    /**
     * Growth between the two most recent periods, in percent.
     */
    private static Optional<BigDecimal> growth(LineItem item) {
        if (item == null || item.periodCount() < 2) {
            return Optional.empty();
        }
        List<String> periods = PeriodOrdering.ascending(new ArrayList<>(item.values().keySet()));
        BigDecimal latest = item.values().get(periods.get(periods.size() - 1));
        BigDecimal previous = item.values().get(periods.get(periods.size() - 2));
        return ratio(latest.subtract(previous), previous).map(KpiEngine::percent);
    }

    private static Optional<String> checkBalance(BigDecimal assets, BigDecimal equity, BigDecimal liabilities) {
        if (assets == null || equity == null || liabilities == null) {
            return Optional.empty();
        }
        BigDecimal funding = equity.add(liabilities);
        BigDecimal difference = assets.subtract(funding).abs();
        BigDecimal tolerance = assets.abs().multiply(BALANCE_TOLERANCE_RATIO).max(BigDecimal.ONE);
        if (difference.compareTo(tolerance) <= 0) {
            return Optional.empty();
        }
        String warning = "Balance sheet does not balance: total assets " + assets.toPlainString()
                + " differ from equity plus liabilities " + funding.toPlainString()
                + " by " + difference.toPlainString() + ".";
        log.warn(warning);
        return Optional.of(warning);
    }

    private static List<TrendSeries> trends(Map<CanonicalLabel, LineItem> items) {
        List<TrendSeries> trends = new ArrayList<>();
        for (LineItem item : items.values()) {
            if (item.periodCount() < 2) {
                continue;
            }
            List<TrendPoint> points = PeriodOrdering.ascending(new ArrayList<>(item.values().keySet())).stream()
                    .map(period -> new TrendPoint(period, item.values().get(period)))
                    .toList();
            trends.add(new TrendSeries(item.key(), points));
        }
        return trends;
    }
}
