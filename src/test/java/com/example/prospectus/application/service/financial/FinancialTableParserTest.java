package com.example.prospectus.application.service.financial;

import com.example.prospectus.domain.exception.NoFinancialDataFoundException;
import com.example.prospectus.domain.model.CanonicalLabel;
import com.example.prospectus.domain.model.LineItem;
import com.example.prospectus.domain.model.Page;
import com.example.prospectus.domain.model.ReportingScale;
import com.example.prospectus.domain.model.TextLine;
import com.example.prospectus.domain.model.WordToken;
import com.example.prospectus.support.ListPageSource;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

class FinancialTableParserTest {

    private final AmountParser amountParser = new AmountParser();
    private final LabelNormalizer labelNormalizer = new LabelNormalizer();
    private final FinancialTableParser parser = new FinancialTableParser(
            amountParser, labelNormalizer, new PeriodHeaderDetector(amountParser, labelNormalizer));

    @Test
    void bindsRowsToHeaderPeriodsAndAppliesScale() {
        ListPageSource pages = ListPageSource.ofTexts(String.join("\n",
                "Restated Statement of Profit and Loss",
                "(₹ in crore)",
                "Particulars FY2023 FY2022",
                "Revenue from operations 1,000.00 800.00",
                "Profit for the year 120 (30)",
                "Basic EPS 12.5 10.1"));

        ParsedFinancials parsed = parser.parse(pages);

        assertThat(parsed.reportingScale()).isEqualTo(ReportingScale.CRORES);
        assertThat(parsed.statements()).containsOnlyKeys("profit_and_loss");
        LineItem revenue = parsed.item(CanonicalLabel.REVENUE).orElseThrow();
        assertThat(revenue.values()).containsOnlyKeys("FY2023", "FY2022");
        assertThat(revenue.values().get("FY2023")).isEqualByComparingTo("10000000000");
        assertThat(revenue.values().get("FY2022")).isEqualByComparingTo("8000000000");
        assertThat(parsed.item(CanonicalLabel.NET_PROFIT).orElseThrow().values().get("FY2022"))
                .isEqualByComparingTo("-300000000");
        LineItem eps = parsed.item(CanonicalLabel.EPS).orElseThrow();
        assertThat(eps.values().get("FY2023")).isEqualByComparingTo("12.5");
    }

    @Test
    void rowsWithoutHeaderUsePositionalPeriods() {
        ListPageSource pages = ListPageSource.ofTexts("Total assets 5,000 4,000");

        ParsedFinancials parsed = parser.parse(pages);

        LineItem assets = parsed.item(CanonicalLabel.TOTAL_ASSETS).orElseThrow();
        assertThat(assets.values()).containsOnlyKeys("P1", "P2");
        assertThat(assets.values().get("P1")).isEqualByComparingTo("5000");
        assertThat(parsed.reportingScale()).isEqualTo(ReportingScale.UNITS);
    }

    @Test
    void trailingDateInLabelIsNotAnAmount() {
        ListPageSource pages = ListPageSource.ofTexts("Cash and cash equivalents as at March 31, 2023 1,500 1,200");

        LineItem cash = parser.parse(pages).item(CanonicalLabel.CASH_AND_EQUIVALENTS).orElseThrow();

        assertThat(cash.values()).hasSize(2);
        assertThat(cash.values().get("P1")).isEqualByComparingTo("1500");
        assertThat(cash.values().get("P2")).isEqualByComparingTo("1200");
    }

    @Test
    void missingLeadingValueBindsFromTheRight() {
        ListPageSource pages = ListPageSource.ofTexts(String.join("\n",
                "Particulars FY2023 FY2022 FY2021",
                "Inventories 300 250"));

        LineItem inventories = parser.parse(pages).item(CanonicalLabel.INVENTORIES).orElseThrow();

        assertThat(inventories.values()).containsOnlyKeys("FY2022", "FY2021");
        assertThat(inventories.values().get("FY2022")).isEqualByComparingTo("300");
    }

    @Test
    void positionedRowsBindByColumn() {
        TextLine header = new TextLine(100f, List.of(
                new WordToken("Particulars", 10f, 100f, 60f, 9f, true),
                new WordToken("FY2023", 300f, 100f, 40f, 9f, true),
                new WordToken("FY2022", 400f, 100f, 40f, 9f, true)));
        TextLine row = new TextLine(120f, List.of(
                new WordToken("Revenue", 10f, 120f, 50f, 9f, false),
                new WordToken("1,000", 305f, 120f, 30f, 9f, false)));

        ParsedFinancials parsed = parser.parse(ListPageSource.ofPages(
                new Page(1, "Particulars FY2023 FY2022\nRevenue 1,000", List.of(header, row))));

        LineItem revenue = parsed.item(CanonicalLabel.REVENUE).orElseThrow();
        assertThat(revenue.values()).containsOnlyKeys("FY2023");
        assertThat(revenue.values().get("FY2023")).isEqualByComparingTo("1000");
    }

    @Test
    void firstOccurrenceWins() {
        ListPageSource pages = ListPageSource.ofTexts(
                "Particulars FY2023 FY2022\nRevenue from operations 1,000 800",
                "Revenue from operations 9,999 8,888");

        ParsedFinancials parsed = parser.parse(pages);

        assertThat(parsed.item(CanonicalLabel.REVENUE).orElseThrow().values().get("FY2023"))
                .isEqualByComparingTo("1000");
        assertThat(parsed.pagesWithText()).isEqualTo(2);
    }

    @Test
    void surplusAmountsKeepTheFirstForTheLatestPeriod() {
        ListPageSource pages = ListPageSource.ofTexts(String.join("\n",
                "Particulars FY2023 FY2022",
                "Revenue from operations 1,100 1,000 800",
                "Total assets 9,000 8,500 8,200 7,000"));

        ParsedFinancials parsed = parser.parse(pages);

        LineItem revenue = parsed.item(CanonicalLabel.REVENUE).orElseThrow();
        assertThat(revenue.values()).containsOnlyKeys("FY2023", "FY2022");
        assertThat(revenue.values().get("FY2023")).isEqualByComparingTo("1100");
        assertThat(revenue.values().get("FY2022")).isEqualByComparingTo("800");
        LineItem assets = parsed.item(CanonicalLabel.TOTAL_ASSETS).orElseThrow();
        assertThat(assets.values().get("FY2023")).isEqualByComparingTo("9000");
        assertThat(assets.values().get("FY2022")).isEqualByComparingTo("7000");
    }

    @Test
    void scalePhraseInLongProseIsIgnored() {
        Page page = Page.ofText(1, "The amounts discussed in this chapter of the offer document are explained"
                + " below and are stated in crore unless the context otherwise requires it");

        assertThat(parser.detectScale(page.lines().get(0))).isEmpty();
        assertThat(parser.detectScale(Page.ofText(1, "(Rs. in lakhs)").lines().get(0))).contains(ReportingScale.LAKHS);
    }

    @Test
    void noCanonicalRowsIsReported() {
        ListPageSource pages = ListPageSource.ofTexts("Our business is growing steadily.", null);

        NoFinancialDataFoundException ex = assertThrows(NoFinancialDataFoundException.class,
                () -> parser.parse(pages));

        assertThat(ex.getPagesWithText()).isEqualTo(1);
    }
}
