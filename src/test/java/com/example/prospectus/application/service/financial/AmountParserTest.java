package com.example.prospectus.application.service.financial;

import com.example.prospectus.domain.model.ReportingScale;

import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static org.assertj.core.api.Assertions.assertThat;

class AmountParserTest {

    private final AmountParser parser = new AmountParser();

    @Test
    void parenthesesMeanNegative() {
        ParsedAmount amount = parser.parse("(1,234.50)").orElseThrow();

        assertThat(amount.value()).isEqualByComparingTo("-1234.50");
        assertThat(amount.explicitUnit()).isNull();
    }

    @Test
    void leadingMinusMeansNegative() {
        assertThat(parser.parse("-450").orElseThrow().value()).isEqualByComparingTo("-450");
        assertThat(parser.parse("−12.5").orElseThrow().value()).isEqualByComparingTo("-12.5");
    }

    @Test
    void understandsIndianAndWesternGrouping() {
        assertThat(parser.parse("1,23,456.78").orElseThrow().value()).isEqualByComparingTo("123456.78");
        assertThat(parser.parse("123,456.78").orElseThrow().value()).isEqualByComparingTo("123456.78");
        assertThat(parser.parse("1,00,00,000").orElseThrow().value()).isEqualByComparingTo("10000000");
    }

    @Test
    void understandsEuropeanDecimalComma() {
        assertThat(parser.parse("1.234,56").orElseThrow().value()).isEqualByComparingTo("1234.56");
        assertThat(parser.parse("12,5").orElseThrow().value()).isEqualByComparingTo("12.5");
    }

    @Test
    void stripsCurrencyPrefixesAndFootnoteMarkers() {
        assertThat(parser.parse("₹2,500").orElseThrow().value()).isEqualByComparingTo("2500");
        assertThat(parser.parse("Rs.1,000").orElseThrow().value()).isEqualByComparingTo("1000");
        assertThat(parser.parse("(₹ 75)").orElseThrow().value()).isEqualByComparingTo("-75");
        assertThat(parser.parse("123*").orElseThrow().value()).isEqualByComparingTo("123");
    }

    @Test
    void keepsAttachedUnitSuffix() {
        ParsedAmount amount = parser.parse("12.5Cr").orElseThrow();

        assertThat(amount.value()).isEqualByComparingTo("12.5");
        assertThat(amount.explicitUnit()).isEqualTo(ReportingScale.CRORES);
        assertThat(amount.scaled(ReportingScale.LAKHS)).isEqualByComparingTo("125000000");
    }

    @Test
    void dashesAndNilArePlaceholders() {
        assertThat(parser.parse("-").orElseThrow().isPlaceholder()).isTrue();
        assertThat(parser.parse("—").orElseThrow().isPlaceholder()).isTrue();
        assertThat(parser.parse("Nil").orElseThrow().isPlaceholder()).isTrue();
        assertThat(parser.parse("Nil").orElseThrow().scaled(ReportingScale.CRORES)).isNull();
    }

    @Test
    void rejectsWordsAndMalformedNumbers() {
        assertThat(parser.parse("Revenue")).isEmpty();
        assertThat(parser.parse("1,2345")).isEmpty();
        assertThat(parser.parse("")).isEmpty();
        assertThat(parser.parse(null)).isEmpty();
    }

    @Test
    void scalesByTableScaleWhenNoUnitIsAttached() {
        ParsedAmount amount = parser.parse("3.5").orElseThrow();

        assertThat(amount.scaled(ReportingScale.MILLIONS)).isEqualByComparingTo(new BigDecimal("3500000"));
        assertThat(amount.scaled(ReportingScale.UNITS)).isEqualByComparingTo("3.5");
    }

    @Test
    void recognisesCurrencyWords() {
        assertThat(parser.isCurrencyWord("₹")).isTrue();
        assertThat(parser.isCurrencyWord("Rs.")).isTrue();
        assertThat(parser.isCurrencyWord("Revenue")).isFalse();
    }
}
