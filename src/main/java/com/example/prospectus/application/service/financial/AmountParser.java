package com.example.prospectus.application.service.financial;

import com.example.prospectus.domain.model.ReportingScale;

import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses the numeric cells of financial tables.
 * <p>
 * Understands parenthesised and leading-minus negatives, currency prefixes, attached unit suffixes, Indian
 * ({@code 1,23,456.78}) and western ({@code 123,456.78}) grouping, and European style {@code 1.234,56}.
 * Dashes and "nil" are placeholders that occupy a column without carrying a value.
 */
@Component
public class AmountParser {

    private static final Set<String> PLACEHOLDERS = Set.of("-", "–", "—", "--", "nil", "n.a.", "na", "n/a");
    private static final List<String> CURRENCY_PREFIXES = List.of("us$", "rs.", "rs", "inr", "₹", "$");
    private static final Set<String> CURRENCY_WORDS = Set.of("₹", "rs.", "rs", "inr", "$", "us$");
    private static final Pattern UNIT_SUFFIX = Pattern.compile(
            "^(?<number>[0-9][0-9.,]*)\\s*(?<unit>crores?|cr|lakhs?|lacs?|millions?|mn|billions?|bn|k)\\.?$",
            Pattern.CASE_INSENSITIVE);
    private static final Pattern DIGITS = Pattern.compile("^[0-9][0-9.,]*[0-9]$|^[0-9]$");
    private static final Pattern COMMA_GROUPING = Pattern.compile("^\\d{1,3}(,\\d{3})+$|^\\d{1,2}(,\\d{2})*,\\d{3}$");
    private static final Pattern DOT_GROUPING = Pattern.compile("^\\d{1,3}(\\.\\d{3})+$");
    private static final Pattern DECIMAL_COMMA = Pattern.compile("^\\d+,\\d{1,2}$");
    private static final String TRAILING_MARKERS = "*#^†‡";

    /**
     * Parses a single cell.
     *
     * @param token raw cell text
     * @return parsed amount, a placeholder for dashes, or empty when the token is not numeric
     */
    public Optional<ParsedAmount> parse(String token) {
        if (token == null) {
            return Optional.empty();
        }
        String value = stripTrailingMarkers(token.strip());
        if (value.isEmpty()) {
            return Optional.empty();
        }
        if (PLACEHOLDERS.contains(value.toLowerCase(Locale.ROOT))) {
            return Optional.of(ParsedAmount.placeholder());
        }

        boolean negative = false;
        if (value.startsWith("(") && value.endsWith(")") && value.length() > 2) {
            negative = true;
            value = value.substring(1, value.length() - 1).strip();
        }
        value = stripCurrency(value);
        if (!value.isEmpty() && isMinus(value.charAt(0))) {
            negative = !negative;
            value = stripCurrency(value.substring(1).strip());
        }

        ReportingScale unit = null;
        Matcher unitMatcher = UNIT_SUFFIX.matcher(value);
        if (unitMatcher.matches()) {
            unit = ReportingScale.fromUnitWord(unitMatcher.group("unit")).orElse(null);
            value = unitMatcher.group("number");
        }

        boolean negated = negative;
        ReportingScale suffix = unit;
        return toPlainNumber(value)
                .map(BigDecimal::new)
                .map(number -> negated ? number.negate() : number)
                .map(number -> new ParsedAmount(number, suffix));
    }

    /**
     * @return {@code true} for a standalone currency marker such as "₹" or "Rs."
     */
    public boolean isCurrencyWord(String token) {
        return token != null && CURRENCY_WORDS.contains(token.strip().toLowerCase(Locale.ROOT));
    }

    /**
     * Normalizes the digits of a cell into a plain {@link BigDecimal} literal.
     */
    Optional<String> toPlainNumber(String value) {
        if (!DIGITS.matcher(value).matches()) {
            return Optional.empty();
        }
        int lastComma = value.lastIndexOf(',');
        int lastDot = value.lastIndexOf('.');
        if (lastComma >= 0 && lastDot >= 0) {
            if (lastDot > lastComma) {
                String integral = value.substring(0, lastDot);
                return COMMA_GROUPING.matcher(integral).matches() && value.indexOf('.') == lastDot
                        ? Optional.of(integral.replace(",", "") + value.substring(lastDot))
                        : Optional.empty();
            }
            String integral = value.substring(0, lastComma);
            return DOT_GROUPING.matcher(integral).matches() && value.indexOf(',') == lastComma
                    ? Optional.of(integral.replace(".", "") + "." + value.substring(lastComma + 1))
                    : Optional.empty();
        }
        if (lastComma >= 0) {
            if (COMMA_GROUPING.matcher(value).matches()) {
                return Optional.of(value.replace(",", ""));
            }
            return DECIMAL_COMMA.matcher(value).matches()
                    ? Optional.of(value.replace(',', '.'))
                    : Optional.empty();
        }
        if (lastDot >= 0 && value.indexOf('.') != lastDot) {
            return DOT_GROUPING.matcher(value).matches()
                    ? Optional.of(value.replace(".", ""))
                    : Optional.empty();
        }
        return Optional.of(value);
    }

    private static String stripCurrency(String value) {
        String lower = value.toLowerCase(Locale.ROOT);
        for (String prefix : CURRENCY_PREFIXES) {
            if (lower.startsWith(prefix)) {
                return value.substring(prefix.length()).strip();
            }
        }
        return value;
    }

    private static String stripTrailingMarkers(String value) {
        int end = value.length();
        while (end > 0 && TRAILING_MARKERS.indexOf(value.charAt(end - 1)) >= 0) {
            end--;
        }
        return value.substring(0, end);
    }

    private static boolean isMinus(char c) {
        return c == '-' || c == '–' || c == '−';
    }
}
