package com.example.prospectus.application.service.financial;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.OptionalInt;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Orders period labels chronologically.
 * <p>
 * Every label is mapped onto the month in which its period ends, assuming an April to March fiscal year:
 * "FY2023" ends in March 2023, "Q1 FY2024" in June 2023, "Mar-2023" in March 2023 and a bare "2023" in
 * December 2023. Positional labels sort by their index with "P1", the most recent, last. When any label cannot be
 * interpreted the labels are assumed to be printed most recent first.
 */
public final class PeriodOrdering {

    private static final Pattern FISCAL = Pattern.compile("^FY\\s*(\\d{4})$", Pattern.CASE_INSENSITIVE);
    private static final Pattern QUARTER = Pattern.compile("^Q([1-4])\\s*FY\\s*(\\d{4})$", Pattern.CASE_INSENSITIVE);
    private static final Pattern MONTH_YEAR = Pattern.compile("^([A-Za-z]{3})-(\\d{4})$");
    private static final Pattern YEAR = Pattern.compile("^(\\d{4})$");
    private static final Pattern POSITIONAL = Pattern.compile("^P(\\d+)$");
    private static final List<String> MONTHS = List.of(
            "jan", "feb", "mar", "apr", "may", "jun", "jul", "aug", "sep", "oct", "nov", "dec");

    private PeriodOrdering() {
    }

    /**
     * @param labels period labels in document order
     * @return the labels sorted oldest first
     */
    public static List<String> ascending(List<String> labels) {
        List<String> sorted = new ArrayList<>(labels);
        boolean allKnown = sorted.stream().allMatch(label -> sortKey(label).isPresent());
        if (!allKnown) {
            Collections.reverse(sorted);
            return sorted;
        }
        sorted.sort(Comparator.comparingInt(label -> sortKey(label).getAsInt()));
        return sorted;
    }

    /**
     * @param labels period labels in document order
     * @return the most recent label, or {@code null} for an empty list
     */
    public static String latest(List<String> labels) {
        List<String> sorted = ascending(labels);
        return sorted.isEmpty() ? null : sorted.get(sorted.size() - 1);
    }

    /**
     * @return months since year zero at which the period ends
     */
    static OptionalInt sortKey(String label) {
        if (label == null) {
            return OptionalInt.empty();
        }
        String value = label.strip();
        Matcher matcher = FISCAL.matcher(value);
        if (matcher.matches()) {
            return OptionalInt.of(Integer.parseInt(matcher.group(1)) * 12 + 3);
        }
        matcher = QUARTER.matcher(value);
        if (matcher.matches()) {
            int quarter = Integer.parseInt(matcher.group(1));
            int fiscalYear = Integer.parseInt(matcher.group(2));
            return OptionalInt.of((fiscalYear - 1) * 12 + 3 + quarter * 3);
        }
        matcher = MONTH_YEAR.matcher(value);
        if (matcher.matches()) {
            int month = MONTHS.indexOf(matcher.group(1).toLowerCase(Locale.ROOT)) + 1;
            if (month == 0) {
                return OptionalInt.empty();
            }
            return OptionalInt.of(Integer.parseInt(matcher.group(2)) * 12 + month);
        }
        matcher = YEAR.matcher(value);
        if (matcher.matches()) {
            return OptionalInt.of(Integer.parseInt(matcher.group(1)) * 12 + 12);
        }
        matcher = POSITIONAL.matcher(value);
        if (matcher.matches()) {
            return OptionalInt.of(-Integer.parseInt(matcher.group(1)));
        }
        return OptionalInt.empty();
    }
}
