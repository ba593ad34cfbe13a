package com.example.prospectus.application.service.financial;

import com.example.prospectus.domain.model.TextLine;
import com.example.prospectus.domain.model.WordToken;

import org.springframework.stereotype.Component;

import java.time.Month;
import java.time.format.TextStyle;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Recognises the period header row of a financial table ("FY23 FY22 FY21", "Fiscal 2023", "2022-23",
 * "As at March 31, 2023", "Q1 FY24") and normalizes every period into a sortable label.
 */
@Component
public class PeriodHeaderDetector {

    private static final String MONTH =
            "jan(?:uary)?|feb(?:ruary)?|mar(?:ch)?|apr(?:il)?|may|june?|july?|aug(?:ust)?|sep(?:t(?:ember)?)?"
                    + "|oct(?:ober)?|nov(?:ember)?|dec(?:ember)?";
    private static final Pattern PERIOD = Pattern.compile(
            "\\b(?<q>q[1-4])\\s*(?:fy|f\\.y\\.)\\s*'?(?<qy>\\d{4}|\\d{2})\\b"
                    + "|(?:\\b(?:fy|f\\.y\\.|fiscal(?:\\s+year)?)\\s*)?\\b(?<ry1>(?:19|20)\\d{2})\\s*[-–/]\\s*(?<ry2>\\d{4}|\\d{2})\\b"
                    + "|\\b(?:fy|f\\.y\\.|fiscal(?:\\s+year)?|financial\\s+year)\\s*'?(?<fy>\\d{4}|\\d{2})\\b"
                    + "|\\b(?:(?<d1>\\d{1,2})(?:st|nd|rd|th)?\\s+)?(?<mon>" + MONTH + ")\\.?\\s*"
                    + "(?:(?<d2>\\d{1,2})(?:st|nd|rd|th)?\\s*)?[,'-]?\\s*(?<my>(?:19|20)\\d{2})\\b"
                    + "|\\b(?<nd>\\d{1,2})[./-](?<nm>\\d{1,2})[./-](?<ny>(?:19|20)\\d{2})\\b"
                    + "|\\b(?<py>(?:19|20)\\d{2})\\b",
            Pattern.CASE_INSENSITIVE);
    private static final Set<String> HEADER_WORDS = Set.of(
            "particulars", "year", "years", "ended", "ending", "as", "at", "on", "of", "for", "the", "period",
            "months", "month", "quarter", "half", "three", "six", "nine", "twelve", "note", "notes", "no",
            "rs", "inr", "in", "crore", "crores", "lakh", "lakhs", "million", "millions", "audited",
            "unaudited", "restated", "consolidated", "standalone", "amount", "and", "upto", "till");
    private static final int MAX_FOREIGN_WORDS = 2;
    private static final Set<String> HEADER_KEYWORDS = Set.of("particulars", "ended", "as", "year", "period");

    private final AmountParser amountParser;
    private final LabelNormalizer labelNormalizer;

    public PeriodHeaderDetector(AmountParser amountParser, LabelNormalizer labelNormalizer) {
        this.amountParser = amountParser;
        this.labelNormalizer = labelNormalizer;
    }

    /**
     * @param line visual line of a page
     * @return the header when the line consists of period labels and header wording only
     */
    public Optional<PeriodHeader> detect(TextLine line) {
        List<WordToken> words = line.words().stream()
                .filter(word -> !word.text().isBlank())
                .toList();
        if (words.isEmpty()) {
            return Optional.empty();
        }
        StringBuilder joined = new StringBuilder();
        List<Integer> wordStarts = new ArrayList<>();
        for (WordToken word : words) {
            if (joined.length() > 0) {
                joined.append(' ');
            }
            wordStarts.add(joined.length());
            joined.append(word.text().strip());
        }
        String text = joined.toString();

        List<String> periods = new ArrayList<>();
        List<Float> anchors = new ArrayList<>();
        StringBuilder residual = new StringBuilder();
        boolean plainYear = false;
        int cursor = 0;
        Matcher matcher = PERIOD.matcher(text);
        while (matcher.find()) {
            residual.append(text, cursor, matcher.start()).append(' ');
            cursor = matcher.end();
            periods.add(label(matcher));
            plainYear |= matcher.group("py") != null;
            int first = wordIndexAt(wordStarts, matcher.start());
            int last = wordIndexAt(wordStarts, matcher.end() - 1);
            float start = words.get(first).x();
            float end = words.get(last).endX();
            anchors.add(start + ((end - start) / 2f));
        }
        residual.append(text.substring(cursor));
        if (periods.isEmpty()) {
            return Optional.empty();
        }

        List<String> residualWords = residualWords(residual.toString());
        for (String word : residualWords) {
            Optional<ParsedAmount> amount = amountParser.parse(word);
            if (amount.isPresent() && !amount.get().isPlaceholder()) {
                return Optional.empty();
            }
        }
        if (labelNormalizer.canonicalize(residual.toString()).isPresent()) {
            return Optional.empty();
        }
        long foreignWords = residualWords.stream().filter(word -> !HEADER_WORDS.contains(word)).count();
        if (foreignWords > (plainYear ? 0 : MAX_FOREIGN_WORDS)) {
            return Optional.empty();
        }
        if (periods.size() < 2 && residualWords.stream().noneMatch(HEADER_KEYWORDS::contains)) {
            return Optional.empty();
        }
        boolean noteColumn = residualWords.contains("note") || residualWords.contains("notes");
        return Optional.of(new PeriodHeader(periods, line.positioned() ? anchors : List.of(), noteColumn));
    }

    private static List<String> residualWords(String residual) {
        List<String> words = new ArrayList<>();
        for (String raw : residual.toLowerCase(Locale.ROOT).split("\\s+")) {
            String word = raw.replaceAll("^[^\\p{L}\\p{N}₹-]+|[^\\p{L}\\p{N}]+$", "");
            if (!word.isEmpty()) {
                words.add(word);
            }
        }
        return words;
    }

    private static int wordIndexAt(List<Integer> wordStarts, int offset) {
        int index = 0;
        for (int i = 0; i < wordStarts.size(); i++) {
            if (wordStarts.get(i) <= offset) {
                index = i;
            }
        }
        return index;
    }

    private static String label(Matcher matcher) {
        if (matcher.group("q") != null) {
            return matcher.group("q").toUpperCase(Locale.ROOT) + " FY" + fullYear(matcher.group("qy"));
        }
        if (matcher.group("ry1") != null) {
            int startYear = Integer.parseInt(matcher.group("ry1"));
            String endText = matcher.group("ry2");
            int endYear = endText.length() == 4
                    ? Integer.parseInt(endText)
                    : (startYear / 100) * 100 + Integer.parseInt(endText);
            if (endYear <= startYear) {
                endYear += 100;
            }
            return "FY" + endYear;
        }
        if (matcher.group("fy") != null) {
            return "FY" + fullYear(matcher.group("fy"));
        }
        if (matcher.group("mon") != null) {
            return monthLabel(monthOf(matcher.group("mon")), Integer.parseInt(matcher.group("my")));
        }
        if (matcher.group("nm") != null) {
            int month = Integer.parseInt(matcher.group("nm"));
            if (month < 1 || month > 12) {
                return matcher.group();
            }
            return monthLabel(Month.of(month), Integer.parseInt(matcher.group("ny")));
        }
        return matcher.group("py");
    }

    private static int fullYear(String digits) {
        int value = Integer.parseInt(digits);
        if (digits.length() == 4) {
            return value;
        }
        return value >= 70 ? 1900 + value : 2000 + value;
    }

    private static Month monthOf(String text) {
        String prefix = text.substring(0, 3).toLowerCase(Locale.ROOT);
        for (Month month : Month.values()) {
            if (month.getDisplayName(TextStyle.SHORT, Locale.ENGLISH).toLowerCase(Locale.ROOT).equals(prefix)) {
                return month;
            }
        }
        throw new IllegalArgumentException("Unknown month " + text);
    }

    private static String monthLabel(Month month, int year) {
        return month.getDisplayName(TextStyle.SHORT, Locale.ENGLISH) + "-" + year;
    }
}
