package com.example.prospectus.application.service.financial;

import com.example.prospectus.application.service.AnalysisCancellation;
import com.example.prospectus.domain.exception.NoFinancialDataFoundException;
import com.example.prospectus.domain.model.CanonicalLabel;
import com.example.prospectus.domain.model.FinancialStatement;
import com.example.prospectus.domain.model.LineItem;
import com.example.prospectus.domain.model.Page;
import com.example.prospectus.domain.model.PageSource;
import com.example.prospectus.domain.model.ReportingScale;
import com.example.prospectus.domain.model.StatementType;
import com.example.prospectus.domain.model.TextLine;
import com.example.prospectus.domain.model.WordToken;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Streams every page of a document and collects rows of the form {@code <label> <amount> <amount> ...} whose
 * label belongs to the canonical vocabulary.
 * <p>
 * Amounts are bound to the periods of the most recent header row: by column position when both rows carry
 * layout, otherwise right to left so that a leading note number drops out. A row with more amounts than header
 * periods keeps its first amount for the most recent period and drops the duplicates that follow it. Rows seen
 * before any header bind left to right to positional periods "P1", "P2", ... with "P1" the most recent. The
 * first occurrence of a label in the document wins. Unsuffixed amounts are multiplied by the scale most recently
 * announced ("₹ in crore", "Rs. in lakhs"); per-share figures are never scaled.
 */
@Service
public class FinancialTableParser {

    private static final Logger log = LoggerFactory.getLogger(FinancialTableParser.class);
    private static final Pattern SCALE_PHRASE = Pattern.compile(
            "\\bin\\s+(?:(?:₹|rs\\.?|inr|rupees|usd|us\\$|\\$)\\s*)?"
                    + "(?<unit>crores?|lakhs?|lacs?|millions?|mn|billions?|bn|thousands?)\\b",
            Pattern.CASE_INSENSITIVE);
    private static final int MAX_SCALE_LINE_WORDS = 15;
    private static final Pattern YEAR = Pattern.compile("^(?:19|20)\\d{2}$");
    private static final Set<String> MONTHS = Set.of(
            "jan", "january", "feb", "february", "mar", "march", "apr", "april", "may", "jun", "june", "jul", "july",
            "aug", "august", "sep", "sept", "september", "oct", "october", "nov", "november", "dec", "december");
    private static final Pattern NOTE_NUMBER = Pattern.compile("^\\d{1,2}(?:\\.\\d)?$");
    private static final Set<CanonicalLabel> UNSCALED = Set.of(CanonicalLabel.EPS);

    private final AmountParser amountParser;
    private final LabelNormalizer labelNormalizer;
    private final PeriodHeaderDetector headerDetector;

    public FinancialTableParser(AmountParser amountParser,
                                LabelNormalizer labelNormalizer,
                                PeriodHeaderDetector headerDetector) {
        this.amountParser = amountParser;
        this.labelNormalizer = labelNormalizer;
        this.headerDetector = headerDetector;
    }

    /**
     * @param pages document pages
     * @return recognised statements
     * @throws NoFinancialDataFoundException when not a single canonical line item was found
     */
    public ParsedFinancials parse(PageSource pages) {
        Map<StatementType, Map<String, LineItem>> items = new EnumMap<>(StatementType.class);
        ReportingScale documentScale = null;
        ReportingScale tableScale = ReportingScale.UNITS;
        PeriodHeader header = null;
        int pagesWithText = 0;

        for (int number = 1; number <= pages.pageCount(); number++) {
            AnalysisCancellation.checkpoint();
            Page page = pages.page(number);
            if (!page.hasText()) {
                continue;
            }
            pagesWithText++;
            for (TextLine line : page.lines()) {
                Optional<ReportingScale> announced = detectScale(line);
                if (announced.isPresent()) {
                    tableScale = announced.get();
                    if (documentScale == null) {
                        documentScale = tableScale;
                        log.info("Reporting scale '{}' announced on page {}", documentScale, number);
                    }
                }
                Optional<PeriodHeader> detectedHeader = headerDetector.detect(line);
                if (detectedHeader.isPresent()) {
                    header = detectedHeader.get();
                    log.debug("Period header {} on page {}", header.periods(), number);
                    continue;
                }
                Optional<LineItem> item = parseRow(line, header, tableScale);
                if (item.isEmpty()) {
                    continue;
                }
                LineItem lineItem = item.get();
                Map<String, LineItem> statement =
                        items.computeIfAbsent(lineItem.label().statement(), type -> new LinkedHashMap<>());
                if (statement.putIfAbsent(lineItem.key(), lineItem) == null) {
                    log.debug("Page {}: {} = {}", number, lineItem.key(), lineItem.values());
                }
            }
        }

        Map<String, FinancialStatement> statements = new LinkedHashMap<>();
        for (StatementType type : StatementType.values()) {
            Map<String, LineItem> statementItems = items.get(type);
            if (statementItems != null && !statementItems.isEmpty()) {
                statements.put(type.key(), new FinancialStatement(type, statementItems));
            }
        }
        ParsedFinancials parsed = new ParsedFinancials(
                statements,
                documentScale == null ? ReportingScale.UNITS : documentScale,
                pages.pageCount(),
                pagesWithText);
        if (parsed.itemCount() == 0) {
            log.warn("No canonical line items in {} pages ({} with text)", pages.pageCount(), pagesWithText);
            throw new NoFinancialDataFoundException(pages.pageCount(), pagesWithText);
        }
        log.info("Parsed {} line items across {} statements", parsed.itemCount(), statements.size());
        return parsed;
    }

    Optional<ReportingScale> detectScale(TextLine line) {
        String text = line.text();
        Matcher matcher = SCALE_PHRASE.matcher(text);
        while (matcher.find()) {
            if (line.words().size() <= MAX_SCALE_LINE_WORDS || insideParentheses(text, matcher.start())) {
                return ReportingScale.fromUnitWord(matcher.group("unit"));
            }
        }
        return Optional.empty();
    }

    Optional<LineItem> parseRow(TextLine line, PeriodHeader header, ReportingScale tableScale) {
        Row row = splitRow(line.words());
        if (row.cells().isEmpty() || row.cells().stream().allMatch(cell -> cell.amount().isPlaceholder())) {
            return Optional.empty();
        }
        Optional<CanonicalLabel> label = labelNormalizer.canonicalize(row.label());
        if (label.isEmpty()) {
            return Optional.empty();
        }
        ReportingScale scale = UNSCALED.contains(label.get()) ? ReportingScale.UNITS : tableScale;
        Map<String, BigDecimal> values = bind(row.cells(), header, line.positioned(), scale);
        if (values.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(new LineItem(label.get(), values));
    }

    private Map<String, BigDecimal> bind(List<Cell> cells, PeriodHeader header, boolean positioned, ReportingScale scale) {
        Map<String, BigDecimal> values = new LinkedHashMap<>();
        if (header == null) {
            for (int i = 0; i < cells.size(); i++) {
                put(values, "P" + (i + 1), cells.get(i), scale);
            }
            return values;
        }

        List<String> periods = header.periods();
        if (positioned && header.positioned()) {
            PeriodColumnLayout layout = PeriodColumnLayout.fromAnchors(header.anchors());
            Cell[] byColumn = new Cell[layout.columnCount()];
            for (Cell cell : cells) {
                int column = layout.locateColumn(cell.center());
                if (column >= 0 && byColumn[column] == null) {
                    byColumn[column] = cell;
                }
            }
            for (int i = 0; i < byColumn.length; i++) {
                if (byColumn[i] != null) {
                    put(values, periods.get(i), byColumn[i], scale);
                }
            }
            if (!values.isEmpty()) {
                return values;
            }
        }

        List<Cell> aligned = cells;
        if (header.hasNoteColumn() && cells.size() > 1 && cells.size() <= periods.size()
                && NOTE_NUMBER.matcher(cells.get(0).text()).matches()) {
            aligned = cells.subList(1, cells.size());
        }
        int extras = aligned.size() - periods.size();
        if (extras > 0) {
            // the first token is the most recent period; the tokens after it repeat that period
            List<Cell> kept = new ArrayList<>(periods.size());
            kept.add(aligned.get(0));
            kept.addAll(aligned.subList(1 + extras, aligned.size()));
            aligned = kept;
        }
        int offset = periods.size() - aligned.size();
        for (int i = aligned.size() - 1; i >= 0; i--) {
            int periodIndex = offset + i;
            if (periodIndex < 0) {
                break;
            }
            put(values, periods.get(periodIndex), aligned.get(i), scale);
        }
        Map<String, BigDecimal> ordered = new LinkedHashMap<>();
        for (String period : periods) {
            if (values.containsKey(period)) {
                ordered.put(period, values.get(period));
            }
        }
        return ordered;
    }

    private static void put(Map<String, BigDecimal> values, String period, Cell cell, ReportingScale scale) {
        BigDecimal value = cell.amount().scaled(scale);
        if (value != null) {
            values.putIfAbsent(period, value);
        }
    }

    /**
     * Splits a line into its label and the trailing run of numeric cells.
     */
    Row splitRow(List<WordToken> words) {
        List<Cell> cells = new ArrayList<>();
        int end = words.size();
        while (end > 0) {
            WordToken word = words.get(end - 1);
            String text = word.text().strip();
            Optional<ParsedAmount> amount;
            int consumed = 1;
            WordToken first = word;
            if (end >= 2 && ReportingScale.fromUnitWord(text).isPresent()
                    && amountParser.parse(words.get(end - 2).text()).filter(parsed -> !parsed.isPlaceholder()).isPresent()) {
                ParsedAmount number = amountParser.parse(words.get(end - 2).text()).get();
                amount = Optional.of(new ParsedAmount(number.value(), ReportingScale.fromUnitWord(text).get()));
                first = words.get(end - 2);
                consumed = 2;
            } else {
                amount = amountParser.parse(text);
            }
            if (amount.isEmpty() || looksLikeDateYear(words, end - consumed, first.text())) {
                break;
            }
            end -= consumed;
            if (end > 0 && amountParser.isCurrencyWord(words.get(end - 1).text())) {
                end--;
            }
            cells.add(0, new Cell(first.text().strip(), amount.get(), first.x(), word.endX()));
        }
        StringBuilder label = new StringBuilder();
        for (int i = 0; i < end; i++) {
            if (label.length() > 0) {
                label.append(' ');
            }
            label.append(words.get(i).text().strip());
        }
        return new Row(label.toString(), cells);
    }

    /**
     * "March 31, 2023" at the end of a label is a date, not an amount.
     */
    private boolean looksLikeDateYear(List<WordToken> words, int index, String text) {
        if (!YEAR.matcher(text.strip()).matches() || index == 0) {
            return false;
        }
        String previous = words.get(index - 1).text().strip().toLowerCase(Locale.ROOT);
        return previous.endsWith(",") || MONTHS.contains(previous.replace(".", ""));
    }

    private static boolean insideParentheses(String text, int position) {
        int open = text.lastIndexOf('(', position);
        if (open < 0) {
            return false;
        }
        int close = text.indexOf(')', open);
        return close < 0 || close > position;
    }

    record Row(String label, List<Cell> cells) {
    }

    record Cell(String text, ParsedAmount amount, float x, float endX) {

        float center() {
            return x + ((endX - x) / 2f);
        }
    }
}
