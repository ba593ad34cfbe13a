package com.example.prospectus.application.service.toc;

import com.example.prospectus.application.service.AnalysisCancellation;
import com.example.prospectus.config.InsightProperties;
import com.example.prospectus.domain.model.Page;
import com.example.prospectus.domain.model.PageSource;
import com.example.prospectus.domain.model.TextLine;
import com.example.prospectus.domain.model.TocEntry;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Reconciles printed page numbers with physical PDF pages.
 * <p>
 * Cover matter is usually unnumbered or roman-numbered, so printed page {@code p} sits on physical page
 * {@code p + offset}. Physical pages around the target are inspected, nearest first, for a page whose first or last
 * line is the printed number itself. A page that also carries the heading text wins; otherwise the nearest
 * number-only match is used; otherwise the offset is {@code 0}.
 */
@Component
public class PageOffsetResolver {

    private static final Logger log = LoggerFactory.getLogger(PageOffsetResolver.class);
    private static final Pattern NON_ALPHANUMERIC = Pattern.compile("[^\\p{L}\\p{N}]+");
    private static final int HEADING_WORDS = 3;

    private final InsightProperties properties;

    public PageOffsetResolver(InsightProperties properties) {
        this.properties = properties;
    }

    /**
     * @param pages document pages
     * @param entry table of contents entry carrying a printed page number
     * @return physical minus printed page number
     */
    public int resolveOffset(PageSource pages, TocEntry entry) {
        if (!properties.getToc().isDetectPageOffset()) {
            return 0;
        }
        int printed = entry.page();
        String heading = headingKey(entry.title());
        int maxOffset = properties.getToc().getMaxPageOffset();
        Integer numberOnly = null;
        for (int distance = 0; distance <= maxOffset; distance++) {
            for (int offset : distance == 0 ? new int[] {0} : new int[] {distance, -distance}) {
                int physical = printed + offset;
                if (physical < 1 || physical > pages.pageCount()) {
                    continue;
                }
                AnalysisCancellation.checkpoint();
                Page page = pages.page(physical);
                if (!carriesPageNumber(page, printed)) {
                    continue;
                }
                if (!heading.isEmpty() && normalize(page.text()).contains(heading)) {
                    log.info("Printed page {} of '{}' is physical page {}", printed, entry.title(), physical);
                    return offset;
                }
                if (numberOnly == null) {
                    numberOnly = offset;
                }
            }
        }
        if (numberOnly != null) {
            log.info("Printed page {} located on physical page {} by its page number only", printed, printed + numberOnly);
            return numberOnly;
        }
        log.debug("No printed page number {} found near physical page {}", printed, printed);
        return 0;
    }

    private boolean carriesPageNumber(Page page, int printed) {
        List<TextLine> lines = page.lines();
        if (lines.isEmpty()) {
            return false;
        }
        return isPageNumber(lines.get(0).text(), printed)
                || isPageNumber(lines.get(lines.size() - 1).text(), printed);
    }

    private boolean isPageNumber(String text, int printed) {
        String normalized = normalize(text);
        if (normalized.startsWith("page ")) {
            normalized = normalized.substring("page ".length());
        }
        return normalized.equals(String.valueOf(printed));
    }

    private String headingKey(String title) {
        return Arrays.stream(normalize(title).split(" "))
                .filter(word -> !word.isEmpty())
                .limit(HEADING_WORDS)
                .collect(Collectors.joining(" "));
    }

    private static String normalize(String text) {
        String lower = text.toLowerCase(Locale.ROOT).replace('’', '\'').replace("'", "");
        return NON_ALPHANUMERIC.matcher(lower).replaceAll(" ").strip();
    }
}
