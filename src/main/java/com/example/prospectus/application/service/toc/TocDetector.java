package com.example.prospectus.application.service.toc;

import com.example.prospectus.application.service.AnalysisCancellation;
import com.example.prospectus.config.InsightProperties;
import com.example.prospectus.domain.model.Page;
import com.example.prospectus.domain.model.PageSource;
import com.example.prospectus.domain.model.TextLine;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Looks for a printed table of contents in the leading pages of a document.
 * A page qualifies when it holds at least {@code insight.toc.min-entries} entry lines, or a "Contents" heading
 * with at least two entry lines. Pages directly following a qualifying page that still carry entry lines are
 * treated as its continuation.
 */
@Component
public class TocDetector {

    private static final Logger log = LoggerFactory.getLogger(TocDetector.class);
    private static final int MIN_ENTRIES_WITH_HEADING = 2;

    private final InsightProperties properties;

    public TocDetector(InsightProperties properties) {
        this.properties = properties;
    }

    public TocCapability detect(PageSource pages) {
        int window = Math.min(properties.getToc().getScanWindow(), pages.pageCount());
        int minEntries = properties.getToc().getMinEntries();
        List<Integer> tocPages = new ArrayList<>();
        for (int number = 1; number <= window; number++) {
            AnalysisCancellation.checkpoint();
            Page page = pages.page(number);
            PageScore score = score(page, pages.pageCount());
            if (tocPages.isEmpty()) {
                if (score.entries() >= minEntries
                        || (score.hasContentsHeading() && score.entries() >= MIN_ENTRIES_WITH_HEADING)) {
                    tocPages.add(number);
                }
            } else if (score.entries() >= MIN_ENTRIES_WITH_HEADING) {
                tocPages.add(number);
            } else {
                break;
            }
        }
        if (tocPages.isEmpty()) {
            log.info("No printed table of contents in the first {} pages", window);
            return TocCapability.none();
        }
        log.info("Printed table of contents found on pages {}", tocPages);
        return new TocCapability(tocPages);
    }

    private PageScore score(Page page, int pageCount) {
        int entries = 0;
        boolean heading = false;
        for (TextLine line : page.lines()) {
            String text = line.text();
            if (TocLine.isContentsHeading(text)) {
                heading = true;
                continue;
            }
            if (TocLine.parse(text).filter(entry -> entry.page() <= pageCount).isPresent()) {
                entries++;
            }
        }
        return new PageScore(entries, heading);
    }

    private record PageScore(int entries, boolean hasContentsHeading) {
    }
}
