package com.example.prospectus.application.service.toc;

import com.example.prospectus.application.service.AnalysisCancellation;
import com.example.prospectus.domain.model.Page;
import com.example.prospectus.domain.model.PageSource;
import com.example.prospectus.domain.model.TableOfContents;
import com.example.prospectus.domain.model.TextLine;
import com.example.prospectus.domain.model.TocEntry;
import com.example.prospectus.domain.model.TocMode;
import com.example.prospectus.domain.model.WordToken;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Degraded mode for documents without a printed table of contents: treats short lines set noticeably larger
 * than the page's body text, or in bold, as headings. Entry pages are physical pages.
 * A heading repeated on later pages (a running header) is only kept at its first occurrence.
 */
@Component
@Order(2)
public class HeuristicHeadingScanStrategy implements TocStrategy {

    private static final Logger log = LoggerFactory.getLogger(HeuristicHeadingScanStrategy.class);
    private static final float SIZE_FACTOR = 1.15f;
    private static final int MAX_HEADING_WORDS = 14;
    private static final int MAX_HEADING_LENGTH = 120;
    private static final int MIN_HEADING_LETTERS = 3;
    private static final int MAX_LEVEL = 3;

    @Override
    public TocMode mode() {
        return TocMode.HEURISTIC;
    }

    @Override
    public boolean supports(TocCapability capability) {
        return true;
    }

    @Override
    public TableOfContents locate(PageSource pages, TocCapability capability) {
        List<Candidate> candidates = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        for (int number = 1; number <= pages.pageCount(); number++) {
            AnalysisCancellation.checkpoint();
            Page page = pages.page(number);
            float bodySize = bodyFontSize(page);
            if (bodySize <= 0f) {
                continue;
            }
            for (TextLine line : page.lines()) {
                if (!isHeading(line, bodySize)) {
                    continue;
                }
                String title = line.text();
                if (seen.add(title.toLowerCase(Locale.ROOT))) {
                    candidates.add(new Candidate(title, number, line.fontSize()));
                }
            }
        }
        List<Float> sizes = candidates.stream()
                .map(candidate -> roundSize(candidate.fontSize()))
                .distinct()
                .sorted(Comparator.reverseOrder())
                .toList();
        List<TocEntry> entries = candidates.stream()
                .map(candidate -> new TocEntry(
                        candidate.title(),
                        candidate.page(),
                        Math.min(sizes.indexOf(roundSize(candidate.fontSize())) + 1, MAX_LEVEL)))
                .toList();
        log.info("Heading scan found {} candidate headings in {} pages", entries.size(), pages.pageCount());
        return new TableOfContents(TocMode.HEURISTIC, entries);
    }

    /**
     * @return most common font size on the page weighted by word count, {@code 0} when unknown
     */
    static float bodyFontSize(Page page) {
        Map<Float, Integer> histogram = new HashMap<>();
        for (TextLine line : page.lines()) {
            for (WordToken word : line.words()) {
                if (word.fontSize() > 0f) {
                    histogram.merge(roundSize(word.fontSize()), 1, Integer::sum);
                }
            }
        }
        return histogram.entrySet().stream()
                .max(Map.Entry.<Float, Integer>comparingByValue().thenComparing(Map.Entry.comparingByKey()))
                .map(Map.Entry::getKey)
                .orElse(0f);
    }

    private boolean isHeading(TextLine line, float bodySize) {
        if (!line.positioned() || line.fontSize() <= 0f) {
            return false;
        }
        String text = line.text();
        if (text.length() > MAX_HEADING_LENGTH || line.words().size() > MAX_HEADING_WORDS) {
            return false;
        }
        if (letters(text) < MIN_HEADING_LETTERS || text.endsWith(".") || text.endsWith(",")) {
            return false;
        }
        return line.fontSize() >= bodySize * SIZE_FACTOR || line.bold();
    }

    private static int letters(String text) {
        int count = 0;
        for (int i = 0; i < text.length(); i++) {
            if (Character.isLetter(text.charAt(i))) {
                count++;
            }
        }
        return count;
    }

    private static float roundSize(float size) {
        return Math.round(size * 2f) / 2f;
    }

    private record Candidate(String title, int page, float fontSize) {
    }
}
