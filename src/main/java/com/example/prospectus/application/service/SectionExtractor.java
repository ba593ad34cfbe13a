package com.example.prospectus.application.service;

import com.example.prospectus.domain.model.PageSource;
import com.example.prospectus.domain.model.Section;

import org.springframework.stereotype.Service;

import java.util.StringJoiner;

/**
 * Materializes the text of a resolved page range.
 */
@Service
public class SectionExtractor {

    /**
     * Concatenates the text of {@code [startPage, endPage]} in page order, one newline between pages.
     * Pages beyond the end of the document are ignored.
     *
     * @param pages   document pages
     * @param section resolved range
     * @return the section carrying its text
     */
    public Section extract(PageSource pages, Section section) {
        int last = Math.min(section.endPage(), pages.pageCount());
        StringJoiner text = new StringJoiner("\n");
        for (int number = section.startPage(); number <= last; number++) {
            AnalysisCancellation.checkpoint();
            String pageText = pages.page(number).text();
            if (!pageText.isBlank()) {
                text.add(pageText.strip());
            }
        }
        return section.withText(text.toString().strip());
    }
}
