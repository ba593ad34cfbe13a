package com.example.prospectus.application.service;

import com.example.prospectus.application.exception.AnalysisCancelledException;
import com.example.prospectus.domain.model.Section;
import com.example.prospectus.support.ListPageSource;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

class SectionExtractorTest {

    private final SectionExtractor extractor = new SectionExtractor();

    @Test
    void joinsPagesInOrderAndSkipsEmptyOnes() {
        ListPageSource pages = ListPageSource.ofTexts("cover", "first mda page ", null, "second mda page", "notes");

        Section section = extractor.extract(pages, new Section("MDA", 2, 4, null));

        assertThat(section.text()).isEqualTo("first mda page\nsecond mda page");
        assertThat(section.startPage()).isEqualTo(2);
        assertThat(section.endPage()).isEqualTo(4);
    }

    @Test
    void pagesBeyondTheDocumentAreIgnored() {
        ListPageSource pages = ListPageSource.ofTexts("cover", "last page");

        Section section = extractor.extract(pages, new Section("MDA", 2, 61, null));

        assertThat(section.text()).isEqualTo("last page");
        assertThat(section.endPage()).isEqualTo(61);
    }

    @Test
    void interruptedThreadStopsAtPageBoundary() {
        ListPageSource pages = ListPageSource.ofTexts("cover", "body");
        Thread.currentThread().interrupt();
        try {
            assertThrows(AnalysisCancelledException.class,
                    () -> extractor.extract(pages, new Section("MDA", 1, 2, null)));
        } finally {
            Thread.interrupted();
        }
    }
}
