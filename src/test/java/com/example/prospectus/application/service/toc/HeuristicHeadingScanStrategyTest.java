package com.example.prospectus.application.service.toc;

import com.example.prospectus.domain.model.TableOfContents;
import com.example.prospectus.domain.model.TocEntry;
import com.example.prospectus.support.ListPageSource;

import org.junit.jupiter.api.Test;

import static com.example.prospectus.support.LayoutPages.body;
import static com.example.prospectus.support.LayoutPages.heading;
import static com.example.prospectus.support.LayoutPages.line;
import static com.example.prospectus.support.LayoutPages.page;
import static org.assertj.core.api.Assertions.assertThat;

class HeuristicHeadingScanStrategyTest {

    private final HeuristicHeadingScanStrategy strategy = new HeuristicHeadingScanStrategy();

    @Test
    void ranksHeadingsByFontSizeAndKeepsRunningHeaderOnce() {
        ListPageSource pages = ListPageSource.ofPages(
                page(1, line(20f, 10f, true, "ABC Industries Limited"), heading(50f, "Risk Factors"), body(80f), body(95f)),
                page(2, line(20f, 10f, true, "ABC Industries Limited"), heading(50f, "Management Discussion and Analysis"),
                        body(80f), body(95f)),
                page(3, line(50f, 12f, true, "Results of Operations"), body(80f), body(95f)),
                page(4, heading(50f, "Financial Statements"), body(80f), body(95f)));

        TableOfContents toc = strategy.locate(pages, TocCapability.none());

        assertThat(toc.entries()).containsExactly(
                new TocEntry("ABC Industries Limited", 1, 3),
                new TocEntry("Risk Factors", 1, 1),
                new TocEntry("Management Discussion and Analysis", 2, 1),
                new TocEntry("Results of Operations", 3, 2),
                new TocEntry("Financial Statements", 4, 1));
    }

    @Test
    void sentencesAndLongLinesAreNotHeadings() {
        ListPageSource pages = ListPageSource.ofPages(page(1,
                line(40f, 16f, false, "This large line ends like a sentence."),
                line(60f, 16f, false, "One two three four five six seven eight nine ten eleven twelve thirteen fourteen fifteen"),
                line(80f, 16f, false, "12"),
                body(100f), body(115f), body(130f), body(145f), body(160f)));

        assertThat(strategy.locate(pages, TocCapability.none()).entries()).isEmpty();
    }

    @Test
    void bodySizeIsTheMostCommonSize() {
        assertThat(HeuristicHeadingScanStrategy.bodyFontSize(
                page(1, heading(50f, "Overview"), body(80f), body(95f)))).isEqualTo(10f);
    }
}
