package com.example.prospectus.application.service.toc;

import com.example.prospectus.config.InsightProperties;
import com.example.prospectus.domain.model.TocEntry;
import com.example.prospectus.support.ListPageSource;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class PageOffsetResolverTest {

    private static final TocEntry MDA = new TocEntry("Management's Discussion and Analysis", 45, 1);

    private final InsightProperties properties = new InsightProperties();
    private final PageOffsetResolver resolver = new PageOffsetResolver(properties);

    @Test
    void findsPrintedPageCarryingTheHeading() {
        ListPageSource pages = ListPageSource.blank(100, "Body text")
                .withPage(47, "Management’s Discussion and Analysis\nOverview of our results\n45");

        assertThat(resolver.resolveOffset(pages, MDA)).isEqualTo(2);
    }

    @Test
    void headingMatchBeatsNearerNumberOnlyMatch() {
        ListPageSource pages = ListPageSource.blank(100, "Body text")
                .withPage(46, "Some other chapter\nPage 45")
                .withPage(48, "45\nMANAGEMENT'S DISCUSSION AND ANALYSIS");

        assertThat(resolver.resolveOffset(pages, MDA)).isEqualTo(3);
    }

    @Test
    void fallsBackToNumberOnlyMatch() {
        ListPageSource pages = ListPageSource.blank(100, "Body text")
                .withPage(44, "Industry overview continues\n45");

        assertThat(resolver.resolveOffset(pages, MDA)).isEqualTo(-1);
    }

    @Test
    void noPrintedNumberMeansNoOffset() {
        assertThat(resolver.resolveOffset(ListPageSource.blank(100, "Body text"), MDA)).isZero();
    }

    @Test
    void detectionCanBeDisabled() {
        properties.getToc().setDetectPageOffset(false);
        ListPageSource pages = ListPageSource.blank(100, "Body text")
                .withPage(47, "Management's Discussion and Analysis\n45");

        assertThat(resolver.resolveOffset(pages, MDA)).isZero();
    }
}
