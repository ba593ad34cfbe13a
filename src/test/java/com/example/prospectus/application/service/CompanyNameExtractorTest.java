package com.example.prospectus.application.service;

import com.example.prospectus.config.InsightProperties;
import com.example.prospectus.domain.model.DocumentInfo;
import com.example.prospectus.support.ListPageSource;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class CompanyNameExtractorTest {

    private final CompanyNameExtractor extractor = new CompanyNameExtractor(new InsightProperties());

    @Test
    void mostFrequentLimitedPhraseWins() {
        ListPageSource pages = ListPageSource.ofTexts(
                "ABC Industries Limited\nRed Herring Prospectus",
                "The Equity Shares are proposed to be listed on BSE Limited and NSE Limited",
                "ABC Industries Limited was incorporated in 1998");

        assertThat(extractor.extract(pages, "rhp.pdf")).isEqualTo("ABC Industries Limited");
    }

    @Test
    void exchangesAreNeverTheIssuer() {
        ListPageSource pages = ListPageSource.ofTexts(
                "Listed on BSE Limited",
                "BSE Limited and Luxembourg Stock Exchange Limited",
                "Issued by XYZ Power Limited");

        assertThat(extractor.extract(pages, "rhp.pdf")).isEqualTo("XYZ Power Limited");
    }

    @Test
    void leadingConnectorWordsAreDropped() {
        ListPageSource pages = ListPageSource.ofTexts("Our Company The Dairy Foods Limited");

        assertThat(extractor.extract(pages, "rhp.pdf")).isEqualTo("Dairy Foods Limited");
    }

    @Test
    void namesBeyondTheLeadingPagesAreIgnored() {
        InsightProperties properties = new InsightProperties();
        properties.getCompany().setScanPages(1);
        CompanyNameExtractor shallow = new CompanyNameExtractor(properties);
        ListPageSource pages = ListPageSource.ofTexts("cover page", "ABC Industries Limited");

        assertThat(shallow.extract(pages, "acme_rhp.pdf")).isEqualTo("ACME");
    }

    @Test
    void fallsBackToDocumentTitle() {
        ListPageSource pages = ListPageSource.ofTexts(
                new DocumentInfo("  Draft Red Herring Prospectus "),
                "no issuer named here");

        assertThat(extractor.extract(pages, "rhp.pdf")).isEqualTo("Draft Red Herring Prospectus");
    }

    @Test
    void fileNameSkipsGeneratedIdentifiers() {
        assertThat(CompanyNameExtractor.fromFileName("3f2a9c1e0b7d4a6f8e5c2b1a0d9e8f7c_acme-rhp.pdf"))
                .isEqualTo("ACME");
        assertThat(CompanyNameExtractor.fromFileName("uploads/tata motors.pdf")).isEqualTo("TATA");
        assertThat(CompanyNameExtractor.fromFileName("3f2a9c1e0b7d4a6f8e5c2b1a0d9e8f7c.pdf"))
                .isEqualTo(CompanyNameExtractor.UNKNOWN);
        assertThat(CompanyNameExtractor.fromFileName(null)).isEqualTo(CompanyNameExtractor.UNKNOWN);
    }
}
