package com.example.prospectus.infrastructure.pdf;

import com.example.prospectus.domain.model.Page;
import com.example.prospectus.domain.model.PageSource;
import com.example.prospectus.domain.model.TextLine;
import com.example.prospectus.infrastructure.exception.UnreadablePdfException;
import com.example.prospectus.support.PdfFixtures;

import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;
import static org.junit.jupiter.api.Assertions.assertThrows;

/**
 * Extraction tests against PDFs rendered in memory.
 */
class PdfBoxTextLayerExtractorTest {

    private final PdfBoxTextLayerExtractor extractor = new PdfBoxTextLayerExtractor(new PdfBoxMetadataReader());

    @Test
    void extractsTextPageByPage() {
        byte[] pdf = PdfFixtures.document()
                .page("First page text")
                .page("Second page text")
                .toBytes();

        try (PageSource pages = extractor.open("sample.pdf", pdf)) {
            assertThat(pages.pageCount()).isEqualTo(2);
            assertThat(pages.page(1).text()).contains("First page text");
            assertThat(pages.page(2).text()).contains("Second page text");
            assertThat(pages.page(2).number()).isEqualTo(2);
        }
    }

    @Test
    void recordsWordPositionsAndFontAttributes() {
        byte[] pdf = PdfFixtures.document()
                .page("# Management Discussion and Analysis", "Revenue increased during the year")
                .toBytes();

        try (PageSource pages = extractor.open("layout.pdf", pdf)) {
            List<TextLine> lines = pages.page(1).lines();

            assertThat(lines).hasSize(2);
            TextLine heading = lines.get(0);
            assertThat(heading.text()).isEqualTo("Management Discussion and Analysis");
            assertThat(heading.bold()).isTrue();
            assertThat(heading.fontSize()).isCloseTo(16f, within(0.5f));
            assertThat(heading.positioned()).isTrue();
            TextLine body = lines.get(1);
            assertThat(body.bold()).isFalse();
            assertThat(body.words()).hasSize(5);
            assertThat(body.words().get(1).x()).isGreaterThan(body.words().get(0).endX());
        }
    }

    @Test
    void tableCellsBecomeSeparateWords() {
        byte[] pdf = PdfFixtures.document()
                .tablePage(List.of("(Rs. in lakhs)"), List.of(
                        List.of("Particulars", "FY2023", "FY2022"),
                        List.of("Revenue from operations", "1,000.00", "800.00")))
                .toBytes();

        try (PageSource pages = extractor.open("table.pdf", pdf)) {
            TextLine row = pages.page(1).lines().get(2);

            assertThat(row.text()).isEqualTo("Revenue from operations 1,000.00 800.00");
            assertThat(row.words().get(3).x()).isCloseTo(300f, within(1f));
        }
    }

    @Test
    void pageWithoutTextIsEmpty() {
        byte[] pdf = PdfFixtures.document().page("Cover").blankPage().toBytes();

        try (PageSource pages = extractor.open("scan.pdf", pdf)) {
            Page blank = pages.page(2);

            assertThat(blank.hasText()).isFalse();
            assertThat(blank.lines()).isEmpty();
        }
    }

    @Test
    void exposesDocumentTitle() {
        byte[] pdf = PdfFixtures.document().title("ABC Industries Limited RHP").page("Cover").toBytes();

        try (PageSource pages = extractor.open("titled.pdf", pdf)) {
            assertThat(pages.info().title()).isEqualTo("ABC Industries Limited RHP");
        }
    }

    @Test
    void rejectsPagesOutsideTheDocument() {
        try (PageSource pages = extractor.open("sample.pdf", PdfFixtures.singlePage("Only page"))) {
            assertThrows(IllegalArgumentException.class, () -> pages.page(0));
            assertThrows(IllegalArgumentException.class, () -> pages.page(2));
        }
    }

    @Test
    void closedSourceRefusesFurtherReads() {
        PageSource pages = extractor.open("sample.pdf", PdfFixtures.singlePage("Only page"));
        pages.close();

        assertThrows(IllegalStateException.class, () -> pages.page(1));
    }

    @Test
    void unreadableBytesAreReported() {
        assertThrows(UnreadablePdfException.class,
                () -> extractor.open("broken.pdf", "this is not a pdf document".getBytes(StandardCharsets.US_ASCII)));
        assertThrows(UnreadablePdfException.class, () -> extractor.open("empty.pdf", new byte[0]));
    }
}
