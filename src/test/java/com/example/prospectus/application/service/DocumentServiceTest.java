package com.example.prospectus.application.service;

import com.example.prospectus.domain.exception.DocumentNotFoundException;
import com.example.prospectus.domain.exception.PdfFileRequiredException;
import com.example.prospectus.domain.exception.UnsupportedPdfFormatException;
import com.example.prospectus.domain.model.AnalysisResult;
import com.example.prospectus.domain.model.BranchFailure;
import com.example.prospectus.domain.model.PageSource;
import com.example.prospectus.domain.model.ReportingScale;
import com.example.prospectus.domain.model.StoredDocument;
import com.example.prospectus.domain.model.TocMode;
import com.example.prospectus.infrastructure.exception.DocumentStorageException;
import com.example.prospectus.infrastructure.pdf.PdfBoxMetadataReader;
import com.example.prospectus.infrastructure.pdf.PdfBoxTextLayerExtractor;
import com.example.prospectus.infrastructure.storage.InMemoryDocumentStore;
import com.example.prospectus.support.PdfFixtures;

import org.junit.jupiter.api.Test;
import org.springframework.mock.web.MockMultipartFile;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.mock;

/**
 * Unit tests for document intake and page access.
 */
class DocumentServiceTest {

    private final AnalysisResultCache cache = new AnalysisResultCache();
    private final DocumentService documentService = new DocumentService(
            new InMemoryDocumentStore(),
            new PdfBoxTextLayerExtractor(new PdfBoxMetadataReader()),
            cache);

    /**
     * Verifies that a PDF upload is stored and its pages can be read back.
     */
    @Test
    void submitDocumentStoresPdf() {
        MockMultipartFile file = new MockMultipartFile(
                "file",
                "rhp.pdf",
                "application/pdf",
                PdfFixtures.singlePage("Hello prospectus")
        );

        StoredDocument stored = documentService.submitDocument(file);

        assertThat(stored.fileName()).isEqualTo("rhp.pdf");
        assertThat(documentService.getDocument(stored.fileId())).isEqualTo(stored);
        try (PageSource pages = documentService.getDocumentPages(stored.fileId())) {
            assertThat(pages.pageCount()).isEqualTo(1);
            assertThat(pages.page(1).text()).contains("Hello prospectus");
        }
    }

    /**
     * Ensures empty and missing uploads are rejected.
     */
    @Test
    void submitDocumentRejectsEmptyUpload() {
        MockMultipartFile empty = new MockMultipartFile("file", "rhp.pdf", "application/pdf", new byte[0]);

        assertThrows(PdfFileRequiredException.class, () -> documentService.submitDocument(empty));
        assertThrows(PdfFileRequiredException.class, () -> documentService.submitDocument((MultipartFile) null));
        assertThrows(PdfFileRequiredException.class, () -> documentService.submitDocument("rhp.pdf", new byte[0]));
    }

    /**
     * Ensures non-PDF uploads are rejected.
     */
    @Test
    void submitDocumentRejectsNonPdf() {
        MockMultipartFile file = new MockMultipartFile(
                "file",
                "note.txt",
                "text/plain",
                "plain text".getBytes(StandardCharsets.UTF_8)
        );

        assertThrows(UnsupportedPdfFormatException.class, () -> documentService.submitDocument(file));
    }

    @Test
    void pdfSignatureOutweighsMissingName() {
        StoredDocument stored = documentService.submitDocument("", PdfFixtures.singlePage("Cover"));

        assertThat(stored.fileName()).isEqualTo("uploaded.pdf");
    }

    @Test
    void unreadableUploadIsReportedAsStorageFailure() throws IOException {
        MultipartFile file = mock(MultipartFile.class);
        given(file.isEmpty()).willReturn(false);
        given(file.getOriginalFilename()).willReturn("rhp.pdf");
        given(file.getBytes()).willThrow(new IOException("stream closed"));

        assertThrows(DocumentStorageException.class, () -> documentService.submitDocument(file));
    }

    @Test
    void unknownDocumentIsNotFound() {
        assertThrows(DocumentNotFoundException.class, () -> documentService.getDocument("missing"));
        assertThrows(DocumentNotFoundException.class, () -> documentService.getDocumentPages("missing"));
        assertThrows(DocumentNotFoundException.class, () -> documentService.deleteDocument("missing"));
    }

    /**
     * Deleting a document also drops its cached analysis.
     */
    @Test
    void deleteDocumentEvictsCachedAnalysis() {
        StoredDocument stored = documentService.submitDocument("rhp.pdf", PdfFixtures.singlePage("Cover"));
        cache.getOrCompute(stored.fileId(), () -> new AnalysisResult(stored.fileId(), "rhp.pdf", "ACME", 1,
                TocMode.NONE, ReportingScale.UNITS, Map.of(), Map.of(), List.of(), List.of(),
                new BranchFailure("NO_FINANCIAL_DATA", "none"), null,
                new BranchFailure("SECTION_NOT_FOUND", "none")));

        documentService.deleteDocument(stored.fileId());

        assertThat(cache.contains(stored.fileId())).isFalse();
        assertThrows(DocumentNotFoundException.class, () -> documentService.getDocument(stored.fileId()));
    }
}
