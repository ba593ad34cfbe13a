package com.example.prospectus.application.service;

import com.example.prospectus.domain.exception.DocumentNotFoundException;
import com.example.prospectus.domain.exception.PdfFileRequiredException;
import com.example.prospectus.domain.exception.UnsupportedPdfFormatException;
import com.example.prospectus.domain.model.PageSource;
import com.example.prospectus.domain.model.StoredDocument;
import com.example.prospectus.infrastructure.exception.DocumentStorageException;
import com.example.prospectus.infrastructure.pdf.PdfBoxTextLayerExtractor;
import com.example.prospectus.infrastructure.storage.InMemoryDocumentStore;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Locale;

/**
 * Accepts uploaded prospectuses and hands out their pages.
 */
@Service
public class DocumentService {

    private static final Logger log = LoggerFactory.getLogger(DocumentService.class);
    private static final byte[] PDF_MAGIC = "%PDF".getBytes(StandardCharsets.US_ASCII);
    private static final int MAGIC_SEARCH_WINDOW = 1024;

    private final InMemoryDocumentStore store;
    private final PdfBoxTextLayerExtractor extractor;
    private final AnalysisResultCache cache;

    public DocumentService(InMemoryDocumentStore store, PdfBoxTextLayerExtractor extractor, AnalysisResultCache cache) {
        this.store = store;
        this.extractor = extractor;
        this.cache = cache;
    }

    /**
     * Stores an uploaded file.
     *
     * @param file multipart upload
     * @return stored document
     * @throws PdfFileRequiredException      when the upload is missing or empty
     * @throws UnsupportedPdfFormatException when the upload does not look like a PDF
     * @throws DocumentStorageException      when the upload cannot be read
     */
    public StoredDocument submitDocument(MultipartFile file) {
        if (file == null || file.isEmpty()) {
            throw new PdfFileRequiredException();
        }
        try {
            return submitDocument(file.getOriginalFilename(), file.getContentType(), file.getBytes());
        } catch (IOException e) {
            throw new DocumentStorageException("Unable to read the uploaded file.", e);
        }
    }

    public StoredDocument submitDocument(String fileName, byte[] content) {
        return submitDocument(fileName, null, content);
    }

    private StoredDocument submitDocument(String fileName, String contentType, byte[] content) {
        if (content == null || content.length == 0) {
            throw new PdfFileRequiredException();
        }
        if (!looksLikePdf(fileName, contentType, content)) {
            throw new UnsupportedPdfFormatException(fileName);
        }
        return store.save(resolveFileName(fileName), content);
    }

    public StoredDocument getDocument(String fileId) {
        return store.find(fileId).orElseThrow(() -> new DocumentNotFoundException(fileId));
    }

    /**
     * Opens the stored document for page-wise reading. The caller closes the returned source.
     *
     * @param fileId document identifier
     * @return lazily evaluated pages
     * @throws DocumentNotFoundException when the identifier is unknown
     */
    public PageSource getDocumentPages(String fileId) {
        StoredDocument document = getDocument(fileId);
        return extractor.open(document.fileName(), document.content());
    }

    /**
     * Removes the document together with its cached analysis.
     *
     * @throws DocumentNotFoundException when the identifier is unknown
     */
    public void deleteDocument(String fileId) {
        cache.evict(fileId);
        if (!store.delete(fileId)) {
            throw new DocumentNotFoundException(fileId);
        }
        log.info("Deleted document {}", fileId);
    }

    /**
     * A PDF signature near the start of the content is decisive; otherwise the declared name or type is trusted
     * and PDFBox has the final word when the document is opened.
     */
    private boolean looksLikePdf(String fileName, String contentType, byte[] content) {
        if (hasPdfSignature(content)) {
            return true;
        }
        if (contentType != null && contentType.equalsIgnoreCase("application/pdf")) {
            return true;
        }
        return fileName != null && fileName.toLowerCase(Locale.ROOT).endsWith(".pdf");
    }

    private static boolean hasPdfSignature(byte[] content) {
        int limit = Math.min(content.length, MAGIC_SEARCH_WINDOW) - PDF_MAGIC.length;
        for (int i = 0; i <= limit; i++) {
            if (Arrays.equals(content, i, i + PDF_MAGIC.length, PDF_MAGIC, 0, PDF_MAGIC.length)) {
                return true;
            }
        }
        return false;
    }

    private static String resolveFileName(String fileName) {
        if (fileName == null || fileName.isBlank()) {
            return "uploaded.pdf";
        }
        return fileName;
    }
}
