package com.example.prospectus.infrastructure.pdf;

import com.example.prospectus.domain.model.DocumentInfo;
import com.example.prospectus.domain.model.PageSource;
import com.example.prospectus.infrastructure.exception.UnreadablePdfException;

import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;

/**
 * Opens PDF bytes with PDFBox and exposes their text layer page by page.
 * The returned {@link PageSource} owns the PDFBox document and must be closed by the caller.
 */
@Component
public class PdfBoxTextLayerExtractor {

    private static final Logger log = LoggerFactory.getLogger(PdfBoxTextLayerExtractor.class);

    private final PdfBoxMetadataReader metadataReader;

    /**
     * Creates the extractor with the infrastructure metadata reader dependency.
     *
     * @param metadataReader helper that maps PDFBox metadata into {@link DocumentInfo}
     */
    public PdfBoxTextLayerExtractor(PdfBoxMetadataReader metadataReader) {
        this.metadataReader = metadataReader;
    }

    /**
     * Opens a document for page-wise extraction.
     *
     * @param fileName logical name used in log messages
     * @param bytes    raw PDF bytes
     * @return lazily evaluated page source
     * @throws UnreadablePdfException when PDFBox cannot parse the container
     */
    public PageSource open(String fileName, byte[] bytes) {
        if (bytes == null || bytes.length == 0) {
            throw new UnreadablePdfException("The PDF " + fileName + " is empty.", null);
        }
        PDDocument document;
        try {
            document = Loader.loadPDF(bytes);
        } catch (IOException ex) {
            throw new UnreadablePdfException("Unable to open the PDF " + fileName + ".", ex);
        }
        try {
            DocumentInfo info = metadataReader.readInfo(document);
            log.info("Opened {} ({} pages)", fileName, document.getNumberOfPages());
            return new PdfPageSource(document, fileName, info);
        } catch (RuntimeException ex) {
            closeQuietly(document, fileName);
            throw ex;
        }
    }

    private void closeQuietly(PDDocument document, String fileName) {
        try {
            document.close();
        } catch (IOException closeFailure) {
            log.warn("Failed to close PDF document {}", fileName, closeFailure);
        }
    }
}
