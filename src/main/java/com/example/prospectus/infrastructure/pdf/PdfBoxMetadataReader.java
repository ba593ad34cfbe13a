package com.example.prospectus.infrastructure.pdf;

import com.example.prospectus.domain.model.DocumentInfo;

import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDDocumentCatalog;
import org.apache.pdfbox.pdmodel.PDDocumentInformation;
import org.apache.pdfbox.pdmodel.common.PDMetadata;
import org.apache.xmpbox.XMPMetadata;
import org.apache.xmpbox.schema.DublinCoreSchema;
import org.apache.xmpbox.type.BadFieldValueException;
import org.apache.xmpbox.xml.DomXmpParser;
import org.apache.xmpbox.xml.XmpParsingException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;

/**
 * Reads the document title from the info dictionary, falling back to the XMP Dublin Core title
 * when the info dictionary leaves it empty.
 */
@Component
public class PdfBoxMetadataReader {

    private static final Logger log = LoggerFactory.getLogger(PdfBoxMetadataReader.class);

    /**
     * @param document already opened PDF document
     * @return document properties, {@link DocumentInfo#EMPTY} when the document is missing
     */
    public DocumentInfo readInfo(PDDocument document) {
        if (document == null) {
            return DocumentInfo.EMPTY;
        }
        PDDocumentInformation info = document.getDocumentInformation();
        String title = blankToNull(info != null ? info.getTitle() : null);
        if (title == null) {
            title = blankToNull(readXmpTitle(document.getDocumentCatalog()));
        }
        return new DocumentInfo(title);
    }

    private String readXmpTitle(PDDocumentCatalog catalog) {
        if (catalog == null) {
            return null;
        }
        PDMetadata pdMetadata = catalog.getMetadata();
        if (pdMetadata == null) {
            return null;
        }
        try (InputStream metadataStream = pdMetadata.exportXMPMetadata()) {
            if (metadataStream == null) {
                return null;
            }
            DomXmpParser parser = new DomXmpParser();
            parser.setStrictParsing(false);
            XMPMetadata xmp = parser.parse(metadataStream);
            DublinCoreSchema dc = xmp.getDublinCoreSchema();
            return dc != null ? dc.getTitle() : null;
        } catch (IOException | XmpParsingException | BadFieldValueException ex) {
            log.warn("Failed to parse XMP metadata", ex);
            return null;
        }
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value.strip();
    }
}
