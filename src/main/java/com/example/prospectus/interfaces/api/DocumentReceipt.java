package com.example.prospectus.interfaces.api;

import com.example.prospectus.domain.model.StoredDocument;

/**
 * Response body of a successful upload.
 */
public record DocumentReceipt(String fileId, String fileName, long sizeBytes) {

    static DocumentReceipt from(StoredDocument document) {
        return new DocumentReceipt(document.fileId(), document.fileName(), document.sizeBytes());
    }
}
