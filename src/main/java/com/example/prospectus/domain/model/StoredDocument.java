package com.example.prospectus.domain.model;

import java.time.Instant;

/**
 * Uploaded prospectus held by the storage collaborator.
 * Immutable once stored; the content array is never handed out for mutation.
 */
public record StoredDocument(
        String fileId,
        String fileName,
        byte[] content,
        Instant uploadedAt
) {

    public StoredDocument {
        content = content == null ? new byte[0] : content.clone();
    }

    @Override
    public byte[] content() {
        return content.clone();
    }

    public long sizeBytes() {
        return content.length;
    }
}
