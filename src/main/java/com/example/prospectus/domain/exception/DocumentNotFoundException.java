package com.example.prospectus.domain.exception;

/**
 * Raised when a {@code fileId} does not refer to a stored document.
 */
public class DocumentNotFoundException extends DomainException {

    private final String fileId;

    /**
     * Creates the exception and records the unknown identifier as part of the message.
     *
     * @param fileId identifier supplied by the caller
     */
    public DocumentNotFoundException(String fileId) {
        super("Document not found: " + fileId);
        this.fileId = fileId;
    }

    public String getFileId() {
        return fileId;
    }
}
