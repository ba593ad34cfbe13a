package com.example.prospectus.domain.model;

/**
 * Document level properties read from the PDF info dictionary and XMP packet.
 */
public record DocumentInfo(String title) {

    public static final DocumentInfo EMPTY = new DocumentInfo(null);

    public boolean hasTitle() {
        return title != null && !title.isBlank();
    }
}
