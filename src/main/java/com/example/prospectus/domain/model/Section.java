package com.example.prospectus.domain.model;

/**
 * Contiguous, inclusive physical page range of a document together with its text.
 */
public record Section(String name, int startPage, int endPage, String text) {

    public Section {
        if (startPage < 1 || endPage < startPage) {
            throw new IllegalArgumentException("Invalid section range " + startPage + ".." + endPage);
        }
        text = text == null ? "" : text;
    }

    public Section withText(String sectionText) {
        return new Section(name, startPage, endPage, sectionText);
    }

    public int pageSpan() {
        return endPage - startPage + 1;
    }
}
