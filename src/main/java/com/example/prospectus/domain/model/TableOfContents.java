package com.example.prospectus.domain.model;

import java.util.List;

/**
 * Result of locating the table of contents.
 *
 * @param mode    strategy that produced the entries
 * @param entries entries in order of appearance
 */
public record TableOfContents(TocMode mode, List<TocEntry> entries) {

    public TableOfContents {
        entries = entries == null ? List.of() : List.copyOf(entries);
        mode = entries.isEmpty() ? TocMode.NONE : mode;
    }

    public static TableOfContents none() {
        return new TableOfContents(TocMode.NONE, List.of());
    }

    /**
     * Printed tables of contents refer to printed page numbers, which may be offset from physical pages.
     */
    public boolean usesPrintedPageNumbers() {
        return mode == TocMode.STRUCTURED;
    }
}
