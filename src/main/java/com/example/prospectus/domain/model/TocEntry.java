package com.example.prospectus.domain.model;

/**
 * Entry of a table of contents in order of appearance.
 *
 * @param title heading text as printed
 * @param page  target page; printed page number for structured tables of contents, physical page otherwise
 * @param level heading level, {@code 1} for top-level entries
 */
public record TocEntry(String title, int page, int level) {
}
