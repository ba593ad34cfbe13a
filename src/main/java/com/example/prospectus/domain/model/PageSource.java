package com.example.prospectus.domain.model;

/**
 * Lazily evaluated, ordered view over the pages of one document.
 * Implementations extract a page only when it is requested so that large prospectuses are processed
 * page by page instead of being materialized at once.
 */
public interface PageSource extends AutoCloseable {

    int pageCount();

    /**
     * Returns the text layer of a page.
     *
     * @param number physical page number, {@code 1..pageCount()}
     * @return extracted page, never {@code null}
     * @throws IllegalArgumentException when the number is out of range
     */
    Page page(int number);

    /**
     * @return document level properties, {@link DocumentInfo#EMPTY} when none are available
     */
    default DocumentInfo info() {
        return DocumentInfo.EMPTY;
    }

    @Override
    default void close() {
    }
}
