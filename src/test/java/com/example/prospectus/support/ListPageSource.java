package com.example.prospectus.support;

import com.example.prospectus.domain.model.DocumentInfo;
import com.example.prospectus.domain.model.Page;
import com.example.prospectus.domain.model.PageSource;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * In-memory page source for unit tests.
 */
public final class ListPageSource implements PageSource {

    private final List<Page> pages;
    private final DocumentInfo info;
    private final AtomicBoolean closed = new AtomicBoolean();

    private ListPageSource(List<Page> pages, DocumentInfo info) {
        this.pages = List.copyOf(pages);
        this.info = info;
    }

    /**
     * Builds a source from plain page texts; {@code null} stands for a page without a text layer.
     */
    public static ListPageSource ofTexts(String... texts) {
        return ofTexts(DocumentInfo.EMPTY, texts);
    }

    public static ListPageSource ofTexts(DocumentInfo info, String... texts) {
        List<Page> pages = new ArrayList<>();
        for (int i = 0; i < texts.length; i++) {
            pages.add(Page.ofText(i + 1, texts[i]));
        }
        return new ListPageSource(pages, info);
    }

    public static ListPageSource ofPages(Page... pages) {
        return new ListPageSource(List.of(pages), DocumentInfo.EMPTY);
    }

    /**
     * Builds a document of {@code count} pages that all carry the same filler text.
     */
    public static ListPageSource blank(int count, String filler) {
        String[] texts = new String[count];
        for (int i = 0; i < count; i++) {
            texts[i] = filler;
        }
        return ofTexts(texts);
    }

    public ListPageSource withPage(int number, String text) {
        List<Page> copy = new ArrayList<>(pages);
        copy.set(number - 1, Page.ofText(number, text));
        return new ListPageSource(copy, info);
    }

    @Override
    public int pageCount() {
        return pages.size();
    }

    @Override
    public Page page(int number) {
        if (number < 1 || number > pages.size()) {
            throw new IllegalArgumentException("Page " + number + " is out of range 1.." + pages.size());
        }
        return pages.get(number - 1);
    }

    @Override
    public DocumentInfo info() {
        return info;
    }

    @Override
    public void close() {
        closed.set(true);
    }

    public boolean isClosed() {
        return closed.get();
    }
}
