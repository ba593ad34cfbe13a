package com.example.prospectus.infrastructure.pdf;

import com.example.prospectus.domain.model.DocumentInfo;
import com.example.prospectus.domain.model.Page;
import com.example.prospectus.domain.model.PageSource;

import org.apache.pdfbox.pdmodel.PDDocument;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * {@link PageSource} backed by an open {@link PDDocument}. Pages are stripped on first access and a small
 * window of recently used pages is retained, since the table of contents and section stages revisit
 * neighbouring pages. Not thread safe beyond the synchronization on {@link #page(int)}.
 */
class PdfPageSource implements PageSource {

    private static final Logger log = LoggerFactory.getLogger(PdfPageSource.class);
    private static final int RECENT_PAGES = 32;

    private final PDDocument document;
    private final String fileName;
    private final DocumentInfo info;
    private final int pageCount;
    private final Map<Integer, Page> recent = new LinkedHashMap<>(RECENT_PAGES, 0.75f, true) {
        @Override
        protected boolean removeEldestEntry(Map.Entry<Integer, Page> eldest) {
            return size() > RECENT_PAGES;
        }
    };
    private PositionedTextStripper stripper;
    private boolean closed;

    PdfPageSource(PDDocument document, String fileName, DocumentInfo info) {
        this.document = document;
        this.fileName = fileName;
        this.info = info == null ? DocumentInfo.EMPTY : info;
        this.pageCount = document.getNumberOfPages();
    }

    @Override
    public int pageCount() {
        return pageCount;
    }

    @Override
    public synchronized Page page(int number) {
        if (number < 1 || number > pageCount) {
            throw new IllegalArgumentException("Page " + number + " is outside 1.." + pageCount);
        }
        if (closed) {
            throw new IllegalStateException("Page source for " + fileName + " is closed");
        }
        Page cached = recent.get(number);
        if (cached != null) {
            return cached;
        }
        Page page = extract(number);
        recent.put(number, page);
        return page;
    }

    @Override
    public DocumentInfo info() {
        return info;
    }

    @Override
    public synchronized void close() {
        if (closed) {
            return;
        }
        closed = true;
        recent.clear();
        try {
            document.close();
        } catch (IOException ex) {
            log.warn("Failed to close PDF document {}", fileName, ex);
        }
    }

    private Page extract(int number) {
        try {
            PositionedTextStripper pageStripper = stripper();
            pageStripper.selectPage(number);
            String text = pageStripper.getText(document).strip();
            if (text.isEmpty()) {
                log.debug("Page {} of {} has no text layer", number, fileName);
                return Page.empty(number);
            }
            return new Page(number, text, pageStripper.getLines());
        } catch (IOException | RuntimeException ex) {
            log.warn("Text extraction failed on page {} of {}; treating it as empty", number, fileName, ex);
            return Page.empty(number);
        }
    }

    private PositionedTextStripper stripper() throws IOException {
        if (stripper == null) {
            stripper = new PositionedTextStripper();
        }
        return stripper;
    }
}
