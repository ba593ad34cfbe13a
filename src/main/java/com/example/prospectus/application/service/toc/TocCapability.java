package com.example.prospectus.application.service.toc;

import java.util.List;

/**
 * What the detector found about a document's table of contents.
 *
 * @param tocPages physical pages that hold a printed table of contents, in order; empty when none was found
 */
public record TocCapability(List<Integer> tocPages) {

    public TocCapability {
        tocPages = tocPages == null ? List.of() : List.copyOf(tocPages);
    }

    public static TocCapability none() {
        return new TocCapability(List.of());
    }

    public boolean hasPrintedToc() {
        return !tocPages.isEmpty();
    }
}
