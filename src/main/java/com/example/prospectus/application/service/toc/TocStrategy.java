package com.example.prospectus.application.service.toc;

import com.example.prospectus.domain.model.PageSource;
import com.example.prospectus.domain.model.TableOfContents;
import com.example.prospectus.domain.model.TocMode;

/**
 * A way of deriving the section layout of a document.
 */
public interface TocStrategy {

    TocMode mode();

    /**
     * @param capability what the detector found about the document
     * @return {@code true} when this strategy can run on such a document
     */
    boolean supports(TocCapability capability);

    /**
     * @return entries in order of appearance, possibly empty
     */
    TableOfContents locate(PageSource pages, TocCapability capability);
}
