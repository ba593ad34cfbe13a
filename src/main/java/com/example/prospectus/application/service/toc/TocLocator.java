package com.example.prospectus.application.service.toc;

import com.example.prospectus.domain.model.PageSource;
import com.example.prospectus.domain.model.TableOfContents;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Chooses how the section layout of a document is obtained. The detection result decides which strategies are
 * eligible; they are tried in their declared order until one yields entries.
 */
@Service
public class TocLocator {

    private static final Logger log = LoggerFactory.getLogger(TocLocator.class);

    private final TocDetector detector;
    private final List<TocStrategy> strategies;

    /**
     * @param detector   table of contents detector
     * @param strategies strategies ordered by preference
     */
    public TocLocator(TocDetector detector, List<TocStrategy> strategies) {
        this.detector = detector;
        this.strategies = List.copyOf(strategies);
    }

    public TableOfContents locate(PageSource pages) {
        TocCapability capability = detector.detect(pages);
        for (TocStrategy strategy : strategies) {
            if (!strategy.supports(capability)) {
                continue;
            }
            TableOfContents toc = strategy.locate(pages, capability);
            if (!toc.entries().isEmpty()) {
                log.info("Section layout taken from {} strategy ({} entries)", strategy.mode(), toc.entries().size());
                return toc;
            }
            log.warn("{} strategy produced no entries", strategy.mode());
        }
        return TableOfContents.none();
    }
}
