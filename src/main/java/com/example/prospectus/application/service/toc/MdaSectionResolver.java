package com.example.prospectus.application.service.toc;

import com.example.prospectus.config.InsightProperties;
import com.example.prospectus.domain.exception.SectionNotFoundException;
import com.example.prospectus.domain.model.PageSource;
import com.example.prospectus.domain.model.Section;
import com.example.prospectus.domain.model.TableOfContents;
import com.example.prospectus.domain.model.TocEntry;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Resolves the page range of the Management's Discussion and Analysis section from a table of contents.
 */
@Service
public class MdaSectionResolver {

    private static final Logger log = LoggerFactory.getLogger(MdaSectionResolver.class);
    private static final List<String> MDA_LABELS = List.of(
            "management discussion",
            "management's discussion",
            "management’s discussion",
            "md&a"
    );
    private static final Pattern MDA_WORD = Pattern.compile("\\bmda\\b");

    private final InsightProperties properties;
    private final PageOffsetResolver offsetResolver;

    public MdaSectionResolver(InsightProperties properties, PageOffsetResolver offsetResolver) {
        this.properties = properties;
        this.offsetResolver = offsetResolver;
    }

    /**
     * Finds the first MDA-like entry and converts it into a physical page range.
     * The section ends on the page before the next entry that starts later and is not nested below the MDA
     * heading; without such an entry it runs to the end of the document, capped at
     * {@code insight.section.max-pages}.
     *
     * @param toc   located table of contents
     * @param pages document pages, used for the page count and for printed page offsets
     * @return section range without text
     * @throws SectionNotFoundException when no entry names the MDA section or it lies beyond the document
     */
    public Section resolve(TableOfContents toc, PageSource pages) {
        List<TocEntry> entries = toc.entries();
        int index = indexOfMda(entries);
        if (index < 0) {
            throw new SectionNotFoundException(
                    "No Management Discussion & Analysis heading found (" + toc.mode() + " layout, "
                            + entries.size() + " entries).");
        }
        TocEntry mda = entries.get(index);
        int start = mda.page();
        Integer nextStart = null;
        for (int i = index + 1; i < entries.size(); i++) {
            TocEntry next = entries.get(i);
            if (next.page() > start && next.level() <= mda.level()) {
                nextStart = next.page();
                break;
            }
        }

        int offset = toc.usesPrintedPageNumbers() ? offsetResolver.resolveOffset(pages, mda) : 0;
        int pageCount = pages.pageCount();
        int physicalStart = start + offset;
        if (physicalStart < 1 || physicalStart > pageCount) {
            throw new SectionNotFoundException(
                    "Management Discussion & Analysis starts on page " + physicalStart
                            + " but the document has " + pageCount + " pages.");
        }
        int physicalEnd = nextStart != null
                ? nextStart - 1 + offset
                : Math.min(pageCount, physicalStart + properties.getSection().getMaxPages() - 1);
        physicalEnd = Math.max(physicalStart, Math.min(physicalEnd, pageCount));

        log.info("Resolved '{}' to pages {}..{} (offset {})", mda.title(), physicalStart, physicalEnd, offset);
        return new Section(mda.title(), physicalStart, physicalEnd, "");
    }

    static int indexOfMda(List<TocEntry> entries) {
        for (int i = 0; i < entries.size(); i++) {
            if (isMdaTitle(entries.get(i).title())) {
                return i;
            }
        }
        return -1;
    }

    static boolean isMdaTitle(String title) {
        if (title == null) {
            return false;
        }
        String lower = title.toLowerCase(Locale.ROOT).replaceAll("\\s+", " ");
        for (String label : MDA_LABELS) {
            if (lower.contains(label)) {
                return true;
            }
        }
        return MDA_WORD.matcher(lower).find();
    }
}
