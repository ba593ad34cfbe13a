package com.example.prospectus.application.service.toc;

import com.example.prospectus.application.service.AnalysisCancellation;
import com.example.prospectus.domain.model.PageSource;
import com.example.prospectus.domain.model.TableOfContents;
import com.example.prospectus.domain.model.TextLine;
import com.example.prospectus.domain.model.TocEntry;
import com.example.prospectus.domain.model.TocMode;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * Parses the printed table of contents on the pages reported by {@link TocDetector}.
 * Page numbers of the resulting entries are printed page numbers.
 */
@Component
@Order(1)
public class StructuredTocStrategy implements TocStrategy {

    private static final Logger log = LoggerFactory.getLogger(StructuredTocStrategy.class);
    private static final float INDENT_THRESHOLD = 12f;
    private static final int MAX_PENDING_WORDS = 15;
    private static final Set<String> CONNECTORS = Set.of("and", "of", "&", "for", "in", "on", "the", "to", "-", "–");

    @Override
    public TocMode mode() {
        return TocMode.STRUCTURED;
    }

    @Override
    public boolean supports(TocCapability capability) {
        return capability.hasPrintedToc();
    }

    @Override
    public TableOfContents locate(PageSource pages, TocCapability capability) {
        List<ParsedLine> parsed = new ArrayList<>();
        for (int number : capability.tocPages()) {
            AnalysisCancellation.checkpoint();
            parsed.addAll(parsePage(pages.page(number).lines(), pages.pageCount()));
        }
        float minX = (float) parsed.stream()
                .filter(ParsedLine::positioned)
                .mapToDouble(ParsedLine::x)
                .min()
                .orElse(0d);
        List<TocEntry> entries = parsed.stream()
                .map(line -> new TocEntry(line.title(), line.page(), levelOf(line, minX)))
                .toList();
        log.info("Parsed {} table of contents entries from pages {}", entries.size(), capability.tocPages());
        return new TableOfContents(TocMode.STRUCTURED, entries);
    }

    private List<ParsedLine> parsePage(List<TextLine> lines, int pageCount) {
        List<ParsedLine> parsed = new ArrayList<>();
        TextLine pending = null;
        for (TextLine line : lines) {
            String text = line.text();
            if (TocLine.isContentsHeading(text)) {
                pending = null;
                continue;
            }
            Optional<TocLine> entry = TocLine.parse(text).filter(candidate -> candidate.page() <= pageCount);
            if (entry.isEmpty()) {
                pending = isWrappedTitle(text) ? line : null;
                continue;
            }
            String title = entry.get().title();
            TextLine first = line;
            if (pending != null) {
                title = pending.text() + " " + title;
                first = pending;
            }
            parsed.add(new ParsedLine(title, entry.get().page(), first.x(), first.positioned()));
            pending = null;
        }
        return parsed;
    }

    /**
     * A title wrapped over two lines leaves a first line without a page number that ends in a connector word.
     */
    private boolean isWrappedTitle(String text) {
        String[] words = text.strip().split("\\s+");
        if (words.length == 0 || words.length > MAX_PENDING_WORDS) {
            return false;
        }
        String last = words[words.length - 1].toLowerCase(Locale.ROOT);
        return CONNECTORS.contains(last) || last.endsWith(",");
    }

    private int levelOf(ParsedLine line, float minX) {
        if (!line.positioned()) {
            return 1;
        }
        return line.x() > minX + INDENT_THRESHOLD ? 2 : 1;
    }

    private record ParsedLine(String title, int page, float x, boolean positioned) {
    }
}
