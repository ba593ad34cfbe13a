package com.example.prospectus.application.service;

import com.example.prospectus.application.exception.AnalysisFailedException;
import com.example.prospectus.application.service.financial.FinancialTableParser;
import com.example.prospectus.application.service.financial.ParsedFinancials;
import com.example.prospectus.application.service.summary.TextRankSummarizer;
import com.example.prospectus.application.service.toc.MdaSectionResolver;
import com.example.prospectus.application.service.toc.TocLocator;
import com.example.prospectus.domain.exception.NoFinancialDataFoundException;
import com.example.prospectus.domain.exception.SectionNotFoundException;
import com.example.prospectus.domain.exception.SummaryUnavailableException;
import com.example.prospectus.domain.model.AnalysisResult;
import com.example.prospectus.domain.model.BranchFailure;
import com.example.prospectus.domain.model.FinancialStatement;
import com.example.prospectus.domain.model.PageSource;
import com.example.prospectus.domain.model.ReportingScale;
import com.example.prospectus.domain.model.Section;
import com.example.prospectus.domain.model.StoredDocument;
import com.example.prospectus.domain.model.SummaryResult;
import com.example.prospectus.domain.model.TableOfContents;
import com.example.prospectus.domain.model.TocMode;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;

/**
 * Runs the insight pipeline for a stored document and caches the outcome per {@code fileId}.
 * <p>
 * The financial branch (table parser, KPI engine) and the summary branch (TOC, MDA range, TextRank) are
 * independent: a branch that yields nothing is recorded as a {@link BranchFailure} and the other branch still
 * completes.
 */
@Service
public class InsightAssembler {

    static final String NO_FINANCIAL_DATA = "NO_FINANCIAL_DATA";
    static final String SECTION_NOT_FOUND = "SECTION_NOT_FOUND";
    static final String SUMMARY_UNAVAILABLE = "SUMMARY_UNAVAILABLE";

    private static final Logger log = LoggerFactory.getLogger(InsightAssembler.class);

    private final DocumentService documentService;
    private final AnalysisResultCache cache;
    private final CompanyNameExtractor companyNameExtractor;
    private final TocLocator tocLocator;
    private final MdaSectionResolver sectionResolver;
    private final SectionExtractor sectionExtractor;
    private final TextRankSummarizer summarizer;
    private final FinancialTableParser tableParser;
    private final KpiEngine kpiEngine;

    public InsightAssembler(DocumentService documentService,
                            AnalysisResultCache cache,
                            CompanyNameExtractor companyNameExtractor,
                            TocLocator tocLocator,
                            MdaSectionResolver sectionResolver,
                            SectionExtractor sectionExtractor,
                            TextRankSummarizer summarizer,
                            FinancialTableParser tableParser,
                            KpiEngine kpiEngine) {
        this.documentService = documentService;
        this.cache = cache;
        this.companyNameExtractor = companyNameExtractor;
        this.tocLocator = tocLocator;
        this.sectionResolver = sectionResolver;
        this.sectionExtractor = sectionExtractor;
        this.summarizer = summarizer;
        this.tableParser = tableParser;
        this.kpiEngine = kpiEngine;
    }

    /**
     * Returns the insight for a document, computing it on the first call only.
     *
     * @param fileId identifier returned by {@link DocumentService#submitDocument}
     * @return cached result
     * @throws com.example.prospectus.domain.exception.DocumentNotFoundException when the identifier is unknown
     * @throws AnalysisFailedException when the document carries no text on any page
     */
    public AnalysisResult analyze(String fileId) {
        StoredDocument document = documentService.getDocument(fileId);
        return cache.getOrCompute(fileId, () -> runPipeline(document));
    }

    /**
     * @throws SummaryUnavailableException with the recorded reason when the summary branch failed
     */
    public SummaryResult getSummary(String fileId) {
        AnalysisResult result = analyze(fileId);
        if (!result.hasSummary()) {
            throw new SummaryUnavailableException(result.summaryFailure().reason());
        }
        return result.summary();
    }

    private AnalysisResult runPipeline(StoredDocument document) {
        long started = System.nanoTime();
        try (PageSource pages = documentService.getDocumentPages(document.fileId())) {
            String companyName = companyNameExtractor.extract(pages, document.fileName());

            FinancialBranch financials = runFinancials(pages);
            SummaryBranch summary = runSummary(pages);

            if (financials.failure() != null && summary.failure() != null && financials.pagesWithText() == 0) {
                throw new AnalysisFailedException("The document has no extractable text layer on any of its "
                        + pages.pageCount() + " pages.", financials.cause());
            }

            AnalysisResult result = new AnalysisResult(
                    document.fileId(),
                    document.fileName(),
                    companyName,
                    pages.pageCount(),
                    summary.tocMode(),
                    financials.scale(),
                    financials.report().kpis(),
                    financials.statements(),
                    financials.report().trends(),
                    financials.report().warnings(),
                    financials.failure(),
                    summary.result(),
                    summary.failure());
            log.info("Analyzed {} ({} pages, {} KPIs, summary {}) in {} ms", document.fileName(), pages.pageCount(),
                    result.kpis().size(), result.hasSummary() ? "available" : "unavailable",
                    (System.nanoTime() - started) / 1_000_000);
            return result;
        }
    }

    private FinancialBranch runFinancials(PageSource pages) {
        try {
            ParsedFinancials parsed = tableParser.parse(pages);
            KpiReport report = kpiEngine.compute(parsed.statements());
            return new FinancialBranch(parsed, report, null, parsed.pagesWithText(), null);
        } catch (NoFinancialDataFoundException ex) {
            log.warn("Financial branch failed: {}", ex.getMessage());
            return new FinancialBranch(null, new KpiReport(Map.of(), List.of(), List.of()),
                    new BranchFailure(NO_FINANCIAL_DATA, ex.getMessage()), ex.getPagesWithText(), ex);
        }
    }

    private SummaryBranch runSummary(PageSource pages) {
        TableOfContents toc = tocLocator.locate(pages);
        if (toc.mode() == TocMode.NONE) {
            log.warn("No table of contents or headings found");
        }
        try {
            Section range = sectionResolver.resolve(toc, pages);
            Section section = sectionExtractor.extract(pages, range);
            return new SummaryBranch(toc.mode(), summarizer.summarize(section), null);
        } catch (SectionNotFoundException ex) {
            log.warn("Summary branch failed: {}", ex.getMessage());
            return new SummaryBranch(toc.mode(), null, new BranchFailure(SECTION_NOT_FOUND, ex.getMessage()));
        } catch (SummaryUnavailableException ex) {
            log.warn("Summary branch failed: {}", ex.getMessage());
            return new SummaryBranch(toc.mode(), null, new BranchFailure(SUMMARY_UNAVAILABLE, ex.getMessage()));
        }
    }

    private record FinancialBranch(ParsedFinancials parsed,
                                   KpiReport report,
                                   BranchFailure failure,
                                   int pagesWithText,
                                   NoFinancialDataFoundException cause) {

        ReportingScale scale() {
            return parsed == null ? ReportingScale.UNITS : parsed.reportingScale();
        }

        Map<String, FinancialStatement> statements() {
            return parsed == null ? Map.of() : parsed.statements();
        }
    }

    private record SummaryBranch(TocMode tocMode, SummaryResult result, BranchFailure failure) {
    }
}
