package com.example.prospectus.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Tunables of the document-to-insight pipeline, bound from the {@code insight.*} namespace.
 * Defaults match the values documented in {@code application.yml}.
 */
@ConfigurationProperties(prefix = "insight")
public class InsightProperties {

    private final Toc toc = new Toc();
    private final SectionLimits section = new SectionLimits();
    private final Summary summary = new Summary();
    private final Kpi kpi = new Kpi();
    private final Company company = new Company();

    public Toc getToc() {
        return toc;
    }

    public SectionLimits getSection() {
        return section;
    }

    public Summary getSummary() {
        return summary;
    }

    public Kpi getKpi() {
        return kpi;
    }

    public Company getCompany() {
        return company;
    }

    /**
     * Table of contents detection.
     */
    public static class Toc {
        /** Number of leading pages scanned for a printed table of contents. */
        private int scanWindow = 40;
        /** Minimum number of "title ... page" lines for a page to count as a table of contents. */
        private int minEntries = 3;
        /** Whether printed page numbers are reconciled with physical pages. */
        private boolean detectPageOffset = true;
        /** Largest printed-to-physical page offset searched for. */
        private int maxPageOffset = 30;

        public int getScanWindow() {
            return scanWindow;
        }

        public void setScanWindow(int scanWindow) {
            this.scanWindow = scanWindow;
        }

        public int getMinEntries() {
            return minEntries;
        }

        public void setMinEntries(int minEntries) {
            this.minEntries = minEntries;
        }

        public boolean isDetectPageOffset() {
            return detectPageOffset;
        }

        public void setDetectPageOffset(boolean detectPageOffset) {
            this.detectPageOffset = detectPageOffset;
        }

        public int getMaxPageOffset() {
            return maxPageOffset;
        }

        public void setMaxPageOffset(int maxPageOffset) {
            this.maxPageOffset = maxPageOffset;
        }
    }

    public static class SectionLimits {
        /** Cap on the length of a section whose end could not be taken from a following heading. */
        private int maxPages = 60;

        public int getMaxPages() {
            return maxPages;
        }

        public void setMaxPages(int maxPages) {
            this.maxPages = maxPages;
        }
    }

    /**
     * TextRank summarization.
     */
    public static class Summary {
        private int sentenceCount = 6;
        /** When set, the summary keeps this share of the usable sentences instead of {@code sentenceCount}. */
        private Double ratio;
        private int minSentences = 3;
        private int minSentenceTokens = 5;
        private double damping = 0.85d;
        private double tolerance = 1e-4d;
        private int maxIterations = 100;

        public int getSentenceCount() {
            return sentenceCount;
        }

        public void setSentenceCount(int sentenceCount) {
            this.sentenceCount = sentenceCount;
        }

        public Double getRatio() {
            return ratio;
        }

        public void setRatio(Double ratio) {
            this.ratio = ratio;
        }

        public int getMinSentences() {
            return minSentences;
        }

        public void setMinSentences(int minSentences) {
            this.minSentences = minSentences;
        }

        public int getMinSentenceTokens() {
            return minSentenceTokens;
        }

        public void setMinSentenceTokens(int minSentenceTokens) {
            this.minSentenceTokens = minSentenceTokens;
        }

        public double getDamping() {
            return damping;
        }

        public void setDamping(double damping) {
            this.damping = damping;
        }

        public double getTolerance() {
            return tolerance;
        }

        public void setTolerance(double tolerance) {
            this.tolerance = tolerance;
        }

        public int getMaxIterations() {
            return maxIterations;
        }

        public void setMaxIterations(int maxIterations) {
            this.maxIterations = maxIterations;
        }
    }

    public static class Kpi {
        /** Decimal places every reported KPI is rounded to. */
        private int precision = 2;

        public int getPrecision() {
            return precision;
        }

        public void setPrecision(int precision) {
            this.precision = precision;
        }
    }

    public static class Company {
        /** Leading pages searched for the issuer's "... Limited" name. */
        private int scanPages = 5;

        public int getScanPages() {
            return scanPages;
        }

        public void setScanPages(int scanPages) {
            this.scanPages = scanPages;
        }
    }
}
