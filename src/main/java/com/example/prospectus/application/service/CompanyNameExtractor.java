package com.example.prospectus.application.service;

import com.example.prospectus.config.InsightProperties;
import com.example.prospectus.domain.model.DocumentInfo;
import com.example.prospectus.domain.model.PageSource;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Works out the issuer's name.
 * <p>
 * The most frequent "&lt;Name&gt; Limited" phrase on the first pages wins, ignoring exchanges, regulators and
 * intermediaries; ties go to the longer, then the earlier, phrase. Without one the PDF title is used, then the
 * first token of the uploaded file name that is not a generated identifier, and finally "Unknown".
 */
@Component
public class CompanyNameExtractor {

    static final String UNKNOWN = "Unknown";

    private static final Logger log = LoggerFactory.getLogger(CompanyNameExtractor.class);
    private static final Pattern COMPANY = Pattern.compile(
            "((?:[A-Z][\\p{L}\\p{N}&.'’-]*\\s+){1,8}?)(PRIVATE\\s+LIMITED|Private\\s+Limited|LIMITED|Limited|LTD\\.?|Ltd\\.?)(?![\\p{L}])");
    private static final Set<String> LEADING_NOISE = Set.of(
            "of", "by", "for", "to", "in", "on", "from", "with", "the", "is", "as", "at", "our", "and", "an", "a");
    private static final Pattern BLACKLIST = Pattern.compile(
            "\\b(?:BSE|NSE|Exchange|Societe|Luxembourg|SEBI|Board|Phiroze|Stock|Registrar|Depository|Depositories)\\b",
            Pattern.CASE_INSENSITIVE);
    private static final Pattern FILE_NAME_DELIMITER = Pattern.compile("[\\s_\\-]+");
    private static final Pattern GENERATED_ID = Pattern.compile("[0-9a-f]{32}");

    private final InsightProperties properties;

    public CompanyNameExtractor(InsightProperties properties) {
        this.properties = properties;
    }

    public String extract(PageSource pages, String fileName) {
        Optional<String> fromText = fromLeadingPages(pages);
        if (fromText.isPresent()) {
            return fromText.get();
        }
        DocumentInfo info = pages.info();
        if (info.hasTitle()) {
            log.debug("Company name taken from the PDF title");
            return info.title().strip();
        }
        return fromFileName(fileName);
    }

    Optional<String> fromLeadingPages(PageSource pages) {
        int limit = Math.min(properties.getCompany().getScanPages(), pages.pageCount());
        Map<String, Candidate> candidates = new LinkedHashMap<>();
        for (int number = 1; number <= limit; number++) {
            AnalysisCancellation.checkpoint();
            for (String line : pages.page(number).text().split("\\R")) {
                Matcher matcher = COMPANY.matcher(line);
                while (matcher.find()) {
                    String name = clean(matcher.group(1), matcher.group(2));
                    if (name == null || BLACKLIST.matcher(name).find()) {
                        continue;
                    }
                    candidates.computeIfAbsent(name.toUpperCase(Locale.ROOT),
                            key -> new Candidate(name, candidates.size())).count++;
                }
            }
        }
        return candidates.values().stream()
                .max(Comparator.comparingInt((Candidate candidate) -> candidate.count)
                        .thenComparingInt(candidate -> candidate.name.length())
                        .thenComparing(Comparator.comparingInt((Candidate candidate) -> candidate.order).reversed()))
                .map(candidate -> candidate.name);
    }

    static String fromFileName(String fileName) {
        if (fileName == null || fileName.isBlank()) {
            return UNKNOWN;
        }
        String base = fileName.replace('\\', '/');
        base = base.substring(base.lastIndexOf('/') + 1);
        int dot = base.lastIndexOf('.');
        if (dot > 0) {
            base = base.substring(0, dot);
        }
        for (String token : FILE_NAME_DELIMITER.split(base)) {
            String cleaned = token.strip();
            if (!cleaned.isEmpty() && !GENERATED_ID.matcher(cleaned.toLowerCase(Locale.ROOT)).matches()) {
                return cleaned.toUpperCase(Locale.ROOT);
            }
        }
        return UNKNOWN;
    }

    private static String clean(String words, String suffix) {
        List<String> parts = new ArrayList<>(List.of(words.strip().split("\\s+")));
        int start = 0;
        for (int i = 0; i < parts.size(); i++) {
            if (LEADING_NOISE.contains(parts.get(i).toLowerCase(Locale.ROOT))) {
                start = i + 1;
            }
        }
        List<String> nameWords = parts.subList(start, parts.size());
        if (nameWords.isEmpty()) {
            return null;
        }
        return String.join(" ", nameWords) + " " + suffix.replaceAll("\\s+", " ");
    }

    private static final class Candidate {
        private final String name;
        private final int order;
        private int count;

        Candidate(String name, int order) {
            this.name = name;
            this.order = order;
        }
    }
}
