package com.example.prospectus.application.service.summary;

import com.example.prospectus.config.InsightProperties;
import com.example.prospectus.domain.exception.SummaryUnavailableException;
import com.example.prospectus.domain.model.Section;
import com.example.prospectus.domain.model.SummaryResult;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

/**
 * Extractive summary of a section: ranks its sentences with TextRank and keeps the best ones in their original
 * order.
 */
@Service
public class TextRankSummarizer {

    private static final Logger log = LoggerFactory.getLogger(TextRankSummarizer.class);
    private static final Pattern TOKEN = Pattern.compile("[\\p{L}\\p{N}]+");

    private final SentenceSplitter splitter;
    private final TextRankRanker ranker;
    private final InsightProperties properties;

    public TextRankSummarizer(SentenceSplitter splitter, TextRankRanker ranker, InsightProperties properties) {
        this.splitter = splitter;
        this.ranker = ranker;
        this.properties = properties;
    }

    /**
     * @param section section carrying its text
     * @return summary of the section
     * @throws SummaryUnavailableException when the section has too few usable sentences
     */
    public SummaryResult summarize(Section section) {
        InsightProperties.Summary config = properties.getSummary();
        List<String> sentences = new ArrayList<>();
        List<List<String>> tokens = new ArrayList<>();
        for (String sentence : splitter.split(section.text())) {
            List<String> sentenceTokens = tokenize(sentence);
            if (sentenceTokens.size() >= config.getMinSentenceTokens()) {
                sentences.add(sentence);
                tokens.add(sentenceTokens);
            }
        }
        if (sentences.size() < config.getMinSentences()) {
            throw new SummaryUnavailableException("The section '" + section.name() + "' on pages "
                    + section.startPage() + "-" + section.endPage() + " has only " + sentences.size()
                    + " usable sentences.");
        }

        RankingOutcome outcome = ranker.rank(tokens);
        if (!outcome.converged()) {
            log.warn("TextRank stopped after {} iterations without converging", outcome.iterations());
        }
        int keep = selectionSize(sentences.size());
        List<Double> scores = outcome.scores();
        List<Integer> selected = IntStream.range(0, sentences.size())
                .boxed()
                .sorted(Comparator.comparing((Integer index) -> scores.get(index)).reversed()
                        .thenComparing(Comparator.naturalOrder()))
                .limit(keep)
                .sorted()
                .toList();
        String summary = selected.stream().map(sentences::get).collect(Collectors.joining(" "));
        log.info("Summarized {} sentences into {} after {} iterations", sentences.size(), selected.size(),
                outcome.iterations());
        return new SummaryResult(summary, section.startPage(), section.endPage(), sentences.size(), selected.size(),
                section.text());
    }

    int selectionSize(int sentenceCount) {
        Double ratio = properties.getSummary().getRatio();
        int keep = ratio != null
                ? (int) Math.ceil(ratio * sentenceCount)
                : properties.getSummary().getSentenceCount();
        return Math.max(1, Math.min(keep, sentenceCount));
    }

    static List<String> tokenize(String sentence) {
        List<String> tokens = new ArrayList<>();
        Matcher matcher = TOKEN.matcher(sentence);
        while (matcher.find()) {
            tokens.add(matcher.group().toLowerCase(Locale.ROOT));
        }
        return tokens;
    }
}
