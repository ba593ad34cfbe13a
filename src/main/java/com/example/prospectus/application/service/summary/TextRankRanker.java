package com.example.prospectus.application.service.summary;

import com.example.prospectus.config.InsightProperties;

import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Weighted PageRank over the sentence similarity graph.
 * <p>
 * The edge weight between two sentences is the number of content words they share divided by
 * {@code ln|Si| + ln|Sj|}. Scores start at {@code 1/N} and are iterated with the configured damping factor until
 * the summed absolute change drops below the tolerance or the iteration cap is hit. The score held by a sentence
 * without any edge is spread evenly over all sentences, which keeps the scores summing to one and makes a graph
 * without edges settle on {@code 1/N} for every sentence.
 */
@Component
public class TextRankRanker {

    private final InsightProperties properties;

    public TextRankRanker(InsightProperties properties) {
        this.properties = properties;
    }

    /**
     * @param sentences lower-cased tokens of each sentence
     * @return scores in sentence order
     */
    public RankingOutcome rank(List<List<String>> sentences) {
        int n = sentences.size();
        if (n == 0) {
            return new RankingOutcome(List.of(), 0, true);
        }
        double[][] weights = similarityMatrix(sentences);
        double[] outgoing = new double[n];
        for (int i = 0; i < n; i++) {
            for (int j = 0; j < n; j++) {
                outgoing[i] += weights[i][j];
            }
        }

        InsightProperties.Summary config = properties.getSummary();
        double damping = config.getDamping();
        double[] scores = new double[n];
        Arrays.fill(scores, 1d / n);
        int iterations = 0;
        boolean converged = false;
        while (iterations < config.getMaxIterations()) {
            iterations++;
            double danglingMass = 0d;
            for (int j = 0; j < n; j++) {
                if (outgoing[j] == 0d) {
                    danglingMass += scores[j];
                }
            }
            double[] next = new double[n];
            double delta = 0d;
            for (int i = 0; i < n; i++) {
                double incoming = danglingMass / n;
                for (int j = 0; j < n; j++) {
                    if (weights[j][i] > 0d) {
                        incoming += weights[j][i] / outgoing[j] * scores[j];
                    }
                }
                next[i] = (1d - damping) / n + damping * incoming;
                delta += Math.abs(next[i] - scores[i]);
            }
            scores = next;
            if (delta < config.getTolerance()) {
                converged = true;
                break;
            }
        }

        List<Double> result = new ArrayList<>(n);
        for (double score : scores) {
            result.add(score);
        }
        return new RankingOutcome(result, iterations, converged);
    }

    double[][] similarityMatrix(List<List<String>> sentences) {
        int n = sentences.size();
        List<Set<String>> contentWords = new ArrayList<>(n);
        for (List<String> tokens : sentences) {
            Set<String> words = new HashSet<>();
            for (String token : tokens) {
                if (!Stopwords.contains(token)) {
                    words.add(token);
                }
            }
            contentWords.add(words);
        }
        double[][] weights = new double[n][n];
        for (int i = 0; i < n; i++) {
            for (int j = i + 1; j < n; j++) {
                double weight = similarity(contentWords.get(i), sentences.get(i).size(),
                        contentWords.get(j), sentences.get(j).size());
                weights[i][j] = weight;
                weights[j][i] = weight;
            }
        }
        return weights;
    }

    static double similarity(Set<String> left, int leftLength, Set<String> right, int rightLength) {
        if (leftLength <= 0 || rightLength <= 0) {
            return 0d;
        }
        double denominator = Math.log(leftLength) + Math.log(rightLength);
        if (denominator <= 0d) {
            return 0d;
        }
        int shared = 0;
        for (String word : left) {
            if (right.contains(word)) {
                shared++;
            }
        }
        return shared / denominator;
    }
}
