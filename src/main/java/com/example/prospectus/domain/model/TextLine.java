package com.example.prospectus.domain.model;

import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;

/**
 * One visual line of a page: the words sharing a baseline, ordered left to right.
 */
public record TextLine(float y, List<WordToken> words) {

    public TextLine {
        words = words == null
                ? List.of()
                : words.stream().sorted(Comparator.comparing(WordToken::x)).toList();
    }

    /**
     * @return words joined by single spaces
     */
    public String text() {
        return words.stream()
                .map(WordToken::text)
                .map(String::strip)
                .filter(value -> !value.isEmpty())
                .collect(Collectors.joining(" "));
    }

    public float x() {
        return words.isEmpty() ? 0f : words.get(0).x();
    }

    /**
     * @return largest font size used on the line, {@code 0} when unknown
     */
    public float fontSize() {
        return (float) words.stream().mapToDouble(WordToken::fontSize).max().orElse(0d);
    }

    /**
     * @return {@code true} when every word on the line is set in a bold face
     */
    public boolean bold() {
        return !words.isEmpty() && words.stream().allMatch(WordToken::bold);
    }

    public boolean positioned() {
        return !words.isEmpty() && words.stream().allMatch(WordToken::positioned);
    }

    public boolean isBlank() {
        return text().isBlank();
    }
}
