package com.example.prospectus.domain.model;

import java.util.Arrays;
import java.util.List;

/**
 * Text layer of a single PDF page. Page numbers are physical and 1-based.
 * A page without a text layer (for example a scanned image) carries empty text and no lines.
 */
public record Page(int number, String text, List<TextLine> lines) {

    public Page {
        text = text == null ? "" : text;
        lines = lines == null ? List.of() : List.copyOf(lines);
    }

    public static Page empty(int number) {
        return new Page(number, "", List.of());
    }

    /**
     * Builds a page from plain text, splitting every line on whitespace into unpositioned words.
     *
     * @param number physical page number
     * @param text   page text
     * @return page without layout information
     */
    public static Page ofText(int number, String text) {
        if (text == null || text.isBlank()) {
            return empty(number);
        }
        List<TextLine> lines = text.lines()
                .map(String::strip)
                .filter(line -> !line.isEmpty())
                .map(line -> new TextLine(0f, Arrays.stream(line.split("\\s+"))
                        .map(WordToken::unpositioned)
                        .toList()))
                .toList();
        return new Page(number, text, lines);
    }

    public boolean hasText() {
        return !text.isBlank();
    }
}
