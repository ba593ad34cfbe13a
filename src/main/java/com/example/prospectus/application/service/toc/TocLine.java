package com.example.prospectus.application.service.toc;

import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * One "title, leader, page number" line of a printed table of contents.
 *
 * @param title heading text without the leader
 * @param page  printed page number
 */
record TocLine(String title, int page) {

    private static final Pattern LINE_PATTERN = Pattern.compile(
            "^(?<title>.*?[\\p{L})'’])\\s*(?:[….·_—][….·_—\\s]*|\\s+)(?<page>\\d{1,4})$");
    private static final Pattern CONTENTS_HEADING = Pattern.compile(
            "^(?:table\\s+of\\s+)?contents?$|^index$", Pattern.CASE_INSENSITIVE);
    private static final int MAX_TITLE_LENGTH = 160;

    /**
     * @param text a visual line
     * @return the parsed entry when the line ends with a page number after a plausible title
     */
    static Optional<TocLine> parse(String text) {
        if (text == null) {
            return Optional.empty();
        }
        String line = text.strip();
        Matcher matcher = LINE_PATTERN.matcher(line);
        if (!matcher.matches()) {
            return Optional.empty();
        }
        String title = matcher.group("title").strip();
        if (title.length() > MAX_TITLE_LENGTH || countLetters(title) < 2) {
            return Optional.empty();
        }
        int page = Integer.parseInt(matcher.group("page"));
        if (page < 1) {
            return Optional.empty();
        }
        return Optional.of(new TocLine(title, page));
    }

    static boolean isContentsHeading(String text) {
        if (text == null) {
            return false;
        }
        String flattened = text.strip().replaceAll("\\s+", " ").toLowerCase(Locale.ROOT);
        return CONTENTS_HEADING.matcher(flattened).matches();
    }

    private static int countLetters(String value) {
        int letters = 0;
        for (int i = 0; i < value.length(); i++) {
            if (Character.isLetter(value.charAt(i))) {
                letters++;
            }
        }
        return letters;
    }
}
