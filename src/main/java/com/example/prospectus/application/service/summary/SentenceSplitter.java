package com.example.prospectus.application.service.summary;

import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Splits section text into sentences.
 * <p>
 * A sentence ends at {@code .}, {@code !} or {@code ?} followed by whitespace and an upper-case letter, digit or
 * opening quote. Periods of common abbreviations ("Rs.", "Ltd.", "e.g.") and of single-letter initials do not end a
 * sentence. Words hyphenated across a line break are rejoined and bullet markers start a new sentence.
 */
@Component
public class SentenceSplitter {

    private static final Set<String> ABBREVIATIONS = Set.of(
            "rs", "ltd", "co", "no", "nos", "e.g", "i.e", "viz", "mr", "mrs", "ms", "dr", "vs", "approx", "pvt",
            "inc", "corp", "st", "fig", "sr", "jr", "cf", "resp", "ref", "nr", "govt", "dept");
    private static final Pattern BOUNDARY = Pattern.compile("[.!?]+[\"'”’)]*\\s+(?=[\"'“‘(]?[\\p{Lu}\\p{N}])");
    private static final Pattern HYPHENATED_BREAK = Pattern.compile("(\\p{L})-\\s*\\n\\s*(\\p{Ll})");
    private static final Pattern BULLET = Pattern.compile("(?m)^\\s*[•●▪■◦►➢]\\s*");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    public List<String> split(String text) {
        List<String> sentences = new ArrayList<>();
        if (text == null || text.isBlank()) {
            return sentences;
        }
        String joined = HYPHENATED_BREAK.matcher(text).replaceAll("$1$2");
        for (String block : BULLET.split(joined)) {
            String flattened = WHITESPACE.matcher(block).replaceAll(" ").strip();
            if (!flattened.isEmpty()) {
                splitBlock(flattened, sentences);
            }
        }
        return sentences;
    }

    private void splitBlock(String block, List<String> sentences) {
        Matcher matcher = BOUNDARY.matcher(block);
        int start = 0;
        while (matcher.find()) {
            if (block.charAt(matcher.start()) == '.' && isProtected(block, matcher.start())) {
                continue;
            }
            add(sentences, block.substring(start, matcher.end()));
            start = matcher.end();
        }
        add(sentences, block.substring(start));
    }

    /**
     * @param periodIndex index of the period that would end the sentence
     * @return {@code true} when the period belongs to an abbreviation or an initial
     */
    private boolean isProtected(String block, int periodIndex) {
        int wordStart = periodIndex;
        while (wordStart > 0 && !Character.isWhitespace(block.charAt(wordStart - 1))) {
            wordStart--;
        }
        String word = block.substring(wordStart, periodIndex).toLowerCase(Locale.ROOT);
        word = word.replaceAll("^[\"'“‘(\\[]+", "");
        if (word.isEmpty()) {
            return false;
        }
        if (word.length() == 1 && Character.isLetter(word.charAt(0))) {
            return true;
        }
        return ABBREVIATIONS.contains(word);
    }

    private static void add(List<String> sentences, String candidate) {
        String sentence = candidate.strip();
        if (!sentence.isEmpty()) {
            sentences.add(sentence);
        }
    }
}
