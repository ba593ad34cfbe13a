package com.example.prospectus.infrastructure.pdf;

import com.example.prospectus.domain.model.TextLine;
import com.example.prospectus.domain.model.WordToken;

import org.apache.pdfbox.pdmodel.font.PDFont;
import org.apache.pdfbox.text.PDFTextStripper;
import org.apache.pdfbox.text.TextPosition;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;

/**
 * Text stripper that records every word with its position and font attributes while PDFBox streams the page.
 * Words that share a baseline (within {@link #Y_TOLERANCE}) are grouped into one {@link TextLine}.
 */
class PositionedTextStripper extends PDFTextStripper {

    private static final float Y_TOLERANCE = 1.5f;

    private final List<LineBuilder> lines = new ArrayList<>();

    PositionedTextStripper() throws IOException {
        super();
        setSortByPosition(true);
        setShouldSeparateByBeads(true);
        setSuppressDuplicateOverlappingText(true);
        setLineSeparator("\n");
        setWordSeparator(" ");
    }

    /**
     * Restricts the stripper to one page and clears the lines captured by a previous run.
     *
     * @param pageNumber 1-based physical page number
     */
    void selectPage(int pageNumber) {
        lines.clear();
        setStartPage(pageNumber);
        setEndPage(pageNumber);
    }

    /**
     * @return captured lines ordered top to bottom
     */
    List<TextLine> getLines() {
        return lines.stream()
                .sorted(Comparator.comparing(LineBuilder::y))
                .map(LineBuilder::build)
                .filter(line -> !line.isBlank())
                .toList();
    }

    @Override
    protected void writeString(String text, List<TextPosition> textPositions) throws IOException {
        List<TextPosition> word = new ArrayList<>();
        for (TextPosition position : textPositions) {
            String unicode = position.getUnicode();
            if (unicode == null || unicode.isBlank()) {
                flushWord(word);
                continue;
            }
            word.add(position);
        }
        flushWord(word);
        super.writeString(text, textPositions);
    }

    private void flushWord(List<TextPosition> positions) {
        if (positions.isEmpty()) {
            return;
        }
        StringBuilder builder = new StringBuilder();
        for (TextPosition position : positions) {
            builder.append(position.getUnicode());
        }
        TextPosition first = positions.get(0);
        TextPosition last = positions.get(positions.size() - 1);
        float x = first.getXDirAdj();
        float width = (last.getXDirAdj() + last.getWidthDirAdj()) - x;
        if (width <= 0f) {
            width = positions.stream().map(TextPosition::getWidthDirAdj).reduce(0f, Float::sum);
        }
        width = Math.max(width, 0.5f);
        float y = positions.stream()
                .map(TextPosition::getYDirAdj)
                .min(Float::compareTo)
                .orElse(first.getYDirAdj());
        float fontSize = positions.stream()
                .map(TextPosition::getFontSizeInPt)
                .max(Float::compareTo)
                .orElse(0f);
        resolveLine(y).add(new WordToken(builder.toString(), x, y, width, fontSize, isBold(first.getFont())));
        positions.clear();
    }

    private static boolean isBold(PDFont font) {
        if (font == null || font.getName() == null) {
            return false;
        }
        String name = font.getName().toLowerCase(Locale.ROOT);
        return name.contains("bold") || name.contains("black") || name.contains("heavy");
    }

    private LineBuilder resolveLine(float y) {
        for (LineBuilder line : lines) {
            if (Math.abs(line.y() - y) < Y_TOLERANCE) {
                return line;
            }
        }
        LineBuilder line = new LineBuilder(y);
        lines.add(line);
        return line;
    }

    private static final class LineBuilder {
        private final float y;
        private final List<WordToken> words = new ArrayList<>();

        LineBuilder(float y) {
            this.y = y;
        }

        float y() {
            return y;
        }

        void add(WordToken word) {
            words.add(word);
        }

        TextLine build() {
            return new TextLine(y, words);
        }
    }
}
