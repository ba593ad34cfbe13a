package com.example.prospectus.domain.model;

/**
 * Single word extracted from a PDF page together with its position and font attributes.
 * Coordinates follow PDFBox's direction-adjusted space: {@code x} grows to the right and {@code y} grows downwards.
 */
public record WordToken(
        String text,
        float x,
        float y,
        float width,
        float fontSize,
        boolean bold
) {

    public WordToken {
        text = text == null ? "" : text;
        width = Math.max(width, 0f);
    }

    /**
     * Creates a token that only carries text, used when no layout information is available.
     *
     * @param text word text
     * @return token positioned at the origin
     */
    public static WordToken unpositioned(String text) {
        return new WordToken(text, 0f, 0f, 0f, 0f, false);
    }

    public float endX() {
        return x + width;
    }

    public float center() {
        return x + (width / 2f);
    }

    public boolean positioned() {
        return width > 0f;
    }
}
