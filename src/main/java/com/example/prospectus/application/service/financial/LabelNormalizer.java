package com.example.prospectus.application.service.financial;

import com.example.prospectus.domain.model.CanonicalLabel;

import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Maps printed row labels onto the canonical vocabulary.
 * Labels are case folded, "&amp;" is spelled out, leading enumerations such as "(i)", "a." or "2." and trailing note
 * references are removed, and everything that is not a letter or digit collapses into single spaces.
 */
@Component
public class LabelNormalizer {

    private static final Pattern LEADING_ENUMERATION = Pattern.compile(
            "^(?:\\(?(?:[ivx]{1,4}|[a-h]|\\d{1,2})[).]\\s+)+");
    private static final Pattern NOTE_REFERENCE = Pattern.compile("\\s+notes?\\s*(?:no\\.?)?\\s*[\\d.,\\s&]*$");
    private static final Pattern NON_ALPHANUMERIC = Pattern.compile("[^\\p{L}\\p{N}]+");
    private static final Pattern APOSTROPHES = Pattern.compile("['’`]");

    public String normalize(String label) {
        if (label == null) {
            return "";
        }
        String value = label.strip().toLowerCase(Locale.ROOT);
        value = LEADING_ENUMERATION.matcher(value).replaceFirst("");
        value = NOTE_REFERENCE.matcher(value).replaceFirst("");
        value = value.replace("&", " and ");
        value = APOSTROPHES.matcher(value).replaceAll("");
        value = NON_ALPHANUMERIC.matcher(value).replaceAll(" ");
        return value.strip().replaceAll("\\s+", " ");
    }

    public Optional<CanonicalLabel> canonicalize(String label) {
        return CanonicalLabel.fromNormalized(normalize(label));
    }
}
