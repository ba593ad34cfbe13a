package com.example.prospectus.domain.model;

/**
 * How the section layout of a document was obtained.
 */
public enum TocMode {
    /** Parsed from a printed table of contents. */
    STRUCTURED,
    /** Degraded mode: inferred from heading font size and weight. */
    HEURISTIC,
    /** Nothing usable was found. */
    NONE
}
