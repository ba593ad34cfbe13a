package com.example.prospectus.domain.model;

import java.util.List;

/**
 * Values of one canonical line item ordered by period, oldest first.
 */
public record TrendSeries(String label, List<TrendPoint> points) {

    public TrendSeries {
        points = points == null ? List.of() : List.copyOf(points);
    }
}
