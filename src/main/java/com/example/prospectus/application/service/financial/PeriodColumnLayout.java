package com.example.prospectus.application.service.financial;

import java.util.ArrayList;
import java.util.List;

/**
 * Column boundaries derived from the horizontal anchors of a period header.
 * Adjacent columns meet halfway between their anchors; the outer columns extend by the same half width,
 * so values printed to the left of the first period (note numbers) fall outside every column.
 */
final class PeriodColumnLayout {

    private static final float SINGLE_COLUMN_HALF_WIDTH = 60f;

    private final List<ColumnBoundary> boundaries;

    private PeriodColumnLayout(List<ColumnBoundary> boundaries) {
        this.boundaries = boundaries;
    }

    static PeriodColumnLayout fromAnchors(List<Float> anchors) {
        int columnCount = anchors.size();
        List<ColumnBoundary> boundaries = new ArrayList<>(columnCount);
        for (int i = 0; i < columnCount; i++) {
            float anchor = anchors.get(i);
            float start = i == 0
                    ? anchor - halfWidth(anchors, 0)
                    : midpoint(anchors.get(i - 1), anchor);
            float end = i == columnCount - 1
                    ? anchor + halfWidth(anchors, columnCount - 1)
                    : midpoint(anchor, anchors.get(i + 1));
            boundaries.add(new ColumnBoundary(start, end));
        }
        return new PeriodColumnLayout(boundaries);
    }

    int columnCount() {
        return boundaries.size();
    }

    /**
     * @param center horizontal centre of a value
     * @return column index or {@code -1} when the value lies outside the table columns
     */
    int locateColumn(float center) {
        for (int i = 0; i < boundaries.size(); i++) {
            if (boundaries.get(i).contains(center, i == boundaries.size() - 1)) {
                return i;
            }
        }
        return -1;
    }

    private static float halfWidth(List<Float> anchors, int index) {
        if (anchors.size() < 2) {
            return SINGLE_COLUMN_HALF_WIDTH;
        }
        int neighbour = index == 0 ? 1 : index - 1;
        return Math.abs(anchors.get(index) - anchors.get(neighbour)) / 2f;
    }

    private static float midpoint(float left, float right) {
        return left + ((right - left) / 2f);
    }

    /**
     * Closed interval covering one period column.
     */
    private static final class ColumnBoundary {
        private static final float TOLERANCE = 0.5f;
        private final float start;
        private final float end;

        ColumnBoundary(float start, float end) {
            this.start = Math.min(start, end);
            this.end = Math.max(start, end);
        }

        boolean contains(float value, boolean last) {
            if (last) {
                return value >= start - TOLERANCE && value <= end + TOLERANCE;
            }
            return value >= start - TOLERANCE && value < end - TOLERANCE;
        }
    }
}
