package com.example.prospectus.application.service.financial;

import java.util.List;

/**
 * Column header row of a financial table.
 *
 * @param periods       normalized period labels, left to right ("FY2023", "Q1 FY2024", "Mar-2023")
 * @param anchors       horizontal centre of each period label; empty when the row carried no layout
 * @param hasNoteColumn whether the row announces a "Note" column ahead of the periods
 */
public record PeriodHeader(List<String> periods, List<Float> anchors, boolean hasNoteColumn) {

    public PeriodHeader {
        periods = List.copyOf(periods);
        anchors = anchors == null ? List.of() : List.copyOf(anchors);
    }

    public int size() {
        return periods.size();
    }

    public boolean positioned() {
        return anchors.size() == periods.size() && !anchors.isEmpty();
    }
}
