package com.example.prospectus.application.service.financial;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class PeriodOrderingTest {

    @Test
    void ordersFiscalYearsOldestFirst() {
        assertThat(PeriodOrdering.ascending(List.of("FY2023", "FY2021", "FY2022")))
                .containsExactly("FY2021", "FY2022", "FY2023");
        assertThat(PeriodOrdering.latest(List.of("FY2022", "FY2023"))).isEqualTo("FY2023");
    }

    @Test
    void quartersAndDatesShareOneTimeline() {
        assertThat(PeriodOrdering.ascending(List.of("Q1 FY2024", "FY2023", "Dec-2022")))
                .containsExactly("Dec-2022", "FY2023", "Q1 FY2024");
    }

    @Test
    void positionalLabelsTreatP1AsLatest() {
        assertThat(PeriodOrdering.ascending(List.of("P1", "P2", "P3"))).containsExactly("P3", "P2", "P1");
        assertThat(PeriodOrdering.latest(List.of("P1", "P2"))).isEqualTo("P1");
    }

    @Test
    void unknownLabelsFallBackToReverseDocumentOrder() {
        assertThat(PeriodOrdering.ascending(List.of("Current", "FY2022"))).containsExactly("FY2022", "Current");
        assertThat(PeriodOrdering.latest(List.of())).isNull();
    }
}
