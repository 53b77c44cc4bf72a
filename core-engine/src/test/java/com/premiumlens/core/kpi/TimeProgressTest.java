package com.premiumlens.core.kpi;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

/**
 * Unit tests for {@link TimeProgress}.
 */
class TimeProgressTest {

    @Test
    @DisplayName("Should close week 1 on the first Saturday of the year")
    void shouldEndFirstWeekOnFirstSaturday() {
        assertThat(TimeProgress.endOfWeek(2024, 1)).isEqualTo(LocalDate.of(2024, 1, 6));
        assertThat(TimeProgress.endOfWeek(2023, 1)).isEqualTo(LocalDate.of(2023, 1, 7));
        assertThat(TimeProgress.endOfWeek(2022, 1)).isEqualTo(LocalDate.of(2022, 1, 1));
        assertThat(TimeProgress.endOfWeek(2024, 24)).isEqualTo(LocalDate.of(2024, 6, 15));
    }

    @Test
    @DisplayName("Should count elapsed days inclusively over the year length")
    void shouldComputeProgress() {
        assertThat(TimeProgress.forWeek(2024, 1)).isCloseTo(6.0 / 366, within(1e-12));
        assertThat(TimeProgress.forWeek(2023, 1)).isCloseTo(7.0 / 365, within(1e-12));
        assertThat(TimeProgress.forWeek(2024, 26)).isCloseTo(181.0 / 366, within(1e-12));
    }

    @Test
    @DisplayName("Should cap progress at 1 past the end of the year")
    void shouldCapAtOne() {
        assertThat(TimeProgress.forWeek(2024, 53)).isEqualTo(1.0);
        assertThat(TimeProgress.forWeek(2024, 80)).isEqualTo(1.0);
    }

    @Test
    @DisplayName("Should reject weeks below 1")
    void shouldRejectWeekZero() {
        assertThatThrownBy(() -> TimeProgress.forWeek(2024, 0))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("week must be >= 1");
    }
}
