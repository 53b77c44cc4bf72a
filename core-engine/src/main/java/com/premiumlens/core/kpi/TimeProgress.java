package com.premiumlens.core.kpi;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.time.temporal.TemporalAdjusters;

/**
 * Share of the calendar year elapsed at the end of a reporting week.
 *
 * <p>
 * Reporting weeks end on Saturday. Week 1 ends on the first Saturday on or
 * after 1 January; week <i>n</i> ends {@code 7·(n−1)} days later. The
 * progress is the number of days from 1 January through that Saturday,
 * divided by the length of the year and capped at 1.
 * </p>
 *
 * @since 1.0.0
 */
public final class TimeProgress {

    private TimeProgress() {
        // utility class
    }

    /**
     * @param year calendar year
     * @param week reporting week, 1-based
     * @return progress in {@code (0, 1]}
     * @throws IllegalArgumentException if {@code week < 1}
     */
    public static double forWeek(int year, int week) {
        if (week < 1) {
            throw new IllegalArgumentException("week must be >= 1, got: " + week);
        }
        LocalDate january1 = LocalDate.of(year, 1, 1);
        LocalDate weekEnd = endOfWeek(year, week);
        long elapsedDays = ChronoUnit.DAYS.between(january1, weekEnd) + 1;
        return Math.min(1.0, (double) elapsedDays / january1.lengthOfYear());
    }

    /**
     * @return the Saturday closing the given reporting week
     */
    public static LocalDate endOfWeek(int year, int week) {
        LocalDate firstSaturday = LocalDate.of(year, 1, 1).with(TemporalAdjusters.nextOrSame(DayOfWeek.SATURDAY));
        return firstSaturday.plusWeeks(week - 1L);
    }
}
