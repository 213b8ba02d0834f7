package com.hydralog.backend.logging.dto;

import java.util.List;

/** Monthly totals plus per-day arrays; index 0 is the 1st, length is the month's length. */
public record MonthlySummaryView(
        SummaryView totals,
        List<Double> dailyVolumes,
        List<Double> dailyGoals,
        List<Integer> dailyScheduledSessions,
        List<Integer> dailyMedicationDoses,
        List<Integer> dailyMedicationScheduledDoses
) {
}
