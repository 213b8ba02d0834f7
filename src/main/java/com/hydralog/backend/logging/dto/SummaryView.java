package com.hydralog.backend.logging.dto;

import com.hydralog.backend.logging.entity.TreatmentSummaryEntity;
import com.hydralog.backend.logging.model.PeriodType;

import java.time.LocalDate;

/**
 * One rollup period as the client sees it. {@code fluidGoalMl} is the daily goal on a daily period and
 * the scheduled volume on a weekly period. A period nobody logged in reads as all zeros.
 */
public record SummaryView(
        PeriodType periodType,
        String periodId,
        LocalDate startDate,
        LocalDate endDate,
        int medicationTotalDoses,
        int medicationScheduledDoses,
        int medicationMissedCount,
        double fluidTotalVolume,
        int fluidSessionCount,
        int fluidScheduledSessions,
        Double fluidGoalMl,
        boolean fluidTreatmentDone,
        int overallStreak
) {
    public static SummaryView of(TreatmentSummaryEntity e) {
        Double goal = e.getPeriodType() == PeriodType.WEEKLY ? e.getFluidScheduledVolume() : e.getFluidDailyGoalMl();
        return new SummaryView(e.getPeriodType(), e.getPeriodId(), e.getStartDate(), e.getEndDate(),
                e.getMedicationTotalDoses(), e.getMedicationScheduledDoses(), e.getMedicationMissedCount(),
                e.getFluidTotalVolume(), e.getFluidSessionCount(), e.getFluidScheduledSessions(),
                goal, e.isFluidTreatmentDone(), e.getOverallStreak());
    }

    public static SummaryView empty(PeriodType type, LocalDate day) {
        return new SummaryView(type, type.periodId(day), type.startDate(day), type.endDate(day),
                0, 0, 0, 0, 0, 0, null, false, 0);
    }
}
