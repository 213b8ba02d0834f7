package com.hydralog.backend.logging.summary;

/**
 * What one logging operation applies to the day / week / month rollups.
 *
 * <p>Delta fields are commutative increments (null = untouched). The schedule fields are per-period
 * constants and are only present when the matching sentinel was still unset:
 * <ul>
 *   <li>{@code medicationScheduledDoses}, {@code fluidScheduledSessions}, {@code fluidDailyGoalMl}:
 *       written once on the daily row and added once into the weekly and monthly totals</li>
 *   <li>{@code fluidWeeklyGoalMl}: written once on the weekly row</li>
 *   <li>{@code monthDay*}: written once into the monthly per-day slot {@code dayOfMonth}</li>
 * </ul>
 */
public record SummaryUpdateDto(
        Integer medicationDosesDelta,
        Integer medicationMissedDelta,
        Double fluidVolumeDelta,
        Integer fluidSessionDelta,
        Boolean fluidTreatmentDone,
        Integer medicationScheduledDoses,
        Integer fluidScheduledSessions,
        Double fluidDailyGoalMl,
        Double fluidWeeklyGoalMl,
        Integer monthDayMedicationScheduledDoses,
        Integer monthDayFluidScheduledSessions,
        Double monthDayFluidGoalMl,
        int dayOfMonth
) {

    public static SummaryUpdateDto none(int dayOfMonth) {
        return new SummaryUpdateDto(null, null, null, null, null,
                null, null, null, null, null, null, null, dayOfMonth);
    }

    public boolean hasDeltas() {
        return medicationDosesDelta != null
                || medicationMissedDelta != null
                || fluidVolumeDelta != null
                || fluidSessionDelta != null
                || fluidTreatmentDone != null;
    }

    public boolean hasScheduleConstants() {
        return medicationScheduledDoses != null
                || fluidScheduledSessions != null
                || fluidDailyGoalMl != null
                || fluidWeeklyGoalMl != null
                || monthDayMedicationScheduledDoses != null
                || monthDayFluidScheduledSessions != null
                || monthDayFluidGoalMl != null;
    }

    /** False when nothing aggregable changed; the caller then writes only the session row. */
    public boolean hasUpdates() {
        return hasDeltas() || hasScheduleConstants();
    }

    public boolean recordsDailyMedicationSchedule() {
        return medicationScheduledDoses != null;
    }

    public boolean recordsDailyFluidSchedule() {
        return fluidScheduledSessions != null || fluidDailyGoalMl != null;
    }

    public boolean recordsMonthDayMedicationSchedule() {
        return monthDayMedicationScheduledDoses != null;
    }

    public boolean recordsMonthDayFluidSchedule() {
        return monthDayFluidScheduledSessions != null || monthDayFluidGoalMl != null;
    }

    public int medicationDosesOrZero() { return medicationDosesDelta == null ? 0 : medicationDosesDelta; }
    public int medicationMissedOrZero() { return medicationMissedDelta == null ? 0 : medicationMissedDelta; }
    public double fluidVolumeOrZero() { return fluidVolumeDelta == null ? 0 : fluidVolumeDelta; }
    public int fluidSessionsOrZero() { return fluidSessionDelta == null ? 0 : fluidSessionDelta; }
    public int medicationScheduledOrZero() { return medicationScheduledDoses == null ? 0 : medicationScheduledDoses; }
    public int fluidScheduledSessionsOrZero() { return fluidScheduledSessions == null ? 0 : fluidScheduledSessions; }
}
