package com.hydralog.backend.schedule.model;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.temporal.ChronoUnit;
import java.util.List;

/**
 * Read-only prescription owned by the profile feature.
 * {@code reminderTimes} are wall-clock times in the user's zone.
 */
public record Schedule(
        String id,
        TreatmentType treatmentType,
        TreatmentFrequency frequency,
        List<LocalTime> reminderTimes,
        boolean active,
        LocalDate anchorDate,
        String medicationName,
        Double targetDosage,
        String medicationUnit,
        Double targetVolume,
        FluidLocation preferredLocation
) {
    public Schedule {
        reminderTimes = (reminderTimes == null) ? List.of() : List.copyOf(reminderTimes);
        if (frequency == null) frequency = TreatmentFrequency.ONCE_DAILY;
    }

    public boolean isMedication() {
        return treatmentType == TreatmentType.MEDICATION;
    }

    public boolean isFluid() {
        return treatmentType == TreatmentType.FLUID;
    }

    /** Whether the frequency fires on {@code date}; daily frequencies always do. */
    public boolean isDueOn(LocalDate date) {
        if (frequency.isDaily() || anchorDate == null) return true;
        long days = ChronoUnit.DAYS.between(anchorDate, date);
        return days >= 0 && days % frequency.intervalDays() == 0;
    }

    /** Reminder instants on {@code date} in {@code zone}, ascending. Empty when inactive or not due. */
    public List<Instant> reminderTimesOn(LocalDate date, ZoneId zone) {
        if (!active || !isDueOn(date)) return List.of();
        return reminderTimes.stream()
                .sorted()
                .map(t -> date.atTime(t).atZone(zone).toInstant())
                .toList();
    }

    public boolean hasReminderOn(LocalDate date, ZoneId zone) {
        return !reminderTimesOn(date, zone).isEmpty();
    }

    /** Volume prescribed for {@code date}: target volume per reminder times reminders that day. */
    public double fluidGoalOn(LocalDate date, ZoneId zone) {
        if (!isFluid() || targetVolume == null) return 0;
        return targetVolume * reminderTimesOn(date, zone).size();
    }
}
