package com.hydralog.backend.logging.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.hydralog.backend.schedule.model.Schedule;
import com.hydralog.backend.schedule.model.TreatmentType;

import java.time.Instant;
import java.util.UUID;

public record MedicationSession(
        String id,
        Long userId,
        String petId,
        Instant dateTime,
        String medicationName,
        double dosageGiven,
        double dosageScheduled,
        String medicationUnit,
        boolean completed,
        String scheduleId,
        Instant scheduledTime,
        String notes,
        Instant createdAt,
        Instant updatedAt
) implements TreatmentSession {

    /** Completed dose synthesized from a schedule reminder. */
    public static MedicationSession fromSchedule(Schedule schedule, Long userId, String petId,
                                                 Instant dateTime, Instant scheduledTime) {
        double target = schedule.targetDosage() == null ? 1.0 : schedule.targetDosage();
        return new MedicationSession(
                UUID.randomUUID().toString(), userId, petId, dateTime,
                schedule.medicationName(), target, target, schedule.medicationUnit(), true,
                schedule.id(), scheduledTime, null, null, null);
    }

    @Override
    @JsonIgnore
    public TreatmentType treatmentType() {
        return TreatmentType.MEDICATION;
    }

    @Override
    public MedicationSession withSchedule(ScheduleMatch match) {
        return new MedicationSession(id, userId, petId, dateTime, medicationName, dosageGiven, dosageScheduled,
                medicationUnit, completed, match.scheduleId(), match.scheduledTime(), notes, createdAt, updatedAt);
    }

    @Override
    public MedicationSession withServerTimestamps(Instant createdAt, Instant updatedAt) {
        return new MedicationSession(id, userId, petId, dateTime, medicationName, dosageGiven, dosageScheduled,
                medicationUnit, completed, scheduleId, scheduledTime, notes, createdAt, updatedAt);
    }
}
