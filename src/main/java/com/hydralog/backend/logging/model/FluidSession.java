package com.hydralog.backend.logging.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.hydralog.backend.schedule.model.FluidLocation;
import com.hydralog.backend.schedule.model.Schedule;
import com.hydralog.backend.schedule.model.TreatmentType;

import java.time.Instant;
import java.util.UUID;

public record FluidSession(
        String id,
        Long userId,
        String petId,
        Instant dateTime,
        double volumeGiven,
        FluidLocation injectionSite,
        StressLevel stressLevel,
        String scheduleId,
        Instant scheduledTime,
        String notes,
        Instant createdAt,
        Instant updatedAt
) implements TreatmentSession {

    /** Catch-up session carrying {@code volume}; the schedule's first reminder of the day is kept as metadata. */
    public static FluidSession catchUp(Schedule schedule, Long userId, String petId,
                                       Instant now, Instant firstReminder, double volume) {
        FluidLocation site = schedule.preferredLocation() == null
                ? FluidLocation.SHOULDER_BLADE_MIDDLE
                : schedule.preferredLocation();
        return new FluidSession(
                UUID.randomUUID().toString(), userId, petId, now, volume, site, StressLevel.LOW,
                schedule.id(), firstReminder, null, null, null);
    }

    @Override
    @JsonIgnore
    public TreatmentType treatmentType() {
        return TreatmentType.FLUID;
    }

    @Override
    public FluidSession withSchedule(ScheduleMatch match) {
        return new FluidSession(id, userId, petId, dateTime, volumeGiven, injectionSite, stressLevel,
                match.scheduleId(), match.scheduledTime(), notes, createdAt, updatedAt);
    }

    @Override
    public FluidSession withServerTimestamps(Instant createdAt, Instant updatedAt) {
        return new FluidSession(id, userId, petId, dateTime, volumeGiven, injectionSite, stressLevel,
                scheduleId, scheduledTime, notes, createdAt, updatedAt);
    }
}
