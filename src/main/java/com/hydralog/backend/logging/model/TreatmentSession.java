package com.hydralog.backend.logging.model;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import com.hydralog.backend.schedule.model.TreatmentType;

import java.time.Instant;

/**
 * One administered treatment. {@code scheduleId} and {@code scheduledTime} are both set or both null.
 * {@code createdAt}/{@code updatedAt} are assigned by the store.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "kind")
@JsonSubTypes({
        @JsonSubTypes.Type(value = MedicationSession.class, name = "medication"),
        @JsonSubTypes.Type(value = FluidSession.class, name = "fluid")
})
public sealed interface TreatmentSession permits MedicationSession, FluidSession {

    String id();

    Long userId();

    String petId();

    Instant dateTime();

    String scheduleId();

    Instant scheduledTime();

    String notes();

    Instant createdAt();

    Instant updatedAt();

    TreatmentType treatmentType();

    TreatmentSession withSchedule(ScheduleMatch match);

    TreatmentSession withServerTimestamps(Instant createdAt, Instant updatedAt);
}
