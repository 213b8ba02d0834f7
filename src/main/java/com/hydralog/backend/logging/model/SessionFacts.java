package com.hydralog.backend.logging.model;

import com.hydralog.backend.schedule.model.TreatmentType;

import java.time.Instant;

/** The part of a session the local summary cache keeps. */
public record SessionFacts(
        TreatmentType treatmentType,
        String medicationName,
        Instant dateTime,
        boolean completed,
        double volumeGiven
) {
    public static SessionFacts of(TreatmentSession session) {
        if (session instanceof MedicationSession m) {
            return new SessionFacts(TreatmentType.MEDICATION, m.medicationName(), m.dateTime(), m.completed(), 0);
        }
        FluidSession f = (FluidSession) session;
        return new SessionFacts(TreatmentType.FLUID, null, f.dateTime(), false, f.volumeGiven());
    }
}
