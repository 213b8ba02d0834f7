package com.hydralog.backend.logging.validation;

import com.hydralog.backend.logging.model.FluidSession;
import com.hydralog.backend.logging.model.MedicationSession;
import com.hydralog.backend.logging.model.TreatmentSession;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;

/** Rules every session must satisfy before anything is written. */
@Component
public class StructuralSessionValidator {

    static final double MAX_DOSAGE = 100;
    static final double MIN_VOLUME_ML = 1;
    static final double MAX_VOLUME_ML = 500;

    private final Clock clock;

    public StructuralSessionValidator(Clock clock) {
        this.clock = clock;
    }

    public ValidationResult validate(TreatmentSession session) {
        List<String> errors = new ArrayList<>();

        if (isBlank(session.id())) errors.add("Session id is required");
        if (session.userId() == null) errors.add("User id is required");
        if (isBlank(session.petId())) errors.add("Pet id is required");

        if (session.dateTime() == null) {
            errors.add("Treatment time is required");
        } else if (session.dateTime().isAfter(clock.instant())) {
            errors.add("Cannot log a treatment for a future time");
        }

        if ((session.scheduleId() == null) != (session.scheduledTime() == null)) {
            errors.add("scheduleId and scheduledTime must be set together");
        }

        if (session instanceof MedicationSession m) {
            medication(m, errors);
        } else if (session instanceof FluidSession f) {
            fluid(f, errors);
        }
        return new ValidationResult(errors, List.of());
    }

    private static void medication(MedicationSession m, List<String> errors) {
        if (m.medicationName() == null || m.medicationName().trim().length() < 2) {
            errors.add("Medication name must be at least 2 characters");
        }
        if (isBlank(m.medicationUnit())) {
            errors.add("Medication unit is required");
        }
        if (m.dosageGiven() < 0) {
            errors.add("Dosage cannot be negative");
        } else if (m.dosageGiven() > MAX_DOSAGE) {
            errors.add("Dosage of " + m.dosageGiven() + " " + m.medicationUnit() + " is unrealistically high");
        }
        if (m.dosageScheduled() <= 0) {
            errors.add("Scheduled dosage must be greater than 0");
        }
    }

    private static void fluid(FluidSession f, List<String> errors) {
        if (f.volumeGiven() < MIN_VOLUME_ML || f.volumeGiven() > MAX_VOLUME_ML) {
            errors.add("Fluid volume must be between 1 and 500 ml");
        }
        if (f.injectionSite() == null) {
            errors.add("Injection site is required");
        }
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
