package com.hydralog.backend.logging.quicklog;

import com.hydralog.backend.logging.model.FluidSession;
import com.hydralog.backend.logging.model.MedicationSession;
import com.hydralog.backend.logging.model.TreatmentSession;

import java.util.ArrayList;
import java.util.List;

/** Sessions still outstanding for today. */
public record QuickLogPlan(List<MedicationSession> medicationSessions, List<FluidSession> fluidSessions) {

    public QuickLogPlan {
        medicationSessions = List.copyOf(medicationSessions);
        fluidSessions = List.copyOf(fluidSessions);
    }

    public boolean isEmpty() {
        return medicationSessions.isEmpty() && fluidSessions.isEmpty();
    }

    public int size() {
        return medicationSessions.size() + fluidSessions.size();
    }

    public List<TreatmentSession> allSessions() {
        List<TreatmentSession> all = new ArrayList<>(size());
        all.addAll(medicationSessions);
        all.addAll(fluidSessions);
        return all;
    }
}
