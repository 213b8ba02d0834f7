package com.hydralog.backend.logging.model;

import com.hydralog.backend.schedule.model.TreatmentType;

import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Local snapshot of what one (user, pet) logged on {@code date}. Valid only for that calendar day.
 * Rings keep the newest timestamps per medication name, oldest evicted first.
 */
public record DailySummaryCache(
        LocalDate date,
        int medicationSessionCount,
        int fluidSessionCount,
        Map<String, List<Instant>> recentMedicationTimes,
        Map<String, List<Instant>> completedMedicationTimes,
        int totalMedicationDosesGiven,
        double totalFluidVolumeGiven
) {
    public DailySummaryCache {
        recentMedicationTimes = copy(recentMedicationTimes);
        completedMedicationTimes = copy(completedMedicationTimes);
    }

    public static DailySummaryCache empty(LocalDate date) {
        return new DailySummaryCache(date, 0, 0, Map.of(), Map.of(), 0, 0);
    }

    public boolean isFor(LocalDate day) {
        return date != null && date.equals(day);
    }

    public boolean hasAnySessions() {
        return medicationSessionCount > 0 || fluidSessionCount > 0;
    }

    public List<Instant> recentTimes(String medicationName) {
        return recentMedicationTimes.getOrDefault(medicationName, List.of());
    }

    public List<Instant> completedTimes(String medicationName) {
        return completedMedicationTimes.getOrDefault(medicationName, List.of());
    }

    public DailySummaryCache withSession(SessionFacts f, int ringSize) {
        if (f.treatmentType() == TreatmentType.FLUID) {
            return new DailySummaryCache(date, medicationSessionCount, fluidSessionCount + 1,
                    recentMedicationTimes, completedMedicationTimes, totalMedicationDosesGiven,
                    totalFluidVolumeGiven + f.volumeGiven());
        }
        Map<String, List<Instant>> recent = push(recentMedicationTimes, f.medicationName(), f.dateTime(), ringSize);
        Map<String, List<Instant>> completed = f.completed()
                ? push(completedMedicationTimes, f.medicationName(), f.dateTime(), ringSize)
                : completedMedicationTimes;
        return new DailySummaryCache(date, medicationSessionCount + 1, fluidSessionCount,
                recent, completed, totalMedicationDosesGiven + (f.completed() ? 1 : 0), totalFluidVolumeGiven);
    }

    /** Reverses {@link #withSession}; counters never go below zero. */
    public DailySummaryCache withoutSession(SessionFacts f) {
        if (f.treatmentType() == TreatmentType.FLUID) {
            return new DailySummaryCache(date, medicationSessionCount, Math.max(0, fluidSessionCount - 1),
                    recentMedicationTimes, completedMedicationTimes, totalMedicationDosesGiven,
                    Math.max(0, totalFluidVolumeGiven - f.volumeGiven()));
        }
        Map<String, List<Instant>> recent = pull(recentMedicationTimes, f.medicationName(), f.dateTime());
        Map<String, List<Instant>> completed = f.completed()
                ? pull(completedMedicationTimes, f.medicationName(), f.dateTime())
                : completedMedicationTimes;
        return new DailySummaryCache(date, Math.max(0, medicationSessionCount - 1), fluidSessionCount,
                recent, completed, Math.max(0, totalMedicationDosesGiven - (f.completed() ? 1 : 0)),
                totalFluidVolumeGiven);
    }

    private static Map<String, List<Instant>> push(Map<String, List<Instant>> rings, String name,
                                                   Instant t, int ringSize) {
        Map<String, List<Instant>> out = new LinkedHashMap<>(rings);
        List<Instant> ring = new ArrayList<>(rings.getOrDefault(name, List.of()));
        ring.add(t);
        while (ring.size() > ringSize) ring.remove(0);
        out.put(name, List.copyOf(ring));
        return out;
    }

    private static Map<String, List<Instant>> pull(Map<String, List<Instant>> rings, String name, Instant t) {
        List<Instant> ring = rings.get(name);
        if (ring == null || !ring.contains(t)) return rings;
        Map<String, List<Instant>> out = new LinkedHashMap<>(rings);
        List<Instant> next = new ArrayList<>(ring);
        next.remove(t);
        if (next.isEmpty()) out.remove(name);
        else out.put(name, List.copyOf(next));
        return out;
    }

    private static Map<String, List<Instant>> copy(Map<String, List<Instant>> in) {
        if (in == null || in.isEmpty()) return Map.of();
        Map<String, List<Instant>> out = new LinkedHashMap<>();
        in.forEach((k, v) -> out.put(k, v == null ? List.of() : List.copyOf(v)));
        return Collections.unmodifiableMap(out);
    }
}
