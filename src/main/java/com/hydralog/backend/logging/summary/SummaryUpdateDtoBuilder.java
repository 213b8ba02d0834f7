package com.hydralog.backend.logging.summary;

import com.hydralog.backend.logging.model.FluidSession;
import com.hydralog.backend.logging.model.MedicationSession;
import com.hydralog.backend.logging.model.TreatmentSession;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.util.List;
import java.util.Objects;

/**
 * Builds {@link SummaryUpdateDto}s. Counters are always deltas; schedule constants are only
 * included while the corresponding sentinel is unset and the constant is non-zero.
 */
@Component
public class SummaryUpdateDtoBuilder {

    public SummaryUpdateDto fromNewSession(TreatmentSession session, LocalDate day,
                                           ScheduledDayConstants constants, SetOnceFlags flags) {
        if (session instanceof MedicationSession m) {
            return withConstants(
                    m.completed() ? 1 : 0,
                    m.completed() ? 0 : 1,
                    null, null, null,
                    day, constants, flags);
        }
        FluidSession f = (FluidSession) session;
        return withConstants(null, null, f.volumeGiven(), 1, Boolean.TRUE, day, constants, flags);
    }

    /**
     * Delta between two versions of the same session. Schedule constants never move on an edit.
     * Returns a dto without updates when only non-aggregable fields (notes, site, dosage) changed.
     */
    public SummaryUpdateDto fromEditDelta(TreatmentSession oldSession, TreatmentSession newSession, LocalDate day) {
        if (oldSession.treatmentType() != newSession.treatmentType()) {
            throw new IllegalArgumentException("SESSION_TYPE_MISMATCH");
        }
        if (oldSession instanceof MedicationSession oldMed) {
            MedicationSession newMed = (MedicationSession) newSession;
            int doses = (newMed.completed() ? 1 : 0) - (oldMed.completed() ? 1 : 0);
            if (doses == 0) return SummaryUpdateDto.none(day.getDayOfMonth());
            return new SummaryUpdateDto(doses, -doses, null, null, null,
                    null, null, null, null, null, null, null, day.getDayOfMonth());
        }
        FluidSession oldFluid = (FluidSession) oldSession;
        FluidSession newFluid = (FluidSession) newSession;
        double volume = newFluid.volumeGiven() - oldFluid.volumeGiven();
        if (volume == 0) return SummaryUpdateDto.none(day.getDayOfMonth());
        return new SummaryUpdateDto(null, null, volume, null, null,
                null, null, null, null, null, null, null, day.getDayOfMonth());
    }

    /** One dto for a whole batch; the constants are resolved once for the batch. */
    public SummaryUpdateDto fromBulkSessions(List<MedicationSession> medications, List<FluidSession> fluids,
                                             LocalDate day, ScheduledDayConstants constants, SetOnceFlags flags) {
        Integer doses = null;
        Integer missed = null;
        if (!medications.isEmpty()) {
            int completed = (int) medications.stream().filter(MedicationSession::completed).count();
            doses = completed;
            missed = medications.size() - completed;
        }

        Double volume = null;
        Integer sessions = null;
        Boolean done = null;
        if (!fluids.isEmpty()) {
            volume = fluids.stream().mapToDouble(FluidSession::volumeGiven).sum();
            sessions = fluids.size();
            done = Boolean.TRUE;
        }
        return withConstants(doses, missed, volume, sessions, done, day, constants, flags);
    }

    /** Negated counters of a removed session. Schedule constants stay recorded. */
    public SummaryUpdateDto fromDeletion(TreatmentSession session, LocalDate day) {
        if (session instanceof MedicationSession m) {
            return new SummaryUpdateDto(
                    m.completed() ? -1 : 0,
                    m.completed() ? 0 : -1,
                    null, null, null, null, null, null, null, null, null, null, day.getDayOfMonth());
        }
        FluidSession f = (FluidSession) session;
        return new SummaryUpdateDto(null, null, -f.volumeGiven(), -1, null,
                null, null, null, null, null, null, null, day.getDayOfMonth());
    }

    private SummaryUpdateDto withConstants(Integer doses, Integer missed, Double volume, Integer sessions,
                                           Boolean done, LocalDate day,
                                           ScheduledDayConstants constants, SetOnceFlags flags) {
        Objects.requireNonNull(constants, "constants");
        Objects.requireNonNull(flags, "flags");

        Integer medScheduled = null;
        if (!flags.dailyMedicationRecorded() && constants.hasMedication()) {
            medScheduled = constants.medicationScheduledDoses();
        }

        Integer fluidScheduled = null;
        Double dailyGoal = null;
        if (!flags.dailyFluidRecorded() && constants.hasFluid()) {
            fluidScheduled = constants.fluidScheduledSessions();
            dailyGoal = constants.fluidDailyGoalMl();
        }

        Double weeklyGoal = null;
        if (!flags.weeklyFluidGoalRecorded() && constants.fluidWeeklyGoalMl() > 0) {
            weeklyGoal = constants.fluidWeeklyGoalMl();
        }

        Integer dayMedScheduled = null;
        if (!flags.monthDayMedicationRecorded() && constants.hasMedication()) {
            dayMedScheduled = constants.medicationScheduledDoses();
        }

        Integer dayFluidScheduled = null;
        Double dayGoal = null;
        if (!flags.monthDayFluidRecorded() && constants.hasFluid()) {
            dayFluidScheduled = constants.fluidScheduledSessions();
            dayGoal = constants.fluidDailyGoalMl();
        }

        return new SummaryUpdateDto(doses, missed, volume, sessions, done,
                medScheduled, fluidScheduled, dailyGoal, weeklyGoal,
                dayMedScheduled, dayFluidScheduled, dayGoal, day.getDayOfMonth());
    }
}
