package com.hydralog.backend.logging.quicklog;

import com.hydralog.backend.config.TreatmentLoggingProperties;
import com.hydralog.backend.logging.error.NoSchedulesTodayException;
import com.hydralog.backend.logging.error.ReconciliationEmptyException;
import com.hydralog.backend.logging.model.DailySummaryCache;
import com.hydralog.backend.logging.model.FluidSession;
import com.hydralog.backend.logging.model.MedicationSession;
import com.hydralog.backend.schedule.model.Schedule;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Computes exactly the sessions still missing today.
 *
 * <p>Medication: every reminder of today not covered by a completed dose of the same name within the
 * match tolerance gets a completed session. Each completed dose covers at most one reminder.
 * Synthesized doses are stamped {@code min(reminder, now)} and keep the reminder as scheduled time.
 *
 * <p>Fluid: the volume already logged is consumed schedule by schedule; the rest of each schedule's
 * daily target becomes catch-up sessions at {@code now}, none above the per-session maximum.
 */
@Slf4j
@Component
public class QuickLogReconciler {

    static final double MAX_FLUID_SESSION_ML = 500;
    static final double MIN_FLUID_SESSION_ML = 1;

    private final Duration tolerance;

    @Autowired
    public QuickLogReconciler(TreatmentLoggingProperties props) {
        this(props.getMatch().getTolerance());
    }

    public QuickLogReconciler(Duration tolerance) {
        this.tolerance = tolerance;
    }

    public QuickLogPlan reconcile(Long userId, String petId, List<Schedule> schedules, DailySummaryCache snapshot,
                                  Instant now, ZoneId zone) {
        LocalDate today = now.atZone(zone).toLocalDate();
        DailySummaryCache logged = (snapshot != null && snapshot.isFor(today)) ? snapshot : DailySummaryCache.empty(today);

        List<Schedule> due = schedules.stream()
                .filter(Schedule::active)
                .filter(s -> s.hasReminderOn(today, zone))
                .toList();
        if (due.isEmpty()) throw new NoSchedulesTodayException();

        List<MedicationSession> medications = new ArrayList<>();
        Map<String, List<Instant>> unusedCompleted = new HashMap<>();

        double loggedVolume = logged.totalFluidVolumeGiven();
        List<FluidSession> fluids = new ArrayList<>();

        for (Schedule schedule : due) {
            List<Instant> reminders = schedule.reminderTimesOn(today, zone);

            if (schedule.isMedication()) {
                List<Instant> pool = unusedCompleted.computeIfAbsent(schedule.medicationName(),
                        name -> new ArrayList<>(logged.completedTimes(name)));
                for (Instant reminder : reminders) {
                    if (consumeNearest(pool, reminder)) continue;
                    Instant at = reminder.isAfter(now) ? now : reminder;
                    medications.add(MedicationSession.fromSchedule(schedule, userId, petId, at, reminder));
                }
            } else if (schedule.isFluid()) {
                double target = schedule.fluidGoalOn(today, zone);
                double covered = Math.min(loggedVolume, target);
                loggedVolume -= covered;
                double remainder = target - covered;
                if (remainder < MIN_FLUID_SESSION_ML) continue;

                Instant firstReminder = reminders.get(0);
                while (remainder >= MIN_FLUID_SESSION_ML) {
                    double volume = Math.min(remainder, MAX_FLUID_SESSION_ML);
                    fluids.add(FluidSession.catchUp(schedule, userId, petId, now, firstReminder, volume));
                    remainder -= volume;
                }
            }
        }

        QuickLogPlan plan = new QuickLogPlan(medications, fluids);
        if (plan.isEmpty()) throw new ReconciliationEmptyException();
        log.debug("quick-log plan user={} pet={} medications={} fluids={}",
                userId, petId, medications.size(), fluids.size());
        return plan;
    }

    /** Removes and reports the completed time closest to the reminder within tolerance, if any. */
    private boolean consumeNearest(List<Instant> pool, Instant reminder) {
        int best = -1;
        Duration bestDiff = null;
        for (int i = 0; i < pool.size(); i++) {
            Duration diff = Duration.between(pool.get(i), reminder).abs();
            if (diff.compareTo(tolerance) > 0) continue;
            if (bestDiff == null || diff.compareTo(bestDiff) < 0) {
                best = i;
                bestDiff = diff;
            }
        }
        if (best < 0) return false;
        pool.remove(best);
        return true;
    }
}
