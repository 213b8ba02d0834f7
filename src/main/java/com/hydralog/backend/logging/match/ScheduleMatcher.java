package com.hydralog.backend.logging.match;

import com.hydralog.backend.config.TreatmentLoggingProperties;
import com.hydralog.backend.logging.model.MedicationSession;
import com.hydralog.backend.logging.model.ScheduleMatch;
import com.hydralog.backend.logging.model.TreatmentSession;
import com.hydralog.backend.schedule.model.Schedule;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZoneId;
import java.util.List;
import java.util.Objects;

/**
 * Links a session to the closest reminder of a compatible schedule within the tolerance.
 * Medication schedules must carry the exact same name; fluid schedules match on type alone.
 * Ties keep the first reminder found in schedule order. No match is a normal manual log.
 */
@Slf4j
@Component
public class ScheduleMatcher {

    private final Duration tolerance;

    @Autowired
    public ScheduleMatcher(TreatmentLoggingProperties props) {
        this(props.getMatch().getTolerance());
    }

    public ScheduleMatcher(Duration tolerance) {
        this.tolerance = tolerance;
    }

    public ScheduleMatch match(TreatmentSession session, List<Schedule> schedules, ZoneId zone) {
        LocalDate sessionDate = session.dateTime().atZone(zone).toLocalDate();

        String bestScheduleId = null;
        Instant bestTime = null;
        Duration bestDiff = null;

        for (Schedule schedule : schedules) {
            if (!compatible(session, schedule)) continue;

            for (LocalTime reminder : schedule.reminderTimes()) {
                Instant projected = sessionDate.atTime(reminder).atZone(zone).toInstant();
                Duration diff = Duration.between(projected, session.dateTime()).abs();
                if (diff.compareTo(tolerance) > 0) continue;
                if (bestDiff == null || diff.compareTo(bestDiff) < 0) {
                    bestDiff = diff;
                    bestTime = projected;
                    bestScheduleId = schedule.id();
                }
            }
        }

        if (bestScheduleId == null) {
            log.debug("no schedule match for session {} at {}", session.id(), session.dateTime());
            return ScheduleMatch.none();
        }
        log.debug("session {} matched schedule {} at {}", session.id(), bestScheduleId, bestTime);
        return new ScheduleMatch(bestScheduleId, bestTime);
    }

    private static boolean compatible(TreatmentSession session, Schedule schedule) {
        if (schedule.treatmentType() != session.treatmentType()) return false;
        if (session instanceof MedicationSession m) {
            return Objects.equals(schedule.medicationName(), m.medicationName());
        }
        return true;
    }
}
