package com.hydralog.backend.logging.summary;

import com.hydralog.backend.common.time.PeriodIds;
import com.hydralog.backend.schedule.model.Schedule;

import java.time.LocalDate;
import java.time.ZoneId;
import java.util.List;

/**
 * Per-period constants derived from the active schedules: the day's scheduled doses and fluid sessions,
 * the day's fluid goal, and the fluid goal of the ISO week containing the day.
 */
public record ScheduledDayConstants(
        int medicationScheduledDoses,
        int fluidScheduledSessions,
        double fluidDailyGoalMl,
        double fluidWeeklyGoalMl
) {
    public static final ScheduledDayConstants NONE = new ScheduledDayConstants(0, 0, 0, 0);

    public static ScheduledDayConstants from(List<Schedule> schedules, LocalDate day, ZoneId zone) {
        int doses = 0;
        int fluidSessions = 0;
        double dailyGoal = 0;
        for (Schedule s : schedules) {
            int reminders = s.reminderTimesOn(day, zone).size();
            if (s.isMedication()) {
                doses += reminders;
            } else if (s.isFluid()) {
                fluidSessions += reminders;
                dailyGoal += s.fluidGoalOn(day, zone);
            }
        }

        double weeklyGoal = 0;
        LocalDate start = PeriodIds.weekStart(day);
        for (int i = 0; i < 7; i++) {
            LocalDate d = start.plusDays(i);
            for (Schedule s : schedules) {
                weeklyGoal += s.fluidGoalOn(d, zone);
            }
        }
        return new ScheduledDayConstants(doses, fluidSessions, dailyGoal, weeklyGoal);
    }

    public boolean hasMedication() {
        return medicationScheduledDoses > 0;
    }

    public boolean hasFluid() {
        return fluidScheduledSessions > 0;
    }
}
