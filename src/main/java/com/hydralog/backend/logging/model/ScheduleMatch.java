package com.hydralog.backend.logging.model;

import java.time.Instant;

/** Both fields set (matched) or both null (manual log). */
public record ScheduleMatch(String scheduleId, Instant scheduledTime) {

    private static final ScheduleMatch NONE = new ScheduleMatch(null, null);

    public ScheduleMatch {
        if ((scheduleId == null) != (scheduledTime == null)) {
            throw new IllegalArgumentException("scheduleId and scheduledTime must be set together");
        }
    }

    public static ScheduleMatch none() {
        return NONE;
    }

    public boolean matched() {
        return scheduleId != null;
    }
}
