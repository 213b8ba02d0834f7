package com.hydralog.backend.logging.service;

import com.hydralog.backend.logging.model.ScheduleMatch;

import java.util.List;

public record LogResult(String sessionId, ScheduleMatch scheduleMatch, List<String> warnings) {

    public LogResult {
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
    }
}
