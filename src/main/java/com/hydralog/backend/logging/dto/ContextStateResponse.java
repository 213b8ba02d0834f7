package com.hydralog.backend.logging.dto;

import com.hydralog.backend.logging.context.ContextState;
import com.hydralog.backend.logging.model.DailySummaryCache;

public record ContextStateResponse(
        boolean authReady,
        String petId,
        String timezone,
        boolean cacheLoaded,
        DailySummaryCache todaySummary
) {
    public static ContextStateResponse of(ContextState s) {
        return new ContextStateResponse(s.authReady(), s.petId(),
                s.zone() == null ? null : s.zone().getId(), s.cacheLoaded(), s.todaySummary());
    }
}
