package com.hydralog.backend.logging.context;

import com.hydralog.backend.logging.model.DailySummaryCache;

import java.time.ZoneId;

/** {@code todaySummary} is null until loaded, and stays null when the cache had nothing for today. */
public record ContextState(
        Long userId,
        boolean authReady,
        String petId,
        ZoneId zone,
        boolean cacheLoaded,
        DailySummaryCache todaySummary
) {
    public static ContextState initial(Long userId) {
        return new ContextState(userId, false, null, null, false, null);
    }

    public boolean ready() {
        return authReady && petId != null;
    }

    ContextState withAuth() {
        return new ContextState(userId, true, petId, zone, cacheLoaded, todaySummary);
    }

    ContextState withPet(String nextPet, ZoneId nextZone, boolean keepLoaded) {
        return new ContextState(userId, authReady, nextPet, nextZone,
                keepLoaded && cacheLoaded, keepLoaded ? todaySummary : null);
    }

    ContextState loaded(DailySummaryCache summary) {
        return new ContextState(userId, authReady, petId, zone, true, summary);
    }
}
