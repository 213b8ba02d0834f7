package com.hydralog.backend.logging.dto;

import com.hydralog.backend.logging.model.FluidSession;
import com.hydralog.backend.logging.model.StressLevel;
import com.hydralog.backend.schedule.model.FluidLocation;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

import java.time.Instant;
import java.util.UUID;

public record FluidSessionRequest(
        String id,
        @NotNull Instant dateTime,
        @NotNull Double volumeGiven,
        @NotNull FluidLocation injectionSite,
        StressLevel stressLevel,
        String scheduleId,
        Instant scheduledTime,
        @Size(max = 500) String notes
) {
    public FluidSession toSession(Long userId, String petId, String pathId) {
        String sessionId = pathId != null ? pathId : (id == null || id.isBlank() ? UUID.randomUUID().toString() : id);
        return new FluidSession(sessionId, userId, petId, dateTime, volumeGiven, injectionSite,
                stressLevel == null ? StressLevel.LOW : stressLevel,
                scheduleId, scheduledTime, notes, null, null);
    }
}
