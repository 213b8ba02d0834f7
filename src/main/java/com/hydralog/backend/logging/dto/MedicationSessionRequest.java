package com.hydralog.backend.logging.dto;

import com.hydralog.backend.logging.model.MedicationSession;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

import java.time.Instant;
import java.util.UUID;

/**
 * Body of create/update medication. {@code id} is optional on create (the client may pre-assign one so
 * an offline retry stays idempotent); {@code completed} defaults to true.
 */
public record MedicationSessionRequest(
        String id,
        @NotNull Instant dateTime,
        @NotBlank String medicationName,
        @NotNull Double dosageGiven,
        @NotNull Double dosageScheduled,
        @NotBlank String medicationUnit,
        Boolean completed,
        String scheduleId,
        Instant scheduledTime,
        @Size(max = 500) String notes
) {
    public MedicationSession toSession(Long userId, String petId, String pathId) {
        String sessionId = pathId != null ? pathId : (id == null || id.isBlank() ? UUID.randomUUID().toString() : id);
        return new MedicationSession(sessionId, userId, petId, dateTime, medicationName.trim(),
                dosageGiven, dosageScheduled, medicationUnit, completed == null || completed,
                scheduleId, scheduledTime, notes, null, null);
    }
}
