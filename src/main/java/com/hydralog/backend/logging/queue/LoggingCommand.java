package com.hydralog.backend.logging.queue;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import com.hydralog.backend.logging.model.FluidSession;
import com.hydralog.backend.logging.model.MedicationSession;

import java.time.Instant;
import java.time.ZoneId;

/** Everything needed to replay one logging entry point later, through the same code path. */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
@JsonSubTypes({
        @JsonSubTypes.Type(value = LoggingCommand.CreateMedication.class, name = "createMedication"),
        @JsonSubTypes.Type(value = LoggingCommand.CreateFluid.class, name = "createFluid"),
        @JsonSubTypes.Type(value = LoggingCommand.UpdateMedication.class, name = "updateMedication"),
        @JsonSubTypes.Type(value = LoggingCommand.UpdateFluid.class, name = "updateFluid"),
        @JsonSubTypes.Type(value = LoggingCommand.QuickLogAll.class, name = "quickLogAll")
})
public sealed interface LoggingCommand {

    Long userId();

    String petId();

    String zoneId();

    default ZoneId zone() {
        return ZoneId.of(zoneId());
    }

    /** Session the command writes; null for quick-log. */
    default String sessionId() {
        return null;
    }

    record CreateMedication(Long userId, String petId, String zoneId, MedicationSession session)
            implements LoggingCommand {
        @Override public String sessionId() { return session.id(); }
    }

    record CreateFluid(Long userId, String petId, String zoneId, FluidSession session)
            implements LoggingCommand {
        @Override public String sessionId() { return session.id(); }
    }

    record UpdateMedication(Long userId, String petId, String zoneId, MedicationSession session)
            implements LoggingCommand {
        @Override public String sessionId() { return session.id(); }
    }

    record UpdateFluid(Long userId, String petId, String zoneId, FluidSession session)
            implements LoggingCommand {
        @Override public String sessionId() { return session.id(); }
    }

    /** {@code requestedAt} pins the calendar day the user confirmed; replay never spills into a later day. */
    record QuickLogAll(Long userId, String petId, String zoneId, Instant requestedAt) implements LoggingCommand {
    }
}
