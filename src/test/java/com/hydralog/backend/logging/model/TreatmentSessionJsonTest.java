package com.hydralog.backend.logging.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.hydralog.backend.logging.queue.LoggingCommand;
import com.hydralog.backend.schedule.model.FluidLocation;
import org.junit.jupiter.api.Test;

import static com.hydralog.backend.logging.testsupport.TestFixtures.*;
import static org.junit.jupiter.api.Assertions.*;

class TreatmentSessionJsonTest {

    private final ObjectMapper om = new ObjectMapper().findAndRegisterModules();

    @Test
    void session_kind_discriminates_the_subtype() throws Exception {
        String json = om.writeValueAsString(fluid("f1", 120, at("08:00")));

        JsonNode node = om.readTree(json);
        assertEquals("fluid", node.get("kind").asText());
        assertEquals("low", node.get("stressLevel").asText());
        assertFalse(node.has("treatmentType"));

        TreatmentSession back = om.readValue(json, TreatmentSession.class);
        assertInstanceOf(FluidSession.class, back);
        assertEquals(120.0, ((FluidSession) back).volumeGiven());
        assertEquals(StressLevel.LOW, ((FluidSession) back).stressLevel());
    }

    @Test
    void medication_survives_a_round_trip_with_every_field_set() throws Exception {
        MedicationSession session = new MedicationSession("m1", USER, PET, at("08:10"), "Benazepril",
                0.5, 1.0, "mg", true, "s-med", at("08:00"), "half dose, vomited earlier", null, null);

        TreatmentSession back = om.readValue(om.writeValueAsString(session), TreatmentSession.class);

        assertEquals(session, back);
    }

    @Test
    void fluid_survives_a_round_trip_with_every_field_set() throws Exception {
        FluidSession session = new FluidSession("f1", USER, PET, at("07:20"), 150,
                FluidLocation.HIP_BONES_LEFT, StressLevel.HIGH, "s-fluid", at("07:00"), "needle changed", null, null);

        TreatmentSession back = om.readValue(om.writeValueAsString(session), TreatmentSession.class);

        assertEquals(session, back);
    }

    @Test
    void queued_command_keeps_its_type_and_session() throws Exception {
        LoggingCommand cmd = new LoggingCommand.CreateMedication(USER, PET, "Europe/Paris",
                med("m1", "Benazepril", at("08:00"), true));

        String json = om.writeValueAsString(cmd);
        assertEquals("createMedication", om.readTree(json).get("type").asText());

        LoggingCommand back = om.readValue(json, LoggingCommand.class);
        assertEquals(cmd, back);
        assertEquals("m1", back.sessionId());
        assertEquals("Europe/Paris", back.zone().getId());
    }

    @Test
    void unknown_stress_level_is_rejected() {
        assertThrows(IllegalArgumentException.class, () -> StressLevel.fromWire("extreme"));
        assertEquals(StressLevel.HIGH, StressLevel.fromWire("HIGH"));
    }
}
