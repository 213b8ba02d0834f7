package com.hydralog.backend.logging.duplicate;

import com.hydralog.backend.config.TreatmentLoggingProperties;
import com.hydralog.backend.logging.model.MedicationSession;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

import static com.hydralog.backend.logging.testsupport.TestFixtures.*;
import static org.junit.jupiter.api.Assertions.*;

class DuplicateDetectorTest {

    private final DuplicateDetector detector = new DuplicateDetector(new TreatmentLoggingProperties());

    private final MedicationSession existing = med("e1", "Benazepril", at("15:00"), true);

    @Test
    void within_fifteen_minutes_is_a_duplicate() {
        Optional<MedicationSession> dup = detector.findDuplicate(
                med("n", "Benazepril", at("15:15"), true), List.of(existing));
        assertEquals(Optional.of(existing), dup);
    }

    @Test
    void sixteen_minutes_apart_is_not() {
        assertTrue(detector.findDuplicate(med("n", "Benazepril", at("15:16"), true), List.of(existing)).isEmpty());
        assertTrue(detector.findDuplicate(med("n", "Benazepril", at("14:44"), true), List.of(existing)).isEmpty());
    }

    @Test
    void different_medication_is_never_a_duplicate() {
        assertTrue(detector.findDuplicate(med("n", "Mirtazapine", at("15:00"), true), List.of(existing)).isEmpty());
    }

    @Test
    void fluids_are_never_duplicates() {
        assertTrue(detector.findDuplicate(fluid("f", 100, at("15:00")), List.of(existing)).isEmpty());
    }

    @Test
    void custom_window() {
        assertTrue(detector.findDuplicate(med("n", "Benazepril", at("15:20"), true), List.of(existing),
                Duration.ofMinutes(30)).isPresent());
    }
}
