package com.hydralog.backend.logging.duplicate;

import com.hydralog.backend.config.TreatmentLoggingProperties;
import com.hydralog.backend.logging.model.MedicationSession;
import com.hydralog.backend.logging.model.TreatmentSession;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * Pure duplicate check for medication doses: same name (case-sensitive) and |dt| within the window,
 * bounds inclusive. Fluid sessions are never duplicates. A miss always means "proceed".
 */
@Component
public class DuplicateDetector {

    private final Duration defaultWindow;

    public DuplicateDetector(TreatmentLoggingProperties props) {
        this.defaultWindow = props.getDuplicate().getWindow();
    }

    public Optional<MedicationSession> findDuplicate(TreatmentSession candidate, List<MedicationSession> recent) {
        return findDuplicate(candidate, recent, defaultWindow);
    }

    public Optional<MedicationSession> findDuplicate(TreatmentSession candidate, List<MedicationSession> recent,
                                                     Duration window) {
        if (!(candidate instanceof MedicationSession med)) return Optional.empty();

        for (MedicationSession existing : recent) {
            if (!med.medicationName().equals(existing.medicationName())) continue;
            Duration diff = Duration.between(existing.dateTime(), med.dateTime()).abs();
            if (diff.compareTo(window) <= 0) return Optional.of(existing);
        }
        return Optional.empty();
    }
}
