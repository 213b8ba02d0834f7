package com.hydralog.backend.logging.validation;

import com.hydralog.backend.config.TreatmentLoggingProperties;
import com.hydralog.backend.logging.model.FluidSession;
import com.hydralog.backend.logging.model.MedicationSession;
import com.hydralog.backend.logging.model.TreatmentSession;
import com.hydralog.backend.schedule.model.Schedule;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Medical plausibility warnings (app.logging.validation.strict=true).
 * A deviation counts as significant above 50% of the scheduled amount.
 */
@Component
@ConditionalOnProperty(prefix = "app.logging.validation", name = "strict", havingValue = "true")
public class MedicalWarningRuleValidator implements SessionRuleValidator {

    static final double LOW_VOLUME_ML = 50;
    static final double HIGH_VOLUME_ML = 300;
    private static final double DEVIATION_RATIO = 0.5;

    private final Duration maxDrift;

    @Autowired
    public MedicalWarningRuleValidator(TreatmentLoggingProperties props) {
        this(props.getMatch().getTolerance());
    }

    public MedicalWarningRuleValidator(Duration maxDrift) {
        this.maxDrift = maxDrift;
    }

    @Override
    public List<String> warnings(TreatmentSession session, Schedule matched) {
        List<String> out = new ArrayList<>();
        if (session instanceof MedicationSession m) {
            if (m.dosageScheduled() > 0
                    && Math.abs(m.dosageGiven() - m.dosageScheduled()) > m.dosageScheduled() * DEVIATION_RATIO) {
                out.add("Dosage differs significantly from scheduled "
                        + m.dosageScheduled() + " " + m.medicationUnit());
            }
            if (m.dosageGiven() == 0) {
                out.add("Dosage is 0, consider marking this treatment as missed instead");
            }
        } else if (session instanceof FluidSession f) {
            if (f.volumeGiven() > 0 && f.volumeGiven() < LOW_VOLUME_ML) {
                out.add("Volume under 50ml is quite low");
            } else if (f.volumeGiven() > HIGH_VOLUME_ML) {
                out.add("Volume over 300ml is high");
            }
            Double target = matched == null ? null : matched.targetVolume();
            if (target != null && target > 0
                    && Math.abs(f.volumeGiven() - target) > target * DEVIATION_RATIO) {
                out.add("Volume differs significantly from scheduled " + target.intValue() + "ml");
            }
        }

        if (session.scheduledTime() != null && session.dateTime() != null) {
            Duration drift = Duration.between(session.scheduledTime(), session.dateTime()).abs();
            if (drift.compareTo(maxDrift) > 0) {
                out.add("Treatment time is " + drift.toHours() + "h different from scheduled");
            }
        }
        return out;
    }
}
