package com.hydralog.backend.logging.validation;

import com.hydralog.backend.logging.model.TreatmentSession;
import com.hydralog.backend.schedule.model.Schedule;

import java.util.List;

/**
 * Non-blocking checks on top of {@link StructuralSessionValidator}.
 *
 * @param matched schedule the session was linked to, or null for a manual log
 */
public interface SessionRuleValidator {

    List<String> warnings(TreatmentSession session, Schedule matched);
}
