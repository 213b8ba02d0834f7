package com.hydralog.backend.logging.validation;

import com.hydralog.backend.logging.model.TreatmentSession;
import com.hydralog.backend.schedule.model.Schedule;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.List;

@Component
@ConditionalOnProperty(prefix = "app.logging.validation", name = "strict", havingValue = "false", matchIfMissing = true)
public class PassThroughSessionRuleValidator implements SessionRuleValidator {

    @Override
    public List<String> warnings(TreatmentSession session, Schedule matched) {
        return List.of();
    }
}
