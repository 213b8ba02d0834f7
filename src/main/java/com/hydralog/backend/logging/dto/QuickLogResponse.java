package com.hydralog.backend.logging.dto;

import com.hydralog.backend.logging.service.QuickLogResult;
import com.hydralog.backend.logging.service.SubmissionResult;

public record QuickLogResponse(
        String status,
        int medicationSessions,
        int fluidSessions,
        double fluidVolume,
        String queuedOperationId,
        Integer queueSize,
        String clientAction
) {
    public static QuickLogResponse of(SubmissionResult<QuickLogResult> r) {
        if (r.isQueued()) {
            var q = r.queued();
            return new QuickLogResponse("QUEUED", 0, 0, 0, q.operation().id(), q.queueSize(),
                    q.warning() ? "SHOW_QUEUE_WARNING" : null);
        }
        QuickLogResult v = r.value();
        return new QuickLogResponse("LOGGED", v.medicationSessions(), v.fluidSessions(), v.fluidVolume(),
                null, null, null);
    }
}
