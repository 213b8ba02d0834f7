package com.hydralog.backend.logging.dto;

import com.hydralog.backend.logging.queue.EnqueueResult;
import com.hydralog.backend.logging.service.LogResult;
import com.hydralog.backend.logging.service.SubmissionResult;

import java.time.Instant;
import java.util.List;

/**
 * status=LOGGED carries the write outcome; status=QUEUED carries the queue entry.
 * clientAction is SHOW_QUEUE_WARNING when the queue passed its soft cap.
 */
public record SubmissionResponse(
        String status,
        String sessionId,
        String scheduleId,
        Instant scheduledTime,
        List<String> warnings,
        String queuedOperationId,
        Integer queueSize,
        String clientAction
) {
    public static SubmissionResponse of(SubmissionResult<LogResult> r) {
        if (r.isQueued()) return queued(r.queued());
        LogResult v = r.value();
        return new SubmissionResponse("LOGGED", v.sessionId(), v.scheduleMatch().scheduleId(),
                v.scheduleMatch().scheduledTime(), v.warnings(), null, null, null);
    }

    public static SubmissionResponse queued(EnqueueResult q) {
        return new SubmissionResponse("QUEUED", q.operation().command().sessionId(), null, null, List.of(),
                q.operation().id(), q.queueSize(), q.warning() ? "SHOW_QUEUE_WARNING" : null);
    }
}
