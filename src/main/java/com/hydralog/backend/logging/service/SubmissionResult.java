package com.hydralog.backend.logging.service;

import com.hydralog.backend.logging.queue.EnqueueResult;

/**
 * Outcome of a submission that may have been deferred. Exactly one of {@code value} and
 * {@code queued} is set.
 */
public record SubmissionResult<T>(Status status, T value, EnqueueResult queued) {

    public enum Status { LOGGED, QUEUED }

    public static <T> SubmissionResult<T> logged(T value) {
        return new SubmissionResult<>(Status.LOGGED, value, null);
    }

    public static <T> SubmissionResult<T> queued(EnqueueResult queued) {
        return new SubmissionResult<>(Status.QUEUED, null, queued);
    }

    public boolean isQueued() {
        return status == Status.QUEUED;
    }
}
