package com.hydralog.backend.logging.queue;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.hydralog.backend.common.kv.KeyValueStore;
import com.hydralog.backend.config.OfflineQueueProperties;
import com.hydralog.backend.logging.error.AtomicWriteFailureException;
import com.hydralog.backend.logging.error.LoggingException;
import com.hydralog.backend.logging.error.QueueFullException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Lazy;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Predicate;
import java.util.function.UnaryOperator;

/**
 * Durable FIFO of logging operations that could not reach the store. Persisted as one JSON document
 * in the local key-value store; storage failures are logged and the in-memory copy stays authoritative.
 * Replay goes back through {@link LoggingCommandExecutor}, so queued writes get the same validation,
 * duplicate checks and rollups as live ones.
 */
@Slf4j
@Component
public class OfflineOperationQueue {

    static final String STORAGE_KEY = "logging_operation_queue";

    private static final TypeReference<List<QueuedOperation>> DOC_TYPE = new TypeReference<>() {};

    private enum Outcome { SUCCEEDED, FAILED, INTERRUPTED }

    private enum Verdict { ALREADY_APPLIED, PERMANENT, TRANSIENT }

    private final KeyValueStore store;
    private final ObjectMapper objectMapper;
    private final OfflineQueueProperties props;
    private final LoggingCommandExecutor executor;
    private final Sleeper sleeper;
    private final Clock clock;
    private final RetryBackoff backoff;

    private final ReentrantLock drainLock = new ReentrantLock();
    private List<QueuedOperation> operations;

    public OfflineOperationQueue(KeyValueStore store, ObjectMapper objectMapper, OfflineQueueProperties props,
                                 @Lazy LoggingCommandExecutor executor, Sleeper sleeper, Clock clock) {
        this.store = store;
        this.objectMapper = objectMapper;
        this.props = props;
        this.executor = executor;
        this.sleeper = sleeper;
        this.clock = clock;
        this.backoff = new RetryBackoff(props.getInitialBackoff(), props.getMaxBackoff(), props.getMaxAttempts());
    }

    /**
     * @throws QueueFullException when the hard cap is reached; the command is not captured
     */
    public synchronized EnqueueResult enqueue(LoggingCommand command) {
        List<QueuedOperation> ops = state();
        if (ops.size() >= props.getHardCap()) {
            log.warn("offline queue full cap={} user={} type={}",
                    props.getHardCap(), command.userId(), command.getClass().getSimpleName());
            throw new QueueFullException(props.getHardCap());
        }
        QueuedOperation op = QueuedOperation.pending(command, clock.instant());
        ops.add(op);
        persist();

        int size = ops.size();
        boolean warning = size >= props.getSoftCap();
        if (warning) {
            log.warn("offline queue above soft cap size={} softCap={}", size, props.getSoftCap());
        } else {
            log.info("operation queued id={} type={} size={}", op.id(), command.getClass().getSimpleName(), size);
        }
        return new EnqueueResult(op, size, warning);
    }

    public DrainResult drainPending() {
        return drain(op -> true);
    }

    public DrainResult drainPending(Long userId) {
        return drain(op -> Objects.equals(userId, op.command().userId()));
    }

    /** FAILED → PENDING with a fresh retry budget. */
    public synchronized boolean retry(String operationId) {
        List<QueuedOperation> ops = state();
        for (int i = 0; i < ops.size(); i++) {
            QueuedOperation op = ops.get(i);
            if (op.id().equals(operationId) && op.status() == QueueStatus.FAILED) {
                ops.set(i, op.resetForRetry());
                persist();
                return true;
            }
        }
        return false;
    }

    public synchronized boolean remove(String operationId) {
        boolean removed = state().removeIf(op -> op.id().equals(operationId));
        if (removed) persist();
        return removed;
    }

    public synchronized void clear() {
        state().clear();
        persist();
    }

    public synchronized List<QueuedOperation> pending() {
        return state().stream().filter(op -> op.status() != QueueStatus.FAILED).toList();
    }

    public synchronized List<QueuedOperation> failed() {
        return state().stream().filter(op -> op.status() == QueueStatus.FAILED).toList();
    }

    public synchronized List<QueuedOperation> operationsFor(Long userId) {
        return state().stream().filter(op -> Objects.equals(userId, op.command().userId())).toList();
    }

    public synchronized Optional<QueuedOperation> find(String operationId) {
        return state().stream().filter(op -> op.id().equals(operationId)).findFirst();
    }

    public synchronized int size() {
        return state().size();
    }

    // ===== drain =====

    private DrainResult drain(Predicate<QueuedOperation> filter) {
        if (!drainLock.tryLock()) {
            log.debug("drain already running, skipped");
            return DrainResult.NOTHING;
        }
        try {
            List<String> ids = pendingIds(filter);
            if (ids.isEmpty()) return DrainResult.NOTHING;

            int succeeded = 0;
            List<String> failedIds = new ArrayList<>();
            for (String id : ids) {
                QueuedOperation op = transition(id, QueueStatus.SYNCING);
                if (op == null) continue;

                Outcome outcome = replay(op);
                if (outcome == Outcome.SUCCEEDED) {
                    remove(id);
                    succeeded++;
                } else if (outcome == Outcome.FAILED) {
                    failedIds.add(id);
                } else {
                    transition(id, QueueStatus.PENDING);
                    break;
                }
            }
            log.info("offline queue drained succeeded={} failed={} remaining={}",
                    succeeded, failedIds.size(), size());
            return new DrainResult(succeeded, failedIds.size(), failedIds);
        } finally {
            drainLock.unlock();
        }
    }

    private Outcome replay(QueuedOperation op) {
        int attempts = op.retryCount();
        while (true) {
            try {
                executor.replay(op.command());
                return Outcome.SUCCEEDED;
            } catch (LoggingException e) {
                Verdict verdict = classify(op, e);
                if (verdict == Verdict.ALREADY_APPLIED) {
                    log.info("queued op {} already applied ({})", op.id(), e.kind());
                    return Outcome.SUCCEEDED;
                }
                if (verdict == Verdict.PERMANENT) {
                    markFailed(op.id(), attempts + 1, e);
                    return Outcome.FAILED;
                }
                attempts++;
                if (backoff.shouldGiveUp(attempts)) {
                    markFailed(op.id(), attempts, e);
                    return Outcome.FAILED;
                }
            } catch (RuntimeException e) {
                attempts++;
                if (backoff.shouldGiveUp(attempts)) {
                    markFailed(op.id(), attempts, e);
                    return Outcome.FAILED;
                }
            }

            recordAttempt(op.id(), attempts);
            try {
                sleeper.sleep(backoff.delayAfter(attempts));
            } catch (InterruptedException ie) {
                Thread.currentThread().interrupt();
                log.warn("offline queue drain interrupted at op {}", op.id());
                return Outcome.INTERRUPTED;
            }
        }
    }

    private Verdict classify(QueuedOperation op, LoggingException e) {
        return switch (e.kind()) {
            case DUPLICATE_CONFLICT -> sameSession(op, e) ? Verdict.ALREADY_APPLIED : Verdict.PERMANENT;
            case RECONCILIATION_EMPTY -> Verdict.ALREADY_APPLIED;
            case VALIDATION_FAILURE, SESSION_NOT_FOUND, NO_SCHEDULES,
                 QUEUE_FULL, QUEUE_WARNING, SYNC_FAILURE -> Verdict.PERMANENT;
            case ATOMIC_WRITE_FAILURE -> partiallyCommitted(e) ? Verdict.PERMANENT : Verdict.TRANSIENT;
        };
    }

    /** Replaying a bulk write whose earlier units landed would log those sessions twice. */
    private static boolean partiallyCommitted(LoggingException e) {
        return e instanceof AtomicWriteFailureException awf && awf.partiallyCommitted();
    }

    private static boolean sameSession(QueuedOperation op, LoggingException e) {
        Object existing = e.context().get("existingSessionId");
        return existing != null && existing.equals(op.command().sessionId());
    }

    private synchronized List<String> pendingIds(Predicate<QueuedOperation> filter) {
        return state().stream()
                .filter(op -> op.status() == QueueStatus.PENDING)
                .filter(filter)
                .map(QueuedOperation::id)
                .toList();
    }

    private synchronized QueuedOperation transition(String id, QueueStatus status) {
        return replaceById(id, op -> op.withStatus(status));
    }

    private synchronized void recordAttempt(String id, int attempts) {
        replaceById(id, op -> op.withAttempt(attempts, op.lastError()));
    }

    private synchronized void markFailed(String id, int attempts, Exception e) {
        log.warn("queued op {} failed after {} attempt(s): {}", id, attempts, e.toString());
        replaceById(id, op -> op.failed(attempts, e.getMessage()));
    }

    private QueuedOperation replaceById(String id, UnaryOperator<QueuedOperation> change) {
        List<QueuedOperation> ops = state();
        for (int i = 0; i < ops.size(); i++) {
            if (ops.get(i).id().equals(id)) {
                QueuedOperation next = change.apply(ops.get(i));
                ops.set(i, next);
                persist();
                return next;
            }
        }
        return null;
    }

    // ===== persistence =====

    /** Loaded once; expired entries dropped on every access, SYNCING reset to PENDING after a restart. */
    private List<QueuedOperation> state() {
        if (operations == null) {
            operations = load();
        }
        Instant cutoff = clock.instant().minus(props.getTtl());
        if (operations.removeIf(op -> op.enqueuedAt().isBefore(cutoff))) {
            log.info("expired queued operations dropped, ttl={}", props.getTtl());
            persist();
        }
        return operations;
    }

    private List<QueuedOperation> load() {
        List<QueuedOperation> loaded = new ArrayList<>();
        try {
            Optional<String> raw = store.get(STORAGE_KEY);
            if (raw.isPresent()) {
                for (QueuedOperation op : objectMapper.readValue(raw.get(), DOC_TYPE)) {
                    loaded.add(op.status() == QueueStatus.SYNCING ? op.withStatus(QueueStatus.PENDING) : op);
                }
            }
        } catch (Exception e) {
            log.warn("offline queue load failed, starting empty: {}", e.toString());
        }
        return loaded;
    }

    private void persist() {
        try {
            store.put(STORAGE_KEY, objectMapper.writeValueAsString(operations));
        } catch (Exception e) {
            log.warn("offline queue persist failed size={}: {}", operations.size(), e.toString());
        }
    }
}
