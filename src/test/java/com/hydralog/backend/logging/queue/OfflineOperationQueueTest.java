package com.hydralog.backend.logging.queue;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.hydralog.backend.common.kv.CaffeineKeyValueStore;
import com.hydralog.backend.common.kv.KeyValueStore;
import com.hydralog.backend.config.OfflineQueueProperties;
import com.hydralog.backend.logging.error.AtomicWriteFailureException;
import com.hydralog.backend.logging.error.DuplicateConflictException;
import com.hydralog.backend.logging.error.QueueFullException;
import com.hydralog.backend.logging.error.ReconciliationEmptyException;
import com.hydralog.backend.logging.error.SessionValidationException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import static com.hydralog.backend.logging.testsupport.TestFixtures.*;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class OfflineOperationQueueTest {

    private final ObjectMapper om = new ObjectMapper().findAndRegisterModules();
    private final List<Duration> sleeps = new ArrayList<>();
    private final Sleeper recordingSleeper = sleeps::add;

    private KeyValueStore kv;
    private OfflineQueueProperties props;
    private LoggingCommandExecutor executor;
    private OfflineOperationQueue queue;

    @BeforeEach
    void setUp() {
        kv = new CaffeineKeyValueStore(100);
        props = new OfflineQueueProperties();
        props.setHardCap(4);
        props.setSoftCap(2);
        executor = mock(LoggingCommandExecutor.class);
        queue = newQueue(CLOCK, recordingSleeper);
    }

    @AfterEach
    void clearInterrupt() {
        Thread.interrupted();
    }

    @Test
    void soft_cap_warns_and_hard_cap_rejects() {
        assertFalse(queue.enqueue(create("a")).warning());
        assertTrue(queue.enqueue(create("b")).warning());
        queue.enqueue(create("c"));
        queue.enqueue(create("d"));

        QueueFullException e = assertThrows(QueueFullException.class, () -> queue.enqueue(create("e")));
        assertEquals(4, e.capacity());
        assertEquals(4, queue.size());
    }

    @Test
    void queue_survives_a_restart_in_order() {
        queue.enqueue(create("a"));
        queue.enqueue(create("b"));

        OfflineOperationQueue reloaded = newQueue(CLOCK, recordingSleeper);

        assertEquals(List.of("a", "b"), reloaded.pending().stream().map(op -> op.command().sessionId()).toList());
    }

    @Test
    void expired_entries_are_dropped() {
        queue.enqueue(create("a"));

        Clock later = Clock.offset(CLOCK, Duration.ofDays(31));
        OfflineOperationQueue reloaded = newQueue(later, recordingSleeper);

        assertEquals(0, reloaded.size());
    }

    @Test
    void successful_drain_empties_the_queue() {
        queue.enqueue(create("a"));
        queue.enqueue(create("b"));

        DrainResult result = queue.drainPending();

        assertEquals(2, result.successCount());
        assertFalse(result.hasFailures());
        assertEquals(0, queue.size());
        verify(executor, times(2)).replay(any());
    }

    @Test
    void drain_for_one_user_leaves_the_others() {
        queue.enqueue(create("a"));
        queue.enqueue(new LoggingCommand.CreateMedication(99L, PET, "UTC", med("z", "Benazepril", at("08:00"), true)));

        queue.drainPending(USER);

        assertEquals(1, queue.size());
        assertEquals(99L, queue.pending().get(0).command().userId());
    }

    @Test
    void validation_failure_is_permanent_without_retries() {
        doThrow(new SessionValidationException("Medication name is required")).when(executor).replay(any());
        String id = queue.enqueue(create("a")).operation().id();

        DrainResult result = queue.drainPending();

        assertEquals(List.of(id), result.failedOperationIds());
        assertTrue(sleeps.isEmpty());
        QueuedOperation op = queue.find(id).orElseThrow();
        assertEquals(QueueStatus.FAILED, op.status());
        assertEquals(1, op.retryCount());
        verify(executor, times(1)).replay(any());
    }

    @Test
    void transient_failure_backs_off_exponentially_then_fails() {
        doThrow(AtomicWriteFailureException.of("log_medication", new RuntimeException("db down")))
                .when(executor).replay(any());
        String id = queue.enqueue(create("a")).operation().id();

        queue.drainPending();

        assertEquals(List.of(Duration.ofSeconds(1), Duration.ofSeconds(2), Duration.ofSeconds(4), Duration.ofSeconds(8)),
                sleeps);
        QueuedOperation op = queue.find(id).orElseThrow();
        assertEquals(QueueStatus.FAILED, op.status());
        assertEquals(5, op.retryCount());
        assertNotNull(op.lastError());
        verify(executor, times(5)).replay(any());
    }

    @Test
    void transient_failure_then_success() {
        doThrow(new IllegalStateException("flaky")).doNothing().when(executor).replay(any());
        queue.enqueue(create("a"));

        DrainResult result = queue.drainPending();

        assertEquals(1, result.successCount());
        assertEquals(List.of(Duration.ofSeconds(1)), sleeps);
    }

    @Test
    void duplicate_of_the_same_session_counts_as_applied() {
        doThrow(new DuplicateConflictException("Benazepril", at("08:00"), "a")).when(executor).replay(any());
        queue.enqueue(create("a"));

        assertEquals(1, queue.drainPending().successCount());
        assertEquals(0, queue.size());
    }

    @Test
    void duplicate_of_another_session_fails() {
        doThrow(new DuplicateConflictException("Benazepril", at("08:05"), "other")).when(executor).replay(any());
        queue.enqueue(create("a"));

        assertEquals(1, queue.drainPending().failureCount());
        assertEquals(1, queue.failed().size());
    }

    @Test
    void quick_log_with_nothing_left_counts_as_applied() {
        doThrow(new ReconciliationEmptyException()).when(executor).replay(any());
        queue.enqueue(new LoggingCommand.QuickLogAll(USER, PET, "UTC", NOW));

        assertEquals(1, queue.drainPending().successCount());
    }

    @Test
    void retry_moves_failed_back_to_pending() {
        doThrow(new SessionValidationException("bad")).when(executor).replay(any());
        String id = queue.enqueue(create("a")).operation().id();
        queue.drainPending();

        assertTrue(queue.retry(id));
        assertFalse(queue.retry(id));

        QueuedOperation op = queue.find(id).orElseThrow();
        assertEquals(QueueStatus.PENDING, op.status());
        assertEquals(0, op.retryCount());
        assertNull(op.lastError());
    }

    @Test
    void interrupted_drain_stops_and_keeps_the_rest_pending() {
        doThrow(AtomicWriteFailureException.of("log_medication", new RuntimeException("db down")))
                .when(executor).replay(any());
        Sleeper interrupting = d -> { throw new InterruptedException(); };
        OfflineOperationQueue q = newQueue(CLOCK, interrupting);
        q.enqueue(create("a"));
        q.enqueue(create("b"));

        DrainResult result = q.drainPending();

        assertEquals(0, result.successCount());
        assertEquals(2, q.pending().size());
        assertTrue(q.pending().stream().allMatch(op -> op.status() == QueueStatus.PENDING));
        assertTrue(Thread.currentThread().isInterrupted());
        verify(executor, times(1)).replay(any());
    }

    @Test
    void syncing_entries_are_pending_again_after_restart() throws Exception {
        QueuedOperation stuck = QueuedOperation.pending(create("a"), NOW).withStatus(QueueStatus.SYNCING);
        kv.put(OfflineOperationQueue.STORAGE_KEY, om.writeValueAsString(List.of(stuck)));

        OfflineOperationQueue reloaded = newQueue(CLOCK, recordingSleeper);

        assertEquals(QueueStatus.PENDING, reloaded.find(stuck.id()).orElseThrow().status());
    }

    @Test
    void partially_committed_bulk_is_never_retried() {
        doThrow(new AtomicWriteFailureException("quickLogAllTreatments", 1, 1, new RuntimeException("db down")))
                .when(executor).replay(any());
        String id = queue.enqueue(new LoggingCommand.QuickLogAll(USER, PET, "UTC", NOW)).operation().id();

        DrainResult result = queue.drainPending();

        assertEquals(1, result.failureCount());
        assertEquals(QueueStatus.FAILED, queue.find(id).orElseThrow().status());
        assertEquals(1, queue.find(id).orElseThrow().retryCount());
        assertTrue(sleeps.isEmpty());
        verify(executor, times(1)).replay(any());
    }

    @Test
    void corrupt_document_starts_empty() throws Exception {
        kv.put(OfflineOperationQueue.STORAGE_KEY, "{not json");

        OfflineOperationQueue reloaded = newQueue(CLOCK, recordingSleeper);

        assertEquals(0, reloaded.size());
        reloaded.enqueue(create("a"));
        assertEquals(1, reloaded.size());
    }

    @Test
    void remove_and_clear() {
        String id = queue.enqueue(create("a")).operation().id();
        queue.enqueue(create("b"));

        assertTrue(queue.remove(id));
        assertFalse(queue.remove(id));
        queue.clear();
        assertEquals(0, queue.size());
    }

    private OfflineOperationQueue newQueue(Clock clock, Sleeper sleeper) {
        return new OfflineOperationQueue(kv, om, props, executor, sleeper, clock);
    }

    private static LoggingCommand create(String sessionId) {
        return new LoggingCommand.CreateMedication(USER, PET, "UTC", med(sessionId, "Benazepril", at("08:00"), true));
    }
}
