package com.hydralog.backend.logging.service;

import com.hydralog.backend.logging.error.AtomicWriteFailureException;
import com.hydralog.backend.logging.error.DuplicateConflictException;
import com.hydralog.backend.logging.error.SyncFailureException;
import com.hydralog.backend.logging.model.MedicationSession;
import com.hydralog.backend.logging.model.ScheduleMatch;
import com.hydralog.backend.logging.queue.DrainResult;
import com.hydralog.backend.logging.queue.EnqueueResult;
import com.hydralog.backend.logging.queue.LoggingCommand;
import com.hydralog.backend.logging.queue.OfflineOperationQueue;
import com.hydralog.backend.logging.queue.QueuedOperation;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.dao.DataAccessResourceFailureException;

import java.util.List;

import static com.hydralog.backend.logging.testsupport.TestFixtures.*;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class OfflineAwareLoggingServiceTest {

    private TreatmentLoggingService logging;
    private OfflineOperationQueue queue;
    private OfflineAwareLoggingService service;

    private final MedicationSession session = med("m1", "Benazepril", at("08:00"), true);
    private final AtomicWriteFailureException storeDown =
            AtomicWriteFailureException.of("logMedicationSession", new DataAccessResourceFailureException("down"));

    @BeforeEach
    void setUp() {
        logging = mock(TreatmentLoggingService.class);
        queue = mock(OfflineOperationQueue.class);
        service = new OfflineAwareLoggingService(logging, queue, CLOCK);
    }

    @Test
    void live_success_is_logged() {
        when(logging.logMedicationSession(USER, PET, ZONE, session))
                .thenReturn(new LogResult("m1", ScheduleMatch.none(), List.of()));

        SubmissionResult<LogResult> r = service.logMedicationSession(USER, PET, ZONE, session, true);

        assertFalse(r.isQueued());
        assertEquals("m1", r.value().sessionId());
        verifyNoInteractions(queue);
    }

    @Test
    void background_store_failure_is_queued() {
        when(logging.logMedicationSession(USER, PET, ZONE, session)).thenThrow(storeDown);
        LoggingCommand expected = new LoggingCommand.CreateMedication(USER, PET, ZONE.getId(), session);
        EnqueueResult enqueued = new EnqueueResult(QueuedOperation.pending(expected, NOW), 1, false);
        when(queue.enqueue(any())).thenReturn(enqueued);

        SubmissionResult<LogResult> r = service.logMedicationSession(USER, PET, ZONE, session, true);

        assertTrue(r.isQueued());
        assertEquals(1, r.queued().queueSize());
        verify(queue).enqueue(expected);
    }

    @Test
    void queued_quick_log_remembers_when_it_was_asked_for() {
        when(logging.quickLogAllTreatments(USER, PET, ZONE)).thenThrow(storeDown);
        LoggingCommand expected = new LoggingCommand.QuickLogAll(USER, PET, ZONE.getId(), NOW);
        when(queue.enqueue(any())).thenReturn(new EnqueueResult(QueuedOperation.pending(expected, NOW), 1, false));

        assertTrue(service.quickLogAllTreatments(USER, PET, ZONE, true).isQueued());
        verify(queue).enqueue(expected);
    }

    @Test
    void foreground_store_failure_surfaces() {
        when(logging.logMedicationSession(USER, PET, ZONE, session)).thenThrow(storeDown);

        assertThrows(AtomicWriteFailureException.class,
                () -> service.logMedicationSession(USER, PET, ZONE, session, false));
        verifyNoInteractions(queue);
    }

    @Test
    void partially_committed_bulk_is_never_queued() {
        when(logging.quickLogAllTreatments(USER, PET, ZONE)).thenThrow(
                new AtomicWriteFailureException("quickLogAllTreatments", 1, 1, new DataAccessResourceFailureException("x")));

        assertThrows(AtomicWriteFailureException.class, () -> service.quickLogAllTreatments(USER, PET, ZONE, true));
        verifyNoInteractions(queue);
    }

    @Test
    void non_store_failures_are_not_queued() {
        when(logging.logMedicationSession(USER, PET, ZONE, session))
                .thenThrow(new DuplicateConflictException("Benazepril", at("07:55"), "m0"));

        assertThrows(DuplicateConflictException.class,
                () -> service.logMedicationSession(USER, PET, ZONE, session, true));
        verifyNoInteractions(queue);
    }

    @Test
    void sync_with_failures_raises() {
        when(queue.drainPending(USER)).thenReturn(new DrainResult(2, 1, List.of("op-3")));

        SyncFailureException e = assertThrows(SyncFailureException.class, () -> service.syncNow(USER));

        assertEquals(2, e.successCount());
        assertEquals(List.of("op-3"), e.failedOperationIds());
    }

    @Test
    void clean_sync_returns_counts() {
        when(queue.drainPending(USER)).thenReturn(new DrainResult(3, 0, List.of()));
        assertEquals(3, service.syncNow(USER).successCount());
    }
}
