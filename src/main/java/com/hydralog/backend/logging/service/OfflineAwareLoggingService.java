package com.hydralog.backend.logging.service;

import com.hydralog.backend.logging.error.AtomicWriteFailureException;
import com.hydralog.backend.logging.error.SyncFailureException;
import com.hydralog.backend.logging.model.FluidSession;
import com.hydralog.backend.logging.model.MedicationSession;
import com.hydralog.backend.logging.queue.DrainResult;
import com.hydralog.backend.logging.queue.LoggingCommand;
import com.hydralog.backend.logging.queue.OfflineOperationQueue;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.ZoneId;
import java.util.function.Supplier;

/**
 * Front door for callers that may be offline. With {@code background=true} a write that failed at the
 * store is captured in the offline queue instead of surfacing; every other failure propagates.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class OfflineAwareLoggingService {

    private final TreatmentLoggingService logging;
    private final OfflineOperationQueue queue;
    private final Clock clock;

    public SubmissionResult<LogResult> logMedicationSession(Long userId, String petId, ZoneId zone,
                                                            MedicationSession session, boolean background) {
        return submit(background,
                () -> logging.logMedicationSession(userId, petId, zone, session),
                new LoggingCommand.CreateMedication(userId, petId, zone.getId(), session));
    }

    public SubmissionResult<LogResult> logFluidSession(Long userId, String petId, ZoneId zone,
                                                       FluidSession session, boolean background) {
        return submit(background,
                () -> logging.logFluidSession(userId, petId, zone, session),
                new LoggingCommand.CreateFluid(userId, petId, zone.getId(), session));
    }

    public SubmissionResult<LogResult> updateMedicationSession(Long userId, String petId, ZoneId zone,
                                                               MedicationSession session, boolean background) {
        return submit(background,
                () -> logging.updateMedicationSession(userId, petId, zone, session),
                new LoggingCommand.UpdateMedication(userId, petId, zone.getId(), session));
    }

    public SubmissionResult<LogResult> updateFluidSession(Long userId, String petId, ZoneId zone,
                                                          FluidSession session, boolean background) {
        return submit(background,
                () -> logging.updateFluidSession(userId, petId, zone, session),
                new LoggingCommand.UpdateFluid(userId, petId, zone.getId(), session));
    }

    public SubmissionResult<QuickLogResult> quickLogAllTreatments(Long userId, String petId, ZoneId zone,
                                                                  boolean background) {
        return submit(background,
                () -> logging.quickLogAllTreatments(userId, petId, zone),
                new LoggingCommand.QuickLogAll(userId, petId, zone.getId(), clock.instant()));
    }

    /**
     * Drains the caller's pending operations now.
     *
     * @throws SyncFailureException when at least one operation ended FAILED
     */
    public DrainResult syncNow(Long userId) {
        DrainResult result = queue.drainPending(userId);
        if (result.hasFailures()) {
            throw new SyncFailureException(result.successCount(), result.failureCount(), result.failedOperationIds());
        }
        return result;
    }

    private <T> SubmissionResult<T> submit(boolean background, Supplier<T> live, LoggingCommand command) {
        try {
            return SubmissionResult.logged(live.get());
        } catch (AtomicWriteFailureException e) {
            if (!background || e.partiallyCommitted()) throw e;
            log.warn("write failed, queued for later user={} type={}: {}",
                    command.userId(), command.getClass().getSimpleName(), e.getMessage());
            return SubmissionResult.queued(queue.enqueue(command));
        }
    }
}
