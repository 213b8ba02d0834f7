package com.hydralog.backend.logging.store;

import com.hydralog.backend.logging.entity.TreatmentSummaryDayEntity;
import com.hydralog.backend.logging.entity.TreatmentSummaryEntity;
import com.hydralog.backend.logging.model.FluidSession;
import com.hydralog.backend.logging.model.MedicationSession;
import com.hydralog.backend.logging.model.PeriodType;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Durable store of sessions and rollups. Every method may throw Spring's
 * {@code DataAccessException} / {@code TransactionException}.
 */
public interface TreatmentStore {

    /** Commits every operation of the unit in one transaction, or none of them. */
    void commit(WriteUnit unit);

    Optional<MedicationSession> findMedicationSession(Long userId, String petId, String sessionId);

    Optional<FluidSession> findFluidSession(Long userId, String petId, String sessionId);

    /** Sessions of one medication with {@code from <= dateTime <= to}, newest first, at most {@code limit}. */
    List<MedicationSession> findMedicationSessions(Long userId, String petId, String medicationName,
                                                   Instant from, Instant to, int limit);

    /** {@code from <= dateTime < toExclusive}, oldest first. */
    List<MedicationSession> findMedicationSessionsBetween(Long userId, String petId, Instant from, Instant toExclusive);

    List<FluidSession> findFluidSessionsBetween(Long userId, String petId, Instant from, Instant toExclusive);

    Optional<TreatmentSummaryEntity> findSummary(Long userId, String petId, PeriodType periodType, String periodId);

    Optional<TreatmentSummaryDayEntity> findSummaryDay(Long userId, String petId, String monthId, int dayOfMonth);

    List<TreatmentSummaryDayEntity> findSummaryDays(Long userId, String petId, String monthId);
}
