package com.hydralog.backend.logging.write;

import com.hydralog.backend.config.TreatmentLoggingProperties;
import com.hydralog.backend.logging.error.AtomicWriteFailureException;
import com.hydralog.backend.logging.model.TreatmentSession;
import com.hydralog.backend.logging.store.RollupRef;
import com.hydralog.backend.logging.store.StoreOperation;
import com.hydralog.backend.logging.store.TreatmentStore;
import com.hydralog.backend.logging.store.WriteUnit;
import com.hydralog.backend.logging.summary.SummaryUpdateDto;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.TransactionException;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/**
 * Composes session writes and the three rollup merges into atomic units.
 *
 * <p>A single-session write is one unit: the session upsert plus daily, weekly and monthly rollups.
 * A bulk write is split at the per-unit ceiling; the first unit carries the three rollups and as many
 * sessions as fit, later units carry sessions only. Units that committed before a failing one stay
 * committed; the failure names the failing unit.
 */
@Slf4j
@Component
public class AtomicWriteOrchestrator {

    static final int ROLLUPS_PER_WRITE = 3;

    private final TreatmentStore store;
    private final int maxOperationsPerUnit;

    public AtomicWriteOrchestrator(TreatmentStore store, TreatmentLoggingProperties props) {
        this.store = store;
        this.maxOperationsPerUnit = props.getWrite().getMaxOperationsPerUnit();
        if (maxOperationsPerUnit <= ROLLUPS_PER_WRITE) {
            throw new IllegalStateException("app.logging.write.max-operations-per-unit must exceed " + ROLLUPS_PER_WRITE);
        }
    }

    public void writeSessionWithRollups(String operation, TreatmentSession session, SummaryUpdateDto dto, LocalDate day) {
        List<StoreOperation> ops = new ArrayList<>(1 + ROLLUPS_PER_WRITE);
        ops.add(new StoreOperation.UpsertSession(session));
        if (dto.hasUpdates()) {
            ops.addAll(rollups(session.userId(), session.petId(), day, dto));
        }
        commitSingle(operation, new WriteUnit(ops));
        log.info("{} committed session={} rollups={}", operation, session.id(), ops.size() - 1);
    }

    /** Edit without aggregable change: only the session row is touched. */
    public void writeEventOnly(String operation, TreatmentSession session) {
        commitSingle(operation, new WriteUnit(List.of(new StoreOperation.UpsertSession(session))));
        log.info("{} committed session={} (event only)", operation, session.id());
    }

    public void deleteSessionWithRollups(String operation, TreatmentSession session, SummaryUpdateDto dto, LocalDate day) {
        List<StoreOperation> ops = new ArrayList<>(1 + ROLLUPS_PER_WRITE);
        ops.add(new StoreOperation.DeleteSession(session));
        if (dto.hasUpdates()) {
            ops.addAll(rollups(session.userId(), session.petId(), day, dto));
        }
        commitSingle(operation, new WriteUnit(ops));
        log.info("{} committed delete session={}", operation, session.id());
    }

    public BulkWriteReport writeBulk(String operation, List<? extends TreatmentSession> sessions, SummaryUpdateDto dto,
                                     Long userId, String petId, LocalDate day) {
        List<WriteUnit> units = planBulk(sessions, dto, userId, petId, day);

        int committed = 0;
        for (WriteUnit unit : units) {
            try {
                store.commit(unit);
            } catch (DataAccessException | TransactionException e) {
                log.warn("{} failed at chunk {}/{} ({} committed)", operation, committed, units.size(), committed, e);
                throw new AtomicWriteFailureException(operation, committed, committed, e);
            }
            committed++;
        }

        int rollups = (int) units.stream().mapToLong(WriteUnit::rollupCount).sum();
        log.info("{} committed sessions={} rollups={} units={}", operation, sessions.size(), rollups, units.size());
        return new BulkWriteReport(sessions.size(), rollups, units.size());
    }

    /** Splits a bulk write into units of at most the configured ceiling. */
    public List<WriteUnit> planBulk(List<? extends TreatmentSession> sessions, SummaryUpdateDto dto,
                                    Long userId, String petId, LocalDate day) {
        List<StoreOperation> rollups = dto.hasUpdates() ? rollups(userId, petId, day, dto) : List.of();

        List<WriteUnit> units = new ArrayList<>();
        int firstCapacity = maxOperationsPerUnit - rollups.size();
        int index = 0;

        List<StoreOperation> first = new ArrayList<>();
        while (index < sessions.size() && first.size() < firstCapacity) {
            first.add(new StoreOperation.UpsertSession(sessions.get(index++)));
        }
        first.addAll(rollups);
        if (!first.isEmpty()) units.add(new WriteUnit(first));

        while (index < sessions.size()) {
            int end = Math.min(sessions.size(), index + maxOperationsPerUnit);
            List<StoreOperation> chunk = new ArrayList<>(end - index);
            for (; index < end; index++) {
                chunk.add(new StoreOperation.UpsertSession(sessions.get(index)));
            }
            units.add(new WriteUnit(chunk));
        }
        return units;
    }

    private void commitSingle(String operation, WriteUnit unit) {
        try {
            store.commit(unit);
        } catch (DataAccessException | TransactionException e) {
            log.warn("{} failed: {}", operation, e.toString());
            throw AtomicWriteFailureException.of(operation, e);
        }
    }

    private static List<StoreOperation> rollups(Long userId, String petId, LocalDate day, SummaryUpdateDto dto) {
        return List.of(
                new StoreOperation.ApplyRollup(RollupRef.daily(userId, petId, day), dto),
                new StoreOperation.ApplyRollup(RollupRef.weekly(userId, petId, day), dto),
                new StoreOperation.ApplyRollup(RollupRef.monthly(userId, petId, day), dto));
    }
}
