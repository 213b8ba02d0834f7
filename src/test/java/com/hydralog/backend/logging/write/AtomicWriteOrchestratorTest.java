package com.hydralog.backend.logging.write;

import com.hydralog.backend.config.TreatmentLoggingProperties;
import com.hydralog.backend.logging.entity.TreatmentSummaryEntity;
import com.hydralog.backend.logging.error.AtomicWriteFailureException;
import com.hydralog.backend.logging.model.MedicationSession;
import com.hydralog.backend.logging.model.PeriodType;
import com.hydralog.backend.logging.store.WriteUnit;
import com.hydralog.backend.logging.summary.ScheduledDayConstants;
import com.hydralog.backend.logging.summary.SetOnceFlags;
import com.hydralog.backend.logging.summary.SummaryUpdateDto;
import com.hydralog.backend.logging.summary.SummaryUpdateDtoBuilder;
import com.hydralog.backend.logging.testsupport.InMemoryTreatmentStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.IntStream;

import static com.hydralog.backend.logging.testsupport.TestFixtures.*;
import static org.junit.jupiter.api.Assertions.*;

class AtomicWriteOrchestratorTest {

    private final SummaryUpdateDtoBuilder builder = new SummaryUpdateDtoBuilder();
    private InMemoryTreatmentStore store;
    private AtomicWriteOrchestrator orchestrator;

    @BeforeEach
    void setUp() {
        store = new InMemoryTreatmentStore();
        orchestrator = new AtomicWriteOrchestrator(store, new TreatmentLoggingProperties());
    }

    @Test
    void single_write_is_one_unit_with_three_rollups() {
        MedicationSession s = med("m1", "Benazepril", at("08:00"), true);
        SummaryUpdateDto dto = builder.fromNewSession(s, TODAY, ScheduledDayConstants.NONE, SetOnceFlags.NONE_RECORDED);

        orchestrator.writeSessionWithRollups("log_medication", s, dto, TODAY);

        assertEquals(1, store.committedUnits().size());
        WriteUnit unit = store.committedUnits().get(0);
        assertEquals(4, unit.size());
        assertEquals(3, unit.rollupCount());
        assertEquals(1, daily().getMedicationTotalDoses());
    }

    @Test
    void event_only_write_touches_no_rollup() {
        orchestrator.writeEventOnly("update_medication", med("m1", "Benazepril", at("08:00"), true));

        assertEquals(0, store.committedUnits().get(0).rollupCount());
        assertTrue(store.findSummary(USER, PET, PeriodType.DAILY, "2026-03-10").isEmpty());
    }

    @Test
    void failing_single_write_commits_nothing() {
        store.failCommit(0);
        MedicationSession s = med("m1", "Benazepril", at("08:00"), true);
        SummaryUpdateDto dto = builder.fromNewSession(s, TODAY, ScheduledDayConstants.NONE, SetOnceFlags.NONE_RECORDED);

        AtomicWriteFailureException e = assertThrows(AtomicWriteFailureException.class,
                () -> orchestrator.writeSessionWithRollups("log_medication", s, dto, TODAY));

        assertFalse(e.partiallyCommitted());
        assertEquals(0, store.sessionCount());
        assertTrue(store.findSummary(USER, PET, PeriodType.DAILY, "2026-03-10").isEmpty());
    }

    @Test
    void bulk_of_507_is_split_at_500_with_rollups_in_first_unit() {
        List<MedicationSession> sessions = sessions(507);
        SummaryUpdateDto dto = builder.fromBulkSessions(sessions, List.of(), TODAY,
                ScheduledDayConstants.NONE, SetOnceFlags.NONE_RECORDED);

        List<WriteUnit> units = orchestrator.planBulk(sessions, dto, USER, PET, TODAY);

        assertEquals(2, units.size());
        assertEquals(500, units.get(0).size());
        assertEquals(497, units.get(0).sessionCount());
        assertEquals(3, units.get(0).rollupCount());
        assertEquals(10, units.get(1).size());
        assertEquals(0, units.get(1).rollupCount());
    }

    @Test
    void small_bulk_is_a_single_unit() {
        List<MedicationSession> sessions = sessions(4);
        SummaryUpdateDto dto = builder.fromBulkSessions(sessions, List.of(), TODAY,
                ScheduledDayConstants.NONE, SetOnceFlags.NONE_RECORDED);

        BulkWriteReport report = orchestrator.writeBulk("quick_log", sessions, dto, USER, PET, TODAY);

        assertEquals(4, report.sessionsWritten());
        assertEquals(3, report.rollupsWritten());
        assertEquals(1, report.unitsCommitted());
        assertEquals(4, daily().getMedicationTotalDoses());
    }

    @Test
    void failure_in_second_chunk_keeps_first_and_names_the_chunk() {
        List<MedicationSession> sessions = sessions(507);
        SummaryUpdateDto dto = builder.fromBulkSessions(sessions, List.of(), TODAY,
                ScheduledDayConstants.NONE, SetOnceFlags.NONE_RECORDED);
        store.failCommit(1);

        AtomicWriteFailureException e = assertThrows(AtomicWriteFailureException.class,
                () -> orchestrator.writeBulk("quick_log", sessions, dto, USER, PET, TODAY));

        assertEquals(1, e.chunkIndex());
        assertEquals(1, e.committedChunks());
        assertTrue(e.partiallyCommitted());
        assertEquals(497, store.sessionCount());
        assertEquals(507, daily().getMedicationTotalDoses());
    }

    @Test
    void rollup_merges_commute() {
        MedicationSession a = med("a", "A", at("08:00"), true);
        MedicationSession b = med("b", "B", at("09:00"), false);
        var c = fluid("c", 120, at("10:00"));
        ScheduledDayConstants constants = new ScheduledDayConstants(2, 1, 100, 700);

        InMemoryTreatmentStore first = new InMemoryTreatmentStore();
        InMemoryTreatmentStore second = new InMemoryTreatmentStore();
        AtomicWriteOrchestrator one = new AtomicWriteOrchestrator(first, new TreatmentLoggingProperties());
        AtomicWriteOrchestrator two = new AtomicWriteOrchestrator(second, new TreatmentLoggingProperties());

        // each writer reads no flags yet, as concurrent first writes of the day would
        one.writeSessionWithRollups("x", a, builder.fromNewSession(a, TODAY, constants, SetOnceFlags.NONE_RECORDED), TODAY);
        one.writeSessionWithRollups("x", b, builder.fromNewSession(b, TODAY, constants, SetOnceFlags.ALL_RECORDED), TODAY);
        one.writeSessionWithRollups("x", c, builder.fromNewSession(c, TODAY, constants, SetOnceFlags.ALL_RECORDED), TODAY);

        two.writeSessionWithRollups("x", c, builder.fromNewSession(c, TODAY, constants, SetOnceFlags.NONE_RECORDED), TODAY);
        two.writeSessionWithRollups("x", b, builder.fromNewSession(b, TODAY, constants, SetOnceFlags.ALL_RECORDED), TODAY);
        two.writeSessionWithRollups("x", a, builder.fromNewSession(a, TODAY, constants, SetOnceFlags.ALL_RECORDED), TODAY);

        for (PeriodType type : PeriodType.values()) {
            TreatmentSummaryEntity x = first.findSummary(USER, PET, type, type.periodId(TODAY)).orElseThrow();
            TreatmentSummaryEntity y = second.findSummary(USER, PET, type, type.periodId(TODAY)).orElseThrow();
            assertEquals(x.getMedicationTotalDoses(), y.getMedicationTotalDoses(), type.name());
            assertEquals(x.getMedicationMissedCount(), y.getMedicationMissedCount(), type.name());
            assertEquals(x.getMedicationScheduledDoses(), y.getMedicationScheduledDoses(), type.name());
            assertEquals(x.getFluidTotalVolume(), y.getFluidTotalVolume(), type.name());
            assertEquals(x.getFluidSessionCount(), y.getFluidSessionCount(), type.name());
        }
        assertEquals(2, daily(first).getMedicationScheduledDoses());
        assertEquals(1, daily(first).getMedicationTotalDoses());
        assertEquals(1, daily(first).getMedicationMissedCount());
    }

    @Test
    void ceiling_must_leave_room_for_sessions() {
        TreatmentLoggingProperties props = new TreatmentLoggingProperties();
        props.getWrite().setMaxOperationsPerUnit(3);
        assertThrows(IllegalStateException.class, () -> new AtomicWriteOrchestrator(store, props));
    }

    private TreatmentSummaryEntity daily() {
        return daily(store);
    }

    private static TreatmentSummaryEntity daily(InMemoryTreatmentStore s) {
        return s.findSummary(USER, PET, PeriodType.DAILY, "2026-03-10").orElseThrow();
    }

    private static List<MedicationSession> sessions(int n) {
        return new ArrayList<>(IntStream.range(0, n)
                .mapToObj(i -> med("s" + i, "Med" + i, at("08:00"), true))
                .toList());
    }
}
