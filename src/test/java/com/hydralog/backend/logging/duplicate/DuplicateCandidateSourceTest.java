package com.hydralog.backend.logging.duplicate;

import com.hydralog.backend.config.TreatmentLoggingProperties;
import com.hydralog.backend.logging.cache.SummaryCacheService;
import com.hydralog.backend.logging.model.DailySummaryCache;
import com.hydralog.backend.logging.model.MedicationSession;
import com.hydralog.backend.logging.model.SessionFacts;
import com.hydralog.backend.logging.testsupport.InMemoryTreatmentStore;
import com.hydralog.backend.logging.store.StoreOperation;
import com.hydralog.backend.logging.store.WriteUnit;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static com.hydralog.backend.logging.testsupport.TestFixtures.*;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class DuplicateCandidateSourceTest {

    private SummaryCacheService cache;
    private InMemoryTreatmentStore store;
    private DuplicateCandidateSource source;

    @BeforeEach
    void setUp() {
        cache = mock(SummaryCacheService.class);
        store = new InMemoryTreatmentStore();
        source = new DuplicateCandidateSource(cache, store, CLOCK, new TreatmentLoggingProperties());
    }

    @Test
    void cache_hit_answers_without_touching_the_store() {
        DailySummaryCache snapshot = DailySummaryCache.empty(TODAY)
                .withSession(SessionFacts.of(med("x", "Benazepril", at("15:00"), true)), 8);
        when(cache.get(USER, PET, ZONE)).thenReturn(Optional.of(snapshot));
        store.failReads(true);

        List<MedicationSession> c = source.candidatesFor(USER, PET, ZONE, med("n", "Benazepril", at("15:10"), true));

        assertEquals(1, c.size());
        assertEquals(at("15:00"), c.get(0).dateTime());
        assertNull(c.get(0).id());
    }

    @Test
    void cache_hit_without_that_name_means_no_candidates() {
        when(cache.get(USER, PET, ZONE)).thenReturn(Optional.of(DailySummaryCache.empty(TODAY)));
        assertTrue(source.candidatesFor(USER, PET, ZONE, med("n", "Benazepril", at("15:10"), true)).isEmpty());
    }

    @Test
    void cache_miss_falls_back_to_narrow_query() {
        when(cache.get(USER, PET, ZONE)).thenReturn(Optional.empty());
        store.commit(new WriteUnit(List.of(
                new StoreOperation.UpsertSession(med("a", "Benazepril", at("15:00"), true)),
                new StoreOperation.UpsertSession(med("b", "Benazepril", at("12:00"), true)),
                new StoreOperation.UpsertSession(med("c", "Mirtazapine", at("15:05"), true)))));

        List<MedicationSession> c = source.candidatesFor(USER, PET, ZONE, med("n", "Benazepril", at("15:10"), true));

        assertEquals(List.of("a"), c.stream().map(MedicationSession::id).toList());
    }

    @Test
    void backdated_session_skips_the_cache() {
        store.commit(new WriteUnit(List.of(
                new StoreOperation.UpsertSession(med("y", "Benazepril", on(TODAY.minusDays(1), "08:00"), true)))));

        List<MedicationSession> c = source.candidatesFor(USER, PET, ZONE,
                med("n", "Benazepril", on(TODAY.minusDays(1), "08:05"), true));

        assertEquals(1, c.size());
        verifyNoInteractions(cache);
    }

    @Test
    void failing_query_yields_no_candidates() {
        when(cache.get(USER, PET, ZONE)).thenReturn(Optional.empty());
        store.failReads(true);
        assertTrue(source.candidatesFor(USER, PET, ZONE, med("n", "Benazepril", at("15:10"), true)).isEmpty());
    }
}
