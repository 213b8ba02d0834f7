package com.hydralog.backend.logging.cache;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.hydralog.backend.common.kv.CaffeineKeyValueStore;
import com.hydralog.backend.common.kv.KeyValueStore;
import com.hydralog.backend.config.SummaryCacheProperties;
import com.hydralog.backend.logging.model.DailySummaryCache;
import com.hydralog.backend.logging.model.SessionFacts;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

import static com.hydralog.backend.logging.testsupport.TestFixtures.*;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

class SummaryCacheServiceTest {

    private final ObjectMapper om = new ObjectMapper().findAndRegisterModules();
    private KeyValueStore kv;
    private SummaryCacheProperties props;

    @BeforeEach
    void setUp() {
        kv = new CaffeineKeyValueStore(1000);
        props = new SummaryCacheProperties();
        props.setRingSize(3);
    }

    private SummaryCacheService cacheAt(Clock clock) {
        return new SummaryCacheService(kv, om, props, clock);
    }

    private static SessionFacts medFacts(String name, Instant at, boolean completed) {
        return SessionFacts.of(med("m-" + at.toEpochMilli(), name, at, completed));
    }

    @Test
    void put_then_get_returns_todays_entry() {
        SummaryCacheService cache = cacheAt(CLOCK);

        cache.putAfterSession(USER, PET, ZONE, medFacts("Benazepril", at("08:00"), true));
        cache.putAfterSession(USER, PET, ZONE, SessionFacts.of(fluid("f1", 120, at("09:00"))));

        DailySummaryCache c = cache.get(USER, PET, ZONE).orElseThrow();
        assertEquals(TODAY, c.date());
        assertEquals(1, c.medicationSessionCount());
        assertEquals(1, c.fluidSessionCount());
        assertEquals(1, c.totalMedicationDosesGiven());
        assertEquals(120.0, c.totalFluidVolumeGiven());
        assertEquals(List.of(at("08:00")), c.completedTimes("Benazepril"));
    }

    @Test
    void sessions_of_another_day_do_not_touch_the_cache() {
        SummaryCacheService cache = cacheAt(CLOCK);
        cache.putAfterSession(USER, PET, ZONE, medFacts("Benazepril", on(TODAY.minusDays(1), "08:00"), true));
        assertTrue(cache.get(USER, PET, ZONE).isEmpty());
    }

    @Test
    void entry_written_yesterday_reads_as_miss_and_is_purged() throws IOException {
        Clock yesterday = Clock.fixed(on(TODAY.minusDays(1), "20:00"), ZONE);
        cacheAt(yesterday).putAfterSession(USER, PET, ZONE, medFacts("Benazepril", on(TODAY.minusDays(1), "19:00"), true));
        assertEquals(1, kv.keysWithPrefix(SummaryCacheService.KEY_PREFIX).size());

        Optional<DailySummaryCache> today = cacheAt(CLOCK).get(USER, PET, ZONE);

        assertTrue(today.isEmpty());
        assertTrue(kv.keysWithPrefix(SummaryCacheService.KEY_PREFIX).isEmpty());
    }

    @Test
    void invalidate_expired_removes_only_stale_days() throws IOException {
        Clock yesterday = Clock.fixed(on(TODAY.minusDays(1), "20:00"), ZONE);
        cacheAt(yesterday).putAfterSession(USER, "old-pet", ZONE, medFacts("A", on(TODAY.minusDays(1), "10:00"), true));
        SummaryCacheService cache = cacheAt(CLOCK);
        cache.putAfterSession(USER, PET, ZONE, medFacts("A", at("10:00"), true));

        cache.invalidateExpired(ZONE);

        List<String> keys = kv.keysWithPrefix(SummaryCacheService.KEY_PREFIX);
        assertEquals(List.of(SummaryCacheService.key(USER, PET, TODAY)), keys);
    }

    @Test
    void ring_keeps_newest_times_per_name() {
        SummaryCacheService cache = cacheAt(CLOCK);
        for (String t : List.of("06:00", "07:00", "08:00", "09:00")) {
            cache.putAfterSession(USER, PET, ZONE, medFacts("Benazepril", at(t), true));
        }
        DailySummaryCache c = cache.get(USER, PET, ZONE).orElseThrow();
        assertEquals(List.of(at("07:00"), at("08:00"), at("09:00")), c.recentTimes("Benazepril"));
        assertEquals(4, c.medicationSessionCount());
    }

    @Test
    void missed_dose_is_recent_but_not_completed() {
        SummaryCacheService cache = cacheAt(CLOCK);
        cache.putAfterSession(USER, PET, ZONE, medFacts("Benazepril", at("08:00"), false));
        DailySummaryCache c = cache.get(USER, PET, ZONE).orElseThrow();
        assertEquals(List.of(at("08:00")), c.recentTimes("Benazepril"));
        assertTrue(c.completedTimes("Benazepril").isEmpty());
        assertEquals(0, c.totalMedicationDosesGiven());
    }

    @Test
    void reverse_session_undoes_put() {
        SummaryCacheService cache = cacheAt(CLOCK);
        SessionFacts f = medFacts("Benazepril", at("08:00"), true);
        cache.putAfterSession(USER, PET, ZONE, f);
        cache.reverseSession(USER, PET, ZONE, f);

        DailySummaryCache c = cache.get(USER, PET, ZONE).orElseThrow();
        assertFalse(c.hasAnySessions());
        assertTrue(c.recentTimes("Benazepril").isEmpty());
    }

    @Test
    void reverse_without_an_entry_leaves_the_cache_empty() {
        SummaryCacheService cache = cacheAt(CLOCK);

        assertFalse(cache.reverseSession(USER, PET, ZONE, medFacts("Benazepril", at("08:00"), true)));
        assertTrue(cache.get(USER, PET, ZONE).isEmpty());
    }

    @Test
    void bulk_snapshot_for_another_day_is_ignored() {
        SummaryCacheService cache = cacheAt(CLOCK);
        cache.putAfterBulk(USER, PET, ZONE, DailySummaryCache.empty(LocalDate.of(2026, 3, 9)));
        assertTrue(cache.get(USER, PET, ZONE).isEmpty());
    }

    @Test
    void clear_drops_only_that_pet() {
        SummaryCacheService cache = cacheAt(CLOCK);
        cache.putAfterSession(USER, PET, ZONE, medFacts("A", at("08:00"), true));
        cache.putAfterSession(USER, "pet-2", ZONE, medFacts("A", at("08:00"), true));

        cache.clear(USER, PET);

        assertTrue(cache.get(USER, PET, ZONE).isEmpty());
        assertTrue(cache.get(USER, "pet-2", ZONE).isPresent());
    }

    @Test
    void storage_failures_are_swallowed() throws IOException {
        KeyValueStore broken = mock(KeyValueStore.class);
        when(broken.keysWithPrefix(anyString())).thenThrow(new IOException("disk gone"));
        when(broken.get(anyString())).thenThrow(new IOException("disk gone"));
        doThrow(new IOException("disk gone")).when(broken).put(anyString(), anyString());
        SummaryCacheService cache = new SummaryCacheService(broken, om, props, CLOCK);

        assertDoesNotThrow(() -> cache.putAfterSession(USER, PET, ZONE, medFacts("A", at("08:00"), true)));
        assertDoesNotThrow(() -> cache.invalidateExpired(ZONE));
        assertDoesNotThrow(() -> cache.clear(USER, PET));
        assertTrue(cache.get(USER, PET, ZONE).isEmpty());
    }

    @Test
    void corrupt_entry_reads_as_miss() throws IOException {
        kv.put(SummaryCacheService.key(USER, PET, TODAY), "{not json");
        assertTrue(cacheAt(CLOCK).get(USER, PET, ZONE).isEmpty());
    }
}
