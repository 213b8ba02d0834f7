package com.hydralog.backend.logging.cache;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.hydralog.backend.common.kv.KeyValueStore;
import com.hydralog.backend.common.time.PeriodIds;
import com.hydralog.backend.config.SummaryCacheProperties;
import com.hydralog.backend.logging.model.DailySummaryCache;
import com.hydralog.backend.logging.model.SessionFacts;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.time.Clock;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.Optional;
import java.util.function.UnaryOperator;

/**
 * Local per-(user, pet, day) snapshot of today's logging. Updated by the write path after a confirmed
 * commit, never by reading the durable store. Every storage or parse failure is logged and treated as
 * a miss or a no-op: a miss never means "nothing was logged".
 */
@Slf4j
@Service
public class SummaryCacheService {

    static final String KEY_PREFIX = "daily_summary_";

    private final KeyValueStore store;
    private final ObjectMapper objectMapper;
    private final SummaryCacheProperties props;
    private final Clock clock;

    public SummaryCacheService(KeyValueStore store, ObjectMapper objectMapper,
                               SummaryCacheProperties props, Clock clock) {
        this.store = store;
        this.objectMapper = objectMapper;
        this.props = props;
        this.clock = clock;
    }

    /** Today's entry. Entries of any other day are purged on the way. */
    public synchronized Optional<DailySummaryCache> get(Long userId, String petId, ZoneId zone) {
        LocalDate today = today(zone);
        try {
            purgeOtherDays(userId, petId, today);
            Optional<String> raw = store.get(key(userId, petId, today));
            if (raw.isEmpty()) return Optional.empty();

            DailySummaryCache entry = objectMapper.readValue(raw.get(), DailySummaryCache.class);
            if (!entry.isFor(today)) {
                store.delete(key(userId, petId, today));
                return Optional.empty();
            }
            return Optional.of(entry);
        } catch (Exception e) {
            log.warn("summary cache read failed user={} pet={}: {}", userId, petId, e.toString());
            return Optional.empty();
        }
    }

    /** Merges one confirmed session into today's entry. Sessions of other days leave the cache untouched. */
    public void putAfterSession(Long userId, String petId, ZoneId zone, SessionFacts facts) {
        update(userId, petId, zone, facts, c -> c.withSession(facts, props.getRingSize()));
    }

    /**
     * Reverses one deleted (or replaced) session in today's entry. A missing entry stays missing: there is
     * nothing to subtract from, and an empty entry would read as "nothing logged today".
     *
     * @return whether an entry was there to reverse
     */
    public synchronized boolean reverseSession(Long userId, String petId, ZoneId zone, SessionFacts facts) {
        LocalDate today = today(zone);
        if (!PeriodIds.localDate(facts.dateTime(), zone).equals(today)) return false;

        Optional<DailySummaryCache> current = get(userId, petId, zone);
        if (current.isEmpty()) {
            log.debug("reverse skipped, no cache entry user={} pet={}", userId, petId);
            return false;
        }
        write(userId, petId, today, current.get().withoutSession(facts));
        return true;
    }

    /** Wholesale replace after a bulk quick-log. */
    public synchronized void putAfterBulk(Long userId, String petId, ZoneId zone, DailySummaryCache snapshot) {
        LocalDate today = today(zone);
        if (!snapshot.isFor(today)) {
            log.debug("bulk snapshot for {} ignored, today is {}", snapshot.date(), today);
            return;
        }
        write(userId, petId, today, snapshot);
    }

    /** Drops every entry not stamped with today's date in {@code zone}. */
    public synchronized void invalidateExpired(ZoneId zone) {
        String todayId = PeriodIds.daily(today(zone));
        try {
            int purged = 0;
            for (String key : store.keysWithPrefix(KEY_PREFIX)) {
                if (!key.endsWith("_" + todayId)) {
                    store.delete(key);
                    purged++;
                }
            }
            if (purged > 0) log.info("summary cache purged {} expired entries", purged);
        } catch (Exception e) {
            log.warn("summary cache expiry sweep failed: {}", e.toString());
        }
    }

    /** Pet switch / sign-out. */
    public synchronized void clear(Long userId, String petId) {
        try {
            for (String key : store.keysWithPrefix(prefix(userId, petId))) {
                store.delete(key);
            }
        } catch (Exception e) {
            log.warn("summary cache clear failed user={} pet={}: {}", userId, petId, e.toString());
        }
    }

    private synchronized void update(Long userId, String petId, ZoneId zone, SessionFacts facts,
                                     UnaryOperator<DailySummaryCache> change) {
        LocalDate today = today(zone);
        if (!PeriodIds.localDate(facts.dateTime(), zone).equals(today)) return;

        DailySummaryCache current = get(userId, petId, zone).orElseGet(() -> DailySummaryCache.empty(today));
        write(userId, petId, today, change.apply(current));
    }

    private void write(Long userId, String petId, LocalDate day, DailySummaryCache entry) {
        try {
            store.put(key(userId, petId, day), objectMapper.writeValueAsString(entry));
        } catch (Exception e) {
            log.warn("summary cache write failed user={} pet={}: {}", userId, petId, e.toString());
        }
    }

    private void purgeOtherDays(Long userId, String petId, LocalDate today) throws IOException {
        String todayKey = key(userId, petId, today);
        for (String key : store.keysWithPrefix(prefix(userId, petId))) {
            if (key.equals(todayKey)) continue;
            store.delete(key);
            log.debug("summary cache purged stale entry {}", key);
        }
    }

    private LocalDate today(ZoneId zone) {
        return LocalDate.now(clock.withZone(zone));
    }

    static String prefix(Long userId, String petId) {
        return KEY_PREFIX + userId + "_" + safe(petId) + "_";
    }

    static String key(Long userId, String petId, LocalDate day) {
        return prefix(userId, petId) + PeriodIds.daily(day);
    }

    /** Keys only allow [A-Za-z0-9._-]. */
    private static String safe(String petId) {
        return petId == null ? "none" : petId.replaceAll("[^A-Za-z0-9.-]", "-");
    }
}
