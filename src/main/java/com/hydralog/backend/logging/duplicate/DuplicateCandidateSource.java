package com.hydralog.backend.logging.duplicate;

import com.hydralog.backend.common.time.PeriodIds;
import com.hydralog.backend.config.TreatmentLoggingProperties;
import com.hydralog.backend.logging.cache.SummaryCacheService;
import com.hydralog.backend.logging.model.DailySummaryCache;
import com.hydralog.backend.logging.model.MedicationSession;
import com.hydralog.backend.logging.store.TreatmentStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.List;
import java.util.Optional;

/**
 * Supplies the bounded candidate set the {@link DuplicateDetector} scans.
 *
 * <p>Today's cache answers for free: no recent time for the name means no candidate, otherwise the
 * cached times are turned into identity-less hint sessions. A cache miss or a backdated session falls
 * back to one narrow store query (name + window, capped). A failing query yields no candidates, so a
 * read problem never blocks a legitimate dose.
 */
@Slf4j
@Component
public class DuplicateCandidateSource {

    private final SummaryCacheService cache;
    private final TreatmentStore store;
    private final Clock clock;
    private final Duration window;
    private final int queryLimit;

    public DuplicateCandidateSource(SummaryCacheService cache, TreatmentStore store, Clock clock,
                                    TreatmentLoggingProperties props) {
        this.cache = cache;
        this.store = store;
        this.clock = clock;
        this.window = props.getDuplicate().getWindow();
        this.queryLimit = props.getDuplicate().getQueryLimit();
    }

    public List<MedicationSession> candidatesFor(Long userId, String petId, ZoneId zone, MedicationSession candidate) {
        LocalDate today = LocalDate.now(clock.withZone(zone));
        boolean forToday = PeriodIds.localDate(candidate.dateTime(), zone).equals(today);

        if (forToday) {
            Optional<DailySummaryCache> cached = cache.get(userId, petId, zone);
            if (cached.isPresent()) {
                List<Instant> times = cached.get().recentTimes(candidate.medicationName());
                log.debug("duplicate hints from cache name={} count={}", candidate.medicationName(), times.size());
                return times.stream().map(t -> hint(candidate, t)).toList();
            }
        }

        try {
            return store.findMedicationSessions(userId, petId, candidate.medicationName(),
                    candidate.dateTime().minus(window), candidate.dateTime().plus(window), queryLimit);
        } catch (DataAccessException e) {
            log.warn("duplicate candidate query failed user={} pet={}: {}", userId, petId, e.toString());
            return List.of();
        }
    }

    private static MedicationSession hint(MedicationSession candidate, Instant at) {
        return new MedicationSession(null, candidate.userId(), candidate.petId(), at, candidate.medicationName(),
                0, 0, candidate.medicationUnit(), true, null, null, null, null, null);
    }
}
