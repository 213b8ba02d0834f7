package com.hydralog.backend.logging.service;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.hydralog.backend.common.time.PeriodIds;
import com.hydralog.backend.config.TreatmentLoggingProperties;
import com.hydralog.backend.logging.dto.MonthlySummaryView;
import com.hydralog.backend.logging.dto.SummaryView;
import com.hydralog.backend.logging.entity.TreatmentSummaryDayEntity;
import com.hydralog.backend.logging.model.PeriodType;
import com.hydralog.backend.logging.store.TreatmentStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Read side of the rollups, memoized per (user, pet, period) with short TTLs.
 * Every write for a (user, pet) calls {@link #invalidate}.
 */
@Slf4j
@Service
public class TreatmentSummaryService {

    private record Key(Long userId, String petId, String periodId) {
        boolean belongsTo(Long u, String p) {
            return Objects.equals(userId, u) && Objects.equals(petId, p);
        }
    }

    private final TreatmentStore store;
    private final Clock clock;

    private final Cache<Key, SummaryView> daily;
    private final Cache<Key, SummaryView> weekly;
    private final Cache<Key, MonthlySummaryView> monthly;

    public TreatmentSummaryService(TreatmentStore store, Clock clock, TreatmentLoggingProperties props) {
        this.store = store;
        this.clock = clock;
        TreatmentLoggingProperties.Summary s = props.getSummary();
        this.daily = build(s.getDailyTtl(), s.getMaxEntries());
        this.weekly = build(s.getWeeklyTtl(), s.getMaxEntries());
        this.monthly = build(s.getMonthlyTtl(), s.getMaxEntries());
    }

    private static <V> Cache<Key, V> build(Duration ttl, long maxSize) {
        return Caffeine.newBuilder()
                .expireAfterWrite(ttl)
                .maximumSize(maxSize)
                .build();
    }

    public SummaryView getTodaySummary(Long userId, String petId, ZoneId zone) {
        return getDailySummary(userId, petId, LocalDate.now(clock.withZone(zone)));
    }

    public SummaryView getDailySummary(Long userId, String petId, LocalDate day) {
        return daily.get(new Key(userId, petId, PeriodIds.daily(day)),
                k -> load(userId, petId, PeriodType.DAILY, day));
    }

    public SummaryView getWeeklySummary(Long userId, String petId, LocalDate anyDayOfWeek) {
        return weekly.get(new Key(userId, petId, PeriodIds.weekly(anyDayOfWeek)),
                k -> load(userId, petId, PeriodType.WEEKLY, anyDayOfWeek));
    }

    public MonthlySummaryView getMonthlySummary(Long userId, String petId, LocalDate anyDayOfMonth) {
        return monthly.get(new Key(userId, petId, PeriodIds.monthly(anyDayOfMonth)),
                k -> loadMonth(userId, petId, anyDayOfMonth));
    }

    public void invalidate(Long userId, String petId) {
        daily.asMap().keySet().removeIf(k -> k.belongsTo(userId, petId));
        weekly.asMap().keySet().removeIf(k -> k.belongsTo(userId, petId));
        monthly.asMap().keySet().removeIf(k -> k.belongsTo(userId, petId));
    }

    private SummaryView load(Long userId, String petId, PeriodType type, LocalDate day) {
        return store.findSummary(userId, petId, type, type.periodId(day))
                .map(SummaryView::of)
                .orElseGet(() -> SummaryView.empty(type, day));
    }

    private MonthlySummaryView loadMonth(Long userId, String petId, LocalDate day) {
        SummaryView totals = load(userId, petId, PeriodType.MONTHLY, day);
        int length = day.lengthOfMonth();

        List<Double> volumes = new ArrayList<>(Collections.nCopies(length, 0.0));
        List<Double> goals = new ArrayList<>(Collections.nCopies(length, 0.0));
        List<Integer> scheduledSessions = new ArrayList<>(Collections.nCopies(length, 0));
        List<Integer> doses = new ArrayList<>(Collections.nCopies(length, 0));
        List<Integer> scheduledDoses = new ArrayList<>(Collections.nCopies(length, 0));

        for (TreatmentSummaryDayEntity slot : store.findSummaryDays(userId, petId, PeriodIds.monthly(day))) {
            int i = slot.getDayOfMonth() - 1;
            if (i < 0 || i >= length) {
                log.warn("month slot out of range month={} day={}", PeriodIds.monthly(day), slot.getDayOfMonth());
                continue;
            }
            volumes.set(i, slot.getFluidVolume());
            goals.set(i, slot.getFluidGoalMl());
            scheduledSessions.set(i, slot.getFluidScheduledSessions());
            doses.set(i, slot.getMedicationDoses());
            scheduledDoses.set(i, slot.getMedicationScheduledDoses());
        }
        return new MonthlySummaryView(totals, List.copyOf(volumes), List.copyOf(goals),
                List.copyOf(scheduledSessions), List.copyOf(doses), List.copyOf(scheduledDoses));
    }
}
