package com.hydralog.backend.logging.summary;

import com.hydralog.backend.common.time.PeriodIds;
import com.hydralog.backend.logging.entity.TreatmentSummaryDayEntity;
import com.hydralog.backend.logging.entity.TreatmentSummaryEntity;
import com.hydralog.backend.logging.model.PeriodType;
import com.hydralog.backend.logging.store.TreatmentStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskExecutor;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

/**
 * Reads the daily row, the weekly row and the monthly day slot before a write to learn which
 * per-period constants are already recorded. The three reads target independent rows and run in
 * parallel; all of them finish before the caller builds its dto.
 */
@Slf4j
@Component
public class SetOnceResolver {

    private final TreatmentStore store;
    private final TaskExecutor executor;

    public SetOnceResolver(TreatmentStore store, @Qualifier("summaryReadExecutor") TaskExecutor executor) {
        this.store = store;
        this.executor = executor;
    }

    public SetOnceFlags resolve(Long userId, String petId, LocalDate day) {
        CompletableFuture<Optional<TreatmentSummaryEntity>> daily = CompletableFuture.supplyAsync(
                () -> store.findSummary(userId, petId, PeriodType.DAILY, PeriodIds.daily(day)), executor);
        CompletableFuture<Optional<TreatmentSummaryEntity>> weekly = CompletableFuture.supplyAsync(
                () -> store.findSummary(userId, petId, PeriodType.WEEKLY, PeriodIds.weekly(day)), executor);
        CompletableFuture<Optional<TreatmentSummaryDayEntity>> monthDay = CompletableFuture.supplyAsync(
                () -> store.findSummaryDay(userId, petId, PeriodIds.monthly(day), day.getDayOfMonth()), executor);

        try {
            CompletableFuture.allOf(daily, weekly, monthDay).join();
        } catch (CompletionException e) {
            // surface the store's own exception so callers map it like any other write-path failure
            if (e.getCause() instanceof RuntimeException re) throw re;
            throw e;
        }

        Optional<TreatmentSummaryEntity> d = daily.join();
        Optional<TreatmentSummaryEntity> w = weekly.join();
        Optional<TreatmentSummaryDayEntity> m = monthDay.join();

        SetOnceFlags flags = new SetOnceFlags(
                d.map(TreatmentSummaryEntity::isMedicationScheduleRecorded).orElse(false),
                d.map(TreatmentSummaryEntity::isFluidScheduleRecorded).orElse(false),
                w.map(TreatmentSummaryEntity::isFluidWeeklyGoalRecorded).orElse(false),
                m.map(TreatmentSummaryDayEntity::isMedicationScheduleRecorded).orElse(false),
                m.map(TreatmentSummaryDayEntity::isFluidScheduleRecorded).orElse(false));
        log.debug("set-once flags user={} pet={} day={} -> {}", userId, petId, day, flags);
        return flags;
    }
}
