package com.hydralog.backend.logging.service;

import com.hydralog.backend.common.time.PeriodIds;
import com.hydralog.backend.config.SummaryCacheProperties;
import com.hydralog.backend.logging.analytics.LoggingAnalytics;
import com.hydralog.backend.logging.cache.SummaryCacheService;
import com.hydralog.backend.logging.duplicate.DuplicateCandidateSource;
import com.hydralog.backend.logging.duplicate.DuplicateDetector;
import com.hydralog.backend.logging.error.AtomicWriteFailureException;
import com.hydralog.backend.logging.error.DuplicateConflictException;
import com.hydralog.backend.logging.error.LoggingException;
import com.hydralog.backend.logging.error.SessionNotFoundException;
import com.hydralog.backend.logging.error.SessionValidationException;
import com.hydralog.backend.logging.match.ScheduleMatcher;
import com.hydralog.backend.logging.model.DailySummaryCache;
import com.hydralog.backend.logging.model.FluidSession;
import com.hydralog.backend.logging.model.MedicationSession;
import com.hydralog.backend.logging.model.ScheduleMatch;
import com.hydralog.backend.logging.model.SessionFacts;
import com.hydralog.backend.logging.model.TreatmentSession;
import com.hydralog.backend.logging.queue.LoggingCommand;
import com.hydralog.backend.logging.queue.LoggingCommandExecutor;
import com.hydralog.backend.logging.quicklog.QuickLogPlan;
import com.hydralog.backend.logging.quicklog.QuickLogReconciler;
import com.hydralog.backend.logging.store.TreatmentStore;
import com.hydralog.backend.logging.summary.ScheduledDayConstants;
import com.hydralog.backend.logging.summary.SetOnceFlags;
import com.hydralog.backend.logging.summary.SetOnceResolver;
import com.hydralog.backend.logging.summary.SummaryUpdateDto;
import com.hydralog.backend.logging.summary.SummaryUpdateDtoBuilder;
import com.hydralog.backend.logging.validation.SessionRuleValidator;
import com.hydralog.backend.logging.validation.StructuralSessionValidator;
import com.hydralog.backend.logging.validation.ValidationResult;
import com.hydralog.backend.logging.write.AtomicWriteOrchestrator;
import com.hydralog.backend.logging.write.BulkWriteReport;
import com.hydralog.backend.schedule.model.Schedule;
import com.hydralog.backend.schedule.service.ScheduleService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Entry points of treatment logging.
 *
 * <p>Single-session flow: validate, link to a schedule, reject duplicates, build the rollup dto
 * (set-once flags read in parallel), commit session + rollups as one unit, then update the local
 * cache and drop memoized summaries. Cache updates only happen after a confirmed commit.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TreatmentLoggingService implements LoggingCommandExecutor {

    private final ScheduleService scheduleService;
    private final ScheduleMatcher matcher;
    private final DuplicateCandidateSource duplicateCandidates;
    private final DuplicateDetector duplicateDetector;
    private final StructuralSessionValidator structuralValidator;
    private final SessionRuleValidator ruleValidator;
    private final SummaryUpdateDtoBuilder dtoBuilder;
    private final SetOnceResolver setOnceResolver;
    private final AtomicWriteOrchestrator writer;
    private final SummaryCacheService cache;
    private final QuickLogReconciler reconciler;
    private final TreatmentStore store;
    private final TreatmentSummaryService summaries;
    private final LoggingAnalytics analytics;
    private final SummaryCacheProperties cacheProps;
    private final Clock clock;

    // ===== create =====

    public LogResult logMedicationSession(Long userId, String petId, ZoneId zone, MedicationSession session) {
        return tracked("logMedicationSession", () -> logNew("logMedicationSession", userId, petId, zone, session));
    }

    public LogResult logFluidSession(Long userId, String petId, ZoneId zone, FluidSession session) {
        return tracked("logFluidSession", () -> logNew("logFluidSession", userId, petId, zone, session));
    }

    private LogResult logNew(String op, Long userId, String petId, ZoneId zone, TreatmentSession input) {
        requireOwner(userId, petId, input);
        ValidationResult validation = structuralValidator.validate(input).orThrow();

        List<Schedule> schedules = scheduleService.activeSchedules(userId, petId);
        ScheduleMatch match = linkOf(input, schedules, zone);
        TreatmentSession session = input.withSchedule(match);

        if (session instanceof MedicationSession med) {
            rejectDuplicate(userId, petId, zone, med);
        }
        validation = validation.withWarnings(ruleValidator.warnings(session, scheduleById(schedules, match)));

        LocalDate day = PeriodIds.localDate(session.dateTime(), zone);
        SummaryUpdateDto dto = dtoBuilder.fromNewSession(session, day,
                ScheduledDayConstants.from(schedules, day, zone), flags(op, userId, petId, day));

        writer.writeSessionWithRollups(op, session, dto, day);
        afterCommit(userId, petId);
        syncCache(userId, petId, zone, session,
                () -> cache.putAfterSession(userId, petId, zone, SessionFacts.of(session)));

        feature(op, Map.of("matched", match.matched(), "warnings", validation.warnings().size()));
        return new LogResult(session.id(), match, validation.warnings());
    }

    // ===== update =====

    public LogResult updateMedicationSession(Long userId, String petId, ZoneId zone, MedicationSession updated) {
        return tracked("updateMedicationSession", () -> {
            MedicationSession old = store.findMedicationSession(userId, petId, updated.id())
                    .orElseThrow(() -> new SessionNotFoundException(updated.id()));
            return update("updateMedicationSession", userId, petId, zone, old, updated);
        });
    }

    public LogResult updateFluidSession(Long userId, String petId, ZoneId zone, FluidSession updated) {
        return tracked("updateFluidSession", () -> {
            FluidSession old = store.findFluidSession(userId, petId, updated.id())
                    .orElseThrow(() -> new SessionNotFoundException(updated.id()));
            return update("updateFluidSession", userId, petId, zone, old, updated);
        });
    }

    private LogResult update(String op, Long userId, String petId, ZoneId zone,
                             TreatmentSession old, TreatmentSession input) {
        requireOwner(userId, petId, input);
        ValidationResult validation = structuralValidator.validate(input).orThrow();

        LocalDate day = PeriodIds.localDate(old.dateTime(), zone);
        if (!PeriodIds.localDate(input.dateTime(), zone).equals(day)) {
            throw new SessionValidationException("A session cannot be moved to another day");
        }

        List<Schedule> schedules = scheduleService.activeSchedules(userId, petId);
        ScheduleMatch match = linkOf(input, schedules, zone);
        TreatmentSession next = input.withSchedule(match);
        validation = validation.withWarnings(ruleValidator.warnings(next, scheduleById(schedules, match)));

        SummaryUpdateDto dto = dtoBuilder.fromEditDelta(old, next, day);
        if (dto.hasUpdates()) {
            writer.writeSessionWithRollups(op, next, dto, day);
        } else {
            writer.writeEventOnly(op, next);
        }
        afterCommit(userId, petId);
        syncCache(userId, petId, zone, next, () -> {
            if (cache.reverseSession(userId, petId, zone, SessionFacts.of(old))) {
                cache.putAfterSession(userId, petId, zone, SessionFacts.of(next));
            }
        });

        feature(op, Map.of("aggregated", dto.hasUpdates()));
        return new LogResult(next.id(), match, validation.warnings());
    }

    // ===== delete =====

    public void deleteMedicationSession(Long userId, String petId, ZoneId zone, String sessionId) {
        tracked("deleteMedicationSession", () -> {
            MedicationSession old = store.findMedicationSession(userId, petId, sessionId)
                    .orElseThrow(() -> new SessionNotFoundException(sessionId));
            delete("deleteMedicationSession", userId, petId, zone, old);
            return null;
        });
    }

    public void deleteFluidSession(Long userId, String petId, ZoneId zone, String sessionId) {
        tracked("deleteFluidSession", () -> {
            FluidSession old = store.findFluidSession(userId, petId, sessionId)
                    .orElseThrow(() -> new SessionNotFoundException(sessionId));
            delete("deleteFluidSession", userId, petId, zone, old);
            return null;
        });
    }

    private void delete(String op, Long userId, String petId, ZoneId zone, TreatmentSession old) {
        LocalDate day = PeriodIds.localDate(old.dateTime(), zone);
        writer.deleteSessionWithRollups(op, old, dtoBuilder.fromDeletion(old, day), day);
        afterCommit(userId, petId);
        syncCache(userId, petId, zone, old, () -> cache.reverseSession(userId, petId, zone, SessionFacts.of(old)));
        feature(op, Map.of());
    }

    // ===== quick-log =====

    /** Logs every treatment still outstanding today, in as few atomic units as possible. */
    public QuickLogResult quickLogAllTreatments(Long userId, String petId, ZoneId zone) {
        return tracked("quickLogAllTreatments", () -> {
            String op = "quickLogAllTreatments";
            Instant now = clock.instant();
            LocalDate today = PeriodIds.localDate(now, zone);

            List<Schedule> schedules = scheduleService.activeSchedules(userId, petId);
            DailySummaryCache snapshot = cache.get(userId, petId, zone)
                    .orElseGet(() -> rebuildSnapshot(op, userId, petId, zone, today));

            QuickLogPlan plan = reconciler.reconcile(userId, petId, schedules, snapshot, now, zone);
            SummaryUpdateDto dto = dtoBuilder.fromBulkSessions(plan.medicationSessions(), plan.fluidSessions(),
                    today, ScheduledDayConstants.from(schedules, today, zone), flags(op, userId, petId, today));

            BulkWriteReport report;
            try {
                report = writer.writeBulk(op, plan.allSessions(), dto, userId, petId, today);
            } catch (AtomicWriteFailureException e) {
                if (e.partiallyCommitted()) {
                    // the cache no longer knows which sessions landed; the next run reads them from the store
                    afterCommit(userId, petId);
                    cache.clear(userId, petId);
                    log.warn("quick-log partially committed user={} pet={} committedUnits={}",
                            userId, petId, e.committedChunks());
                }
                throw e;
            }
            afterCommit(userId, petId);

            DailySummaryCache merged = snapshot;
            for (TreatmentSession s : plan.allSessions()) {
                merged = merged.withSession(SessionFacts.of(s), cacheProps.getRingSize());
            }
            cache.putAfterBulk(userId, petId, zone, merged);

            double volume = plan.fluidSessions().stream().mapToDouble(FluidSession::volumeGiven).sum();
            feature(op, Map.of("medications", plan.medicationSessions().size(),
                    "fluids", plan.fluidSessions().size(), "units", report.unitsCommitted()));
            return new QuickLogResult(plan.medicationSessions().size(), plan.fluidSessions().size(),
                    volume, report.unitsCommitted());
        });
    }

    private DailySummaryCache rebuildSnapshot(String op, Long userId, String petId, ZoneId zone, LocalDate today) {
        try {
            return snapshotFromStore(userId, petId, zone, today);
        } catch (DataAccessException e) {
            throw AtomicWriteFailureException.of(op, e);
        }
    }

    private DailySummaryCache snapshotFromStore(Long userId, String petId, ZoneId zone, LocalDate today) {
        Instant from = PeriodIds.startOfDay(today, zone);
        Instant to = PeriodIds.endOfDay(today, zone);
        DailySummaryCache snapshot = DailySummaryCache.empty(today);
        for (MedicationSession m : store.findMedicationSessionsBetween(userId, petId, from, to)) {
            snapshot = snapshot.withSession(SessionFacts.of(m), cacheProps.getRingSize());
        }
        for (FluidSession f : store.findFluidSessionsBetween(userId, petId, from, to)) {
            snapshot = snapshot.withSession(SessionFacts.of(f), cacheProps.getRingSize());
        }
        log.debug("snapshot rebuilt from store user={} pet={} meds={} fluids={}",
                userId, petId, snapshot.medicationSessionCount(), snapshot.fluidSessionCount());
        return snapshot;
    }

    /**
     * Applies a committed change to today's cache entry. With no entry the change is not applied on top of
     * nothing; today's entry is rebuilt from the store, which already holds the change.
     */
    private void syncCache(Long userId, String petId, ZoneId zone, TreatmentSession changed, Runnable incremental) {
        LocalDate today = LocalDate.now(clock.withZone(zone));
        if (!PeriodIds.localDate(changed.dateTime(), zone).equals(today)) return;

        if (cache.get(userId, petId, zone).isPresent()) {
            incremental.run();
            return;
        }
        try {
            cache.putAfterBulk(userId, petId, zone, snapshotFromStore(userId, petId, zone, today));
        } catch (DataAccessException e) {
            log.warn("cache left empty after write user={} pet={}: {}", userId, petId, e.toString());
        }
    }

    // ===== reads =====

    public List<MedicationSession> getTodaysMedicationSessions(Long userId, String petId, ZoneId zone,
                                                               String medicationName) {
        LocalDate today = LocalDate.now(clock.withZone(zone));
        return store.findMedicationSessionsBetween(userId, petId,
                        PeriodIds.startOfDay(today, zone), PeriodIds.endOfDay(today, zone)).stream()
                .filter(m -> medicationName == null || medicationName.equals(m.medicationName()))
                .sorted(Comparator.comparing(MedicationSession::dateTime))
                .toList();
    }

    // ===== queue replay =====

    /**
     * Replays a queued command through the live entry points. A create whose session id is already
     * stored was applied before the queue lost track of it and is skipped.
     */
    @Override
    public void replay(LoggingCommand command) {
        ZoneId zone = command.zone();
        if (command instanceof LoggingCommand.CreateMedication c) {
            if (store.findMedicationSession(c.userId(), c.petId(), c.session().id()).isPresent()) {
                log.info("replay skipped, session {} already stored", c.session().id());
                return;
            }
            logMedicationSession(c.userId(), c.petId(), zone, c.session());
        } else if (command instanceof LoggingCommand.CreateFluid c) {
            if (store.findFluidSession(c.userId(), c.petId(), c.session().id()).isPresent()) {
                log.info("replay skipped, session {} already stored", c.session().id());
                return;
            }
            logFluidSession(c.userId(), c.petId(), zone, c.session());
        } else if (command instanceof LoggingCommand.UpdateMedication c) {
            updateMedicationSession(c.userId(), c.petId(), zone, c.session());
        } else if (command instanceof LoggingCommand.UpdateFluid c) {
            updateFluidSession(c.userId(), c.petId(), zone, c.session());
        } else if (command instanceof LoggingCommand.QuickLogAll c) {
            requireSameDay(c, zone);
            quickLogAllTreatments(c.userId(), c.petId(), zone);
        }
    }

    /** A quick-log confirmed on one day is never replayed into another. Entries without a stamp predate it. */
    private void requireSameDay(LoggingCommand.QuickLogAll command, ZoneId zone) {
        if (command.requestedAt() == null) return;
        LocalDate requested = PeriodIds.localDate(command.requestedAt(), zone);
        LocalDate today = LocalDate.now(clock.withZone(zone));
        if (!requested.equals(today)) {
            throw new SessionValidationException("Quick-log requested on " + requested
                    + " can no longer be applied on " + today);
        }
    }

    // ===== helpers =====

    /** A link the client already sent is kept; otherwise the matcher decides. */
    private ScheduleMatch linkOf(TreatmentSession session, List<Schedule> schedules, ZoneId zone) {
        if (session.scheduleId() != null) {
            return new ScheduleMatch(session.scheduleId(), session.scheduledTime());
        }
        return matcher.match(session, schedules, zone);
    }

    private void rejectDuplicate(Long userId, String petId, ZoneId zone, MedicationSession med) {
        List<MedicationSession> recent = duplicateCandidates.candidatesFor(userId, petId, zone, med);
        Optional<MedicationSession> dup = duplicateDetector.findDuplicate(med, recent);
        if (dup.isPresent()) {
            log.debug("duplicate rejected name={} at={} existing={}", med.medicationName(), med.dateTime(),
                    dup.get().dateTime());
            throw new DuplicateConflictException(med.medicationName(), dup.get().dateTime(), dup.get().id());
        }
    }

    private SetOnceFlags flags(String op, Long userId, String petId, LocalDate day) {
        try {
            return setOnceResolver.resolve(userId, petId, day);
        } catch (DataAccessException e) {
            throw AtomicWriteFailureException.of(op, e);
        }
    }

    private static Schedule scheduleById(List<Schedule> schedules, ScheduleMatch match) {
        if (!match.matched()) return null;
        return schedules.stream().filter(s -> match.scheduleId().equals(s.id())).findFirst().orElse(null);
    }

    private static void requireOwner(Long userId, String petId, TreatmentSession session) {
        if (!Objects.equals(userId, session.userId()) || !Objects.equals(petId, session.petId())) {
            throw new SessionValidationException("Session does not belong to this user and pet");
        }
    }

    private void afterCommit(Long userId, String petId) {
        summaries.invalidate(userId, petId);
    }

    private <T> T tracked(String op, Supplier<T> body) {
        try {
            return body.get();
        } catch (LoggingException e) {
            try {
                Map<String, Object> ctx = new HashMap<>(e.context());
                ctx.put("operation", op);
                analytics.trackLoggingFailure(e.kind(), ctx);
            } catch (RuntimeException analyticsError) {
                log.debug("analytics failure ignored: {}", analyticsError.toString());
            }
            throw e;
        }
    }

    private void feature(String op, Map<String, Object> props) {
        try {
            analytics.trackFeatureUsed(op, props);
        } catch (RuntimeException e) {
            log.debug("analytics failure ignored: {}", e.toString());
        }
    }
}
