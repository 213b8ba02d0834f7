package com.hydralog.backend.logging.store;

import com.hydralog.backend.logging.entity.FluidSessionEntity;
import com.hydralog.backend.logging.entity.MedicationSessionEntity;
import com.hydralog.backend.logging.entity.TreatmentSummaryDayEntity;
import com.hydralog.backend.logging.entity.TreatmentSummaryEntity;
import com.hydralog.backend.logging.model.FluidSession;
import com.hydralog.backend.logging.model.MedicationSession;
import com.hydralog.backend.logging.model.PeriodType;
import com.hydralog.backend.logging.model.TreatmentSession;
import com.hydralog.backend.logging.repo.FluidSessionRepository;
import com.hydralog.backend.logging.repo.MedicationSessionRepository;
import com.hydralog.backend.logging.repo.TreatmentSummaryDayRepository;
import com.hydralog.backend.logging.repo.TreatmentSummaryRepository;
import com.hydralog.backend.logging.summary.SummaryUpdateDto;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Component;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * MySQL-backed store. A {@link WriteUnit} runs inside one {@link TransactionTemplate} transaction;
 * rollups go through {@code INSERT ... ON DUPLICATE KEY UPDATE col = col + delta}.
 */
@Slf4j
@Component
public class JpaTreatmentStore implements TreatmentStore {

    private final MedicationSessionRepository medicationRepo;
    private final FluidSessionRepository fluidRepo;
    private final TreatmentSummaryRepository summaryRepo;
    private final TreatmentSummaryDayRepository dayRepo;
    private final TransactionTemplate tx;
    private final Clock clock;

    public JpaTreatmentStore(MedicationSessionRepository medicationRepo,
                             FluidSessionRepository fluidRepo,
                             TreatmentSummaryRepository summaryRepo,
                             TreatmentSummaryDayRepository dayRepo,
                             PlatformTransactionManager txManager,
                             Clock clock) {
        this.medicationRepo = medicationRepo;
        this.fluidRepo = fluidRepo;
        this.summaryRepo = summaryRepo;
        this.dayRepo = dayRepo;
        this.tx = new TransactionTemplate(txManager);
        this.clock = clock;
    }

    @Override
    public void commit(WriteUnit unit) {
        Instant now = Instant.now(clock);
        tx.executeWithoutResult(status -> {
            for (StoreOperation op : unit.operations()) {
                apply(op, now);
            }
        });
        log.debug("write unit committed: ops={} rollups={}", unit.size(), unit.rollupCount());
    }

    private void apply(StoreOperation op, Instant now) {
        if (op instanceof StoreOperation.UpsertSession u) {
            upsertSession(u.session(), now);
        } else if (op instanceof StoreOperation.DeleteSession d) {
            deleteSession(d.session());
        } else if (op instanceof StoreOperation.ApplyRollup r) {
            applyRollup(r.ref(), r.dto(), now);
        }
    }

    private void upsertSession(TreatmentSession session, Instant now) {
        if (session instanceof MedicationSession m) {
            MedicationSessionEntity e = medicationRepo.findById(m.id()).orElseGet(MedicationSessionEntity::new);
            e.apply(m);
            if (e.getCreatedAt() == null) e.setCreatedAt(now);
            e.setUpdatedAt(now);
            medicationRepo.save(e);
        } else if (session instanceof FluidSession f) {
            FluidSessionEntity e = fluidRepo.findById(f.id()).orElseGet(FluidSessionEntity::new);
            e.apply(f);
            if (e.getCreatedAt() == null) e.setCreatedAt(now);
            e.setUpdatedAt(now);
            fluidRepo.save(e);
        }
    }

    private void deleteSession(TreatmentSession session) {
        if (session instanceof MedicationSession) {
            medicationRepo.deleteById(session.id());
        } else {
            fluidRepo.deleteById(session.id());
        }
    }

    private void applyRollup(RollupRef ref, SummaryUpdateDto dto, Instant now) {
        PeriodType type = ref.periodType();
        boolean daily = type == PeriodType.DAILY;

        // daily rows take the constants as absolute values below; longer periods add them once per day
        summaryRepo.upsertIncrements(
                ref.userId(), ref.petId(), type.name(), ref.periodId(),
                type.startDate(ref.day()), type.endDate(ref.day()),
                dto.medicationDosesOrZero(),
                daily ? 0 : dto.medicationScheduledOrZero(),
                dto.medicationMissedOrZero(),
                dto.fluidVolumeOrZero(),
                dto.fluidSessionsOrZero(),
                daily ? 0 : dto.fluidScheduledSessionsOrZero(),
                daily && Boolean.TRUE.equals(dto.fluidTreatmentDone()),
                now);

        switch (type) {
            case DAILY -> {
                if (dto.recordsDailyMedicationSchedule()) {
                    summaryRepo.recordDailyMedicationSchedule(ref.userId(), ref.petId(), ref.periodId(),
                            dto.medicationScheduledDoses(), now);
                }
                if (dto.recordsDailyFluidSchedule()) {
                    summaryRepo.recordDailyFluidSchedule(ref.userId(), ref.petId(), ref.periodId(),
                            dto.fluidScheduledSessionsOrZero(), dto.fluidDailyGoalMl(), now);
                }
            }
            case WEEKLY -> {
                if (dto.fluidWeeklyGoalMl() != null) {
                    summaryRepo.recordWeeklyFluidGoal(ref.userId(), ref.petId(), ref.periodId(),
                            dto.fluidWeeklyGoalMl(), now);
                }
            }
            case MONTHLY -> applyMonthDay(ref, dto, now);
        }
    }

    private void applyMonthDay(RollupRef ref, SummaryUpdateDto dto, Instant now) {
        String monthId = ref.periodId();
        int day = dto.dayOfMonth();
        dayRepo.upsertIncrements(ref.userId(), ref.petId(), monthId, day,
                dto.medicationDosesOrZero(), dto.fluidVolumeOrZero(), now);

        if (dto.recordsMonthDayMedicationSchedule()) {
            dayRepo.recordMedicationSchedule(ref.userId(), ref.petId(), monthId, day,
                    dto.monthDayMedicationScheduledDoses(), now);
        }
        if (dto.recordsMonthDayFluidSchedule()) {
            dayRepo.recordFluidSchedule(ref.userId(), ref.petId(), monthId, day,
                    dto.monthDayFluidScheduledSessions() == null ? 0 : dto.monthDayFluidScheduledSessions(),
                    dto.monthDayFluidGoalMl() == null ? 0 : dto.monthDayFluidGoalMl(),
                    now);
        }
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<MedicationSession> findMedicationSession(Long userId, String petId, String sessionId) {
        return medicationRepo.findByIdAndUserIdAndPetId(sessionId, userId, petId)
                .map(MedicationSessionEntity::toModel);
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<FluidSession> findFluidSession(Long userId, String petId, String sessionId) {
        return fluidRepo.findByIdAndUserIdAndPetId(sessionId, userId, petId)
                .map(FluidSessionEntity::toModel);
    }

    @Override
    @Transactional(readOnly = true)
    public List<MedicationSession> findMedicationSessions(Long userId, String petId, String medicationName,
                                                          Instant from, Instant to, int limit) {
        return medicationRepo.findNamedInRange(userId, petId, medicationName, from, to, PageRequest.of(0, limit))
                .stream()
                .map(MedicationSessionEntity::toModel)
                .toList();
    }

    @Override
    @Transactional(readOnly = true)
    public List<MedicationSession> findMedicationSessionsBetween(Long userId, String petId,
                                                                 Instant from, Instant toExclusive) {
        return medicationRepo
                .findByUserIdAndPetIdAndDateTimeGreaterThanEqualAndDateTimeLessThanOrderByDateTimeAsc(
                        userId, petId, from, toExclusive)
                .stream()
                .map(MedicationSessionEntity::toModel)
                .toList();
    }

    @Override
    @Transactional(readOnly = true)
    public List<FluidSession> findFluidSessionsBetween(Long userId, String petId, Instant from, Instant toExclusive) {
        return fluidRepo
                .findByUserIdAndPetIdAndDateTimeGreaterThanEqualAndDateTimeLessThanOrderByDateTimeAsc(
                        userId, petId, from, toExclusive)
                .stream()
                .map(FluidSessionEntity::toModel)
                .toList();
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<TreatmentSummaryEntity> findSummary(Long userId, String petId, PeriodType periodType, String periodId) {
        return summaryRepo.findByUserIdAndPetIdAndPeriodTypeAndPeriodId(userId, petId, periodType, periodId);
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<TreatmentSummaryDayEntity> findSummaryDay(Long userId, String petId, String monthId, int dayOfMonth) {
        return dayRepo.findByUserIdAndPetIdAndMonthIdAndDayOfMonth(userId, petId, monthId, dayOfMonth);
    }

    @Override
    @Transactional(readOnly = true)
    public List<TreatmentSummaryDayEntity> findSummaryDays(Long userId, String petId, String monthId) {
        return dayRepo.findByUserIdAndPetIdAndMonthIdOrderByDayOfMonthAsc(userId, petId, monthId);
    }
}
