package com.hydralog.backend.logging.repo;

import com.hydralog.backend.logging.entity.TreatmentSummaryEntity;
import com.hydralog.backend.logging.model.PeriodType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.Instant;
import java.time.LocalDate;
import java.util.Optional;

public interface TreatmentSummaryRepository extends JpaRepository<TreatmentSummaryEntity, Long> {

    Optional<TreatmentSummaryEntity> findByUserIdAndPetIdAndPeriodTypeAndPeriodId(
            Long userId, String petId, PeriodType periodType, String periodId);

    /** Creates the row on first touch, otherwise adds the deltas. Commutative across writers. */
    @Modifying
    @Query(
            value = """
        INSERT INTO treatment_summaries(
            user_id, pet_id, period_type, period_id, start_date, end_date,
            medication_total_doses, medication_scheduled_doses, medication_missed_count,
            fluid_total_volume, fluid_session_count, fluid_scheduled_sessions,
            fluid_treatment_done, overall_streak,
            medication_schedule_recorded, fluid_schedule_recorded, fluid_weekly_goal_recorded,
            created_at, updated_at)
        VALUES (
            :userId, :petId, :periodType, :periodId, :startDate, :endDate,
            :doses, :scheduledDoses, :missed,
            :volume, :sessions, :scheduledSessions,
            :treatmentDone, 0,
            false, false, false,
            :now, :now)
        ON DUPLICATE KEY UPDATE
            medication_total_doses = medication_total_doses + :doses,
            medication_scheduled_doses = medication_scheduled_doses + :scheduledDoses,
            medication_missed_count = medication_missed_count + :missed,
            fluid_total_volume = fluid_total_volume + :volume,
            fluid_session_count = fluid_session_count + :sessions,
            fluid_scheduled_sessions = fluid_scheduled_sessions + :scheduledSessions,
            fluid_treatment_done = (fluid_treatment_done OR :treatmentDone),
            updated_at = :now
        """,
            nativeQuery = true
    )
    int upsertIncrements(@Param("userId") Long userId,
                         @Param("petId") String petId,
                         @Param("periodType") String periodType,
                         @Param("periodId") String periodId,
                         @Param("startDate") LocalDate startDate,
                         @Param("endDate") LocalDate endDate,
                         @Param("doses") int doses,
                         @Param("scheduledDoses") int scheduledDosesDelta,
                         @Param("missed") int missed,
                         @Param("volume") double volume,
                         @Param("sessions") int sessions,
                         @Param("scheduledSessions") int scheduledSessionsDelta,
                         @Param("treatmentDone") boolean treatmentDone,
                         @Param("now") Instant now);

    @Modifying
    @Query(
            value = """
        UPDATE treatment_summaries
        SET medication_scheduled_doses = :scheduledDoses,
            medication_schedule_recorded = true,
            updated_at = :now
        WHERE user_id = :userId AND pet_id = :petId
          AND period_type = 'DAILY' AND period_id = :periodId
        """,
            nativeQuery = true
    )
    int recordDailyMedicationSchedule(@Param("userId") Long userId,
                                      @Param("petId") String petId,
                                      @Param("periodId") String periodId,
                                      @Param("scheduledDoses") int scheduledDoses,
                                      @Param("now") Instant now);

    @Modifying
    @Query(
            value = """
        UPDATE treatment_summaries
        SET fluid_scheduled_sessions = :scheduledSessions,
            fluid_daily_goal_ml = :goalMl,
            fluid_schedule_recorded = true,
            updated_at = :now
        WHERE user_id = :userId AND pet_id = :petId
          AND period_type = 'DAILY' AND period_id = :periodId
        """,
            nativeQuery = true
    )
    int recordDailyFluidSchedule(@Param("userId") Long userId,
                                 @Param("petId") String petId,
                                 @Param("periodId") String periodId,
                                 @Param("scheduledSessions") int scheduledSessions,
                                 @Param("goalMl") Double goalMl,
                                 @Param("now") Instant now);

    @Modifying
    @Query(
            value = """
        UPDATE treatment_summaries
        SET fluid_scheduled_volume = :goalMl,
            fluid_weekly_goal_recorded = true,
            updated_at = :now
        WHERE user_id = :userId AND pet_id = :petId
          AND period_type = 'WEEKLY' AND period_id = :periodId
        """,
            nativeQuery = true
    )
    int recordWeeklyFluidGoal(@Param("userId") Long userId,
                              @Param("petId") String petId,
                              @Param("periodId") String periodId,
                              @Param("goalMl") double goalMl,
                              @Param("now") Instant now);
}
