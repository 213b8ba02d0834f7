package com.hydralog.backend.logging.repo;

import com.hydralog.backend.logging.entity.TreatmentSummaryDayEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

public interface TreatmentSummaryDayRepository extends JpaRepository<TreatmentSummaryDayEntity, Long> {

    Optional<TreatmentSummaryDayEntity> findByUserIdAndPetIdAndMonthIdAndDayOfMonth(
            Long userId, String petId, String monthId, int dayOfMonth);

    List<TreatmentSummaryDayEntity> findByUserIdAndPetIdAndMonthIdOrderByDayOfMonthAsc(
            Long userId, String petId, String monthId);

    @Modifying
    @Query(
            value = """
        INSERT INTO treatment_summary_days(
            user_id, pet_id, month_id, day_of_month,
            medication_doses, medication_scheduled_doses, fluid_volume, fluid_goal_ml, fluid_scheduled_sessions,
            medication_schedule_recorded, fluid_schedule_recorded, updated_at)
        VALUES (
            :userId, :petId, :monthId, :day,
            :doses, 0, :volume, 0, 0,
            false, false, :now)
        ON DUPLICATE KEY UPDATE
            medication_doses = medication_doses + :doses,
            fluid_volume = fluid_volume + :volume,
            updated_at = :now
        """,
            nativeQuery = true
    )
    int upsertIncrements(@Param("userId") Long userId,
                         @Param("petId") String petId,
                         @Param("monthId") String monthId,
                         @Param("day") int dayOfMonth,
                         @Param("doses") int doses,
                         @Param("volume") double volume,
                         @Param("now") Instant now);

    @Modifying
    @Query(
            value = """
        UPDATE treatment_summary_days
        SET medication_scheduled_doses = :scheduledDoses,
            medication_schedule_recorded = true,
            updated_at = :now
        WHERE user_id = :userId AND pet_id = :petId AND month_id = :monthId AND day_of_month = :day
        """,
            nativeQuery = true
    )
    int recordMedicationSchedule(@Param("userId") Long userId,
                                 @Param("petId") String petId,
                                 @Param("monthId") String monthId,
                                 @Param("day") int dayOfMonth,
                                 @Param("scheduledDoses") int scheduledDoses,
                                 @Param("now") Instant now);

    @Modifying
    @Query(
            value = """
        UPDATE treatment_summary_days
        SET fluid_scheduled_sessions = :scheduledSessions,
            fluid_goal_ml = :goalMl,
            fluid_schedule_recorded = true,
            updated_at = :now
        WHERE user_id = :userId AND pet_id = :petId AND month_id = :monthId AND day_of_month = :day
        """,
            nativeQuery = true
    )
    int recordFluidSchedule(@Param("userId") Long userId,
                            @Param("petId") String petId,
                            @Param("monthId") String monthId,
                            @Param("day") int dayOfMonth,
                            @Param("scheduledSessions") int scheduledSessions,
                            @Param("goalMl") double goalMl,
                            @Param("now") Instant now);
}
