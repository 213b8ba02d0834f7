package com.hydralog.backend.logging.entity;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;

import java.time.Instant;

/** One slot of a monthly rollup's per-day arrays. */
@Getter
@Setter
@Entity
@Table(name = "treatment_summary_days",
        uniqueConstraints = @UniqueConstraint(name = "uk_treatment_summary_days_slot",
                columnNames = {"user_id", "pet_id", "month_id", "day_of_month"})
)
public class TreatmentSummaryDayEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "user_id", nullable = false)
    private Long userId;

    @Column(name = "pet_id", nullable = false, length = 64)
    private String petId;

    @Column(name = "month_id", nullable = false, length = 7)
    private String monthId;

    @Column(name = "day_of_month", nullable = false)
    private int dayOfMonth;

    @Column(name = "medication_doses", nullable = false)
    private int medicationDoses;

    @Column(name = "medication_scheduled_doses", nullable = false)
    private int medicationScheduledDoses;

    @Column(name = "fluid_volume", nullable = false)
    private double fluidVolume;

    @Column(name = "fluid_goal_ml", nullable = false)
    private double fluidGoalMl;

    @Column(name = "fluid_scheduled_sessions", nullable = false)
    private int fluidScheduledSessions;

    @Column(name = "medication_schedule_recorded", nullable = false)
    private boolean medicationScheduleRecorded;

    @Column(name = "fluid_schedule_recorded", nullable = false)
    private boolean fluidScheduleRecorded;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;
}
