package com.hydralog.backend.logging.entity;

import com.hydralog.backend.logging.model.PeriodType;
import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;

import java.time.Instant;
import java.time.LocalDate;

/**
 * One rollup row per (user, pet, period). Counters only move through commutative increments;
 * scheduled totals and goals are written once per period, guarded by the *_recorded sentinels.
 */
@Getter
@Setter
@Entity
@Table(name = "treatment_summaries",
        uniqueConstraints = @UniqueConstraint(name = "uk_treatment_summaries_period",
                columnNames = {"user_id", "pet_id", "period_type", "period_id"})
)
public class TreatmentSummaryEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "user_id", nullable = false)
    private Long userId;

    @Column(name = "pet_id", nullable = false, length = 64)
    private String petId;

    @Enumerated(EnumType.STRING)
    @Column(name = "period_type", nullable = false, length = 16)
    private PeriodType periodType;

    @Column(name = "period_id", nullable = false, length = 16)
    private String periodId;

    @Column(name = "start_date", nullable = false)
    private LocalDate startDate;

    @Column(name = "end_date", nullable = false)
    private LocalDate endDate;

    @Column(name = "medication_total_doses", nullable = false)
    private int medicationTotalDoses;

    @Column(name = "medication_scheduled_doses", nullable = false)
    private int medicationScheduledDoses;

    @Column(name = "medication_missed_count", nullable = false)
    private int medicationMissedCount;

    @Column(name = "fluid_total_volume", nullable = false)
    private double fluidTotalVolume;

    @Column(name = "fluid_session_count", nullable = false)
    private int fluidSessionCount;

    @Column(name = "fluid_scheduled_sessions", nullable = false)
    private int fluidScheduledSessions;

    /** daily rows only */
    @Column(name = "fluid_daily_goal_ml")
    private Double fluidDailyGoalMl;

    /** weekly rows only */
    @Column(name = "fluid_scheduled_volume")
    private Double fluidScheduledVolume;

    @Column(name = "fluid_treatment_done", nullable = false)
    private boolean fluidTreatmentDone;

    /** computed by an external batch job; this service always writes 0 */
    @Column(name = "overall_streak", nullable = false)
    private int overallStreak;

    @Column(name = "medication_schedule_recorded", nullable = false)
    private boolean medicationScheduleRecorded;

    @Column(name = "fluid_schedule_recorded", nullable = false)
    private boolean fluidScheduleRecorded;

    @Column(name = "fluid_weekly_goal_recorded", nullable = false)
    private boolean fluidWeeklyGoalRecorded;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;
}
