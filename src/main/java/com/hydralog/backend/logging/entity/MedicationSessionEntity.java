package com.hydralog.backend.logging.entity;

import com.hydralog.backend.logging.model.MedicationSession;
import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;

import java.time.Instant;

@Getter
@Setter
@Entity
@Table(name = "medication_sessions",
        indexes = {
                @Index(name = "idx_med_sessions_user_pet_name_time", columnList = "user_id,pet_id,medication_name,date_time"),
                @Index(name = "idx_med_sessions_user_pet_time", columnList = "user_id,pet_id,date_time")
        }
)
public class MedicationSessionEntity {

    @Id
    @Column(length = 36)
    private String id;

    @Column(name = "user_id", nullable = false)
    private Long userId;

    @Column(name = "pet_id", nullable = false, length = 64)
    private String petId;

    @Column(name = "date_time", nullable = false)
    private Instant dateTime;

    @Column(name = "medication_name", nullable = false, length = 128)
    private String medicationName;

    @Column(name = "dosage_given", nullable = false)
    private double dosageGiven;

    @Column(name = "dosage_scheduled", nullable = false)
    private double dosageScheduled;

    @Column(name = "medication_unit", nullable = false, length = 32)
    private String medicationUnit;

    @Column(nullable = false)
    private boolean completed;

    @Column(name = "schedule_id", length = 36)
    private String scheduleId;

    @Column(name = "scheduled_time")
    private Instant scheduledTime;

    @Column(length = 500)
    private String notes;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    /** Copies the client-owned fields; server timestamps stay with the caller. */
    public void apply(MedicationSession s) {
        this.id = s.id();
        this.userId = s.userId();
        this.petId = s.petId();
        this.dateTime = s.dateTime();
        this.medicationName = s.medicationName();
        this.dosageGiven = s.dosageGiven();
        this.dosageScheduled = s.dosageScheduled();
        this.medicationUnit = s.medicationUnit();
        this.completed = s.completed();
        this.scheduleId = s.scheduleId();
        this.scheduledTime = s.scheduledTime();
        this.notes = s.notes();
    }

    public MedicationSession toModel() {
        return new MedicationSession(id, userId, petId, dateTime, medicationName, dosageGiven, dosageScheduled,
                medicationUnit, completed, scheduleId, scheduledTime, notes, createdAt, updatedAt);
    }
}
