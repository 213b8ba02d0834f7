package com.hydralog.backend.schedule.entity;

import com.hydralog.backend.schedule.model.FluidLocation;
import com.hydralog.backend.schedule.model.Schedule;
import com.hydralog.backend.schedule.model.TreatmentFrequency;
import com.hydralog.backend.schedule.model.TreatmentType;
import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.util.ArrayList;
import java.util.List;

@Getter
@Setter
@Entity
@Table(name = "treatment_schedules",
        indexes = @Index(name = "idx_treatment_schedules_user_pet", columnList = "user_id,pet_id,active")
)
public class TreatmentScheduleEntity {

    @Id
    @Column(length = 36)
    private String id;

    @Column(name = "user_id", nullable = false)
    private Long userId;

    @Column(name = "pet_id", nullable = false, length = 64)
    private String petId;

    @Enumerated(EnumType.STRING)
    @Column(name = "treatment_type", nullable = false, length = 16)
    private TreatmentType treatmentType;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 24)
    private TreatmentFrequency frequency;

    @Convert(converter = LocalTimeListConverter.class)
    @Column(name = "reminder_times", nullable = false, length = 255)
    private List<LocalTime> reminderTimes = new ArrayList<>();

    @Column(nullable = false)
    private boolean active = true;

    @Column(name = "anchor_date")
    private LocalDate anchorDate;

    @Column(name = "medication_name", length = 128)
    private String medicationName;

    @Column(name = "target_dosage")
    private Double targetDosage;

    @Column(name = "medication_unit", length = 32)
    private String medicationUnit;

    @Column(name = "target_volume")
    private Double targetVolume;

    @Enumerated(EnumType.STRING)
    @Column(name = "preferred_location", length = 32)
    private FluidLocation preferredLocation;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @PrePersist @PreUpdate
    void touchUpdatedAt() {
        this.updatedAt = Instant.now();
    }

    public Schedule toModel() {
        return new Schedule(id, treatmentType, frequency, reminderTimes, active, anchorDate,
                medicationName, targetDosage, medicationUnit, targetVolume, preferredLocation);
    }
}
