package com.hydralog.backend.logging.entity;

import com.hydralog.backend.logging.model.FluidSession;
import com.hydralog.backend.logging.model.StressLevel;
import com.hydralog.backend.schedule.model.FluidLocation;
import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;

import java.time.Instant;

@Getter
@Setter
@Entity
@Table(name = "fluid_sessions",
        indexes = @Index(name = "idx_fluid_sessions_user_pet_time", columnList = "user_id,pet_id,date_time")
)
public class FluidSessionEntity {

    @Id
    @Column(length = 36)
    private String id;

    @Column(name = "user_id", nullable = false)
    private Long userId;

    @Column(name = "pet_id", nullable = false, length = 64)
    private String petId;

    @Column(name = "date_time", nullable = false)
    private Instant dateTime;

    @Column(name = "volume_given", nullable = false)
    private double volumeGiven;

    @Enumerated(EnumType.STRING)
    @Column(name = "injection_site", length = 32)
    private FluidLocation injectionSite;

    @Enumerated(EnumType.STRING)
    @Column(name = "stress_level", length = 16)
    private StressLevel stressLevel;

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

    public void apply(FluidSession s) {
        this.id = s.id();
        this.userId = s.userId();
        this.petId = s.petId();
        this.dateTime = s.dateTime();
        this.volumeGiven = s.volumeGiven();
        this.injectionSite = s.injectionSite();
        this.stressLevel = s.stressLevel();
        this.scheduleId = s.scheduleId();
        this.scheduledTime = s.scheduledTime();
        this.notes = s.notes();
    }

    public FluidSession toModel() {
        return new FluidSession(id, userId, petId, dateTime, volumeGiven, injectionSite, stressLevel,
                scheduleId, scheduledTime, notes, createdAt, updatedAt);
    }
}
