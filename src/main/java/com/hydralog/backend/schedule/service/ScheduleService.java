package com.hydralog.backend.schedule.service;

import com.hydralog.backend.schedule.entity.TreatmentScheduleEntity;
import com.hydralog.backend.schedule.model.Schedule;
import com.hydralog.backend.schedule.repo.TreatmentScheduleRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDate;
import java.time.ZoneId;
import java.util.List;

/**
 * Read-only access to a pet's prescriptions. Schedules are written by the profile feature, never here.
 */
@Service
@RequiredArgsConstructor
public class ScheduleService {

    private final TreatmentScheduleRepository repo;

    @Transactional(readOnly = true)
    public List<Schedule> activeSchedules(Long userId, String petId) {
        return repo.findByUserIdAndPetIdAndActiveTrueOrderByIdAsc(userId, petId).stream()
                .map(TreatmentScheduleEntity::toModel)
                .toList();
    }

    /** Active schedules with at least one reminder on {@code date}. */
    @Transactional(readOnly = true)
    public List<Schedule> schedulesDueOn(Long userId, String petId, LocalDate date, ZoneId zone) {
        return activeSchedules(userId, petId).stream()
                .filter(s -> s.hasReminderOn(date, zone))
                .toList();
    }
}
