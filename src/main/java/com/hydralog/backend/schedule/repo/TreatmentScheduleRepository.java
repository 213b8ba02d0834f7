package com.hydralog.backend.schedule.repo;

import com.hydralog.backend.schedule.entity.TreatmentScheduleEntity;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface TreatmentScheduleRepository extends JpaRepository<TreatmentScheduleEntity, String> {

    List<TreatmentScheduleEntity> findByUserIdAndPetIdAndActiveTrueOrderByIdAsc(Long userId, String petId);
}
