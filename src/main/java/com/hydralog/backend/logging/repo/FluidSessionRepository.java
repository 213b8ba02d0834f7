package com.hydralog.backend.logging.repo;

import com.hydralog.backend.logging.entity.FluidSessionEntity;
import org.springframework.data.jpa.repository.JpaRepository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

public interface FluidSessionRepository extends JpaRepository<FluidSessionEntity, String> {

    Optional<FluidSessionEntity> findByIdAndUserIdAndPetId(String id, Long userId, String petId);

    List<FluidSessionEntity> findByUserIdAndPetIdAndDateTimeGreaterThanEqualAndDateTimeLessThanOrderByDateTimeAsc(
            Long userId, String petId, Instant from, Instant toExclusive);
}
