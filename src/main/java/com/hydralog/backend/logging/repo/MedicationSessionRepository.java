package com.hydralog.backend.logging.repo;

import com.hydralog.backend.logging.entity.MedicationSessionEntity;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

public interface MedicationSessionRepository extends JpaRepository<MedicationSessionEntity, String> {

    Optional<MedicationSessionEntity> findByIdAndUserIdAndPetId(String id, Long userId, String petId);

    @Query("""
        select m from MedicationSessionEntity m
        where m.userId = :userId
          and m.petId = :petId
          and m.medicationName = :name
          and m.dateTime >= :from
          and m.dateTime <= :to
        order by m.dateTime desc
        """)
    List<MedicationSessionEntity> findNamedInRange(@Param("userId") Long userId,
                                                   @Param("petId") String petId,
                                                   @Param("name") String medicationName,
                                                   @Param("from") Instant from,
                                                   @Param("to") Instant to,
                                                   Pageable pageable);

    List<MedicationSessionEntity> findByUserIdAndPetIdAndDateTimeGreaterThanEqualAndDateTimeLessThanOrderByDateTimeAsc(
            Long userId, String petId, Instant from, Instant toExclusive);
}
