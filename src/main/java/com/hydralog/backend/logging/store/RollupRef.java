package com.hydralog.backend.logging.store;

import com.hydralog.backend.logging.model.PeriodType;

import java.time.LocalDate;

/** Addresses the rollup row of {@code periodType} that contains {@code day}. */
public record RollupRef(Long userId, String petId, PeriodType periodType, LocalDate day) {

    public String periodId() {
        return periodType.periodId(day);
    }

    public static RollupRef daily(Long userId, String petId, LocalDate day) {
        return new RollupRef(userId, petId, PeriodType.DAILY, day);
    }

    public static RollupRef weekly(Long userId, String petId, LocalDate day) {
        return new RollupRef(userId, petId, PeriodType.WEEKLY, day);
    }

    public static RollupRef monthly(Long userId, String petId, LocalDate day) {
        return new RollupRef(userId, petId, PeriodType.MONTHLY, day);
    }
}
