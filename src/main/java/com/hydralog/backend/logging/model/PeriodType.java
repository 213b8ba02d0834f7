package com.hydralog.backend.logging.model;

import com.hydralog.backend.common.time.PeriodIds;

import java.time.LocalDate;

public enum PeriodType {
    DAILY,
    WEEKLY,
    MONTHLY;

    public String periodId(LocalDate day) {
        return switch (this) {
            case DAILY -> PeriodIds.daily(day);
            case WEEKLY -> PeriodIds.weekly(day);
            case MONTHLY -> PeriodIds.monthly(day);
        };
    }

    public LocalDate startDate(LocalDate day) {
        return switch (this) {
            case DAILY -> day;
            case WEEKLY -> PeriodIds.weekStart(day);
            case MONTHLY -> PeriodIds.monthStart(day);
        };
    }

    public LocalDate endDate(LocalDate day) {
        return switch (this) {
            case DAILY -> day;
            case WEEKLY -> PeriodIds.weekEnd(day);
            case MONTHLY -> PeriodIds.monthEnd(day);
        };
    }
}
