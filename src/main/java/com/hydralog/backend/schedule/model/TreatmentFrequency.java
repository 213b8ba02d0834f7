package com.hydralog.backend.schedule.model;

/**
 * Daily frequencies fire every day; interval frequencies fire every {@code intervalDays} counted from the anchor date.
 */
public enum TreatmentFrequency {
    ONCE_DAILY(1),
    TWICE_DAILY(1),
    THRICE_DAILY(1),
    EVERY_OTHER_DAY(2),
    EVERY_3_DAYS(3);

    private final int intervalDays;

    TreatmentFrequency(int intervalDays) {
        this.intervalDays = intervalDays;
    }

    public int intervalDays() {
        return intervalDays;
    }

    public boolean isDaily() {
        return intervalDays == 1;
    }
}
