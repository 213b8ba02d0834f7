package com.hydralog.backend.logging.summary;

/** Which per-period constants are already recorded, as read from the target rows before a write. */
public record SetOnceFlags(
        boolean dailyMedicationRecorded,
        boolean dailyFluidRecorded,
        boolean weeklyFluidGoalRecorded,
        boolean monthDayMedicationRecorded,
        boolean monthDayFluidRecorded
) {
    public static final SetOnceFlags NONE_RECORDED = new SetOnceFlags(false, false, false, false, false);
    public static final SetOnceFlags ALL_RECORDED = new SetOnceFlags(true, true, true, true, true);
}
