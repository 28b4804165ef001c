package com.len.waitingroom.application.expiry;

public record ReconcileResult(
        ScanOutcome outcome,
        long startWatermark,
        long endWatermark,
        int expiredCount,
        long servingCounterIncrement
) {
    public static ReconcileResult skipped() {
        return new ReconcileResult(ScanOutcome.SKIPPED_RESET_IN_PROGRESS, 0L, 0L, 0, 0L);
    }

    public static ReconcileResult nothingEligible(long watermark) {
        return new ReconcileResult(ScanOutcome.NOTHING_ELIGIBLE, watermark, watermark, 0, 0L);
    }
}
