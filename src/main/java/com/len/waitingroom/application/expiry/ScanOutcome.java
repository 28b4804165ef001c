package com.len.waitingroom.application.expiry;

/**
 * 한 번의 만료 스캔이 어디서 멈췄는지
 */
public enum ScanOutcome {
    SKIPPED_RESET_IN_PROGRESS,
    NOTHING_ELIGIBLE,
    GAP,
    WITHIN_GRACE_PERIOD,
    EXHAUSTED
}
