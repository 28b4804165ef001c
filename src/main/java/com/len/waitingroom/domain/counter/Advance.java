package com.len.waitingroom.domain.counter;

/**
 * advanceIfGreater 결과
 */
public enum Advance {
    ADVANCED,
    NOT_GREATER,
    // 리셋 플래그가 서 있어서 거부
    FROZEN
}
