package com.len.waitingroom.application.reset;

public enum ResetState {
    IDLE,
    // 리셋 진행 중이거나, 실패해서 운영자 재시도를 기다리는 상태
    RESETTING
}
