package com.len.waitingroom.domain.counter;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

import java.util.List;

@Getter
@RequiredArgsConstructor
public enum CounterKey {

    QUEUE_COUNTER("queue_counter"),
    SERVING_COUNTER("serving_counter"),
    TOKEN_COUNTER("token_counter"),
    MAX_QUEUE_POSITION_EXPIRED("max_queue_position_expired"),
    RESET_IN_PROGRESS("reset_in_progress"),
    ABANDONED_SESSION_COUNTER("abandoned_session_counter"),
    COMPLETED_SESSION_COUNTER("completed_session_counter");

    private final String redisKey;

    /**
     * 리셋 시 0으로 되돌리는 카운터 (reset_in_progress 제외)
     */
    public static List<CounterKey> resettable() {
        return List.of(
                SERVING_COUNTER,
                QUEUE_COUNTER,
                TOKEN_COUNTER,
                COMPLETED_SESSION_COUNTER,
                ABANDONED_SESSION_COUNTER,
                MAX_QUEUE_POSITION_EXPIRED
        );
    }
}
