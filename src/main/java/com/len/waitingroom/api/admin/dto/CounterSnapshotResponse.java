package com.len.waitingroom.api.admin.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.len.waitingroom.application.counter.CounterQueryService.CounterSnapshot;
import com.len.waitingroom.domain.counter.CounterKey;

public record CounterSnapshotResponse(
        @JsonProperty("queue_counter") long queueCounter,
        @JsonProperty("serving_counter") long servingCounter,
        @JsonProperty("token_counter") long tokenCounter,
        @JsonProperty("max_queue_position_expired") long maxQueuePositionExpired,
        @JsonProperty("abandoned_session_counter") long abandonedSessionCounter,
        @JsonProperty("completed_session_counter") long completedSessionCounter,
        @JsonProperty("reset_state") String resetState
) {
    public static CounterSnapshotResponse from(CounterSnapshot s) {
        return new CounterSnapshotResponse(
                s.get(CounterKey.QUEUE_COUNTER),
                s.get(CounterKey.SERVING_COUNTER),
                s.get(CounterKey.TOKEN_COUNTER),
                s.get(CounterKey.MAX_QUEUE_POSITION_EXPIRED),
                s.get(CounterKey.ABANDONED_SESSION_COUNTER),
                s.get(CounterKey.COMPLETED_SESSION_COUNTER),
                s.resetState().name()
        );
    }
}
