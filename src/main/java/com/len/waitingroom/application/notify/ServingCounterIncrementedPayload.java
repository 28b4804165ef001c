package com.len.waitingroom.application.notify;

import com.fasterxml.jackson.annotation.JsonProperty;

public record ServingCounterIncrementedPayload(
        @JsonProperty("previous_serving_counter_position") long previousServingCounterPosition,
        @JsonProperty("increment_by") long incrementBy,
        @JsonProperty("current_serving_counter_position") long currentServingCounterPosition
) {}
