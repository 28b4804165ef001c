package com.len.waitingroom.api.admin.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;

public record ResetRequest(
        @JsonProperty("event_id") @NotBlank String eventId
) {}
