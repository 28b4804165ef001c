package com.len.waitingroom.api.admin.dto;

public record ResetResponse(String message) {

    public static ResetResponse completed() {
        return new ResetResponse("Reset completed");
    }
}
