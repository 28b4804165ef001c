package com.len.waitingroom.common.exception;

import lombok.Getter;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;

@Getter
@RequiredArgsConstructor
public enum ErrorCode {

    // 공통
    INTERNAL_ERROR(HttpStatus.INTERNAL_SERVER_ERROR, "INTERNAL_ERROR", "알 수 없는 오류가 발생했습니다."),
    INVALID_REQUEST(HttpStatus.BAD_REQUEST, "INVALID_REQUEST", "잘못된 요청입니다."),

    // 저장소
    COUNTER_STORE_UNAVAILABLE(HttpStatus.SERVICE_UNAVAILABLE, "COUNTER_STORE_UNAVAILABLE", "카운터 저장소(Redis) 호출에 실패했습니다."),
    DURABLE_STORE_UNAVAILABLE(HttpStatus.SERVICE_UNAVAILABLE, "DURABLE_STORE_UNAVAILABLE", "영속 저장소(DB) 호출에 실패했습니다."),

    // 만료 스캔
    EXPIRY_SCAN_RUNNING(HttpStatus.CONFLICT, "EXPIRY_SCAN_RUNNING", "만료 스캔이 진행 중입니다. 잠시 후 다시 시도하세요."),

    // 리셋 관련
    INVALID_EVENT_ID(HttpStatus.BAD_REQUEST, "INVALID_EVENT_ID", "Invalid event ID"),
    RESET_ALREADY_RUNNING(HttpStatus.CONFLICT, "RESET_ALREADY_RUNNING", "이미 리셋이 진행 중입니다."),
    RESET_FAILED(HttpStatus.INTERNAL_SERVER_ERROR, "RESET_FAILED", "리셋 중 테이블 재생성에 실패했습니다. 운영자 재시도가 필요합니다.");

    private final HttpStatus httpStatus;
    private final String code;
    private final String message;
}
