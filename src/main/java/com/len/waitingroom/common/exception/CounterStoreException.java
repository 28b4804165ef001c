package com.len.waitingroom.common.exception;

/**
 * Redis 카운터 읽기/쓰기 실패. 현재 패스는 중단되고 다음 스케줄에서 재시도된다.
 */
public class CounterStoreException extends BusinessException {

    public CounterStoreException(String detailMessage, Throwable cause) {
        super(ErrorCode.COUNTER_STORE_UNAVAILABLE, detailMessage, cause);
    }
}
