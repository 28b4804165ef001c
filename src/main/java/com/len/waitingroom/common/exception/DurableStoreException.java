package com.len.waitingroom.common.exception;

/**
 * queue position / serving counter 테이블 접근 실패.
 */
public class DurableStoreException extends BusinessException {

    public DurableStoreException(String detailMessage, Throwable cause) {
        super(ErrorCode.DURABLE_STORE_UNAVAILABLE, detailMessage, cause);
    }
}
