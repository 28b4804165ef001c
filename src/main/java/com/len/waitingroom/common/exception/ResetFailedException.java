package com.len.waitingroom.common.exception;

import lombok.Getter;

/**
 * 테이블 재생성 단계 실패. reset_in_progress 플래그는 그대로 남는다.
 */
@Getter
public class ResetFailedException extends BusinessException {

    private final String table;

    public ResetFailedException(String table, String detailMessage) {
        super(ErrorCode.RESET_FAILED, detailMessage);
        this.table = table;
    }

    public ResetFailedException(String table, String detailMessage, Throwable cause) {
        super(ErrorCode.RESET_FAILED, detailMessage, cause);
        this.table = table;
    }
}
