package com.len.waitingroom.common.exception;

public class InvalidEventIdException extends BusinessException {

    public InvalidEventIdException() {
        super(ErrorCode.INVALID_EVENT_ID);
    }
}
