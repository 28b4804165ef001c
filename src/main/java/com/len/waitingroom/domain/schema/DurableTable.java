package com.len.waitingroom.domain.schema;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * 리셋 대상 테이블. 선언 순서대로 재생성한다.
 */
@Getter
@RequiredArgsConstructor
public enum DurableTable {

    TOKEN("token"),
    QUEUE_POSITION_ENTRY("queue_position_entry"),
    SERVING_COUNTER_ISSUANCE("serving_counter_issuance");

    private final String tableName;
}
