package com.len.waitingroom.domain.schema;

public interface TableAdmin {

    boolean exists(DurableTable table);

    void drop(DurableTable table);

    void create(DurableTable table);

    void createIfAbsent(DurableTable table);

    /**
     * 생성 직후 호출. 복구 수단을 쓸 수 없으면 예외.
     */
    void enablePointInTimeRecovery(DurableTable table);
}
