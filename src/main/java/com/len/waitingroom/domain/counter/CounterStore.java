package com.len.waitingroom.domain.counter;

import java.util.OptionalLong;

/**
 * 빠른 카운터 저장소 (Redis). 모든 연산은 단일 원자 호출이다.
 * 구현체는 저장소 오류를 CounterStoreException 으로 감싸서 던진다.
 */
public interface CounterStore {

    /**
     * 키가 없으면 empty
     */
    OptionalLong get(CounterKey key);

    default long getOrZero(CounterKey key) {
        return get(key).orElse(0L);
    }

    /**
     * @return 이전 값 (없었으면 0)
     */
    long set(CounterKey key, long value);

    /**
     * freezeFlag 가 0 이 아니면 아무것도 하지 않는다. 플래그 확인과 증가는 한 번의 원자 호출.
     * @return 증가 후 값, 플래그가 서 있었으면 empty
     */
    OptionalLong incrementByUnlessFrozen(CounterKey key, long delta, CounterKey freezeFlag);

    /**
     * 현재 값보다 클 때만 덮어쓴다 (단조 증가 보장). freezeFlag 가 0 이 아니면 거부.
     */
    Advance advanceIfGreater(CounterKey key, long value, CounterKey freezeFlag);

    /**
     * 키가 없을 때만 0으로 만든다.
     */
    void initializeIfAbsent(CounterKey key);
}
