package com.len.waitingroom.domain.counter;

import java.util.Optional;

public interface JobLock {

    /**
     * @return 획득 성공 시 해제에 필요한 토큰
     */
    Optional<String> tryAcquire(String name, long ttlMs);

    void release(String name, String token);
}
