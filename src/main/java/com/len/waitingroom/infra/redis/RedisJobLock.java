package com.len.waitingroom.infra.redis;

import com.len.waitingroom.common.exception.CounterStoreException;
import com.len.waitingroom.domain.counter.JobLock;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.RedisScript;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.TimeUnit;

@Slf4j
@Component
@RequiredArgsConstructor
public class RedisJobLock implements JobLock {

    private static final String LOCK_PREFIX = "waitingroom:lock:";

    private final StringRedisTemplate redis;

    private final RedisScript<Long> unlockScript = RedisScript.of(
            "if redis.call('GET', KEYS[1]) == ARGV[1] then return redis.call('DEL', KEYS[1]) else return 0 end",
            Long.class
    );

    @Override
    public Optional<String> tryAcquire(String name, long ttlMs) {
        String token = UUID.randomUUID().toString();
        Boolean locked;
        try {
            locked = redis.opsForValue().setIfAbsent(LOCK_PREFIX + name, token, ttlMs, TimeUnit.MILLISECONDS);
        } catch (DataAccessException e) {
            throw new CounterStoreException("Lock acquire failed. name=" + name, e);
        }
        return Boolean.TRUE.equals(locked) ? Optional.of(token) : Optional.empty();
    }

    @Override
    public void release(String name, String token) {
        try {
            redis.execute(unlockScript, List.of(LOCK_PREFIX + name), token);
        } catch (DataAccessException e) {
            // ttl 지나면 자연 해제
            log.warn("Lock release failed. name={}", name, e);
        }
    }
}
