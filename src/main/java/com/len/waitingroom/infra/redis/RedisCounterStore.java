package com.len.waitingroom.infra.redis;

import com.len.waitingroom.common.exception.CounterStoreException;
import com.len.waitingroom.domain.counter.Advance;
import com.len.waitingroom.domain.counter.CounterKey;
import com.len.waitingroom.domain.counter.CounterStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.ClassPathResource;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.DefaultRedisScript;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.OptionalLong;

@Slf4j
@Component
@RequiredArgsConstructor
public class RedisCounterStore implements CounterStore {

    private final StringRedisTemplate redis;

    private final DefaultRedisScript<Long> setIfGreaterScript = new DefaultRedisScript<>() {{
        setLocation(new ClassPathResource("redis/set_if_greater.lua"));
        setResultType(Long.class);
    }};

    private final DefaultRedisScript<Long> incrUnlessFrozenScript = new DefaultRedisScript<>() {{
        setLocation(new ClassPathResource("redis/incr_unless_frozen.lua"));
        setResultType(Long.class);
    }};

    @Override
    public OptionalLong get(CounterKey key) {
        String raw;
        try {
            raw = redis.opsForValue().get(key.getRedisKey());
        } catch (DataAccessException e) {
            throw new CounterStoreException("GET failed. key=" + key.getRedisKey(), e);
        }
        if (raw == null) {
            return OptionalLong.empty();
        }
        return OptionalLong.of(parse(key, raw));
    }

    @Override
    public long set(CounterKey key, long value) {
        String old;
        try {
            old = redis.opsForValue().getAndSet(key.getRedisKey(), String.valueOf(value));
        } catch (DataAccessException e) {
            throw new CounterStoreException("SET failed. key=" + key.getRedisKey() + ", value=" + value, e);
        }
        return old == null ? 0L : parse(key, old);
    }

    @Override
    public OptionalLong incrementByUnlessFrozen(CounterKey key, long delta, CounterKey freezeFlag) {
        Long cur;
        try {
            cur = redis.execute(incrUnlessFrozenScript,
                    List.of(key.getRedisKey(), freezeFlag.getRedisKey()), String.valueOf(delta));
        } catch (DataAccessException e) {
            throw new CounterStoreException("INCRBY failed. key=" + key.getRedisKey() + ", delta=" + delta, e);
        }
        // 스크립트가 nil 을 돌려주면 플래그가 서 있던 것
        return cur == null ? OptionalLong.empty() : OptionalLong.of(cur);
    }

    @Override
    public Advance advanceIfGreater(CounterKey key, long value, CounterKey freezeFlag) {
        if (value < 0) {
            throw new IllegalArgumentException("negative counter value. key=" + key.getRedisKey() + ", value=" + value);
        }
        Long changed;
        try {
            changed = redis.execute(setIfGreaterScript,
                    List.of(key.getRedisKey(), freezeFlag.getRedisKey()), String.valueOf(value));
        } catch (DataAccessException e) {
            throw new CounterStoreException("set-if-greater failed. key=" + key.getRedisKey() + ", value=" + value, e);
        }
        if (changed == null) {
            throw new CounterStoreException("set-if-greater returned no value. key=" + key.getRedisKey(), null);
        }
        if (changed < 0) {
            return Advance.FROZEN;
        }
        return changed == 1L ? Advance.ADVANCED : Advance.NOT_GREATER;
    }

    @Override
    public void initializeIfAbsent(CounterKey key) {
        try {
            Boolean created = redis.opsForValue().setIfAbsent(key.getRedisKey(), "0");
            if (Boolean.TRUE.equals(created)) {
                log.info("Counter initialized. key={}", key.getRedisKey());
            }
        } catch (DataAccessException e) {
            throw new CounterStoreException("SETNX failed. key=" + key.getRedisKey(), e);
        }
    }

    private long parse(CounterKey key, String raw) {
        try {
            return Long.parseLong(raw.trim());
        } catch (NumberFormatException e) {
            throw new CounterStoreException("Non-numeric counter value. key=" + key.getRedisKey() + ", value=" + raw, e);
        }
    }
}
