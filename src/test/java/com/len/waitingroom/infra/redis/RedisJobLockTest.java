package com.len.waitingroom.infra.redis;

import com.len.waitingroom.common.exception.CounterStoreException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.redis.RedisConnectionFailureException;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.ValueOperations;

import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.BDDMockito.given;

@ExtendWith(MockitoExtension.class)
class RedisJobLockTest {

    @Mock
    StringRedisTemplate redis;

    @Mock
    ValueOperations<String, String> valueOps;

    @InjectMocks
    RedisJobLock jobLock;

    @Test
    @DisplayName("락 획득 중 Redis 장애는 CounterStoreException 으로 감싼다")
    void tryAcquire_redisDown_wrapped() {
        given(redis.opsForValue()).willReturn(valueOps);
        given(valueOps.setIfAbsent(eq("waitingroom:lock:expiry-scan"), anyString(), anyLong(), eq(TimeUnit.MILLISECONDS)))
                .willThrow(new RedisConnectionFailureException("connection refused"));

        assertThatThrownBy(() -> jobLock.tryAcquire("expiry-scan", 5_000L))
                .isInstanceOf(CounterStoreException.class)
                .hasCauseInstanceOf(RedisConnectionFailureException.class)
                .hasMessageContaining("expiry-scan");
    }
}
