package com.len.waitingroom.infra.redis;

import com.len.waitingroom.application.expiry.ExpiryScanGuard;
import com.len.waitingroom.domain.counter.Advance;
import com.len.waitingroom.domain.counter.CounterKey;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.data.redis.connection.RedisStandaloneConfiguration;
import org.springframework.data.redis.connection.lettuce.LettuceConnectionFactory;
import org.springframework.data.redis.core.RedisCallback;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.testcontainers.containers.GenericContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;
import org.testcontainers.utility.DockerImageName;

import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

@Testcontainers(disabledWithoutDocker = true)
class RedisCounterStoreTest {

    @Container
    static final GenericContainer<?> redisContainer =
            new GenericContainer<>(DockerImageName.parse("redis:7.2-alpine")).withExposedPorts(6379);

    static LettuceConnectionFactory connectionFactory;
    static StringRedisTemplate redis;

    RedisCounterStore counterStore;
    RedisJobLock jobLock;

    @BeforeAll
    static void connect() {
        connectionFactory = new LettuceConnectionFactory(
                new RedisStandaloneConfiguration(redisContainer.getHost(), redisContainer.getMappedPort(6379)));
        connectionFactory.afterPropertiesSet();
        redis = new StringRedisTemplate(connectionFactory);
    }

    @AfterAll
    static void disconnect() {
        connectionFactory.destroy();
    }

    @BeforeEach
    void setUp() {
        redis.execute((RedisCallback<Void>) connection -> {
            connection.serverCommands().flushDb();
            return null;
        });
        counterStore = new RedisCounterStore(redis);
        jobLock = new RedisJobLock(redis);
    }

    @Test
    @DisplayName("없는 키는 empty, getOrZero 는 0")
    void get_absentKey() {
        assertThat(counterStore.get(CounterKey.SERVING_COUNTER)).isEmpty();
        assertThat(counterStore.getOrZero(CounterKey.SERVING_COUNTER)).isZero();
    }

    @Test
    @DisplayName("set 은 이전 값을 돌려준다")
    void set_returnsOldValue() {
        assertThat(counterStore.set(CounterKey.QUEUE_COUNTER, 7L)).isZero();
        assertThat(counterStore.set(CounterKey.QUEUE_COUNTER, 9L)).isEqualTo(7L);
        assertThat(redis.opsForValue().get("queue_counter")).isEqualTo("9");
    }

    @Test
    @DisplayName("incrementByUnlessFrozen 은 증가 후 값을 돌려준다")
    void incrementBy_returnsNewValue() {
        counterStore.set(CounterKey.SERVING_COUNTER, 10L);

        assertThat(counterStore.incrementByUnlessFrozen(CounterKey.SERVING_COUNTER, 3L, CounterKey.RESET_IN_PROGRESS))
                .hasValue(13L);
    }

    @Test
    @DisplayName("리셋 플래그가 서 있으면 증가하지 않고 empty")
    void incrementBy_frozen() {
        counterStore.set(CounterKey.SERVING_COUNTER, 10L);
        counterStore.set(CounterKey.RESET_IN_PROGRESS, 1L);

        assertThat(counterStore.incrementByUnlessFrozen(CounterKey.SERVING_COUNTER, 3L, CounterKey.RESET_IN_PROGRESS))
                .isEmpty();
        assertThat(counterStore.getOrZero(CounterKey.SERVING_COUNTER)).isEqualTo(10L);
    }

    @Test
    @DisplayName("advanceIfGreater 는 더 큰 값으로만 바꾼다")
    void advanceIfGreater_isMonotonic() {
        CounterKey key = CounterKey.MAX_QUEUE_POSITION_EXPIRED;
        CounterKey flag = CounterKey.RESET_IN_PROGRESS;

        assertThat(counterStore.advanceIfGreater(key, 5L, flag)).isEqualTo(Advance.ADVANCED);
        assertThat(counterStore.advanceIfGreater(key, 5L, flag)).isEqualTo(Advance.NOT_GREATER);
        assertThat(counterStore.advanceIfGreater(key, 3L, flag)).isEqualTo(Advance.NOT_GREATER);
        assertThat(counterStore.getOrZero(key)).isEqualTo(5L);

        // 자릿수가 달라도 정수로 비교
        assertThat(counterStore.advanceIfGreater(key, 10L, flag)).isEqualTo(Advance.ADVANCED);
        assertThat(counterStore.advanceIfGreater(key, 9L, flag)).isEqualTo(Advance.NOT_GREATER);
        assertThat(counterStore.getOrZero(key)).isEqualTo(10L);
    }

    @Test
    @DisplayName("advanceIfGreater 는 2^53 을 넘는 값도 정확히 비교한다")
    void advanceIfGreater_exactBeyondDoublePrecision() {
        CounterKey key = CounterKey.MAX_QUEUE_POSITION_EXPIRED;
        long base = (1L << 53) + 1;
        counterStore.set(key, base);

        // double 로 바꾸면 base 와 base + 1 이 같아진다
        assertThat(counterStore.advanceIfGreater(key, base + 1, CounterKey.RESET_IN_PROGRESS)).isEqualTo(Advance.ADVANCED);
        assertThat(counterStore.getOrZero(key)).isEqualTo(base + 1);
        assertThat(counterStore.advanceIfGreater(key, base, CounterKey.RESET_IN_PROGRESS)).isEqualTo(Advance.NOT_GREATER);
        assertThat(counterStore.advanceIfGreater(key, Long.MAX_VALUE, CounterKey.RESET_IN_PROGRESS)).isEqualTo(Advance.ADVANCED);
    }

    @Test
    @DisplayName("리셋 플래그가 서 있으면 워터마크를 바꾸지 않는다")
    void advanceIfGreater_frozen() {
        counterStore.set(CounterKey.RESET_IN_PROGRESS, 1L);

        assertThat(counterStore.advanceIfGreater(CounterKey.MAX_QUEUE_POSITION_EXPIRED, 5L, CounterKey.RESET_IN_PROGRESS))
                .isEqualTo(Advance.FROZEN);
        assertThat(counterStore.get(CounterKey.MAX_QUEUE_POSITION_EXPIRED)).isEmpty();

        counterStore.set(CounterKey.RESET_IN_PROGRESS, 0L);
        assertThat(counterStore.advanceIfGreater(CounterKey.MAX_QUEUE_POSITION_EXPIRED, 5L, CounterKey.RESET_IN_PROGRESS))
                .isEqualTo(Advance.ADVANCED);
    }

    @Test
    @DisplayName("initializeIfAbsent 는 기존 값을 덮어쓰지 않는다")
    void initializeIfAbsent_keepsExisting() {
        counterStore.set(CounterKey.TOKEN_COUNTER, 4L);

        counterStore.initializeIfAbsent(CounterKey.TOKEN_COUNTER);
        counterStore.initializeIfAbsent(CounterKey.RESET_IN_PROGRESS);

        assertThat(counterStore.getOrZero(CounterKey.TOKEN_COUNTER)).isEqualTo(4L);
        assertThat(counterStore.get(CounterKey.RESET_IN_PROGRESS)).hasValue(0L);
    }

    @Test
    @DisplayName("스캔 락은 한 번에 하나만, 토큰이 맞아야 풀린다")
    void jobLock_singleHolder() {
        Optional<String> first = jobLock.tryAcquire(ExpiryScanGuard.LOCK_NAME, 5_000L);
        Optional<String> second = jobLock.tryAcquire(ExpiryScanGuard.LOCK_NAME, 5_000L);

        assertThat(first).isPresent();
        assertThat(second).isEmpty();

        jobLock.release(ExpiryScanGuard.LOCK_NAME, "not-mine");
        assertThat(jobLock.tryAcquire(ExpiryScanGuard.LOCK_NAME, 5_000L)).isEmpty();

        jobLock.release(ExpiryScanGuard.LOCK_NAME, first.get());
        assertThat(jobLock.tryAcquire(ExpiryScanGuard.LOCK_NAME, 5_000L)).isPresent();
    }
}
