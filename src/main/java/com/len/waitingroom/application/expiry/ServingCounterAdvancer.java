package com.len.waitingroom.application.expiry;

import com.len.waitingroom.application.notify.ServingCounterNotifier;
import com.len.waitingroom.domain.counter.CounterKey;
import com.len.waitingroom.domain.counter.CounterStore;
import com.len.waitingroom.domain.index.DurableIndex;
import com.len.waitingroom.domain.index.ServingCounterIssuance;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.OptionalLong;

/**
 * 만료된 순번만큼 serving counter 를 간접 증가시킨다.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ServingCounterAdvancer {

    private final CounterStore counterStore;
    private final DurableIndex durableIndex;
    private final ServingCounterNotifier notifier;
    private final MeterRegistry meterRegistry;
    private final Clock clock;

    @Value("${waitingroom.event-id}")
    private String eventId;

    /**
     * increment = (expiredPosition - previousServingPosition) - queuePositionsServed
     *
     * @return 실제로 적용한 증가량 (건너뛰거나 리셋 중이면 0)
     */
    public long advance(long queuePositionsServed, long expiredPosition, long previousServingPosition) {
        long increment = (expiredPosition - previousServingPosition) - queuePositionsServed;

        // 정상 집계에서는 나오지 않음. 절대 감소시키지 않는다
        if (increment <= 0) {
            meterRegistry.counter("waitingroom.serving.auto_increment", "result", "skipped").increment();
            log.warn("Increment value calculated as {}, serving counter increment skipped. expired={}, previous={}, served={}",
                    increment, expiredPosition, previousServingPosition, queuePositionsServed);
            return 0L;
        }

        OptionalLong incremented = counterStore.incrementByUnlessFrozen(
                CounterKey.SERVING_COUNTER, increment, CounterKey.RESET_IN_PROGRESS);
        if (incremented.isEmpty()) {
            meterRegistry.counter("waitingroom.serving.auto_increment", "result", "frozen").increment();
            log.info("Reset in progress, serving counter increment skipped. expired={}, increment={}", expiredPosition, increment);
            return 0L;
        }
        long current = incremented.getAsLong();
        long now = clock.instant().getEpochSecond();

        boolean appended = durableIndex.appendIssuanceIfAbsent(
                ServingCounterIssuance.of(eventId, current, now, 0L)
        );
        if (!appended) {
            log.warn("Serving counter issuance already exists, append rejected. eventId={}, servingCounter={}", eventId, current);
        }

        meterRegistry.counter("waitingroom.serving.auto_increment", "result", "applied").increment();
        log.info("Serving counter incremented by {}. Current value: {}", increment, current);

        notifier.notifyAutoIncrement(current - increment, increment, current);
        return increment;
    }
}
