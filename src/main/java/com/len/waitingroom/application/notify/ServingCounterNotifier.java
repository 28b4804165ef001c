package com.len.waitingroom.application.notify;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.len.waitingroom.domain.outbox.OutboxEvent;
import com.len.waitingroom.infra.outbox.OutboxEventRepository;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.UUID;

/**
 * serving counter 자동 증가 알림. fire-and-forget 이라 실패해도 예외를 올리지 않는다.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ServingCounterNotifier {

    public static final String SOURCE = "custom.waitingroom";
    public static final String DETAIL_TYPE = "automatic_serving_counter_incr";

    private final OutboxEventRepository outboxEventRepository;
    private final ObjectMapper objectMapper;
    private final MeterRegistry meterRegistry;
    private final Clock clock;

    @Value("${waitingroom.event-id}")
    private String eventId;

    @Value("${waitingroom.notify.topic:waitingroom.serving-counter.auto-incremented.v1}")
    private String topic;

    @Value("${waitingroom.outbox.max-attempts:10}")
    private int maxAttempts;

    public void notifyAutoIncrement(long previous, long incrementBy, long current) {
        ServingCounterIncrementedPayload payload = new ServingCounterIncrementedPayload(previous, incrementBy, current);
        try {
            String json = objectMapper.writeValueAsString(payload);
            outboxEventRepository.save(OutboxEvent.pending(
                    UUID.randomUUID().toString(), topic, SOURCE, DETAIL_TYPE, eventId, json, maxAttempts, LocalDateTime.now(clock)
            ));
            meterRegistry.counter("waitingroom.notify", "result", "queued").increment();
        } catch (JsonProcessingException e) {
            meterRegistry.counter("waitingroom.notify", "result", "failed").increment();
            log.error("Notification serialize failed. payload={}", payload, e);
        } catch (RuntimeException e) {
            // 카운터 변경이 기준이고 알림은 참고용이라 롤백하지 않는다
            meterRegistry.counter("waitingroom.notify", "result", "failed").increment();
            log.error("Notification enqueue failed. payload={}", payload, e);
        }
    }
}
