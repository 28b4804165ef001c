package com.len.waitingroom.infra.outbox;

import com.len.waitingroom.domain.outbox.OutboxEvent;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * outbox relay. 발행 시점이 된 알림을 Kafka 로 넘기고, source / detail-type 은 헤더에 싣는다.
 */
@Slf4j
@Service
@RequiredArgsConstructor
@ConditionalOnProperty(name = "waitingroom.outbox.enabled", havingValue = "true", matchIfMissing = true)
public class OutboxPublisher {

    public static final String HEADER_SOURCE = "source";
    public static final String HEADER_DETAIL_TYPE = "detail-type";

    private final OutboxEventRepository outboxEventRepository;
    private final KafkaTemplate<String, String> kafkaTemplate;
    private final MeterRegistry meterRegistry;
    private final Clock clock;

    @Value("${waitingroom.outbox.batch-size:100}")
    private int batchSize;

    @Value("${waitingroom.outbox.publish-timeout-ms:3000}")
    private long publishTimeoutMs;

    @Scheduled(fixedDelayString = "${waitingroom.outbox.publish-interval-ms:300}")
    @Transactional
    public void publish() {
        Timer.Sample sample = Timer.start(meterRegistry);
        try {
            List<OutboxEvent> due = outboxEventRepository.lockDue(LocalDateTime.now(clock), batchSize);
            if (due.isEmpty()) {
                return;
            }

            int published = 0;
            int failed = 0;
            for (OutboxEvent event : due) {
                if (relay(event)) {
                    published++;
                } else {
                    failed++;
                }
                if (Thread.currentThread().isInterrupted()) {
                    break;
                }
            }
            outboxEventRepository.saveAll(due);

            meterRegistry.counter("waitingroom.outbox.events", "result", "published").increment(published);
            meterRegistry.counter("waitingroom.outbox.events", "result", "failed").increment(failed);
            log.info("Outbox relay done. due={}, published={}, failed={}", due.size(), published, failed);
        } finally {
            sample.stop(meterRegistry.timer("waitingroom.outbox.publish.loop"));
        }
    }

    private boolean relay(OutboxEvent event) {
        try {
            kafkaTemplate.send(toRecord(event)).get(publishTimeoutMs, TimeUnit.MILLISECONDS);
            event.markPublished(LocalDateTime.now(clock));
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            event.markAttemptFailed("interrupted", LocalDateTime.now(clock));
        } catch (ExecutionException | TimeoutException | RuntimeException e) {
            Throwable cause = e instanceof ExecutionException && e.getCause() != null ? e.getCause() : e;
            event.markAttemptFailed(String.valueOf(cause.getMessage()), LocalDateTime.now(clock));
        }

        if (event.isFailed()) {
            log.error("Outbox event dropped after {} attempts. eventId={}, detailType={}, err={}",
                    event.getAttempts(), event.getEventId(), event.getDetailType(), event.getLastError());
        } else {
            log.warn("Outbox publish failed, retry at {}. eventId={}, attempts={}, err={}",
                    event.getNextAttemptAt(), event.getEventId(), event.getAttempts(), event.getLastError());
        }
        return false;
    }

    private ProducerRecord<String, String> toRecord(OutboxEvent event) {
        ProducerRecord<String, String> record = new ProducerRecord<>(event.getTopic(), event.getEventKey(), event.getDetail());
        record.headers()
                .add(HEADER_SOURCE, event.getSource().getBytes(StandardCharsets.UTF_8))
                .add(HEADER_DETAIL_TYPE, event.getDetailType().getBytes(StandardCharsets.UTF_8));
        return record;
    }
}
