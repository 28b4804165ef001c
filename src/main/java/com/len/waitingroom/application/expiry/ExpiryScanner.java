package com.len.waitingroom.application.expiry;

import com.len.waitingroom.domain.counter.Advance;
import com.len.waitingroom.domain.counter.CounterKey;
import com.len.waitingroom.domain.counter.CounterStore;
import com.len.waitingroom.domain.index.DurableIndex;
import com.len.waitingroom.domain.index.QueuePositionEntry;
import com.len.waitingroom.domain.index.ServingCounterIssuance;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * 발급됐지만 쓰이지 않은 대기열 순번을 찾아 max_queue_position_expired 를 전진시킨다.
 * <p>
 * serving counter issuance 를 워터마크 이후부터 오름차순으로 훑으면서 해당 순번의 진입 시각과 맞춰 보고,
 * 유예 시간이 지난 것만 만료 처리한다. 첫 번째로 유예 시간 안에 있는 순번이나 진입 기록이 없는 순번에서 멈춘다.
 * 워터마크와 issuance 로그가 모두 영속/단조라서 중간에 실패해도 다음 실행에서 이어서 처리된다.
 * 카운터 쓰기는 reset_in_progress 확인과 같은 원자 호출 안에서 일어나서, 스캔 도중 리셋이 시작되면 그 자리에서 멈춘다.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ExpiryScanner {

    private final CounterStore counterStore;
    private final DurableIndex durableIndex;
    private final ServingCounterAdvancer servingCounterAdvancer;
    private final MeterRegistry meterRegistry;
    private final Clock clock;

    @Value("${waitingroom.event-id}")
    private String eventId;

    @Value("${waitingroom.expiry.grace-period-seconds:900}")
    private long gracePeriodSeconds;

    @Value("${waitingroom.expiry.increment-serving-counter:false}")
    private boolean incrementServingCounter;

    @Value("${waitingroom.expiry.batch-size:500}")
    private int batchSize;

    public ReconcileResult reconcile() {
        if (counterStore.getOrZero(CounterKey.RESET_IN_PROGRESS) != 0) {
            log.info("[ExpiryScanner] Reset in progress. Skipping execution");
            return record(ReconcileResult.skipped());
        }

        long now = clock.instant().getEpochSecond();
        long watermark = counterStore.getOrZero(CounterKey.MAX_QUEUE_POSITION_EXPIRED);
        long servingCounter = counterStore.getOrZero(CounterKey.SERVING_COUNTER);
        long queueCounter = counterStore.getOrZero(CounterKey.QUEUE_COUNTER);
        log.info("[ExpiryScanner] queueCounter={}, maxPositionExpired={}, servingCounter={}",
                queueCounter, watermark, servingCounter);

        final long startWatermark = watermark;
        long previousServingPosition = watermark;
        long cursor = watermark;
        int expired = 0;
        long incremented = 0L;
        ScanOutcome outcome;

        scan:
        while (true) {
            List<ServingCounterIssuance> page = durableIndex.findIssuancesAfter(eventId, cursor, batchSize);
            if (page.isEmpty()) {
                outcome = expired == 0 && cursor == startWatermark ? ScanOutcome.NOTHING_ELIGIBLE : ScanOutcome.EXHAUSTED;
                break;
            }

            for (ServingCounterIssuance candidate : page) {
                long position = candidate.getServingCounter();
                cursor = position;

                Optional<QueuePositionEntry> entry = durableIndex.findQueuePositionEntry(position);
                if (entry.isEmpty()) {
                    // 진입 기록 없는 순번을 건너뛰면 워터마크가 구멍 위로 넘어간다
                    log.warn("[ExpiryScanner] No queue position entry for serving counter item. position={}", position);
                    outcome = ScanOutcome.GAP;
                    break scan;
                }

                long queueTime = Math.max(entry.get().getEntryTime(), candidate.getIssueTime());
                if (now - queueTime < gracePeriodSeconds) {
                    outcome = ScanOutcome.WITHIN_GRACE_PERIOD;
                    break scan;
                }

                Advance advance = counterStore.advanceIfGreater(
                        CounterKey.MAX_QUEUE_POSITION_EXPIRED, position, CounterKey.RESET_IN_PROGRESS);
                if (advance == Advance.FROZEN) {
                    // 스캔 도중 리셋이 시작됨. 0으로 돌린 카운터 위에 쓰지 않는다
                    log.info("[ExpiryScanner] Reset started during scan. Stopping at position={}", position);
                    outcome = ScanOutcome.SKIPPED_RESET_IN_PROGRESS;
                    break scan;
                }
                if (advance == Advance.ADVANCED) {
                    log.info("[ExpiryScanner] Max queue expiry position set to: {}", position);
                    if (incrementServingCounter) {
                        incremented += servingCounterAdvancer.advance(
                                candidate.getQueuePositionsServed(), position, previousServingPosition);
                    }
                } else {
                    // 다른 실행이 이미 여기까지(또는 더) 처리함. 증가분도 그쪽에서 반영
                    log.warn("[ExpiryScanner] Failed to set max queue position expired, already advanced. position={}", position);
                }

                watermark = position;
                previousServingPosition = position;
                expired++;
            }

            if (page.size() < batchSize) {
                outcome = ScanOutcome.EXHAUSTED;
                break;
            }
        }

        return record(new ReconcileResult(outcome, startWatermark, watermark, expired, incremented));
    }

    private ReconcileResult record(ReconcileResult result) {
        meterRegistry.counter("waitingroom.expiry.pass", "outcome", result.outcome().name().toLowerCase(Locale.ROOT)).increment();
        if (result.expiredCount() > 0) {
            meterRegistry.counter("waitingroom.expiry.positions").increment(result.expiredCount());
            log.info("[ExpiryScanner] outcome={}, watermark {} -> {}, expired={}, servingIncrement={}",
                    result.outcome(), result.startWatermark(), result.endWatermark(),
                    result.expiredCount(), result.servingCounterIncrement());
        }
        return result;
    }
}
