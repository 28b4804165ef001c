package com.len.waitingroom.application.expiry;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "waitingroom.expiry.enabled", havingValue = "true", matchIfMissing = true)
public class QueueExpiryJob {

    private final ExpiryScanGuard expiryScanGuard;

    @Scheduled(fixedDelayString = "${waitingroom.expiry.interval-ms:5000}")
    public void tick() {
        try {
            if (expiryScanGuard.tryReconcile().isEmpty()) {
                // 다른 인스턴스(또는 수동 실행, 리셋)가 락을 쥐고 있음
                log.debug("[QueueExpiryJob] scan lock held elsewhere, skipping");
            }
        } catch (Exception e) {
            // 다음 tick 에서 영속된 워터마크부터 재시도
            log.warn("[QueueExpiryJob] failed", e);
        }
    }
}
