package com.len.waitingroom.application.expiry;

import com.len.waitingroom.domain.counter.JobLock;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.concurrent.TimeUnit;

/**
 * 만료 스캔 락. 스케줄 실행, 수동 실행, 리셋이 모두 같은 락을 쓴다.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ExpiryScanGuard {

    public static final String LOCK_NAME = "expiry-scan";

    private final ExpiryScanner expiryScanner;
    private final JobLock jobLock;

    @Value("${waitingroom.expiry.lock-ttl-ms:10000}")
    private long scanLockTtlMs;

    @Value("${waitingroom.expiry.lock-poll-interval-ms:100}")
    private long lockPollIntervalMs;

    /**
     * 락이 비어 있을 때만 한 번 스캔한다.
     *
     * @return 다른 실행이 락을 잡고 있으면 empty
     */
    public Optional<ReconcileResult> tryReconcile() {
        Optional<String> token = jobLock.tryAcquire(LOCK_NAME, scanLockTtlMs);
        if (token.isEmpty()) {
            return Optional.empty();
        }
        try {
            return Optional.of(expiryScanner.reconcile());
        } finally {
            jobLock.release(LOCK_NAME, token.get());
        }
    }

    /**
     * 진행 중인 스캔이 끝나길 최대 waitMs 기다렸다가, 락을 쥔 채로 action 을 실행한다.
     *
     * @return waitMs 안에 락을 못 잡았으면 false (action 은 실행되지 않음)
     */
    public boolean runWithScanPaused(long ttlMs, long waitMs, Runnable action) {
        Optional<String> token = acquireWithin(ttlMs, waitMs);
        if (token.isEmpty()) {
            return false;
        }
        try {
            action.run();
            return true;
        } finally {
            jobLock.release(LOCK_NAME, token.get());
        }
    }

    private Optional<String> acquireWithin(long ttlMs, long waitMs) {
        long deadline = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(waitMs);
        while (true) {
            Optional<String> token = jobLock.tryAcquire(LOCK_NAME, ttlMs);
            if (token.isPresent() || System.nanoTime() >= deadline) {
                return token;
            }
            try {
                Thread.sleep(lockPollIntervalMs);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("Interrupted waiting for expiry scan lock");
                return Optional.empty();
            }
        }
    }
}
