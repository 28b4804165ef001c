package com.len.waitingroom.application.reset;

import com.len.waitingroom.application.expiry.ExpiryScanGuard;
import com.len.waitingroom.common.exception.BusinessException;
import com.len.waitingroom.common.exception.ErrorCode;
import com.len.waitingroom.common.exception.InvalidEventIdException;
import com.len.waitingroom.common.exception.ResetFailedException;
import com.len.waitingroom.domain.counter.CounterKey;
import com.len.waitingroom.domain.counter.CounterStore;
import com.len.waitingroom.domain.schema.DurableTable;
import com.len.waitingroom.domain.schema.TableAdmin;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 전체 초기화 (IDLE -> RESETTING -> IDLE).
 * <p>
 * 만료 스캔 락을 잡은 채 reset_in_progress 를 세워 스캔을 멈추고, 카운터를 0으로 돌린 뒤 테이블을 순서대로 재생성한다.
 * 중간에 실패하면 플래그를 내리지 않는다. 반쯤 재생성된 데이터 위에서 스캔이 다시 돌면 안 되기 때문에
 * 운영자가 reset 을 다시 호출할 때까지 RESETTING 으로 남는다.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ResetService {

    private final CounterStore counterStore;
    private final TableAdmin tableAdmin;
    private final ExpiryScanGuard expiryScanGuard;
    private final MeterRegistry meterRegistry;

    private final AtomicBoolean running = new AtomicBoolean(false);

    @Value("${waitingroom.event-id}")
    private String eventId;

    @Value("${waitingroom.reset.table-wait-timeout-ms:120000}")
    private long tableWaitTimeoutMs;

    @Value("${waitingroom.reset.table-poll-interval-ms:500}")
    private long tablePollIntervalMs;

    @Value("${waitingroom.reset.lock-ttl-ms:600000}")
    private long lockTtlMs;

    @Value("${waitingroom.reset.scan-lock-wait-ms:10000}")
    private long scanLockWaitMs;

    public ResetState currentState() {
        return counterStore.getOrZero(CounterKey.RESET_IN_PROGRESS) != 0 ? ResetState.RESETTING : ResetState.IDLE;
    }

    public void reset(String clientEventId) {
        if (clientEventId == null || !clientEventId.equals(eventId)) {
            log.warn("Reset rejected. Invalid event id. eventId={}", clientEventId);
            throw new InvalidEventIdException();
        }
        if (!running.compareAndSet(false, true)) {
            throw new BusinessException(ErrorCode.RESET_ALREADY_RUNNING);
        }

        try {
            // 스캔 락을 쥔 채로 진행해서, 플래그를 세우기 전에 시작한 스캔이 남아 있지 않게 한다
            if (!expiryScanGuard.runWithScanPaused(lockTtlMs, scanLockWaitMs, this::resetAll)) {
                meterRegistry.counter("waitingroom.reset", "result", "rejected").increment();
                log.warn("Reset rejected. Expiry scan still holds the lock after {}ms", scanLockWaitMs);
                throw new BusinessException(ErrorCode.EXPIRY_SCAN_RUNNING);
            }
        } finally {
            running.set(false);
        }
    }

    private void resetAll() {
        try {
            counterStore.set(CounterKey.RESET_IN_PROGRESS, 1L);
            log.info("Reset in progress");

            for (CounterKey key : CounterKey.resettable()) {
                counterStore.set(key, 0L);
            }
            log.info("Counters reset");

            for (DurableTable table : DurableTable.values()) {
                rebuild(table);
            }
            log.info("Durable tables recreated");

            counterStore.set(CounterKey.RESET_IN_PROGRESS, 0L);
            meterRegistry.counter("waitingroom.reset", "result", "completed").increment();
            log.info("Reset completed");
        } catch (RuntimeException e) {
            meterRegistry.counter("waitingroom.reset", "result", "failed").increment();
            log.error("Reset failed. reset_in_progress stays set until an operator retries", e);
            throw e;
        }
    }

    /**
     * 시작 시 없는 테이블/카운터만 만든다. 기존 데이터는 건드리지 않는다.
     */
    public void bootstrap() {
        for (DurableTable table : DurableTable.values()) {
            tableAdmin.createIfAbsent(table);
        }
        for (CounterKey key : CounterKey.values()) {
            counterStore.initializeIfAbsent(key);
        }
        log.info("Bootstrap done. state={}", currentState());
    }

    private void rebuild(DurableTable table) {
        String name = table.getTableName();

        step(table, "drop", () -> tableAdmin.drop(table));
        awaitExistence(table, false);
        log.info("Table deleted. table={}", name);

        step(table, "create", () -> tableAdmin.create(table));
        awaitExistence(table, true);
        log.info("Table recreated. table={}", name);

        step(table, "point-in-time recovery", () -> tableAdmin.enablePointInTimeRecovery(table));
    }

    private void step(DurableTable table, String step, Runnable action) {
        try {
            action.run();
        } catch (ResetFailedException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new ResetFailedException(table.getTableName(), step + " failed. table=" + table.getTableName(), e);
        }
    }

    private void awaitExistence(DurableTable table, boolean present) {
        long deadline = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(tableWaitTimeoutMs);
        String expected = present ? "exist" : "not exist";

        while (true) {
            boolean exists;
            try {
                exists = tableAdmin.exists(table);
            } catch (RuntimeException e) {
                throw new ResetFailedException(table.getTableName(), "table status check failed. table=" + table.getTableName(), e);
            }
            if (exists == present) {
                return;
            }
            if (System.nanoTime() >= deadline) {
                throw new ResetFailedException(table.getTableName(),
                        "timed out after " + tableWaitTimeoutMs + "ms waiting for table to " + expected + ". table=" + table.getTableName());
            }
            try {
                Thread.sleep(tablePollIntervalMs);
            } catch (InterruptedException ie) {
                Thread.currentThread().interrupt();
                throw new ResetFailedException(table.getTableName(), "interrupted waiting for table to " + expected + ". table=" + table.getTableName(), ie);
            }
        }
    }
}
