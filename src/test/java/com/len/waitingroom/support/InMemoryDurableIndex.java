package com.len.waitingroom.support;

import com.len.waitingroom.common.exception.DurableStoreException;
import com.len.waitingroom.domain.index.DurableIndex;
import com.len.waitingroom.domain.index.QueuePositionEntry;
import com.len.waitingroom.domain.index.ServingCounterIssuance;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.UUID;

/**
 * 단일 이벤트용 테이블 대역
 */
public class InMemoryDurableIndex implements DurableIndex {

    private final String eventId;
    private final Map<Long, QueuePositionEntry> entries = new HashMap<>();
    private final TreeMap<Long, ServingCounterIssuance> issuances = new TreeMap<>();
    private boolean failing;
    private Runnable onFirstEntryLookup;

    public InMemoryDurableIndex(String eventId) {
        this.eventId = eventId;
    }

    public InMemoryDurableIndex entry(long queuePosition, long entryTime) {
        entries.put(queuePosition, QueuePositionEntry.of(UUID.randomUUID().toString(), eventId, queuePosition, entryTime));
        return this;
    }

    public InMemoryDurableIndex issuance(long servingCounter, long issueTime, long queuePositionsServed) {
        issuances.put(servingCounter, ServingCounterIssuance.of(eventId, servingCounter, issueTime, queuePositionsServed));
        return this;
    }

    public void failing(boolean failing) {
        this.failing = failing;
    }

    /**
     * 첫 진입 기록 조회 직전에 한 번 실행. 스캔 도중 끼어드는 동작을 흉내낸다
     */
    public InMemoryDurableIndex onFirstEntryLookup(Runnable action) {
        this.onFirstEntryLookup = action;
        return this;
    }

    public Optional<ServingCounterIssuance> issuanceAt(long servingCounter) {
        return Optional.ofNullable(issuances.get(servingCounter));
    }

    public int issuanceCount() {
        return issuances.size();
    }

    @Override
    public Optional<QueuePositionEntry> findQueuePositionEntry(long queuePosition) {
        checkAvailable();
        if (onFirstEntryLookup != null) {
            Runnable action = onFirstEntryLookup;
            onFirstEntryLookup = null;
            action.run();
        }
        return Optional.ofNullable(entries.get(queuePosition));
    }

    @Override
    public List<ServingCounterIssuance> findIssuancesAfter(String eventId, long servingCounter, int limit) {
        checkAvailable();
        if (!this.eventId.equals(eventId)) {
            return List.of();
        }
        return issuances.tailMap(servingCounter, false).values().stream().limit(limit).toList();
    }

    @Override
    public boolean appendIssuanceIfAbsent(ServingCounterIssuance issuance) {
        checkAvailable();
        return issuances.putIfAbsent(issuance.getServingCounter(), issuance) == null;
    }

    private void checkAvailable() {
        if (failing) {
            throw new DurableStoreException("durable store unavailable", null);
        }
    }
}
