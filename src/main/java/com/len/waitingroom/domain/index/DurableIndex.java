package com.len.waitingroom.domain.index;

import java.util.List;
import java.util.Optional;

/**
 * queue position entry / serving counter issuance 테이블 조회·추가.
 * 구현체는 저장소 오류를 DurableStoreException 으로 감싸서 던진다.
 */
public interface DurableIndex {

    Optional<QueuePositionEntry> findQueuePositionEntry(long queuePosition);

    /**
     * servingCounter 보다 큰 issuance 를 serving_counter 오름차순으로 최대 limit 개
     */
    List<ServingCounterIssuance> findIssuancesAfter(String eventId, long servingCounter, int limit);

    /**
     * insert-if-absent. 같은 (event_id, serving_counter) 가 이미 있으면 false
     */
    boolean appendIssuanceIfAbsent(ServingCounterIssuance issuance);
}
