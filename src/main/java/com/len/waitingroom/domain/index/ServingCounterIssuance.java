package com.len.waitingroom.domain.index;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.IdClass;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.ToString;

/**
 * serving counter 가 가졌던 값 하나당 한 행. (event_id, serving_counter) 로 유일하고 append-only.
 */
@Getter
@ToString
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@Entity
@IdClass(ServingCounterIssuanceId.class)
@Table(name = "serving_counter_issuance")
public class ServingCounterIssuance {

    @Id
    @Column(name = "event_id", length = 64, nullable = false, updatable = false)
    private String eventId;

    @Id
    @Column(name = "serving_counter", nullable = false, updatable = false)
    private long servingCounter;

    // unix seconds
    @Column(name = "issue_time", nullable = false, updatable = false)
    private long issueTime;

    // 이 증가분 안에서 정상 처리(완료/포기)로 이미 집계된 순번 수
    @Column(name = "queue_positions_served", nullable = false, updatable = false)
    private long queuePositionsServed;

    public static ServingCounterIssuance of(String eventId, long servingCounter, long issueTime, long queuePositionsServed) {
        ServingCounterIssuance i = new ServingCounterIssuance();
        i.eventId = eventId;
        i.servingCounter = servingCounter;
        i.issueTime = issueTime;
        i.queuePositionsServed = queuePositionsServed;
        return i;
    }
}
