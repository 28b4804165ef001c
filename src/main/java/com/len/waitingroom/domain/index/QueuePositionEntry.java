package com.len.waitingroom.domain.index;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * 대기열 순번이 발급된 시각. 발급 시 한 번 쓰이고 이후 변경되지 않는다.
 */
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@Entity
@Table(name = "queue_position_entry")
public class QueuePositionEntry {

    @Id
    @Column(name = "request_id", length = 64, nullable = false, updatable = false)
    private String requestId;

    @Column(name = "event_id", length = 64, nullable = false, updatable = false)
    private String eventId;

    @Column(name = "queue_position", nullable = false, updatable = false)
    private long queuePosition;

    // unix seconds
    @Column(name = "entry_time", nullable = false, updatable = false)
    private long entryTime;

    public static QueuePositionEntry of(String requestId, String eventId, long queuePosition, long entryTime) {
        QueuePositionEntry e = new QueuePositionEntry();
        e.requestId = requestId;
        e.eventId = eventId;
        e.queuePosition = queuePosition;
        e.entryTime = entryTime;
        return e;
    }
}
