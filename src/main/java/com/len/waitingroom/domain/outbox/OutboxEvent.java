package com.len.waitingroom.domain.outbox;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * 이벤트 버스로 나갈 알림 한 건 (source / detail-type / detail).
 * 시각은 전부 호출자가 넘긴다.
 */
@Entity
@Table(name = "outbox_event")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class OutboxEvent {

    static final int ERROR_LIMIT = 500;
    static final int MAX_BACKOFF_SECONDS = 60;

    @Id
    @Column(name = "event_id", length = 64, nullable = false, updatable = false)
    private String eventId;

    @Column(name = "topic", length = 120, nullable = false)
    private String topic;

    @Column(name = "source", length = 120, nullable = false)
    private String source;

    @Column(name = "detail_type", length = 120, nullable = false)
    private String detailType;

    @Column(name = "event_key", length = 120, nullable = false)
    private String eventKey;

    @Column(name = "detail", columnDefinition = "json", nullable = false)
    private String detail;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", length = 20, nullable = false)
    private OutboxStatus status;

    @Column(name = "attempts", nullable = false)
    private int attempts;

    @Column(name = "max_attempts", nullable = false)
    private int maxAttempts;

    @Column(name = "next_attempt_at", nullable = false)
    private LocalDateTime nextAttemptAt;

    @Column(name = "published_at")
    private LocalDateTime publishedAt;

    @Column(name = "last_error", length = ERROR_LIMIT)
    private String lastError;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @Column(name = "updated_at", nullable = false)
    private LocalDateTime updatedAt;

    public static OutboxEvent pending(String eventId, String topic, String source, String detailType,
                                      String eventKey, String detail, int maxAttempts, LocalDateTime now) {
        if (maxAttempts <= 0) {
            throw new IllegalArgumentException("maxAttempts must be positive: " + maxAttempts);
        }
        OutboxEvent e = new OutboxEvent();
        e.eventId = eventId;
        e.topic = topic;
        e.source = source;
        e.detailType = detailType;
        e.eventKey = eventKey;
        e.detail = detail;
        e.status = OutboxStatus.PENDING;
        e.maxAttempts = maxAttempts;
        e.nextAttemptAt = now;
        e.createdAt = now;
        e.updatedAt = now;
        return e;
    }

    public void markPublished(LocalDateTime now) {
        status = OutboxStatus.PUBLISHED;
        publishedAt = now;
        lastError = null;
        updatedAt = now;
    }

    /**
     * 실패 1회 기록. 한도에 닿으면 FAILED, 아니면 2^attempts 초(최대 60초) 뒤 재시도.
     */
    public void markAttemptFailed(String error, LocalDateTime now) {
        attempts++;
        lastError = error == null || error.length() <= ERROR_LIMIT ? error : error.substring(0, ERROR_LIMIT);
        updatedAt = now;

        if (attempts >= maxAttempts) {
            status = OutboxStatus.FAILED;
            return;
        }
        status = OutboxStatus.PENDING;
        nextAttemptAt = now.plusSeconds(backoffSeconds(attempts));
    }

    public boolean isFailed() {
        return status == OutboxStatus.FAILED;
    }

    static long backoffSeconds(int attempts) {
        return attempts >= 6 ? MAX_BACKOFF_SECONDS : Math.min(MAX_BACKOFF_SECONDS, 1L << attempts);
    }
}
