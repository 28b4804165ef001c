package com.len.waitingroom.domain.outbox;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class OutboxEventTest {

    private static final LocalDateTime NOW = LocalDateTime.of(2026, 1, 1, 0, 0);

    private OutboxEvent pending(int maxAttempts) {
        return OutboxEvent.pending("e-1", "topic.v1", "custom.waitingroom", "automatic_serving_counter_incr",
                "evt-1", "{}", maxAttempts, NOW);
    }

    @Test
    @DisplayName("max_attempts 에 도달하면 FAILED 로 남는다")
    void markAttemptFailed_reachesMaxAttempts() {
        OutboxEvent event = pending(3);

        event.markAttemptFailed("err", NOW);
        event.markAttemptFailed("err", NOW);
        assertThat(event.getNextAttemptAt()).isEqualTo(NOW.plusSeconds(4));
        event.markAttemptFailed("err", NOW);

        assertThat(event.isFailed()).isTrue();
        assertThat(event.getAttempts()).isEqualTo(3);
    }

    @Test
    @DisplayName("backoff 는 2^n 초, 60초에서 멈춘다")
    void backoff_isCapped() {
        assertThat(OutboxEvent.backoffSeconds(1)).isEqualTo(2L);
        assertThat(OutboxEvent.backoffSeconds(5)).isEqualTo(32L);
        assertThat(OutboxEvent.backoffSeconds(6)).isEqualTo(60L);
        assertThat(OutboxEvent.backoffSeconds(40)).isEqualTo(60L);
    }

    @Test
    @DisplayName("에러 메시지는 500자로 자른다")
    void lastError_isTruncated() {
        OutboxEvent event = pending(10);

        event.markAttemptFailed("x".repeat(800), NOW);

        assertThat(event.getLastError()).hasSize(OutboxEvent.ERROR_LIMIT);
    }

    @Test
    @DisplayName("발행 성공 시 에러를 지우고 PUBLISHED")
    void markPublished_clearsError() {
        OutboxEvent event = pending(10);
        event.markAttemptFailed("err", NOW);

        event.markPublished(NOW.plusSeconds(2));

        assertThat(event.getStatus()).isEqualTo(OutboxStatus.PUBLISHED);
        assertThat(event.getLastError()).isNull();
        assertThat(event.getPublishedAt()).isEqualTo(NOW.plusSeconds(2));
    }

    @Test
    @DisplayName("max_attempts 는 양수여야 한다")
    void pending_rejectsNonPositiveMaxAttempts() {
        assertThatThrownBy(() -> pending(0)).isInstanceOf(IllegalArgumentException.class);
    }
}
