package com.len.waitingroom.infra.outbox;

import com.len.waitingroom.domain.outbox.OutboxEvent;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.LocalDateTime;
import java.util.List;

public interface OutboxEventRepository extends JpaRepository<OutboxEvent, String> {

    // 여러 relay 인스턴스가 같은 행을 잡지 않도록 SKIP LOCKED
    @Query(value = """
        SELECT * FROM outbox_event
         WHERE status = 'PENDING'
           AND next_attempt_at <= :now
         ORDER BY created_at
         LIMIT :limit
         FOR UPDATE SKIP LOCKED
        """, nativeQuery = true)
    List<OutboxEvent> lockDue(@Param("now") LocalDateTime now, @Param("limit") int limit);
}
