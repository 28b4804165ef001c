package com.len.waitingroom.infra.index;

import com.len.waitingroom.domain.index.QueuePositionEntry;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Optional;

public interface QueuePositionEntryJpaRepository extends JpaRepository<QueuePositionEntry, String> {

    // ix_queue_position 인덱스 사용
    Optional<QueuePositionEntry> findFirstByQueuePosition(long queuePosition);
}
