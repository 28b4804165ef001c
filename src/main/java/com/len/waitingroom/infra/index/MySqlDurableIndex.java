package com.len.waitingroom.infra.index;

import com.len.waitingroom.common.exception.DurableStoreException;
import com.len.waitingroom.domain.index.DurableIndex;
import com.len.waitingroom.domain.index.QueuePositionEntry;
import com.len.waitingroom.domain.index.ServingCounterIssuance;
import lombok.RequiredArgsConstructor;
import org.springframework.dao.DataAccessException;
import org.springframework.data.domain.PageRequest;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
@RequiredArgsConstructor
public class MySqlDurableIndex implements DurableIndex {

    private final QueuePositionEntryJpaRepository queuePositionEntryRepository;
    private final ServingCounterIssuanceJpaRepository issuanceRepository;
    private final JdbcTemplate jdbcTemplate;

    @Override
    public Optional<QueuePositionEntry> findQueuePositionEntry(long queuePosition) {
        try {
            return queuePositionEntryRepository.findFirstByQueuePosition(queuePosition);
        } catch (DataAccessException e) {
            throw new DurableStoreException("queue position lookup failed. queuePosition=" + queuePosition, e);
        }
    }

    @Override
    public List<ServingCounterIssuance> findIssuancesAfter(String eventId, long servingCounter, int limit) {
        try {
            return issuanceRepository.findAfter(eventId, servingCounter, PageRequest.of(0, limit));
        } catch (DataAccessException e) {
            throw new DurableStoreException("issuance query failed. eventId=" + eventId + ", after=" + servingCounter, e);
        }
    }

    @Override
    public boolean appendIssuanceIfAbsent(ServingCounterIssuance issuance) {
        try {
            // 같은 serving_counter 중복 추가는 PK 로 거부 (동시 스캔 대비)
            int inserted = jdbcTemplate.update(
                    "INSERT IGNORE INTO serving_counter_issuance(event_id, serving_counter, issue_time, queue_positions_served) VALUES (?, ?, ?, ?)",
                    issuance.getEventId(),
                    issuance.getServingCounter(),
                    issuance.getIssueTime(),
                    issuance.getQueuePositionsServed()
            );
            return inserted > 0;
        } catch (DataAccessException e) {
            throw new DurableStoreException("issuance append failed. " + issuance, e);
        }
    }
}
