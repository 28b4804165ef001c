package com.len.waitingroom.infra.schema;

import com.len.waitingroom.common.exception.DurableStoreException;
import com.len.waitingroom.domain.schema.DurableTable;
import com.len.waitingroom.domain.schema.TableAdmin;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;

@Slf4j
@Component
@RequiredArgsConstructor
public class MySqlTableAdmin implements TableAdmin {

    private final JdbcTemplate jdbcTemplate;

    @Value("${waitingroom.schema.encrypt-at-rest:true}")
    private boolean encryptAtRest;

    @Value("${waitingroom.schema.require-point-in-time-recovery:true}")
    private boolean requirePointInTimeRecovery;

    @Override
    public boolean exists(DurableTable table) {
        try {
            Integer count = jdbcTemplate.queryForObject(
                    "SELECT COUNT(*) FROM information_schema.tables WHERE table_schema = DATABASE() AND table_name = ?",
                    Integer.class,
                    table.getTableName()
            );
            return count != null && count > 0;
        } catch (DataAccessException e) {
            throw new DurableStoreException("table lookup failed. table=" + table.getTableName(), e);
        }
    }

    @Override
    public void drop(DurableTable table) {
        // 이전 리셋이 중간에 실패했을 수 있어서 IF EXISTS
        execute(table, "DROP TABLE IF EXISTS " + table.getTableName());
    }

    @Override
    public void create(DurableTable table) {
        execute(table, ddl(table, false));
    }

    @Override
    public void createIfAbsent(DurableTable table) {
        execute(table, ddl(table, true));
    }

    /**
     * MySQL 의 point-in-time recovery 는 binlog 기반이라 테이블 단위 설정이 없다.
     * 서버 binlog 가 켜져 있는지 확인한다.
     */
    @Override
    public void enablePointInTimeRecovery(DurableTable table) {
        Integer logBin;
        try {
            logBin = jdbcTemplate.queryForObject("SELECT @@log_bin", Integer.class);
        } catch (DataAccessException e) {
            throw new DurableStoreException("binlog status lookup failed. table=" + table.getTableName(), e);
        }

        if (logBin != null && logBin == 1) {
            log.info("Point-in-time recovery available via binlog. table={}", table.getTableName());
            return;
        }
        if (requirePointInTimeRecovery) {
            throw new DurableStoreException("binlog disabled, point-in-time recovery unavailable. table=" + table.getTableName(), null);
        }
        log.warn("binlog disabled, point-in-time recovery unavailable. table={}", table.getTableName());
    }

    private void execute(DurableTable table, String sql) {
        try {
            jdbcTemplate.execute(sql);
        } catch (DataAccessException e) {
            throw new DurableStoreException("DDL failed. table=" + table.getTableName() + ", sql=" + sql, e);
        }
    }

    String ddl(DurableTable table, boolean ifAbsent) {
        String create = ifAbsent ? "CREATE TABLE IF NOT EXISTS " : "CREATE TABLE ";
        String body = switch (table) {
            case TOKEN -> """
                    (
                      request_id VARCHAR(64) NOT NULL,
                      event_id   VARCHAR(64) NOT NULL,
                      expires    BIGINT      NOT NULL,
                      PRIMARY KEY (request_id),
                      KEY ix_event_expires (event_id, expires)
                    )""";
            case QUEUE_POSITION_ENTRY -> """
                    (
                      request_id     VARCHAR(64) NOT NULL,
                      event_id       VARCHAR(64) NOT NULL,
                      queue_position BIGINT      NOT NULL,
                      entry_time     BIGINT      NOT NULL,
                      PRIMARY KEY (request_id),
                      KEY ix_queue_position (queue_position)
                    )""";
            case SERVING_COUNTER_ISSUANCE -> """
                    (
                      event_id               VARCHAR(64) NOT NULL,
                      serving_counter        BIGINT      NOT NULL,
                      issue_time             BIGINT      NOT NULL,
                      queue_positions_served BIGINT      NOT NULL DEFAULT 0,
                      PRIMARY KEY (event_id, serving_counter)
                    )""";
        };
        String options = " ENGINE=InnoDB" + (encryptAtRest ? " ENCRYPTION='Y'" : "");
        return create + table.getTableName() + " " + body + options;
    }
}
