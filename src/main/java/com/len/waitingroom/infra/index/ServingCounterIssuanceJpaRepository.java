package com.len.waitingroom.infra.index;

import com.len.waitingroom.domain.index.ServingCounterIssuance;
import com.len.waitingroom.domain.index.ServingCounterIssuanceId;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;

public interface ServingCounterIssuanceJpaRepository extends JpaRepository<ServingCounterIssuance, ServingCounterIssuanceId> {

    @Query("""
        select i from ServingCounterIssuance i
        where i.eventId = :eventId
          and i.servingCounter > :servingCounter
        order by i.servingCounter asc
    """)
    List<ServingCounterIssuance> findAfter(@Param("eventId") String eventId,
                                           @Param("servingCounter") long servingCounter,
                                           Pageable pageable);
}
