package com.len.waitingroom.domain.index;

import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.io.Serializable;

@Getter
@NoArgsConstructor
@AllArgsConstructor
@EqualsAndHashCode
public class ServingCounterIssuanceId implements Serializable {

    private String eventId;
    private long servingCounter;
}
