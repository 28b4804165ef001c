package com.len.waitingroom.application.counter;

import com.len.waitingroom.application.reset.ResetState;
import com.len.waitingroom.domain.counter.CounterKey;
import com.len.waitingroom.domain.counter.CounterStore;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.util.EnumMap;
import java.util.Map;

@Service
@RequiredArgsConstructor
public class CounterQueryService {

    private final CounterStore counterStore;

    public CounterSnapshot snapshot() {
        Map<CounterKey, Long> values = new EnumMap<>(CounterKey.class);
        for (CounterKey key : CounterKey.values()) {
            values.put(key, counterStore.getOrZero(key));
        }
        ResetState state = values.get(CounterKey.RESET_IN_PROGRESS) != 0 ? ResetState.RESETTING : ResetState.IDLE;
        return new CounterSnapshot(values, state);
    }

    public record CounterSnapshot(Map<CounterKey, Long> values, ResetState resetState) {
        public long get(CounterKey key) {
            return values.getOrDefault(key, 0L);
        }
    }
}
