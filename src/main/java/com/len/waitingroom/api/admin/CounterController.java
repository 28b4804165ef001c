package com.len.waitingroom.api.admin;

import com.len.waitingroom.api.admin.dto.CounterSnapshotResponse;
import com.len.waitingroom.application.counter.CounterQueryService;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RequiredArgsConstructor
@RestController
@RequestMapping("/api/admin")
public class CounterController {

    private final CounterQueryService counterQueryService;

    @GetMapping("/counters")
    public CounterSnapshotResponse counters() {
        return CounterSnapshotResponse.from(counterQueryService.snapshot());
    }
}
