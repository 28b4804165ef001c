package com.len.waitingroom.api.admin;

import com.len.waitingroom.api.admin.dto.ResetRequest;
import com.len.waitingroom.api.admin.dto.ResetResponse;
import com.len.waitingroom.application.reset.ResetService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RequiredArgsConstructor
@RestController
@RequestMapping("/api/admin")
public class ResetController {

    private final ResetService resetService;

    // 카운터 0 + 테이블 재생성. event_id 불일치면 400
    @PostMapping("/reset")
    public ResetResponse reset(@Valid @RequestBody ResetRequest request) {
        resetService.reset(request.eventId());
        return ResetResponse.completed();
    }
}
