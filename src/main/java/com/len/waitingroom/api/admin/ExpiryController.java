package com.len.waitingroom.api.admin;

import com.len.waitingroom.application.expiry.ExpiryScanGuard;
import com.len.waitingroom.application.expiry.ReconcileResult;
import com.len.waitingroom.common.exception.BusinessException;
import com.len.waitingroom.common.exception.ErrorCode;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RequiredArgsConstructor
@RestController
@RequestMapping("/api/admin/expiry")
public class ExpiryController {

    private final ExpiryScanGuard expiryScanGuard;

    // 스케줄 주기를 기다리지 않고 한 번 실행. 스캔 락은 스케줄 실행과 공유
    @PostMapping("/reconcile")
    public ReconcileResult reconcile() {
        return expiryScanGuard.tryReconcile()
                .orElseThrow(() -> new BusinessException(ErrorCode.EXPIRY_SCAN_RUNNING));
    }
}
