package com.len.waitingroom.application.reset;

import lombok.RequiredArgsConstructor;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "waitingroom.bootstrap.enabled", havingValue = "true", matchIfMissing = true)
public class WaitingRoomBootstrap implements ApplicationRunner {

    private final ResetService resetService;

    @Override
    public void run(ApplicationArguments args) {
        resetService.bootstrap();
    }
}
