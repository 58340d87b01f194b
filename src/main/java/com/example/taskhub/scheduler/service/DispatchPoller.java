package com.example.taskhub.scheduler.service;

import com.example.taskhub.scheduler.config.SchedulerProperties;
import com.example.taskhub.scheduler.exception.StoreUnavailableException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Slf4j
@Component
@RequiredArgsConstructor
public class DispatchPoller {
    private final Dispatcher dispatcher;
    private final SchedulerProperties props;

    @Scheduled(fixedDelayString = "${scheduler.dispatcher.poll-delay-ms:1000}", initialDelay = 3000L)
    public void tick() {
        int maxPerTick = props.getDispatcher().getBatch();
        try {
            for (int i = 0; i < maxPerTick; i++) {
                if (!dispatcher.pollAndRunOnce()) break;
            }
        } catch (StoreUnavailableException e) {
            log.warn("Poll skipped, store unavailable: {}", e.getMessage());
        }
    }

    @Scheduled(fixedDelayString = "${scheduler.dispatcher.sweep-delay-ms:15000}", initialDelay = 15000L)
    public void sweep() {
        try {
            dispatcher.sweep();
        } catch (StoreUnavailableException e) {
            log.warn("Sweep skipped, store unavailable: {}", e.getMessage());
        }
    }
}
