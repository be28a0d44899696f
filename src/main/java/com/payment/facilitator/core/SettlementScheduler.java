package com.payment.facilitator.core;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Background work for the coordinator: confirmation polling, the deadline sweep, and
 * one recovery pass at startup. Can be switched off for instances that only verify.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "facilitator.settlement.scheduler.enabled", havingValue = "true", matchIfMissing = true)
public class SettlementScheduler {

    private final SettlementCoordinator coordinator;

    @EventListener(ApplicationReadyEvent.class)
    public void recoverOnStartup() {
        int recovered = coordinator.recoverInFlight();
        log.info("Startup recovery resumed {} payment(s)", recovered);
    }

    @Scheduled(fixedDelayString = "${facilitator.settlement.poll-interval-ms:5000}",
            initialDelayString = "${facilitator.settlement.poll-interval-ms:5000}")
    public void pollConfirmations() {
        int advanced = coordinator.pollConfirmations();
        if (advanced > 0) {
            log.debug("Confirmation poll advanced {} payment(s)", advanced);
        }
    }

    @Scheduled(fixedDelayString = "${facilitator.settlement.sweep-interval-ms:15000}",
            initialDelayString = "${facilitator.settlement.sweep-interval-ms:15000}")
    public void sweepExpired() {
        coordinator.sweepExpired();
    }
}
