package com.flagship.marketplace.offer;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;

@Component
@RequiredArgsConstructor
@Slf4j
public class OfferExpirySweeper {

    private final OfferEngine offerEngine;
    private final Clock clock;

    @Scheduled(fixedDelayString = "${marketplace.offers.sweep-interval-ms:60000}")
    public void sweep() {
        try {
            offerEngine.sweepExpired(Instant.now(clock));
        } catch (RuntimeException e) {
            log.error("Offer expiry sweep failed", e);
        }
    }
}
