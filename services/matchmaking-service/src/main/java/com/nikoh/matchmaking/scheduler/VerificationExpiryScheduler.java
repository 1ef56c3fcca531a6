package com.nikoh.matchmaking.scheduler;

import com.nikoh.matchmaking.service.verification.VerificationExpiryService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Scheduled jobs for verification expiry
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class VerificationExpiryScheduler {

    private final VerificationExpiryService expiryService;

    /**
     * Expire approvals of documents past their expiry date
     * Runs daily at 01:00
     */
    @Scheduled(cron = "0 0 1 * * *")
    public void expireDocuments() {
        log.info("=== Scheduled Job: Expire Verified Documents ===");
        try {
            expiryService.expireDocuments();
        } catch (Exception e) {
            log.error("Error expiring verified documents", e);
        }
    }

    /**
     * Downgrade users whose verification lapsed
     * Runs daily at 01:15
     */
    @Scheduled(cron = "0 15 1 * * *")
    public void expireUserVerifications() {
        log.info("=== Scheduled Job: Expire User Verifications ===");
        try {
            expiryService.expireUsers();
        } catch (Exception e) {
            log.error("Error expiring user verifications", e);
        }
    }
}
