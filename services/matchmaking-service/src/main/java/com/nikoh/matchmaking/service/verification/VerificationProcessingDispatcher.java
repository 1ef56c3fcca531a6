package com.nikoh.matchmaking.service.verification;

import com.nikoh.matchmaking.config.AsyncConfiguration;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Component;

import java.util.UUID;

/**
 * Runs automatic verification off the request thread
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class VerificationProcessingDispatcher {

    private final AutoVerificationService autoVerificationService;

    @Async(AsyncConfiguration.DOCUMENT_PROCESSING_EXECUTOR)
    public void dispatch(UUID verificationId) {
        AutoVerificationResult result = autoVerificationService.process(verificationId);
        log.info("Auto-verification of {} finished: autoVerified={}, needsManualReview={}, reason={}",
                verificationId, result.isAutoVerified(), result.isNeedsManualReview(), result.getFailureReason());
    }
}
