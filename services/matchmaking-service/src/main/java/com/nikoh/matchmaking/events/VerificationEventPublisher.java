package com.nikoh.matchmaking.events;

import com.nikoh.matchmaking.domain.Verification;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.UUID;

/**
 * Publishes verification decisions for notification and profile services.
 * Publishing is fire and forget: a broker failure is logged and counted, never
 * propagated into the verification flow.
 *
 * Topics Published:
 * - verification-events: every decision on a verification
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class VerificationEventPublisher {

    private final KafkaTemplate<String, Object> kafkaTemplate;
    private final MeterRegistry meterRegistry;
    private final Clock clock;

    @Value("${nikoh.events.verification-topic:verification-events}")
    private String verificationTopic;

    public void publishApproved(Verification verification, Double faceMatchScore) {
        publish(VerificationEvent.APPROVED, verification, faceMatchScore, null);
    }

    public void publishRejected(Verification verification, Double faceMatchScore) {
        publish(VerificationEvent.REJECTED, verification, faceMatchScore, verification.getRejectionReason());
    }

    public void publishManualReview(Verification verification, Double faceMatchScore, String reason) {
        publish(VerificationEvent.MANUAL_REVIEW, verification, faceMatchScore, reason);
    }

    public void publishCancelled(Verification verification) {
        publish(VerificationEvent.CANCELLED, verification, null, null);
    }

    public void publishExpired(Verification verification) {
        publish(VerificationEvent.EXPIRED, verification, null, "Document expired");
    }

    private void publish(String eventType, Verification verification, Double faceMatchScore, String reason) {
        VerificationEvent event = VerificationEvent.builder()
                .eventId(UUID.randomUUID().toString())
                .eventType(eventType)
                .correlationId(MDC.get("traceId"))
                .timestamp(clock.instant())
                .version("1.0")
                .verificationId(String.valueOf(verification.getId()))
                .userId(String.valueOf(verification.getUserId()))
                .documentType(verification.getDocumentType().name())
                .status(verification.getStatus().name())
                .verificationMethod(verification.getVerificationMethod() != null
                        ? verification.getVerificationMethod().name() : null)
                .faceMatchScore(faceMatchScore)
                .reason(reason)
                .build();

        try {
            kafkaTemplate.send(verificationTopic, event.getVerificationId(), event)
                    .whenComplete((result, ex) -> {
                        if (ex != null) {
                            meterRegistry.counter("verification.events.failed", "type", eventType).increment();
                            log.error("Failed to publish {} for verification {}: {}",
                                    eventType, event.getVerificationId(), ex.getMessage());
                        } else {
                            meterRegistry.counter("verification.events.published", "type", eventType).increment();
                            log.debug("Published {} for verification {} to partition {}",
                                    eventType, event.getVerificationId(),
                                    result.getRecordMetadata().partition());
                        }
                    });
        } catch (RuntimeException e) {
            meterRegistry.counter("verification.events.failed", "type", eventType).increment();
            log.error("Failed to publish {} for verification {}: {}",
                    eventType, event.getVerificationId(), e.getMessage());
        }
    }
}
