package com.nikoh.matchmaking.service.verification;

import com.nikoh.matchmaking.domain.Profile;
import com.nikoh.matchmaking.domain.User;
import com.nikoh.matchmaking.domain.UserVerificationStatus;
import com.nikoh.matchmaking.domain.Verification;
import com.nikoh.matchmaking.domain.VerificationMethod;
import com.nikoh.matchmaking.domain.VerificationStatus;
import com.nikoh.matchmaking.exception.ResourceNotFoundException;
import com.nikoh.matchmaking.repository.ProfileRepository;
import com.nikoh.matchmaking.repository.UserRepository;
import com.nikoh.matchmaking.repository.VerificationRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * Applies verification decisions in their own transactions.
 *
 * Every write re-reads the verification and only proceeds while its status is
 * still one of the expected ones, so a cancellation that landed while the
 * pipeline was running wins. Concurrent writers are stopped by the version column.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class VerificationDecisionWriter {

    private final VerificationRepository verificationRepository;
    private final UserRepository userRepository;
    private final ProfileRepository profileRepository;
    private final ProfileFieldMapper profileFieldMapper;
    private final Clock clock;

    /**
     * Approves the verification, copies its data onto the profile and marks the user verified.
     *
     * @return the approved verification, or empty if its status moved on
     */
    @Transactional
    public Optional<Verification> approve(UUID verificationId, Set<VerificationStatus> expected,
                                          Map<String, Object> extractedData, LocalDate documentExpiryDate,
                                          VerificationMethod method, UUID reviewerId) {
        Optional<Verification> current = loadExpecting(verificationId, expected);
        if (current.isEmpty()) {
            return Optional.empty();
        }
        Verification verification = current.get();
        LocalDateTime now = LocalDateTime.now(clock);

        verification.setStatus(VerificationStatus.APPROVED);
        verification.setExtractedData(copy(extractedData));
        verification.setVerificationMethod(method);
        verification.setVerifiedBy(reviewerId);
        verification.setVerifiedAt(now);
        verification.setRejectionReason(null);
        if (documentExpiryDate != null) {
            verification.setDocumentExpiryDate(documentExpiryDate);
        }

        User user = userRepository.findById(verification.getUserId())
                .orElseThrow(() -> new ResourceNotFoundException("User", verification.getUserId()));
        user.setVerificationStatus(UserVerificationStatus.VERIFIED);
        if (documentExpiryDate != null) {
            user.setVerificationExpiresAt(documentExpiryDate.atStartOfDay());
        }

        Optional<Profile> profile = profileRepository.findByUserId(verification.getUserId());
        if (profile.isPresent()) {
            profileFieldMapper.apply(profile.get(), verification.getDocumentType(), verification.getExtractedData());
        } else {
            log.warn("User {} has no profile; verified fields from {} not copied",
                    verification.getUserId(), verificationId);
        }

        log.info("Approved verification {} for user {} ({})", verificationId, verification.getUserId(), method);
        return Optional.of(verification);
    }

    /**
     * @return the rejected verification, or empty if its status moved on
     */
    @Transactional
    public Optional<Verification> reject(UUID verificationId, Set<VerificationStatus> expected, String reason,
                                         Map<String, Object> extractedData, VerificationMethod method,
                                         UUID reviewerId) {
        Optional<Verification> current = loadExpecting(verificationId, expected);
        if (current.isEmpty()) {
            return Optional.empty();
        }
        Verification verification = current.get();
        verification.setStatus(VerificationStatus.REJECTED);
        verification.setRejectionReason(reason);
        verification.setVerificationMethod(method);
        verification.setVerifiedBy(reviewerId);
        verification.setVerifiedAt(LocalDateTime.now(clock));
        if (extractedData != null) {
            verification.setExtractedData(copy(extractedData));
        }

        log.info("Rejected verification {} ({}): {}", verificationId, method, reason);
        return Optional.of(verification);
    }

    /**
     * Returns a processing verification to the review queue, keeping whatever was extracted.
     *
     * @return the pending verification, or empty if it was no longer processing
     */
    @Transactional
    public Optional<Verification> returnToPending(UUID verificationId, Map<String, Object> extractedData) {
        Optional<Verification> current = loadExpecting(verificationId, Set.of(VerificationStatus.PROCESSING));
        if (current.isEmpty()) {
            return Optional.empty();
        }
        Verification verification = current.get();
        verification.setStatus(VerificationStatus.PENDING);
        if (extractedData != null) {
            verification.setExtractedData(copy(extractedData));
        }
        log.info("Verification {} queued for manual review", verificationId);
        return Optional.of(verification);
    }

    private Optional<Verification> loadExpecting(UUID verificationId, Set<VerificationStatus> expected) {
        Optional<Verification> verification = verificationRepository.findById(verificationId);
        if (verification.isEmpty()) {
            log.warn("Verification {} disappeared before decision could be written", verificationId);
            return Optional.empty();
        }
        VerificationStatus status = verification.get().getStatus();
        if (!expected.contains(status)) {
            log.warn("Verification {} is {}, expected one of {}; decision not written",
                    verificationId, status, expected);
            return Optional.empty();
        }
        return verification;
    }

    private static Map<String, Object> copy(Map<String, Object> data) {
        return data == null ? new LinkedHashMap<>() : new LinkedHashMap<>(data);
    }
}
