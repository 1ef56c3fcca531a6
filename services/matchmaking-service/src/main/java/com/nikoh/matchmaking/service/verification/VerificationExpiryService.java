package com.nikoh.matchmaking.service.verification;

import com.nikoh.matchmaking.domain.User;
import com.nikoh.matchmaking.domain.UserVerificationStatus;
import com.nikoh.matchmaking.domain.Verification;
import com.nikoh.matchmaking.domain.VerificationStatus;
import com.nikoh.matchmaking.events.VerificationEventPublisher;
import com.nikoh.matchmaking.repository.UserRepository;
import com.nikoh.matchmaking.repository.VerificationRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;

/**
 * Expires approvals whose document ran out and users whose verification lapsed
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class VerificationExpiryService {

    private final VerificationRepository verificationRepository;
    private final UserRepository userRepository;
    private final VerificationEventPublisher eventPublisher;
    private final Clock clock;

    /**
     * @return number of verifications expired
     */
    @Transactional
    public int expireDocuments() {
        List<Verification> expired = verificationRepository.findApprovedWithDocumentExpiredBefore(LocalDate.now(clock));
        for (Verification verification : expired) {
            verification.setStatus(VerificationStatus.EXPIRED);
            eventPublisher.publishExpired(verification);
        }
        if (!expired.isEmpty()) {
            log.info("Expired {} verifications with outdated documents", expired.size());
        }
        return expired.size();
    }

    /**
     * @return number of users whose verification expired
     */
    @Transactional
    public int expireUsers() {
        List<User> users = userRepository.findWithVerificationExpiredBefore(
                UserVerificationStatus.VERIFIED, LocalDateTime.now(clock));
        users.forEach(user -> user.setVerificationStatus(UserVerificationStatus.EXPIRED));
        if (!users.isEmpty()) {
            log.info("Verification expired for {} users", users.size());
        }
        return users.size();
    }
}
