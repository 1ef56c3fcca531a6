package com.nikoh.matchmaking.service.verification;

import com.nikoh.matchmaking.domain.DocumentType;
import com.nikoh.matchmaking.domain.User;
import com.nikoh.matchmaking.domain.UserVerificationStatus;
import com.nikoh.matchmaking.domain.Verification;
import com.nikoh.matchmaking.domain.VerificationStatus;
import com.nikoh.matchmaking.events.VerificationEventPublisher;
import com.nikoh.matchmaking.repository.UserRepository;
import com.nikoh.matchmaking.repository.VerificationRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("VerificationExpiryService Tests")
class VerificationExpiryServiceTest {

    @Mock
    private VerificationRepository verificationRepository;

    @Mock
    private UserRepository userRepository;

    @Mock
    private VerificationEventPublisher eventPublisher;

    private VerificationExpiryService expiryService;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(Instant.parse("2026-03-01T10:00:00Z"), ZoneOffset.UTC);
        expiryService = new VerificationExpiryService(verificationRepository, userRepository, eventPublisher, clock);
    }

    @Test
    @DisplayName("Should expire approvals whose document ran out and publish an event each")
    void shouldExpireDocuments() {
        // Given
        Verification first = approved();
        Verification second = approved();
        when(verificationRepository.findApprovedWithDocumentExpiredBefore(LocalDate.of(2026, 3, 1)))
                .thenReturn(List.of(first, second));

        // When
        int expired = expiryService.expireDocuments();

        // Then
        assertThat(expired).isEqualTo(2);
        assertThat(first.getStatus()).isEqualTo(VerificationStatus.EXPIRED);
        assertThat(second.getStatus()).isEqualTo(VerificationStatus.EXPIRED);
        verify(eventPublisher).publishExpired(first);
        verify(eventPublisher).publishExpired(second);
    }

    @Test
    @DisplayName("Should do nothing when no document has expired")
    void shouldSkipWhenNothingExpired() {
        // Given
        when(verificationRepository.findApprovedWithDocumentExpiredBefore(any())).thenReturn(List.of());

        // When
        int expired = expiryService.expireDocuments();

        // Then
        assertThat(expired).isZero();
        verify(eventPublisher, never()).publishExpired(any());
    }

    @Test
    @DisplayName("Should downgrade users whose verification lapsed")
    void shouldExpireUsers() {
        // Given
        User user = new User();
        user.setVerificationStatus(UserVerificationStatus.VERIFIED);
        when(userRepository.findWithVerificationExpiredBefore(
                UserVerificationStatus.VERIFIED, LocalDateTime.of(2026, 3, 1, 10, 0)))
                .thenReturn(List.of(user));

        // When
        int expired = expiryService.expireUsers();

        // Then
        assertThat(expired).isEqualTo(1);
        assertThat(user.getVerificationStatus()).isEqualTo(UserVerificationStatus.EXPIRED);
    }

    private Verification approved() {
        Verification verification = new Verification();
        verification.setId(UUID.randomUUID());
        verification.setUserId(UUID.randomUUID());
        verification.setDocumentType(DocumentType.PASSPORT);
        verification.setStatus(VerificationStatus.APPROVED);
        verification.setDocumentExpiryDate(LocalDate.of(2026, 2, 1));
        return verification;
    }
}
