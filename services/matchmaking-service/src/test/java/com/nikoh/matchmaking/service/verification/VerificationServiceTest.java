package com.nikoh.matchmaking.service.verification;

import com.nikoh.matchmaking.config.VerificationProperties;
import com.nikoh.matchmaking.domain.DocumentType;
import com.nikoh.matchmaking.domain.Selfie;
import com.nikoh.matchmaking.domain.SelfieStatus;
import com.nikoh.matchmaking.domain.User;
import com.nikoh.matchmaking.domain.UserVerificationStatus;
import com.nikoh.matchmaking.domain.Verification;
import com.nikoh.matchmaking.domain.VerificationMethod;
import com.nikoh.matchmaking.domain.VerificationStatus;
import com.nikoh.matchmaking.dto.ApproveVerificationRequest;
import com.nikoh.matchmaking.dto.PrerequisiteCheckResponse;
import com.nikoh.matchmaking.dto.RejectVerificationRequest;
import com.nikoh.matchmaking.dto.VerificationResponse;
import com.nikoh.matchmaking.dto.VerificationStatusSummary;
import com.nikoh.matchmaking.events.VerificationEventPublisher;
import com.nikoh.matchmaking.exception.ForbiddenOperationException;
import com.nikoh.matchmaking.exception.InvalidDocumentException;
import com.nikoh.matchmaking.exception.InvalidRequestException;
import com.nikoh.matchmaking.exception.InvalidVerificationStateException;
import com.nikoh.matchmaking.exception.ResourceNotFoundException;
import com.nikoh.matchmaking.repository.SelfieRepository;
import com.nikoh.matchmaking.repository.UserRepository;
import com.nikoh.matchmaking.repository.VerificationRepository;
import com.nikoh.matchmaking.service.storage.DocumentStorageService;
import com.nikoh.matchmaking.service.storage.UploadValidator;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.mock.web.MockMultipartFile;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.verifyNoMoreInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("VerificationService Tests")
class VerificationServiceTest {

    @Mock
    private VerificationRepository verificationRepository;

    @Mock
    private UserRepository userRepository;

    @Mock
    private SelfieRepository selfieRepository;

    @Mock
    private VerificationDecisionWriter decisionWriter;

    @Mock
    private VerificationProcessingDispatcher processingDispatcher;

    @Mock
    private DocumentStorageService storageService;

    @Mock
    private VerificationEventPublisher eventPublisher;

    private VerificationProperties properties;
    private VerificationService service;

    private User user;
    private User admin;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(Instant.parse("2026-03-01T10:00:00Z"), ZoneOffset.UTC);
        properties = new VerificationProperties();
        service = new VerificationService(verificationRepository, userRepository, selfieRepository, decisionWriter,
                processingDispatcher, storageService, new UploadValidator(), properties, eventPublisher, clock);

        user = User.builder().id(UUID.randomUUID()).email("user@example.com").build();
        admin = User.builder().id(UUID.randomUUID()).email("admin@example.com").admin(true).build();
    }

    private Verification verification(VerificationStatus status) {
        return Verification.builder()
                .id(UUID.randomUUID())
                .userId(user.getId())
                .documentType(DocumentType.PASSPORT)
                .status(status)
                .filePath("verifications/" + user.getId() + "/v/document.jpg")
                .build();
    }

    private void givenAdmin() {
        when(userRepository.findById(admin.getId())).thenReturn(Optional.of(admin));
    }

    @Nested
    @DisplayName("Upload")
    class Upload {

        private final MockMultipartFile passport =
                new MockMultipartFile("file", "passport.jpg", "image/jpeg", new byte[]{1, 2, 3, 4});

        @Test
        @DisplayName("Should store document and start processing when auto-verification is enabled")
        void shouldStoreAndDispatch() {
            // Given
            UUID verificationId = UUID.randomUUID();
            when(userRepository.findById(user.getId())).thenReturn(Optional.of(user));
            when(verificationRepository.saveAndFlush(any(Verification.class))).thenAnswer(invocation -> {
                Verification saved = invocation.getArgument(0);
                saved.setId(verificationId);
                return saved;
            });
            when(verificationRepository.save(any(Verification.class))).thenAnswer(invocation -> invocation.getArgument(0));
            when(storageService.store(anyString(), anyString(), any())).thenAnswer(invocation ->
                    invocation.getArgument(0) + "/" + invocation.getArgument(1));

            // When
            VerificationResponse response = service.upload(user.getId(), DocumentType.PASSPORT, "UZB", passport);

            // Then
            assertThat(response.getId()).isEqualTo(verificationId);
            assertThat(response.getStatus()).isEqualTo(VerificationStatus.PROCESSING);
            assertThat(response.getFileSize()).isEqualTo(4L);
            assertThat(response.getSubmittedAt()).isEqualTo(LocalDateTime.of(2026, 3, 1, 10, 0));
            assertThat(response.getFilePath()).isNull();

            verify(storageService).store(eq("verifications/" + user.getId() + "/" + verificationId),
                    eq("document.jpg"), eq(new byte[]{1, 2, 3, 4}));
            verify(processingDispatcher).dispatch(verificationId);
        }

        @Test
        @DisplayName("Should leave the verification pending when auto-verification is disabled")
        void shouldStayPendingWhenAutoDisabled() {
            // Given
            properties.setAutoEnabled(false);
            when(userRepository.findById(user.getId())).thenReturn(Optional.of(user));
            when(verificationRepository.saveAndFlush(any(Verification.class))).thenAnswer(invocation -> {
                Verification saved = invocation.getArgument(0);
                saved.setId(UUID.randomUUID());
                return saved;
            });
            when(verificationRepository.save(any(Verification.class))).thenAnswer(invocation -> invocation.getArgument(0));
            when(storageService.store(anyString(), anyString(), any())).thenReturn("verifications/x/document.jpg");

            // When
            VerificationResponse response = service.upload(user.getId(), DocumentType.DIPLOMA, null, passport);

            // Then
            assertThat(response.getStatus()).isEqualTo(VerificationStatus.PENDING);
            verifyNoInteractions(processingDispatcher);
        }

        @Test
        @DisplayName("Should reject unsupported file types before writing anything")
        void shouldRejectFileType() {
            // Given
            MockMultipartFile text = new MockMultipartFile("file", "passport.txt", "text/plain", new byte[]{1});

            // When / Then
            assertThatThrownBy(() -> service.upload(user.getId(), DocumentType.PASSPORT, "UZB", text))
                    .isInstanceOf(InvalidDocumentException.class)
                    .hasMessage("Invalid file type. Allowed types: JPEG, PNG, PDF");
            verifyNoInteractions(verificationRepository, storageService);
        }

        @Test
        @DisplayName("Should refuse a second upload while one of the same type is in progress")
        void shouldRefuseDuplicateInProgress() {
            // Given
            when(userRepository.findById(user.getId())).thenReturn(Optional.of(user));
            when(verificationRepository.existsByUserIdAndDocumentTypeAndStatusIn(
                    eq(user.getId()), eq(DocumentType.PASSPORT), any())).thenReturn(true);

            // When / Then
            assertThatThrownBy(() -> service.upload(user.getId(), DocumentType.PASSPORT, "UZB", passport))
                    .isInstanceOf(InvalidVerificationStateException.class)
                    .hasMessageContaining("already in progress");
            verify(verificationRepository, never()).saveAndFlush(any());
        }

        @Test
        @DisplayName("Should fail for unknown users")
        void shouldFailForUnknownUser() {
            UUID unknown = UUID.randomUUID();
            when(userRepository.findById(unknown)).thenReturn(Optional.empty());

            assertThatThrownBy(() -> service.upload(unknown, DocumentType.PASSPORT, "UZB", passport))
                    .isInstanceOf(ResourceNotFoundException.class);
        }
    }

    @Nested
    @DisplayName("Owner actions")
    class OwnerActions {

        @Test
        @DisplayName("Should cancel a pending verification and delete its file")
        void shouldCancelPending() {
            // Given
            Verification verification = verification(VerificationStatus.PENDING);
            when(verificationRepository.findById(verification.getId())).thenReturn(Optional.of(verification));
            when(verificationRepository.saveAndFlush(verification)).thenReturn(verification);
            when(storageService.delete(verification.getFilePath())).thenReturn(true);

            // When
            VerificationResponse response = service.cancel(verification.getId(), user.getId());

            // Then
            assertThat(response.getStatus()).isEqualTo(VerificationStatus.CANCELLED);
            verify(storageService).delete(verification.getFilePath());
            verify(eventPublisher).publishCancelled(verification);
        }

        @Test
        @DisplayName("Should not cancel another user's verification")
        void shouldRejectForeignCancel() {
            // Given
            Verification verification = verification(VerificationStatus.PENDING);
            when(verificationRepository.findById(verification.getId())).thenReturn(Optional.of(verification));

            // When / Then
            assertThatThrownBy(() -> service.cancel(verification.getId(), UUID.randomUUID()))
                    .isInstanceOf(ForbiddenOperationException.class)
                    .hasMessage("Not your verification");
            assertThat(verification.getStatus()).isEqualTo(VerificationStatus.PENDING);
        }

        @Test
        @DisplayName("Should not cancel a decided verification")
        void shouldRejectCancelOfApproved() {
            // Given
            Verification verification = verification(VerificationStatus.APPROVED);
            when(verificationRepository.findById(verification.getId())).thenReturn(Optional.of(verification));

            // When / Then
            assertThatThrownBy(() -> service.cancel(verification.getId(), user.getId()))
                    .isInstanceOf(InvalidVerificationStateException.class)
                    .hasMessage("Cannot cancel verification with status 'approved'");
            verifyNoInteractions(storageService, eventPublisher);
        }

        @Test
        @DisplayName("Should hide file details from owners and show them to admins")
        void shouldShapeResponseByRequester() {
            // Given
            Verification verification = verification(VerificationStatus.PENDING);
            when(verificationRepository.findById(verification.getId())).thenReturn(Optional.of(verification));
            givenAdmin();

            // When
            VerificationResponse ownerView = service.getVerification(verification.getId(), user.getId());
            VerificationResponse adminView = service.getVerification(verification.getId(), admin.getId());

            // Then
            assertThat(ownerView.getFilePath()).isNull();
            assertThat(adminView.getFilePath()).isEqualTo(verification.getFilePath());
        }

        @Test
        @DisplayName("Should forbid other non-admin users from reading a verification")
        void shouldForbidStrangers() {
            // Given
            Verification verification = verification(VerificationStatus.PENDING);
            User stranger = User.builder().id(UUID.randomUUID()).email("s@example.com").build();
            when(verificationRepository.findById(verification.getId())).thenReturn(Optional.of(verification));
            when(userRepository.findById(stranger.getId())).thenReturn(Optional.of(stranger));

            // When / Then
            assertThatThrownBy(() -> service.getVerification(verification.getId(), stranger.getId()))
                    .isInstanceOf(ForbiddenOperationException.class)
                    .hasMessage("Admin privileges required");
        }
    }

    @Nested
    @DisplayName("Manual review")
    class ManualReview {

        @Test
        @DisplayName("Should approve through the decision writer as a manual decision")
        void shouldApproveManually() {
            // Given
            givenAdmin();
            Verification verification = verification(VerificationStatus.PENDING);
            when(verificationRepository.findById(verification.getId())).thenReturn(Optional.of(verification));
            Map<String, Object> data = Map.of("first_name", "Aziza", "last_name", "Karimova");
            LocalDate expiry = LocalDate.of(2031, 5, 1);
            when(decisionWriter.approve(eq(verification.getId()), eq(VerificationStatus.reviewable()), eq(data),
                    eq(expiry), eq(VerificationMethod.MANUAL), eq(admin.getId())))
                    .thenAnswer(invocation -> {
                        verification.setStatus(VerificationStatus.APPROVED);
                        verification.setVerifiedBy(admin.getId());
                        return Optional.of(verification);
                    });

            // When
            VerificationResponse response = service.approve(verification.getId(), admin.getId(),
                    ApproveVerificationRequest.builder().extractedData(data).documentExpiryDate(expiry).build());

            // Then
            assertThat(response.getStatus()).isEqualTo(VerificationStatus.APPROVED);
            assertThat(response.getVerifiedBy()).isEqualTo(admin.getId());
            verify(eventPublisher).publishApproved(verification, null);
        }

        @Test
        @DisplayName("Should publish review decisions only once the transaction commits")
        void shouldPublishDecisionsAfterCommit() {
            // Given
            givenAdmin();
            Verification approvedOne = verification(VerificationStatus.PENDING);
            Verification rejectedOne = verification(VerificationStatus.MANUAL_REVIEW);
            when(verificationRepository.findById(approvedOne.getId())).thenReturn(Optional.of(approvedOne));
            when(verificationRepository.findById(rejectedOne.getId())).thenReturn(Optional.of(rejectedOne));
            when(decisionWriter.approve(eq(approvedOne.getId()), any(), any(), any(), any(), any()))
                    .thenReturn(Optional.of(approvedOne));
            when(decisionWriter.reject(eq(rejectedOne.getId()), any(), any(), any(), any(), any()))
                    .thenReturn(Optional.of(rejectedOne));

            TransactionSynchronizationManager.initSynchronization();
            try {
                // When
                service.approve(approvedOne.getId(), admin.getId(),
                        ApproveVerificationRequest.builder().extractedData(Map.of()).build());
                service.reject(rejectedOne.getId(), admin.getId(),
                        new RejectVerificationRequest("Photo page is unreadable"));

                // Then
                verifyNoInteractions(eventPublisher);

                TransactionSynchronizationManager.getSynchronizations()
                        .forEach(TransactionSynchronization::afterCommit);
                verify(eventPublisher).publishApproved(approvedOne, null);
                verify(eventPublisher).publishRejected(rejectedOne, null);
                verifyNoMoreInteractions(eventPublisher);
            } finally {
                TransactionSynchronizationManager.clearSynchronization();
            }
        }

        @Test
        @DisplayName("Should publish nothing when the decision transaction rolls back")
        void shouldNotPublishOnRollback() {
            // Given
            givenAdmin();
            Verification verification = verification(VerificationStatus.PENDING);
            when(verificationRepository.findById(verification.getId())).thenReturn(Optional.of(verification));
            when(decisionWriter.approve(any(), any(), any(), any(), any(), any())).thenReturn(Optional.of(verification));

            TransactionSynchronizationManager.initSynchronization();
            try {
                // When
                service.approve(verification.getId(), admin.getId(),
                        ApproveVerificationRequest.builder().extractedData(Map.of()).build());
                TransactionSynchronizationManager.getSynchronizations()
                        .forEach(sync -> sync.afterCompletion(TransactionSynchronization.STATUS_ROLLED_BACK));

                // Then
                verifyNoInteractions(eventPublisher);
            } finally {
                TransactionSynchronizationManager.clearSynchronization();
            }
        }

        @Test
        @DisplayName("Should report a conflict when the status changed during review")
        void shouldReportConflictOnApprove() {
            // Given
            givenAdmin();
            Verification verification = verification(VerificationStatus.PENDING);
            when(verificationRepository.findById(verification.getId())).thenReturn(Optional.of(verification));
            when(decisionWriter.approve(any(), any(), any(), any(), any(), any())).thenReturn(Optional.empty());

            // When / Then
            assertThatThrownBy(() -> service.approve(verification.getId(), admin.getId(),
                    ApproveVerificationRequest.builder().extractedData(Map.of()).build()))
                    .isInstanceOf(InvalidVerificationStateException.class)
                    .hasMessageContaining("changed status during review");
        }

        @Test
        @DisplayName("Should require admin privileges for review decisions")
        void shouldRequireAdmin() {
            // Given
            when(userRepository.findById(user.getId())).thenReturn(Optional.of(user));

            // When / Then
            assertThatThrownBy(() -> service.approve(UUID.randomUUID(), user.getId(),
                    ApproveVerificationRequest.builder().extractedData(Map.of()).build()))
                    .isInstanceOf(ForbiddenOperationException.class);
            verifyNoInteractions(decisionWriter);
        }

        @Test
        @DisplayName("Should reject with a trimmed reason")
        void shouldRejectWithTrimmedReason() {
            // Given
            givenAdmin();
            Verification verification = verification(VerificationStatus.PENDING);
            when(verificationRepository.findById(verification.getId())).thenReturn(Optional.of(verification));
            when(decisionWriter.reject(any(), any(), any(), any(), any(), any())).thenReturn(Optional.of(verification));

            // When
            service.reject(verification.getId(), admin.getId(),
                    new RejectVerificationRequest("   Photo page is unreadable   "));

            // Then
            ArgumentCaptor<String> reason = ArgumentCaptor.forClass(String.class);
            verify(decisionWriter).reject(eq(verification.getId()), eq(VerificationStatus.reviewable()),
                    reason.capture(), any(), eq(VerificationMethod.MANUAL), eq(admin.getId()));
            assertThat(reason.getValue()).isEqualTo("Photo page is unreadable");
            verify(eventPublisher).publishRejected(verification, null);
        }

        @Test
        @DisplayName("Should refuse rejection reasons shorter than the minimum")
        void shouldRefuseShortReason() {
            // Given
            givenAdmin();

            // When / Then
            assertThatThrownBy(() -> service.reject(UUID.randomUUID(), admin.getId(),
                    new RejectVerificationRequest("  blurry  ")))
                    .isInstanceOf(InvalidRequestException.class)
                    .hasMessage("Rejection reason must be at least 10 characters");
            verifyNoInteractions(decisionWriter, verificationRepository);
        }

        @Test
        @DisplayName("Should not review decided verifications")
        void shouldNotReviewDecided() {
            // Given
            givenAdmin();
            Verification verification = verification(VerificationStatus.REJECTED);
            when(verificationRepository.findById(verification.getId())).thenReturn(Optional.of(verification));

            // When / Then
            assertThatThrownBy(() -> service.approve(verification.getId(), admin.getId(),
                    ApproveVerificationRequest.builder().extractedData(Map.of()).build()))
                    .isInstanceOf(InvalidVerificationStateException.class)
                    .hasMessage("Cannot approve verification with status 'rejected'");
        }

        @Test
        @DisplayName("Should put a pending verification back into processing on reprocess")
        void shouldReprocess() {
            // Given
            givenAdmin();
            Verification verification = verification(VerificationStatus.PENDING);
            when(verificationRepository.findById(verification.getId())).thenReturn(Optional.of(verification));
            when(verificationRepository.saveAndFlush(verification)).thenReturn(verification);

            // When
            VerificationResponse response = service.reprocess(verification.getId(), admin.getId());

            // Then
            assertThat(response.getStatus()).isEqualTo(VerificationStatus.PROCESSING);
            verify(processingDispatcher).dispatch(verification.getId());
        }

        @Test
        @DisplayName("Should not reprocess a terminal verification")
        void shouldNotReprocessTerminal() {
            // Given
            givenAdmin();
            Verification verification = verification(VerificationStatus.CANCELLED);
            when(verificationRepository.findById(verification.getId())).thenReturn(Optional.of(verification));

            // When / Then
            assertThatThrownBy(() -> service.reprocess(verification.getId(), admin.getId()))
                    .isInstanceOf(InvalidVerificationStateException.class);
            verifyNoInteractions(processingDispatcher);
        }
    }

    @Nested
    @DisplayName("Status summary and prerequisites")
    class Summary {

        @Test
        @DisplayName("Should report verified when every required document is approved")
        void shouldReportVerified() {
            // Given
            when(userRepository.findById(user.getId())).thenReturn(Optional.of(user));
            Verification passport = verification(VerificationStatus.APPROVED);
            Verification diploma = verification(VerificationStatus.PENDING);
            diploma.setDocumentType(DocumentType.DIPLOMA);
            when(verificationRepository.findByUserId(user.getId())).thenReturn(List.of(passport, diploma));

            // When
            VerificationStatusSummary summary = service.getStatusSummary(user.getId());

            // Then
            assertThat(summary.getOverallStatus()).isEqualTo(UserVerificationStatus.VERIFIED);
            assertThat(summary.getVerifiedDocuments()).containsExactly(DocumentType.PASSPORT);
            assertThat(summary.getPendingDocuments()).containsExactly(DocumentType.DIPLOMA);
            assertThat(summary.getMissingRequiredDocuments()).isEmpty();
        }

        @Test
        @DisplayName("Should report partial when only optional documents are approved")
        void shouldReportPartial() {
            // Given
            when(userRepository.findById(user.getId())).thenReturn(Optional.of(user));
            Verification diploma = verification(VerificationStatus.APPROVED);
            diploma.setDocumentType(DocumentType.DIPLOMA);
            when(verificationRepository.findByUserId(user.getId())).thenReturn(List.of(diploma));

            // When
            VerificationStatusSummary summary = service.getStatusSummary(user.getId());

            // Then
            assertThat(summary.getOverallStatus()).isEqualTo(UserVerificationStatus.PARTIAL);
            assertThat(summary.getMissingRequiredDocuments()).containsExactly(DocumentType.PASSPORT);
        }

        @Test
        @DisplayName("Should report unverified with nothing approved and expired for expired users")
        void shouldReportUnverifiedAndExpired() {
            // Given
            when(userRepository.findById(user.getId())).thenReturn(Optional.of(user));
            when(verificationRepository.findByUserId(user.getId())).thenReturn(List.of());

            // When / Then
            assertThat(service.getStatusSummary(user.getId()).getOverallStatus())
                    .isEqualTo(UserVerificationStatus.UNVERIFIED);

            user.setVerificationStatus(UserVerificationStatus.EXPIRED);
            assertThat(service.getStatusSummary(user.getId()).getOverallStatus())
                    .isEqualTo(UserVerificationStatus.EXPIRED);
        }

        @Test
        @DisplayName("Should allow auto-verification only for passports with a processed selfie")
        void shouldCheckPrerequisites() {
            // Given
            Selfie selfie = Selfie.builder()
                    .userId(user.getId())
                    .filePath("selfies/x/selfie.jpg")
                    .status(SelfieStatus.PROCESSED)
                    .faceEmbedding(new byte[2048])
                    .build();
            when(selfieRepository.findByUserId(user.getId())).thenReturn(Optional.of(selfie));

            // When
            PrerequisiteCheckResponse passport = service.checkPrerequisites(user.getId(), DocumentType.PASSPORT);
            PrerequisiteCheckResponse diploma = service.checkPrerequisites(user.getId(), DocumentType.DIPLOMA);

            // Then
            assertThat(passport.isCanAutoVerify()).isTrue();
            assertThat(passport.getReason()).isNull();
            assertThat(diploma.isCanAutoVerify()).isFalse();
            assertThat(diploma.getReason()).isEqualTo("Only passports support auto-verification");
        }

        @Test
        @DisplayName("Should explain missing or failed selfies")
        void shouldExplainSelfieProblems() {
            // Given
            when(selfieRepository.findByUserId(user.getId())).thenReturn(Optional.empty());

            // When / Then
            assertThat(service.checkPrerequisites(user.getId(), DocumentType.PASSPORT).getReason())
                    .isEqualTo("Please upload a selfie first for identity verification");

            Selfie failed = Selfie.builder().userId(user.getId()).filePath("s").status(SelfieStatus.FAILED).build();
            when(selfieRepository.findByUserId(user.getId())).thenReturn(Optional.of(failed));
            assertThat(service.checkPrerequisites(user.getId(), DocumentType.PASSPORT).getReason())
                    .isEqualTo("Selfie processing incomplete, please re-upload");
        }
    }
}
