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
import com.nikoh.matchmaking.exception.InvalidRequestException;
import com.nikoh.matchmaking.exception.InvalidVerificationStateException;
import com.nikoh.matchmaking.exception.ResourceNotFoundException;
import com.nikoh.matchmaking.repository.SelfieRepository;
import com.nikoh.matchmaking.repository.UserRepository;
import com.nikoh.matchmaking.repository.VerificationRepository;
import com.nikoh.matchmaking.service.storage.DocumentStorageService;
import com.nikoh.matchmaking.service.storage.UploadValidator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;
import org.springframework.web.multipart.MultipartFile;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * Document verification lifecycle: upload, owner actions and manual review.
 * Automatic processing is handed to {@link VerificationProcessingDispatcher} once the upload commits.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class VerificationService {

    static final Set<DocumentType> REQUIRED_DOCUMENTS = EnumSet.of(DocumentType.PASSPORT);

    private static final Set<VerificationStatus> IN_PROGRESS =
            EnumSet.of(VerificationStatus.PENDING, VerificationStatus.PROCESSING, VerificationStatus.MANUAL_REVIEW);

    private final VerificationRepository verificationRepository;
    private final UserRepository userRepository;
    private final SelfieRepository selfieRepository;
    private final VerificationDecisionWriter decisionWriter;
    private final VerificationProcessingDispatcher processingDispatcher;
    private final DocumentStorageService storageService;
    private final UploadValidator uploadValidator;
    private final VerificationProperties properties;
    private final VerificationEventPublisher eventPublisher;
    private final Clock clock;

    /**
     * Stores the document and creates its verification. Input errors are raised before
     * anything is written. With auto-verification enabled the verification is returned in
     * the processing state and the pipeline starts after commit.
     */
    @Transactional
    public VerificationResponse upload(UUID userId, DocumentType documentType, String documentCountry,
                                       MultipartFile file) {
        byte[] content = uploadValidator.validateAndRead(file, properties.getAllowedDocumentTypes(),
                properties.getMaxFileSize(), "Invalid file type. Allowed types: JPEG, PNG, PDF");

        User user = userRepository.findById(userId)
                .orElseThrow(() -> new ResourceNotFoundException("User", userId));

        if (verificationRepository.existsByUserIdAndDocumentTypeAndStatusIn(user.getId(), documentType, IN_PROGRESS)) {
            throw new InvalidVerificationStateException(
                    "A " + documentType.name().toLowerCase() + " verification is already in progress");
        }

        Verification verification = verificationRepository.saveAndFlush(Verification.builder()
                .userId(user.getId())
                .documentType(documentType)
                .documentCountry(documentCountry)
                .status(VerificationStatus.PENDING)
                .originalFilename(file.getOriginalFilename())
                .mimeType(file.getContentType())
                .fileSize((long) content.length)
                .submittedAt(LocalDateTime.now(clock))
                .build());

        String directory = "verifications/" + user.getId() + "/" + verification.getId();
        verification.setFilePath(storageService.store(directory,
                "document" + uploadValidator.extensionFor(file.getContentType()), content));

        if (properties.isAutoEnabled()) {
            verification.setStatus(VerificationStatus.PROCESSING);
            UUID verificationId = verification.getId();
            afterCommit(() -> processingDispatcher.dispatch(verificationId));
        }

        log.info("Uploaded {} verification {} for user {} ({} bytes)", documentType, verification.getId(),
                userId, content.length);
        return VerificationResponse.from(verificationRepository.save(verification));
    }

    /**
     * Owners see their own verifications, admins see all of them with file details.
     */
    @Transactional(readOnly = true)
    public VerificationResponse getVerification(UUID verificationId, UUID requesterId) {
        Verification verification = findVerification(verificationId);
        if (verification.isOwnedBy(requesterId)) {
            return VerificationResponse.from(verification);
        }
        requireAdmin(requesterId);
        return VerificationResponse.forAdmin(verification);
    }

    @Transactional(readOnly = true)
    public Page<VerificationResponse> listUserVerifications(UUID userId, VerificationStatus status, Pageable pageable) {
        Page<Verification> page = status == null
                ? verificationRepository.findByUserIdOrderByCreatedAtDesc(userId, pageable)
                : verificationRepository.findByUserIdAndStatusOrderByCreatedAtDesc(userId, status, pageable);
        return page.map(VerificationResponse::from);
    }

    /**
     * Review queue for admins, oldest first
     */
    @Transactional(readOnly = true)
    public Page<VerificationResponse> listPendingReview(UUID adminId, Pageable pageable) {
        requireAdmin(adminId);
        return verificationRepository.findByStatusInOrderByCreatedAtAsc(VerificationStatus.reviewable(), pageable)
                .map(VerificationResponse::forAdmin);
    }

    /**
     * Cancels a pending or processing verification. A concurrent decision by the pipeline
     * surfaces as an optimistic locking conflict.
     */
    @Transactional
    public VerificationResponse cancel(UUID verificationId, UUID userId) {
        Verification verification = findVerification(verificationId);
        if (!verification.isOwnedBy(userId)) {
            throw new ForbiddenOperationException("Not your verification");
        }
        if (!verification.getStatus().isCancellable()) {
            throw new InvalidVerificationStateException(verification.getStatus(), "cancel");
        }

        verification.setStatus(VerificationStatus.CANCELLED);
        Verification saved = verificationRepository.saveAndFlush(verification);
        afterCommit(() -> deleteDocumentFile(saved));

        afterCommit(() -> eventPublisher.publishCancelled(saved));
        log.info("Verification {} cancelled by owner {}", verificationId, userId);
        return VerificationResponse.from(saved);
    }

    @Transactional
    public VerificationResponse approve(UUID verificationId, UUID adminId, ApproveVerificationRequest request) {
        requireAdmin(adminId);
        Verification verification = findVerification(verificationId);
        if (!verification.getStatus().isReviewable()) {
            throw new InvalidVerificationStateException(verification.getStatus(), "approve");
        }

        Verification approved = decisionWriter.approve(verificationId, VerificationStatus.reviewable(),
                        request.getExtractedData(), request.getDocumentExpiryDate(), VerificationMethod.MANUAL, adminId)
                .orElseThrow(() -> new InvalidVerificationStateException(
                        "Verification " + verificationId + " changed status during review"));

        afterCommit(() -> eventPublisher.publishApproved(approved, null));
        return VerificationResponse.forAdmin(approved);
    }

    @Transactional
    public VerificationResponse reject(UUID verificationId, UUID adminId, RejectVerificationRequest request) {
        requireAdmin(adminId);
        String reason = request.getReason() == null ? "" : request.getReason().trim();
        if (reason.length() < properties.getMinRejectionReasonLength()) {
            throw new InvalidRequestException("Rejection reason must be at least "
                    + properties.getMinRejectionReasonLength() + " characters");
        }

        Verification verification = findVerification(verificationId);
        if (!verification.getStatus().isReviewable()) {
            throw new InvalidVerificationStateException(verification.getStatus(), "reject");
        }

        Verification rejected = decisionWriter.reject(verificationId, VerificationStatus.reviewable(), reason,
                        null, VerificationMethod.MANUAL, adminId)
                .orElseThrow(() -> new InvalidVerificationStateException(
                        "Verification " + verificationId + " changed status during review"));

        afterCommit(() -> eventPublisher.publishRejected(rejected, null));
        return VerificationResponse.forAdmin(rejected);
    }

    /**
     * Runs the automatic pipeline again, for verifications still awaiting a decision.
     * Also releases a verification left in processing by a crashed run.
     */
    @Transactional
    public VerificationResponse reprocess(UUID verificationId, UUID adminId) {
        requireAdmin(adminId);
        if (!properties.isAutoEnabled()) {
            throw new InvalidRequestException("Auto-verification is disabled");
        }
        Verification verification = findVerification(verificationId);
        if (verification.getStatus().isTerminal()) {
            throw new InvalidVerificationStateException(verification.getStatus(), "reprocess");
        }

        verification.setStatus(VerificationStatus.PROCESSING);
        Verification saved = verificationRepository.saveAndFlush(verification);
        afterCommit(() -> processingDispatcher.dispatch(verificationId));

        log.info("Admin {} requested reprocessing of verification {}", adminId, verificationId);
        return VerificationResponse.forAdmin(saved);
    }

    @Transactional(readOnly = true)
    public VerificationStatusSummary getStatusSummary(UUID userId) {
        User user = userRepository.findById(userId)
                .orElseThrow(() -> new ResourceNotFoundException("User", userId));

        List<DocumentType> verified = new ArrayList<>();
        List<DocumentType> pending = new ArrayList<>();
        for (Verification verification : verificationRepository.findByUserId(userId)) {
            if (verification.getStatus() == VerificationStatus.APPROVED) {
                verified.add(verification.getDocumentType());
            } else if (verification.getStatus().isReviewable()) {
                pending.add(verification.getDocumentType());
            }
        }

        List<DocumentType> missing = new ArrayList<>();
        for (DocumentType required : REQUIRED_DOCUMENTS) {
            if (!verified.contains(required) && !pending.contains(required)) {
                missing.add(required);
            }
        }

        UserVerificationStatus overall;
        if (user.getVerificationStatus() == UserVerificationStatus.EXPIRED) {
            overall = UserVerificationStatus.EXPIRED;
        } else if (verified.isEmpty()) {
            overall = UserVerificationStatus.UNVERIFIED;
        } else if (missing.isEmpty()) {
            overall = UserVerificationStatus.VERIFIED;
        } else {
            overall = UserVerificationStatus.PARTIAL;
        }

        return VerificationStatusSummary.builder()
                .overallStatus(overall)
                .verifiedDocuments(verified)
                .pendingDocuments(pending)
                .missingRequiredDocuments(missing)
                .verificationExpiresAt(user.getVerificationExpiresAt())
                .build();
    }

    /**
     * Whether an upload of {@code documentType} would be decided automatically right now.
     */
    @Transactional(readOnly = true)
    public PrerequisiteCheckResponse checkPrerequisites(UUID userId, DocumentType documentType) {
        PrerequisiteCheckResponse.PrerequisiteCheckResponseBuilder response = PrerequisiteCheckResponse.builder()
                .documentType(documentType);

        if (!documentType.supportsAutoApproval()) {
            return response.reason("Only passports support auto-verification").build();
        }
        if (!properties.isAutoEnabled()) {
            return response.reason("Auto-verification is disabled").build();
        }

        Optional<Selfie> selfie = selfieRepository.findByUserId(userId);
        if (selfie.isEmpty()) {
            return response.reason("Please upload a selfie first for identity verification").build();
        }
        if (!selfie.get().hasEmbedding()) {
            return response.reason("Selfie processing incomplete, please re-upload").build();
        }
        if (selfie.get().getStatus() != SelfieStatus.PROCESSED) {
            return response.reason("Selfie status is " + selfie.get().getStatus().name().toLowerCase()
                    + ", expected 'processed'").build();
        }
        return response.canAutoVerify(true).build();
    }

    /**
     * Removes the stored document together with its now empty directories.
     */
    public void deleteDocumentFile(Verification verification) {
        if (storageService.delete(verification.getFilePath())) {
            log.info("Deleted document file of verification {}", verification.getId());
        }
    }

    private Verification findVerification(UUID verificationId) {
        return verificationRepository.findById(verificationId)
                .orElseThrow(() -> new ResourceNotFoundException("Verification", verificationId));
    }

    private void requireAdmin(UUID userId) {
        userRepository.findById(userId)
                .filter(User::isAdmin)
                .orElseThrow(() -> new ForbiddenOperationException("Admin privileges required"));
    }

    private static void afterCommit(Runnable action) {
        if (!TransactionSynchronizationManager.isSynchronizationActive()) {
            action.run();
            return;
        }
        TransactionSynchronizationManager.registerSynchronization(new TransactionSynchronization() {
            @Override
            public void afterCommit() {
                action.run();
            }
        });
    }
}
