package com.nikoh.matchmaking.service.verification;

import com.nikoh.matchmaking.config.VerificationProperties;
import com.nikoh.matchmaking.domain.DocumentType;
import com.nikoh.matchmaking.domain.Selfie;
import com.nikoh.matchmaking.domain.Verification;
import com.nikoh.matchmaking.domain.VerificationMethod;
import com.nikoh.matchmaking.domain.VerificationStatus;
import com.nikoh.matchmaking.events.VerificationEventPublisher;
import com.nikoh.matchmaking.repository.SelfieRepository;
import com.nikoh.matchmaking.repository.VerificationRepository;
import com.nikoh.matchmaking.service.face.FaceComparator;
import com.nikoh.matchmaking.service.face.FaceEmbedding;
import com.nikoh.matchmaking.service.face.FaceExtraction;
import com.nikoh.matchmaking.service.face.FaceService;
import com.nikoh.matchmaking.service.mrz.IdentityRecord;
import com.nikoh.matchmaking.service.mrz.MrzExtraction;
import com.nikoh.matchmaking.service.mrz.MrzExtractor;
import com.nikoh.matchmaking.service.ocr.DocumentTextService;
import com.nikoh.matchmaking.service.ocr.PdfRasterizer;
import com.nikoh.matchmaking.service.ocr.TemporaryImage;
import com.nikoh.matchmaking.service.ocr.TextExtraction;
import com.nikoh.matchmaking.service.storage.DocumentStorageService;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * Automatic document verification.
 *
 * Passports go through MRZ extraction, selfie lookup, passport face extraction
 * and face comparison; the similarity score then decides between approval,
 * rejection and manual review. Every other document type is read with OCR and
 * always queued for manual review.
 *
 * The pipeline is not one transaction: each decision is written by
 * {@link VerificationDecisionWriter}, which refuses to overwrite a verification
 * that left the processing state in the meantime.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AutoVerificationService {

    static final double NO_FACE_COMPARISON_CONFIDENCE = 0.5;
    static final double OCR_ONLY_CONFIDENCE = 0.3;

    private static final Set<VerificationStatus> PROCESSING_ONLY = Set.of(VerificationStatus.PROCESSING);

    private final VerificationRepository verificationRepository;
    private final SelfieRepository selfieRepository;
    private final VerificationDecisionWriter decisionWriter;
    private final MrzExtractor mrzExtractor;
    private final FaceService faceService;
    private final FaceComparator faceComparator;
    private final DocumentTextService documentTextService;
    private final PdfRasterizer pdfRasterizer;
    private final DocumentStorageService storageService;
    private final VerificationProperties properties;
    private final VerificationEventPublisher eventPublisher;
    private final MeterRegistry meterRegistry;

    /**
     * Runs automatic verification for a verification in the processing state.
     * Never throws; unexpected errors leave the verification pending for review.
     */
    public AutoVerificationResult process(UUID verificationId) {
        if (!properties.isAutoEnabled()) {
            return AutoVerificationResult.notProcessed("Auto-verification is disabled");
        }

        Optional<Verification> found = verificationRepository.findById(verificationId);
        if (found.isEmpty()) {
            return AutoVerificationResult.notProcessed("Verification not found");
        }
        Verification verification = found.get();

        if (verification.getStatus() != VerificationStatus.PROCESSING) {
            return AutoVerificationResult.notProcessed(String.format("Verification status is %s, expected 'processing'",
                    verification.getStatus().name().toLowerCase(Locale.ROOT)));
        }

        Timer.Sample sample = Timer.start(meterRegistry);
        try {
            if (!storageService.exists(verification.getFilePath())) {
                log.warn("Document file missing for verification {}", verificationId);
                return review(verification, new LinkedHashMap<>(), "Document file not found", 0.0, null);
            }

            Path document = storageService.locate(verification.getFilePath());
            log.info("Auto-verifying {} {} for user {}", verification.getDocumentType(), verificationId,
                    verification.getUserId());

            return verification.getDocumentType() == DocumentType.PASSPORT
                    ? processPassport(verification, document)
                    : processOtherDocument(verification, document);
        } catch (Exception e) {
            log.error("Auto-verification of {} failed unexpectedly", verificationId, e);
            record("error");
            try {
                decisionWriter.returnToPending(verificationId, null);
            } catch (RuntimeException resetFailure) {
                log.error("Could not return verification {} to pending", verificationId, resetFailure);
            }
            return AutoVerificationResult.notProcessed("Automatic processing failed, queued for manual review");
        } finally {
            sample.stop(meterRegistry.timer("verification.auto.duration"));
        }
    }

    private AutoVerificationResult processPassport(Verification verification, Path document) {
        if (!PdfRasterizer.isPdf(document)) {
            return runPassportPipeline(verification, document);
        }
        try (TemporaryImage page = pdfRasterizer.renderFirstPage(document)) {
            return runPassportPipeline(verification, page.path());
        } catch (IOException e) {
            log.warn("Could not render passport PDF for verification {}: {}", verification.getId(), e.getMessage());
            Map<String, Object> data = new LinkedHashMap<>();
            data.put(ExtractedData.RAW_TEXT,
                    documentTextService.extractText(document).truncated(properties.getPassportRawTextLimit()));
            return review(verification, data, "PDF passport could not be converted to an image", 0.0, null);
        }
    }

    private AutoVerificationResult runPassportPipeline(Verification verification, Path image) {
        StepOutcome<IdentityRecord> identity = readIdentity(verification, image);
        if (!identity.isSuccess()) {
            return review(verification, identity.partialData(), identity.reason(), 0.0, null);
        }
        IdentityRecord record = identity.value();
        Map<String, Object> data = ExtractedData.fromIdentity(record);
        log.info("MRZ decoded for verification {}: {} {}", verification.getId(),
                record.getFirstName(), record.getLastName());

        StepOutcome<FaceEmbedding> selfie = loadSelfieEmbedding(verification.getUserId(), data);
        if (!selfie.isSuccess()) {
            return review(verification, data, selfie.reason(), NO_FACE_COMPARISON_CONFIDENCE, null);
        }

        StepOutcome<FaceEmbedding> passportFace = extractPassportFace(image, data);
        if (!passportFace.isSuccess()) {
            return review(verification, data, passportFace.reason(), NO_FACE_COMPARISON_CONFIDENCE, null);
        }

        double score = faceComparator.similarity(passportFace.value(), selfie.value());
        log.info("Face comparison score for verification {}: {}", verification.getId(),
                String.format(Locale.ROOT, "%.3f", score));

        return decide(verification, record, data, score);
    }

    private StepOutcome<IdentityRecord> readIdentity(Verification verification, Path image) {
        MrzExtraction mrz = mrzExtractor.extract(image);
        if (mrz.isValid()) {
            return StepOutcome.success(mrz.getRecord());
        }

        log.info("No valid MRZ for verification {}, falling back to OCR", verification.getId());
        TextExtraction text = documentTextService.extractText(image);
        Map<String, Object> data = new LinkedHashMap<>();
        data.put(ExtractedData.RAW_TEXT, text.truncated(properties.getPassportRawTextLimit()));
        data.put(ExtractedData.MRZ_DATA, mrz.getRecord() != null ? ExtractedData.fromIdentity(mrz.getRecord()) : null);

        if (mrz.getStatus() == MrzExtraction.Status.UNAVAILABLE) {
            return StepOutcome.failure("OCR engine not available, passport needs manual review", data);
        }
        return StepOutcome.needsReview("Could not extract valid MRZ from passport", data);
    }

    private StepOutcome<FaceEmbedding> loadSelfieEmbedding(UUID userId, Map<String, Object> data) {
        Optional<Selfie> selfie = selfieRepository.findByUserId(userId);
        if (selfie.isEmpty() || !selfie.get().hasEmbedding()) {
            return StepOutcome.needsReview("No selfie uploaded for face comparison", data);
        }
        try {
            return StepOutcome.success(FaceEmbedding.fromBytes(selfie.get().getFaceEmbedding()));
        } catch (IllegalArgumentException e) {
            log.warn("Stored selfie embedding for user {} is unreadable: {}", userId, e.getMessage());
            return StepOutcome.failure("Selfie embedding unreadable, please re-upload selfie", data);
        }
    }

    private StepOutcome<FaceEmbedding> extractPassportFace(Path image, Map<String, Object> data) {
        FaceExtraction face = faceService.extractFace(image);
        switch (face.getStatus()) {
            case FOUND:
                return StepOutcome.success(face.getEmbedding());
            case NO_FACE:
                return StepOutcome.needsReview("Could not detect face in passport photo", data);
            case UNAVAILABLE:
                return StepOutcome.failure("Face recognition service not available", data);
            default:
                return StepOutcome.failure("Passport face extraction failed: " + face.getMessage(), data);
        }
    }

    private AutoVerificationResult decide(Verification verification, IdentityRecord record,
                                          Map<String, Object> data, double score) {
        double approveThreshold = properties.getAutoApproveThreshold();
        double rejectThreshold = properties.getAutoRejectThreshold();

        if (score >= approveThreshold) {
            Optional<Verification> approved = decisionWriter.approve(verification.getId(), PROCESSING_ONLY, data,
                    record.getExpiryDate(), VerificationMethod.AUTOMATED, null);
            if (approved.isEmpty()) {
                return superseded(data, score);
            }
            eventPublisher.publishApproved(approved.get(), score);
            record("approved");
            return AutoVerificationResult.builder()
                    .autoVerified(true)
                    .confidence(score)
                    .extractedData(data)
                    .needsManualReview(false)
                    .faceMatchScore(score)
                    .build();
        }

        if (score <= rejectThreshold) {
            String reason = String.format(Locale.ROOT,
                    "Face match score too low (%.2f). Possible identity mismatch.", score);
            Optional<Verification> rejected = decisionWriter.reject(verification.getId(), PROCESSING_ONLY, reason,
                    data, VerificationMethod.AUTOMATED, null);
            if (rejected.isEmpty()) {
                return superseded(data, score);
            }
            eventPublisher.publishRejected(rejected.get(), score);
            record("rejected");
            return AutoVerificationResult.builder()
                    .confidence(score)
                    .extractedData(data)
                    .failureReason(String.format(Locale.ROOT, "Face match score too low: %.2f", score))
                    .needsManualReview(false)
                    .faceMatchScore(score)
                    .build();
        }

        return review(verification, data,
                String.format(Locale.ROOT, "Face match score uncertain (%.2f), needs manual review", score),
                score, score);
    }

    private AutoVerificationResult processOtherDocument(Verification verification, Path document) {
        TextExtraction text = documentTextService.extractText(document);

        Map<String, Object> data = new LinkedHashMap<>();
        if (text.hasText()) {
            Optional<DocumentType> detected = documentTextService.detectDocumentType(text.getText());
            List<String> dates = documentTextService.extractDates(text.getText());

            data.put(ExtractedData.RAW_TEXT, text.truncated(properties.getDocumentRawTextLimit()));
            data.put(ExtractedData.DETECTED_TYPE, detected.map(type -> type.name().toLowerCase(Locale.ROOT)).orElse(null));
            detected.ifPresent(type -> data.put(ExtractedData.TYPE_MATCHES_DECLARED,
                    type == verification.getDocumentType()));
            data.put(ExtractedData.FOUND_DATES, dates.subList(0, Math.min(dates.size(), properties.getMaxFoundDates())));
            data.put(ExtractedData.FOUND_NAMES, documentTextService.extractNames(text.getText()));
        } else {
            log.info("No text read from {} {}: {}", verification.getDocumentType(), verification.getId(),
                    text.getReason());
        }

        return review(verification, data, "Non-passport documents require manual review", OCR_ONLY_CONFIDENCE, null);
    }

    private AutoVerificationResult review(Verification verification, Map<String, Object> data, String reason,
                                          double confidence, Double faceMatchScore) {
        Optional<Verification> pending = decisionWriter.returnToPending(verification.getId(), data);
        if (pending.isEmpty()) {
            return superseded(data, faceMatchScore);
        }
        eventPublisher.publishManualReview(pending.get(), faceMatchScore, reason);
        record("manual_review");
        return AutoVerificationResult.builder()
                .confidence(confidence)
                .extractedData(data)
                .failureReason(reason)
                .needsManualReview(true)
                .faceMatchScore(faceMatchScore)
                .build();
    }

    private AutoVerificationResult superseded(Map<String, Object> data, Double faceMatchScore) {
        record("superseded");
        return AutoVerificationResult.builder()
                .extractedData(data)
                .failureReason("Verification status changed during processing")
                .needsManualReview(false)
                .faceMatchScore(faceMatchScore)
                .build();
    }

    private void record(String outcome) {
        meterRegistry.counter("verification.auto.outcome", "outcome", outcome).increment();
    }
}
