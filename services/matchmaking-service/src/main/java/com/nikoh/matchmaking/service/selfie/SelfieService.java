package com.nikoh.matchmaking.service.selfie;

import com.nikoh.matchmaking.config.VerificationProperties;
import com.nikoh.matchmaking.domain.Selfie;
import com.nikoh.matchmaking.domain.SelfieStatus;
import com.nikoh.matchmaking.dto.SelfieResponse;
import com.nikoh.matchmaking.exception.ResourceNotFoundException;
import com.nikoh.matchmaking.repository.SelfieRepository;
import com.nikoh.matchmaking.service.face.FaceExtraction;
import com.nikoh.matchmaking.service.face.FaceService;
import com.nikoh.matchmaking.service.storage.DocumentStorageService;
import com.nikoh.matchmaking.service.storage.UploadValidator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.web.multipart.MultipartFile;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.UUID;

/**
 * Reference selfies used for passport face comparison. Each user keeps at most one;
 * uploading again replaces the file and discards the previous embedding.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SelfieService {

    static final String NOT_AVAILABLE = "Face recognition service not available";
    static final String NO_FACE = "No face detected in image";
    static final String MULTIPLE_FACES = "Multiple faces detected, please upload a photo with only your face";
    static final String LOW_QUALITY = "Face quality too low, please upload a clearer photo";

    private final SelfieRepository selfieRepository;
    private final FaceService faceService;
    private final DocumentStorageService storageService;
    private final UploadValidator uploadValidator;
    private final VerificationProperties properties;
    private final Clock clock;

    @Transactional
    public SelfieResponse upload(UUID userId, MultipartFile file) {
        byte[] content = uploadValidator.validateAndRead(file, properties.getAllowedSelfieTypes(),
                properties.getMaxFileSize(), "Invalid file type. Please upload a JPEG or PNG image.");

        String path = storageService.store("selfies/" + userId,
                "selfie" + uploadValidator.extensionFor(file.getContentType()), content);

        Selfie selfie = selfieRepository.findByUserId(userId)
                .orElseGet(() -> Selfie.builder().userId(userId).build());
        if (selfie.getFilePath() != null && !selfie.getFilePath().equals(path)) {
            storageService.delete(selfie.getFilePath());
        }

        selfie.setFilePath(path);
        selfie.setOriginalFilename(file.getOriginalFilename());
        selfie.setMimeType(file.getContentType());
        selfie.setFileSize((long) content.length);
        resetProcessing(selfie);

        process(selfie);
        return SelfieResponse.from(selfieRepository.save(selfie));
    }

    @Transactional(readOnly = true)
    public SelfieResponse getSelfie(UUID userId) {
        return SelfieResponse.from(findSelfie(userId));
    }

    @Transactional
    public void deleteSelfie(UUID userId) {
        Selfie selfie = findSelfie(userId);
        storageService.delete(selfie.getFilePath());
        selfieRepository.delete(selfie);
        log.info("Deleted selfie of user {}", userId);
    }

    /**
     * Extracts the embedding again, e.g. after the face runtime became available.
     */
    @Transactional
    public SelfieResponse reprocess(UUID userId) {
        Selfie selfie = findSelfie(userId);
        resetProcessing(selfie);
        process(selfie);
        return SelfieResponse.from(selfieRepository.save(selfie));
    }

    /**
     * Fills in the embedding or marks the selfie failed with a message the user can act on.
     */
    void process(Selfie selfie) {
        if (!storageService.exists(selfie.getFilePath())) {
            fail(selfie, "File not found");
            return;
        }
        if (!faceService.isAvailable()) {
            fail(selfie, NOT_AVAILABLE);
            return;
        }

        FaceExtraction face = faceService.extractFace(storageService.locate(selfie.getFilePath()));
        switch (face.getStatus()) {
            case FOUND:
                break;
            case NO_FACE:
                fail(selfie, NO_FACE);
                return;
            case UNAVAILABLE:
                fail(selfie, NOT_AVAILABLE);
                return;
            default:
                fail(selfie, face.getMessage());
                return;
        }

        if (face.getFaceCount() > 1) {
            fail(selfie, MULTIPLE_FACES);
            return;
        }
        if (face.getQuality() < properties.getMinSelfieQuality()) {
            fail(selfie, LOW_QUALITY);
            return;
        }

        selfie.setFaceEmbedding(face.getEmbedding().toBytes());
        selfie.setStatus(SelfieStatus.PROCESSED);
        selfie.setProcessedAt(LocalDateTime.now(clock));
        selfie.setErrorMessage(null);
        log.info("Selfie processed for user {}", selfie.getUserId());
    }

    private void fail(Selfie selfie, String message) {
        selfie.setStatus(SelfieStatus.FAILED);
        selfie.setErrorMessage(message);
        log.info("Selfie of user {} failed: {}", selfie.getUserId(), message);
    }

    private static void resetProcessing(Selfie selfie) {
        selfie.setStatus(SelfieStatus.PENDING);
        selfie.setErrorMessage(null);
        selfie.setFaceEmbedding(null);
        selfie.setProcessedAt(null);
    }

    private Selfie findSelfie(UUID userId) {
        return selfieRepository.findByUserId(userId)
                .orElseThrow(() -> new ResourceNotFoundException("Selfie", userId));
    }
}
