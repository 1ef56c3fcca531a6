package com.nikoh.matchmaking.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.util.unit.DataSize;

import java.util.ArrayList;
import java.util.List;

/**
 * Document verification policy.
 * Thresholds are read on every decision so a property refresh takes effect immediately.
 */
@Data
@Component
@ConfigurationProperties(prefix = "nikoh.verification")
public class VerificationProperties {

    /**
     * Run the automatic pipeline after upload
     */
    private boolean autoEnabled = true;

    /**
     * Face similarity at or above which a passport is approved
     */
    private double autoApproveThreshold = 0.65;

    /**
     * Face similarity at or below which a passport is rejected
     */
    private double autoRejectThreshold = 0.35;

    private int minRejectionReasonLength = 10;

    private DataSize maxFileSize = DataSize.ofMegabytes(10);

    private List<String> allowedDocumentTypes = new ArrayList<>(
            List.of("image/jpeg", "image/png", "application/pdf"));

    private List<String> allowedSelfieTypes = new ArrayList<>(
            List.of("image/jpeg", "image/png"));

    /**
     * Resolution used when rendering PDF pages for OCR and face detection
     */
    private int pdfRenderDpi = 300;

    private int passportRawTextLimit = 1000;

    private int documentRawTextLimit = 2000;

    private int maxFoundDates = 5;

    /**
     * Selfies with a lower quality score are marked failed
     */
    private double minSelfieQuality = 0.3;
}
