package com.nikoh.matchmaking.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Native OCR and face model locations.
 * Missing files leave the corresponding engine unavailable instead of failing startup.
 */
@Data
@Component
@ConfigurationProperties(prefix = "nikoh.recognition")
public class RecognitionProperties {

    private Tesseract tesseract = new Tesseract();

    private Face face = new Face();

    @Data
    public static class Tesseract {
        /**
         * Directory containing the tessdata files
         */
        private String dataPath = "/usr/share/tesseract-ocr/5/tessdata";

        /**
         * Languages for general document text
         */
        private String languages = "eng+rus";

        /**
         * Language for machine readable zones
         */
        private String mrzLanguage = "eng";
    }

    @Data
    public static class Face {
        /**
         * YuNet face detector in ONNX format
         */
        private String detectorModel = "models/face_detection_yunet_2023mar.onnx";

        /**
         * ArcFace recogniser in ONNX format producing 512 dimensional embeddings
         */
        private String recognizerModel = "models/arcface_r100.onnx";

        private float scoreThreshold = 0.8f;

        private float nmsThreshold = 0.3f;

        private int topK = 50;
    }
}
