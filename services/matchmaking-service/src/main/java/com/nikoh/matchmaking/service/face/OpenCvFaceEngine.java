package com.nikoh.matchmaking.service.face;

import com.nikoh.matchmaking.config.RecognitionProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.bytedeco.javacpp.PointerScope;
import org.bytedeco.javacpp.indexer.FloatIndexer;
import org.bytedeco.opencv.opencv_core.Mat;
import org.bytedeco.opencv.opencv_core.Rect;
import org.bytedeco.opencv.opencv_core.Scalar;
import org.bytedeco.opencv.opencv_core.Size;
import org.bytedeco.opencv.opencv_dnn.Net;
import org.bytedeco.opencv.opencv_objdetect.FaceDetectorYN;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

import static org.bytedeco.opencv.global.opencv_core.CV_32F;
import static org.bytedeco.opencv.global.opencv_dnn.DNN_BACKEND_DEFAULT;
import static org.bytedeco.opencv.global.opencv_dnn.DNN_TARGET_CPU;
import static org.bytedeco.opencv.global.opencv_dnn.blobFromImage;
import static org.bytedeco.opencv.global.opencv_dnn.readNetFromONNX;
import static org.bytedeco.opencv.global.opencv_imgcodecs.imread;

/**
 * OpenCV backed face engine: YuNet for detection, an ArcFace ONNX model for
 * 512 dimensional embeddings.
 *
 * Models are loaded once on first use and kept for the life of the process.
 * Inference is serialised because neither network is thread safe.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class OpenCvFaceEngine implements FaceEngine {

    private static final int EMBEDDING_INPUT_SIZE = 112;
    private static final double PIXEL_MEAN = 127.5;
    private static final double PIXEL_SCALE = 1.0 / 127.5;

    private final RecognitionProperties properties;

    private final Object lock = new Object();
    private volatile boolean initialised;
    private FaceDetectorYN detector;
    private Net recognizer;

    @Override
    public boolean isAvailable() {
        initialiseOnce();
        return detector != null && recognizer != null;
    }

    @Override
    public FaceAnalysis analyze(Path image) throws IOException {
        if (!isAvailable()) {
            throw new IllegalStateException("Face engine not available");
        }
        synchronized (lock) {
            try (PointerScope scope = new PointerScope()) {
                Mat picture = imread(image.toString());
                if (picture == null || picture.empty()) {
                    throw new IOException("Unreadable image: " + image.getFileName());
                }

                detector.setInputSize(new Size(picture.cols(), picture.rows()));
                Mat detections = new Mat();
                detector.detect(picture, detections);

                FaceAnalysis.FaceAnalysisBuilder analysis = FaceAnalysis.builder()
                        .imageWidth(picture.cols())
                        .imageHeight(picture.rows());

                if (detections.empty()) {
                    return analysis.build();
                }

                try (FloatIndexer rows = detections.createIndexer()) {
                    for (int i = 0; i < detections.rows(); i++) {
                        Rect box = clamp(rows.get(i, 0), rows.get(i, 1), rows.get(i, 2), rows.get(i, 3),
                                picture.cols(), picture.rows());
                        if (box.width() <= 0 || box.height() <= 0) {
                            continue;
                        }
                        analysis.face(DetectedFace.builder()
                                .x(box.x())
                                .y(box.y())
                                .width(box.width())
                                .height(box.height())
                                .score(rows.get(i, 14))
                                .embedding(embed(new Mat(picture, box)))
                                .build());
                    }
                }
                return analysis.build();
            }
        }
    }

    private FaceEmbedding embed(Mat faceCrop) {
        Mat blob = blobFromImage(faceCrop, PIXEL_SCALE,
                new Size(EMBEDDING_INPUT_SIZE, EMBEDDING_INPUT_SIZE),
                new Scalar(PIXEL_MEAN, PIXEL_MEAN, PIXEL_MEAN, 0.0),
                true, false, CV_32F);
        recognizer.setInput(blob);
        Mat output = recognizer.forward();

        float[] values = new float[FaceEmbedding.DIMENSION];
        try (FloatIndexer indexer = output.createIndexer()) {
            for (int j = 0; j < values.length; j++) {
                values[j] = indexer.get(0, j);
            }
        }
        return FaceEmbedding.of(values).normalized();
    }

    private static Rect clamp(float x, float y, float width, float height, int imageWidth, int imageHeight) {
        int left = Math.max(0, Math.round(x));
        int top = Math.max(0, Math.round(y));
        int right = Math.min(imageWidth, Math.round(x + width));
        int bottom = Math.min(imageHeight, Math.round(y + height));
        return new Rect(left, top, right - left, bottom - top);
    }

    private void initialiseOnce() {
        if (initialised) {
            return;
        }
        synchronized (lock) {
            if (initialised) {
                return;
            }
            try {
                load();
            } finally {
                initialised = true;
            }
        }
    }

    private void load() {
        RecognitionProperties.Face face = properties.getFace();
        Path detectorModel = Paths.get(face.getDetectorModel());
        Path recognizerModel = Paths.get(face.getRecognizerModel());

        if (!Files.isRegularFile(detectorModel) || !Files.isRegularFile(recognizerModel)) {
            log.warn("Face models not found ({}, {}), face recognition disabled", detectorModel, recognizerModel);
            return;
        }

        try {
            FaceDetectorYN loadedDetector = FaceDetectorYN.create(detectorModel.toString(), "",
                    new Size(320, 320), face.getScoreThreshold(), face.getNmsThreshold(), face.getTopK(),
                    DNN_BACKEND_DEFAULT, DNN_TARGET_CPU);
            Net loadedRecognizer = readNetFromONNX(recognizerModel.toString());
            if (loadedRecognizer.empty()) {
                log.warn("Face recognizer model {} could not be loaded, face recognition disabled", recognizerModel);
                return;
            }
            detector = loadedDetector;
            recognizer = loadedRecognizer;
            log.info("Face engine initialised with detector {} and recognizer {}", detectorModel, recognizerModel);
        } catch (LinkageError | RuntimeException e) {
            log.warn("OpenCV runtime not available, face recognition disabled: {}", e.getMessage());
        }
    }
}
