package com.nikoh.matchmaking.service.storage;

import com.nikoh.matchmaking.exception.InvalidDocumentException;
import org.springframework.stereotype.Component;
import org.springframework.util.unit.DataSize;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.util.Collection;
import java.util.Map;

/**
 * Checks uploads before anything is persisted and reads their content.
 */
@Component
public class UploadValidator {

    private static final Map<String, String> EXTENSIONS = Map.of(
            "image/jpeg", ".jpg",
            "image/png", ".png",
            "application/pdf", ".pdf");

    /**
     * @return the file content
     * @throws InvalidDocumentException when the file is missing, of a type not in {@code allowedTypes} or too large
     */
    public byte[] validateAndRead(MultipartFile file, Collection<String> allowedTypes, DataSize maxSize,
                                  String invalidTypeMessage) {
        if (file == null || file.isEmpty()) {
            throw new InvalidDocumentException("File is required");
        }
        if (file.getContentType() == null || !allowedTypes.contains(file.getContentType())) {
            throw new InvalidDocumentException(invalidTypeMessage);
        }
        if (file.getSize() > maxSize.toBytes()) {
            throw new InvalidDocumentException("File too large. Maximum size: " + maxSize.toMegabytes() + "MB");
        }
        try {
            return file.getBytes();
        } catch (IOException e) {
            throw new InvalidDocumentException("Could not read uploaded file", e);
        }
    }

    /**
     * Extension stored files get, derived from the validated content type
     */
    public String extensionFor(String contentType) {
        return EXTENSIONS.getOrDefault(contentType, ".bin");
    }
}
