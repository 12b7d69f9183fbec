package com.example.cardamageanalyzer.controller;

import com.example.cardamageanalyzer.model.ImagePayload;
import org.springframework.web.multipart.MultipartFile;
import org.springframework.web.server.ResponseStatusException;

import java.io.IOException;

import static org.springframework.http.HttpStatus.BAD_REQUEST;

/**
 * Converts multipart uploads into payloads. Uploads are not decoded here; decoding problems are
 * reported per image by the pipeline.
 */
final class UploadedImages {

    private UploadedImages() {
    }

    static ImagePayload toPayload(MultipartFile file) {
        String fileName = file.getOriginalFilename();
        if (fileName == null || fileName.isBlank()) {
            fileName = "image";
        }
        try {
            return ImagePayload.of(fileName, file.getContentType(), file.getBytes());
        } catch (IOException ex) {
            throw new ResponseStatusException(BAD_REQUEST, "Failed to read uploaded file " + fileName, ex);
        }
    }
}
