package com.example.cardamageanalyzer.model;

import io.swagger.v3.oas.annotations.media.Schema;

@Schema(description = "State of a single image within the current batch")
public record BatchItemResponse(
        @Schema(description = "Position of the image in the submitted batch", example = "0") int index,
        @Schema(description = "Original name of the uploaded file", example = "front-left.jpg") String fileName,
        @Schema(description = "Declared media type of the upload", example = "image/jpeg") String mediaType,
        @Schema(description = "Size of the upload in bytes", example = "482113") int sizeBytes,
        @Schema(description = "Whether a normalized copy exists and will be used for scoring") boolean normalized,
        @Schema(description = "Damage estimate, absent until the image was scored successfully") ScoreResult result,
        @Schema(description = "Failure of the last normalization or scoring attempt") ItemError error) {

    public static BatchItemResponse from(BatchItem item) {
        ImagePayload source = item.sourceImage();
        return new BatchItemResponse(
                item.index(),
                source.fileName(),
                source.mediaType(),
                source.size(),
                item.normalizedImage() != null,
                item.result(),
                item.error());
    }
}
