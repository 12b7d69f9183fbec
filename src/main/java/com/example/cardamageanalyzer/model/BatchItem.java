package com.example.cardamageanalyzer.model;

import java.util.Objects;
import java.util.Optional;

/**
 * One entry of a batch, addressed by its position. Instances are never mutated; every state
 * change produces a replacement item so previously published snapshots stay consistent.
 */
public record BatchItem(int index, ImagePayload sourceImage, ImagePayload normalizedImage, ScoreResult result,
                        ItemError error) {

    public BatchItem {
        if (index < 0) {
            throw new IllegalArgumentException("Item index cannot be negative");
        }
        Objects.requireNonNull(sourceImage, "sourceImage");
        if (result != null && error != null && error.kind().isScoringFailure()) {
            throw new IllegalArgumentException("An item cannot carry both a result and a scoring error");
        }
    }

    public static BatchItem pending(int index, ImagePayload sourceImage) {
        return new BatchItem(index, sourceImage, null, null, null);
    }

    public Optional<ImagePayload> normalized() {
        return Optional.ofNullable(normalizedImage);
    }

    public Optional<ScoreResult> scoreResult() {
        return Optional.ofNullable(result);
    }

    public Optional<ItemError> itemError() {
        return Optional.ofNullable(error);
    }

    /**
     * Image handed to the scoring oracle: the normalized one when available, the upload otherwise.
     */
    public ImagePayload imageForScoring() {
        return normalizedImage != null ? normalizedImage : sourceImage;
    }

    public boolean hasResult() {
        return result != null;
    }

    /**
     * Replaces the normalized copy and clears the last error. An earlier score is kept until the
     * next analysis replaces it.
     */
    public BatchItem withNormalized(ImagePayload normalized) {
        return new BatchItem(index, sourceImage, Objects.requireNonNull(normalized, "normalized"), result, null);
    }

    /**
     * Drops the normalized copy so scoring falls back to the upload. An earlier score is kept next
     * to the normalization error.
     */
    public BatchItem withNormalizationFailure(ItemError failure) {
        Objects.requireNonNull(failure, "failure");
        if (failure.kind().isScoringFailure()) {
            throw new IllegalArgumentException("Not a normalization failure: " + failure.kind());
        }
        return new BatchItem(index, sourceImage, null, result, failure);
    }

    public BatchItem withResult(ScoreResult score) {
        return new BatchItem(index, sourceImage, normalizedImage, Objects.requireNonNull(score, "score"), null);
    }

    public BatchItem withScoringFailure(ItemError failure) {
        return new BatchItem(index, sourceImage, normalizedImage, null, Objects.requireNonNull(failure, "failure"));
    }
}
