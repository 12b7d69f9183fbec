package com.example.cardamageanalyzer.model;

/**
 * Item-level failure categories. None of them aborts the surrounding batch.
 */
public enum ItemErrorKind {

    // normalization
    UNSUPPORTED_MEDIA_TYPE(false),
    DECODE_FAILURE(false),
    ENCODE_FAILURE(false),

    // scoring
    TRANSPORT_FAILURE(true),
    SERVICE_ERROR(true),
    MALFORMED_RESPONSE(true);

    private final boolean scoringFailure;

    ItemErrorKind(boolean scoringFailure) {
        this.scoringFailure = scoringFailure;
    }

    public boolean isScoringFailure() {
        return scoringFailure;
    }
}
