package com.example.cardamageanalyzer.exception;

import com.example.cardamageanalyzer.model.ItemError;
import com.example.cardamageanalyzer.model.ItemErrorKind;

public class ScoringException extends ItemProcessingException {

    public ScoringException(ItemErrorKind kind, String message, Throwable cause) {
        super(ItemError.of(kind, message), cause);
    }

    private ScoringException(ItemError error, Throwable cause) {
        super(error, cause);
    }

    public static ScoringException serviceError(int status, String message, Throwable cause) {
        return new ScoringException(ItemError.serviceError(status, message), cause);
    }
}
