package com.example.cardamageanalyzer.exception;

import com.example.cardamageanalyzer.model.ItemError;
import com.example.cardamageanalyzer.model.ItemErrorKind;

public class NormalizationException extends ItemProcessingException {

    public NormalizationException(ItemErrorKind kind, String message) {
        this(kind, message, null);
    }

    public NormalizationException(ItemErrorKind kind, String message, Throwable cause) {
        super(ItemError.of(kind, message), cause);
    }
}
