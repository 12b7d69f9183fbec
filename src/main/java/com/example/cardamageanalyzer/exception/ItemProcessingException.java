package com.example.cardamageanalyzer.exception;

import com.example.cardamageanalyzer.model.ItemError;
import com.example.cardamageanalyzer.model.ItemErrorKind;

import java.util.Objects;

/**
 * Base type for failures that only affect a single batch item.
 */
public abstract class ItemProcessingException extends Exception {

    private final ItemError error;

    protected ItemProcessingException(ItemError error, Throwable cause) {
        super(Objects.requireNonNull(error, "error").message(), cause);
        this.error = error;
    }

    public ItemError getError() {
        return error;
    }

    public ItemErrorKind getKind() {
        return error.kind();
    }
}
