package com.example.cardamageanalyzer.model;

import io.swagger.v3.oas.annotations.media.Schema;

import java.util.Objects;

@Schema(description = "Failure recorded against a single batch item")
public record ItemError(
        @Schema(description = "Failure category", example = "SERVICE_ERROR") ItemErrorKind kind,
        @Schema(description = "Upstream HTTP status, only set for SERVICE_ERROR", example = "503") Integer status,
        @Schema(description = "Human readable detail", example = "Scoring service answered 503") String message) {

    public ItemError {
        Objects.requireNonNull(kind, "kind");
        if (kind != ItemErrorKind.SERVICE_ERROR) {
            status = null;
        }
    }

    public static ItemError of(ItemErrorKind kind, String message) {
        return new ItemError(kind, null, message);
    }

    public static ItemError serviceError(int status, String message) {
        return new ItemError(ItemErrorKind.SERVICE_ERROR, status, message);
    }
}
