package com.example.cardamageanalyzer.model;

import com.example.cardamageanalyzer.exception.BatchFailure;
import com.fasterxml.jackson.annotation.JsonInclude;
import io.swagger.v3.oas.annotations.media.Schema;

import java.time.Instant;

@JsonInclude(JsonInclude.Include.NON_NULL)
@Schema(description = "Error payload returned for rejected or failed requests")
public record ErrorResponse(
        @Schema(description = "Time the error was produced") Instant timestamp,
        @Schema(description = "HTTP status code", example = "409") int status,
        @Schema(description = "HTTP reason phrase", example = "Conflict") String error,
        @Schema(description = "Detail message") String message,
        @Schema(description = "Request path", example = "/api/v1/batches/current/analyze") String path,
        @Schema(description = "Batch-level failure category, when the pipeline rejected the call") BatchFailure failure,
        @Schema(description = "Pipeline state at the time of the failure") BatchStatusResponse batch) {
}
