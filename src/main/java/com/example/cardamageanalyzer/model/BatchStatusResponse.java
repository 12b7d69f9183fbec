package com.example.cardamageanalyzer.model;

import io.swagger.v3.oas.annotations.media.Schema;

import java.util.List;
import java.util.UUID;
import java.util.stream.Collectors;

@Schema(description = "Snapshot of the batch pipeline")
public record BatchStatusResponse(
        @Schema(description = "Identifier of the current batch, absent when no batch is loaded") UUID batchId,
        @Schema(description = "Operation currently running", example = "ANALYZING") PipelineStage stage,
        @Schema(description = "Completion percentage of the current or last operation", example = "66") int progress,
        @Schema(description = "Whether the batch went through normalization") boolean preprocessed,
        @Schema(description = "Whether the batch went through scoring") boolean analyzed,
        @Schema(description = "Average over successfully scored images") ScoreResult overallResult,
        @Schema(description = "Per-image state in submission order") List<BatchItemResponse> items) {

    public static BatchStatusResponse from(PipelineSnapshot snapshot) {
        List<BatchItemResponse> items = snapshot.items().stream()
                .map(BatchItemResponse::from)
                .collect(Collectors.toList());
        return new BatchStatusResponse(
                snapshot.batchId(),
                snapshot.stage(),
                snapshot.progress(),
                snapshot.preprocessed(),
                snapshot.analyzed(),
                snapshot.overallResult(),
                items);
    }
}
