package com.example.cardamageanalyzer.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/**
 * Read-only view of the pipeline at one point in time. A new snapshot is published after every
 * state change, so readers never observe a half-applied transition.
 *
 * @param batchId       identifier of the batch, {@code null} when no batch has been submitted
 * @param stage         operation currently running
 * @param progress      percentage of items handled by the current or last operation
 * @param items         batch items in index order
 * @param overallResult aggregate over successfully scored items, {@code null} until available
 * @param preprocessed  whether a normalization pass has completed for this batch
 * @param analyzed      whether a scoring pass has completed for this batch
 */
public record PipelineSnapshot(UUID batchId, PipelineStage stage, int progress, List<BatchItem> items,
                               ScoreResult overallResult, boolean preprocessed, boolean analyzed) {

    private static final PipelineSnapshot EMPTY =
            new PipelineSnapshot(null, PipelineStage.IDLE, 0, List.of(), null, false, false);

    public PipelineSnapshot {
        Objects.requireNonNull(stage, "stage");
        if (progress < 0 || progress > 100) {
            throw new IllegalArgumentException("Progress must be within [0, 100]: " + progress);
        }
        items = List.copyOf(items);
    }

    public static PipelineSnapshot empty() {
        return EMPTY;
    }

    public static PipelineSnapshot newBatch(List<BatchItem> items) {
        return new PipelineSnapshot(UUID.randomUUID(), PipelineStage.IDLE, 0, items, null, false, false);
    }

    public Optional<ScoreResult> overall() {
        return Optional.ofNullable(overallResult);
    }

    public boolean isEmpty() {
        return items.isEmpty();
    }

    public boolean isIdle() {
        return stage == PipelineStage.IDLE;
    }

    public int size() {
        return items.size();
    }

    public BatchItem item(int index) {
        return items.get(index);
    }

    public PipelineSnapshot withStage(PipelineStage newStage, int newProgress) {
        return new PipelineSnapshot(batchId, newStage, newProgress, items, overallResult, preprocessed, analyzed);
    }

    public PipelineSnapshot withItem(BatchItem item, int newProgress) {
        List<BatchItem> updated = new ArrayList<>(items);
        updated.set(item.index(), item);
        return new PipelineSnapshot(batchId, stage, newProgress, updated, overallResult, preprocessed, analyzed);
    }

    public PipelineSnapshot withOverallResult(ScoreResult result) {
        return new PipelineSnapshot(batchId, stage, progress, items, result, preprocessed, analyzed);
    }

    public PipelineSnapshot markPreprocessed() {
        return new PipelineSnapshot(batchId, stage, progress, items, overallResult, true, analyzed);
    }

    /**
     * Drops the aggregate of the last scoring pass; used when a new pass starts.
     */
    public PipelineSnapshot withoutAnalysis() {
        return new PipelineSnapshot(batchId, stage, progress, items, null, preprocessed, false);
    }

    public PipelineSnapshot markAnalyzed() {
        return new PipelineSnapshot(batchId, stage, progress, items, overallResult, preprocessed, true);
    }

    public long resultCount() {
        return items.stream().filter(BatchItem::hasResult).count();
    }

    public long errorCount() {
        return items.stream().filter(item -> item.error() != null).count();
    }
}
