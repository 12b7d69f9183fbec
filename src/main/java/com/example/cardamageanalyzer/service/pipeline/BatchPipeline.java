package com.example.cardamageanalyzer.service.pipeline;

import com.example.cardamageanalyzer.exception.BatchFailure;
import com.example.cardamageanalyzer.exception.BatchProcessingException;
import com.example.cardamageanalyzer.exception.NormalizationException;
import com.example.cardamageanalyzer.exception.ScoringException;
import com.example.cardamageanalyzer.model.BatchItem;
import com.example.cardamageanalyzer.model.ImagePayload;
import com.example.cardamageanalyzer.model.PipelineSnapshot;
import com.example.cardamageanalyzer.model.PipelineStage;
import com.example.cardamageanalyzer.model.ScoreResult;
import com.example.cardamageanalyzer.service.normalization.ImageNormalizer;
import com.example.cardamageanalyzer.service.scoring.ScoringClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Drives one batch of photos through normalization and damage scoring.
 *
 * <p>The pipeline owns a single batch at a time. Items are always processed one by one in index
 * order, so at most one request is in flight against the scoring service and progress only ever
 * grows. Every transition publishes a new immutable {@link PipelineSnapshot}; readers on other
 * threads can poll {@link #snapshot()} at any moment.
 *
 * <p>Only one operation may run at a time. A second call while an operation is in flight fails
 * fast with {@link BatchFailure#BUSY}. Failures of a single image are recorded on its item and
 * never stop the loop; failures of the whole operation are raised as
 * {@link BatchProcessingException}.
 */
@Service
public class BatchPipeline {

    private static final Logger log = LoggerFactory.getLogger(BatchPipeline.class);

    private final ImageNormalizer normalizer;
    private final ScoringClient scoringClient;
    private final ResultAggregator aggregator;
    private final List<PipelineListener> listeners;

    private final AtomicReference<PipelineSnapshot> state = new AtomicReference<>(PipelineSnapshot.empty());
    private final AtomicReference<Operation> current = new AtomicReference<>();

    public BatchPipeline(ImageNormalizer normalizer,
                         ScoringClient scoringClient,
                         ResultAggregator aggregator,
                         List<PipelineListener> listeners) {
        this.normalizer = normalizer;
        this.scoringClient = scoringClient;
        this.aggregator = aggregator;
        this.listeners = new CopyOnWriteArrayList<>(listeners);
    }

    public PipelineSnapshot snapshot() {
        return state.get();
    }

    public void addListener(PipelineListener listener) {
        listeners.add(listener);
    }

    public void removeListener(PipelineListener listener) {
        listeners.remove(listener);
    }

    public boolean isRunning() {
        return current.get() != null;
    }

    /**
     * Replaces the current batch with a new one. The submission is validated as a whole: when any
     * entry is not a raster image nothing is replaced.
     */
    public PipelineSnapshot submitBatch(List<ImagePayload> images) {
        if (images == null || images.isEmpty()) {
            throw new BatchProcessingException(BatchFailure.INVALID_INPUT,
                    "At least one image must be submitted", state.get());
        }
        for (int index = 0; index < images.size(); index++) {
            ImagePayload image = images.get(index);
            if (image == null || !image.isRaster()) {
                String description = image == null
                        ? "missing"
                        : String.format("%s (%s)", image.fileName(), image.mediaType());
                throw new BatchProcessingException(BatchFailure.INVALID_INPUT,
                        String.format("Item %d is not a raster image: %s", index, description), state.get());
            }
        }

        Operation operation = begin("submit a batch");
        try {
            List<BatchItem> items = new ArrayList<>(images.size());
            for (int index = 0; index < images.size(); index++) {
                items.add(BatchItem.pending(index, images.get(index)));
            }
            PipelineSnapshot snapshot = publish(PipelineSnapshot.newBatch(items));
            log.info("Accepted batch {} with {} image(s)", snapshot.batchId(), snapshot.size());
            return snapshot;
        } finally {
            finish(operation);
        }
    }

    /**
     * Normalizes every item in index order. An image that cannot be normalized keeps no
     * normalized copy and records the failure; it is later scored on its original upload.
     * Running this again re-normalizes all items; earlier scores and the overall result stay
     * until the next analysis replaces them.
     */
    public PipelineSnapshot runPreprocessing() {
        Operation operation = begin("preprocess");
        try {
            PipelineSnapshot snapshot = requireItems();
            log.info("Preprocessing batch {} ({} image(s))", snapshot.batchId(), snapshot.size());
            snapshot = publish(snapshot.withStage(PipelineStage.PREPROCESSING, 0));

            int total = snapshot.size();
            for (int index = 0; index < total; index++) {
                checkCancellation(operation, snapshot);
                BatchItem item = snapshot.item(index);
                BatchItem updated;
                try {
                    updated = item.withNormalized(normalizer.normalize(item.sourceImage()));
                } catch (NormalizationException ex) {
                    log.warn("Normalization failed for item {} ({}): {}", index, item.sourceImage().fileName(),
                            ex.getMessage());
                    updated = item.withNormalizationFailure(ex.getError());
                }
                snapshot = publish(snapshot.withItem(updated, progress(index + 1, total)));
            }

            snapshot = publish(snapshot.withStage(PipelineStage.IDLE, snapshot.progress()).markPreprocessed());
            log.info("Preprocessing of batch {} finished, {} image(s) could not be normalized",
                    snapshot.batchId(), snapshot.errorCount());
            return snapshot;
        } finally {
            finish(operation);
        }
    }

    /**
     * Scores every item in index order, preferring the normalized copy when one exists, and
     * aggregates the successful results.
     *
     * @throws BatchProcessingException with {@link BatchFailure#ALL_ITEMS_FAILED} when no item
     *                                  could be scored; the attached snapshot still lists every
     *                                  item error
     */
    public PipelineSnapshot runAnalysis() {
        Operation operation = begin("analyze");
        try {
            PipelineSnapshot snapshot = requireItems();
            log.info("Analyzing batch {} ({} image(s))", snapshot.batchId(), snapshot.size());
            snapshot = publish(snapshot.withoutAnalysis().withStage(PipelineStage.ANALYZING, 0));

            int total = snapshot.size();
            for (int index = 0; index < total; index++) {
                checkCancellation(operation, snapshot);
                BatchItem item = snapshot.item(index);
                BatchItem updated;
                try {
                    updated = item.withResult(scoringClient.score(item.imageForScoring()));
                } catch (ScoringException ex) {
                    log.warn("Scoring failed for item {} ({}): {}", index, item.sourceImage().fileName(),
                            ex.getMessage());
                    updated = item.withScoringFailure(ex.getError());
                }
                snapshot = publish(snapshot.withItem(updated, progress(index + 1, total)));
            }

            Optional<ScoreResult> overall = aggregator.aggregate(snapshot.items());
            snapshot = publish(snapshot.withStage(PipelineStage.IDLE, 100)
                    .withOverallResult(overall.orElse(null))
                    .markAnalyzed());
            if (overall.isEmpty()) {
                log.warn("Analysis of batch {} produced no results, all {} image(s) failed",
                        snapshot.batchId(), total);
                throw new BatchProcessingException(BatchFailure.ALL_ITEMS_FAILED,
                        String.format("None of the %d image(s) could be scored", total), snapshot);
            }
            log.info("Analysis of batch {} finished: damage {}%, confidence {}% over {} of {} image(s)",
                    snapshot.batchId(), overall.get().damagePercentage(), overall.get().confidence(),
                    snapshot.resultCount(), total);
            return snapshot;
        } finally {
            finish(operation);
        }
    }

    /**
     * Asks the running operation to stop before its next item. The item currently being
     * processed is completed first. Has no effect when nothing is running.
     *
     * @return whether an operation was running when the request was made
     */
    public boolean requestCancellation() {
        Operation operation = current.get();
        if (operation == null) {
            log.debug("Cancellation requested while idle, ignoring");
            return false;
        }
        operation.cancel();
        log.info("Cancellation requested for {} of batch {}", operation.name(), state.get().batchId());
        return true;
    }

    /**
     * Discards the current batch.
     */
    public PipelineSnapshot clear() {
        Operation operation = begin("clear the batch");
        try {
            PipelineSnapshot previous = state.get();
            PipelineSnapshot cleared = publish(PipelineSnapshot.empty());
            if (previous.batchId() != null) {
                log.info("Cleared batch {}", previous.batchId());
            }
            return cleared;
        } finally {
            finish(operation);
        }
    }

    static int progress(int completed, int total) {
        return (int) Math.round(100.0 * completed / total);
    }

    private Operation begin(String name) {
        Operation operation = new Operation(name);
        if (!current.compareAndSet(null, operation)) {
            throw new BatchProcessingException(BatchFailure.BUSY,
                    String.format("Cannot %s while another operation is in flight (stage %s)", name,
                            state.get().stage()),
                    state.get());
        }
        return operation;
    }

    // Whatever ended the operation, the pipeline must be idle again afterwards.
    private void finish(Operation operation) {
        PipelineSnapshot latest = state.get();
        if (!latest.isIdle()) {
            publish(latest.withStage(PipelineStage.IDLE, latest.progress()));
        }
        current.compareAndSet(operation, null);
    }

    private PipelineSnapshot requireItems() {
        PipelineSnapshot current = state.get();
        if (current.isEmpty()) {
            throw new BatchProcessingException(BatchFailure.EMPTY_BATCH, "No images to process", current);
        }
        return current;
    }

    private void checkCancellation(Operation operation, PipelineSnapshot snapshot) {
        if (!operation.isCancelled()) {
            return;
        }
        PipelineSnapshot idle = publish(snapshot.withStage(PipelineStage.IDLE, snapshot.progress()));
        log.info("Batch {}: {} cancelled at {}%", idle.batchId(), operation.name(), idle.progress());
        throw new BatchProcessingException(BatchFailure.CANCELLED,
                String.format("Cancelled the request to %s at %d%%", operation.name(), idle.progress()), idle);
    }

    private PipelineSnapshot publish(PipelineSnapshot snapshot) {
        state.set(snapshot);
        for (PipelineListener listener : listeners) {
            try {
                listener.onSnapshot(snapshot);
            } catch (RuntimeException ex) {
                log.warn("Pipeline listener {} failed", listener.getClass().getSimpleName(), ex);
            }
        }
        return snapshot;
    }

    /**
     * One in-flight operation. A cancellation request is recorded on the operation it was aimed
     * at, so it can never leak into the next one.
     */
    private static final class Operation {

        private final String name;
        private final AtomicBoolean cancelled = new AtomicBoolean();

        private Operation(String name) {
            this.name = name;
        }

        String name() {
            return name;
        }

        void cancel() {
            cancelled.set(true);
        }

        boolean isCancelled() {
            return cancelled.get();
        }
    }
}
