package com.example.cardamageanalyzer.service.pipeline;

import com.example.cardamageanalyzer.TestImages;
import com.example.cardamageanalyzer.exception.BatchFailure;
import com.example.cardamageanalyzer.exception.BatchProcessingException;
import com.example.cardamageanalyzer.exception.NormalizationException;
import com.example.cardamageanalyzer.exception.ScoringException;
import com.example.cardamageanalyzer.model.BatchItem;
import com.example.cardamageanalyzer.model.ImagePayload;
import com.example.cardamageanalyzer.model.ItemErrorKind;
import com.example.cardamageanalyzer.model.PipelineSnapshot;
import com.example.cardamageanalyzer.model.PipelineStage;
import com.example.cardamageanalyzer.model.ScoreResult;
import com.example.cardamageanalyzer.service.normalization.ImageNormalizer;
import com.example.cardamageanalyzer.service.scoring.ScoringClient;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class BatchPipelineTest {

    @Mock
    private ImageNormalizer normalizer;

    @Mock
    private ScoringClient scoringClient;

    private final List<PipelineSnapshot> published = new ArrayList<>();

    private BatchPipeline pipeline;

    private final ImagePayload front = TestImages.opaque("front.jpg");
    private final ImagePayload side = TestImages.opaque("side.jpg");
    private final ImagePayload rear = TestImages.opaque("rear.jpg");

    @BeforeEach
    void setUp() {
        pipeline = new BatchPipeline(normalizer, scoringClient, new ResultAggregator(), List.of(published::add));
    }

    @Test
    void submitBatchCreatesOnePendingItemPerImageInOrder() {
        PipelineSnapshot snapshot = pipeline.submitBatch(List.of(front, side, rear));

        assertThat(snapshot.batchId()).isNotNull();
        assertThat(snapshot.stage()).isEqualTo(PipelineStage.IDLE);
        assertThat(snapshot.progress()).isZero();
        assertThat(snapshot.overall()).isEmpty();
        assertThat(snapshot.items()).extracting(BatchItem::index).containsExactly(0, 1, 2);
        assertThat(snapshot.items()).extracting(BatchItem::sourceImage).containsExactly(front, side, rear);
        assertThat(snapshot.items()).allSatisfy(item -> {
            assertThat(item.normalized()).isEmpty();
            assertThat(item.scoreResult()).isEmpty();
            assertThat(item.itemError()).isEmpty();
        });
    }

    @Test
    void submitBatchRejectsEmptySubmissions() {
        BatchProcessingException exception = assertThrows(BatchProcessingException.class,
                () -> pipeline.submitBatch(List.of()));

        assertThat(exception.getFailure()).isEqualTo(BatchFailure.INVALID_INPUT);
        assertThat(pipeline.snapshot().isEmpty()).isTrue();
    }

    @Test
    void submitBatchRejectsTheWholeSubmissionWhenOneEntryIsNotAnImage() {
        PipelineSnapshot first = pipeline.submitBatch(List.of(front));
        ImagePayload document = ImagePayload.of("claim.pdf", "application/pdf", new byte[]{1});

        BatchProcessingException exception = assertThrows(BatchProcessingException.class,
                () -> pipeline.submitBatch(List.of(side, document)));

        assertThat(exception.getFailure()).isEqualTo(BatchFailure.INVALID_INPUT);
        assertThat(exception.getMessage()).contains("claim.pdf");
        assertThat(pipeline.snapshot()).isEqualTo(first);
    }

    @Test
    void operationsOnAnEmptyPipelineFailWithEmptyBatch() {
        BatchProcessingException preprocessing = assertThrows(BatchProcessingException.class,
                () -> pipeline.runPreprocessing());
        BatchProcessingException analysis = assertThrows(BatchProcessingException.class,
                () -> pipeline.runAnalysis());

        assertThat(preprocessing.getFailure()).isEqualTo(BatchFailure.EMPTY_BATCH);
        assertThat(analysis.getFailure()).isEqualTo(BatchFailure.EMPTY_BATCH);
        assertThat(pipeline.isRunning()).isFalse();
        verifyNoInteractions(normalizer, scoringClient);
    }

    @Test
    void failedNormalizationFallsBackToTheOriginalImageForScoring() throws Exception {
        ImagePayload frontNormalized = TestImages.opaque("front-normalized.jpg");
        ImagePayload rearNormalized = TestImages.opaque("rear-normalized.jpg");
        when(normalizer.normalize(front)).thenReturn(frontNormalized);
        when(normalizer.normalize(side)).thenThrow(
                new NormalizationException(ItemErrorKind.DECODE_FAILURE, "cannot decode side.jpg"));
        when(normalizer.normalize(rear)).thenReturn(rearNormalized);
        when(scoringClient.score(frontNormalized)).thenReturn(new ScoreResult(10, 90));
        when(scoringClient.score(side)).thenThrow(
                new ScoringException(ItemErrorKind.TRANSPORT_FAILURE, "timeout", null));
        when(scoringClient.score(rearNormalized)).thenReturn(new ScoreResult(30, 50));
        pipeline.submitBatch(List.of(front, side, rear));

        PipelineSnapshot preprocessed = pipeline.runPreprocessing();

        assertThat(preprocessed.preprocessed()).isTrue();
        assertThat(preprocessed.item(0).normalized()).contains(frontNormalized);
        assertThat(preprocessed.item(1).normalized()).isEmpty();
        assertThat(preprocessed.item(1).error().kind()).isEqualTo(ItemErrorKind.DECODE_FAILURE);
        assertThat(preprocessed.progress()).isEqualTo(100);

        PipelineSnapshot analyzed = pipeline.runAnalysis();

        verify(scoringClient, times(3)).score(any());
        verify(scoringClient).score(side);
        assertThat(analyzed.progress()).isEqualTo(100);
        assertThat(analyzed.resultCount()).isEqualTo(2);
        assertThat(analyzed.errorCount()).isEqualTo(1);
        assertThat(analyzed.item(1).error().kind()).isEqualTo(ItemErrorKind.TRANSPORT_FAILURE);
        assertThat(analyzed.overall()).contains(new ScoreResult(20, 70));
    }

    @Test
    void successfulScoringClearsAnEarlierNormalizationError() throws Exception {
        when(normalizer.normalize(front)).thenThrow(
                new NormalizationException(ItemErrorKind.DECODE_FAILURE, "cannot decode front.jpg"));
        when(scoringClient.score(front)).thenReturn(new ScoreResult(55, 65));
        pipeline.submitBatch(List.of(front));
        pipeline.runPreprocessing();

        PipelineSnapshot analyzed = pipeline.runAnalysis();

        assertThat(analyzed.item(0).scoreResult()).contains(new ScoreResult(55, 65));
        assertThat(analyzed.item(0).itemError()).isEmpty();
        assertThat(analyzed.item(0).normalized()).isEmpty();
    }

    @Test
    void analysisWithoutPreprocessingScoresTheOriginals() throws Exception {
        when(scoringClient.score(any())).thenReturn(new ScoreResult(40, 80));
        pipeline.submitBatch(List.of(front, side));

        PipelineSnapshot analyzed = pipeline.runAnalysis();

        verify(scoringClient).score(front);
        verify(scoringClient).score(side);
        verifyNoInteractions(normalizer);
        assertThat(analyzed.analyzed()).isTrue();
        assertThat(analyzed.preprocessed()).isFalse();
        assertThat(analyzed.overall()).contains(new ScoreResult(40, 80));
    }

    @Test
    void progressNeverDecreasesAndFinishesAtHundred() throws Exception {
        when(scoringClient.score(any())).thenReturn(new ScoreResult(50, 50));
        pipeline.submitBatch(List.of(front, side, rear));
        published.clear();

        pipeline.runAnalysis();

        List<Integer> progress = published.stream().map(PipelineSnapshot::progress).collect(Collectors.toList());
        assertThat(progress).isSorted();
        assertThat(progress).contains(33, 67);
        assertThat(progress.get(progress.size() - 1)).isEqualTo(100);
        assertThat(published.get(0).stage()).isEqualTo(PipelineStage.ANALYZING);
        assertThat(published.get(published.size() - 1).stage()).isEqualTo(PipelineStage.IDLE);
    }

    @Test
    void itemsCompleteStrictlyInIndexOrder() throws Exception {
        when(scoringClient.score(any())).thenReturn(new ScoreResult(50, 50));
        pipeline.submitBatch(List.of(front, side, rear));
        published.clear();

        pipeline.runAnalysis();

        List<Long> scoredCounts = published.stream()
                .filter(snapshot -> snapshot.stage() == PipelineStage.ANALYZING)
                .map(PipelineSnapshot::resultCount)
                .collect(Collectors.toList());
        assertThat(scoredCounts).containsExactly(0L, 1L, 2L, 3L);
        for (PipelineSnapshot snapshot : published) {
            List<BatchItem> items = snapshot.items();
            for (int index = 1; index < items.size(); index++) {
                if (items.get(index).hasResult()) {
                    assertThat(items.get(index - 1).hasResult()).isTrue();
                }
            }
        }
    }

    @Test
    void allScoringFailuresEndInAllItemsFailedWithoutAnAggregate() throws Exception {
        when(scoringClient.score(any())).thenThrow(
                ScoringException.serviceError(503, "Scoring service answered 503", null));
        pipeline.submitBatch(List.of(front, side, rear));

        BatchProcessingException exception = assertThrows(BatchProcessingException.class,
                () -> pipeline.runAnalysis());

        assertThat(exception.getFailure()).isEqualTo(BatchFailure.ALL_ITEMS_FAILED);
        PipelineSnapshot snapshot = exception.getSnapshot();
        assertThat(snapshot.overall()).isEmpty();
        assertThat(snapshot.stage()).isEqualTo(PipelineStage.IDLE);
        assertThat(snapshot.progress()).isEqualTo(100);
        assertThat(snapshot.errorCount()).isEqualTo(3);
        assertThat(snapshot.item(0).error().status()).isEqualTo(503);
        assertThat(pipeline.snapshot().overall()).isEmpty();
        assertThat(pipeline.isRunning()).isFalse();
    }

    @Test
    void resubmittingDiscardsThePreviousBatchEntirely() throws Exception {
        when(scoringClient.score(any())).thenReturn(new ScoreResult(70, 90));
        PipelineSnapshot first = pipeline.submitBatch(List.of(front, side));
        pipeline.runAnalysis();

        PipelineSnapshot second = pipeline.submitBatch(List.of(rear));

        assertThat(second.batchId()).isNotEqualTo(first.batchId());
        assertThat(second.items()).hasSize(1);
        assertThat(second.item(0).sourceImage()).isEqualTo(rear);
        assertThat(second.item(0).scoreResult()).isEmpty();
        assertThat(second.overall()).isEmpty();
        assertThat(second.analyzed()).isFalse();
        assertThat(second.progress()).isZero();
    }

    @Test
    void cancellationStopsBeforeTheNextItemAndKeepsCompletedOnes() throws Exception {
        when(scoringClient.score(front)).thenAnswer(invocation -> {
            pipeline.requestCancellation();
            return new ScoreResult(25, 75);
        });
        pipeline.submitBatch(List.of(front, side, rear));

        BatchProcessingException exception = assertThrows(BatchProcessingException.class,
                () -> pipeline.runAnalysis());

        assertThat(exception.getFailure()).isEqualTo(BatchFailure.CANCELLED);
        verify(scoringClient, times(1)).score(any());
        PipelineSnapshot snapshot = pipeline.snapshot();
        assertThat(snapshot.stage()).isEqualTo(PipelineStage.IDLE);
        assertThat(snapshot.progress()).isEqualTo(33);
        assertThat(snapshot.item(0).scoreResult()).contains(new ScoreResult(25, 75));
        assertThat(snapshot.item(1).scoreResult()).isEmpty();
        assertThat(snapshot.item(2).scoreResult()).isEmpty();
        assertThat(snapshot.overall()).isEmpty();
        assertThat(snapshot.analyzed()).isFalse();
        assertThat(pipeline.isRunning()).isFalse();
    }

    @Test
    void cancellationWhileIdleIsIgnored() throws Exception {
        when(scoringClient.score(any())).thenReturn(new ScoreResult(10, 10));
        pipeline.submitBatch(List.of(front));

        assertThat(pipeline.requestCancellation()).isFalse();

        assertThat(pipeline.runAnalysis().overall()).contains(new ScoreResult(10, 10));
    }

    @Test
    void reentrantCallsAreRejectedWhileAnOperationIsInFlight() throws Exception {
        AtomicReference<BatchProcessingException> nestedAnalysis = new AtomicReference<>();
        AtomicReference<BatchProcessingException> nestedSubmit = new AtomicReference<>();
        when(scoringClient.score(front)).thenAnswer(invocation -> {
            nestedAnalysis.set(assertThrows(BatchProcessingException.class, () -> pipeline.runAnalysis()));
            nestedSubmit.set(assertThrows(BatchProcessingException.class, () -> pipeline.submitBatch(List.of(rear))));
            assertThat(pipeline.snapshot().stage()).isEqualTo(PipelineStage.ANALYZING);
            return new ScoreResult(60, 60);
        });
        pipeline.submitBatch(List.of(front));

        PipelineSnapshot analyzed = pipeline.runAnalysis();

        assertThat(nestedAnalysis.get().getFailure()).isEqualTo(BatchFailure.BUSY);
        assertThat(nestedSubmit.get().getFailure()).isEqualTo(BatchFailure.BUSY);
        assertThat(analyzed.item(0).sourceImage()).isEqualTo(front);
        assertThat(analyzed.overall()).contains(new ScoreResult(60, 60));
    }

    @Test
    void rerunningPreprocessingOverwritesNormalizationOutcomesAndKeepsScores() throws Exception {
        ImagePayload frontNormalized = TestImages.opaque("front-normalized.jpg");
        when(normalizer.normalize(front))
                .thenThrow(new NormalizationException(ItemErrorKind.ENCODE_FAILURE, "encoder unavailable"))
                .thenReturn(frontNormalized);
        when(scoringClient.score(front)).thenReturn(new ScoreResult(40, 80));
        pipeline.submitBatch(List.of(front));
        pipeline.runPreprocessing();
        pipeline.runAnalysis();

        PipelineSnapshot rerun = pipeline.runPreprocessing();

        assertThat(rerun.item(0).normalized()).contains(frontNormalized);
        assertThat(rerun.item(0).itemError()).isEmpty();
        assertThat(rerun.item(0).scoreResult()).contains(new ScoreResult(40, 80));
        assertThat(rerun.overall()).contains(new ScoreResult(40, 80));
        assertThat(rerun.preprocessed()).isTrue();
        assertThat(rerun.analyzed()).isTrue();
    }

    @Test
    void normalizationFailureOnRerunKeepsTheEarlierScoreNextToTheError() throws Exception {
        ImagePayload frontNormalized = TestImages.opaque("front-normalized.jpg");
        when(normalizer.normalize(front))
                .thenReturn(frontNormalized)
                .thenThrow(new NormalizationException(ItemErrorKind.DECODE_FAILURE, "cannot decode front.jpg"));
        when(scoringClient.score(frontNormalized)).thenReturn(new ScoreResult(15, 65));
        pipeline.submitBatch(List.of(front));
        pipeline.runPreprocessing();
        pipeline.runAnalysis();

        PipelineSnapshot rerun = pipeline.runPreprocessing();

        assertThat(rerun.item(0).normalized()).isEmpty();
        assertThat(rerun.item(0).itemError()).map(error -> error.kind()).contains(ItemErrorKind.DECODE_FAILURE);
        assertThat(rerun.item(0).scoreResult()).contains(new ScoreResult(15, 65));
        assertThat(rerun.overall()).contains(new ScoreResult(15, 65));
    }

    @Test
    void cancellingPreprocessingStopsBeforeTheNextItemAndKeepsNormalizedOnes() throws Exception {
        ImagePayload frontNormalized = TestImages.opaque("front-normalized.jpg");
        when(normalizer.normalize(front)).thenAnswer(invocation -> {
            pipeline.requestCancellation();
            return frontNormalized;
        });
        pipeline.submitBatch(List.of(front, side, rear));

        BatchProcessingException exception = assertThrows(BatchProcessingException.class,
                () -> pipeline.runPreprocessing());

        assertThat(exception.getFailure()).isEqualTo(BatchFailure.CANCELLED);
        verify(normalizer, times(1)).normalize(any());
        PipelineSnapshot snapshot = pipeline.snapshot();
        assertThat(exception.getSnapshot()).isEqualTo(snapshot);
        assertThat(snapshot.stage()).isEqualTo(PipelineStage.IDLE);
        assertThat(snapshot.progress()).isEqualTo(33);
        assertThat(snapshot.item(0).normalized()).contains(frontNormalized);
        assertThat(snapshot.item(1).normalized()).isEmpty();
        assertThat(snapshot.item(2).normalized()).isEmpty();
        assertThat(snapshot.preprocessed()).isFalse();
        assertThat(snapshot.analyzed()).isFalse();
        assertThat(pipeline.isRunning()).isFalse();
    }

    @Test
    void cancelledPreprocessingRerunLeavesEarlierAnalysisConsistent() throws Exception {
        ImagePayload frontNormalized = TestImages.opaque("front-normalized.jpg");
        ImagePayload sideNormalized = TestImages.opaque("side-normalized.jpg");
        when(normalizer.normalize(front)).thenReturn(frontNormalized);
        when(normalizer.normalize(side))
                .thenReturn(sideNormalized)
                .thenThrow(new AssertionError("side must not be normalized after cancellation"));
        when(scoringClient.score(any())).thenReturn(new ScoreResult(20, 60), new ScoreResult(40, 80));
        pipeline.submitBatch(List.of(front, side));
        pipeline.runPreprocessing();
        pipeline.runAnalysis();
        pipeline.addListener(snapshot -> {
            if (snapshot.stage() == PipelineStage.PREPROCESSING && snapshot.progress() == 50) {
                pipeline.requestCancellation();
            }
        });

        assertThrows(BatchProcessingException.class, () -> pipeline.runPreprocessing());

        PipelineSnapshot snapshot = pipeline.snapshot();
        assertThat(snapshot.stage()).isEqualTo(PipelineStage.IDLE);
        assertThat(snapshot.item(0).scoreResult()).contains(new ScoreResult(20, 60));
        assertThat(snapshot.item(1).scoreResult()).contains(new ScoreResult(40, 80));
        assertThat(snapshot.overall()).contains(new ScoreResult(30, 70));
        assertThat(snapshot.analyzed()).isTrue();
        assertThat(snapshot.preprocessed()).isTrue();
    }

    @Test
    void cancellationOnlyAppliesToTheOperationItWasAimedAt() throws Exception {
        when(scoringClient.score(front)).thenAnswer(invocation -> {
            assertThat(pipeline.requestCancellation()).isTrue();
            return new ScoreResult(50, 50);
        });
        when(normalizer.normalize(any())).thenReturn(TestImages.opaque("front-normalized.jpg"));
        pipeline.submitBatch(List.of(front));

        assertThat(pipeline.runAnalysis().overall()).contains(new ScoreResult(50, 50));
        PipelineSnapshot preprocessed = pipeline.runPreprocessing();

        assertThat(preprocessed.preprocessed()).isTrue();
        assertThat(preprocessed.progress()).isEqualTo(100);
    }

    @Test
    void clearIsRejectedWhileAnOperationIsInFlight() throws Exception {
        AtomicReference<BatchProcessingException> nestedClear = new AtomicReference<>();
        when(normalizer.normalize(front)).thenAnswer(invocation -> {
            nestedClear.set(assertThrows(BatchProcessingException.class, () -> pipeline.clear()));
            return TestImages.opaque("front-normalized.jpg");
        });
        pipeline.submitBatch(List.of(front));

        PipelineSnapshot preprocessed = pipeline.runPreprocessing();

        assertThat(nestedClear.get().getFailure()).isEqualTo(BatchFailure.BUSY);
        assertThat(preprocessed.items()).hasSize(1);
        assertThat(preprocessed.item(0).normalized()).isPresent();
    }

    @Test
    void unexpectedFailuresStillReturnThePipelineToIdle() throws Exception {
        when(scoringClient.score(front)).thenThrow(new IllegalStateException("boom"));
        pipeline.submitBatch(List.of(front));

        assertThrows(IllegalStateException.class, () -> pipeline.runAnalysis());

        assertThat(pipeline.snapshot().stage()).isEqualTo(PipelineStage.IDLE);
        assertThat(pipeline.isRunning()).isFalse();
    }

    @Test
    void clearDiscardsTheBatch() {
        pipeline.submitBatch(List.of(front, side));

        PipelineSnapshot cleared = pipeline.clear();

        assertThat(cleared.isEmpty()).isTrue();
        assertThat(cleared.batchId()).isNull();
        assertThat(pipeline.snapshot()).isEqualTo(cleared);
    }

    @Test
    void failingListenersDoNotBreakProcessing() throws Exception {
        pipeline.addListener(snapshot -> {
            throw new IllegalStateException("listener failure");
        });
        when(scoringClient.score(any())).thenReturn(new ScoreResult(5, 95));
        pipeline.submitBatch(List.of(front));

        assertThat(pipeline.runAnalysis().overall()).contains(new ScoreResult(5, 95));
    }

    @Test
    void removedListenersStopReceivingSnapshots() {
        List<PipelineSnapshot> seen = new ArrayList<>();
        PipelineListener listener = seen::add;
        pipeline.addListener(listener);
        pipeline.submitBatch(List.of(front));
        pipeline.removeListener(listener);

        pipeline.clear();

        assertThat(seen).hasSize(1);
        assertThat(seen.get(0).size()).isEqualTo(1);
    }

    @Test
    void progressIsRoundedToTheNearestPercent() {
        assertThat(BatchPipeline.progress(1, 3)).isEqualTo(33);
        assertThat(BatchPipeline.progress(2, 3)).isEqualTo(67);
        assertThat(BatchPipeline.progress(1, 8)).isEqualTo(13);
        assertThat(BatchPipeline.progress(5, 5)).isEqualTo(100);
    }
}
