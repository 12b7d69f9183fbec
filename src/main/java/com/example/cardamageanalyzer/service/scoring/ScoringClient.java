package com.example.cardamageanalyzer.service.scoring;

import com.example.cardamageanalyzer.exception.ScoringException;
import com.example.cardamageanalyzer.model.ImagePayload;
import com.example.cardamageanalyzer.model.ScoreResult;

/**
 * Estimates vehicle damage for a single image. Implementations can call a remote model server
 * or run a local model; the pipeline only relies on this contract and treats every outcome as
 * final, so any retry policy belongs to the implementation.
 */
public interface ScoringClient {

    /**
     * @param image normalized or original photo of the vehicle
     * @return damage estimate with both values already clamped into {@code [0, 100]}
     * @throws ScoringException when the estimate cannot be obtained for this image
     */
    ScoreResult score(ImagePayload image) throws ScoringException;
}
