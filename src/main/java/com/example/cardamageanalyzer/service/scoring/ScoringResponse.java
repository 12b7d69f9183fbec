package com.example.cardamageanalyzer.service.scoring;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * JSON body returned by the scoring service. Values may be fractional or out of range; they are
 * only trusted after conversion to a {@link com.example.cardamageanalyzer.model.ScoreResult}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ScoringResponse(Double damagePercentage, Double confidence) {

    boolean isComplete() {
        return damagePercentage != null && confidence != null
                && Double.isFinite(damagePercentage) && Double.isFinite(confidence);
    }
}
