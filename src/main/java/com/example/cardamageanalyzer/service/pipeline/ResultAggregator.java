package com.example.cardamageanalyzer.service.pipeline;

import com.example.cardamageanalyzer.model.BatchItem;
import com.example.cardamageanalyzer.model.ScoreResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;

/**
 * Combines per-image estimates into a single batch estimate. Damage and confidence are averaged
 * independently over the items that were scored successfully; failed items are ignored rather
 * than counted as zero.
 */
@Component
public class ResultAggregator {

    private static final Logger log = LoggerFactory.getLogger(ResultAggregator.class);

    public Optional<ScoreResult> aggregate(List<BatchItem> items) {
        if (items == null || items.isEmpty()) {
            return Optional.empty();
        }

        long damageSum = 0;
        long confidenceSum = 0;
        int count = 0;
        for (BatchItem item : items) {
            if (item == null || item.result() == null) {
                continue;
            }
            damageSum += item.result().damagePercentage();
            confidenceSum += item.result().confidence();
            count++;
        }
        if (count == 0) {
            return Optional.empty();
        }

        ScoreResult aggregated = ScoreResult.fromRaw(damageSum / (double) count, confidenceSum / (double) count);
        log.debug("Aggregated {} of {} items into damage {}% (confidence {}%)", count, items.size(),
                aggregated.damagePercentage(), aggregated.confidence());
        return Optional.of(aggregated);
    }
}
