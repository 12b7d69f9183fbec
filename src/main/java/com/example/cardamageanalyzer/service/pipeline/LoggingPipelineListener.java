package com.example.cardamageanalyzer.service.pipeline;

import com.example.cardamageanalyzer.model.PipelineSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
public class LoggingPipelineListener implements PipelineListener {

    private static final Logger log = LoggerFactory.getLogger(LoggingPipelineListener.class);

    @Override
    public void onSnapshot(PipelineSnapshot snapshot) {
        if (!log.isDebugEnabled()) {
            return;
        }
        log.debug("Batch {} [{}] {}% - {} scored, {} failed, overall {}",
                snapshot.batchId(),
                snapshot.stage(),
                snapshot.progress(),
                snapshot.resultCount(),
                snapshot.errorCount(),
                snapshot.overall().map(result -> result.damagePercentage() + "%").orElse("n/a"));
    }
}
