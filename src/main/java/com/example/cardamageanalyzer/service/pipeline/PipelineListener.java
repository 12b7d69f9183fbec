package com.example.cardamageanalyzer.service.pipeline;

import com.example.cardamageanalyzer.model.PipelineSnapshot;

/**
 * Receives a snapshot after every pipeline state change: stage transitions and each completed
 * item. Callbacks run on the thread executing the operation, between items, so they should
 * return quickly.
 */
@FunctionalInterface
public interface PipelineListener {

    void onSnapshot(PipelineSnapshot snapshot);
}
