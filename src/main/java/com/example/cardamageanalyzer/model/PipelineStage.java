package com.example.cardamageanalyzer.model;

/**
 * Operation context of the batch pipeline. {@link #IDLE} is both the initial state and the
 * state between operations.
 */
public enum PipelineStage {
    IDLE,
    PREPROCESSING,
    ANALYZING
}
