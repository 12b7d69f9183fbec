package com.example.cardamageanalyzer.exception;

/**
 * Batch-level outcomes that reject or abort a whole pipeline operation.
 */
public enum BatchFailure {
    /** Submission contained no images or a non-raster entry. */
    INVALID_INPUT,
    /** An operation was requested while no batch items exist. */
    EMPTY_BATCH,
    /** Analysis finished without a single successfully scored item. */
    ALL_ITEMS_FAILED,
    /** A caller asked the running operation to stop between items. */
    CANCELLED,
    /** Another operation is still in flight. */
    BUSY
}
