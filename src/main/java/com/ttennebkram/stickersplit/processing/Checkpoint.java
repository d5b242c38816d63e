package com.ttennebkram.stickersplit.processing;

/**
 * Points in the per-image flow where progress is reported and cancellation is checked.
 */
public enum Checkpoint {
    FEATURES_ANALYZED,  // adaptive mode only
    EDGES_DETECTED,
    LINES_LOCATED,
    TILE_EXTRACTED      // once per tile
}
