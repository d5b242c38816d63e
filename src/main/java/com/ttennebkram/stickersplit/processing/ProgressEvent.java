package com.ttennebkram.stickersplit.processing;

/**
 * One progress notification. For TILE_EXTRACTED, {@code tileIndex} is the 0-based row-major
 * index of the tile just produced; for the other checkpoints it is -1.
 */
public class ProgressEvent {
    public final String imageName;
    public final Checkpoint checkpoint;
    public final int tileIndex;
    public final int tileCount;

    public ProgressEvent(String imageName, Checkpoint checkpoint, int tileIndex, int tileCount) {
        this.imageName = imageName;
        this.checkpoint = checkpoint;
        this.tileIndex = tileIndex;
        this.tileCount = tileCount;
    }

    @Override
    public String toString() {
        if (checkpoint == Checkpoint.TILE_EXTRACTED) {
            return imageName + ": " + checkpoint + " " + (tileIndex + 1) + "/" + tileCount;
        }
        return imageName + ": " + checkpoint;
    }
}
