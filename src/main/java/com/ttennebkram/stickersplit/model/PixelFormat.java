package com.ttennebkram.stickersplit.model;

/**
 * Format descriptor supplied with a raw pixel buffer by the decoding side.
 * Channel order follows OpenCV: GRAY, BGR or BGRA.
 */
public final class PixelFormat {

    public final int width;
    public final int height;
    public final int channels;
    public final int bitDepth;

    public PixelFormat(int width, int height, int channels, int bitDepth) {
        this.width = width;
        this.height = height;
        this.channels = channels;
        this.bitDepth = bitDepth;
    }

    /**
     * Check the descriptor and return the exact byte length a buffer in this format must have.
     */
    public long requiredBytes() {
        if (width <= 0 || height <= 0) {
            throw new InputException("Zero-sized image: " + width + "x" + height);
        }
        if (channels != 1 && channels != 3 && channels != 4) {
            throw new InputException("Unsupported channel count: " + channels + " (expected 1, 3 or 4)");
        }
        if (bitDepth != 8 && bitDepth != 16) {
            throw new InputException("Unsupported bit depth: " + bitDepth + " (expected 8 or 16)");
        }
        return (long) width * height * channels * (bitDepth / 8);
    }

    @Override
    public String toString() {
        return width + "x" + height + "x" + channels + "@" + bitDepth + "bit";
    }
}
