package com.ttennebkram.stickersplit.grid;

import com.ttennebkram.stickersplit.model.ParameterException;

/**
 * Tuning for automatic line search.
 */
public final class LocatorConfig {

    public static final int DEFAULT_SMOOTHING_WINDOW = 5;
    public static final double DEFAULT_PROMINENCE_FACTOR = 0.5;
    public static final int DEFAULT_GAP_DIVISOR = 18;

    private final int smoothingWindow;
    private final double prominenceFactor;
    private final int gapDivisor;

    /**
     * @param smoothingWindow  moving-average window over the density profile, odd and at least 1
     * @param prominenceFactor multiplied by minAreaRatio to give the minimum peak prominence
     * @param gapDivisor       minimum spacing between lines is dimension / gapDivisor
     */
    public LocatorConfig(int smoothingWindow, double prominenceFactor, int gapDivisor) {
        if (smoothingWindow < 1 || smoothingWindow % 2 == 0) {
            throw new ParameterException("smoothingWindow must be odd and positive, got " + smoothingWindow);
        }
        if (Double.isNaN(prominenceFactor) || prominenceFactor < 0) {
            throw new ParameterException("prominenceFactor must be non-negative, got " + prominenceFactor);
        }
        if (gapDivisor < 1) {
            throw new ParameterException("gapDivisor must be positive, got " + gapDivisor);
        }
        this.smoothingWindow = smoothingWindow;
        this.prominenceFactor = prominenceFactor;
        this.gapDivisor = gapDivisor;
    }

    public static LocatorConfig defaults() {
        return new LocatorConfig(DEFAULT_SMOOTHING_WINDOW, DEFAULT_PROMINENCE_FACTOR, DEFAULT_GAP_DIVISOR);
    }

    public int getSmoothingWindow() {
        return smoothingWindow;
    }

    public double getProminenceFactor() {
        return prominenceFactor;
    }

    public int getGapDivisor() {
        return gapDivisor;
    }

    /** Minimum distance between two lines, and between a line and the image border. */
    public int minGap(int dimension) {
        return Math.max(1, dimension / gapDivisor);
    }
}
