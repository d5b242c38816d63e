package com.ttennebkram.stickersplit.model;

import java.util.Objects;

/**
 * Immutable thresholds used by the edge detectors and the grid-line locator.
 * Adaptive detection derives a new instance through {@link #toBuilder()}; nothing mutates a shared one.
 */
public final class DetectionParameters {

    public static final int MIN_KERNEL_SIZE = 3;
    public static final int MAX_KERNEL_SIZE = 9;

    // Defaults
    public static final double DEFAULT_CANNY_LOW = 50;
    public static final double DEFAULT_CANNY_HIGH = 150;
    public static final double DEFAULT_SOBEL_THRESHOLD = 50;
    public static final double DEFAULT_LAPLACIAN_THRESHOLD = 20;
    public static final int DEFAULT_MORPH_KERNEL_SIZE = 5;
    public static final double DEFAULT_MIN_AREA_RATIO = 0.6;
    public static final double DEFAULT_BLUR_THRESHOLD = 100;
    public static final double DEFAULT_TEXTURE_THRESHOLD = 50;
    public static final double DEFAULT_CONTRAST_THRESHOLD = 30;

    private final double cannyLow;
    private final double cannyHigh;
    private final double sobelThreshold;
    private final double laplacianThreshold;
    private final int morphKernelSize;
    private final double minAreaRatio;
    private final double blurThreshold;
    private final double textureThreshold;
    private final double contrastThreshold;

    private DetectionParameters(Builder b) {
        this.cannyLow = b.cannyLow;
        this.cannyHigh = b.cannyHigh;
        this.sobelThreshold = b.sobelThreshold;
        this.laplacianThreshold = b.laplacianThreshold;
        this.morphKernelSize = b.morphKernelSize;
        this.minAreaRatio = b.minAreaRatio;
        this.blurThreshold = b.blurThreshold;
        this.textureThreshold = b.textureThreshold;
        this.contrastThreshold = b.contrastThreshold;
    }

    public static DetectionParameters defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
                .cannyLow(cannyLow)
                .cannyHigh(cannyHigh)
                .sobelThreshold(sobelThreshold)
                .laplacianThreshold(laplacianThreshold)
                .morphKernelSize(morphKernelSize)
                .minAreaRatio(minAreaRatio)
                .blurThreshold(blurThreshold)
                .textureThreshold(textureThreshold)
                .contrastThreshold(contrastThreshold);
    }

    public double getCannyLow() {
        return cannyLow;
    }

    public double getCannyHigh() {
        return cannyHigh;
    }

    public double getSobelThreshold() {
        return sobelThreshold;
    }

    public double getLaplacianThreshold() {
        return laplacianThreshold;
    }

    public int getMorphKernelSize() {
        return morphKernelSize;
    }

    public double getMinAreaRatio() {
        return minAreaRatio;
    }

    public double getBlurThreshold() {
        return blurThreshold;
    }

    public double getTextureThreshold() {
        return textureThreshold;
    }

    public double getContrastThreshold() {
        return contrastThreshold;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof DetectionParameters)) return false;
        DetectionParameters that = (DetectionParameters) o;
        return Double.compare(cannyLow, that.cannyLow) == 0
                && Double.compare(cannyHigh, that.cannyHigh) == 0
                && Double.compare(sobelThreshold, that.sobelThreshold) == 0
                && Double.compare(laplacianThreshold, that.laplacianThreshold) == 0
                && morphKernelSize == that.morphKernelSize
                && Double.compare(minAreaRatio, that.minAreaRatio) == 0
                && Double.compare(blurThreshold, that.blurThreshold) == 0
                && Double.compare(textureThreshold, that.textureThreshold) == 0
                && Double.compare(contrastThreshold, that.contrastThreshold) == 0;
    }

    @Override
    public int hashCode() {
        return Objects.hash(cannyLow, cannyHigh, sobelThreshold, laplacianThreshold, morphKernelSize,
                minAreaRatio, blurThreshold, textureThreshold, contrastThreshold);
    }

    @Override
    public String toString() {
        return String.format("DetectionParameters[canny=%.1f/%.1f, sobel=%.1f, laplacian=%.1f, kernel=%d, "
                        + "minAreaRatio=%.3f, pivots=%.1f/%.1f/%.1f]",
                cannyLow, cannyHigh, sobelThreshold, laplacianThreshold, morphKernelSize,
                minAreaRatio, blurThreshold, textureThreshold, contrastThreshold);
    }

    /**
     * Builder that validates every range in {@link #build()}.
     */
    public static final class Builder {
        private double cannyLow = DEFAULT_CANNY_LOW;
        private double cannyHigh = DEFAULT_CANNY_HIGH;
        private double sobelThreshold = DEFAULT_SOBEL_THRESHOLD;
        private double laplacianThreshold = DEFAULT_LAPLACIAN_THRESHOLD;
        private int morphKernelSize = DEFAULT_MORPH_KERNEL_SIZE;
        private double minAreaRatio = DEFAULT_MIN_AREA_RATIO;
        private double blurThreshold = DEFAULT_BLUR_THRESHOLD;
        private double textureThreshold = DEFAULT_TEXTURE_THRESHOLD;
        private double contrastThreshold = DEFAULT_CONTRAST_THRESHOLD;

        private Builder() {
        }

        public Builder cannyLow(double value) {
            this.cannyLow = value;
            return this;
        }

        public Builder cannyHigh(double value) {
            this.cannyHigh = value;
            return this;
        }

        public Builder sobelThreshold(double value) {
            this.sobelThreshold = value;
            return this;
        }

        public Builder laplacianThreshold(double value) {
            this.laplacianThreshold = value;
            return this;
        }

        public Builder morphKernelSize(int value) {
            this.morphKernelSize = value;
            return this;
        }

        public Builder minAreaRatio(double value) {
            this.minAreaRatio = value;
            return this;
        }

        public Builder blurThreshold(double value) {
            this.blurThreshold = value;
            return this;
        }

        public Builder textureThreshold(double value) {
            this.textureThreshold = value;
            return this;
        }

        public Builder contrastThreshold(double value) {
            this.contrastThreshold = value;
            return this;
        }

        public DetectionParameters build() {
            requireNonNegative("cannyLow", cannyLow);
            requireNonNegative("cannyHigh", cannyHigh);
            requireNonNegative("sobelThreshold", sobelThreshold);
            requireNonNegative("laplacianThreshold", laplacianThreshold);
            requireNonNegative("blurThreshold", blurThreshold);
            requireNonNegative("textureThreshold", textureThreshold);
            requireNonNegative("contrastThreshold", contrastThreshold);
            if (cannyLow > cannyHigh) {
                throw new ParameterException("cannyLow (" + cannyLow + ") cannot be higher than cannyHigh (" + cannyHigh + ")");
            }
            if (morphKernelSize < MIN_KERNEL_SIZE || morphKernelSize > MAX_KERNEL_SIZE || morphKernelSize % 2 == 0) {
                throw new ParameterException("morphKernelSize must be odd and within " + MIN_KERNEL_SIZE + ".." + MAX_KERNEL_SIZE
                        + ", got " + morphKernelSize);
            }
            if (Double.isNaN(minAreaRatio) || minAreaRatio < 0 || minAreaRatio > 1) {
                throw new ParameterException("minAreaRatio must be within [0, 1], got " + minAreaRatio);
            }
            return new DetectionParameters(this);
        }

        private static void requireNonNegative(String name, double value) {
            if (Double.isNaN(value) || value < 0) {
                throw new ParameterException(name + " must be non-negative, got " + value);
            }
        }
    }
}
