package com.ttennebkram.stickersplit.edges;

import com.ttennebkram.stickersplit.model.DetectionParameters;
import com.ttennebkram.stickersplit.model.ParameterException;

/**
 * Floors, caps and weights used when adaptive detection tunes its parameters.
 */
public final class AdaptationConfig {

    // Defaults
    public static final double DEFAULT_CANNY_LOW_FLOOR = 20;
    public static final double DEFAULT_CANNY_HIGH_FLOOR = 60;
    public static final int DEFAULT_KERNEL_CAP = 9;
    public static final double DEFAULT_MIN_AREA_RATIO_FLOOR = 0.3;
    public static final double DEFAULT_GRADIENT_WEIGHT = 0.7;
    public static final double DEFAULT_VARIANCE_WEIGHT = 0.3;

    private final double cannyLowFloor;
    private final double cannyHighFloor;
    private final int kernelCap;
    private final double minAreaRatioFloor;
    private final double gradientWeight;
    private final double varianceWeight;

    private AdaptationConfig(Builder b) {
        this.cannyLowFloor = b.cannyLowFloor;
        this.cannyHighFloor = b.cannyHighFloor;
        this.kernelCap = b.kernelCap;
        this.minAreaRatioFloor = b.minAreaRatioFloor;
        this.gradientWeight = b.gradientWeight;
        this.varianceWeight = b.varianceWeight;
    }

    public static AdaptationConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public double getCannyLowFloor() {
        return cannyLowFloor;
    }

    public double getCannyHighFloor() {
        return cannyHighFloor;
    }

    public int getKernelCap() {
        return kernelCap;
    }

    public double getMinAreaRatioFloor() {
        return minAreaRatioFloor;
    }

    public double getGradientWeight() {
        return gradientWeight;
    }

    public double getVarianceWeight() {
        return varianceWeight;
    }

    public static final class Builder {
        private double cannyLowFloor = DEFAULT_CANNY_LOW_FLOOR;
        private double cannyHighFloor = DEFAULT_CANNY_HIGH_FLOOR;
        private int kernelCap = DEFAULT_KERNEL_CAP;
        private double minAreaRatioFloor = DEFAULT_MIN_AREA_RATIO_FLOOR;
        private double gradientWeight = DEFAULT_GRADIENT_WEIGHT;
        private double varianceWeight = DEFAULT_VARIANCE_WEIGHT;

        private Builder() {
        }

        public Builder cannyLowFloor(double value) {
            this.cannyLowFloor = value;
            return this;
        }

        public Builder cannyHighFloor(double value) {
            this.cannyHighFloor = value;
            return this;
        }

        public Builder kernelCap(int value) {
            this.kernelCap = value;
            return this;
        }

        public Builder minAreaRatioFloor(double value) {
            this.minAreaRatioFloor = value;
            return this;
        }

        public Builder gradientWeight(double value) {
            this.gradientWeight = value;
            return this;
        }

        public Builder varianceWeight(double value) {
            this.varianceWeight = value;
            return this;
        }

        public AdaptationConfig build() {
            if (cannyLowFloor < 0 || cannyHighFloor < cannyLowFloor) {
                throw new ParameterException("Canny floors must satisfy 0 <= low <= high, got "
                        + cannyLowFloor + "/" + cannyHighFloor);
            }
            if (kernelCap < DetectionParameters.MIN_KERNEL_SIZE || kernelCap > DetectionParameters.MAX_KERNEL_SIZE
                    || kernelCap % 2 == 0) {
                throw new ParameterException("kernelCap must be odd and within " + DetectionParameters.MIN_KERNEL_SIZE
                        + ".." + DetectionParameters.MAX_KERNEL_SIZE + ", got " + kernelCap);
            }
            if (minAreaRatioFloor < 0 || minAreaRatioFloor > 1) {
                throw new ParameterException("minAreaRatioFloor must be within [0, 1], got " + minAreaRatioFloor);
            }
            if (gradientWeight < 0 || varianceWeight < 0) {
                throw new ParameterException("Texture weights must be non-negative");
            }
            return new AdaptationConfig(this);
        }
    }
}
