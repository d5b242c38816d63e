package com.ttennebkram.stickersplit.processing;

import com.ttennebkram.stickersplit.extract.TrimMode;
import com.ttennebkram.stickersplit.model.DetectionMode;
import com.ttennebkram.stickersplit.model.DetectionParameters;
import com.ttennebkram.stickersplit.model.GridSpec;
import com.ttennebkram.stickersplit.model.OutputFormat;
import com.ttennebkram.stickersplit.model.ParameterException;

/**
 * Everything needed to split one image: grid, detection mode and parameters,
 * rotation, output format and border trimming. Validated on build, before any pixel work.
 */
public final class SplitRequest {

    private final GridSpec gridSpec;
    private final DetectionMode mode;
    private final DetectionParameters parameters;
    private final double rotationAngle;
    private final OutputFormat outputFormat;
    private final TrimMode trimMode;

    private SplitRequest(Builder b) {
        this.gridSpec = b.gridSpec;
        this.mode = b.gridSpec.isManual() ? DetectionMode.MANUAL : b.mode;
        this.parameters = b.parameters;
        this.rotationAngle = b.rotationAngle;
        this.outputFormat = b.outputFormat;
        this.trimMode = b.trimMode;
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
                .gridSpec(gridSpec)
                .mode(mode)
                .parameters(parameters)
                .rotationAngle(rotationAngle)
                .outputFormat(outputFormat)
                .trimMode(trimMode);
    }

    public GridSpec gridSpec() {
        return gridSpec;
    }

    /** MANUAL whenever the grid is manual, otherwise the requested detector. */
    public DetectionMode mode() {
        return mode;
    }

    public DetectionParameters parameters() {
        return parameters;
    }

    public double rotationAngle() {
        return rotationAngle;
    }

    public OutputFormat outputFormat() {
        return outputFormat;
    }

    public TrimMode trimMode() {
        return trimMode;
    }

    @Override
    public String toString() {
        return "SplitRequest[" + gridSpec + ", " + mode.displayName() + ", angle=" + rotationAngle
                + ", " + outputFormat + ", trim=" + trimMode + "]";
    }

    public static final class Builder {
        private GridSpec gridSpec = GridSpec.auto();
        private DetectionMode mode = DetectionMode.ADAPTIVE;
        private DetectionParameters parameters = DetectionParameters.defaults();
        private double rotationAngle = 0;
        private OutputFormat outputFormat = OutputFormat.PNG;
        private TrimMode trimMode = TrimMode.NONE;

        private Builder() {
        }

        public Builder gridSpec(GridSpec value) {
            this.gridSpec = value;
            return this;
        }

        public Builder mode(DetectionMode value) {
            this.mode = value;
            return this;
        }

        public Builder parameters(DetectionParameters value) {
            this.parameters = value;
            return this;
        }

        public Builder rotationAngle(double value) {
            this.rotationAngle = value;
            return this;
        }

        public Builder outputFormat(OutputFormat value) {
            this.outputFormat = value;
            return this;
        }

        public Builder trimMode(TrimMode value) {
            this.trimMode = value;
            return this;
        }

        public SplitRequest build() {
            if (gridSpec == null || mode == null || parameters == null || outputFormat == null || trimMode == null) {
                throw new ParameterException("Split request is incomplete");
            }
            if (mode == DetectionMode.MANUAL && !gridSpec.isManual()) {
                throw new ParameterException("Manual mode needs explicit rows and cols");
            }
            if (Double.isNaN(rotationAngle) || Double.isInfinite(rotationAngle)) {
                throw new ParameterException("Rotation angle must be finite, got " + rotationAngle);
            }
            return new SplitRequest(this);
        }
    }
}
