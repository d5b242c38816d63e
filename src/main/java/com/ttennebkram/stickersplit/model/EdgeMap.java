package com.ttennebkram.stickersplit.model;

import org.opencv.core.CvType;
import org.opencv.core.Mat;

/**
 * Binary edge mask with the dimensions of its source image, one byte per pixel
 * (nonzero = edge). Lives on the Java heap so it can be shared freely between threads.
 *
 * Also records the parameters that produced it, so the locator applies the same
 * (possibly adapted) min area ratio the detector worked with.
 */
public final class EdgeMap {

    private final int width;
    private final int height;
    private final byte[] mask;
    private final DetectionParameters parameters;
    private final FeatureScores features;
    private final DetectionMode mode;

    private EdgeMap(int width, int height, byte[] mask, DetectionParameters parameters,
                    FeatureScores features, DetectionMode mode) {
        this.width = width;
        this.height = height;
        this.mask = mask;
        this.parameters = parameters;
        this.features = features;
        this.mode = mode;
    }

    /**
     * Copy a single-channel 8-bit Mat into an edge map.
     */
    public static EdgeMap fromMat(Mat binary, DetectionParameters parameters,
                                  FeatureScores features, DetectionMode mode) {
        if (binary.type() != CvType.CV_8UC1) {
            throw new IllegalArgumentException("Edge mask must be CV_8UC1, got " + CvType.typeToString(binary.type()));
        }
        Mat continuous = binary.isContinuous() ? binary : binary.clone();
        byte[] data = new byte[continuous.rows() * continuous.cols()];
        continuous.get(0, 0, data);
        if (continuous != binary) {
            continuous.release();
        }
        return new EdgeMap(binary.cols(), binary.rows(), data, parameters, features, mode);
    }

    /**
     * Build an edge map from a row-major mask; used for synthetic maps.
     */
    public static EdgeMap fromMask(int width, int height, byte[] mask, DetectionParameters parameters) {
        if (width <= 0 || height <= 0) {
            throw new InputException("Zero-sized edge map: " + width + "x" + height);
        }
        if (mask.length != width * height) {
            throw new InputException("Edge mask has " + mask.length + " bytes, expected " + (width * height));
        }
        return new EdgeMap(width, height, mask.clone(), parameters, null, DetectionMode.BASIC);
    }

    public int width() {
        return width;
    }

    public int height() {
        return height;
    }

    public boolean isEdge(int x, int y) {
        return mask[y * width + x] != 0;
    }

    public DetectionParameters parameters() {
        return parameters;
    }

    /** Feature scores the adaptive detector used, or null for the other modes. */
    public FeatureScores features() {
        return features;
    }

    public DetectionMode mode() {
        return mode;
    }

    public long edgeCount() {
        long count = 0;
        for (byte b : mask) {
            if (b != 0) count++;
        }
        return count;
    }

    /**
     * Fraction of edge pixels in each row, indexed by y.
     */
    public double[] rowDensity() {
        double[] density = new double[height];
        for (int y = 0; y < height; y++) {
            int count = 0;
            int offset = y * width;
            for (int x = 0; x < width; x++) {
                if (mask[offset + x] != 0) count++;
            }
            density[y] = count / (double) width;
        }
        return density;
    }

    /**
     * Fraction of edge pixels in each column, indexed by x.
     */
    public double[] columnDensity() {
        int[] counts = new int[width];
        for (int y = 0; y < height; y++) {
            int offset = y * width;
            for (int x = 0; x < width; x++) {
                if (mask[offset + x] != 0) counts[x]++;
            }
        }
        double[] density = new double[width];
        for (int x = 0; x < width; x++) {
            density[x] = counts[x] / (double) height;
        }
        return density;
    }

    /**
     * New CV_8UC1 Mat with 255 for edges. Caller releases it.
     */
    public Mat toMat() {
        Mat out = new Mat(height, width, CvType.CV_8UC1);
        byte[] data = new byte[mask.length];
        for (int i = 0; i < mask.length; i++) {
            data[i] = mask[i] != 0 ? (byte) 255 : 0;
        }
        out.put(0, 0, data);
        return out;
    }
}
