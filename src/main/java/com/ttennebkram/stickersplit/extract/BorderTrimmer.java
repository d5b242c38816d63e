package com.ttennebkram.stickersplit.extract;

import com.ttennebkram.stickersplit.model.SheetImage;
import com.ttennebkram.stickersplit.model.Tile;
import org.opencv.core.Core;
import org.opencv.core.CvType;
import org.opencv.core.Mat;
import org.opencv.core.Rect;
import org.opencv.imgproc.Imgproc;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;

/**
 * Removes thin flat borders (separator remnants) from the edges of a tile.
 *
 * Each row and column gets an activity score: its intensity variance, or its mean gradient
 * magnitude in GRADIENT mode. Scanning inwards from each side, the first row/column whose
 * score exceeds a fraction of the median score marks the content edge. The cut is applied
 * only if every side is thinner than the mode's limit; otherwise the tile is left alone.
 */
public class BorderTrimmer {

    private static final Logger LOG = LoggerFactory.getLogger(BorderTrimmer.class);

    /** Rows/columns scoring at or below this fraction of the median count as border. */
    public static final double ACTIVITY_FRACTION = 0.1;

    private final TrimMode mode;

    public BorderTrimmer(TrimMode mode) {
        this.mode = mode;
    }

    public TrimMode mode() {
        return mode;
    }

    /**
     * Return a trimmed copy of {@code tile}, or {@code tile} itself when nothing is cut.
     * The input tile is never modified or closed.
     */
    public Tile trim(Tile tile) {
        if (mode == TrimMode.NONE) {
            return tile;
        }
        Rect content = findContent(tile.image());
        if (content == null) {
            return tile;
        }
        Mat region = tile.image().view().submat(content);
        SheetImage cropped;
        try {
            cropped = SheetImage.adopt(region.clone());
        } finally {
            region.release();
        }
        Rect bounds = tile.bounds();
        Rect trimmed = new Rect(bounds.x + content.x, bounds.y + content.y, content.width, content.height);
        LOG.debug("Trimmed {} to {}x{}", tile, content.width, content.height);
        return new Tile(tile.rowIndex(), tile.colIndex(), trimmed, cropped);
    }

    /**
     * Content rectangle in tile coordinates, or null when no trim applies.
     */
    Rect findContent(SheetImage image) {
        int w = image.width();
        int h = image.height();
        double[] rowScore = new double[h];
        double[] colScore = new double[w];
        Mat gray = image.toGray();
        try {
            if (mode.usesGradientProfile()) {
                gradientProfiles(gray, rowScore, colScore);
            } else {
                varianceProfiles(gray, rowScore, colScore);
            }
        } finally {
            gray.release();
        }

        double rowThreshold = median(rowScore) * ACTIVITY_FRACTION;
        double colThreshold = median(colScore) * ACTIVITY_FRACTION;

        int top = 0;
        for (int i = 0; i < h; i++) {
            if (rowScore[i] > rowThreshold) {
                top = i;
                break;
            }
        }
        int bottom = h - 1;
        for (int i = h - 1; i >= 0; i--) {
            if (rowScore[i] > rowThreshold) {
                bottom = i;
                break;
            }
        }
        int left = 0;
        for (int i = 0; i < w; i++) {
            if (colScore[i] > colThreshold) {
                left = i;
                break;
            }
        }
        int right = w - 1;
        for (int i = w - 1; i >= 0; i--) {
            if (colScore[i] > colThreshold) {
                right = i;
                break;
            }
        }

        int maxThickness = (int) (Math.min(w, h) * mode.edgeThicknessRatio());
        if (top >= maxThickness || left >= maxThickness
                || bottom <= h - maxThickness || right <= w - maxThickness) {
            return null;
        }
        if (top == 0 && left == 0 && bottom == h - 1 && right == w - 1) {
            return null;
        }
        return new Rect(left, top, right - left + 1, bottom - top + 1);
    }

    private static void varianceProfiles(Mat gray, double[] rowScore, double[] colScore) {
        Mat gray64 = new Mat();
        Mat squared = new Mat();
        try {
            gray.convertTo(gray64, CvType.CV_64F);
            Core.multiply(gray64, gray64, squared);
            reduceVariance(gray64, squared, 1, rowScore);
            reduceVariance(gray64, squared, 0, colScore);
        } finally {
            gray64.release();
            squared.release();
        }
    }

    private static void reduceVariance(Mat values, Mat squares, int dim, double[] out) {
        Mat mean = new Mat();
        Mat meanSq = new Mat();
        try {
            Core.reduce(values, mean, dim, Core.REDUCE_AVG, CvType.CV_64F);
            Core.reduce(squares, meanSq, dim, Core.REDUCE_AVG, CvType.CV_64F);
            double[] m = new double[out.length];
            double[] m2 = new double[out.length];
            mean.get(0, 0, m);
            meanSq.get(0, 0, m2);
            for (int i = 0; i < out.length; i++) {
                out[i] = Math.max(0, m2[i] - m[i] * m[i]);
            }
        } finally {
            mean.release();
            meanSq.release();
        }
    }

    private static void gradientProfiles(Mat gray, double[] rowScore, double[] colScore) {
        Mat gradX = new Mat();
        Mat gradY = new Mat();
        Mat magnitude = new Mat();
        Mat rows = new Mat();
        Mat cols = new Mat();
        try {
            Imgproc.Sobel(gray, gradX, CvType.CV_64F, 1, 0, 3);
            Imgproc.Sobel(gray, gradY, CvType.CV_64F, 0, 1, 3);
            Core.magnitude(gradX, gradY, magnitude);
            Core.reduce(magnitude, rows, 1, Core.REDUCE_AVG, CvType.CV_64F);
            Core.reduce(magnitude, cols, 0, Core.REDUCE_AVG, CvType.CV_64F);
            rows.get(0, 0, rowScore);
            cols.get(0, 0, colScore);
        } finally {
            gradX.release();
            gradY.release();
            magnitude.release();
            rows.release();
            cols.release();
        }
    }

    static double median(double[] values) {
        double[] sorted = values.clone();
        Arrays.sort(sorted);
        int n = sorted.length;
        if (n == 0) {
            return 0;
        }
        return n % 2 == 1 ? sorted[n / 2] : (sorted[n / 2 - 1] + sorted[n / 2]) / 2.0;
    }
}
