package com.ttennebkram.stickersplit.edges;

import com.ttennebkram.stickersplit.model.FeatureScores;
import com.ttennebkram.stickersplit.model.SheetImage;
import org.opencv.core.Core;
import org.opencv.core.CvType;
import org.opencv.core.Mat;
import org.opencv.core.MatOfDouble;
import org.opencv.imgproc.Imgproc;

/**
 * Measures blur, texture and contrast of a grayscale image.
 * All three scores are 0 for a flat image.
 */
public class FeatureAnalyzer {

    private final double gradientWeight;
    private final double varianceWeight;

    public FeatureAnalyzer() {
        this(AdaptationConfig.defaults());
    }

    public FeatureAnalyzer(AdaptationConfig config) {
        this.gradientWeight = config.getGradientWeight();
        this.varianceWeight = config.getVarianceWeight();
    }

    public FeatureScores analyze(SheetImage image) {
        Mat gray = image.toGray();
        try {
            return analyze(gray);
        } finally {
            gray.release();
        }
    }

    /**
     * Analyze a single-channel 8-bit image (not modified or released).
     */
    public FeatureScores analyze(Mat gray) {
        return new FeatureScores(blurScore(gray), textureScore(gray), contrastScore(gray));
    }

    /**
     * Variance of the Laplacian response. Sharp images score high.
     */
    double blurScore(Mat gray) {
        Mat lap = new Mat();
        try {
            Imgproc.Laplacian(gray, lap, CvType.CV_64F);
            double std = stdDev(lap);
            return std * std;
        } finally {
            lap.release();
        }
    }

    /**
     * Weighted sum of the mean per-row gradient magnitude and the mean per-row intensity
     * standard deviation. Both terms are row averages, so image size does not matter.
     */
    double textureScore(Mat gray) {
        Mat gray64 = new Mat();
        Mat gradX = new Mat();
        Mat gradY = new Mat();
        Mat magnitude = new Mat();
        Mat rowGradient = new Mat();
        Mat squared = new Mat();
        Mat rowMean = new Mat();
        Mat rowMeanSq = new Mat();
        try {
            gray.convertTo(gray64, CvType.CV_64F);

            // Scale 1/4 so a step of height h yields a magnitude of h
            Imgproc.Sobel(gray64, gradX, CvType.CV_64F, 1, 0, 3, 0.25, 0);
            Imgproc.Sobel(gray64, gradY, CvType.CV_64F, 0, 1, 3, 0.25, 0);
            Core.magnitude(gradX, gradY, magnitude);
            Core.reduce(magnitude, rowGradient, 1, Core.REDUCE_AVG, CvType.CV_64F);
            double meanRowGradient = Core.mean(rowGradient).val[0];

            Core.multiply(gray64, gray64, squared);
            Core.reduce(gray64, rowMean, 1, Core.REDUCE_AVG, CvType.CV_64F);
            Core.reduce(squared, rowMeanSq, 1, Core.REDUCE_AVG, CvType.CV_64F);
            int rows = rowMean.rows();
            double[] means = new double[rows];
            double[] meansSq = new double[rows];
            rowMean.get(0, 0, means);
            rowMeanSq.get(0, 0, meansSq);
            double stdSum = 0;
            for (int y = 0; y < rows; y++) {
                stdSum += Math.sqrt(Math.max(0, meansSq[y] - means[y] * means[y]));
            }
            double meanRowStdDev = rows == 0 ? 0 : stdSum / rows;

            return gradientWeight * meanRowGradient + varianceWeight * meanRowStdDev;
        } finally {
            gray64.release();
            gradX.release();
            gradY.release();
            magnitude.release();
            rowGradient.release();
            squared.release();
            rowMean.release();
            rowMeanSq.release();
        }
    }

    /**
     * Standard deviation of the intensity distribution.
     */
    double contrastScore(Mat gray) {
        return stdDev(gray);
    }

    private static double stdDev(Mat src) {
        MatOfDouble mean = new MatOfDouble();
        MatOfDouble std = new MatOfDouble();
        try {
            Core.meanStdDev(src, mean, std);
            return std.toArray()[0];
        } finally {
            mean.release();
            std.release();
        }
    }
}
