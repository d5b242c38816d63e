package com.ttennebkram.stickersplit.edges;

import com.ttennebkram.stickersplit.model.DetectionMode;
import com.ttennebkram.stickersplit.model.DetectionParameters;
import com.ttennebkram.stickersplit.model.EdgeMap;
import com.ttennebkram.stickersplit.model.SheetImage;
import org.opencv.core.Core;
import org.opencv.core.CvType;
import org.opencv.core.Mat;
import org.opencv.core.Scalar;
import org.opencv.imgproc.Imgproc;

/**
 * Single-operator detector: a pixel is an edge when its Sobel gradient magnitude
 * exceeds sobelThreshold. Fast, but noise passes straight through.
 */
@EdgeDetectorInfo(
    mode = DetectionMode.BASIC,
    displayName = "Basic",
    description = "Sobel gradient magnitude above sobelThreshold"
)
public class BasicEdgeDetector implements EdgeDetector {

    @Override
    public EdgeMap detect(SheetImage image, DetectionParameters params, AnalysisListener listener) {
        Mat gray = image.toGray();
        Mat mask = new Mat();
        try {
            sobelMask(gray, params.getSobelThreshold(), mask);
            return EdgeMap.fromMat(mask, params, null, DetectionMode.BASIC);
        } finally {
            gray.release();
            mask.release();
        }
    }

    /**
     * Write a 0/255 mask of pixels whose gradient magnitude is above {@code threshold} into {@code dst}.
     */
    static void sobelMask(Mat gray, double threshold, Mat dst) {
        Mat gradX = new Mat();
        Mat gradY = new Mat();
        Mat magnitude = new Mat();
        try {
            Imgproc.Sobel(gray, gradX, CvType.CV_64F, 1, 0, 3);
            Imgproc.Sobel(gray, gradY, CvType.CV_64F, 0, 1, 3);
            Core.magnitude(gradX, gradY, magnitude);
            Core.compare(magnitude, new Scalar(threshold), dst, Core.CMP_GT);
        } finally {
            gradX.release();
            gradY.release();
            magnitude.release();
        }
    }
}
