package com.ttennebkram.stickersplit.edges;

import com.ttennebkram.stickersplit.model.DetectionMode;
import com.ttennebkram.stickersplit.model.DetectionParameters;
import com.ttennebkram.stickersplit.model.EdgeMap;
import com.ttennebkram.stickersplit.model.FeatureScores;
import com.ttennebkram.stickersplit.model.SheetImage;
import org.opencv.core.Core;
import org.opencv.core.CvType;
import org.opencv.core.Mat;
import org.opencv.core.Scalar;
import org.opencv.core.Size;
import org.opencv.imgproc.Imgproc;

/**
 * Combines three operators on a lightly smoothed copy of the image:
 * Canny, Sobel magnitude and absolute Laplacian. Their masks are OR-ed together
 * and closed with a square kernel so broken separator segments join up.
 */
@EdgeDetectorInfo(
    mode = DetectionMode.MULTI_ALGORITHM,
    displayName = "Multi-algorithm",
    description = "Gaussian 3x3, then Canny | Sobel | Laplacian, then morphological close"
)
public class MultiAlgorithmEdgeDetector implements EdgeDetector {

    @Override
    public EdgeMap detect(SheetImage image, DetectionParameters params, AnalysisListener listener) {
        Mat gray = image.toGray();
        try {
            return detectGray(gray, params, null, DetectionMode.MULTI_ALGORITHM);
        } finally {
            gray.release();
        }
    }

    /**
     * Run the combined detector on a grayscale Mat (not modified or released) and tag the
     * result with the given features and mode.
     */
    EdgeMap detectGray(Mat gray, DetectionParameters params, FeatureScores features, DetectionMode mode) {
        Mat blurred = new Mat();
        Mat canny = new Mat();
        Mat sobel = new Mat();
        Mat laplacian = new Mat();
        Mat absLaplacian = new Mat();
        Mat laplacianMask = new Mat();
        Mat combined = new Mat();
        Mat closed = new Mat();
        Mat kernel = null;
        try {
            Imgproc.GaussianBlur(gray, blurred, new Size(3, 3), 0);

            Imgproc.Canny(blurred, canny, params.getCannyLow(), params.getCannyHigh());

            BasicEdgeDetector.sobelMask(blurred, params.getSobelThreshold(), sobel);

            Imgproc.Laplacian(blurred, laplacian, CvType.CV_64F);
            Core.absdiff(laplacian, new Scalar(0), absLaplacian);
            Core.compare(absLaplacian, new Scalar(params.getLaplacianThreshold()), laplacianMask, Core.CMP_GT);

            Core.bitwise_or(canny, sobel, combined);
            Core.bitwise_or(combined, laplacianMask, combined);

            int k = params.getMorphKernelSize();
            kernel = Imgproc.getStructuringElement(Imgproc.MORPH_RECT, new Size(k, k));
            Imgproc.morphologyEx(combined, closed, Imgproc.MORPH_CLOSE, kernel);

            return EdgeMap.fromMat(closed, params, features, mode);
        } finally {
            blurred.release();
            canny.release();
            sobel.release();
            laplacian.release();
            absLaplacian.release();
            laplacianMask.release();
            combined.release();
            closed.release();
            if (kernel != null) {
                kernel.release();
            }
        }
    }
}
