package com.ttennebkram.stickersplit.extract;

import com.ttennebkram.stickersplit.model.SheetImage;
import org.opencv.core.Core;
import org.opencv.core.Mat;
import org.opencv.core.Point;
import org.opencv.core.Scalar;
import org.opencv.core.Size;
import org.opencv.imgproc.Imgproc;

/**
 * Rotates an image about its centre onto a canvas large enough to hold the whole result.
 * Positive angles turn clockwise. Corners the source does not cover are transparent
 * for images with alpha and black otherwise.
 */
public final class ImageRotator {

    private ImageRotator() {
    }

    /**
     * Normalize an angle in degrees to [0, 360).
     */
    public static double normalize(double degrees) {
        double a = degrees % 360.0;
        return a < 0 ? a + 360.0 : a;
    }

    /**
     * Return a new rotated image. An angle of 0 (mod 360) returns an unrotated copy.
     */
    public static SheetImage rotate(SheetImage image, double degrees) {
        double angle = normalize(degrees);
        if (angle == 0) {
            return image.copy();
        }

        Mat input = image.view();
        Mat output = new Mat();

        // Quarter turns are exact
        if (angle == 90) {
            Core.rotate(input, output, Core.ROTATE_90_CLOCKWISE);
            return SheetImage.adopt(output);
        }
        if (angle == 180) {
            Core.rotate(input, output, Core.ROTATE_180);
            return SheetImage.adopt(output);
        }
        if (angle == 270) {
            Core.rotate(input, output, Core.ROTATE_90_COUNTERCLOCKWISE);
            return SheetImage.adopt(output);
        }

        int width = input.cols();
        int height = input.rows();
        double cx = width / 2.0;
        double cy = height / 2.0;

        // Negate angle so positive = clockwise
        Mat m = Imgproc.getRotationMatrix2D(new Point(cx, cy), -angle, 1.0);
        try {
            double cos = Math.abs(m.get(0, 0)[0]);
            double sin = Math.abs(m.get(0, 1)[0]);
            int newWidth = (int) Math.round(height * sin + width * cos);
            int newHeight = (int) Math.round(height * cos + width * sin);

            // Shift so the rotated content is centred on the expanded canvas
            m.put(0, 2, m.get(0, 2)[0] + newWidth / 2.0 - cx);
            m.put(1, 2, m.get(1, 2)[0] + newHeight / 2.0 - cy);

            Imgproc.warpAffine(input, output, m, new Size(newWidth, newHeight),
                    Imgproc.INTER_LANCZOS4, Core.BORDER_CONSTANT, new Scalar(0, 0, 0, 0));
            return SheetImage.adopt(output);
        } finally {
            m.release();
        }
    }
}
