package com.ttennebkram.stickersplit.extract;

import com.ttennebkram.stickersplit.model.DetectionResult;
import com.ttennebkram.stickersplit.model.SheetImage;
import org.opencv.core.Mat;
import org.opencv.core.Point;
import org.opencv.core.Scalar;
import org.opencv.imgproc.Imgproc;

import java.util.List;

/**
 * Draws located separator lines onto a BGR copy of the image.
 */
public final class PreviewRenderer {

    // BGR
    public static final Scalar ROW_COLOR = new Scalar(0, 0, 255);
    public static final Scalar COL_COLOR = new Scalar(0, 200, 0);

    private PreviewRenderer() {
    }

    public static SheetImage render(SheetImage image, DetectionResult result) {
        Mat output = image.toBgr();
        int width = output.cols();
        int height = output.rows();
        int thickness = Math.max(1, Math.min(width, height) / 200);

        // Inner lines only; the image border is always a boundary
        List<Integer> rows = result.rowLines();
        for (int i = 1; i < rows.size() - 1; i++) {
            int y = rows.get(i);
            Imgproc.line(output, new Point(0, y), new Point(width - 1, y), ROW_COLOR, thickness);
        }
        List<Integer> cols = result.colLines();
        for (int i = 1; i < cols.size() - 1; i++) {
            int x = cols.get(i);
            Imgproc.line(output, new Point(x, 0), new Point(x, height - 1), COL_COLOR, thickness);
        }
        return SheetImage.adopt(output);
    }
}
