package com.ttennebkram.stickersplit.extract;

import com.ttennebkram.stickersplit.model.DetectionResult;
import com.ttennebkram.stickersplit.model.OutputFormat;
import com.ttennebkram.stickersplit.model.ParameterException;
import com.ttennebkram.stickersplit.model.SheetImage;
import com.ttennebkram.stickersplit.model.Tile;
import org.opencv.core.CvType;
import org.opencv.core.Mat;
import org.opencv.core.Rect;

import java.util.ArrayList;
import java.util.List;

/**
 * Crops an image along located separator lines into row-major tiles.
 * Does no file I/O; the source image is not modified.
 */
public class TileExtractor {

    /**
     * Rotate (if the angle is nonzero), then crop one tile per cell of {@code result}.
     * The lines must fit the rotated image.
     */
    public List<Tile> extract(SheetImage image, DetectionResult result, double rotationAngle, OutputFormat format) {
        try (SheetImage rotated = ImageRotator.rotate(image, rotationAngle)) {
            return crop(rotated, result, format);
        }
    }

    /**
     * Crop without rotating.
     */
    public List<Tile> crop(SheetImage image, DetectionResult result, OutputFormat format) {
        if (result.width() > image.width() || result.height() > image.height()) {
            throw new ParameterException("Grid " + result.width() + "x" + result.height()
                    + " does not fit image " + image.width() + "x" + image.height());
        }

        List<Integer> rows = result.rowLines();
        List<Integer> cols = result.colLines();
        List<Tile> tiles = new ArrayList<>(result.tileCount());
        try {
            for (int r = 0; r < rows.size() - 1; r++) {
                for (int c = 0; c < cols.size() - 1; c++) {
                    Rect roi = new Rect(cols.get(c), rows.get(r),
                            cols.get(c + 1) - cols.get(c), rows.get(r + 1) - rows.get(r));
                    tiles.add(new Tile(r, c, roi, cropOne(image.view(), roi, format)));
                }
            }
        } catch (RuntimeException e) {
            for (Tile tile : tiles) {
                tile.close();
            }
            throw e;
        }
        return tiles;
    }

    private static SheetImage cropOne(Mat source, Rect roi, OutputFormat format) {
        Mat region = source.submat(roi);
        try {
            if (!format.keepsAlpha() && region.channels() == 4) {
                return SheetImage.adopt(flattenOnWhite(region));
            }
            return SheetImage.adopt(region.clone());
        } finally {
            region.release();
        }
    }

    /**
     * Composite a BGRA region onto a white background, giving a new BGR Mat.
     */
    static Mat flattenOnWhite(Mat bgra) {
        Mat continuous = bgra.clone();
        int pixels = continuous.rows() * continuous.cols();
        byte[] src = new byte[pixels * 4];
        continuous.get(0, 0, src);
        continuous.release();

        byte[] dst = new byte[pixels * 3];
        for (int i = 0; i < pixels; i++) {
            int alpha = src[i * 4 + 3] & 0xFF;
            for (int ch = 0; ch < 3; ch++) {
                int value = src[i * 4 + ch] & 0xFF;
                dst[i * 3 + ch] = (byte) ((value * alpha + 255 * (255 - alpha) + 127) / 255);
            }
        }
        Mat out = new Mat(bgra.rows(), bgra.cols(), CvType.CV_8UC3);
        out.put(0, 0, dst);
        return out;
    }
}
