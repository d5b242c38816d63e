package com.ttennebkram.stickersplit.model;

import com.ttennebkram.stickersplit.OpenCvLoader;
import org.opencv.core.CvType;
import org.opencv.core.Mat;
import org.opencv.imgcodecs.Imgcodecs;
import org.opencv.imgproc.Imgproc;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Immutable 8-bit image (GRAY, BGR or BGRA) backed by an OpenCV Mat.
 * Every factory copies its input, and every transformation returns a new instance.
 */
public final class SheetImage implements AutoCloseable {

    private final Mat mat;

    private SheetImage(Mat ownedMat) {
        this.mat = ownedMat;
    }

    /**
     * Build an image from a raw buffer described by {@code format}.
     * 16-bit samples are little-endian and scaled down to 8 bits.
     */
    public static SheetImage fromPixels(byte[] data, PixelFormat format) {
        if (data == null) {
            throw new InputException("Pixel buffer is null");
        }
        long required = format.requiredBytes();
        if (data.length != required) {
            throw new InputException("Corrupt pixel buffer: " + data.length + " bytes for "
                    + format + " (expected " + required + ")");
        }
        OpenCvLoader.load();

        Mat owned;
        if (format.bitDepth == 8) {
            owned = new Mat(format.height, format.width, CvType.makeType(CvType.CV_8U, format.channels));
            owned.put(0, 0, data);
        } else {
            short[] samples = new short[data.length / 2];
            ByteBuffer.wrap(data).order(ByteOrder.LITTLE_ENDIAN).asShortBuffer().get(samples);
            Mat wide = new Mat(format.height, format.width, CvType.makeType(CvType.CV_16U, format.channels));
            wide.put(0, 0, samples);
            owned = new Mat();
            wide.convertTo(owned, CvType.makeType(CvType.CV_8U, format.channels), 1.0 / 257.0);
            wide.release();
        }
        return new SheetImage(owned);
    }

    /**
     * Copy an existing Mat. 16-bit input is scaled to 8 bits.
     */
    public static SheetImage fromMat(Mat source) {
        if (source == null || source.empty()) {
            throw new InputException("Image is empty");
        }
        int channels = source.channels();
        if (channels != 1 && channels != 3 && channels != 4) {
            throw new InputException("Unsupported channel count: " + channels);
        }
        if (source.depth() == CvType.CV_8U) {
            return new SheetImage(source.clone());
        }
        if (source.depth() == CvType.CV_16U) {
            Mat narrow = new Mat();
            source.convertTo(narrow, CvType.makeType(CvType.CV_8U, channels), 1.0 / 257.0);
            return new SheetImage(narrow);
        }
        throw new InputException("Unsupported pixel depth: " + CvType.typeToString(source.type()));
    }

    /**
     * Decode an image file, keeping its alpha channel if it has one.
     */
    public static SheetImage load(Path file) {
        ImageFormats.requireSupported(file);
        if (!Files.isRegularFile(file)) {
            throw new InputException("Image file does not exist: " + file);
        }
        OpenCvLoader.load();
        Mat decoded = Imgcodecs.imread(file.toAbsolutePath().toString(), Imgcodecs.IMREAD_UNCHANGED);
        try {
            if (decoded.empty()) {
                throw new InputException("Cannot decode image: " + file);
            }
            return fromMat(decoded);
        } finally {
            decoded.release();
        }
    }

    public int width() {
        return mat.cols();
    }

    public int height() {
        return mat.rows();
    }

    public int channels() {
        return mat.channels();
    }

    public int bitDepth() {
        return 8;
    }

    public boolean hasAlpha() {
        return mat.channels() == 4;
    }

    /**
     * Read-only view of the pixels (do not modify or release).
     */
    public Mat view() {
        return mat;
    }

    /**
     * New single-channel copy of this image. Caller releases it.
     */
    public Mat toGray() {
        Mat gray = new Mat();
        switch (mat.channels()) {
            case 4:
                Imgproc.cvtColor(mat, gray, Imgproc.COLOR_BGRA2GRAY);
                break;
            case 3:
                Imgproc.cvtColor(mat, gray, Imgproc.COLOR_BGR2GRAY);
                break;
            default:
                mat.copyTo(gray);
        }
        return gray;
    }

    /**
     * New BGR copy of this image. Caller releases it.
     */
    public Mat toBgr() {
        Mat bgr = new Mat();
        switch (mat.channels()) {
            case 4:
                Imgproc.cvtColor(mat, bgr, Imgproc.COLOR_BGRA2BGR);
                break;
            case 1:
                Imgproc.cvtColor(mat, bgr, Imgproc.COLOR_GRAY2BGR);
                break;
            default:
                mat.copyTo(bgr);
        }
        return bgr;
    }

    /**
     * Raw interleaved bytes, row-major.
     */
    public byte[] toBytes() {
        byte[] data = new byte[(int) (mat.total() * mat.channels())];
        mat.get(0, 0, data);
        return data;
    }

    public PixelFormat format() {
        return new PixelFormat(width(), height(), channels(), bitDepth());
    }

    public SheetImage copy() {
        return new SheetImage(mat.clone());
    }

    /**
     * Wrap a Mat the caller hands over; the image takes ownership.
     */
    public static SheetImage adopt(Mat owned) {
        if (owned == null || owned.empty()) {
            throw new InputException("Image is empty");
        }
        return new SheetImage(owned);
    }

    @Override
    public void close() {
        mat.release();
    }

    @Override
    public String toString() {
        return "SheetImage[" + format() + "]";
    }
}
