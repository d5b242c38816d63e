package com.ttennebkram.stickersplit.model;

import org.opencv.core.Rect;

/**
 * One cropped cell of the sheet, tagged with its grid position and its rectangle
 * in the (rotated) source image. Owns its pixels.
 */
public final class Tile implements AutoCloseable {

    private final int rowIndex;
    private final int colIndex;
    private final Rect bounds;
    private final SheetImage image;

    public Tile(int rowIndex, int colIndex, Rect bounds, SheetImage image) {
        this.rowIndex = rowIndex;
        this.colIndex = colIndex;
        this.bounds = bounds.clone();
        this.image = image;
    }

    public int rowIndex() {
        return rowIndex;
    }

    public int colIndex() {
        return colIndex;
    }

    /** Copy of the source rectangle. */
    public Rect bounds() {
        return bounds.clone();
    }

    public SheetImage image() {
        return image;
    }

    public int width() {
        return image.width();
    }

    public int height() {
        return image.height();
    }

    @Override
    public void close() {
        image.close();
    }

    @Override
    public String toString() {
        return "Tile[r" + rowIndex + " c" + colIndex + " " + bounds.x + "," + bounds.y
                + " " + bounds.width + "x" + bounds.height + "]";
    }
}
