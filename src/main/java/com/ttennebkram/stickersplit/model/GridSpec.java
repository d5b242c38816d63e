package com.ttennebkram.stickersplit.model;

import java.util.Objects;

/**
 * Requested grid layout: either a fixed row/column count, or automatic line search
 * with optional fallback counts for when nothing is found.
 */
public final class GridSpec {

    public static final int MIN_CELLS = 1;
    public static final int MAX_CELLS = 18;

    private final boolean manual;
    private final int rows;
    private final int cols;

    private GridSpec(boolean manual, int rows, int cols) {
        this.manual = manual;
        this.rows = rows;
        this.cols = cols;
    }

    /**
     * Fixed grid; rows and cols must each be within 1..18.
     */
    public static GridSpec manual(int rows, int cols) {
        requireCount("rows", rows);
        requireCount("cols", cols);
        return new GridSpec(true, rows, cols);
    }

    /**
     * Automatic search; the fallback grid is guessed from the sheet shape.
     */
    public static GridSpec auto() {
        return new GridSpec(false, 0, 0);
    }

    /**
     * Automatic search with an explicit fallback grid.
     */
    public static GridSpec auto(int fallbackRows, int fallbackCols) {
        requireCount("rows", fallbackRows);
        requireCount("cols", fallbackCols);
        return new GridSpec(false, fallbackRows, fallbackCols);
    }

    private static void requireCount(String name, int value) {
        if (value < MIN_CELLS || value > MAX_CELLS) {
            throw new ParameterException(name + " must be within " + MIN_CELLS + ".." + MAX_CELLS + ", got " + value);
        }
    }

    public boolean isManual() {
        return manual;
    }

    public boolean hasFallbackCounts() {
        return rows > 0 && cols > 0;
    }

    /** Manual row count, or the fallback row count (0 when none was declared). */
    public int rows() {
        return rows;
    }

    public int cols() {
        return cols;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof GridSpec)) return false;
        GridSpec that = (GridSpec) o;
        return manual == that.manual && rows == that.rows && cols == that.cols;
    }

    @Override
    public int hashCode() {
        return Objects.hash(manual, rows, cols);
    }

    @Override
    public String toString() {
        if (manual) {
            return "Manual(" + rows + "x" + cols + ")";
        }
        return hasFallbackCounts() ? "Auto(fallback " + rows + "x" + cols + ")" : "Auto";
    }
}
