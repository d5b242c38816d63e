package com.ttennebkram.stickersplit.model;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Located separator lines. Both line lists are strictly increasing and always start at 0
 * and end at the image dimension, so N lines describe N-1 bands.
 */
public final class DetectionResult {

    private final List<Integer> rowLines;
    private final List<Integer> colLines;
    private final double confidence;
    private final DetectionMode mode;
    private final boolean fallback;

    public DetectionResult(List<Integer> rowLines, List<Integer> colLines, double confidence,
                           DetectionMode mode, boolean fallback) {
        requireBoundaries("rowLines", rowLines);
        requireBoundaries("colLines", colLines);
        if (Double.isNaN(confidence) || confidence < 0 || confidence > 1) {
            throw new IllegalArgumentException("confidence must be within [0, 1], got " + confidence);
        }
        this.rowLines = Collections.unmodifiableList(Arrays.asList(rowLines.toArray(new Integer[0])));
        this.colLines = Collections.unmodifiableList(Arrays.asList(colLines.toArray(new Integer[0])));
        this.confidence = confidence;
        this.mode = Objects.requireNonNull(mode, "mode");
        this.fallback = fallback;
    }

    private static void requireBoundaries(String name, List<Integer> lines) {
        if (lines == null || lines.size() < 2) {
            throw new IllegalArgumentException(name + " needs at least two boundaries");
        }
        if (lines.get(0) != 0) {
            throw new IllegalArgumentException(name + " must start at 0, got " + lines.get(0));
        }
        for (int i = 1; i < lines.size(); i++) {
            if (lines.get(i) <= lines.get(i - 1)) {
                throw new IllegalArgumentException(name + " must be strictly increasing: " + lines);
            }
        }
    }

    public List<Integer> rowLines() {
        return rowLines;
    }

    public List<Integer> colLines() {
        return colLines;
    }

    public double confidence() {
        return confidence;
    }

    public DetectionMode mode() {
        return mode;
    }

    /** True when no line was found and a uniform grid was substituted. */
    public boolean isFallback() {
        return fallback;
    }

    public int rowCount() {
        return rowLines.size() - 1;
    }

    public int colCount() {
        return colLines.size() - 1;
    }

    public int tileCount() {
        return rowCount() * colCount();
    }

    /** Last row boundary, i.e. the image height the lines were located on. */
    public int height() {
        return rowLines.get(rowLines.size() - 1);
    }

    public int width() {
        return colLines.get(colLines.size() - 1);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof DetectionResult)) return false;
        DetectionResult that = (DetectionResult) o;
        return Double.compare(confidence, that.confidence) == 0
                && fallback == that.fallback
                && mode == that.mode
                && rowLines.equals(that.rowLines)
                && colLines.equals(that.colLines);
    }

    @Override
    public int hashCode() {
        return Objects.hash(rowLines, colLines, confidence, mode, fallback);
    }

    @Override
    public String toString() {
        return String.format("DetectionResult[%dx%d, rows=%s, cols=%s, confidence=%.3f, mode=%s%s]",
                rowCount(), colCount(), rowLines, colLines, confidence, mode.displayName(),
                fallback ? ", fallback" : "");
    }
}
