package com.ttennebkram.stickersplit.grid;

/**
 * Default grid for a sheet of a given size: near-square sheets of at least 300 px
 * are usually 3x3, everything else 2x2.
 */
public final class GridShapeGuesser {

    public static final int SQUARE_MIN_SIDE = 300;
    public static final double SQUARE_MIN_RATIO = 0.9;
    public static final double SQUARE_MAX_RATIO = 1.1;

    private GridShapeGuesser() {
    }

    /**
     * @return {rows, cols}
     */
    public static int[] guess(int width, int height) {
        double ratio = height > 0 ? width / (double) height : 1.0;
        if (ratio >= SQUARE_MIN_RATIO && ratio <= SQUARE_MAX_RATIO && Math.min(width, height) >= SQUARE_MIN_SIDE) {
            return new int[]{3, 3};
        }
        return new int[]{2, 2};
    }
}
