package com.ttennebkram.stickersplit.extract;

import com.ttennebkram.stickersplit.OpenCvLoader;
import com.ttennebkram.stickersplit.SyntheticSheets;
import com.ttennebkram.stickersplit.model.ParameterException;
import com.ttennebkram.stickersplit.model.Tile;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.opencv.core.Rect;

import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

public class BorderTrimmerTest {

    @BeforeAll
    public static void loadOpenCv() {
        OpenCvLoader.load();
    }

    /**
     * 100x100 tile at (200, 300) whose first {@code borderRows} rows are flat and the rest noise.
     */
    private static Tile tileWithTopBorder(int borderRows) {
        Random random = new Random(7);
        byte[] pixels = new byte[100 * 100];
        for (int y = 0; y < 100; y++) {
            for (int x = 0; x < 100; x++) {
                pixels[y * 100 + x] = (byte) (y < borderRows ? 30 : random.nextInt(256));
            }
        }
        return new Tile(1, 2, new Rect(200, 300, 100, 100), SyntheticSheets.gray(pixels, 100, 100));
    }

    @Test
    public void testThinBorderRemoved() {
        try (Tile tile = tileWithTopBorder(3)) {
            Tile trimmed = new BorderTrimmer(TrimMode.AUTO).trim(tile);
            try {
                assertNotSame(tile, trimmed);
                assertEquals(97, trimmed.height());
                assertEquals(100, trimmed.width());
                assertEquals(303, trimmed.bounds().y);
                assertEquals(200, trimmed.bounds().x);
                assertEquals(1, trimmed.rowIndex());
                assertEquals(2, trimmed.colIndex());
            } finally {
                trimmed.close();
            }
        }
    }

    @Test
    public void testThickBorderLeftAlone() {
        try (Tile tile = tileWithTopBorder(20)) {
            assertSame(tile, new BorderTrimmer(TrimMode.AGGRESSIVE).trim(tile));
        }
    }

    @Test
    public void testNoneAndCleanTilesUntouched() {
        try (Tile bordered = tileWithTopBorder(3); Tile clean = tileWithTopBorder(0)) {
            assertSame(bordered, new BorderTrimmer(TrimMode.NONE).trim(bordered));
            assertSame(clean, new BorderTrimmer(TrimMode.AUTO).trim(clean));
        }
    }

    @Test
    public void testMedian() {
        assertEquals(2.0, BorderTrimmer.median(new double[]{3, 1, 2}), 1e-12);
        assertEquals(2.5, BorderTrimmer.median(new double[]{4, 1, 3, 2}), 1e-12);
        assertEquals(0.0, BorderTrimmer.median(new double[0]), 1e-12);
    }

    @Test
    public void testTrimModeNames() {
        assertEquals(TrimMode.NONE, TrimMode.fromName(""));
        assertEquals(TrimMode.GRADIENT, TrimMode.fromName("gradient"));
        assertTrue(TrimMode.GRADIENT.usesGradientProfile());
        assertThrows(ParameterException.class, () -> TrimMode.fromName("sideways"));
    }
}
