package com.ttennebkram.stickersplit.extract;

import com.ttennebkram.stickersplit.OpenCvLoader;
import com.ttennebkram.stickersplit.SyntheticSheets;
import com.ttennebkram.stickersplit.model.PixelFormat;
import com.ttennebkram.stickersplit.model.SheetImage;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class ImageRotatorTest {

    @BeforeAll
    public static void loadOpenCv() {
        OpenCvLoader.load();
    }

    @Test
    public void testNormalize() {
        assertEquals(0.0, ImageRotator.normalize(360), 1e-12);
        assertEquals(270.0, ImageRotator.normalize(-90), 1e-12);
        assertEquals(45.0, ImageRotator.normalize(405), 1e-12);
    }

    @Test
    public void testQuarterTurnSwapsDimensions() {
        try (SheetImage image = SyntheticSheets.gray(SyntheticSheets.flat(200, 100, 50), 200, 100);
             SheetImage rotated = ImageRotator.rotate(image, 90)) {
            assertEquals(100, rotated.width());
            assertEquals(200, rotated.height());
        }
    }

    @Test
    public void testPositiveAngleTurnsClockwise() {
        byte[] pixels = {1, 2, 3, 4, 5, 6};
        try (SheetImage image = SyntheticSheets.gray(pixels, 3, 2);
             SheetImage rotated = ImageRotator.rotate(image, 90)) {
            assertArrayEquals(new byte[]{4, 1, 5, 2, 6, 3}, rotated.toBytes());
        }
        try (SheetImage image = SyntheticSheets.gray(pixels, 3, 2);
             SheetImage rotated = ImageRotator.rotate(image, -90)) {
            assertArrayEquals(new byte[]{3, 6, 2, 5, 1, 4}, rotated.toBytes());
        }
    }

    @Test
    public void testHalfTurnReversesPixels() {
        byte[] pixels = {1, 2, 3, 4, 5, 6};
        try (SheetImage image = SyntheticSheets.gray(pixels, 3, 2);
             SheetImage rotated = ImageRotator.rotate(image, 180)) {
            assertArrayEquals(new byte[]{6, 5, 4, 3, 2, 1}, rotated.toBytes());
        }
    }

    @Test
    public void testArbitraryAngleExpandsCanvas() {
        try (SheetImage image = SyntheticSheets.gray(SyntheticSheets.flat(100, 100, 200), 100, 100);
             SheetImage rotated = ImageRotator.rotate(image, 45)) {
            assertEquals(141, rotated.width());
            assertEquals(141, rotated.height());
            // Corner is outside the source and filled black
            assertEquals(0, rotated.toBytes()[0]);
        }
        try (SheetImage image = SyntheticSheets.gray(SyntheticSheets.flat(200, 100, 200), 200, 100);
             SheetImage rotated = ImageRotator.rotate(image, 30)) {
            assertEquals(223, rotated.width());
            assertEquals(187, rotated.height());
        }
    }

    @Test
    public void testCornersTransparentWithAlpha() {
        byte[] bgra = new byte[50 * 50 * 4];
        java.util.Arrays.fill(bgra, (byte) 255);
        try (SheetImage image = SheetImage.fromPixels(bgra, new PixelFormat(50, 50, 4, 8));
             SheetImage rotated = ImageRotator.rotate(image, 45)) {
            assertTrue(rotated.hasAlpha());
            assertEquals(0, rotated.toBytes()[3]);
        }
    }

    @Test
    public void testFullTurnReturnsIndependentCopy() {
        byte[] pixels = {1, 2, 3, 4, 5, 6};
        try (SheetImage image = SyntheticSheets.gray(pixels, 3, 2);
             SheetImage rotated = ImageRotator.rotate(image, 360)) {
            assertArrayEquals(pixels, rotated.toBytes());
            assertNotSame(image.view(), rotated.view());
        }
    }
}
