package com.ttennebkram.stickersplit.extract;

import com.ttennebkram.stickersplit.OpenCvLoader;
import com.ttennebkram.stickersplit.SyntheticSheets;
import com.ttennebkram.stickersplit.model.DetectionMode;
import com.ttennebkram.stickersplit.model.DetectionResult;
import com.ttennebkram.stickersplit.model.OutputFormat;
import com.ttennebkram.stickersplit.model.ParameterException;
import com.ttennebkram.stickersplit.model.PixelFormat;
import com.ttennebkram.stickersplit.model.SheetImage;
import com.ttennebkram.stickersplit.model.Tile;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class TileExtractorTest {

    private final TileExtractor extractor = new TileExtractor();

    @BeforeAll
    public static void loadOpenCv() {
        OpenCvLoader.load();
    }

    private static DetectionResult grid(List<Integer> rows, List<Integer> cols) {
        return new DetectionResult(rows, cols, 1.0, DetectionMode.MANUAL, false);
    }

    private static void closeAll(List<Tile> tiles) {
        for (Tile tile : tiles) {
            tile.close();
        }
    }

    @Test
    public void testSingleCellIsWholeImage() {
        try (SheetImage sheet = SyntheticSheets.cleanSheet()) {
            List<Tile> tiles = extractor.extract(sheet, grid(Arrays.asList(0, 400), Arrays.asList(0, 400)),
                    0, OutputFormat.PNG);
            try {
                assertEquals(1, tiles.size());
                assertArrayEquals(sheet.toBytes(), tiles.get(0).image().toBytes());
            } finally {
                closeAll(tiles);
            }
        }
    }

    @Test
    public void testTilesAreRowMajorAndCoverImage() {
        try (SheetImage sheet = SyntheticSheets.cleanSheet()) {
            List<Tile> tiles = extractor.crop(sheet,
                    grid(Arrays.asList(0, 150, 400), Arrays.asList(0, 100, 250, 400)), OutputFormat.PNG);
            try {
                assertEquals(6, tiles.size());
                int widthSum = 0;
                for (int c = 0; c < 3; c++) {
                    widthSum += tiles.get(c).width();
                    assertEquals(0, tiles.get(c).rowIndex());
                    assertEquals(c, tiles.get(c).colIndex());
                }
                assertEquals(400, widthSum);
                assertEquals(400, tiles.get(0).height() + tiles.get(3).height());
                assertEquals(250, tiles.get(5).bounds().x);
                assertEquals(150, tiles.get(5).bounds().y);
            } finally {
                closeAll(tiles);
            }
        }
    }

    @Test
    public void testRotationAppliedBeforeCrop() {
        try (SheetImage wide = SyntheticSheets.gray(SyntheticSheets.flat(200, 100, 80), 200, 100)) {
            List<Tile> tiles = extractor.extract(wide, grid(Arrays.asList(0, 200), Arrays.asList(0, 100)),
                    90, OutputFormat.PNG);
            try {
                assertEquals(100, tiles.get(0).width());
                assertEquals(200, tiles.get(0).height());
            } finally {
                closeAll(tiles);
            }
        }
    }

    @Test
    public void testJpgFlattensTransparencyOnWhite() {
        byte[] bgra = new byte[4 * 4 * 4];
        // Fully transparent black everywhere
        try (SheetImage image = SheetImage.fromPixels(bgra, new PixelFormat(4, 4, 4, 8))) {
            List<Tile> jpg = extractor.crop(image, grid(Arrays.asList(0, 4), Arrays.asList(0, 4)), OutputFormat.JPG);
            List<Tile> png = extractor.crop(image, grid(Arrays.asList(0, 4), Arrays.asList(0, 4)), OutputFormat.PNG);
            try {
                assertEquals(3, jpg.get(0).image().channels());
                assertEquals((byte) 255, jpg.get(0).image().toBytes()[0]);
                assertEquals(4, png.get(0).image().channels());
                assertEquals(0, png.get(0).image().toBytes()[3]);
            } finally {
                closeAll(jpg);
                closeAll(png);
            }
        }
    }

    @Test
    public void testGridLargerThanImageRejected() {
        try (SheetImage small = SyntheticSheets.gray(SyntheticSheets.flat(50, 50, 0), 50, 50)) {
            assertThrows(ParameterException.class, () -> extractor.crop(small,
                    grid(Arrays.asList(0, 25, 60), Arrays.asList(0, 50)), OutputFormat.PNG));
        }
    }

    @Test
    public void testSourceUnchanged() {
        try (SheetImage sheet = SyntheticSheets.noisySheet()) {
            byte[] before = sheet.toBytes();
            closeAll(extractor.extract(sheet, grid(Arrays.asList(0, 200, 400), Arrays.asList(0, 200, 400)),
                    0, OutputFormat.JPG));
            assertArrayEquals(before, sheet.toBytes());
        }
    }
}
