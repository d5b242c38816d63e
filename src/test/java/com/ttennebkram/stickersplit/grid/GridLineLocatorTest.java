package com.ttennebkram.stickersplit.grid;

import com.ttennebkram.stickersplit.model.DetectionMode;
import com.ttennebkram.stickersplit.model.DetectionParameters;
import com.ttennebkram.stickersplit.model.DetectionResult;
import com.ttennebkram.stickersplit.model.EdgeMap;
import com.ttennebkram.stickersplit.model.GridSpec;
import com.ttennebkram.stickersplit.model.ParameterException;
import org.junit.jupiter.api.Test;

import java.util.Arrays;

import static org.junit.jupiter.api.Assertions.*;

public class GridLineLocatorTest {

    private final GridLineLocator locator = new GridLineLocator();

    private static EdgeMap horizontalBand(int width, int height, int fromRow, int toRow) {
        byte[] mask = new byte[width * height];
        for (int y = fromRow; y <= toRow; y++) {
            Arrays.fill(mask, y * width, (y + 1) * width, (byte) 1);
        }
        return EdgeMap.fromMask(width, height, mask, DetectionParameters.defaults());
    }

    @Test
    public void testSingleBandGivesOneRowLine() {
        DetectionResult result = locator.locate(horizontalBand(100, 100, 48, 51), GridSpec.auto());
        assertEquals(Arrays.asList(0, 50, 100), result.rowLines());
        assertEquals(Arrays.asList(0, 100), result.colLines());
        assertEquals(0.8, result.confidence(), 1e-9);
        assertFalse(result.isFallback());
        assertEquals(2, result.tileCount());
    }

    @Test
    public void testWeakPeakBelowProminenceFallsBack() {
        DetectionParameters strict = DetectionParameters.builder().minAreaRatio(1.0).build();
        // Band prominence is 0.8, below the required 1.0
        GridLineLocator picky = new GridLineLocator(new LocatorConfig(5, 1.0, 18));
        DetectionResult result = picky.locate(horizontalBand(100, 100, 48, 51), GridSpec.auto(), strict);
        assertTrue(result.isFallback());
    }

    @Test
    public void testEmptyMaskFallsBackToGuessedGrid() {
        EdgeMap empty = EdgeMap.fromMask(400, 400, new byte[400 * 400], DetectionParameters.defaults());
        DetectionResult result = locator.locate(empty, GridSpec.auto());
        assertEquals(Arrays.asList(0, 133, 266, 400), result.rowLines());
        assertEquals(Arrays.asList(0, 133, 266, 400), result.colLines());
        assertEquals(0.0, result.confidence(), 1e-9);
        assertTrue(result.isFallback());
    }

    @Test
    public void testFallbackUsesRequestedCounts() {
        EdgeMap empty = EdgeMap.fromMask(400, 400, new byte[400 * 400], DetectionParameters.defaults());
        DetectionResult result = locator.locate(empty, GridSpec.auto(2, 4));
        assertEquals(Arrays.asList(0, 200, 400), result.rowLines());
        assertEquals(Arrays.asList(0, 100, 200, 300, 400), result.colLines());
        assertTrue(result.isFallback());
    }

    @Test
    public void testFallbackCappedByTinyImage() {
        EdgeMap tiny = EdgeMap.fromMask(2, 1, new byte[2], DetectionParameters.defaults());
        DetectionResult result = locator.locate(tiny, GridSpec.auto(3, 3));
        assertEquals(Arrays.asList(0, 1), result.rowLines());
        assertEquals(Arrays.asList(0, 1, 2), result.colLines());
    }

    @Test
    public void testManualGridIsUniform() {
        DetectionResult result = locator.manual(300, 200, GridSpec.manual(2, 3));
        assertEquals(Arrays.asList(0, 100, 200), result.rowLines());
        assertEquals(Arrays.asList(0, 100, 200, 300), result.colLines());
        assertEquals(1.0, result.confidence(), 1e-9);
        assertEquals(DetectionMode.MANUAL, result.mode());
        assertFalse(result.isFallback());
    }

    @Test
    public void testManualGridIgnoresEdges() {
        DetectionResult result = locator.locate(horizontalBand(100, 100, 10, 12), GridSpec.manual(1, 1));
        assertEquals(Arrays.asList(0, 100), result.rowLines());
        assertEquals(Arrays.asList(0, 100), result.colLines());
    }

    @Test
    public void testManualCountsLargerThanImageRejected() {
        assertThrows(ParameterException.class, () -> locator.manual(50, 10, GridSpec.manual(11, 2)));
        assertThrows(IllegalArgumentException.class, () -> locator.manual(50, 10, GridSpec.auto()));
    }

    @Test
    public void testUniformSplitsRemainderIntoLaterCells() {
        assertEquals(Arrays.asList(0, 3, 6, 10), GridLineLocator.uniform(10, 3));
        assertEquals(Arrays.asList(0, 7), GridLineLocator.uniform(7, 1));
    }
}
