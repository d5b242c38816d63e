package com.ttennebkram.stickersplit.edges;

import com.ttennebkram.stickersplit.OpenCvLoader;
import com.ttennebkram.stickersplit.SyntheticSheets;
import com.ttennebkram.stickersplit.model.DetectionParameters;
import com.ttennebkram.stickersplit.model.EdgeMap;
import com.ttennebkram.stickersplit.model.SheetImage;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class MultiAlgorithmEdgeDetectorTest {

    @BeforeAll
    public static void loadOpenCv() {
        OpenCvLoader.load();
    }

    @Test
    public void testSeparatorRowsAreDense() {
        try (SheetImage sheet = SyntheticSheets.cleanSheet()) {
            EdgeMap edges = new MultiAlgorithmEdgeDetector().detect(sheet, DetectionParameters.defaults());
            double[] rows = edges.rowDensity();
            assertTrue(rows[199] > 0.9, "separator row density " + rows[199]);
            assertTrue(rows[100] < 0.1, "content row density " + rows[100]);
            double[] cols = edges.columnDensity();
            assertTrue(cols[200] > 0.9);
            assertTrue(cols[50] < 0.1);
        }
    }

    @Test
    public void testFlatImageHasNoEdges() {
        try (SheetImage flat = SyntheticSheets.gray(SyntheticSheets.flat(120, 80, 200), 120, 80)) {
            assertEquals(0, new MultiAlgorithmEdgeDetector().detect(flat, DetectionParameters.defaults()).edgeCount());
            assertEquals(0, new BasicEdgeDetector().detect(flat, DetectionParameters.defaults()).edgeCount());
        }
    }

    @Test
    public void testInputNotModified() {
        try (SheetImage sheet = SyntheticSheets.cleanSheet()) {
            byte[] before = sheet.toBytes();
            new MultiAlgorithmEdgeDetector().detect(sheet, DetectionParameters.defaults());
            new BasicEdgeDetector().detect(sheet, DetectionParameters.defaults());
            assertArrayEquals(before, sheet.toBytes());
        }
    }
}
