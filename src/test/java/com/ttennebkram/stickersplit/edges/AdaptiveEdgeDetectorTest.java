package com.ttennebkram.stickersplit.edges;

import com.ttennebkram.stickersplit.OpenCvLoader;
import com.ttennebkram.stickersplit.SyntheticSheets;
import com.ttennebkram.stickersplit.model.DetectionMode;
import com.ttennebkram.stickersplit.model.DetectionParameters;
import com.ttennebkram.stickersplit.model.EdgeMap;
import com.ttennebkram.stickersplit.model.FeatureScores;
import com.ttennebkram.stickersplit.model.ParameterException;
import com.ttennebkram.stickersplit.model.SheetImage;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class AdaptiveEdgeDetectorTest {

    private static final DetectionParameters BASE = DetectionParameters.defaults();
    private static final AdaptationConfig CONFIG = AdaptationConfig.defaults();

    @BeforeAll
    public static void loadOpenCv() {
        OpenCvLoader.load();
    }

    @Test
    public void testSharpTexturelessHighContrastKeepsBase() {
        DetectionParameters p = AdaptiveEdgeDetector.adapt(BASE, new FeatureScores(500, 10, 60), CONFIG);
        assertEquals(BASE, p);
    }

    @Test
    public void testBlurLowersCannyToFloors() {
        DetectionParameters veryBlurry = AdaptiveEdgeDetector.adapt(BASE, new FeatureScores(10, 0, 60), CONFIG);
        assertEquals(20, veryBlurry.getCannyLow(), 1e-9);
        assertEquals(60, veryBlurry.getCannyHigh(), 1e-9);

        DetectionParameters slightlyBlurry = AdaptiveEdgeDetector.adapt(BASE, new FeatureScores(80, 0, 60), CONFIG);
        assertEquals(40, slightlyBlurry.getCannyLow(), 1e-9);
        assertEquals(120, slightlyBlurry.getCannyHigh(), 1e-9);
    }

    @Test
    public void testTextureGrowsKernelOddAndCapped() {
        assertEquals(7, AdaptiveEdgeDetector.adapt(BASE, new FeatureScores(500, 60, 60), CONFIG).getMorphKernelSize());
        assertEquals(9, AdaptiveEdgeDetector.adapt(BASE, new FeatureScores(500, 200, 60), CONFIG).getMorphKernelSize());
        assertEquals(9, AdaptiveEdgeDetector.adapt(BASE, new FeatureScores(500, 5000, 60), CONFIG).getMorphKernelSize());
    }

    @Test
    public void testLowContrastLowersMinAreaRatioToFloor() {
        assertEquals(0.4, AdaptiveEdgeDetector.adapt(BASE, new FeatureScores(500, 0, 20), CONFIG).getMinAreaRatio(), 1e-9);
        assertEquals(0.3, AdaptiveEdgeDetector.adapt(BASE, new FeatureScores(500, 0, 1), CONFIG).getMinAreaRatio(), 1e-9);

        AdaptationConfig lowFloor = AdaptationConfig.builder().minAreaRatioFloor(0.05).build();
        assertEquals(0.1, AdaptiveEdgeDetector.adapt(BASE, new FeatureScores(500, 0, 5), lowFloor).getMinAreaRatio(), 1e-9);
    }

    @Test
    public void testFlatImageAdaptsAllThree() {
        DetectionParameters p = AdaptiveEdgeDetector.adapt(BASE, new FeatureScores(0, 0, 0), CONFIG);
        assertEquals(20, p.getCannyLow(), 1e-9);
        assertEquals(60, p.getCannyHigh(), 1e-9);
        assertEquals(5, p.getMorphKernelSize());
        assertEquals(0.3, p.getMinAreaRatio(), 1e-9);
    }

    @Test
    public void testKernelCapMustBeValidKernel() {
        assertThrows(ParameterException.class,
                () -> AdaptationConfig.builder().kernelCap(15).build());
        assertEquals(7, AdaptationConfig.builder().kernelCap(7).build().getKernelCap());
    }

    @Test
    public void testDetectReportsAnalysisAndTagsMap() {
        AdaptiveEdgeDetector detector = new AdaptiveEdgeDetector();
        List<DetectionParameters> seen = new ArrayList<>();
        try (SheetImage noisy = SyntheticSheets.noisySheet()) {
            EdgeMap edges = detector.detect(noisy, BASE, (scores, adapted) -> seen.add(adapted));
            assertEquals(1, seen.size());
            assertEquals(seen.get(0), edges.parameters());
            assertEquals(DetectionMode.ADAPTIVE, edges.mode());
            assertNotNull(edges.features());
            assertEquals(SyntheticSheets.SIZE, edges.width());
            assertTrue(edges.edgeCount() > 0);
        }
    }

    @Test
    public void testRegistryDispatch() {
        EdgeDetectorRegistry registry = EdgeDetectorRegistry.withDefaults();
        assertTrue(registry.get(DetectionMode.BASIC) instanceof BasicEdgeDetector);
        assertTrue(registry.get(DetectionMode.MULTI_ALGORITHM) instanceof MultiAlgorithmEdgeDetector);
        assertTrue(registry.get(DetectionMode.ADAPTIVE) instanceof AdaptiveEdgeDetector);
        assertFalse(registry.hasDetector(DetectionMode.MANUAL));
        assertThrows(ParameterException.class,
                () -> registry.get(DetectionMode.MANUAL));
        assertEquals(3, registry.descriptions().size());
        assertTrue(registry.descriptions().containsKey("multi-algorithm"));
    }
}
