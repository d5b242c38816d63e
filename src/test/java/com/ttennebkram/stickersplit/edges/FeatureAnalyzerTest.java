package com.ttennebkram.stickersplit.edges;

import com.ttennebkram.stickersplit.OpenCvLoader;
import com.ttennebkram.stickersplit.SyntheticSheets;
import com.ttennebkram.stickersplit.model.FeatureScores;
import com.ttennebkram.stickersplit.model.SheetImage;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class FeatureAnalyzerTest {

    private final FeatureAnalyzer analyzer = new FeatureAnalyzer();

    @BeforeAll
    public static void loadOpenCv() {
        OpenCvLoader.load();
    }

    @Test
    public void testFlatImageScoresZero() {
        try (SheetImage flat = SyntheticSheets.gray(SyntheticSheets.flat(64, 48, 128), 64, 48)) {
            FeatureScores scores = analyzer.analyze(flat);
            assertEquals(0.0, scores.getBlurScore(), 1e-9);
            assertEquals(0.0, scores.getTextureScore(), 1e-9);
            assertEquals(0.0, scores.getContrastScore(), 1e-9);
        }
    }

    @Test
    public void testNoiseRaisesSharpnessAndTexture() {
        try (SheetImage clean = SyntheticSheets.cleanSheet();
             SheetImage noisy = SyntheticSheets.noisySheet()) {
            FeatureScores a = analyzer.analyze(clean);
            FeatureScores b = analyzer.analyze(noisy);
            assertTrue(a.getBlurScore() > 0);
            assertTrue(b.getBlurScore() > a.getBlurScore());
            // Halved contrast shows up even with noise on top
            assertTrue(b.getContrastScore() < a.getContrastScore());
        }
    }

    @Test
    public void testScoresAreDeterministic() {
        try (SheetImage noisy = SyntheticSheets.noisySheet()) {
            assertEquals(analyzer.analyze(noisy), analyzer.analyze(noisy));
        }
    }

    @Test
    public void testTextureWeightsApply() {
        FeatureAnalyzer gradientOnly = new FeatureAnalyzer(AdaptationConfig.builder()
                .gradientWeight(1).varianceWeight(0).build());
        FeatureAnalyzer varianceOnly = new FeatureAnalyzer(AdaptationConfig.builder()
                .gradientWeight(0).varianceWeight(1).build());
        try (SheetImage clean = SyntheticSheets.cleanSheet()) {
            double g = gradientOnly.analyze(clean).getTextureScore();
            double v = varianceOnly.analyze(clean).getTextureScore();
            double combined = analyzer.analyze(clean).getTextureScore();
            assertEquals(0.7 * g + 0.3 * v, combined, 1e-6);
        }
    }
}
