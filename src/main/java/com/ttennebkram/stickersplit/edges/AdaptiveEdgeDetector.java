package com.ttennebkram.stickersplit.edges;

import com.ttennebkram.stickersplit.model.DetectionMode;
import com.ttennebkram.stickersplit.model.DetectionParameters;
import com.ttennebkram.stickersplit.model.EdgeMap;
import com.ttennebkram.stickersplit.model.FeatureScores;
import com.ttennebkram.stickersplit.model.SheetImage;
import org.opencv.core.Mat;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Analyzes the image first, then runs the multi-algorithm detector with parameters
 * tuned to what it found:
 * - blurry images get lower Canny thresholds
 * - textured images get a larger closing kernel
 * - low-contrast images get a lower min area ratio
 *
 * The caller's parameters are never changed; a derived copy is used.
 */
@EdgeDetectorInfo(
    mode = DetectionMode.ADAPTIVE,
    displayName = "Adaptive",
    description = "Blur/texture/contrast analysis tunes the multi-algorithm detector"
)
public class AdaptiveEdgeDetector implements EdgeDetector {

    private static final Logger LOG = LoggerFactory.getLogger(AdaptiveEdgeDetector.class);

    // Keeps ratios finite when a pivot threshold is configured as 0
    private static final double MIN_PIVOT = 1e-9;

    private final AdaptationConfig config;
    private final FeatureAnalyzer analyzer;
    private final MultiAlgorithmEdgeDetector delegate = new MultiAlgorithmEdgeDetector();

    public AdaptiveEdgeDetector() {
        this(AdaptationConfig.defaults());
    }

    public AdaptiveEdgeDetector(AdaptationConfig config) {
        this.config = config;
        this.analyzer = new FeatureAnalyzer(config);
    }

    @Override
    public EdgeMap detect(SheetImage image, DetectionParameters params, AnalysisListener listener) {
        Mat gray = image.toGray();
        try {
            FeatureScores scores = analyzer.analyze(gray);
            DetectionParameters adapted = adapt(params, scores, config);
            LOG.debug("{} -> {}", scores, adapted);
            listener.onFeaturesAnalyzed(scores, adapted);
            return delegate.detectGray(gray, adapted, scores, DetectionMode.ADAPTIVE);
        } finally {
            gray.release();
        }
    }

    /**
     * Derive detection parameters for an image with the given scores.
     */
    public static DetectionParameters adapt(DetectionParameters base, FeatureScores scores, AdaptationConfig config) {
        DetectionParameters.Builder builder = base.toBuilder();

        double blurPivot = Math.max(base.getBlurThreshold(), MIN_PIVOT);
        if (scores.getBlurScore() < base.getBlurThreshold()) {
            double ratio = scores.getBlurScore() / blurPivot;
            double low = Math.max(config.getCannyLowFloor(), base.getCannyLow() * ratio);
            double high = Math.max(config.getCannyHighFloor(), base.getCannyHigh() * ratio);
            builder.cannyLow(Math.min(low, high)).cannyHigh(high);
        }

        double texturePivot = Math.max(base.getTextureThreshold(), MIN_PIVOT);
        if (scores.getTextureScore() > base.getTextureThreshold()) {
            int kernel = (int) (base.getMorphKernelSize() + 2 * scores.getTextureScore() / texturePivot);
            if (kernel % 2 == 0) {
                kernel++;
            }
            kernel = Math.min(config.getKernelCap(), kernel);
            builder.morphKernelSize(Math.max(base.getMorphKernelSize(), kernel));
        }

        double contrastPivot = Math.max(base.getContrastThreshold(), MIN_PIVOT);
        if (scores.getContrastScore() < base.getContrastThreshold()) {
            double ratio = scores.getContrastScore() / contrastPivot;
            builder.minAreaRatio(Math.max(config.getMinAreaRatioFloor(), base.getMinAreaRatio() * ratio));
        }

        return builder.build();
    }
}
