package com.ttennebkram.stickersplit.edges;

import com.ttennebkram.stickersplit.model.DetectionParameters;
import com.ttennebkram.stickersplit.model.FeatureScores;

/**
 * Callback fired by detectors that analyze the image before detecting edges.
 * Implementations may throw to abort detection (e.g. on cancellation).
 */
@FunctionalInterface
public interface AnalysisListener {

    AnalysisListener NONE = (scores, adapted) -> { };

    void onFeaturesAnalyzed(FeatureScores scores, DetectionParameters adapted);
}
