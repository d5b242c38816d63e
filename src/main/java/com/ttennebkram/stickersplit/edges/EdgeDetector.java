package com.ttennebkram.stickersplit.edges;

import com.ttennebkram.stickersplit.model.DetectionParameters;
import com.ttennebkram.stickersplit.model.EdgeMap;
import com.ttennebkram.stickersplit.model.SheetImage;

/**
 * Turns an image into a binary edge map. Implementations are stateless and thread-safe;
 * the input image is never modified.
 */
public interface EdgeDetector {

    EdgeMap detect(SheetImage image, DetectionParameters params, AnalysisListener listener);

    default EdgeMap detect(SheetImage image, DetectionParameters params) {
        return detect(image, params, AnalysisListener.NONE);
    }
}
