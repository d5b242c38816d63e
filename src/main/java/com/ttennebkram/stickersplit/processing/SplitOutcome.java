package com.ttennebkram.stickersplit.processing;

import com.ttennebkram.stickersplit.model.DetectionParameters;
import com.ttennebkram.stickersplit.model.DetectionResult;
import com.ttennebkram.stickersplit.model.FeatureScores;
import com.ttennebkram.stickersplit.model.Tile;

import java.util.Collections;
import java.util.List;

/**
 * Result of splitting one image. Owns its tiles; close it to release their pixels.
 */
public class SplitOutcome implements AutoCloseable {
    public final String imageName;
    public final DetectionResult result;
    public final List<Tile> tiles;
    public final DetectionParameters parameters;  // as used, after any adaptation
    public final FeatureScores features;          // null unless adaptive

    public SplitOutcome(String imageName, DetectionResult result, List<Tile> tiles,
                        DetectionParameters parameters, FeatureScores features) {
        this.imageName = imageName;
        this.result = result;
        this.tiles = Collections.unmodifiableList(tiles);
        this.parameters = parameters;
        this.features = features;
    }

    @Override
    public void close() {
        for (Tile tile : tiles) {
            tile.close();
        }
    }
}
