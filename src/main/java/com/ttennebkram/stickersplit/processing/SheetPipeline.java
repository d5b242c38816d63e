package com.ttennebkram.stickersplit.processing;

import com.ttennebkram.stickersplit.edges.EdgeDetector;
import com.ttennebkram.stickersplit.edges.EdgeDetectorRegistry;
import com.ttennebkram.stickersplit.extract.BorderTrimmer;
import com.ttennebkram.stickersplit.extract.ImageRotator;
import com.ttennebkram.stickersplit.extract.TileExtractor;
import com.ttennebkram.stickersplit.extract.TrimMode;
import com.ttennebkram.stickersplit.grid.GridLineLocator;
import com.ttennebkram.stickersplit.model.DetectionParameters;
import com.ttennebkram.stickersplit.model.DetectionResult;
import com.ttennebkram.stickersplit.model.EdgeMap;
import com.ttennebkram.stickersplit.model.ImageFormats;
import com.ttennebkram.stickersplit.model.SheetImage;
import com.ttennebkram.stickersplit.model.Tile;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits one image: rotate, detect edges, locate lines, crop tiles, optionally trim them.
 * Progress is reported and cancellation checked at each {@link Checkpoint}.
 * Stateless; one instance may serve many threads.
 */
public class SheetPipeline {

    private static final Logger LOG = LoggerFactory.getLogger(SheetPipeline.class);

    private final EdgeDetectorRegistry detectors;
    private final GridLineLocator locator;
    private final TileExtractor extractor;

    public SheetPipeline() {
        this(EdgeDetectorRegistry.withDefaults(), new GridLineLocator(), new TileExtractor());
    }

    public SheetPipeline(EdgeDetectorRegistry detectors, GridLineLocator locator, TileExtractor extractor) {
        this.detectors = detectors;
        this.locator = locator;
        this.extractor = extractor;
    }

    /**
     * Locate lines only, without cropping.
     */
    public DetectionResult detect(SheetImage image, SplitRequest request) {
        try (SheetImage rotated = ImageRotator.rotate(image, request.rotationAngle())) {
            return locate("image", rotated, request, ProgressListener.NONE, new CancellationToken()).result;
        }
    }

    public SplitOutcome split(String imageName, SheetImage image, SplitRequest request) {
        return split(imageName, image, request, ProgressListener.NONE, new CancellationToken());
    }

    /**
     * @throws java.util.concurrent.CancellationException if the token is cancelled at a checkpoint;
     *         no tiles survive in that case
     */
    public SplitOutcome split(String imageName, SheetImage image, SplitRequest request,
                              ProgressListener listener, CancellationToken token) {
        token.throwIfCancelled();
        if (ImageFormats.isSmall(image.width(), image.height())) {
            LOG.warn("{} is only {}x{}; split results may be poor", imageName, image.width(), image.height());
        }

        try (SheetImage rotated = ImageRotator.rotate(image, request.rotationAngle())) {
            Located located = locate(imageName, rotated, request, listener, token);
            DetectionResult result = located.result;

            List<Tile> tiles = new ArrayList<>(extractor.crop(rotated, result, request.outputFormat()));
            BorderTrimmer trimmer = request.trimMode() == TrimMode.NONE ? null : new BorderTrimmer(request.trimMode());
            try {
                for (int i = 0; i < tiles.size(); i++) {
                    Tile tile = tiles.get(i);
                    if (trimmer != null) {
                        Tile trimmed = trimmer.trim(tile);
                        if (trimmed != tile) {
                            tile.close();
                            tiles.set(i, trimmed);
                        }
                    }
                    listener.onProgress(new ProgressEvent(imageName, Checkpoint.TILE_EXTRACTED, i, tiles.size()));
                    token.throwIfCancelled();
                }
            } catch (RuntimeException e) {
                for (Tile tile : tiles) {
                    tile.close();
                }
                throw e;
            }

            EdgeMap edges = located.edges;
            DetectionParameters used = edges != null ? edges.parameters() : request.parameters();
            LOG.info("{}: {} tiles ({}x{}, confidence {}, {})", imageName, tiles.size(),
                    result.rowCount(), result.colCount(), String.format("%.2f", result.confidence()),
                    result.mode().displayName());
            return new SplitOutcome(imageName, result, tiles, used, edges != null ? edges.features() : null);
        }
    }

    /**
     * Lines plus the edge map they came from (null for manual grids).
     */
    private static class Located {
        final DetectionResult result;
        final EdgeMap edges;

        Located(DetectionResult result, EdgeMap edges) {
            this.result = result;
            this.edges = edges;
        }
    }

    private Located locate(String imageName, SheetImage rotated, SplitRequest request,
                           ProgressListener listener, CancellationToken token) {
        DetectionResult result;
        EdgeMap edges = null;
        if (request.gridSpec().isManual()) {
            result = locator.manual(rotated.width(), rotated.height(), request.gridSpec());
        } else {
            EdgeDetector detector = detectors.get(request.mode());
            edges = detector.detect(rotated, request.parameters(), (scores, adapted) -> {
                listener.onProgress(new ProgressEvent(imageName, Checkpoint.FEATURES_ANALYZED, -1, 0));
                token.throwIfCancelled();
            });
            listener.onProgress(new ProgressEvent(imageName, Checkpoint.EDGES_DETECTED, -1, 0));
            token.throwIfCancelled();
            result = locator.locate(edges, request.gridSpec());
        }
        listener.onProgress(new ProgressEvent(imageName, Checkpoint.LINES_LOCATED, -1, 0));
        token.throwIfCancelled();
        return new Located(result, edges);
    }
}
