package com.ttennebkram.stickersplit.grid;

import com.ttennebkram.stickersplit.model.DetectionMode;
import com.ttennebkram.stickersplit.model.DetectionParameters;
import com.ttennebkram.stickersplit.model.DetectionResult;
import com.ttennebkram.stickersplit.model.EdgeMap;
import com.ttennebkram.stickersplit.model.GridSpec;
import com.ttennebkram.stickersplit.model.ParameterException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.TreeSet;

/**
 * Resolves separator coordinates, either uniformly from a fixed row/column count or
 * by searching the edge-density profiles for prominent peaks.
 */
public class GridLineLocator {

    private static final Logger LOG = LoggerFactory.getLogger(GridLineLocator.class);

    private final LocatorConfig config;

    public GridLineLocator() {
        this(LocatorConfig.defaults());
    }

    public GridLineLocator(LocatorConfig config) {
        this.config = config;
    }

    /**
     * Locate lines using the parameters the edge map was produced with.
     */
    public DetectionResult locate(EdgeMap edges, GridSpec spec) {
        return locate(edges, spec, edges.parameters());
    }

    public DetectionResult locate(EdgeMap edges, GridSpec spec, DetectionParameters params) {
        if (spec.isManual()) {
            return manual(edges.width(), edges.height(), spec);
        }

        int width = edges.width();
        int height = edges.height();
        double minProminence = params.getMinAreaRatio() * config.getProminenceFactor();

        List<DensityProfile.Peak> rowPeaks = new ArrayList<>();
        List<Integer> rowLines = axisLines(edges.rowDensity(), height, minProminence, rowPeaks);
        List<DensityProfile.Peak> colPeaks = new ArrayList<>();
        List<Integer> colLines = axisLines(edges.columnDensity(), width, minProminence, colPeaks);

        if (rowPeaks.isEmpty() && colPeaks.isEmpty()) {
            int[] counts = spec.hasFallbackCounts()
                    ? new int[]{spec.rows(), spec.cols()}
                    : GridShapeGuesser.guess(width, height);
            int rows = Math.min(counts[0], height);
            int cols = Math.min(counts[1], width);
            LOG.warn("No separator lines found in {}x{} image; using uniform {}x{} grid", width, height, rows, cols);
            return new DetectionResult(uniform(height, rows), uniform(width, cols), 0.0, edges.mode(), true);
        }

        double sum = 0;
        for (DensityProfile.Peak p : rowPeaks) {
            sum += p.prominence;
        }
        for (DensityProfile.Peak p : colPeaks) {
            sum += p.prominence;
        }
        double confidence = Math.max(0, Math.min(1, sum / (rowPeaks.size() + colPeaks.size())));
        LOG.debug("Located rows={} cols={} confidence={}", rowLines, colLines, confidence);
        return new DetectionResult(rowLines, colLines, confidence, edges.mode(), false);
    }

    /**
     * Uniform grid for an image of the given size; no pixels are looked at.
     */
    public DetectionResult manual(int width, int height, GridSpec spec) {
        if (!spec.isManual()) {
            throw new IllegalArgumentException("Manual grid expected, got " + spec);
        }
        requireFits("rows", spec.rows(), "height", height);
        requireFits("cols", spec.cols(), "width", width);
        return new DetectionResult(uniform(height, spec.rows()), uniform(width, spec.cols()),
                1.0, DetectionMode.MANUAL, false);
    }

    private static void requireFits(String name, int count, String dimName, int dim) {
        if (count > dim) {
            throw new ParameterException(name + " (" + count + ") exceeds image " + dimName + " (" + dim + ")");
        }
    }

    /**
     * Boundaries 0, dim/n, 2*dim/n, ..., dim (integer floor).
     */
    static List<Integer> uniform(int dim, int n) {
        List<Integer> lines = new ArrayList<>(n + 1);
        for (int i = 0; i <= n; i++) {
            lines.add((int) ((long) i * dim / n));
        }
        return lines;
    }

    private List<Integer> axisLines(double[] density, int dim, double minProminence,
                                    List<DensityProfile.Peak> acceptedOut) {
        DensityProfile profile = new DensityProfile(density, config.getSmoothingWindow());
        int minGap = config.minGap(dim);
        List<DensityProfile.Peak> accepted = DensityProfile.accept(profile.candidates(minGap, minProminence), minGap);
        acceptedOut.addAll(accepted);

        TreeSet<Integer> coords = new TreeSet<>();
        coords.add(0);
        coords.add(dim);
        for (DensityProfile.Peak peak : accepted) {
            int line = (int) Math.round(profile.refine(peak));
            if (line > 0 && line < dim) {
                coords.add(line);
            }
        }
        return new ArrayList<>(coords);
    }
}
