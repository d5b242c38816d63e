package com.ttennebkram.stickersplit.grid;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Smoothed edge-density profile along one axis, with the peak search used to find separators.
 */
final class DensityProfile {

    /**
     * A local maximum of the smoothed profile.
     */
    static final class Peak {
        final int index;
        final double density;
        final double prominence;

        Peak(int index, double density, double prominence) {
            this.index = index;
            this.density = density;
            this.prominence = prominence;
        }
    }

    // Highest prominence first, then higher density, then lower coordinate
    private static final Comparator<Peak> ACCEPT_ORDER = Comparator
            .comparingDouble((Peak p) -> -p.prominence)
            .thenComparingDouble(p -> -p.density)
            .thenComparingInt(p -> p.index);

    private final double[] smoothed;

    DensityProfile(double[] raw, int window) {
        this.smoothed = smooth(raw, window);
    }

    double[] smoothed() {
        return smoothed.clone();
    }

    /**
     * Centered moving average. Near the ends only the samples inside the profile are averaged.
     */
    static double[] smooth(double[] raw, int window) {
        int n = raw.length;
        double[] prefix = new double[n + 1];
        for (int i = 0; i < n; i++) {
            prefix[i + 1] = prefix[i] + raw[i];
        }
        int half = window / 2;
        double[] out = new double[n];
        for (int i = 0; i < n; i++) {
            int from = Math.max(0, i - half);
            int to = Math.min(n, i + half + 1);
            out[i] = (prefix[to] - prefix[from]) / (to - from);
        }
        return out;
    }

    /**
     * Smoothed value minus the lowest smoothed value within +/- radius.
     */
    double prominence(int index, int radius) {
        int from = Math.max(0, index - radius);
        int to = Math.min(smoothed.length - 1, index + radius);
        double min = smoothed[index];
        for (int j = from; j <= to; j++) {
            min = Math.min(min, smoothed[j]);
        }
        return smoothed[index] - min;
    }

    /**
     * Local maxima that are at least {@code minGap} from both ends and reach {@code minProminence}.
     * A flat top yields only its first sample.
     */
    List<Peak> candidates(int minGap, double minProminence) {
        int n = smoothed.length;
        List<Peak> peaks = new ArrayList<>();
        for (int i = Math.max(1, minGap); i <= n - minGap && i < n; i++) {
            double left = smoothed[i - 1];
            double right = i + 1 < n ? smoothed[i + 1] : Double.NEGATIVE_INFINITY;
            if (!(smoothed[i] > left && smoothed[i] >= right)) {
                continue;
            }
            double prom = prominence(i, minGap);
            if (prom > 0 && prom >= minProminence) {
                peaks.add(new Peak(i, smoothed[i], prom));
            }
        }
        return peaks;
    }

    /**
     * Greedily accept candidates in prominence order, dropping any closer than {@code minGap}
     * to a line already accepted.
     */
    static List<Peak> accept(List<Peak> candidates, int minGap) {
        List<Peak> sorted = new ArrayList<>(candidates);
        sorted.sort(ACCEPT_ORDER);
        List<Peak> accepted = new ArrayList<>();
        for (Peak candidate : sorted) {
            boolean tooClose = false;
            for (Peak line : accepted) {
                if (Math.abs(candidate.index - line.index) < minGap) {
                    tooClose = true;
                    break;
                }
            }
            if (!tooClose) {
                accepted.add(candidate);
            }
        }
        return accepted;
    }

    /**
     * Density-weighted centre of the contiguous band around a peak that stays above half its prominence.
     */
    double refine(Peak peak) {
        double base = smoothed[peak.index] - peak.prominence;
        double cutoff = base + peak.prominence / 2;
        int from = peak.index;
        while (from > 0 && smoothed[from - 1] >= cutoff) {
            from--;
        }
        int to = peak.index;
        while (to < smoothed.length - 1 && smoothed[to + 1] >= cutoff) {
            to++;
        }
        double weightSum = 0;
        double weighted = 0;
        for (int j = from; j <= to; j++) {
            double w = smoothed[j] - base;
            weightSum += w;
            weighted += w * j;
        }
        return weightSum > 0 ? weighted / weightSum : peak.index;
    }
}
