package com.ttennebkram.stickersplit.extract;

import com.ttennebkram.stickersplit.model.ParameterException;

import java.util.Locale;

/**
 * How aggressively {@link BorderTrimmer} removes separator slivers. The ratio is the
 * thickest border, as a fraction of the tile's shorter side, that may be cut.
 */
public enum TrimMode {
    NONE(0.0, false),
    AUTO(0.05, false),
    AGGRESSIVE(0.08, false),
    CONSERVATIVE(0.03, false),
    GRADIENT(0.12, true);   // for soft, anti-aliased separators

    private final double edgeThicknessRatio;
    private final boolean gradientProfile;

    TrimMode(double edgeThicknessRatio, boolean gradientProfile) {
        this.edgeThicknessRatio = edgeThicknessRatio;
        this.gradientProfile = gradientProfile;
    }

    public double edgeThicknessRatio() {
        return edgeThicknessRatio;
    }

    public boolean usesGradientProfile() {
        return gradientProfile;
    }

    public static TrimMode fromName(String name) {
        if (name == null || name.trim().isEmpty()) {
            return NONE;
        }
        try {
            return valueOf(name.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new ParameterException("Unknown trim mode: " + name, e);
        }
    }
}
