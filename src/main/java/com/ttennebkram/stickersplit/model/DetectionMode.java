package com.ttennebkram.stickersplit.model;

import java.util.Locale;

/**
 * How separator lines are found. Resolved once per image; never changes mid-run.
 */
public enum DetectionMode {
    MANUAL,           // uniform grid from the requested rows/cols, no edge detection
    BASIC,            // single Sobel magnitude threshold
    MULTI_ALGORITHM,  // Canny + Sobel + Laplacian, OR-combined, closed
    ADAPTIVE;         // feature analysis tunes the multi-algorithm parameters

    /**
     * Parse a settings or command-line value such as "adaptive", "multi" or "MULTI_ALGORITHM".
     */
    public static DetectionMode fromName(String name) {
        if (name == null) {
            throw new ParameterException("Detection mode is missing");
        }
        String key = name.trim().toUpperCase(Locale.ROOT).replace('-', '_');
        switch (key) {
            case "MANUAL":
                return MANUAL;
            case "BASIC":
                return BASIC;
            case "MULTI":
            case "MULTI_ALGORITHM":
            case "ENHANCED":
                return MULTI_ALGORITHM;
            case "ADAPTIVE":
            case "AUTO":
                return ADAPTIVE;
            default:
                throw new ParameterException("Unknown detection mode: " + name);
        }
    }

    public String displayName() {
        return name().toLowerCase(Locale.ROOT).replace('_', '-');
    }
}
