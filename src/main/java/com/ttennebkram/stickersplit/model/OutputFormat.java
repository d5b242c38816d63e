package com.ttennebkram.stickersplit.model;

import java.util.Locale;

/**
 * Tile export format. PNG keeps transparency; JPG is flattened onto white.
 */
public enum OutputFormat {
    PNG("png", true),
    JPG("jpg", false);

    public static final int JPEG_QUALITY = 95;

    private final String extension;
    private final boolean keepsAlpha;

    OutputFormat(String extension, boolean keepsAlpha) {
        this.extension = extension;
        this.keepsAlpha = keepsAlpha;
    }

    public String extension() {
        return extension;
    }

    public boolean keepsAlpha() {
        return keepsAlpha;
    }

    public static OutputFormat fromName(String name) {
        if (name == null) {
            throw new ParameterException("Output format is missing");
        }
        switch (name.trim().toLowerCase(Locale.ROOT)) {
            case "png":
                return PNG;
            case "jpg":
            case "jpeg":
                return JPG;
            default:
                throw new ParameterException("Unknown output format: " + name);
        }
    }
}
