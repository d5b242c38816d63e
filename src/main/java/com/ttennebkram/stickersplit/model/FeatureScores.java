package com.ttennebkram.stickersplit.model;

import java.util.Objects;

/**
 * Image-quality signals that steer adaptive detection.
 * Each score is 0 for a flat image and grows with sharpness, texture or contrast.
 */
public final class FeatureScores {

    private final double blurScore;
    private final double textureScore;
    private final double contrastScore;

    public FeatureScores(double blurScore, double textureScore, double contrastScore) {
        this.blurScore = blurScore;
        this.textureScore = textureScore;
        this.contrastScore = contrastScore;
    }

    /** Laplacian variance; low means blurry. */
    public double getBlurScore() {
        return blurScore;
    }

    public double getTextureScore() {
        return textureScore;
    }

    public double getContrastScore() {
        return contrastScore;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof FeatureScores)) return false;
        FeatureScores that = (FeatureScores) o;
        return Double.compare(blurScore, that.blurScore) == 0
                && Double.compare(textureScore, that.textureScore) == 0
                && Double.compare(contrastScore, that.contrastScore) == 0;
    }

    @Override
    public int hashCode() {
        return Objects.hash(blurScore, textureScore, contrastScore);
    }

    @Override
    public String toString() {
        return String.format("FeatureScores[blur=%.2f, texture=%.2f, contrast=%.2f]",
                blurScore, textureScore, contrastScore);
    }
}
