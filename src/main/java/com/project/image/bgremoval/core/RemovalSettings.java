package com.project.image.bgremoval.core;

/**
 * User-tunable parameters of a removal run. Out-of-range values are clamped, never rejected.
 *
 * @param threshold  color sensitivity, 1..100; scaled by 2.55 onto the RGB distance range
 * @param blurRadius edge softening, 0..10; 0 disables the blur pass
 */
public record RemovalSettings(int threshold, int blurRadius) {
    public static final int MIN_THRESHOLD = 1;
    public static final int MAX_THRESHOLD = 100;
    public static final int MIN_BLUR_RADIUS = 0;
    public static final int MAX_BLUR_RADIUS = 10;

    public static final int DEFAULT_THRESHOLD = 30;
    public static final int DEFAULT_BLUR_RADIUS = 3;

    public RemovalSettings {
        threshold = clampThreshold(threshold);
        blurRadius = clampBlurRadius(blurRadius);
    }

    public static RemovalSettings defaults() {
        return new RemovalSettings(DEFAULT_THRESHOLD, DEFAULT_BLUR_RADIUS);
    }

    public static int clampThreshold(int threshold) {
        return clamp(threshold, MIN_THRESHOLD, MAX_THRESHOLD);
    }

    public static int clampBlurRadius(int blurRadius) {
        return clamp(blurRadius, MIN_BLUR_RADIUS, MAX_BLUR_RADIUS);
    }

    private static int clamp(int v, int lo, int hi) {
        return (v < lo) ? lo : Math.min(hi, v);
    }
}
