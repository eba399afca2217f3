package net.assetdownloader.model;

import jakarta.annotation.Nullable;

/**
 * Image normalization settings for one run.
 *
 * @param enabled whether transparent pixels are flattened onto white before JPEG encoding
 * @param quality JPEG quality 60-100; {@code null} uses the configured default
 * @param method background handling tag, see {@link BackgroundProcessingMethod}
 * @param edgeThreshold 10-100; accepted for compatibility with edge-detection configs
 */
public record ImageProcessingConfig(
        boolean enabled,
        @Nullable Integer quality,
        @Nullable BackgroundProcessingMethod method,
        @Nullable Integer edgeThreshold) {

    public ImageProcessingConfig {
        if (method == null) {
            method = BackgroundProcessingMethod.SMART_DETECT;
        }
    }

    /** Flattening enabled with default quality; used when a run omits image settings. */
    public static ImageProcessingConfig defaults() {
        return new ImageProcessingConfig(true, null, BackgroundProcessingMethod.SMART_DETECT, null);
    }

    public static ImageProcessingConfig disabled() {
        return new ImageProcessingConfig(false, null, BackgroundProcessingMethod.SMART_DETECT, null);
    }

    /** Returns the configured quality, or {@code defaultQuality} when unset. */
    public int qualityOrDefault(int defaultQuality) {
        return quality == null ? defaultQuality : quality;
    }
}
