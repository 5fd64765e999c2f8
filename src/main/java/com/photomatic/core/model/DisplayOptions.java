package com.photomatic.core.model;

import java.util.Objects;

/**
 * Session-wide rendering options. Never persisted.
 */
public record DisplayOptions(boolean roundedCorners,
                             boolean showMetadataOverlay,
                             Mat mat,
                             boolean glow) {

    public DisplayOptions {
        Objects.requireNonNull(mat, "mat");
    }

    public static DisplayOptions defaults() {
        return new DisplayOptions(true, false, Mat.DARK, false);
    }

    public DisplayOptions with(DisplayOption option, boolean enabled) {
        return switch (option) {
            case ROUNDED_CORNERS -> new DisplayOptions(enabled, showMetadataOverlay, mat, glow);
            case METADATA_OVERLAY -> new DisplayOptions(roundedCorners, enabled, mat, glow);
            case LIGHT_MAT -> new DisplayOptions(roundedCorners, showMetadataOverlay, enabled ? Mat.LIGHT : Mat.DARK, glow);
            case GLOW -> new DisplayOptions(roundedCorners, showMetadataOverlay, mat, enabled);
        };
    }

    public boolean isEnabled(DisplayOption option) {
        return switch (option) {
            case ROUNDED_CORNERS -> roundedCorners;
            case METADATA_OVERLAY -> showMetadataOverlay;
            case LIGHT_MAT -> mat == Mat.LIGHT;
            case GLOW -> glow;
        };
    }
}
