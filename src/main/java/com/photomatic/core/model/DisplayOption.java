package com.photomatic.core.model;

/**
 * Toggles exposed to the user; {@link #LIGHT_MAT} switches between the dark and light mat.
 */
public enum DisplayOption {
    ROUNDED_CORNERS,
    METADATA_OVERLAY,
    LIGHT_MAT,
    GLOW
}
