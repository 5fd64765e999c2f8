package com.photomatic.core.model;

import java.awt.Color;

/**
 * Background frame color around the photo, with the overlay text color readable on it.
 */
public enum Mat {
    DARK(Color.BLACK, new Color(0x999999)),
    LIGHT(Color.WHITE, new Color(0x666666));

    private final Color background;
    private final Color textColor;

    Mat(Color background, Color textColor) {
        this.background = background;
        this.textColor = textColor;
    }

    public Color background() {
        return background;
    }

    public Color textColor() {
        return textColor;
    }
}
