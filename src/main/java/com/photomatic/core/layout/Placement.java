package com.photomatic.core.layout;

import java.awt.geom.Rectangle2D;

/**
 * Where a photo lands on the canvas, in canvas pixels.
 *
 * @param portraitConstrained {@code true} when the vertical content budget bound the size
 */
public record Placement(double x, double y, double width, double height, boolean portraitConstrained) {

    public Rectangle2D toRectangle() {
        return new Rectangle2D.Double(x, y, width, height);
    }
}
