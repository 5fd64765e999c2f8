package com.photomatic.core.layout;

/**
 * Space kept free between each canvas edge and the photo.
 */
public record Margins(double left, double right, double top, double bottom) {

    public Margins {
        if (left < 0 || right < 0 || top < 0 || bottom < 0) {
            throw new IllegalArgumentException("Margins must not be negative");
        }
    }

    public static Margins uniform(double margin) {
        return new Margins(margin, margin, margin, margin);
    }

    public Margins withBottom(double newBottom) {
        return new Margins(left, right, top, newBottom);
    }
}
