package com.photomatic.core.layout;

/**
 * Scales a photo of a given aspect ratio into the content area of a canvas.
 * <p>
 * Width is tried first: the photo spans the full horizontal content width and is centered
 * vertically, anchored to the left margin. When that would overflow the vertical budget the
 * height binds instead: the photo spans the full content height from the top margin and is
 * centered horizontally.
 */
public final class FitCalculator {

    private FitCalculator() {
    }

    public static Placement computeFit(double canvasWidth,
                                       double canvasHeight,
                                       Margins margins,
                                       double sourceAspect) {
        if (!Double.isFinite(sourceAspect) || sourceAspect <= 0) {
            throw new IllegalArgumentException("Aspect ratio must be a positive finite number: " + sourceAspect);
        }
        double contentWidth = canvasWidth - margins.left() - margins.right();
        double portraitHeight = canvasHeight - margins.top() - margins.bottom();
        if (!(contentWidth > 0) || !(portraitHeight > 0)) {
            throw new IllegalArgumentException("Margins leave no content area on a "
                + canvasWidth + "x" + canvasHeight + " canvas");
        }

        // landscape
        double w = contentWidth;
        double h = w / sourceAspect;

        // portrait
        if (h > portraitHeight) {
            h = portraitHeight;
            w = h * sourceAspect;
        }

        double x = margins.left();
        double y = canvasHeight * 0.5 - h * 0.5;
        boolean portrait = h == portraitHeight;
        if (portrait) {
            x = canvasWidth * 0.5 - w * 0.5;
            y = margins.top();
        }
        return new Placement(x, y, w, h, portrait);
    }
}
