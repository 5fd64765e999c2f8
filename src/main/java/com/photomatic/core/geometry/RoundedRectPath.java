package com.photomatic.core.geometry;

import java.awt.geom.Path2D;
import java.awt.geom.Point2D;

/**
 * Builds rounded-rectangle outlines out of tangent-arc segments.
 */
public final class RoundedRectPath {

    private static final double EPSILON = 1e-9;

    private RoundedRectPath() {
    }

    /**
     * Closed outline of the rectangle {@code (x, y, w, h)} with every corner replaced by a
     * quarter circle of radius {@code r}.
     * <p>
     * The radius is not clamped: callers pass {@code r <= min(w, h) / 2}. Larger values give
     * a self-intersecting outline.
     *
     * @throws IllegalArgumentException if {@code r} is negative or not finite
     */
    public static Path2D build(double x, double y, double w, double h, double r) {
        if (!Double.isFinite(r) || r < 0) {
            throw new IllegalArgumentException("Corner radius must be a finite, non-negative value: " + r);
        }
        Path2D.Double path = new Path2D.Double();
        path.moveTo(x + r, y);
        arcTo(path, x, y, x, y + h - r, r);                 // top-left
        arcTo(path, x, y + h, x + w - r, y + h, r);         // bottom-left
        arcTo(path, x + w, y + h, x + w, y + h - r, r);     // bottom-right
        arcTo(path, x + w, y, x + w - r, y, r);             // top-right
        path.lineTo(x + r, y);
        path.closePath();
        return path;
    }

    /**
     * Appends a tangent arc: a line from the current point to the first tangent point, then an
     * arc of radius {@code r} that touches both the line (current point, {@code (x1, y1)}) and
     * the line ({@code (x1, y1)}, {@code (x2, y2)}).
     */
    static void arcTo(Path2D path, double x1, double y1, double x2, double y2, double r) {
        Point2D current = path.getCurrentPoint();
        if (current == null) {
            path.moveTo(x1, y1);
            return;
        }
        double x0 = current.getX();
        double y0 = current.getY();

        double ax = x0 - x1;
        double ay = y0 - y1;
        double bx = x2 - x1;
        double by = y2 - y1;
        double lenA = Math.hypot(ax, ay);
        double lenB = Math.hypot(bx, by);

        if (r == 0 || lenA < EPSILON || lenB < EPSILON) {
            path.lineTo(x1, y1);
            return;
        }
        ax /= lenA;
        ay /= lenA;
        bx /= lenB;
        by /= lenB;

        double cross = ax * by - ay * bx;
        if (Math.abs(cross) < EPSILON) {
            path.lineTo(x1, y1);
            return;
        }

        double cos = Math.max(-1.0, Math.min(1.0, ax * bx + ay * by));
        double between = Math.acos(cos);
        double tangentDistance = r / Math.tan(between / 2.0);

        double t1x = x1 + ax * tangentDistance;
        double t1y = y1 + ay * tangentDistance;
        double t2x = x1 + bx * tangentDistance;
        double t2y = y1 + by * tangentDistance;

        // one cubic per arc; the sweep is always below a half turn here
        double sweep = Math.PI - between;
        double handle = 4.0 / 3.0 * Math.tan(sweep / 4.0) * r;

        path.lineTo(t1x, t1y);
        path.curveTo(
            t1x - ax * handle, t1y - ay * handle,
            t2x - bx * handle, t2y - by * handle,
            t2x, t2y
        );
    }
}
