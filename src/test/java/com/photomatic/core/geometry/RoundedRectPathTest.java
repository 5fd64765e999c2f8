package com.photomatic.core.geometry;

import org.junit.jupiter.api.Test;

import java.awt.geom.Path2D;
import java.awt.geom.Point2D;
import java.awt.geom.Rectangle2D;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class RoundedRectPathTest {

    @Test
    void outlineStaysInsideTheRectangle() {
        Path2D path = RoundedRectPath.build(10, 20, 300, 200, 30);

        Rectangle2D bounds = path.getBounds2D();
        assertEquals(10, bounds.getX(), 1e-6);
        assertEquals(20, bounds.getY(), 1e-6);
        assertEquals(300, bounds.getWidth(), 1e-6);
        assertEquals(200, bounds.getHeight(), 1e-6);
    }

    @Test
    void cornersAreCutAway() {
        Path2D path = RoundedRectPath.build(0, 0, 300, 200, 30);

        assertTrue(path.contains(150, 100), "center should be inside");
        assertTrue(path.contains(1, 100), "left edge midpoint should be inside");
        assertTrue(path.contains(150, 1), "top edge midpoint should be inside");
        assertFalse(path.contains(2, 2), "top-left corner should be cut");
        assertFalse(path.contains(298, 2), "top-right corner should be cut");
        assertFalse(path.contains(2, 198), "bottom-left corner should be cut");
        assertFalse(path.contains(298, 198), "bottom-right corner should be cut");
    }

    @Test
    void arcFollowsTheCircle() {
        Path2D path = RoundedRectPath.build(0, 0, 300, 200, 30);
        double diagonal = 30 - 30 / Math.sqrt(2);

        assertTrue(path.contains(diagonal + 1, diagonal + 1), "just inside the arc");
        assertFalse(path.contains(diagonal - 1, diagonal - 1), "just outside the arc");
    }

    @Test
    void zeroRadiusGivesPlainRectangle() {
        Path2D path = RoundedRectPath.build(0, 0, 100, 50, 0);

        assertTrue(path.contains(0.5, 0.5));
        assertTrue(path.contains(99.5, 49.5));
        assertEquals(new Rectangle2D.Double(0, 0, 100, 50), path.getBounds2D());
    }

    @Test
    void rejectsNegativeRadius() {
        assertThrows(IllegalArgumentException.class, () -> RoundedRectPath.build(0, 0, 10, 10, -1));
        assertThrows(IllegalArgumentException.class, () -> RoundedRectPath.build(0, 0, 10, 10, Double.NaN));
    }

    @Test
    void collinearArcDegradesToLine() {
        Path2D.Double path = new Path2D.Double();
        path.moveTo(0, 0);
        RoundedRectPath.arcTo(path, 10, 0, 20, 0, 5);

        assertEquals(new Point2D.Double(10, 0), path.getCurrentPoint());
    }

    @Test
    void rightAngleArcEndsOnSecondTangentPoint() {
        Path2D.Double path = new Path2D.Double();
        path.moveTo(0, 0);
        RoundedRectPath.arcTo(path, 100, 0, 100, 100, 20);

        Point2D end = path.getCurrentPoint();
        assertEquals(100, end.getX(), 1e-9);
        assertEquals(20, end.getY(), 1e-9);
    }
}
