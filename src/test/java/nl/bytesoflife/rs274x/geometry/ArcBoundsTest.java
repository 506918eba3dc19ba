package nl.bytesoflife.rs274x.geometry;

import nl.bytesoflife.rs274x.model.ArcDirection;
import nl.bytesoflife.rs274x.model.Point;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ArcBoundsTest {

    private static final Point RIGHT = new Point(1, 0);
    private static final Point TOP = new Point(0, 1);
    private static final Point LEFT = new Point(-1, 0);
    private static final Point BOTTOM = new Point(0, -1);
    private static final Point TO_CENTER = new Point(-1, 0);

    @Test
    void fullCircleIncludesAllExtremes() {
        List<Point> points = ArcBounds.candidates(RIGHT, RIGHT, TO_CENTER, ArcDirection.CLOCKWISE);

        assertEquals(List.of(RIGHT, RIGHT, TOP, LEFT, BOTTOM), points);
    }

    @Test
    void counterClockwiseQuarterStaysInFirstQuadrant() {
        List<Point> points = ArcBounds.candidates(RIGHT, TOP, TO_CENTER, ArcDirection.COUNTERCLOCKWISE);

        assertTrue(points.contains(RIGHT));
        assertTrue(points.contains(TOP));
        assertFalse(points.contains(LEFT));
        assertFalse(points.contains(BOTTOM));
    }

    @Test
    void clockwiseThreeQuartersPassesEveryExtreme() {
        List<Point> points = ArcBounds.candidates(RIGHT, TOP, TO_CENTER, ArcDirection.CLOCKWISE);

        assertTrue(points.contains(LEFT));
        assertTrue(points.contains(BOTTOM));
    }

    @Test
    void halfCircleBelowCenter() {
        // from left to right through the bottom
        List<Point> points = ArcBounds.candidates(LEFT, RIGHT, new Point(1, 0), ArcDirection.COUNTERCLOCKWISE);

        assertTrue(points.contains(BOTTOM));
        assertFalse(points.contains(TOP));
    }

    @Test
    void sweepIncludesEndAngles() {
        assertTrue(ArcBounds.sweeps(0, Math.PI / 2, 0, ArcDirection.COUNTERCLOCKWISE));
        assertTrue(ArcBounds.sweeps(0, Math.PI / 2, Math.PI / 2, ArcDirection.COUNTERCLOCKWISE));
        assertFalse(ArcBounds.sweeps(0, Math.PI / 2, Math.PI, ArcDirection.COUNTERCLOCKWISE));
        assertTrue(ArcBounds.sweeps(0, Math.PI / 2, Math.PI, ArcDirection.CLOCKWISE));
    }
}
