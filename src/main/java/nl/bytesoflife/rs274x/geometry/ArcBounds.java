package nl.bytesoflife.rs274x.geometry;

import nl.bytesoflife.rs274x.model.ArcDirection;
import nl.bytesoflife.rs274x.model.Point;

import java.util.ArrayList;
import java.util.List;

/**
 * Candidate points that enclose a multi-quadrant circular arc: the end points plus every axis
 * extreme of the circle the arc sweeps through. The arc itself is never traced.
 */
public final class ArcBounds {

    private static final double TWO_PI = 2 * Math.PI;
    private static final double EPSILON = 1e-12;

    private ArcBounds() {
    }

    /**
     * @param start     current point, where the arc begins
     * @param end       arc end point
     * @param offset    I/J offset from start to the arc center
     * @param direction sweep direction
     */
    public static List<Point> candidates(Point start, Point end, Point offset, ArcDirection direction) {
        Point center = start.translate(offset.x(), offset.y());
        double radius = Math.hypot(offset.x(), offset.y());

        // right, top, left, bottom
        Point[] extremes = {
                new Point(center.x() + radius, center.y()),
                new Point(center.x(), center.y() + radius),
                new Point(center.x() - radius, center.y()),
                new Point(center.x(), center.y() - radius)
        };

        List<Point> points = new ArrayList<>();
        points.add(start);

        if (start.equals(end)) {
            // full circle
            points.addAll(List.of(extremes));
            return points;
        }

        points.add(end);
        double startAngle = angle(center, start);
        double endAngle = angle(center, end);
        for (int k = 0; k < extremes.length; k++) {
            double cardinal = k * Math.PI / 2;
            if (sweeps(startAngle, endAngle, cardinal, direction)) {
                points.add(extremes[k]);
            }
        }
        return points;
    }

    static boolean sweeps(double startAngle, double endAngle, double angle, ArcDirection direction) {
        // clockwise from start to end covers the same angles as counter-clockwise from end to start
        double from = direction == ArcDirection.COUNTERCLOCKWISE ? startAngle : endAngle;
        double to = direction == ArcDirection.COUNTERCLOCKWISE ? endAngle : startAngle;
        double span = normalize(to - from);
        return normalize(angle - from) <= span + EPSILON;
    }

    private static double angle(Point center, Point p) {
        return Math.atan2(p.y() - center.y(), p.x() - center.x());
    }

    private static double normalize(double angle) {
        double a = angle % TWO_PI;
        return a < 0 ? a + TWO_PI : a;
    }
}
