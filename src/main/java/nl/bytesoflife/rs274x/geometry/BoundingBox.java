package nl.bytesoflife.rs274x.geometry;

import nl.bytesoflife.rs274x.model.Point;
import org.locationtech.jts.geom.Envelope;

import java.util.Locale;

/**
 * Running extent of everything drawn or flashed. Empty until the first point; afterwards it
 * only grows.
 */
public class BoundingBox {

    private final Envelope envelope = new Envelope();

    public void extend(double x, double y) {
        envelope.expandToInclude(x, y);
    }

    public void extend(Point point) {
        extend(point.x(), point.y());
    }

    public boolean isEmpty() {
        return envelope.isNull();
    }

    /**
     * Left-most X, or null while empty.
     */
    public Double getLeftX() {
        return isEmpty() ? null : envelope.getMinX();
    }

    public Double getRightX() {
        return isEmpty() ? null : envelope.getMaxX();
    }

    public Double getBottomY() {
        return isEmpty() ? null : envelope.getMinY();
    }

    public Double getTopY() {
        return isEmpty() ? null : envelope.getMaxY();
    }

    public double getWidth() {
        return isEmpty() ? 0 : envelope.getWidth();
    }

    public double getHeight() {
        return isEmpty() ? 0 : envelope.getHeight();
    }

    public boolean contains(double x, double y) {
        return envelope.contains(x, y);
    }

    @Override
    public String toString() {
        if (isEmpty()) {
            return "BoundingBox[empty]";
        }
        return String.format(Locale.US, "BoundingBox[%.6f,%.6f -> %.6f,%.6f]",
                envelope.getMinX(), envelope.getMinY(), envelope.getMaxX(), envelope.getMaxY());
    }
}
