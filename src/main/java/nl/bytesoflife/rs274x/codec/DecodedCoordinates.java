package nl.bytesoflife.rs274x.codec;

import nl.bytesoflife.rs274x.model.Point;

/**
 * Per-axis values decoded from one coordinate token. Axes absent from the token are null.
 */
public record DecodedCoordinates(Double x, Double y, Double i, Double j) {

    public static final DecodedCoordinates EMPTY = new DecodedCoordinates(null, null, null, null);

    public boolean hasOffset() {
        return i != null || j != null;
    }

    /**
     * Resolves the position against the previous one; coordinates are modal, so a missing
     * axis keeps its previous value.
     */
    public Point resolve(Point previous) {
        return new Point(x != null ? x : previous.x(), y != null ? y : previous.y());
    }

    /**
     * I/J as an offset, with missing components treated as zero.
     */
    public Point offset() {
        return new Point(i != null ? i : 0.0, j != null ? j : 0.0);
    }
}
