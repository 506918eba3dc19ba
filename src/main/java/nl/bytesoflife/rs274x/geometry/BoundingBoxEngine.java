package nl.bytesoflife.rs274x.geometry;

import nl.bytesoflife.rs274x.codec.DecodedCoordinates;
import nl.bytesoflife.rs274x.model.InterpolationMode;
import nl.bytesoflife.rs274x.model.ModalState;
import nl.bytesoflife.rs274x.model.OperationCode;
import nl.bytesoflife.rs274x.model.Point;

/**
 * Applies one decoded operation to the modal state and the running bounding box.
 * Moves never extend the box; a draw following a move first adds the move's destination so
 * both ends of the stroke are covered.
 */
public class BoundingBoxEngine {

    private final BoundingBox box;

    public BoundingBoxEngine(BoundingBox box) {
        this.box = box;
    }

    /**
     * Resolves the target position of a command. Missing axes come from the last position. In
     * linear mode an I/J offset is added to X/Y as a displacement.
     */
    public static Point resolvePosition(DecodedCoordinates coordinates, ModalState state) {
        Point pos = coordinates.resolve(state.getLastPosition());
        if (state.getInterpolationMode() == InterpolationMode.LINEAR && coordinates.hasOffset()) {
            Point offset = coordinates.offset();
            pos = pos.translate(offset.x(), offset.y());
        }
        return pos;
    }

    /**
     * @param state        modal state, updated in place
     * @param end          resolved target position
     * @param offset       arc center offset (I/J), zero when absent
     * @param operation    operation to apply
     * @param drawExposes  false when drawing with a blank aperture that should not count
     */
    public void apply(ModalState state, Point end, Point offset, OperationCode operation, boolean drawExposes) {
        Point start = state.getLastPosition();

        switch (operation) {
            case D02 -> state.setLastWasMove(true);
            case D01 -> {
                if (state.isLastWasMove()) {
                    box.extend(start);
                    state.setLastWasMove(false);
                }
                if (drawExposes) {
                    extendDraw(state, start, end, offset);
                }
            }
            case D03 -> box.extend(end);
        }

        state.setLastPosition(end);
    }

    private void extendDraw(ModalState state, Point start, Point end, Point offset) {
        switch (state.getInterpolationMode()) {
            case LINEAR -> box.extend(end);
            case SINGLE_QUADRANT_ARC -> {
                // a single-quadrant arc cannot start and end on the same point
                if (!start.equals(end)) {
                    box.extend(end);
                }
            }
            case MULTI_QUADRANT_ARC -> {
                for (Point p : ArcBounds.candidates(start, end, offset, state.getArcDirection())) {
                    box.extend(p);
                }
            }
        }
    }
}
