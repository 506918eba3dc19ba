package nl.bytesoflife.rs274x.model;

/**
 * Modal interpreter state carried from one command to the next.
 * A fresh state starts at the origin with linear interpolation and no aperture selected.
 */
public class ModalState {

    private Point lastPosition = Point.ORIGIN;
    private String currentAperture;
    private boolean lastWasMove;
    private boolean circular;
    private QuadrantMode quadrantMode = QuadrantMode.SINGLE;
    private ArcDirection arcDirection = ArcDirection.CLOCKWISE;
    private OperationCode lastOperation;

    public Point getLastPosition() {
        return lastPosition;
    }

    public void setLastPosition(Point lastPosition) {
        this.lastPosition = lastPosition;
    }

    /**
     * D-code of the selected aperture, or null when none was selected yet.
     */
    public String getCurrentAperture() {
        return currentAperture;
    }

    public void setCurrentAperture(String currentAperture) {
        this.currentAperture = currentAperture;
    }

    public boolean isLastWasMove() {
        return lastWasMove;
    }

    public void setLastWasMove(boolean lastWasMove) {
        this.lastWasMove = lastWasMove;
    }

    public OperationCode getLastOperation() {
        return lastOperation;
    }

    public void setLastOperation(OperationCode lastOperation) {
        this.lastOperation = lastOperation;
    }

    public QuadrantMode getQuadrantMode() {
        return quadrantMode;
    }

    public ArcDirection getArcDirection() {
        return arcDirection;
    }

    /**
     * G01: straight line segments. The quadrant mode is kept for the next arc.
     */
    public void linear() {
        this.circular = false;
    }

    /**
     * G02 / G03: circular segments in the given direction, using the current quadrant mode.
     */
    public void circular(ArcDirection direction) {
        this.circular = true;
        this.arcDirection = direction;
    }

    /**
     * G74 / G75: selects the quadrant mode and switches to circular interpolation in it.
     */
    public void setQuadrantMode(QuadrantMode quadrantMode) {
        this.quadrantMode = quadrantMode;
        this.circular = true;
    }

    public InterpolationMode getInterpolationMode() {
        if (!circular) {
            return InterpolationMode.LINEAR;
        }
        return quadrantMode == QuadrantMode.MULTI
                ? InterpolationMode.MULTI_QUADRANT_ARC
                : InterpolationMode.SINGLE_QUADRANT_ARC;
    }

    @Override
    public String toString() {
        return "ModalState{position=" + lastPosition + ", aperture=" + currentAperture
                + ", mode=" + getInterpolationMode() + ", direction=" + arcDirection
                + ", lastOperation=" + lastOperation + "}";
    }
}
