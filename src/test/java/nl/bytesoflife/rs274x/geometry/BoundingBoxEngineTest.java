package nl.bytesoflife.rs274x.geometry;

import nl.bytesoflife.rs274x.codec.DecodedCoordinates;
import nl.bytesoflife.rs274x.model.ArcDirection;
import nl.bytesoflife.rs274x.model.ModalState;
import nl.bytesoflife.rs274x.model.OperationCode;
import nl.bytesoflife.rs274x.model.Point;
import nl.bytesoflife.rs274x.model.QuadrantMode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class BoundingBoxEngineTest {

    private ModalState state;
    private BoundingBox box;
    private BoundingBoxEngine engine;

    @BeforeEach
    void setUp() {
        state = new ModalState();
        box = new BoundingBox();
        engine = new BoundingBoxEngine(box);
    }

    private void move(double x, double y) {
        engine.apply(state, new Point(x, y), Point.ORIGIN, OperationCode.D02, true);
    }

    private void draw(double x, double y, double i, double j) {
        engine.apply(state, new Point(x, y), new Point(i, j), OperationCode.D01, true);
    }

    @Test
    void moveOnlyUpdatesPosition() {
        move(3, 4);

        assertTrue(box.isEmpty());
        assertTrue(state.isLastWasMove());
        assertEquals(new Point(3, 4), state.getLastPosition());
    }

    @Test
    void drawAddsMoveDestinationOnce() {
        move(-1, -1);
        draw(2, 3, 0, 0);

        assertFalse(state.isLastWasMove());
        assertEquals(-1.0, box.getLeftX(), 1e-12);
        assertEquals(-1.0, box.getBottomY(), 1e-12);
        assertEquals(3.0, box.getWidth(), 1e-12);
        assertEquals(4.0, box.getHeight(), 1e-12);
    }

    @Test
    void hiddenDrawStillAddsMoveDestination() {
        move(1, 1);
        engine.apply(state, new Point(5, 5), Point.ORIGIN, OperationCode.D01, false);

        assertTrue(box.contains(1, 1));
        assertFalse(box.contains(5, 5));
        assertEquals(new Point(5, 5), state.getLastPosition());
    }

    @Test
    void multiQuadrantArcIncludesSweptExtremes() {
        move(1, 0);
        state.setQuadrantMode(QuadrantMode.MULTI);
        state.circular(ArcDirection.CLOCKWISE);
        draw(0, 1, -1, 0);

        assertEquals(-1.0, box.getLeftX(), 1e-12);
        assertEquals(1.0, box.getRightX(), 1e-12);
        assertEquals(-1.0, box.getBottomY(), 1e-12);
        assertEquals(1.0, box.getTopY(), 1e-12);
    }

    @Test
    void multiQuadrantFullCircle() {
        move(2, 0);
        state.setQuadrantMode(QuadrantMode.MULTI);
        state.circular(ArcDirection.COUNTERCLOCKWISE);
        draw(2, 0, -1, 0);

        assertEquals(2.0, box.getWidth(), 1e-12);
        assertEquals(2.0, box.getHeight(), 1e-12);
    }

    @Test
    void singleQuadrantZeroLengthArcAddsNothing() {
        move(1, 0);
        state.circular(ArcDirection.COUNTERCLOCKWISE);
        draw(1, 0, -1, 0);

        assertEquals(0.0, box.getWidth());
        assertEquals(0.0, box.getHeight());
        assertTrue(box.contains(1, 0));
    }

    @Test
    void singleQuadrantArcAddsEndPointOnly() {
        move(1, 0);
        state.circular(ArcDirection.COUNTERCLOCKWISE);
        draw(0, 1, -1, 0);

        assertEquals(1.0, box.getTopY(), 1e-12);
        assertEquals(0.0, box.getLeftX(), 1e-12);
    }

    @Test
    void flashExtendsWithoutMove() {
        engine.apply(state, new Point(4, -2), Point.ORIGIN, OperationCode.D03, true);

        assertTrue(box.contains(4, -2));
        assertFalse(state.isLastWasMove());
    }

    @Test
    void resolveFoldsOffsetInLinearMode() {
        state.setLastPosition(new Point(1, 1));
        DecodedCoordinates c = new DecodedCoordinates(2.0, null, 0.5, null);

        assertEquals(new Point(2.5, 1.0), BoundingBoxEngine.resolvePosition(c, state));

        state.circular(ArcDirection.CLOCKWISE);
        assertEquals(new Point(2.0, 1.0), BoundingBoxEngine.resolvePosition(c, state));
    }
}
