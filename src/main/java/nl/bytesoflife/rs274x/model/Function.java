package nl.bytesoflife.rs274x.model;

/**
 * One entry of a document's function sequence.
 */
public sealed interface Function permits Function.ApertureSelect, Function.ParamCall, Function.Command {

    /**
     * Select the aperture used by following operations ({@code D10*}).
     */
    record ApertureSelect(String code) implements Function {
    }

    /**
     * A parameter that may appear repeatedly in the body, e.g. {@code LPD} or {@code SRX2Y3I1.0J1.0}.
     */
    record ParamCall(String raw) implements Function {
    }

    /**
     * A G/M-code command and/or coordinate operation. Every field is optional.
     *
     * @param func     function code such as {@code G01}, or null
     * @param coord    raw coordinate data such as {@code X1000Y-250}, or null
     * @param op       operation code as written, or null
     * @param comment  comment text for G04
     * @param position decoded, modally resolved end position; present only with coordinate data
     */
    record Command(String func, String coord, String op, String comment, Point position) implements Function {

        public boolean hasCoordinates() {
            return coord != null;
        }

        public OperationCode getOperation() {
            return OperationCode.parse(op).orElse(null);
        }

        Command withCoordinates(String newCoord, String newOp, Point newPosition) {
            return new Command(func, newCoord, newOp, comment, newPosition);
        }
    }
}
