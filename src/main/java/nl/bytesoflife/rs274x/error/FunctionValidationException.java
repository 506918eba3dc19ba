package nl.bytesoflife.rs274x.error;

/**
 * A command was rejected before it was appended to the function sequence.
 */
public class FunctionValidationException extends GerberException {

    public enum Reason {
        INVALID_FUNCTION_CODE,
        INVALID_OPERATION_CODE,
        MISSING_OPERATION_CODE
    }

    private final Reason reason;

    public FunctionValidationException(Reason reason, String message) {
        super(message);
        this.reason = reason;
    }

    public Reason getReason() {
        return reason;
    }
}
