package nl.bytesoflife.rs274x.error;

/**
 * Unit token other than IN or MM.
 */
public class ModeException extends GerberException {

    public ModeException(String message) {
        super(message);
    }
}
