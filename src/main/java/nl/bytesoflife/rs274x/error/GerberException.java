package nl.bytesoflife.rs274x.error;

/**
 * Base class for all errors raised while building, decoding or parsing a Gerber document.
 */
public class GerberException extends RuntimeException {

    public GerberException(String message) {
        super(message);
    }

    public GerberException(String message, Throwable cause) {
        super(message, cause);
    }
}
