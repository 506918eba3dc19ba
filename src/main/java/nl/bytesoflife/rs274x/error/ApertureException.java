package nl.bytesoflife.rs274x.error;

/**
 * Malformed D-code, reserved D-code or invalid aperture type token.
 */
public class ApertureException extends GerberException {

    public ApertureException(String message) {
        super(message);
    }
}
