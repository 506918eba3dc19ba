package nl.bytesoflife.rs274x.error;

/**
 * A coordinate value does not fit the configured field width.
 */
public class GeometryException extends GerberException {

    public GeometryException(String message) {
        super(message);
    }
}
