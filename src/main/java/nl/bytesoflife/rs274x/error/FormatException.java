package nl.bytesoflife.rs274x.error;

/**
 * Bad digit counts, bad zero-suppression or coordinate-mode tokens, or malformed coordinate data.
 */
public class FormatException extends GerberException {

    public FormatException(String message) {
        super(message);
    }
}
