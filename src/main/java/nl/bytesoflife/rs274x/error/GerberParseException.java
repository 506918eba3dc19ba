package nl.bytesoflife.rs274x.error;

/**
 * Parse failure on a specific input line. The message carries the line number suffix
 * {@code [line N]}; the underlying document error, if any, is the cause.
 */
public class GerberParseException extends GerberException {

    private final int line;

    public GerberParseException(String message, int line) {
        super(message + " [line " + line + "]");
        this.line = line;
    }

    public GerberParseException(String message, int line, Throwable cause) {
        super(message + " [line " + line + "]", cause);
        this.line = line;
    }

    /**
     * 1-based line number of the offending input line.
     */
    public int getLine() {
        return line;
    }
}
