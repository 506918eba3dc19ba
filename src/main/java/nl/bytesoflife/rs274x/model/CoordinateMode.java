package nl.bytesoflife.rs274x.model;

import nl.bytesoflife.rs274x.error.FormatException;

/**
 * Absolute or incremental coordinate notation. Incremental is accepted in the format
 * specification but coordinates are always interpreted as absolute.
 */
public enum CoordinateMode {
    ABSOLUTE("A"),
    INCREMENTAL("I");

    private final String code;

    CoordinateMode(String code) {
        this.code = code;
    }

    public String getCode() {
        return code;
    }

    /**
     * Accepts any word starting with A or I, case-insensitive ("A", "Abs", "absolute").
     */
    public static CoordinateMode fromToken(String token) {
        if (token != null && !token.isEmpty()) {
            switch (Character.toUpperCase(token.charAt(0))) {
                case 'A':
                    return ABSOLUTE;
                case 'I':
                    return INCREMENTAL;
                default:
                    break;
            }
        }
        throw new FormatException("[format] Invalid coordinates value: " + token);
    }
}
