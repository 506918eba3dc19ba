package nl.bytesoflife.rs274x.model;

/**
 * Built-in aperture templates; anything else refers to an aperture macro by name.
 */
public enum ApertureType {
    CIRCLE,
    RECTANGLE,
    OBROUND,
    POLYGON,
    MACRO;

    public static ApertureType fromTypeToken(String token) {
        return switch (token) {
            case "C" -> CIRCLE;
            case "R" -> RECTANGLE;
            case "O" -> OBROUND;
            case "P" -> POLYGON;
            default -> MACRO;
        };
    }
}
