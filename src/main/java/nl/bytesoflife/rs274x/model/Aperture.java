package nl.bytesoflife.rs274x.model;

/**
 * An aperture definition (AD parameter).
 *
 * @param code      D-code, e.g. {@code D10}
 * @param typeToken type as written: C, R, O, P or an aperture macro name
 * @param modifiers raw modifier string, e.g. {@code 0.0100} or {@code 0.060X0.040}
 * @param diameter  leading diameter for circle apertures, null when not a circle or not parseable
 */
public record Aperture(String code, String typeToken, String modifiers, Double diameter) {

    public ApertureType getType() {
        return ApertureType.fromTypeToken(typeToken);
    }

    public int getNumber() {
        return Integer.parseInt(code.substring(1));
    }

    /**
     * True for circle apertures with a zero or missing diameter; drawing with these does not
     * expose anything.
     */
    public boolean isBlank() {
        return diameter == null || diameter <= 0.0;
    }
}
