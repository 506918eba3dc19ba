package nl.bytesoflife.rs274x.model;

import nl.bytesoflife.rs274x.error.ModeException;

/**
 * Measurement units of a document (the MO parameter).
 */
public enum Unit {
    INCH("IN"),
    MM("MM");

    private final String code;

    Unit(String code) {
        this.code = code;
    }

    public String getCode() {
        return code;
    }

    public static Unit fromCode(String code) {
        for (Unit unit : values()) {
            if (unit.code.equals(code)) {
                return unit;
            }
        }
        throw new ModeException("[mode] Invalid Mode: " + code);
    }
}
