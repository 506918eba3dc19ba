package nl.bytesoflife.rs274x.model;

import nl.bytesoflife.rs274x.error.FormatException;

/**
 * Which redundant zeros are omitted from fixed-width coordinate fields.
 * LEADING omits leading zeros, TRAILING omits trailing (decimal) zeros.
 */
public enum ZeroSuppression {
    LEADING("L"),
    TRAILING("T");

    private final String code;

    ZeroSuppression(String code) {
        this.code = code;
    }

    public String getCode() {
        return code;
    }

    /**
     * Accepts any word starting with L or T, case-insensitive ("L", "Lead", "leading").
     */
    public static ZeroSuppression fromToken(String token) {
        if (token != null && !token.isEmpty()) {
            switch (Character.toUpperCase(token.charAt(0))) {
                case 'L':
                    return LEADING;
                case 'T':
                    return TRAILING;
                default:
                    break;
            }
        }
        throw new FormatException("[format] Invalid zero value: " + token);
    }
}
