package nl.bytesoflife.rs274x.model;

/**
 * Coordinate format specification (the FS parameter). X and Y share one digit format,
 * I and J follow the same convention.
 */
public record FormatSpec(ZeroSuppression zeroSuppression,
                         CoordinateMode coordinateMode,
                         int integerDigits,
                         int decimalDigits) {

    public static final int MAX_DIGITS = 7;

    public static final FormatSpec DEFAULT =
            new FormatSpec(ZeroSuppression.LEADING, CoordinateMode.ABSOLUTE, 5, 5);

    /**
     * Total number of digits in a fully padded coordinate field.
     */
    public int fieldLength() {
        return integerDigits + decimalDigits;
    }

    public FormatSpec withZeroSuppression(ZeroSuppression zero) {
        return new FormatSpec(zero, coordinateMode, integerDigits, decimalDigits);
    }

    public FormatSpec withCoordinateMode(CoordinateMode mode) {
        return new FormatSpec(zeroSuppression, mode, integerDigits, decimalDigits);
    }

    public FormatSpec withIntegerDigits(int digits) {
        return new FormatSpec(zeroSuppression, coordinateMode, digits, decimalDigits);
    }

    public FormatSpec withDecimalDigits(int digits) {
        return new FormatSpec(zeroSuppression, coordinateMode, integerDigits, digits);
    }

    /**
     * Renders the spec the way it appears in an FS parameter body, e.g. {@code LAX25Y25}.
     */
    public String toParameterBody() {
        String digits = "" + integerDigits + decimalDigits;
        return zeroSuppression.getCode() + coordinateMode.getCode() + "X" + digits + "Y" + digits;
    }
}
