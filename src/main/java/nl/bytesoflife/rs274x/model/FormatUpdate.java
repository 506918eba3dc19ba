package nl.bytesoflife.rs274x.model;

/**
 * Partial update of a {@link FormatSpec}. Fields left unset are not touched.
 */
public class FormatUpdate {

    private String zero;
    private String coordinates;
    private Integer integerDigits;
    private Integer decimalDigits;

    public FormatUpdate zero(String zero) {
        this.zero = zero;
        return this;
    }

    public FormatUpdate coordinates(String coordinates) {
        this.coordinates = coordinates;
        return this;
    }

    public FormatUpdate integerDigits(int digits) {
        this.integerDigits = digits;
        return this;
    }

    public FormatUpdate decimalDigits(int digits) {
        this.decimalDigits = digits;
        return this;
    }

    public String getZero() {
        return zero;
    }

    public String getCoordinates() {
        return coordinates;
    }

    public Integer getIntegerDigits() {
        return integerDigits;
    }

    public Integer getDecimalDigits() {
        return decimalDigits;
    }
}
