package nl.bytesoflife.rs274x.codec;

import nl.bytesoflife.rs274x.error.FormatException;
import nl.bytesoflife.rs274x.error.GeometryException;
import nl.bytesoflife.rs274x.model.FormatSpec;
import nl.bytesoflife.rs274x.model.ZeroSuppression;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Converts between compact fixed-point coordinate tokens ({@code X123500Y-1250}) and decimal
 * values, following the digit counts and zero suppression of a {@link FormatSpec}.
 */
public final class CoordinateCodec {

    private static final Pattern AXIS_PATTERN = Pattern.compile("([XYIJ])([+-]?\\d+)");

    private CoordinateCodec() {
    }

    /**
     * Decodes every X, Y, I and J field of a token. Each axis may appear once, in any order.
     *
     * @throws FormatException on a repeated axis or text that is not an axis field
     */
    public static DecodedCoordinates decode(String token, FormatSpec format) {
        if (token == null || token.isEmpty()) {
            return DecodedCoordinates.EMPTY;
        }

        String[] raw = new String[4];
        Matcher m = AXIS_PATTERN.matcher(token);
        int pos = 0;
        while (pos < token.length()) {
            m.region(pos, token.length());
            if (!m.lookingAt()) {
                throw new FormatException("Invalid coordinate data: '" + token.substring(pos) + "' in " + token);
            }
            int axis = "XYIJ".indexOf(m.group(1).charAt(0));
            if (raw[axis] != null) {
                throw new FormatException("Axis " + m.group(1) + " repeated in coordinate data: " + token);
            }
            raw[axis] = m.group(2);
            pos = m.end();
        }

        return new DecodedCoordinates(
                decodeValue(raw[0], format),
                decodeValue(raw[1], format),
                decodeValue(raw[2], format),
                decodeValue(raw[3], format));
    }

    /**
     * Decodes a single signed digit run. Short values are padded to the field length: after the
     * sign for leading zero suppression, at the end for trailing zero suppression.
     */
    public static Double decodeValue(String value, FormatSpec format) {
        if (value == null) {
            return null;
        }
        String sign = "";
        String digits = value;
        if (value.startsWith("+") || value.startsWith("-")) {
            sign = value.substring(0, 1);
            digits = value.substring(1);
        }
        if (digits.isEmpty()) {
            throw new FormatException("Coordinate value without digits: " + value);
        }

        int missing = format.fieldLength() - digits.length();
        if (missing > 0) {
            String zeros = "0".repeat(missing);
            digits = format.zeroSuppression() == ZeroSuppression.LEADING ? zeros + digits : digits + zeros;
        }

        return new BigDecimal(sign + digits).movePointLeft(format.decimalDigits()).doubleValue();
    }

    /**
     * Encodes a value as a signed digit run with the zeros the format allows to be omitted
     * removed. The result decodes back to the value rounded to the format's decimal digits.
     *
     * @throws GeometryException if the value needs more digits than the format provides
     */
    public static String encodeValue(double value, FormatSpec format) {
        BigDecimal scaled = BigDecimal.valueOf(value)
                .setScale(format.decimalDigits(), RoundingMode.HALF_UP)
                .movePointRight(format.decimalDigits());
        String digits = scaled.abs().toBigInteger().toString();
        int width = Math.max(format.fieldLength(), 1);
        if (digits.length() > width) {
            throw new GeometryException("Coordinate too large to format using Gerber: " + value
                    + " does not fit " + format.integerDigits() + "." + format.decimalDigits());
        }
        if (digits.length() < format.fieldLength()) {
            digits = "0".repeat(format.fieldLength() - digits.length()) + digits;
        }

        digits = suppressZeros(digits, format.zeroSuppression());
        return (scaled.signum() < 0 ? "-" : "") + digits;
    }

    /**
     * Builds a coordinate token from the given axis values; null axes are left out.
     */
    public static String encode(DecodedCoordinates coordinates, FormatSpec format) {
        StringBuilder sb = new StringBuilder();
        appendAxis(sb, 'X', coordinates.x(), format);
        appendAxis(sb, 'Y', coordinates.y(), format);
        appendAxis(sb, 'I', coordinates.i(), format);
        appendAxis(sb, 'J', coordinates.j(), format);
        return sb.toString();
    }

    private static void appendAxis(StringBuilder sb, char axis, Double value, FormatSpec format) {
        if (value != null) {
            sb.append(axis).append(encodeValue(value, format));
        }
    }

    private static String suppressZeros(String digits, ZeroSuppression zero) {
        int start = 0;
        int end = digits.length();
        if (zero == ZeroSuppression.LEADING) {
            while (start < end - 1 && digits.charAt(start) == '0') {
                start++;
            }
        } else {
            while (end > start + 1 && digits.charAt(end - 1) == '0') {
                end--;
            }
        }
        return digits.substring(start, end);
    }
}
