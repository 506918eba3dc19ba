package nl.bytesoflife.rs274x.model;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * D01 interpolate (draw), D02 move, D03 flash.
 */
public enum OperationCode {
    D01,
    D02,
    D03;

    private static final Pattern OP_PATTERN = Pattern.compile("D0?([123])");

    /**
     * Parses {@code D1}/{@code D01} style codes; anything else is empty.
     */
    public static Optional<OperationCode> parse(String code) {
        if (code == null) {
            return Optional.empty();
        }
        Matcher m = OP_PATTERN.matcher(code);
        if (!m.matches()) {
            return Optional.empty();
        }
        return Optional.of(switch (m.group(1)) {
            case "1" -> D01;
            case "2" -> D02;
            default -> D03;
        });
    }
}
