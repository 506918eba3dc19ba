package nl.bytesoflife.rs274x.model;

import nl.bytesoflife.rs274x.codec.CoordinateCodec;
import nl.bytesoflife.rs274x.codec.DecodedCoordinates;
import nl.bytesoflife.rs274x.error.ApertureException;
import nl.bytesoflife.rs274x.error.FormatException;
import nl.bytesoflife.rs274x.error.FunctionValidationException;
import nl.bytesoflife.rs274x.error.FunctionValidationException.Reason;
import nl.bytesoflife.rs274x.error.GerberException;
import nl.bytesoflife.rs274x.error.ModeException;
import nl.bytesoflife.rs274x.geometry.BoundingBox;
import nl.bytesoflife.rs274x.geometry.BoundingBoxEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * In-memory RS-274X document: format specification, units, aperture and macro tables and the
 * ordered function sequence.
 *
 * <p>Functions are interpreted in the order they are added, exactly as they would appear in a
 * file: every command updates the modal state and the bounding box. Set the format
 * specification before adding commands, since it determines how coordinates are decoded.
 *
 * <p>Every mutator validates its input before committing. On failure it throws a
 * {@link GerberException} and records the message, available from {@link #getLastError()}.
 * Not thread-safe.
 */
public class GerberDocument {

    private static final Logger log = LoggerFactory.getLogger(GerberDocument.class);

    private static final Set<String> FUNCTION_CODES = Set.of(
            "G01", "G1", "G02", "G2", "G03", "G3", "G04", "G4",
            "G36", "G37", "G54", "G55", "G70", "G71", "G74", "G75",
            "G90", "G91", "M00", "M01", "M02");

    private static final Pattern APERTURE_CODE = Pattern.compile("D(\\d+)");
    private static final Pattern TYPE_TOKEN = Pattern.compile("[a-z_$][a-z0-9_$]*", Pattern.CASE_INSENSITIVE);
    private static final Pattern LEADING_NUMBER = Pattern.compile("^([0-9.]+)");
    private static final Pattern G_CODE = Pattern.compile("G0*(\\d+)");
    private static final Pattern COMMENT_PRIMITIVE = Pattern.compile("^0(?![\\d.]).*", Pattern.DOTALL);

    private FormatSpec format = FormatSpec.DEFAULT;
    private Unit unit = Unit.INCH;
    private final Map<String, Aperture> apertures = new LinkedHashMap<>();
    private final Map<String, ApertureMacro> macros = new LinkedHashMap<>();
    private final List<Function> functions = new ArrayList<>();
    private final ModalState modalState = new ModalState();
    private final BoundingBox boundingBox = new BoundingBox();
    private final BoundingBoxEngine engine = new BoundingBoxEngine(boundingBox);

    private boolean ignoreInvalid;
    private boolean ignoreBlank;
    private boolean reuseOperationCode;
    private String lastError;

    // --- flags

    public boolean isIgnoreInvalid() {
        return ignoreInvalid;
    }

    /**
     * When set, unrecognized G/M function codes are accepted instead of rejected.
     */
    public GerberDocument setIgnoreInvalid(boolean ignoreInvalid) {
        this.ignoreInvalid = ignoreInvalid;
        return this;
    }

    public boolean isIgnoreBlank() {
        return ignoreBlank;
    }

    /**
     * When set, draws made with an aperture whose diameter is zero or undefined do not
     * extend the bounding box.
     */
    public GerberDocument setIgnoreBlank(boolean ignoreBlank) {
        this.ignoreBlank = ignoreBlank;
        return this;
    }

    public boolean isReuseOperationCode() {
        return reuseOperationCode;
    }

    /**
     * When set, any command with coordinate data but no operation code reuses the previous
     * operation. Without it only circular interpolation commands may omit the operation code.
     */
    public GerberDocument setReuseOperationCode(boolean reuseOperationCode) {
        this.reuseOperationCode = reuseOperationCode;
        return this;
    }

    /**
     * Last recorded error or warning, or null if none occurred yet.
     */
    public String getLastError() {
        return lastError;
    }

    // --- format and units

    public FormatSpec getFormat() {
        return format;
    }

    /**
     * Applies a partial format update. Fields are validated and committed one at a time, in the
     * order zero, coordinates, integer, decimal: when a field is invalid the fields before it
     * stay applied and it and the fields after it are left unchanged.
     *
     * @throws FormatException on the first invalid field
     */
    public void format(FormatUpdate update) {
        try {
            if (update.getZero() != null) {
                format = format.withZeroSuppression(ZeroSuppression.fromToken(update.getZero()));
            }
            if (update.getCoordinates() != null) {
                CoordinateMode mode = CoordinateMode.fromToken(update.getCoordinates());
                if (mode == CoordinateMode.INCREMENTAL) {
                    log.warn("Incremental coordinates are not supported, values will be read as absolute");
                }
                format = format.withCoordinateMode(mode);
            }
        } catch (FormatException e) {
            throw fail(e);
        }
        if (update.getIntegerDigits() != null) {
            format = format.withIntegerDigits(checkDigits("integer", update.getIntegerDigits()));
        }
        if (update.getDecimalDigits() != null) {
            format = format.withDecimalDigits(checkDigits("decimal", update.getDecimalDigits()));
        }
    }

    private int checkDigits(String name, int digits) {
        if (digits < 0 || digits > FormatSpec.MAX_DIGITS) {
            throw fail(new FormatException("[format] Invalid format spec for " + name + " : " + digits));
        }
        return digits;
    }

    public Unit getUnit() {
        return unit;
    }

    /**
     * @param code {@code IN} or {@code MM}
     * @throws ModeException for anything else
     */
    public void setUnit(String code) {
        try {
            this.unit = Unit.fromCode(code);
        } catch (ModeException e) {
            throw fail(e);
        }
    }

    // --- apertures and macros

    /**
     * Defines (or redefines) an aperture.
     *
     * <p>For circles the leading number of the modifiers is taken as the diameter. A circle
     * without one is still defined, with no diameter, and the problem is recorded as the last
     * error.
     *
     * @param code      D-code, {@code D10} or higher
     * @param type      C, R, O, P or a macro name
     * @param modifiers modifier string, stored as given; null is stored as empty
     * @throws ApertureException on a malformed or reserved code, or an invalid type
     */
    public Aperture defineAperture(String code, String type, String modifiers) {
        checkApertureCode(code, true);
        if (type == null || !TYPE_TOKEN.matcher(type).matches()) {
            throw fail(new ApertureException("[aperture] Invalid Type: " + type));
        }
        String mods = modifiers != null ? modifiers : "";

        Double diameter = null;
        if (ApertureType.fromTypeToken(type) == ApertureType.CIRCLE) {
            diameter = parseDiameter(mods);
            if (diameter == null) {
                recordWarning("[aperture] Modifier does not appear to include diameter for circle: " + mods);
            }
        }

        Aperture aperture = new Aperture(code, type, mods, diameter);
        apertures.put(code, aperture);
        return aperture;
    }

    private static Double parseDiameter(String modifiers) {
        Matcher m = LEADING_NUMBER.matcher(modifiers);
        if (!m.find()) {
            return null;
        }
        try {
            return Double.parseDouble(m.group(1));
        } catch (NumberFormatException e) {
            return null;
        }
    }

    /**
     * Looks up an aperture. An undefined code is not an error.
     *
     * @throws ApertureException if the code is not a D-code
     */
    public Optional<Aperture> getAperture(String code) {
        checkApertureCode(code, false);
        return Optional.ofNullable(apertures.get(code));
    }

    public Map<String, Aperture> getApertures() {
        return Collections.unmodifiableMap(apertures);
    }

    private void checkApertureCode(String code, boolean forDefinition) {
        Matcher m = code != null ? APERTURE_CODE.matcher(code) : null;
        if (m == null || !m.matches()) {
            throw fail(new ApertureException("[aperture] Invalid D-Code: " + code));
        }
        if (forDefinition && Integer.parseInt(m.group(1)) < 10) {
            throw fail(new ApertureException("[aperture] Invalid D-Code: '" + code + "'"));
        }
    }

    /**
     * Stores an aperture macro. Comment primitives (code 0) are dropped.
     *
     * @throws ApertureException if the name is not a valid macro name
     */
    public ApertureMacro defineMacro(String name, List<String> primitives) {
        if (name == null || !TYPE_TOKEN.matcher(name).matches()) {
            throw fail(new ApertureException("[macro] Invalid macro name: " + name));
        }
        List<String> kept = new ArrayList<>();
        for (String primitive : primitives) {
            String p = primitive.trim();
            if (!p.isEmpty() && !COMMENT_PRIMITIVE.matcher(p).matches()) {
                kept.add(p);
            }
        }
        ApertureMacro macro = new ApertureMacro(name, kept);
        macros.put(name, macro);
        return macro;
    }

    public Optional<ApertureMacro> getMacro(String name) {
        return Optional.ofNullable(macros.get(name));
    }

    public Map<String, ApertureMacro> getMacros() {
        return Collections.unmodifiableMap(macros);
    }

    // --- function sequence

    /**
     * Selects an aperture for the following operations. Selecting an undefined aperture is
     * tolerated: the selection is still appended and the problem is recorded as the last error.
     */
    public Function.ApertureSelect selectAperture(String code) {
        if (!apertures.containsKey(code)) {
            recordWarning("[function] Invalid/Unknown Aperture Referenced: " + code);
        }
        modalState.setCurrentAperture(code);
        Function.ApertureSelect select = new Function.ApertureSelect(code);
        functions.add(select);
        return select;
    }

    /**
     * Appends a repeatable parameter (e.g. {@code LPD}) verbatim.
     */
    public Function.ParamCall addParameter(String raw) {
        if (raw == null || raw.isEmpty()) {
            throw new IllegalArgumentException("Parameter must not be empty");
        }
        Function.ParamCall param = new Function.ParamCall(raw);
        functions.add(param);
        return param;
    }

    /**
     * Validates and appends a command, updating the modal state and bounding box.
     *
     * <p>Coordinate data needs an operation code, except with circular interpolation (G02/G03),
     * where the previous operation is reused, or when {@link #setReuseOperationCode(boolean)}
     * is on. The stored command carries the operation actually applied.
     *
     * @param func    function code such as {@code G01}, or null
     * @param coord   coordinate data such as {@code X1000Y2000I-50J0}, or null
     * @param op      {@code D01}, {@code D02} or {@code D03} (or an aperture code after G54), or null
     * @param comment comment text, or null
     * @throws FunctionValidationException if the command is rejected
     * @throws FormatException             if the coordinate data cannot be decoded
     */
    public Function.Command addCommand(String func, String coord, String op, String comment) {
        if (func == null && coord == null && op == null && comment == null) {
            throw new IllegalArgumentException("Command must have at least one field");
        }

        if (func != null && !ignoreInvalid && !FUNCTION_CODES.contains(func)) {
            throw fail(new FunctionValidationException(Reason.INVALID_FUNCTION_CODE,
                    "[function] Invalid Function Code: " + func));
        }

        int gCode = gCodeNumber(func);
        OperationCode operation = null;
        boolean apertureSelect = false;
        if (op != null) {
            operation = OperationCode.parse(op).orElse(null);
            if (operation == null) {
                if (gCode == 54 && APERTURE_CODE.matcher(op).matches() && coord == null) {
                    apertureSelect = true;
                } else {
                    throw fail(new FunctionValidationException(Reason.INVALID_OPERATION_CODE,
                            "[function] Invalid Operation Code: " + op));
                }
            }
        }

        if (coord != null && operation == null) {
            boolean arc = gCode == 2 || gCode == 3;
            if (arc || reuseOperationCode) {
                operation = modalState.getLastOperation();
                if (operation == null && arc) {
                    operation = OperationCode.D01;
                }
            }
            if (operation == null) {
                throw fail(new FunctionValidationException(Reason.MISSING_OPERATION_CODE,
                        "[function] Operation Code must be provided when Coordinate Data is provided"));
            }
            op = operation.name();
        }

        DecodedCoordinates decoded = null;
        if (coord != null) {
            try {
                decoded = CoordinateCodec.decode(coord, format);
            } catch (FormatException e) {
                throw fail(e);
            }
        }

        applyInterpolation(gCode);
        if (apertureSelect) {
            if (!apertures.containsKey(op)) {
                recordWarning("[function] Invalid/Unknown Aperture Referenced: " + op);
            }
            modalState.setCurrentAperture(op);
        }

        Point position = null;
        if (decoded != null) {
            position = BoundingBoxEngine.resolvePosition(decoded, modalState);
            engine.apply(modalState, position, decoded.offset(), operation, drawExposes());
        }
        if (operation != null) {
            modalState.setLastOperation(operation);
        }

        Function.Command command = new Function.Command(func, coord, op, comment, position);
        functions.add(command);
        return command;
    }

    private void applyInterpolation(int gCode) {
        switch (gCode) {
            case 1 -> modalState.linear();
            case 2 -> modalState.circular(ArcDirection.CLOCKWISE);
            case 3 -> modalState.circular(ArcDirection.COUNTERCLOCKWISE);
            case 74 -> modalState.setQuadrantMode(QuadrantMode.SINGLE);
            case 75 -> modalState.setQuadrantMode(QuadrantMode.MULTI);
            default -> {
            }
        }
    }

    private static int gCodeNumber(String func) {
        if (func == null) {
            return -1;
        }
        Matcher m = G_CODE.matcher(func);
        return m.matches() ? Integer.parseInt(m.group(1)) : -1;
    }

    private boolean drawExposes() {
        if (!ignoreBlank) {
            return true;
        }
        String current = modalState.getCurrentAperture();
        Aperture aperture = current != null ? apertures.get(current) : null;
        return aperture != null && !aperture.isBlank();
    }

    /**
     * Replaces the coordinate data and operation of a command and decodes its position again
     * with the current format. Axes missing from the new data are taken from the nearest
     * preceding command with a position. Modal state and bounding box are not touched.
     *
     * @throws IllegalArgumentException if the function at the index is not a command
     * @throws FormatException          if the coordinate data cannot be decoded
     */
    public Function.Command rewriteCommand(int index, String coord, String op) {
        if (!(functions.get(index) instanceof Function.Command command)) {
            throw new IllegalArgumentException("Function " + index + " is not a command");
        }
        Point position = null;
        if (coord != null) {
            try {
                position = CoordinateCodec.decode(coord, format).resolve(previousPosition(index));
            } catch (FormatException e) {
                throw fail(e);
            }
        }
        Function.Command rewritten = command.withCoordinates(coord, op, position);
        functions.set(index, rewritten);
        return rewritten;
    }

    /**
     * Decodes the position of every command again, e.g. after the format specification was
     * changed by a conversion step.
     */
    public void refreshPositions() {
        for (int i = 0; i < functions.size(); i++) {
            if (functions.get(i) instanceof Function.Command command && command.hasCoordinates()) {
                rewriteCommand(i, command.coord(), command.op());
            }
        }
    }

    private Point previousPosition(int index) {
        for (int i = index - 1; i >= 0; i--) {
            if (functions.get(i) instanceof Function.Command c && c.position() != null) {
                return c.position();
            }
        }
        return Point.ORIGIN;
    }

    public List<Function> getFunctions() {
        return Collections.unmodifiableList(functions);
    }

    /**
     * @throws IndexOutOfBoundsException if there is no function at the index
     */
    public Function getFunction(int index) {
        return functions.get(index);
    }

    public int getFunctionCount() {
        return functions.size();
    }

    public ModalState getModalState() {
        return modalState;
    }

    public BoundingBox getBoundingBox() {
        return boundingBox;
    }

    public double getWidth() {
        return boundingBox.getWidth();
    }

    public double getHeight() {
        return boundingBox.getHeight();
    }

    private <E extends GerberException> E fail(E e) {
        lastError = e.getMessage();
        return e;
    }

    private void recordWarning(String message) {
        lastError = message;
        log.warn(message);
    }
}
