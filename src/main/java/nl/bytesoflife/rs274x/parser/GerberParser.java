package nl.bytesoflife.rs274x.parser;

import nl.bytesoflife.rs274x.error.GerberException;
import nl.bytesoflife.rs274x.error.GerberParseException;
import nl.bytesoflife.rs274x.lexer.CommandParts;
import nl.bytesoflife.rs274x.lexer.GerberLexer;
import nl.bytesoflife.rs274x.lexer.Token;
import nl.bytesoflife.rs274x.model.FormatUpdate;
import nl.bytesoflife.rs274x.model.GerberDocument;
import nl.bytesoflife.rs274x.model.OperationCode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.io.StringReader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Line-oriented RS-274X parser producing a {@link GerberDocument}.
 *
 * <p>Parameters are delimited by {@code %} and may span several lines. All other lines hold
 * {@code *} terminated commands. Parsing stops at the first error, or at {@code M02}.
 *
 * <p>A parser can be reused for several files but is not thread-safe.
 */
public class GerberParser {

    private static final Logger log = LoggerFactory.getLogger(GerberParser.class);

    private static final Pattern BLANK_LINE = Pattern.compile("^\\s*\\*?\\s*$");
    private static final Pattern PARAMETER_OPEN = Pattern.compile("^\\s*%([^%]*)$");
    private static final Pattern PARAMETER_LINE = Pattern.compile("^\\s*%(.*)%\\s*$");
    private static final Pattern PARAMETER_CLOSE = Pattern.compile(".*%\\s*$");

    private static final Pattern FS_MODES = Pattern.compile("^([LT])([AI])", Pattern.CASE_INSENSITIVE);
    private static final Pattern FS_DIGITS = Pattern.compile("X(\\d)(\\d)");
    private static final Pattern MO_VALUE = Pattern.compile("^(IN|MM)$", Pattern.CASE_INSENSITIVE);
    private static final Pattern AD_VALUE = Pattern.compile(
            "^D(\\d+)([a-z_$][a-z0-9_$]*)(.*)$", Pattern.CASE_INSENSITIVE);
    private static final Pattern LP_VALUE = Pattern.compile("^[DC]$");

    private final ParserOptions options;
    private final GerberLexer lexer = new GerberLexer();

    private GerberDocument document;
    private ParserState state;
    private final StringBuilder parameterBuffer = new StringBuilder();
    private String lastOpCode;
    private int lineNumber;
    private boolean finished;
    private String lastError;

    /**
     * Parser with {@link ParserOptions#defaults()}: the bundled settings and any
     * {@code rs274x.*} system properties.
     */
    public GerberParser() {
        this(ParserOptions.defaults());
    }

    public GerberParser(ParserOptions options) {
        this.options = options;
    }

    public ParserOptions getOptions() {
        return options;
    }

    /**
     * Message of the last parse failure, or null when the last parse succeeded.
     */
    public String getLastError() {
        return lastError;
    }

    public GerberDocument parse(String content) {
        try {
            return parse(new StringReader(content));
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    public GerberDocument parse(Path file) throws IOException {
        log.debug("Parsing {}", file);
        try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            return parse(reader);
        }
    }

    public GerberDocument parse(Reader reader) throws IOException {
        begin();
        BufferedReader buffered = reader instanceof BufferedReader br ? br : new BufferedReader(reader);
        String line;
        while (!finished && (line = buffered.readLine()) != null) {
            parseLine(line);
        }
        return end();
    }

    /**
     * Parses lines that were already split. Line terminators left on a line are ignored.
     */
    public GerberDocument parse(List<String> lines) {
        begin();
        for (String line : lines) {
            if (finished) {
                break;
            }
            parseLine(line);
        }
        return end();
    }

    private void begin() {
        document = new GerberDocument()
                .setIgnoreInvalid(options.isIgnoreInvalid())
                .setIgnoreBlank(options.isIgnoreBlank())
                .setReuseOperationCode(options.isReuseOperationCode());
        state = ParserState.IDLE;
        parameterBuffer.setLength(0);
        lastOpCode = null;
        lineNumber = 0;
        finished = false;
        lastError = null;
    }

    private GerberDocument end() {
        if (state == ParserState.ACCUMULATING_PARAMETER) {
            throw error("[parse] Unterminated parameter block: %" + parameterBuffer, null);
        }
        log.debug("Parsed {} lines into {} functions, {} apertures",
                lineNumber, document.getFunctionCount(), document.getApertures().size());
        GerberDocument result = document;
        document = null;
        return result;
    }

    private void parseLine(String raw) {
        lineNumber++;
        String line = raw.replace("\r", "").replace("\n", "");

        // inside a parameter every line is part of the body, including a lone '*'
        if (state == ParserState.ACCUMULATING_PARAMETER) {
            if (!PARAMETER_CLOSE.matcher(line).matches()) {
                parameterBuffer.append(line.trim());
                return;
            }
            parameterBuffer.append(line.replace("%", "").trim());
            String block = parameterBuffer.toString();
            parameterBuffer.setLength(0);
            state = ParserState.IDLE;
            dispatchParameterBlock(block);
            return;
        }

        if (BLANK_LINE.matcher(line).matches()) {
            return;
        }

        Matcher complete = PARAMETER_LINE.matcher(line);
        if (complete.matches()) {
            // several blocks may share a line: %FSLAX25Y25*%%MOIN*%
            for (String block : complete.group(1).split("%")) {
                if (!block.isBlank()) {
                    dispatchParameterBlock(block);
                }
            }
            return;
        }

        Matcher open = PARAMETER_OPEN.matcher(line);
        if (open.matches()) {
            state = ParserState.ACCUMULATING_PARAMETER;
            parameterBuffer.append(open.group(1).trim());
            return;
        }

        for (Token token : lexer.tokenizeCommands(line, lineNumber)) {
            if (!dispatchCommand(token)) {
                finished = true;
                log.debug("End of program at line {}", lineNumber);
                return;
            }
        }
    }

    // --- parameters

    private void dispatchParameterBlock(String block) {
        for (String body : lexer.splitParameterBlock(block)) {
            Token token = lexer.classifyParameter(body, lineNumber);
            try {
                dispatchParameter(token);
            } catch (GerberParseException e) {
                throw e;
            } catch (GerberException e) {
                throw error(e.getMessage(), e);
            }
        }
    }

    private void dispatchParameter(Token token) {
        String value = token.value();
        switch (token.type()) {
            case FORMAT_SPEC -> handleFormat(value);
            case UNIT -> handleUnit(value);
            case APERTURE_DEFINE -> handleApertureDefine(value);
            case APERTURE_MACRO -> handleApertureMacro(value);
            case POLARITY -> {
                if (!LP_VALUE.matcher(value).matches()) {
                    throw error("[parse] Invalid LP Parameter Value: " + value, null);
                }
                document.addParameter(token.code() + value);
            }
            case STEP_REPEAT, ATTRIBUTE, IMAGE_PARAMETER -> document.addParameter(token.code() + value);
            default -> {
                if (!options.isIgnoreInvalid()) {
                    throw error("[parse] Unknown parameter: " + token.code() + value, null);
                }
                log.debug("Skipping unknown parameter {} at line {}", token.code(), token.line());
            }
        }
    }

    private void handleFormat(String value) {
        Matcher modes = FS_MODES.matcher(value);
        Matcher digits = FS_DIGITS.matcher(value);
        if (!modes.find() || !digits.find()) {
            throw error("[parse] Invalid FS Parameter Value: " + value, null);
        }
        document.format(new FormatUpdate()
                .zero(modes.group(1))
                .coordinates(modes.group(2))
                .integerDigits(Integer.parseInt(digits.group(1)))
                .decimalDigits(Integer.parseInt(digits.group(2))));
        log.debug("Format {}", document.getFormat());
    }

    private void handleUnit(String value) {
        if (!MO_VALUE.matcher(value).matches()) {
            throw error("[parse] Invalid MO Parameter Value: " + value, null);
        }
        document.setUnit(value.toUpperCase());
    }

    private void handleApertureDefine(String value) {
        Matcher m = AD_VALUE.matcher(value);
        if (!m.matches()) {
            throw error("[parse] Invalid AD Parameter Value: " + value, null);
        }
        int number = Integer.parseInt(m.group(1));
        if (number < 10) {
            throw error("[parse] Invalid User-Defined Aperture Number: " + number, null);
        }
        String rest = m.group(3);
        String modifiers = rest.startsWith(",") ? rest.substring(1) : rest;
        document.defineAperture("D" + number, m.group(2), modifiers);
    }

    private void handleApertureMacro(String value) {
        List<String> parts = new ArrayList<>();
        for (String part : value.split("\\*")) {
            String p = part.trim();
            if (!p.isEmpty()) {
                parts.add(p);
            }
        }
        if (parts.isEmpty()) {
            throw error("[parse] Aperture macro without a name", null);
        }
        document.defineMacro(parts.get(0), parts.subList(1, parts.size()));
    }

    // --- commands

    /**
     * @return false when the command ends the program
     */
    private boolean dispatchCommand(Token token) {
        try {
            switch (token.type()) {
                case COMMAND -> handleCommand(token.value());
                case OPERATION -> {
                    if (!options.isIgnoreInvalid()) {
                        throw error("[parse] Operation code without coordinate data: " + token.value(), null);
                    }
                    handleMove(token.value());
                }
                case APERTURE_SELECT -> document.selectAperture(token.value());
                case PROGRAM_END -> {
                    return false;
                }
                default -> handleMove(token.value());
            }
        } catch (GerberParseException e) {
            throw e;
        } catch (GerberException | IllegalArgumentException e) {
            throw error(e.getMessage(), e);
        }
        return true;
    }

    private void handleCommand(String command) {
        CommandParts parts = lexer.parseCommand(command);
        if (parts == null) {
            throw error("[parse] Invalid instruction following command code: " + command, null);
        }
        rememberOperation(parts.op());
        document.addCommand(parts.func(), parts.coord(), parts.op(), parts.comment());
    }

    private void handleMove(String command) {
        CommandParts parts = lexer.parseMove(command);
        String op = parts.op();
        if (op == null) {
            op = lastOpCode;
        }
        if (op == null) {
            throw error("[parse] Invalid move instruction: " + command, null);
        }
        rememberOperation(op);
        document.addCommand(null, parts.coord(), op, null);
    }

    private void rememberOperation(String op) {
        if (op != null && OperationCode.parse(op).isPresent()) {
            lastOpCode = op;
        }
    }

    private GerberParseException error(String message, Throwable cause) {
        GerberParseException e = new GerberParseException(message, lineNumber, cause);
        lastError = e.getMessage();
        log.debug("Parse failed: {}", lastError);
        return e;
    }
}
