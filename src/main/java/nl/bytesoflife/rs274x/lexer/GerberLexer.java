package nl.bytesoflife.rs274x.lexer;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Splits and classifies the text of Gerber parameters and command lines. Stateless; the line
 * state machine lives in the parser.
 */
public class GerberLexer {

    private static final Pattern G_CODE_PATTERN = Pattern.compile("^(G\\d+)(.*)$", Pattern.DOTALL);
    private static final Pattern M_CODE_PATTERN = Pattern.compile("^M\\d+$");
    private static final Pattern PROGRAM_END_PATTERN = Pattern.compile("^M0?[02]$");
    private static final Pattern OPERATION_PATTERN = Pattern.compile("^D0.*|^D\\d$");
    private static final Pattern APERTURE_SELECT_PATTERN = Pattern.compile("^D[1-9]\\d+$");
    private static final Pattern COMMAND_BODY_PATTERN = Pattern.compile("^((?:[XYIJ][+-]?\\d+)*)(D\\d+)?$");
    private static final Pattern MOVE_WITH_OP_PATTERN = Pattern.compile("^(.+)(D\\d+)$");
    private static final Pattern OP_ONLY_PATTERN = Pattern.compile("^(D0*[1-9])$");

    private static final Set<String> ATTRIBUTE_CODES = Set.of("TF", "TA", "TO", "TD");
    private static final Set<String> IMAGE_CODES = Set.of(
            "IP", "IN", "LN", "OF", "SF", "MI", "IR", "AS", "LM", "LR", "LS", "AB");

    /**
     * Classifies one parameter by its two-letter code.
     *
     * @param body parameter text between the {@code %} delimiters, without the final {@code *}
     */
    public Token classifyParameter(String body, int line) {
        String code = body.length() >= 2 ? body.substring(0, 2) : body;
        String value = body.length() >= 2 ? body.substring(2) : "";

        TokenType type = switch (code) {
            case "FS" -> TokenType.FORMAT_SPEC;
            case "MO" -> TokenType.UNIT;
            case "AD" -> TokenType.APERTURE_DEFINE;
            case "AM" -> TokenType.APERTURE_MACRO;
            case "LP" -> TokenType.POLARITY;
            case "SR" -> TokenType.STEP_REPEAT;
            default -> {
                if (ATTRIBUTE_CODES.contains(code)) {
                    yield TokenType.ATTRIBUTE;
                } else if (IMAGE_CODES.contains(code)) {
                    yield TokenType.IMAGE_PARAMETER;
                }
                yield TokenType.UNKNOWN_PARAMETER;
            }
        };
        return new Token(type, value, code, line);
    }

    /**
     * Splits a parameter block into its parameters. Aperture macros keep their {@code *}
     * separated primitives together; any other block may hold several parameters.
     */
    public List<String> splitParameterBlock(String block) {
        List<String> bodies = new ArrayList<>();
        String trimmed = block.trim();
        if (trimmed.startsWith("AM")) {
            bodies.add(trimmed);
            return bodies;
        }
        for (String part : trimmed.split("\\*")) {
            String p = part.trim();
            if (!p.isEmpty()) {
                bodies.add(p);
            }
        }
        return bodies;
    }

    /**
     * Splits a command line on {@code *} and classifies each command.
     */
    public List<Token> tokenizeCommands(String line, int lineNum) {
        List<Token> tokens = new ArrayList<>();
        for (String part : line.split("\\*")) {
            String command = part.trim();
            if (command.isEmpty()) {
                continue;
            }
            tokens.add(new Token(classifyCommand(command), command, command, lineNum));
        }
        return tokens;
    }

    public TokenType classifyCommand(String command) {
        if (G_CODE_PATTERN.matcher(command).matches()) {
            return TokenType.COMMAND;
        }
        if (OPERATION_PATTERN.matcher(command).matches()) {
            return TokenType.OPERATION;
        }
        if (APERTURE_SELECT_PATTERN.matcher(command).matches()) {
            return TokenType.APERTURE_SELECT;
        }
        if (PROGRAM_END_PATTERN.matcher(command).matches()) {
            return TokenType.PROGRAM_END;
        }
        if (M_CODE_PATTERN.matcher(command).matches()) {
            return TokenType.COMMAND;
        }
        return TokenType.MOVE;
    }

    /**
     * Splits a G/M-code command into code, coordinate data and operation code. For G04 the rest
     * of the command is the comment.
     *
     * @return the parts, or null if the text after the code is not coordinate data
     */
    public CommandParts parseCommand(String command) {
        Matcher g = G_CODE_PATTERN.matcher(command);
        if (!g.matches()) {
            return new CommandParts(command, null, null, null);
        }
        String func = g.group(1);
        String rest = g.group(2);

        if (func.equals("G04") || func.equals("G4")) {
            return new CommandParts(func, null, null, rest.trim());
        }

        Matcher body = COMMAND_BODY_PATTERN.matcher(rest.trim());
        if (!body.matches()) {
            return null;
        }
        String coord = body.group(1).isEmpty() ? null : body.group(1);
        return new CommandParts(func, coord, body.group(2), null);
    }

    /**
     * Splits a bare move into coordinate data and operation code.
     *
     * @return parts with a null op when the operation code was omitted
     */
    public CommandParts parseMove(String command) {
        Matcher withOp = MOVE_WITH_OP_PATTERN.matcher(command);
        if (withOp.matches()) {
            return new CommandParts(null, withOp.group(1), withOp.group(2), null);
        }
        Matcher opOnly = OP_ONLY_PATTERN.matcher(command);
        if (opOnly.matches()) {
            return new CommandParts(null, null, opOnly.group(1), null);
        }
        return new CommandParts(null, command, null, null);
    }
}
