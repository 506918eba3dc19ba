package nl.bytesoflife.rs274x.lexer;

/**
 * A classified parameter or command.
 *
 * @param type  kind of token
 * @param value token text; for parameters the body without the two-letter code
 * @param code  two-letter parameter code, or the command text itself for commands
 * @param line  1-based input line
 */
public record Token(TokenType type, String value, String code, int line) {

    public boolean isParameter() {
        return type.ordinal() <= TokenType.UNKNOWN_PARAMETER.ordinal();
    }

    @Override
    public String toString() {
        return type + "(" + value + ")@" + line;
    }
}
