package nl.bytesoflife.rs274x.lexer;

/**
 * Fields of a single command. Any field may be null.
 */
public record CommandParts(String func, String coord, String op, String comment) {
}
