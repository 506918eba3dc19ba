package nl.bytesoflife.rs274x.parser;

/**
 * Line state of the parser: either between parameters, or inside a parameter block that
 * continues on following lines until its closing {@code %}.
 */
public enum ParserState {
    IDLE,
    ACCUMULATING_PARAMETER
}
